/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core;

import ai.evacortex.qcircuit.core.analysis.DensityMatrixAnalysis;
import ai.evacortex.qcircuit.core.analysis.StateAnalyzer;
import ai.evacortex.qcircuit.core.analysis.StatevectorAnalysis;
import ai.evacortex.qcircuit.core.builders.AnsatzResult;
import ai.evacortex.qcircuit.core.builders.Entanglement;
import ai.evacortex.qcircuit.core.builders.QftBuilder;
import ai.evacortex.qcircuit.core.builders.VariationalAnsatzBuilder;
import ai.evacortex.qcircuit.core.circuit.CircuitDraft;
import ai.evacortex.qcircuit.core.circuit.GateRequest;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.OperationParser;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.engine.RunResult;
import ai.evacortex.qcircuit.core.engine.SimulatorConfig;
import ai.evacortex.qcircuit.core.engine.StatevectorCache;
import ai.evacortex.qcircuit.core.engine.StatevectorEngine;
import ai.evacortex.qcircuit.core.exceptions.DuplicateCircuitException;
import ai.evacortex.qcircuit.core.optimizer.CircuitOptimizer;
import ai.evacortex.qcircuit.core.optimizer.OptimizationResult;
import ai.evacortex.qcircuit.core.registry.CircuitRegistry;
import ai.evacortex.qcircuit.core.registry.CircuitSummary;
import ai.evacortex.qcircuit.core.registry.InMemoryCircuitRegistry;
import ai.evacortex.qcircuit.core.storage.CircuitSnapshotStore;
import ai.evacortex.qcircuit.core.storage.CircuitSnapshotStore.CircuitSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class QuantumCircuitServiceImpl implements QuantumCircuitService, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(QuantumCircuitServiceImpl.class);

    private final CircuitRegistry registry;
    private final SimulatorConfig config;
    private final StatevectorEngine engine;
    private final StatevectorCache cache;
    private final StateAnalyzer analyzer;
    private final CircuitOptimizer optimizer;

    public QuantumCircuitServiceImpl(CircuitRegistry registry, SimulatorConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.engine = new StatevectorEngine(config);
        this.cache = new StatevectorCache(config.cacheMaxBytes());
        this.analyzer = new StateAnalyzer(engine, cache);
        this.optimizer = new CircuitOptimizer();
    }

    public QuantumCircuitServiceImpl(SimulatorConfig config) {
        this(new InMemoryCircuitRegistry(), config);
    }

    public QuantumCircuitServiceImpl() {
        this(SimulatorConfig.fromSystemProperties());
    }

    public CircuitRegistry registry() {
        return registry;
    }

    @Override
    public String createCircuit(int numQubits, Integer numClbits, String name) {
        int clbits = numClbits == null ? numQubits : numClbits;
        return registry.create(numQubits, clbits, name).name();
    }

    @Override
    public AppliedOperations appendGates(String circuit, List<GateRequest> operations) {
        Objects.requireNonNull(operations, "operations must not be null");
        List<Operation> parsed = OperationParser.parse(operations);
        QuantumCircuit updated = registry.appendOperations(circuit, parsed);
        List<String> applied = parsed.stream().map(Operation::describe).toList();
        return new AppliedOperations(updated.name(), applied, updated.size());
    }

    @Override
    public RunResult run(String circuit, Integer shots, Long seed) {
        int n = shots == null ? config.defaultShots() : shots;
        return engine.run(registry.get(circuit), n, seed);
    }

    @Override
    public CircuitDescription describe(String circuit) {
        QuantumCircuit c = registry.get(circuit);
        return new CircuitDescription(c.name(), c.numQubits(), c.numClbits(), c.depth(), c.size(),
                c.width(), c.gateCounts(), c.size());
    }

    @Override
    public List<CircuitSummary> listCircuits() {
        return registry.list();
    }

    @Override
    public StatevectorAnalysis analyzeStatevector(String circuit) {
        return analyzer.analyzeStatevector(registry.get(circuit));
    }

    @Override
    public DensityMatrixAnalysis analyzeDensityMatrix(String circuit) {
        return analyzer.analyzeDensityMatrix(registry.get(circuit));
    }

    @Override
    public double entanglementEntropy(String circuit, int... subsystem) {
        return analyzer.entanglementEntropy(registry.get(circuit), subsystem);
    }

    @Override
    public OptimizationOutcome optimize(String circuit, int level) {
        QuantumCircuit original = registry.get(circuit);
        OptimizationResult result = optimizer.optimize(original, level);
        QuantumCircuit stored = registry.register(result.optimized(), null);
        return new OptimizationOutcome(original.name(), stored.name(), result.report());
    }

    @Override
    public VariationalCircuit buildVariational(int numQubits, int layers, String entanglement, String name) {
        return buildVariational(numQubits, layers, entanglement, null, name);
    }

    @Override
    public VariationalCircuit buildVariational(int numQubits, int layers, String entanglement,
                                               double[] values, String name) {
        AnsatzResult ansatz = VariationalAnsatzBuilder.build(numQubits, layers,
                Entanglement.fromName(entanglement), values);
        QuantumCircuit stored = registry.register(ansatz.draft(), name);
        return new VariationalCircuit(stored.name(), ansatz.parameterCount());
    }

    @Override
    public String buildQft(int numQubits, boolean inverse, String name) {
        return registry.register(QftBuilder.build(numQubits, inverse), name).name();
    }

    @Override
    public void removeCircuit(String circuit) {
        registry.remove(circuit);
        cache.invalidate(circuit);
    }

    @Override
    public void exportCircuits(Path file) {
        List<QuantumCircuit> circuits = registry.list().stream()
                .map(summary -> registry.get(summary.name()))
                .toList();
        new CircuitSnapshotStore(file).write(circuits);
        logger.info("Exported {} circuit(s) to {}", circuits.size(), file);
    }

    @Override
    public List<String> importCircuits(Path file) {
        List<CircuitSnapshot> snapshots = new CircuitSnapshotStore(file).read();
        for (CircuitSnapshot snapshot : snapshots) {
            if (registry.contains(snapshot.name())) {
                throw new DuplicateCircuitException(snapshot.name());
            }
        }

        List<String> imported = new ArrayList<>(snapshots.size());
        for (CircuitSnapshot snapshot : snapshots) {
            List<GateRequest> requests = snapshot.operations() == null ? List.of() : snapshot.operations();
            CircuitDraft draft = new CircuitDraft(snapshot.numQubits(), snapshot.numClbits(),
                    OperationParser.parse(requests), snapshot.name());
            imported.add(registry.register(draft, snapshot.name()).name());
        }
        logger.info("Imported {} circuit(s) from {}", imported.size(), file);
        return imported;
    }

    @Override
    public void close() {
        cache.close();
    }
}
