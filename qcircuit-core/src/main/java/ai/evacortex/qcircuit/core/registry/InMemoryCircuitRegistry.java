/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.registry;

import ai.evacortex.qcircuit.core.circuit.CircuitDraft;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.OperationValidator;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.exceptions.CircuitNotFoundException;
import ai.evacortex.qcircuit.core.exceptions.DuplicateCircuitException;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryCircuitRegistry implements CircuitRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCircuitRegistry.class);

    private final Map<String, QuantumCircuit> circuits = new LinkedHashMap<>();
    private final RegistryLock globalLock = new RegistryLock();
    private final AtomicLong versions = new AtomicLong();

    @Override
    public QuantumCircuit create(int numQubits, int numClbits, String name) {
        OperationValidator.requireRegisters(numQubits, numClbits);
        return register(new CircuitDraft(numQubits, numClbits, List.of(), "circuit_" + System.currentTimeMillis()), name);
    }

    @Override
    public QuantumCircuit register(CircuitDraft draft, String name) {
        Objects.requireNonNull(draft, "draft must not be null");
        OperationValidator.requireRegisters(draft.numQubits(), draft.numClbits());
        OperationValidator.validate(draft.numQubits(), draft.numClbits(), List.of(), draft.operations());
        if (name != null && name.isBlank()) {
            throw new InvalidParameterException("name", "'" + name + "'", "must not be blank");
        }

        try (RegistryLock.Held ignored = globalLock.write()) {
            String key = name != null ? name : generateName(draft.namePrefix());
            if (circuits.containsKey(key)) {
                throw new DuplicateCircuitException(key);
            }
            QuantumCircuit circuit = new QuantumCircuit(key, draft.numQubits(), draft.numClbits(),
                    draft.operations(), versions.incrementAndGet());
            circuits.put(key, circuit);
            logger.info("Created circuit '{}' with {} qubits and {} classical bits ({} operations)",
                    key, circuit.numQubits(), circuit.numClbits(), circuit.size());
            return circuit;
        }
    }

    @Override
    public QuantumCircuit get(String name) {
        try (RegistryLock.Held ignored = globalLock.read()) {
            QuantumCircuit circuit = circuits.get(name);
            if (circuit == null) throw new CircuitNotFoundException(name);
            return circuit;
        }
    }

    @Override
    public boolean contains(String name) {
        try (RegistryLock.Held ignored = globalLock.read()) {
            return circuits.containsKey(name);
        }
    }

    @Override
    public List<CircuitSummary> list() {
        try (RegistryLock.Held ignored = globalLock.read()) {
            return circuits.values().stream().map(CircuitSummary::of).toList();
        }
    }

    @Override
    public QuantumCircuit appendOperations(String name, List<? extends Operation> operations) {
        Objects.requireNonNull(operations, "operations must not be null");
        try (RegistryLock.Held ignored = globalLock.write()) {
            QuantumCircuit current = circuits.get(name);
            if (current == null) throw new CircuitNotFoundException(name);

            OperationValidator.validate(current.numQubits(), current.numClbits(), current.operations(), operations);
            List<Operation> batch = List.copyOf(operations);
            QuantumCircuit updated = current.withAppended(batch, versions.incrementAndGet());
            circuits.put(name, updated);
            logger.debug("Appended {} operation(s) to '{}' (now {})", batch.size(), name, updated.size());
            return updated;
        }
    }

    @Override
    public QuantumCircuit remove(String name) {
        try (RegistryLock.Held ignored = globalLock.write()) {
            QuantumCircuit removed = circuits.remove(name);
            if (removed == null) throw new CircuitNotFoundException(name);
            logger.info("Removed circuit '{}'", name);
            return removed;
        }
    }

    @Override
    public int size() {
        try (RegistryLock.Held ignored = globalLock.read()) {
            return circuits.size();
        }
    }

    private String generateName(String prefix) {
        assert globalLock.heldForWrite() : "name generation outside the write lock";
        String base = (prefix == null || prefix.isBlank()) ? "circuit" : prefix;
        String candidate;
        do {
            candidate = base + "_" + UUID.randomUUID().toString().substring(0, 8);
        } while (circuits.containsKey(candidate));
        return candidate;
    }
}
