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
import ai.evacortex.qcircuit.core.analysis.StatevectorAnalysis;
import ai.evacortex.qcircuit.core.circuit.GateRequest;
import ai.evacortex.qcircuit.core.engine.RunResult;
import ai.evacortex.qcircuit.core.engine.SimulatorConfig;
import ai.evacortex.qcircuit.core.exceptions.CircuitNotFoundException;
import ai.evacortex.qcircuit.core.exceptions.DuplicateCircuitException;
import ai.evacortex.qcircuit.core.exceptions.InvalidOperationException;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import ai.evacortex.qcircuit.core.exceptions.MeasurementPresentException;
import ai.evacortex.qcircuit.core.exceptions.NoMeasurementException;
import ai.evacortex.qcircuit.core.registry.CircuitSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QuantumCircuitServiceImplTest {

    private QuantumCircuitServiceImpl service;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        service = new QuantumCircuitServiceImpl(SimulatorConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private String bell(String name) {
        String id = service.createCircuit(2, null, name);
        service.appendGates(id, List.of(GateRequest.of("h", 0), GateRequest.of("cx", 0, 1)));
        return id;
    }

    @Test
    @DisplayName("Bell pair: build, analyze, measure")
    void bellEndToEnd() {
        String id = bell("bell");
        StatevectorAnalysis sv = service.analyzeStatevector(id);
        assertEquals(Map.of("00", 0.5, "11", 0.5).keySet(), sv.probabilities().keySet());
        assertEquals(0.5, sv.probabilities().get("11"), 1e-9);

        DensityMatrixAnalysis dm = service.analyzeDensityMatrix(id);
        assertEquals(1.0, dm.purity(), 1e-9);
        assertEquals(1.0, service.entanglementEntropy(id, 0), 1e-6);

        service.appendGates(id, List.of(GateRequest.measureAll()));
        RunResult result = service.run(id, 2000, 11L);
        assertEquals(2000, result.totalCounts());
        assertEquals(0, result.count("01") + result.count("10"));
        assertThrows(MeasurementPresentException.class, () -> service.analyzeStatevector(id));
    }

    @Test
    void createDefaultsClassicalBitsToQubits() {
        String id = service.createCircuit(3, null, null);
        CircuitDescription d = service.describe(id);
        assertEquals(3, d.numClbits());
        assertEquals(6, d.width());
        assertEquals(0, d.depth());
        assertTrue(id.startsWith("circuit_"));
    }

    @Test
    void appendReportsAppliedOperations() {
        String id = service.createCircuit(2, 2, "ops");
        AppliedOperations applied = service.appendGates(id, List.of(
                GateRequest.of("cx", 0, 1),
                GateRequest.withParams("rx", List.of(0.5), 0),
                GateRequest.of("measure", 1)));
        assertEquals(List.of("CNOT gate from qubit 0 to 1", "RX(0.5) gate on qubit 0", "Measure qubit 1 into bit 1"),
                applied.applied());
        assertEquals(3, applied.totalOperations());
    }

    @Test
    void describeCountsGatesByType() {
        String id = bell("d");
        service.appendGates(id, List.of(GateRequest.of("h", 1), GateRequest.measure(0, 0), GateRequest.measure(1, 1)));
        CircuitDescription d = service.describe(id);
        assertEquals(5, d.size());
        assertEquals(5, d.totalOperations());
        assertEquals(Map.of("h", 2, "cx", 1, "measure", 2), d.gateCounts());
        assertEquals(4, d.depth());
    }

    @Test
    void invalidAppendIsAllOrNothing() {
        String id = service.createCircuit(2, 2, "atomic");
        assertThrows(InvalidOperationException.class, () -> service.appendGates(id,
                List.of(GateRequest.of("h", 0), GateRequest.of("frobnicate", 1))));
        assertThrows(InvalidOperationException.class, () -> service.appendGates(id,
                List.of(GateRequest.of("h", 0), GateRequest.of("x", 2))));
        assertEquals(0, service.describe(id).size());
    }

    @Test
    void runErrors() {
        String id = bell("noMeasure");
        assertThrows(NoMeasurementException.class, () -> service.run(id, 100, 1L));
        service.appendGates(id, List.of(GateRequest.measureAll()));
        assertThrows(InvalidParameterException.class, () -> service.run(id, 0, 1L));
        assertEquals(1000, service.run(id, null, 1L).shots());
        assertThrows(CircuitNotFoundException.class, () -> service.run("nope", 10, 1L));
    }

    @Test
    void analysisSeesAppendedGates() {
        String id = service.createCircuit(1, 1, "cached");
        assertEquals(1.0, service.analyzeStatevector(id).probabilities().get("0"), 1e-12);
        service.appendGates(id, List.of(GateRequest.of("x", 0)));
        assertEquals(1.0, service.analyzeStatevector(id).probabilities().get("1"), 1e-12);
    }

    @Test
    void duplicateNameFails() {
        service.createCircuit(1, 1, "dup");
        assertThrows(DuplicateCircuitException.class, () -> service.createCircuit(2, 2, "dup"));
    }

    @Test
    void optimizeStoresNewCircuitAndKeepsOriginal() {
        String id = service.createCircuit(2, 2, "opt");
        service.appendGates(id, List.of(GateRequest.of("x", 0), GateRequest.of("x", 0), GateRequest.of("h", 1)));
        OptimizationOutcome outcome = service.optimize(id, 1);
        assertEquals("opt", outcome.originalCircuit());
        assertTrue(outcome.optimizedCircuit().matches("opt_opt1_[0-9a-f]{8}"), outcome.optimizedCircuit());
        assertEquals(1, service.describe(outcome.optimizedCircuit()).size());
        assertEquals(3, service.describe(id).size());
        assertEquals(2, outcome.report().sizeReduction());
        assertThrows(InvalidParameterException.class, () -> service.optimize(id, 5));
    }

    @Test
    void variationalCircuitIsRegistered() {
        VariationalCircuit vqc = service.buildVariational(3, 2, "circular", "vqc");
        assertEquals("vqc", vqc.circuit());
        assertEquals(12, vqc.parameterCount());
        // 2 layers × (6 rotations + 3 entanglers)
        assertEquals(18, service.describe("vqc").size());
        assertThrows(InvalidParameterException.class, () -> service.buildVariational(3, 1, "ring", null));
    }

    @Test
    void qftCircuitGetsGeneratedName() {
        String id = service.buildQft(3, false, null);
        assertTrue(id.matches("qft_3q_[0-9a-f]{8}"), id);
        String inverse = service.buildQft(3, true, null);
        assertTrue(inverse.startsWith("iqft_3q_"), inverse);
        StatevectorAnalysis a = service.analyzeStatevector(id);
        assertEquals(8, a.probabilities().size());
    }

    @Test
    void removeForgetsCircuit() {
        String id = bell("temp");
        service.analyzeStatevector(id);
        service.removeCircuit(id);
        assertThrows(CircuitNotFoundException.class, () -> service.describe(id));
        assertTrue(service.listCircuits().isEmpty());
        String again = service.createCircuit(2, 2, "temp");
        assertEquals(1.0, service.analyzeStatevector(again).probabilities().get("00"), 1e-12);
    }

    @Test
    void exportThenImportIntoFreshService() {
        bell("one");
        service.buildQft(2, false, "two");
        Path file = tempDir.resolve("circuits.json");
        service.exportCircuits(file);

        try (QuantumCircuitServiceImpl other = new QuantumCircuitServiceImpl(SimulatorConfig.defaults())) {
            assertEquals(List.of("one", "two"), other.importCircuits(file));
            assertEquals(service.listCircuits(), other.listCircuits());
            assertEquals(service.analyzeStatevector("two").probabilities(), other.analyzeStatevector("two").probabilities());
        }
    }

    @Test
    void importWithExistingNameImportsNothing() {
        bell("one");
        service.createCircuit(1, 1, "two");
        Path file = tempDir.resolve("circuits.json");
        service.exportCircuits(file);

        try (QuantumCircuitServiceImpl other = new QuantumCircuitServiceImpl(SimulatorConfig.defaults())) {
            other.createCircuit(3, 0, "two");
            assertThrows(DuplicateCircuitException.class, () -> other.importCircuits(file));
            assertEquals(List.of(new CircuitSummary("two", 3, 0, 0)), other.listCircuits());
        }
    }
}
