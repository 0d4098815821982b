/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.engine;

import ai.evacortex.qcircuit.core.CircuitTestUtils;
import ai.evacortex.qcircuit.core.circuit.CircuitBuilder;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.circuit.UnitaryOp;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import ai.evacortex.qcircuit.core.exceptions.NoMeasurementException;
import ai.evacortex.qcircuit.core.gates.GateType;
import ai.evacortex.qcircuit.core.math.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StatevectorEngineTest {

    private static final double EPS = 1e-9;

    private final StatevectorEngine engine = new StatevectorEngine(SimulatorConfig.defaults());

    @Test
    @DisplayName("qubit 0 is the rightmost character of a bitstring")
    void xOnQubitZeroFlipsRightmostBit() {
        QuantumCircuit c = CircuitTestUtils.circuit("x0", new CircuitBuilder(2).x(0), 2, 0);
        Statevector psi = engine.evolve(c);
        assertEquals(1.0, psi.probability(1), EPS);
        assertEquals("01", psi.bitstring(1));
    }

    @Test
    void bellStateAmplitudes() {
        Statevector psi = engine.evolve(CircuitTestUtils.bell());
        double h = Math.sqrt(0.5);
        assertTrue(psi.amplitude(0).isClose(Complex.of(h), EPS));
        assertTrue(psi.amplitude(3).isClose(Complex.of(h), EPS));
        assertEquals(0.0, psi.probability(1), EPS);
        assertEquals(0.0, psi.probability(2), EPS);
        assertEquals(1.0, psi.normSquared(), EPS);
    }

    @Test
    void cxControlIsFirstQubit() {
        QuantumCircuit c = CircuitTestUtils.circuit("cx", new CircuitBuilder(3).x(2).cx(2, 0), 3, 0);
        Statevector psi = engine.evolve(c);
        assertEquals(1.0, psi.probability(0b101), EPS, "control 2 set must flip target 0");
    }

    @Test
    void gateFollowedByInverseRestoresState() {
        Random r = new Random(5);
        Statevector start = engine.evolve(CircuitTestUtils.circuit("prep",
                new CircuitBuilder(3).h(0).ry(0.7, 1).cx(0, 2).rz(1.1, 2).s(1), 3, 0));

        for (GateType gate : GateType.values()) {
            double[] params = new double[gate.paramCount()];
            for (int p = 0; p < params.length; p++) params[p] = r.nextDouble() * 4 - 2;
            int[] targets = gate.arity() == 1 ? new int[]{1} : new int[]{2, 0};
            UnitaryOp forward = new UnitaryOp(gate, targets, params);

            Statevector psi = start.copy();
            engine.applyUnitary(psi, forward);
            applyAdjoint(psi, gate, targets, params);
            for (int i = 0; i < psi.dimension(); i++) {
                assertTrue(psi.amplitude(i).isClose(start.amplitude(i), EPS),
                        gate + " followed by its inverse must restore amplitude " + i);
            }
        }
    }

    private static void applyAdjoint(Statevector psi, GateType gate, int[] targets, double[] params) {
        StatevectorEngine.applyMatrix(psi, gate.matrix(params).conjugateTranspose(), targets);
    }

    @Test
    void runRequiresMeasurement() {
        QuantumCircuit c = CircuitTestUtils.circuit("nomeasure", new CircuitBuilder(1).h(0), 1, 1);
        assertThrows(NoMeasurementException.class, () -> engine.run(c, 10, 1L));
    }

    @Test
    void runRejectsNonPositiveShots() {
        QuantumCircuit c = CircuitTestUtils.circuit("m", new CircuitBuilder(1, 1).measure(0, 0), 1, 1);
        assertThrows(InvalidParameterException.class, () -> engine.run(c, 0, 1L));
        assertThrows(InvalidParameterException.class, () -> engine.run(c, -5, 1L));
    }

    @Test
    void seededRunsAreReproducible() {
        QuantumCircuit c = CircuitTestUtils.circuit("bell", new CircuitBuilder(2, 2).h(0).cx(0, 1).measureAll(), 2, 2);
        assertEquals(engine.run(c, 500, 42L).counts(), engine.run(c, 500, 42L).counts());
    }

    @Test
    void bellSamplingOnlyProducesCorrelatedOutcomes() {
        QuantumCircuit c = CircuitTestUtils.circuit("bell", new CircuitBuilder(2, 2).h(0).cx(0, 1).measureAll(), 2, 2);
        RunResult result = engine.run(c, 100_000, 7L);
        assertEquals(100_000, result.totalCounts());
        assertEquals(result.shots(), result.counts().values().stream().mapToInt(Integer::intValue).sum());
        assertEquals(0, result.count("01"));
        assertEquals(0, result.count("10"));
        assertEquals(0.5, result.frequency("00"), 0.02);
        assertEquals(0.5, result.frequency("11"), 0.02);
    }

    @Test
    void samplingConvergesToBornProbabilities() {
        // P(1) = sin²(θ/2)
        double theta = 1.2;
        QuantumCircuit c = CircuitTestUtils.circuit("ry", new CircuitBuilder(1, 1).ry(theta, 0).measure(0, 0), 1, 1);
        RunResult result = engine.run(c, 100_000, 99L);
        double expected = Math.pow(Math.sin(theta / 2), 2);
        assertEquals(expected, result.frequency("1"), 0.02);
        assertEquals(1.0 - expected, result.frequency("0"), 0.02);
    }

    @Test
    void partialMeasurementProjectsOntoClassicalBits() {
        // qubit 1 is |1>, measured into classical bit 0 of a 2-bit register
        QuantumCircuit c = CircuitTestUtils.circuit("partial",
                new CircuitBuilder(2, 2).x(1).measure(1, 0), 2, 2);
        RunResult result = engine.run(c, 50, 3L);
        assertEquals(Map.of("01", 50), result.counts());
    }

    @Test
    void laterMeasurementIntoSameBitWins() {
        QuantumCircuit c = CircuitTestUtils.circuit("overwrite",
                new CircuitBuilder(2, 1).x(1).measure(0, 0).measure(1, 0), 2, 1);
        assertEquals(Map.of("1", 20), engine.run(c, 20, 1L).counts());
    }

    @Test
    void classicalRegisterWiderThanALongKeepsHighBits() {
        QuantumCircuit c = CircuitTestUtils.circuit("wide-clbits",
                new CircuitBuilder(1, 65).x(0).measure(0, 64), 1, 65);
        assertEquals(Map.of("1" + "0".repeat(64), 10), engine.run(c, 10, 1L).counts());

        QuantumCircuit both = CircuitTestUtils.circuit("wide-clbits-both",
                new CircuitBuilder(1, 65).x(0).measure(0, 0).measure(0, 64), 1, 65);
        assertEquals(Map.of("1" + "0".repeat(63) + "1", 10), engine.run(both, 10, 1L).counts());
    }

    @Test
    void formatBitsPadsBeyondSixtyFourDigits() {
        assertEquals("0".repeat(62) + "101", Statevector.formatBits(5L, 65));
    }

    @Test
    void sampleCountsSumToShots() {
        Statevector psi = engine.evolve(CircuitTestUtils.circuit("h3", new CircuitBuilder(3).h(0).h(1).h(2), 3, 0));
        Map<String, Integer> counts = engine.sample(psi, 4000, new Random(11));
        assertEquals(4000, counts.values().stream().mapToInt(Integer::intValue).sum());
        assertEquals(8, counts.size());
        counts.keySet().forEach(k -> assertEquals(3, k.length()));
    }
}
