/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.builders;

import ai.evacortex.qcircuit.core.circuit.CircuitDraft;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.UnitaryOp;
import ai.evacortex.qcircuit.core.engine.Statevector;
import ai.evacortex.qcircuit.core.engine.StatevectorEngine;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import ai.evacortex.qcircuit.core.gates.GateType;
import ai.evacortex.qcircuit.core.math.Complex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QftBuilderTest {

    private static final double EPS = 1e-9;

    private final StatevectorEngine engine = new StatevectorEngine();

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4})
    void forwardTransformMatchesDiscreteFourierTransform(int n) {
        List<Operation> qft = QftBuilder.operations(n, false);
        int dim = 1 << n;
        for (int x = 0; x < dim; x++) {
            Statevector psi = engine.evolve(Statevector.basis(n, x), qft);
            for (int k = 0; k < dim; k++) {
                Complex expected = Complex.expI(2 * Math.PI * x * k / dim).scale(1.0 / Math.sqrt(dim));
                assertTrue(psi.amplitude(k).isClose(expected, EPS),
                        "QFT|" + x + "> amplitude " + k + ": " + psi.amplitude(k) + " != " + expected);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5})
    void inverseUndoesForwardOnEveryBasisState(int n) {
        List<Operation> roundTrip = new ArrayList<>(QftBuilder.operations(n, false));
        roundTrip.addAll(QftBuilder.operations(n, true));
        for (int x = 0; x < (1 << n); x++) {
            Statevector psi = engine.evolve(Statevector.basis(n, x), roundTrip);
            assertEquals(1.0, psi.probability(x), EPS, "round trip must restore |" + x + ">");
        }
    }

    @Test
    void draftHasClassicalRegisterAndPrefix() {
        CircuitDraft qft = QftBuilder.build(3, false);
        assertEquals(3, qft.numQubits());
        assertEquals(3, qft.numClbits());
        assertEquals("qft_3q", qft.namePrefix());
        // 3 h + 3 cp + 1 swap
        assertEquals(7, qft.size());
        assertEquals("iqft_3q", QftBuilder.build(3, true).namePrefix());
    }

    @Test
    void nonPositiveSizeIsRejected() {
        assertThrows(InvalidParameterException.class, () -> QftBuilder.build(0, false));
    }

    @Test
    void phaseAnglesStayPositiveAndShrinkOnWideRegisters() {
        int n = 66;
        // target -> (distance -> angle)
        Map<Integer, Map<Integer, Double>> angles = new HashMap<>();
        for (Operation op : QftBuilder.operations(n, false)) {
            if (op instanceof UnitaryOp u && u.gate() == GateType.CP) {
                int distance = u.target(1) - u.target(0);
                assertTrue(u.params()[0] > 0, "angle at distance " + distance + " must be positive");
                assertEquals(Math.PI / Math.pow(2, distance), u.params()[0], 0.0);
                angles.computeIfAbsent(u.target(1), j -> new HashMap<>()).put(distance, u.params()[0]);
            }
        }
        Map<Integer, Double> widest = angles.get(n - 1);
        assertEquals(n - 1, widest.size());
        for (int d = 2; d < n; d++) {
            assertTrue(widest.get(d) < widest.get(d - 1), "angle must shrink at distance " + d);
        }

        for (Operation op : QftBuilder.operations(n, true)) {
            if (op instanceof UnitaryOp u && u.gate() == GateType.CP) {
                assertTrue(u.params()[0] < 0, "inverse angles must be negative");
            }
        }
    }
}
