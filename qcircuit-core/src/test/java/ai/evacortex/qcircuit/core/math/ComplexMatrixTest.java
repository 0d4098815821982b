/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexMatrixTest {

    private static final double EPS = 1e-12;

    @Test
    void identityIsUnitaryAndHermitian() {
        ComplexMatrix id = ComplexMatrix.identity(4);
        assertTrue(id.isUnitary(EPS));
        assertTrue(id.isHermitian(EPS));
        assertEquals(4.0, id.trace().real, EPS);
    }

    @Test
    void multiplyFollowsComplexArithmetic() {
        ComplexMatrix a = ComplexMatrix.of(new Complex[][]{
                {Complex.ONE, Complex.I},
                {Complex.ZERO, Complex.ONE}
        });
        ComplexMatrix product = a.multiply(a);
        assertTrue(product.get(0, 1).isClose(new Complex(0, 2), EPS), "Off-diagonal must double: " + product);
        assertTrue(product.get(1, 1).isClose(Complex.ONE, EPS));
    }

    @Test
    void conjugateTransposeNegatesImaginaryParts() {
        ComplexMatrix a = ComplexMatrix.of(new Complex[][]{
                {new Complex(1, 2), new Complex(3, 4)},
                {new Complex(5, 6), new Complex(7, 8)}
        });
        ComplexMatrix adj = a.conjugateTranspose();
        assertTrue(adj.get(0, 1).isClose(new Complex(5, -6), EPS));
        assertTrue(adj.get(1, 0).isClose(new Complex(3, -4), EPS));
        assertFalse(a.isHermitian(EPS));
    }

    @Test
    void identityPhaseDetectsScalarMultiples() {
        Complex phase = Complex.expI(0.7);
        ComplexMatrix scaled = ComplexMatrix.diagonal(phase, phase);
        assertNotNull(scaled.identityPhase(EPS));
        assertTrue(scaled.identityPhase(EPS).isClose(phase, EPS));

        ComplexMatrix notScalar = ComplexMatrix.diagonal(Complex.ONE, Complex.I);
        assertNull(notScalar.identityPhase(EPS));
    }

    @Test
    void frobeniusSquaredSumsMagnitudes() {
        ComplexMatrix m = ComplexMatrix.diagonal(new Complex(0.5, 0.5), new Complex(0, 1));
        assertEquals(1.5, m.frobeniusSquared(), EPS);
    }
}
