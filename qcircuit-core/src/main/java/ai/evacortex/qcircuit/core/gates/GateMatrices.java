/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.gates;

import ai.evacortex.qcircuit.core.math.Complex;
import ai.evacortex.qcircuit.core.math.ComplexMatrix;

/**
 * Closed-form unitaries for the gate catalog.
 *
 * <p>Local basis convention: for a gate on qubits {@code (q0, q1)} the local index is
 * {@code b0 + 2·b1}, i.e. the first listed qubit is the least significant bit.
 * For {@code cx(control, target)} this gives the usual
 * {@code |c t⟩ → |c, t ⊕ c⟩} action with the control in bit 0.</p>
 */
final class GateMatrices {

    private static final double SQRT_HALF = Math.sqrt(0.5);

    private GateMatrices() {}

    static ComplexMatrix hadamard() {
        Complex p = Complex.of(SQRT_HALF);
        return ComplexMatrix.of(new Complex[][]{
                {p, p},
                {p, p.negate()}
        });
    }

    static ComplexMatrix pauliX() {
        return ComplexMatrix.of(new Complex[][]{
                {Complex.ZERO, Complex.ONE},
                {Complex.ONE, Complex.ZERO}
        });
    }

    static ComplexMatrix pauliY() {
        return ComplexMatrix.of(new Complex[][]{
                {Complex.ZERO, Complex.I.negate()},
                {Complex.I, Complex.ZERO}
        });
    }

    static ComplexMatrix pauliZ() {
        return ComplexMatrix.diagonal(Complex.ONE, Complex.ONE.negate());
    }

    static ComplexMatrix phase(double lambda) {
        return ComplexMatrix.diagonal(Complex.ONE, Complex.expI(lambda));
    }

    static ComplexMatrix rx(double theta) {
        Complex c = Complex.of(Math.cos(theta / 2));
        Complex s = new Complex(0.0, -Math.sin(theta / 2));
        return ComplexMatrix.of(new Complex[][]{
                {c, s},
                {s, c}
        });
    }

    static ComplexMatrix ry(double theta) {
        Complex c = Complex.of(Math.cos(theta / 2));
        Complex s = Complex.of(Math.sin(theta / 2));
        return ComplexMatrix.of(new Complex[][]{
                {c, s.negate()},
                {s, c}
        });
    }

    static ComplexMatrix rz(double theta) {
        return ComplexMatrix.diagonal(Complex.expI(-theta / 2), Complex.expI(theta / 2));
    }

    /**
     * U(θ, φ, λ) = [[cos θ/2, −e^{iλ} sin θ/2], [e^{iφ} sin θ/2, e^{i(φ+λ)} cos θ/2]]
     */
    static ComplexMatrix u(double theta, double phi, double lambda) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        return ComplexMatrix.of(new Complex[][]{
                {Complex.of(c), Complex.expI(lambda).scale(-s)},
                {Complex.expI(phi).scale(s), Complex.expI(phi + lambda).scale(c)}
        });
    }

    static ComplexMatrix cx() {
        ComplexMatrix m = new ComplexMatrix(4);
        m.set(0, 0, 1.0, 0.0);
        m.set(1, 3, 1.0, 0.0);
        m.set(2, 2, 1.0, 0.0);
        m.set(3, 1, 1.0, 0.0);
        return m;
    }

    static ComplexMatrix cz() {
        return ComplexMatrix.diagonal(Complex.ONE, Complex.ONE, Complex.ONE, Complex.ONE.negate());
    }

    static ComplexMatrix cp(double lambda) {
        return ComplexMatrix.diagonal(Complex.ONE, Complex.ONE, Complex.ONE, Complex.expI(lambda));
    }

    static ComplexMatrix swap() {
        ComplexMatrix m = new ComplexMatrix(4);
        m.set(0, 0, 1.0, 0.0);
        m.set(1, 2, 1.0, 0.0);
        m.set(2, 1, 1.0, 0.0);
        m.set(3, 3, 1.0, 0.0);
        return m;
    }

    /** exp(−iθ/2 · X⊗X) */
    static ComplexMatrix rxx(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        ComplexMatrix m = new ComplexMatrix(4);
        for (int i = 0; i < 4; i++) {
            m.set(i, i, c, 0.0);
            m.set(i, 3 - i, 0.0, -s);
        }
        return m;
    }

    /** exp(−iθ/2 · Y⊗Y) */
    static ComplexMatrix ryy(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        ComplexMatrix m = new ComplexMatrix(4);
        for (int i = 0; i < 4; i++) {
            m.set(i, i, c, 0.0);
        }
        m.set(0, 3, 0.0, s);
        m.set(3, 0, 0.0, s);
        m.set(1, 2, 0.0, -s);
        m.set(2, 1, 0.0, -s);
        return m;
    }

    /** exp(−iθ/2 · Z⊗Z) */
    static ComplexMatrix rzz(double theta) {
        Complex even = Complex.expI(-theta / 2);
        Complex odd = Complex.expI(theta / 2);
        return ComplexMatrix.diagonal(even, odd, odd, even);
    }
}
