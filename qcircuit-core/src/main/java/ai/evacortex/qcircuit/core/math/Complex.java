/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.math;

import java.util.Locale;

/**
 * Immutable complex value used for gate matrix entries and reported amplitudes.
 * Hot loops work on split real/imaginary arrays instead.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex of(double real) {
        return new Complex(real, 0.0);
    }

    /** e^{iθ} */
    public static Complex expI(double theta) {
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    public Complex multiply(Complex other) {
        return new Complex(real * other.real - imag * other.imag, real * other.imag + imag * other.real);
    }

    public Complex scale(double factor) {
        return new Complex(real * factor, imag * factor);
    }

    public Complex negate() {
        return new Complex(-real, -imag);
    }

    public Complex conjugate() {
        return new Complex(real, -imag);
    }

    /** |z| */
    public double abs() {
        return Math.hypot(real, imag);
    }

    /** |z|², the Born-rule probability of an amplitude */
    public double absSquared() {
        return real * real + imag * imag;
    }

    /**
     * Component-wise comparison; both parts must lie within {@code tolerance}.
     */
    public boolean isClose(Complex other, double tolerance) {
        return Math.abs(real - other.real) <= tolerance && Math.abs(imag - other.imag) <= tolerance;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex other)) return false;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(real) + Double.hashCode(imag);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.6f%+.6fi", real, imag);
    }
}
