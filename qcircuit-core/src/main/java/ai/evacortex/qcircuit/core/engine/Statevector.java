/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.engine;

import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import ai.evacortex.qcircuit.core.math.Complex;

/**
 * Dense amplitude vector of length {@code 2^n}.
 *
 * <p>Index convention: qubit {@code q} is bit {@code q} of the amplitude index, so qubit 0 is
 * the least significant bit. Bitstrings are printed with qubit {@code n-1} leftmost; with
 * {@code x} applied to qubit 0 of a 2-qubit register the populated outcome is {@code "01"}.</p>
 *
 * <p>Only {@link StatevectorEngine} mutates amplitudes; the public API is read-only.</p>
 */
public final class Statevector {

    public static final int MAX_QUBITS = 30;

    private final int numQubits;
    final double[] re;
    final double[] im;

    private Statevector(int numQubits, double[] re, double[] im) {
        this.numQubits = numQubits;
        this.re = re;
        this.im = im;
    }

    /** |0…0⟩ */
    public static Statevector zero(int numQubits) {
        return basis(numQubits, 0);
    }

    public static Statevector basis(int numQubits, int index) {
        if (numQubits < 1 || numQubits > MAX_QUBITS) {
            throw new InvalidParameterException("num_qubits", numQubits,
                    "statevector simulation supports 1.." + MAX_QUBITS + " qubits");
        }
        int dim = 1 << numQubits;
        if (index < 0 || index >= dim) {
            throw new IllegalArgumentException("Basis index " + index + " out of range [0, " + dim + ")");
        }
        Statevector state = new Statevector(numQubits, new double[dim], new double[dim]);
        state.re[index] = 1.0;
        return state;
    }

    /**
     * Builds a state from explicit amplitudes; no normalization is applied.
     */
    public static Statevector of(Complex... amplitudes) {
        int dim = amplitudes.length;
        if (dim < 2 || Integer.bitCount(dim) != 1) {
            throw new IllegalArgumentException("Amplitude count must be a power of two >= 2, got " + dim);
        }
        Statevector state = new Statevector(Integer.numberOfTrailingZeros(dim), new double[dim], new double[dim]);
        for (int i = 0; i < dim; i++) {
            state.re[i] = amplitudes[i].real;
            state.im[i] = amplitudes[i].imag;
        }
        return state;
    }

    public int numQubits() {
        return numQubits;
    }

    public int dimension() {
        return re.length;
    }

    public Complex amplitude(int index) {
        return new Complex(re[index], im[index]);
    }

    public double probability(int index) {
        return re[index] * re[index] + im[index] * im[index];
    }

    public double[] probabilities() {
        double[] p = new double[re.length];
        for (int i = 0; i < p.length; i++) {
            p[i] = probability(i);
        }
        return p;
    }

    public double normSquared() {
        double sum = 0.0;
        for (int i = 0; i < re.length; i++) {
            sum += re[i] * re[i] + im[i] * im[i];
        }
        return sum;
    }

    public String bitstring(int index) {
        return formatBits(index, numQubits);
    }

    /**
     * Binary form of {@code value} with {@code width} digits, most significant bit leftmost.
     * Digits beyond bit 63 are zero.
     */
    public static String formatBits(long value, int width) {
        char[] chars = new char[width];
        for (int bit = 0; bit < width; bit++) {
            chars[width - 1 - bit] = bit < Long.SIZE && ((value >>> bit) & 1L) == 1L ? '1' : '0';
        }
        return new String(chars);
    }

    public Statevector copy() {
        return new Statevector(numQubits, re.clone(), im.clone());
    }

    public long sizeInBytes() {
        return 16L * re.length;
    }

    /**
     * Compares two states while ignoring an unobservable global phase.
     */
    public boolean equalsUpToGlobalPhase(Statevector other, double tolerance) {
        if (other.dimension() != dimension()) return false;

        int pivot = 0;
        for (int i = 1; i < re.length; i++) {
            if (probability(i) > probability(pivot)) pivot = i;
        }
        Complex a = amplitude(pivot);
        Complex b = other.amplitude(pivot);
        if (a.abs() <= tolerance) {
            return other.normSquared() <= tolerance;
        }
        if (b.abs() <= tolerance) return false;

        // phase = b / a, normalized to the unit circle
        Complex ratio = b.multiply(a.conjugate()).scale(1.0 / a.absSquared());
        Complex phase = ratio.scale(1.0 / ratio.abs());

        for (int i = 0; i < re.length; i++) {
            Complex expected = amplitude(i).multiply(phase);
            if (!expected.isClose(other.amplitude(i), tolerance)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Statevector[");
        for (int i = 0; i < re.length; i++) {
            if (probability(i) == 0.0) continue;
            if (sb.length() > 12) sb.append(", ");
            sb.append(bitstring(i)).append('=').append(amplitude(i));
        }
        return sb.append(']').toString();
    }
}
