/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.math;

import java.util.Arrays;

/**
 * Dense square complex matrix stored as split row-major real/imaginary arrays.
 *
 * <p>Used for gate unitaries (2×2 up to 16×16) and for density matrices, where the
 * dimension is {@code 2^n}. Instances are mutable only through the package-private
 * setters used while building them; every public operation returns a new matrix.</p>
 */
public final class ComplexMatrix {

    private final int dim;
    private final double[] re;
    private final double[] im;

    public ComplexMatrix(int dim) {
        if (dim <= 0) throw new IllegalArgumentException("Matrix dimension must be positive: " + dim);
        this.dim = dim;
        this.re = new double[dim * dim];
        this.im = new double[dim * dim];
    }

    public static ComplexMatrix identity(int dim) {
        ComplexMatrix m = new ComplexMatrix(dim);
        for (int i = 0; i < dim; i++) m.re[i * dim + i] = 1.0;
        return m;
    }

    /**
     * Builds a matrix from rows of complex entries.
     */
    public static ComplexMatrix of(Complex[][] rows) {
        int dim = rows.length;
        ComplexMatrix m = new ComplexMatrix(dim);
        for (int r = 0; r < dim; r++) {
            if (rows[r].length != dim) {
                throw new IllegalArgumentException("Row " + r + " has " + rows[r].length + " entries, expected " + dim);
            }
            for (int c = 0; c < dim; c++) {
                m.set(r, c, rows[r][c].real, rows[r][c].imag);
            }
        }
        return m;
    }

    public static ComplexMatrix diagonal(Complex... entries) {
        ComplexMatrix m = new ComplexMatrix(entries.length);
        for (int i = 0; i < entries.length; i++) {
            m.set(i, i, entries[i].real, entries[i].imag);
        }
        return m;
    }

    public int dim() {
        return dim;
    }

    public double re(int row, int col) {
        return re[row * dim + col];
    }

    public double im(int row, int col) {
        return im[row * dim + col];
    }

    public Complex get(int row, int col) {
        return new Complex(re(row, col), im(row, col));
    }

    public void set(int row, int col, double real, double imag) {
        re[row * dim + col] = real;
        im[row * dim + col] = imag;
    }

    public void add(int row, int col, double real, double imag) {
        re[row * dim + col] += real;
        im[row * dim + col] += imag;
    }

    public ComplexMatrix multiply(ComplexMatrix other) {
        requireSameDim(other);
        ComplexMatrix out = new ComplexMatrix(dim);
        for (int r = 0; r < dim; r++) {
            for (int k = 0; k < dim; k++) {
                double ar = re[r * dim + k];
                double ai = im[r * dim + k];
                if (ar == 0.0 && ai == 0.0) continue;
                for (int c = 0; c < dim; c++) {
                    double br = other.re[k * dim + c];
                    double bi = other.im[k * dim + c];
                    out.re[r * dim + c] += ar * br - ai * bi;
                    out.im[r * dim + c] += ar * bi + ai * br;
                }
            }
        }
        return out;
    }

    public ComplexMatrix conjugateTranspose() {
        ComplexMatrix out = new ComplexMatrix(dim);
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                out.re[c * dim + r] = re[r * dim + c];
                out.im[c * dim + r] = -im[r * dim + c];
            }
        }
        return out;
    }

    public Complex trace() {
        double tr = 0.0;
        double ti = 0.0;
        for (int i = 0; i < dim; i++) {
            tr += re[i * dim + i];
            ti += im[i * dim + i];
        }
        return new Complex(tr, ti);
    }

    /**
     * Frobenius norm squared, Σ|m_ij|². Equals Tr(M†M).
     */
    public double frobeniusSquared() {
        double sum = 0.0;
        for (int i = 0; i < re.length; i++) {
            sum += re[i] * re[i] + im[i] * im[i];
        }
        return sum;
    }

    public boolean isHermitian(double tolerance) {
        for (int r = 0; r < dim; r++) {
            for (int c = r; c < dim; c++) {
                if (Math.abs(re(r, c) - re(c, r)) > tolerance) return false;
                if (Math.abs(im(r, c) + im(c, r)) > tolerance) return false;
            }
        }
        return true;
    }

    public boolean isUnitary(double tolerance) {
        return conjugateTranspose().multiply(this).isClose(identity(dim), tolerance);
    }

    public boolean isClose(ComplexMatrix other, double tolerance) {
        if (other.dim != dim) return false;
        for (int i = 0; i < re.length; i++) {
            if (Math.abs(re[i] - other.re[i]) > tolerance) return false;
            if (Math.abs(im[i] - other.im[i]) > tolerance) return false;
        }
        return true;
    }

    /**
     * Returns the phase {@code c} with {@code |c| = 1} such that {@code this ≈ c·I},
     * or {@code null} if the matrix is not a scalar multiple of the identity.
     */
    public Complex identityPhase(double tolerance) {
        double cr = re[0];
        double ci = im[0];
        if (Math.abs(Math.hypot(cr, ci) - 1.0) > tolerance) return null;
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                double er = (r == c) ? cr : 0.0;
                double ei = (r == c) ? ci : 0.0;
                if (Math.abs(re(r, c) - er) > tolerance || Math.abs(im(r, c) - ei) > tolerance) {
                    return null;
                }
            }
        }
        return new Complex(cr, ci);
    }

    private void requireSameDim(ComplexMatrix other) {
        if (other.dim != dim) {
            throw new IllegalArgumentException("Dimension mismatch: " + dim + " vs " + other.dim);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComplexMatrix)) return false;
        ComplexMatrix other = (ComplexMatrix) obj;
        return dim == other.dim && Arrays.equals(re, other.re) && Arrays.equals(im, other.im);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * dim + Arrays.hashCode(re)) + Arrays.hashCode(im);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < dim; r++) {
            sb.append('[');
            for (int c = 0; c < dim; c++) {
                if (c > 0) sb.append(", ");
                sb.append(get(r, c));
            }
            sb.append(']').append('\n');
        }
        return sb.toString();
    }
}
