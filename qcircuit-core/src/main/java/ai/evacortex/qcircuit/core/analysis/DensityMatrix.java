/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.analysis;

import ai.evacortex.qcircuit.core.engine.Statevector;
import ai.evacortex.qcircuit.core.math.Complex;
import ai.evacortex.qcircuit.core.math.ComplexMatrix;

import java.util.Objects;

/**
 * Density operator over {@code numQubits} qubits, same index convention as {@link Statevector}.
 */
public record DensityMatrix(int numQubits, ComplexMatrix matrix) {

    public DensityMatrix {
        Objects.requireNonNull(matrix, "matrix must not be null");
        if (matrix.dim() != 1 << numQubits) {
            throw new IllegalArgumentException("Matrix dimension " + matrix.dim() + " does not match "
                    + numQubits + " qubit(s)");
        }
    }

    /** ρ = |ψ⟩⟨ψ| */
    public static DensityMatrix fromStatevector(Statevector psi) {
        int dim = psi.dimension();
        ComplexMatrix rho = new ComplexMatrix(dim);
        for (int r = 0; r < dim; r++) {
            Complex a = psi.amplitude(r);
            if (a.absSquared() == 0.0) continue;
            for (int c = 0; c < dim; c++) {
                Complex b = psi.amplitude(c);
                rho.set(r, c, a.real * b.real + a.imag * b.imag, a.imag * b.real - a.real * b.imag);
            }
        }
        return new DensityMatrix(psi.numQubits(), rho);
    }

    public int dimension() {
        return matrix.dim();
    }

    public Complex get(int row, int col) {
        return matrix.get(row, col);
    }

    public double trace() {
        return matrix.trace().real;
    }
}
