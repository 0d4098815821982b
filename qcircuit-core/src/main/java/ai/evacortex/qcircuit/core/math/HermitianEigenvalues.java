/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.math;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

import java.util.Arrays;

/**
 * Eigenvalues of a complex Hermitian matrix via EJML's symmetric solver.
 *
 * <p>{@code H = A + iB} is embedded as the real symmetric {@code [[A, −B], [B, A]]}, whose
 * spectrum is the spectrum of {@code H} with every eigenvalue doubled.</p>
 */
public final class HermitianEigenvalues {

    private HermitianEigenvalues() {}

    /**
     * @return eigenvalues in ascending order
     * @throws IllegalStateException if the decomposition does not converge
     */
    public static double[] of(ComplexMatrix hermitian) {
        int d = hermitian.dim();
        DMatrixRMaj embedded = new DMatrixRMaj(2 * d, 2 * d);
        for (int r = 0; r < d; r++) {
            for (int c = 0; c < d; c++) {
                double a = hermitian.re(r, c);
                double b = hermitian.im(r, c);
                embedded.set(r, c, a);
                embedded.set(r + d, c + d, a);
                embedded.set(r, c + d, -b);
                embedded.set(r + d, c, b);
            }
        }

        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(2 * d, false, true);
        if (!eig.decompose(embedded)) {
            throw new IllegalStateException("Eigen decomposition failed for " + d + "x" + d + " matrix");
        }

        double[] doubled = new double[eig.getNumberOfEigenvalues()];
        for (int i = 0; i < doubled.length; i++) {
            doubled[i] = eig.getEigenvalue(i).getReal();
        }
        Arrays.sort(doubled);

        double[] values = new double[d];
        for (int i = 0; i < d; i++) {
            values[i] = 0.5 * (doubled[2 * i] + doubled[2 * i + 1]);
        }
        return values;
    }
}
