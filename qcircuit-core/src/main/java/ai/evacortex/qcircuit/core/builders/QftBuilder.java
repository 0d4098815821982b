/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.builders;

import ai.evacortex.qcircuit.core.circuit.CircuitBuilder;
import ai.evacortex.qcircuit.core.circuit.CircuitDraft;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;

import java.util.List;

/**
 * Quantum Fourier Transform, {@code |x⟩ → 2^{-n/2} Σ_k e^{2πi·xk/2^n} |k⟩}.
 *
 * <p>Forward: for qubit j from n−1 down to 0, {@code h(j)} followed by {@code cp(π/2^{j−k})}
 * from every lower qubit k, then a swap network reversing qubit order. The inverse is the
 * exact adjoint: swaps first, then the rotations in reverse order with negated angles.</p>
 */
public final class QftBuilder {

    private QftBuilder() {}

    public static CircuitDraft build(int numQubits, boolean inverse) {
        if (numQubits < 1) {
            throw new InvalidParameterException("num_qubits", numQubits, "must be a positive integer");
        }
        String prefix = (inverse ? "iqft_" : "qft_") + numQubits + "q";
        return new CircuitBuilder(numQubits, numQubits)
                .addAll(operations(numQubits, inverse))
                .draft(prefix);
    }

    public static List<Operation> operations(int numQubits, boolean inverse) {
        CircuitBuilder ops = new CircuitBuilder(numQubits);
        if (!inverse) {
            for (int j = numQubits - 1; j >= 0; j--) {
                ops.h(j);
                for (int k = j - 1; k >= 0; k--) {
                    ops.cp(Math.scalb(Math.PI, -(j - k)), k, j);
                }
            }
            swapNetwork(ops, numQubits);
        } else {
            swapNetwork(ops, numQubits);
            for (int j = 0; j < numQubits; j++) {
                for (int k = 0; k < j; k++) {
                    ops.cp(-Math.scalb(Math.PI, -(j - k)), k, j);
                }
                ops.h(j);
            }
        }
        return ops.operations();
    }

    private static void swapNetwork(CircuitBuilder ops, int numQubits) {
        for (int i = 0; i < numQubits / 2; i++) {
            ops.swap(i, numQubits - 1 - i);
        }
    }
}
