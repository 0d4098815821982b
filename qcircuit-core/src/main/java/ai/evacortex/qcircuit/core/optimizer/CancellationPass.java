/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.optimizer;

import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.UnitaryOp;

/**
 * Removes adjacent inverse pairs: {@code x x}, {@code h h}, {@code s sdg}, {@code t tdg},
 * {@code rz(θ) rz(−θ)}, {@code cx cx} on the same qubits. "Adjacent" means no operation
 * in between touches any of the pair's qubits.
 */
public class CancellationPass extends PeepholePass {

    @Override
    protected boolean commutes(Operation earlier, UnitaryOp gate, int numQubits) {
        return GateAlgebra.disjoint(earlier, gate, numQubits);
    }

    @Override
    protected Fold combine(UnitaryOp earlier, UnitaryOp later) {
        return GateAlgebra.cancels(earlier, later) ? Fold.CANCEL : Fold.NONE;
    }

    @Override
    public String name() {
        return "inverse-cancellation";
    }
}
