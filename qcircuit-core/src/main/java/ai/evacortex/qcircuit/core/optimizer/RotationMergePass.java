/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.optimizer;

import ai.evacortex.qcircuit.core.circuit.UnitaryOp;

/**
 * Adds rotation merging on top of commutative cancellation: same-axis rotations on the same
 * qubits collapse into one with the summed angle, dropped entirely when the sum is ≡ 0 mod 2π.
 */
public class RotationMergePass extends CommutativeCancellationPass {

    private static final double ZERO_ANGLE = 1e-12;

    @Override
    protected Fold combine(UnitaryOp earlier, UnitaryOp later) {
        Fold cancel = super.combine(earlier, later);
        if (cancel.applies()) return cancel;
        if (!GateAlgebra.mergeable(earlier, later)) return Fold.NONE;

        double angle = GateAlgebra.normalizeAngle(earlier.params()[0] + later.params()[0]);
        if (Math.abs(angle) < ZERO_ANGLE) return Fold.CANCEL;
        return Fold.replaceWith(UnitaryOp.rotation(earlier.gate(), angle, earlier.targets()));
    }

    @Override
    public String name() {
        return "rotation-merge";
    }
}
