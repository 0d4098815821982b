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
 * Inverse-pair cancellation that also looks past overlapping gates the incoming gate
 * commutes with, e.g. {@code rz(θ)·0, cx(0,1), rz(−θ)·0} or {@code x·1, cx(0,1), x·1}.
 * Measurements are never crossed.
 */
public class CommutativeCancellationPass extends CancellationPass {

    @Override
    protected boolean commutes(Operation earlier, UnitaryOp gate, int numQubits) {
        if (GateAlgebra.disjoint(earlier, gate, numQubits)) return true;
        return earlier instanceof UnitaryOp previous && GateAlgebra.commute(previous, gate);
    }

    @Override
    public String name() {
        return "commutative-cancellation";
    }
}
