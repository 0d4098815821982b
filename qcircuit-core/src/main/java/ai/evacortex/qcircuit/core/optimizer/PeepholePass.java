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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single left-to-right sweep that tries to fold every incoming gate into an earlier one.
 *
 * <p>For each gate the already emitted operations are scanned backwards. The scan stops at the
 * first operation the gate does not commute with; before that, any operation that
 * {@link #combine combines} with the gate absorbs it. Folding into an earlier position is
 * sound because the gate commutes with everything it was moved past.</p>
 */
abstract class PeepholePass implements OptimizationPass {

    /** Outcome of folding a later gate into an earlier one. */
    record Fold(UnitaryOp replacement, boolean applies) {
        static final Fold NONE = new Fold(null, false);
        static final Fold CANCEL = new Fold(null, true);

        static Fold replaceWith(UnitaryOp op) {
            return new Fold(op, true);
        }
    }

    @Override
    public List<Operation> run(List<Operation> operations, int numQubits) {
        Objects.requireNonNull(operations, "operations must not be null");
        List<Operation> out = new ArrayList<>(operations.size());

        for (Operation op : operations) {
            if (!(op instanceof UnitaryOp gate)) {
                out.add(op);
                continue;
            }
            boolean absorbed = false;
            for (int i = out.size() - 1; i >= 0; i--) {
                Operation earlier = out.get(i);
                if (earlier == null) continue;
                if (earlier instanceof UnitaryOp previous) {
                    Fold fold = combine(previous, gate);
                    if (fold.applies()) {
                        out.set(i, fold.replacement());
                        absorbed = true;
                        break;
                    }
                }
                if (!commutes(earlier, gate, numQubits)) break;
            }
            if (!absorbed) out.add(gate);
        }

        out.removeIf(Objects::isNull);
        return out;
    }

    /**
     * Whether {@code gate} may be moved in front of {@code earlier}.
     */
    protected abstract boolean commutes(Operation earlier, UnitaryOp gate, int numQubits);

    protected abstract Fold combine(UnitaryOp earlier, UnitaryOp later);
}
