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
import ai.evacortex.qcircuit.core.math.ComplexMatrix;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Exact algebraic checks between pairs of gates, decided on their matrices embedded in the
 * joint space of the qubits they touch (at most four qubits, 16×16).
 */
final class GateAlgebra {

    static final double TOLERANCE = 1e-9;

    private GateAlgebra() {}

    static boolean disjoint(Operation a, Operation b, int numQubits) {
        int[] qa = a.qubits(numQubits);
        int[] qb = b.qubits(numQubits);
        for (int x : qa) {
            for (int y : qb) {
                if (x == y) return false;
            }
        }
        return true;
    }

    static boolean sameQubitSet(UnitaryOp a, UnitaryOp b) {
        if (a.arity() != b.arity()) return false;
        int[] sa = a.targets();
        int[] sb = b.targets();
        Arrays.sort(sa);
        Arrays.sort(sb);
        return Arrays.equals(sa, sb);
    }

    /**
     * True when {@code later · earlier} equals the identity up to global phase.
     */
    static boolean cancels(UnitaryOp earlier, UnitaryOp later) {
        if (!sameQubitSet(earlier, later)) return false;
        int[] space = earlier.targets();
        ComplexMatrix product = embed(later, space).multiply(embed(earlier, space));
        return product.identityPhase(TOLERANCE) != null;
    }

    /**
     * True when both unitaries commute. Disjoint gates always do.
     */
    static boolean commute(UnitaryOp a, UnitaryOp b) {
        int[] space = union(a.targets(), b.targets());
        if (space.length == a.arity() + b.arity()) return true;
        ComplexMatrix ea = embed(a, space);
        ComplexMatrix eb = embed(b, space);
        return ea.multiply(eb).isClose(eb.multiply(ea), TOLERANCE);
    }

    /**
     * Same additive rotation on the same qubits; the angles of the two can be summed.
     */
    static boolean mergeable(UnitaryOp earlier, UnitaryOp later) {
        if (earlier.gate() != later.gate() || !earlier.gate().isAdditiveRotation()) return false;
        if (Arrays.equals(earlier.targets(), later.targets())) return true;
        return earlier.gate().isSymmetric() && sameQubitSet(earlier, later);
    }

    /**
     * Maps an angle into (−π, π]. Shifting a rotation angle by 2π changes the gate by at
     * most a global phase of −1.
     */
    static double normalizeAngle(double angle) {
        double a = Math.IEEEremainder(angle, 2 * Math.PI);
        if (a <= -Math.PI) a += 2 * Math.PI;
        return a;
    }

    /**
     * Matrix of {@code op} acting on the ordered qubit list {@code space}; {@code space[j]}
     * is bit {@code j} of the local index.
     */
    static ComplexMatrix embed(UnitaryOp op, int[] space) {
        int[] targets = op.targets();
        int[] position = new int[targets.length];
        int targetMask = 0;
        for (int t = 0; t < targets.length; t++) {
            position[t] = indexOf(space, targets[t]);
            targetMask |= 1 << position[t];
        }

        ComplexMatrix gate = op.matrix();
        int dim = 1 << space.length;
        ComplexMatrix out = new ComplexMatrix(dim);
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                if ((r & ~targetMask) != (c & ~targetMask)) continue;
                int lr = gather(r, position);
                int lc = gather(c, position);
                out.set(r, c, gate.re(lr, lc), gate.im(lr, lc));
            }
        }
        return out;
    }

    private static int gather(int index, int[] position) {
        int local = 0;
        for (int t = 0; t < position.length; t++) {
            if (((index >>> position[t]) & 1) == 1) local |= 1 << t;
        }
        return local;
    }

    private static int indexOf(int[] space, int qubit) {
        for (int i = 0; i < space.length; i++) {
            if (space[i] == qubit) return i;
        }
        throw new IllegalArgumentException("Qubit " + qubit + " not in " + Arrays.toString(space));
    }

    private static int[] union(int[] a, int[] b) {
        Set<Integer> all = new LinkedHashSet<>();
        for (int q : a) all.add(q);
        for (int q : b) all.add(q);
        return all.stream().mapToInt(Integer::intValue).toArray();
    }
}
