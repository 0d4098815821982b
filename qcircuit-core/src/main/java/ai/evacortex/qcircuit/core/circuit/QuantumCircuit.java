/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a named circuit: register sizes plus the ordered operation list.
 *
 * <p>Appending produces a new snapshot with a fresh {@code version}; a version is never
 * reused by the registry, so {@code (name, version)} identifies one exact operation list.</p>
 */
public final class QuantumCircuit {

    private final String name;
    private final int numQubits;
    private final int numClbits;
    private final List<Operation> operations;
    private final long version;

    public QuantumCircuit(String name, int numQubits, int numClbits, List<Operation> operations, long version) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.numQubits = numQubits;
        this.numClbits = numClbits;
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
        this.version = version;
    }

    public String name() {
        return name;
    }

    public int numQubits() {
        return numQubits;
    }

    public int numClbits() {
        return numClbits;
    }

    public List<Operation> operations() {
        return operations;
    }

    public long version() {
        return version;
    }

    /** Total number of operations, measurements included. */
    public int size() {
        return operations.size();
    }

    public int width() {
        return numQubits + numClbits;
    }

    public boolean hasMeasurement() {
        for (Operation op : operations) {
            if (op.isMeasurement()) return true;
        }
        return false;
    }

    public int depth() {
        return depthOf(operations, numQubits, numClbits);
    }

    /**
     * Operation counts keyed by gate name ({@code measure} / {@code measure_all} for measurements),
     * in first-seen order.
     */
    public Map<String, Integer> gateCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Operation op : operations) {
            counts.merge(keyOf(op), 1, Integer::sum);
        }
        return counts;
    }

    public QuantumCircuit withAppended(List<Operation> extra, long newVersion) {
        List<Operation> ops = new ArrayList<>(operations.size() + extra.size());
        ops.addAll(operations);
        ops.addAll(extra);
        return new QuantumCircuit(name, numQubits, numClbits, ops, newVersion);
    }

    /**
     * Length of the longest dependency chain: two operations are ordered when they share a
     * qubit or a classical bit.
     */
    public static int depthOf(List<Operation> operations, int numQubits, int numClbits) {
        int[] qubitLevel = new int[numQubits];
        int[] clbitLevel = new int[numClbits];
        int depth = 0;
        for (Operation op : operations) {
            int[] qubits = op.qubits(numQubits);
            int[] clbits = op.classicalBits(numQubits);
            int level = 0;
            for (int q : qubits) level = Math.max(level, qubitLevel[q]);
            for (int c : clbits) level = Math.max(level, clbitLevel[c]);
            level++;
            for (int q : qubits) qubitLevel[q] = level;
            for (int c : clbits) clbitLevel[c] = level;
            depth = Math.max(depth, level);
        }
        return depth;
    }

    private static String keyOf(Operation op) {
        if (op instanceof UnitaryOp unitary) return unitary.gate().gateName();
        if (op instanceof MeasureOp) return "measure";
        return "measure_all";
    }

    @Override
    public String toString() {
        return "QuantumCircuit[" + name + ", qubits=" + numQubits + ", clbits=" + numClbits
                + ", ops=" + operations.size() + ", v" + version + "]";
    }
}
