/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.builders;

import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Qubit-pair topology of an ansatz entangling layer.
 */
public enum Entanglement {

    /** every pair (i, j), i < j */
    FULL,
    /** (i, i+1) */
    LINEAR,
    /** linear plus the wrap-around pair (n−1, 0) */
    CIRCULAR;

    public static Entanglement fromName(String name) {
        if (name != null) {
            String key = name.trim().toUpperCase(Locale.ROOT);
            for (Entanglement e : values()) {
                if (e.name().equals(key)) return e;
            }
        }
        throw new InvalidParameterException("entanglement", name,
                "must be one of " + Arrays.toString(values()).toLowerCase(Locale.ROOT));
    }

    /**
     * Control/target pairs for a register of {@code numQubits}. The wrap-around pair is only
     * added for three or more qubits, where it is not already a linear pair.
     */
    public List<int[]> pairs(int numQubits) {
        List<int[]> pairs = new ArrayList<>();
        switch (this) {
            case FULL -> {
                for (int i = 0; i < numQubits; i++) {
                    for (int j = i + 1; j < numQubits; j++) pairs.add(new int[]{i, j});
                }
            }
            case LINEAR, CIRCULAR -> {
                for (int i = 0; i + 1 < numQubits; i++) pairs.add(new int[]{i, i + 1});
                if (this == CIRCULAR && numQubits > 2) pairs.add(new int[]{numQubits - 1, 0});
            }
        }
        return pairs;
    }
}
