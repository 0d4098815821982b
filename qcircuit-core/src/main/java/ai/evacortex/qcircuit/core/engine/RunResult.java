/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.engine;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Observed counts keyed by classical-register bitstring (bit {@code n_c-1} leftmost).
 * Zero-count outcomes are omitted.
 */
public record RunResult(String circuit, int shots, Map<String, Integer> counts, int totalCounts) {

    public RunResult {
        counts = Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    public int count(String bitstring) {
        return counts.getOrDefault(bitstring, 0);
    }

    public double frequency(String bitstring) {
        return shots == 0 ? 0.0 : (double) count(bitstring) / shots;
    }
}
