/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.analysis;

import ai.evacortex.qcircuit.core.math.Complex;

import java.util.Map;

/**
 * Pure-state view of a circuit.
 *
 * @param amplitudes       every basis bitstring with its amplitude, in index order
 * @param probabilities    non-negligible |amplitude|², in index order
 * @param topProbabilities at most ten most probable outcomes, descending
 */
public record StatevectorAnalysis(
        String circuit,
        int numQubits,
        int stateDimension,
        Map<String, Complex> amplitudes,
        Map<String, Double> probabilities,
        Map<String, Double> topProbabilities,
        double totalProbability,
        String mostProbableState,
        double maxProbability
) {

    public double probability(String bitstring) {
        return probabilities.getOrDefault(bitstring, 0.0);
    }
}
