/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.analysis;

import java.util.Map;

/**
 * Density-matrix summary of a circuit's final pure state. Entropies are in bits.
 *
 * @param entanglementEntropy entropy of each single-qubit reduced state, keyed by qubit
 * @param entangled           any single-qubit entanglement entropy above 0.01
 */
public record DensityMatrixAnalysis(
        String circuit,
        int numQubits,
        double purity,
        double entropy,
        double trace,
        boolean isPureState,
        Map<Integer, Double> entanglementEntropy,
        boolean entangled
) {}
