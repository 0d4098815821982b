/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core;

import java.util.Map;

public record CircuitDescription(
        String name,
        int numQubits,
        int numClbits,
        int depth,
        int size,
        int width,
        Map<String, Integer> gateCounts,
        int totalOperations
) {}
