/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.optimizer;

public record OptimizationReport(
        int level,
        int originalGateCount,
        int optimizedGateCount,
        int originalDepth,
        int optimizedDepth
) {

    public int sizeReduction() {
        return originalGateCount - optimizedGateCount;
    }

    public int depthReduction() {
        return originalDepth - optimizedDepth;
    }

    /** Gate-count reduction in percent, two decimals; 0 for an empty circuit. */
    public double improvementPercentage() {
        if (originalGateCount == 0) return 0.0;
        return Math.round(10000.0 * sizeReduction() / originalGateCount) / 100.0;
    }
}
