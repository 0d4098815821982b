/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core;

import java.util.List;

/**
 * Result of an append: one human readable line per applied operation.
 */
public record AppliedOperations(String circuit, List<String> applied, int totalOperations) {

    public AppliedOperations {
        applied = List.copyOf(applied);
    }
}
