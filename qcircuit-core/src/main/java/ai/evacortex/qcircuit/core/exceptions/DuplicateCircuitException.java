/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.exceptions;

public class DuplicateCircuitException extends RuntimeException {
    public DuplicateCircuitException(String name) {
        super("Circuit with name already exists: " + name);
    }
}
