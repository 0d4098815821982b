/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

import java.util.List;

/**
 * Unregistered circuit content produced by a builder.
 *
 * @param namePrefix prefix used when the registry has to generate a name for it
 */
public record CircuitDraft(int numQubits, int numClbits, List<Operation> operations, String namePrefix) {

    public CircuitDraft {
        operations = List.copyOf(operations);
    }

    public int size() {
        return operations.size();
    }

    public int depth() {
        return QuantumCircuit.depthOf(operations, numQubits, numClbits);
    }
}
