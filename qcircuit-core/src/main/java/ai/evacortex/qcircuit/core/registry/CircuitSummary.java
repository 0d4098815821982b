/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.registry;

import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;

public record CircuitSummary(String name, int qubits, int classicalBits, int gates) {

    public static CircuitSummary of(QuantumCircuit circuit) {
        return new CircuitSummary(circuit.name(), circuit.numQubits(), circuit.numClbits(), circuit.size());
    }
}
