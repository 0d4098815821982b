/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.builders;

import ai.evacortex.qcircuit.core.circuit.CircuitDraft;

public record AnsatzResult(CircuitDraft draft, int parameterCount) {}
