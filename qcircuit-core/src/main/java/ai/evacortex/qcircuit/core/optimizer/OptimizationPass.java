/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.optimizer;

import ai.evacortex.qcircuit.core.circuit.Operation;

import java.util.List;

/**
 * {@code OptimizationPass} rewrites an operation sequence into an equivalent one.
 *
 * <p>Equivalence is strict: the rewritten sequence must implement the same unitary as the
 * input up to an unobservable global phase, and measurements must stay in place relative to
 * every operation on the qubits they read. Passes never mutate their input.</p>
 */
public interface OptimizationPass {

    /**
     * @param operations input sequence, left untouched
     * @param numQubits  register size of the owning circuit
     * @return the rewritten sequence; equal to the input when nothing applies
     */
    List<Operation> run(List<Operation> operations, int numQubits);

    String name();
}
