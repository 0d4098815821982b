/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

/**
 * A single step of a circuit: a unitary gate application or a measurement.
 */
public sealed interface Operation permits UnitaryOp, MeasureOp, MeasureAllOp {

    /**
     * Qubits this operation acts on, in the order given at construction.
     *
     * @param numQubits register size of the owning circuit (needed by {@link MeasureAllOp})
     */
    int[] qubits(int numQubits);

    /**
     * Classical bits written by this operation.
     */
    int[] classicalBits(int numQubits);

    boolean isMeasurement();

    /**
     * Short human readable form, e.g. {@code "CNOT gate from qubit 0 to 1"}.
     */
    String describe();
}
