/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.exceptions;

/**
 * Raised when an operation cannot be appended to a circuit: unknown gate, index out of
 * range, arity or parameter-count mismatch, duplicate target qubits, or a unitary after
 * a measurement. The whole batch containing the operation is rejected.
 */
public class InvalidOperationException extends RuntimeException {

    private final int index;
    private final String operation;
    private final String reason;

    public InvalidOperationException(int index, String operation, String reason) {
        super("Invalid operation #" + index + " (" + operation + "): " + reason);
        this.index = index;
        this.operation = operation;
        this.reason = reason;
    }

    public int index() {
        return index;
    }

    public String operation() {
        return operation;
    }

    public String reason() {
        return reason;
    }
}
