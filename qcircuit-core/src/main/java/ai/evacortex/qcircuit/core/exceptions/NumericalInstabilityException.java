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
 * Internal invariant breach in the numeric core (norm drift, a density matrix that is not
 * Hermitian or not unit trace). Indicates a defect in a gate matrix or the engine, never a
 * bad request.
 */
public class NumericalInstabilityException extends IllegalStateException {
    public NumericalInstabilityException(String message) {
        super(message);
    }
}
