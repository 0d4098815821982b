/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.exceptions;

public class InvalidParameterException extends RuntimeException {

    private final String parameter;

    public InvalidParameterException(String parameter, Object value, String constraint) {
        super("Invalid " + parameter + " = " + value + ": " + constraint);
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }
}
