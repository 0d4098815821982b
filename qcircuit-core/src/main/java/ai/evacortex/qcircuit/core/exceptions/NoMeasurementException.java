/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.exceptions;

public class NoMeasurementException extends RuntimeException {
    public NoMeasurementException(String name) {
        super("Circuit '" + name + "' has no measurement operations; add 'measure' or 'measure_all' before running.");
    }
}
