/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

import java.util.stream.IntStream;

/**
 * Measures every qubit {@code i} into classical bit {@code i}.
 */
public record MeasureAllOp() implements Operation {

    @Override
    public int[] qubits(int numQubits) {
        return IntStream.range(0, numQubits).toArray();
    }

    @Override
    public int[] classicalBits(int numQubits) {
        return IntStream.range(0, numQubits).toArray();
    }

    @Override
    public boolean isMeasurement() {
        return true;
    }

    @Override
    public String describe() {
        return "Measure all qubits";
    }

    @Override
    public String toString() {
        return "measure_all";
    }
}
