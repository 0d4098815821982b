/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

public record MeasureOp(int qubit, int classicalBit) implements Operation {

    @Override
    public int[] qubits(int numQubits) {
        return new int[]{qubit};
    }

    @Override
    public int[] classicalBits(int numQubits) {
        return new int[]{classicalBit};
    }

    @Override
    public boolean isMeasurement() {
        return true;
    }

    @Override
    public String describe() {
        return "Measure qubit " + qubit + " into bit " + classicalBit;
    }

    @Override
    public String toString() {
        return "measure[" + qubit + " -> " + classicalBit + "]";
    }
}
