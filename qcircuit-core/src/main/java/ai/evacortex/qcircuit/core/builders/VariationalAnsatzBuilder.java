/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.builders;

import ai.evacortex.qcircuit.core.circuit.CircuitBuilder;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;

/**
 * Hardware-efficient ansatz: each layer applies {@code ry} and {@code rz} to every qubit and
 * then a {@code cx} entangler on each pair of the chosen topology.
 *
 * <p>Parameter values are consumed layer by layer, qubit by qubit, {@code ry} before {@code rz}.</p>
 */
public final class VariationalAnsatzBuilder {

    public static final int ROTATIONS_PER_QUBIT = 2;

    private VariationalAnsatzBuilder() {}

    public static int parameterCount(int numQubits, int layers) {
        return numQubits * ROTATIONS_PER_QUBIT * layers;
    }

    /**
     * Builds the ansatz with all parameters bound to zero.
     */
    public static AnsatzResult build(int numQubits, int layers, Entanglement entanglement) {
        return build(numQubits, layers, entanglement, null);
    }

    /**
     * @param values one value per free parameter, or {@code null} for all zeros
     * @throws InvalidParameterException on a non-positive size or a wrong number of values
     */
    public static AnsatzResult build(int numQubits, int layers, Entanglement entanglement, double[] values) {
        if (numQubits < 1) {
            throw new InvalidParameterException("num_qubits", numQubits, "must be a positive integer");
        }
        if (layers < 1) {
            throw new InvalidParameterException("num_layers", layers, "must be a positive integer");
        }
        if (entanglement == null) {
            throw new InvalidParameterException("entanglement", null, "must not be null");
        }
        int count = parameterCount(numQubits, layers);
        double[] theta = values == null ? new double[count] : values;
        if (theta.length != count) {
            throw new InvalidParameterException("parameter_values", theta.length + " values",
                    "ansatz has " + count + " free parameters");
        }

        CircuitBuilder circuit = new CircuitBuilder(numQubits, numQubits);
        int next = 0;
        for (int layer = 0; layer < layers; layer++) {
            for (int q = 0; q < numQubits; q++) {
                circuit.ry(theta[next++], q);
                circuit.rz(theta[next++], q);
            }
            for (int[] pair : entanglement.pairs(numQubits)) {
                circuit.cx(pair[0], pair[1]);
            }
        }
        return new AnsatzResult(circuit.draft(), count);
    }
}
