/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

import ai.evacortex.qcircuit.core.gates.GateType;
import ai.evacortex.qcircuit.core.math.ComplexMatrix;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

public record UnitaryOp(GateType gate, int[] targets, double[] params) implements Operation {

    public UnitaryOp {
        Objects.requireNonNull(gate, "gate must not be null");
        targets = targets.clone();
        params = params == null ? new double[0] : params.clone();
    }

    public static UnitaryOp of(GateType gate, int... targets) {
        return new UnitaryOp(gate, targets, new double[0]);
    }

    public static UnitaryOp rotation(GateType gate, double angle, int... targets) {
        return new UnitaryOp(gate, targets, new double[]{angle});
    }

    @Override
    public int[] targets() {
        return targets.clone();
    }

    @Override
    public double[] params() {
        return params.clone();
    }

    public int target(int i) {
        return targets[i];
    }

    public int arity() {
        return targets.length;
    }

    public ComplexMatrix matrix() {
        return gate.matrix(params);
    }

    @Override
    public int[] qubits(int numQubits) {
        return targets.clone();
    }

    @Override
    public int[] classicalBits(int numQubits) {
        return new int[0];
    }

    @Override
    public boolean isMeasurement() {
        return false;
    }

    @Override
    public String describe() {
        String paramText = params.length == 0 ? "" : Arrays.stream(params)
                .mapToObj(Double::toString)
                .collect(Collectors.joining(", ", "(", ")"));
        if (gate == GateType.CX) {
            return "CNOT gate from qubit " + targets[0] + " to " + targets[1];
        }
        if (targets.length == 1) {
            return gate.label() + paramText + " gate on qubit " + targets[0];
        }
        return gate.label() + paramText + " gate on qubits " + Arrays.stream(targets)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnitaryOp)) return false;
        UnitaryOp other = (UnitaryOp) obj;
        return gate == other.gate && Arrays.equals(targets, other.targets) && Arrays.equals(params, other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gate, Arrays.hashCode(targets), Arrays.hashCode(params));
    }

    @Override
    public String toString() {
        return gate.gateName() + Arrays.toString(targets) + (params.length == 0 ? "" : Arrays.toString(params));
    }
}
