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

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent assembly of an operation list. Every call is validated immediately against the
 * register sizes, so a builder never holds an invalid sequence.
 */
public final class CircuitBuilder {

    private final int numQubits;
    private final int numClbits;
    private final List<Operation> operations = new ArrayList<>();

    public CircuitBuilder(int numQubits, int numClbits) {
        OperationValidator.requireRegisters(numQubits, numClbits);
        this.numQubits = numQubits;
        this.numClbits = numClbits;
    }

    public CircuitBuilder(int numQubits) {
        this(numQubits, 0);
    }

    public CircuitBuilder gate(GateType gate, double[] params, int... targets) {
        return add(new UnitaryOp(gate, targets, params));
    }

    public CircuitBuilder gate(GateType gate, int... targets) {
        return add(UnitaryOp.of(gate, targets));
    }

    public CircuitBuilder h(int q) { return gate(GateType.H, q); }

    public CircuitBuilder x(int q) { return gate(GateType.X, q); }

    public CircuitBuilder y(int q) { return gate(GateType.Y, q); }

    public CircuitBuilder z(int q) { return gate(GateType.Z, q); }

    public CircuitBuilder s(int q) { return gate(GateType.S, q); }

    public CircuitBuilder sdg(int q) { return gate(GateType.SDG, q); }

    public CircuitBuilder t(int q) { return gate(GateType.T, q); }

    public CircuitBuilder tdg(int q) { return gate(GateType.TDG, q); }

    public CircuitBuilder rx(double theta, int q) { return add(UnitaryOp.rotation(GateType.RX, theta, q)); }

    public CircuitBuilder ry(double theta, int q) { return add(UnitaryOp.rotation(GateType.RY, theta, q)); }

    public CircuitBuilder rz(double theta, int q) { return add(UnitaryOp.rotation(GateType.RZ, theta, q)); }

    public CircuitBuilder p(double lambda, int q) { return add(UnitaryOp.rotation(GateType.P, lambda, q)); }

    public CircuitBuilder u(double theta, double phi, double lambda, int q) {
        return gate(GateType.U, new double[]{theta, phi, lambda}, q);
    }

    public CircuitBuilder cx(int control, int target) { return gate(GateType.CX, control, target); }

    public CircuitBuilder cz(int a, int b) { return gate(GateType.CZ, a, b); }

    public CircuitBuilder cp(double lambda, int control, int target) {
        return add(UnitaryOp.rotation(GateType.CP, lambda, control, target));
    }

    public CircuitBuilder swap(int a, int b) { return gate(GateType.SWAP, a, b); }

    public CircuitBuilder rxx(double theta, int a, int b) { return add(UnitaryOp.rotation(GateType.RXX, theta, a, b)); }

    public CircuitBuilder ryy(double theta, int a, int b) { return add(UnitaryOp.rotation(GateType.RYY, theta, a, b)); }

    public CircuitBuilder rzz(double theta, int a, int b) { return add(UnitaryOp.rotation(GateType.RZZ, theta, a, b)); }

    public CircuitBuilder measure(int qubit, int classicalBit) { return add(new MeasureOp(qubit, classicalBit)); }

    public CircuitBuilder measureAll() { return add(new MeasureAllOp()); }

    public CircuitBuilder add(Operation op) {
        OperationValidator.validate(numQubits, numClbits, operations, List.of(op));
        operations.add(op);
        return this;
    }

    public CircuitBuilder addAll(List<? extends Operation> ops) {
        OperationValidator.validate(numQubits, numClbits, operations, ops);
        operations.addAll(ops);
        return this;
    }

    public List<Operation> operations() {
        return List.copyOf(operations);
    }

    public CircuitDraft draft() {
        return draft("circuit_" + System.currentTimeMillis());
    }

    public CircuitDraft draft(String namePrefix) {
        return new CircuitDraft(numQubits, numClbits, operations, namePrefix);
    }
}
