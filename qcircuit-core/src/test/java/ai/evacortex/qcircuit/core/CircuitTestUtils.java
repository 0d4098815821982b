/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core;

import ai.evacortex.qcircuit.core.circuit.CircuitBuilder;
import ai.evacortex.qcircuit.core.circuit.CircuitDraft;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.gates.GateType;
import ai.evacortex.qcircuit.core.circuit.UnitaryOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class CircuitTestUtils {

    public static QuantumCircuit circuit(String name, CircuitBuilder builder, int numQubits, int numClbits) {
        return new QuantumCircuit(name, numQubits, numClbits, builder.operations(), 1);
    }

    public static QuantumCircuit circuit(String name, CircuitDraft draft) {
        return new QuantumCircuit(name, draft.numQubits(), draft.numClbits(), draft.operations(), 1);
    }

    public static QuantumCircuit circuit(String name, int numQubits, List<Operation> ops) {
        return new QuantumCircuit(name, numQubits, numQubits, ops, 1);
    }

    public static QuantumCircuit bell() {
        return circuit("bell", new CircuitBuilder(2, 2).h(0).cx(0, 1), 2, 2);
    }

    /**
     * Random unitary-only circuit drawn from a small gate set with deliberate repetition, so
     * optimizers have something to find.
     */
    public static List<Operation> randomOps(int numQubits, int length, long seed) {
        GateType[] gates = {
                GateType.H, GateType.X, GateType.Z, GateType.S, GateType.T, GateType.SDG,
                GateType.RX, GateType.RZ, GateType.P, GateType.CX, GateType.CZ, GateType.SWAP, GateType.RZZ
        };
        Random r = new Random(seed);
        List<Operation> ops = new ArrayList<>(length);
        while (ops.size() < length) {
            GateType gate = gates[r.nextInt(gates.length)];
            int a = r.nextInt(numQubits);
            int[] targets;
            if (gate.arity() == 2) {
                int b = (a + 1 + r.nextInt(numQubits - 1)) % numQubits;
                targets = new int[]{a, b};
            } else {
                targets = new int[]{a};
            }
            double[] params = new double[gate.paramCount()];
            for (int p = 0; p < params.length; p++) {
                params[p] = (r.nextInt(8) - 4) * Math.PI / 4 + (r.nextBoolean() ? 0.0 : 0.3);
            }
            UnitaryOp op = new UnitaryOp(gate, targets, params);
            ops.add(op);
            if (r.nextDouble() < 0.3) ops.add(op);
        }
        return ops;
    }
}
