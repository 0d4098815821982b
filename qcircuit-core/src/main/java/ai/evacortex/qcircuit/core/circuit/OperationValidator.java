/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

import ai.evacortex.qcircuit.core.exceptions.InvalidOperationException;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import ai.evacortex.qcircuit.core.gates.GateType;

import java.util.List;

/**
 * Checks operations against a circuit's registers before they are appended.
 *
 * <p>Validation is all-or-nothing: the first offending operation aborts the whole batch.
 * Once a circuit holds a measurement, further unitaries are rejected; additional
 * measurements remain allowed.</p>
 */
public final class OperationValidator {

    private OperationValidator() {}

    public static void requireRegisters(int numQubits, int numClbits) {
        if (numQubits < 1) {
            throw new InvalidParameterException("num_qubits", numQubits, "must be a positive integer");
        }
        if (numClbits < 0) {
            throw new InvalidParameterException("num_classical_bits", numClbits, "must be non-negative");
        }
    }

    /**
     * @param existing operations already in the circuit
     * @param batch    operations to append, indexed from 0 in error messages
     * @throws InvalidOperationException on the first invalid operation
     */
    public static void validate(int numQubits, int numClbits, List<Operation> existing, List<? extends Operation> batch) {
        boolean measured = existing.stream().anyMatch(Operation::isMeasurement);

        for (int i = 0; i < batch.size(); i++) {
            Operation op = batch.get(i);
            if (op == null) {
                throw new InvalidOperationException(i, "null", "operation must not be null");
            }
            if (op instanceof UnitaryOp unitary) {
                if (measured) {
                    throw new InvalidOperationException(i, op.toString(),
                            "unitary gate after a measurement is not allowed");
                }
                checkUnitary(i, unitary, numQubits);
            } else if (op instanceof MeasureOp measure) {
                checkQubit(i, op, measure.qubit(), numQubits);
                if (measure.classicalBit() < 0 || measure.classicalBit() >= numClbits) {
                    throw new InvalidOperationException(i, op.toString(),
                            "classical bit " + measure.classicalBit() + " out of range [0, " + numClbits + ")");
                }
                measured = true;
            } else if (op instanceof MeasureAllOp) {
                if (numClbits < numQubits) {
                    throw new InvalidOperationException(i, op.toString(),
                            "measure_all needs " + numQubits + " classical bits, circuit has " + numClbits);
                }
                measured = true;
            }
        }
    }

    private static void checkUnitary(int index, UnitaryOp op, int numQubits) {
        GateType gate = op.gate();
        int[] targets = op.targets();
        double[] params = op.params();

        if (targets.length != gate.arity()) {
            throw new InvalidOperationException(index, op.toString(),
                    "gate '" + gate.gateName() + "' acts on " + gate.arity() + " qubit(s), got " + targets.length);
        }
        if (params.length != gate.paramCount()) {
            throw new InvalidOperationException(index, op.toString(),
                    "gate '" + gate.gateName() + "' takes " + gate.paramCount() + " parameter(s), got " + params.length);
        }
        for (double param : params) {
            if (!Double.isFinite(param)) {
                throw new InvalidOperationException(index, op.toString(), "parameter " + param + " is not finite");
            }
        }
        for (int a = 0; a < targets.length; a++) {
            checkQubit(index, op, targets[a], numQubits);
            for (int b = a + 1; b < targets.length; b++) {
                if (targets[a] == targets[b]) {
                    throw new InvalidOperationException(index, op.toString(),
                            "duplicate target qubit " + targets[a]);
                }
            }
        }
    }

    private static void checkQubit(int index, Operation op, int qubit, int numQubits) {
        if (qubit < 0 || qubit >= numQubits) {
            throw new InvalidOperationException(index, op.toString(),
                    "qubit index " + qubit + " out of range [0, " + numQubits + ")");
        }
    }
}
