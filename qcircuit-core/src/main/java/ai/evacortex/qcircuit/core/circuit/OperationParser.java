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
import ai.evacortex.qcircuit.core.gates.GateType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves {@link GateRequest}s into typed operations. Range and arity checks are left to
 * {@link OperationValidator}, which knows the target circuit.
 */
public final class OperationParser {

    private static final String MEASURE = "measure";
    private static final String MEASURE_ALL = "measure_all";

    private OperationParser() {}

    public static List<Operation> parse(List<GateRequest> requests) {
        List<Operation> ops = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ops.add(parse(i, requests.get(i)));
        }
        return ops;
    }

    static Operation parse(int index, GateRequest request) {
        if (request == null || request.type() == null || request.type().isBlank()) {
            throw new InvalidOperationException(index, String.valueOf(request), "missing operation type");
        }
        String type = request.type().trim().toLowerCase(Locale.ROOT);
        int[] qubits = toQubits(index, request);

        if (MEASURE_ALL.equals(type)) {
            return new MeasureAllOp();
        }
        if (MEASURE.equals(type)) {
            if (qubits.length != 1) {
                throw new InvalidOperationException(index, describe(request),
                        "measure takes exactly one qubit, got " + qubits.length);
            }
            int bit = request.classicalBit() != null ? request.classicalBit() : qubits[0];
            return new MeasureOp(qubits[0], bit);
        }

        Optional<GateType> gate = GateType.fromName(type);
        if (gate.isEmpty()) {
            throw new InvalidOperationException(index, describe(request), "unknown gate '" + request.type() + "'");
        }
        double[] params = new double[request.params() == null ? 0 : request.params().size()];
        for (int p = 0; p < params.length; p++) {
            Double value = request.params().get(p);
            if (value == null) {
                throw new InvalidOperationException(index, describe(request), "parameter " + p + " is null");
            }
            params[p] = value;
        }
        return new UnitaryOp(gate.get(), qubits, params);
    }

    private static int[] toQubits(int index, GateRequest request) {
        List<Integer> qubits = request.qubits() == null ? List.of() : request.qubits();
        int[] out = new int[qubits.size()];
        for (int q = 0; q < out.length; q++) {
            Integer value = qubits.get(q);
            if (value == null) {
                throw new InvalidOperationException(index, describe(request), "qubit " + q + " is null");
            }
            out[q] = value;
        }
        return out;
    }

    private static String describe(GateRequest request) {
        return request.type() + (request.qubits() == null ? "[]" : request.qubits().toString())
                + (request.params() == null ? "" : request.params().toString());
    }
}
