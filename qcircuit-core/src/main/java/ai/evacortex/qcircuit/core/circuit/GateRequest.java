/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.circuit;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Loosely typed operation request, {@code {type, qubits, params?, classical_bit?}}, as handed
 * over by the dispatch layer or read back from a snapshot file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GateRequest(
        @JsonAlias("gate") String type,
        List<Integer> qubits,
        List<Double> params,
        @JsonProperty("classical_bit") @JsonAlias("classicalBit") Integer classicalBit
) {

    public static GateRequest of(String type, Integer... qubits) {
        return new GateRequest(type, Arrays.asList(qubits), null, null);
    }

    public static GateRequest withParams(String type, List<Double> params, Integer... qubits) {
        return new GateRequest(type, Arrays.asList(qubits), params, null);
    }

    public static GateRequest measure(int qubit, int classicalBit) {
        return new GateRequest("measure", List.of(qubit), null, classicalBit);
    }

    public static GateRequest measureAll() {
        return new GateRequest("measure_all", List.of(), null, null);
    }

    /**
     * Request form of an existing operation; parsing it yields an equal operation.
     */
    public static GateRequest fromOperation(Operation op) {
        if (op instanceof UnitaryOp unitary) {
            List<Integer> qubits = Arrays.stream(unitary.targets()).boxed().toList();
            double[] params = unitary.params();
            List<Double> paramList = params.length == 0 ? null : Arrays.stream(params).boxed().toList();
            return new GateRequest(unitary.gate().gateName(), qubits, paramList, null);
        }
        if (op instanceof MeasureOp measure) {
            return measure(measure.qubit(), measure.classicalBit());
        }
        return measureAll();
    }
}
