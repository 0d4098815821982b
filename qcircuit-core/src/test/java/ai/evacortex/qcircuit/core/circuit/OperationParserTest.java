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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationParserTest {

    @Test
    void parsesGatesAndMeasurements() {
        List<Operation> ops = OperationParser.parse(List.of(
                GateRequest.of("H", 0),
                GateRequest.of("cnot", 0, 1),
                GateRequest.withParams("rz", List.of(0.25), 1),
                GateRequest.measure(1, 0),
                GateRequest.measureAll()));

        assertEquals(UnitaryOp.of(GateType.H, 0), ops.get(0));
        assertEquals(UnitaryOp.of(GateType.CX, 0, 1), ops.get(1));
        assertEquals(UnitaryOp.rotation(GateType.RZ, 0.25, 1), ops.get(2));
        assertEquals(new MeasureOp(1, 0), ops.get(3));
        assertEquals(new MeasureAllOp(), ops.get(4));
    }

    @Test
    void measureDefaultsClassicalBitToQubit() {
        Operation op = OperationParser.parse(List.of(GateRequest.of("measure", 2))).get(0);
        assertEquals(new MeasureOp(2, 2), op);
    }

    @Test
    void unknownGateNamesTheOffendingIndex() {
        InvalidOperationException ex = assertThrows(InvalidOperationException.class,
                () -> OperationParser.parse(List.of(GateRequest.of("h", 0), GateRequest.of("toffoli", 0, 1, 2))));
        assertEquals(1, ex.index());
        assertTrue(ex.reason().contains("toffoli"));
    }

    @Test
    void nullEntriesAreRejected() {
        assertThrows(InvalidOperationException.class,
                () -> OperationParser.parse(List.of(new GateRequest("x", Arrays.asList((Integer) null), null, null))));
        assertThrows(InvalidOperationException.class,
                () -> OperationParser.parse(List.of(new GateRequest("rx", List.of(0), Arrays.asList((Double) null), null))));
        assertThrows(InvalidOperationException.class,
                () -> OperationParser.parse(List.of(new GateRequest(" ", List.of(0), null, null))));
        assertThrows(InvalidOperationException.class,
                () -> OperationParser.parse(List.of(GateRequest.of("measure", 0, 1))));
    }

    @Test
    void requestRoundTripsThroughOperation() {
        List<Operation> ops = new CircuitBuilder(2, 2).u(0.1, 0.2, 0.3, 0).cp(0.5, 0, 1).measure(1, 0).operations();
        for (Operation op : ops) {
            assertEquals(op, OperationParser.parse(List.of(GateRequest.fromOperation(op))).get(0));
        }
    }

    @Test
    void jsonRequestsAcceptAliases() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        GateRequest gate = mapper.readValue("{\"gate\":\"ry\",\"qubits\":[1],\"params\":[0.5],\"extra\":true}", GateRequest.class);
        assertEquals("ry", gate.type());
        assertEquals(List.of(0.5), gate.params());

        GateRequest measure = mapper.readValue("{\"type\":\"measure\",\"qubits\":[0],\"classical_bit\":1}", GateRequest.class);
        assertEquals(new MeasureOp(0, 1), OperationParser.parse(List.of(measure)).get(0));
    }
}
