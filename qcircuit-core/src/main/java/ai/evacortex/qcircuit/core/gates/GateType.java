/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.gates;

import ai.evacortex.qcircuit.core.math.ComplexMatrix;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Closed catalog of unitary gates, keyed by the lower-case name used in requests.
 *
 * <p>Each entry fixes its arity (number of target qubits), parameter count and a pure
 * matrix generator returning a {@code 2^arity × 2^arity} unitary. Measurement is not a
 * gate and is modelled separately by the circuit operations.</p>
 */
public enum GateType {

    H("h", "H", 1, 0, p -> GateMatrices.hadamard()),
    X("x", "X", 1, 0, p -> GateMatrices.pauliX()),
    Y("y", "Y", 1, 0, p -> GateMatrices.pauliY()),
    Z("z", "Z", 1, 0, p -> GateMatrices.pauliZ()),
    S("s", "S", 1, 0, p -> GateMatrices.phase(Math.PI / 2)),
    SDG("sdg", "S†", 1, 0, p -> GateMatrices.phase(-Math.PI / 2)),
    T("t", "T", 1, 0, p -> GateMatrices.phase(Math.PI / 4)),
    TDG("tdg", "T†", 1, 0, p -> GateMatrices.phase(-Math.PI / 4)),
    RX("rx", "RX", 1, 1, p -> GateMatrices.rx(p[0])),
    RY("ry", "RY", 1, 1, p -> GateMatrices.ry(p[0])),
    RZ("rz", "RZ", 1, 1, p -> GateMatrices.rz(p[0])),
    P("p", "P", 1, 1, p -> GateMatrices.phase(p[0])),
    U("u", "U", 1, 3, p -> GateMatrices.u(p[0], p[1], p[2])),
    CX("cx", "CNOT", 2, 0, p -> GateMatrices.cx()),
    CZ("cz", "CZ", 2, 0, p -> GateMatrices.cz()),
    CP("cp", "CP", 2, 1, p -> GateMatrices.cp(p[0])),
    SWAP("swap", "SWAP", 2, 0, p -> GateMatrices.swap()),
    RXX("rxx", "RXX", 2, 1, p -> GateMatrices.rxx(p[0])),
    RYY("ryy", "RYY", 2, 1, p -> GateMatrices.ryy(p[0])),
    RZZ("rzz", "RZZ", 2, 1, p -> GateMatrices.rzz(p[0]));

    private static final Map<String, GateType> BY_NAME;

    static {
        Map<String, GateType> byName = new LinkedHashMap<>();
        for (GateType type : values()) {
            byName.put(type.gateName, type);
        }
        byName.put("cnot", CX);
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String gateName;
    private final String label;
    private final int arity;
    private final int paramCount;
    private final Function<double[], ComplexMatrix> generator;

    GateType(String gateName, String label, int arity, int paramCount, Function<double[], ComplexMatrix> generator) {
        this.gateName = gateName;
        this.label = label;
        this.arity = arity;
        this.paramCount = paramCount;
        this.generator = generator;
    }

    /**
     * Resolves a request name (case-insensitive) to its catalog entry.
     */
    public static Optional<GateType> fromName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public String gateName() {
        return gateName;
    }

    public String label() {
        return label;
    }

    public int arity() {
        return arity;
    }

    public int paramCount() {
        return paramCount;
    }

    public int dimension() {
        return 1 << arity;
    }

    /**
     * Builds the unitary for the given parameters.
     *
     * @throws IllegalArgumentException if the parameter count does not match
     */
    public ComplexMatrix matrix(double... params) {
        double[] actual = params == null ? new double[0] : params;
        if (actual.length != paramCount) {
            throw new IllegalArgumentException(gateName + " expects " + paramCount
                    + " parameter(s), got " + actual.length + " " + Arrays.toString(actual));
        }
        return generator.apply(actual);
    }

    /**
     * Gates whose action does not depend on the order of their target qubits.
     */
    public boolean isSymmetric() {
        return switch (this) {
            case CZ, CP, SWAP, RXX, RYY, RZZ -> true;
            default -> false;
        };
    }

    /**
     * Single-angle gates for which {@code g(a)·g(b) = g(a + b)} on the same qubits.
     */
    public boolean isAdditiveRotation() {
        return switch (this) {
            case RX, RY, RZ, P, CP, RXX, RYY, RZZ -> true;
            default -> false;
        };
    }
}
