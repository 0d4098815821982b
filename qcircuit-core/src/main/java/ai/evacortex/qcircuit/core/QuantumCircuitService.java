/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core;

import ai.evacortex.qcircuit.core.analysis.DensityMatrixAnalysis;
import ai.evacortex.qcircuit.core.analysis.StatevectorAnalysis;
import ai.evacortex.qcircuit.core.circuit.GateRequest;
import ai.evacortex.qcircuit.core.engine.RunResult;
import ai.evacortex.qcircuit.core.exceptions.*;
import ai.evacortex.qcircuit.core.registry.CircuitSummary;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code QuantumCircuitService} is the call surface consumed by an external dispatch layer.
 * It manages a collection of named, mutable quantum circuits that can be built gate by gate,
 * simulated, analyzed and optimized.
 *
 * <p>Circuits are identified by name. Names are either chosen by the caller, in which case a
 * collision fails with {@link DuplicateCircuitException}, or generated, in which case they are
 * guaranteed unique within the service's lifetime.</p>
 *
 * <p>Simulation is exact: a circuit over {@code n} qubits is represented by {@code 2^n}
 * complex amplitudes, and measurement outcomes are drawn from the Born-rule distribution of
 * the final state. Qubit 0 is the least significant (rightmost) bit of every bitstring.</p>
 *
 * <p>Implementations must be thread-safe. Every error is reported as an unchecked exception
 * naming the offending circuit, operation or value; none of them is worth retrying with the
 * same input.</p>
 *
 * @see ai.evacortex.qcircuit.core.registry.CircuitRegistry
 */
public interface QuantumCircuitService {

    /**
     * Creates an empty circuit.
     *
     * @param numQubits  number of qubits, at least 1
     * @param numClbits  number of classical bits; {@code null} means {@code numQubits}
     * @param name       optional unique name; generated when {@code null}
     * @return the circuit name
     * @throws DuplicateCircuitException if {@code name} is taken
     * @throws InvalidParameterException if a register size is invalid
     */
    String createCircuit(int numQubits, Integer numClbits, String name);

    /**
     * Appends operations of the form {@code {type, qubits, params?, classical_bit?}}.
     * All-or-nothing per call.
     *
     * @throws CircuitNotFoundException  if the circuit does not exist
     * @throws InvalidOperationException naming the first offending operation
     */
    AppliedOperations appendGates(String circuit, List<GateRequest> operations);

    /**
     * Samples the circuit's measured qubits.
     *
     * @param shots number of shots; {@code null} means the configured default (1000)
     * @param seed  random seed; {@code null} for a non-reproducible run
     * @return counts keyed by classical bitstring
     * @throws NoMeasurementException    if the circuit has no measurement
     * @throws InvalidParameterException if {@code shots} is not positive
     */
    RunResult run(String circuit, Integer shots, Long seed);

    /**
     * Register sizes, depth, size, width and gate counts by type.
     */
    CircuitDescription describe(String circuit);

    List<CircuitSummary> listCircuits();

    /**
     * Amplitudes, probabilities and the most probable outcome of the final pure state.
     *
     * @throws MeasurementPresentException if the circuit contains any measurement
     */
    StatevectorAnalysis analyzeStatevector(String circuit);

    /**
     * Purity, von Neumann entropy and single-qubit entanglement entropies (bits).
     *
     * @throws MeasurementPresentException if the circuit contains any measurement
     * @throws InvalidParameterException   if the register is too large for a dense density matrix
     */
    DensityMatrixAnalysis analyzeDensityMatrix(String circuit);

    /**
     * Entanglement entropy (bits) of an arbitrary subsystem of the circuit's final state.
     */
    double entanglementEntropy(String circuit, int... subsystem);

    /**
     * Stores an optimized copy of a circuit under a new name; the original is untouched.
     *
     * @param level 0 (none) to 3 (rotation merging)
     * @throws InvalidParameterException if the level is outside 0..3
     */
    OptimizationOutcome optimize(String circuit, int level);

    /**
     * Builds a layered {@code ry/rz + cx} ansatz with all parameters at zero.
     *
     * @param entanglement {@code full}, {@code linear} or {@code circular}
     * @throws InvalidParameterException on an unknown entanglement name or non-positive sizes
     */
    VariationalCircuit buildVariational(int numQubits, int layers, String entanglement, String name);

    /**
     * Same as {@link #buildVariational(int, int, String, String)} with bound parameter values.
     */
    VariationalCircuit buildVariational(int numQubits, int layers, String entanglement, double[] values, String name);

    /**
     * Builds a forward or inverse Quantum Fourier Transform circuit.
     *
     * @return the circuit name
     */
    String buildQft(int numQubits, boolean inverse, String name);

    void removeCircuit(String circuit);

    /**
     * Writes every circuit to a JSON snapshot file.
     */
    void exportCircuits(Path file);

    /**
     * Re-creates circuits from a snapshot file, validating every operation.
     *
     * @return names of the imported circuits
     * @throws DuplicateCircuitException if a stored name already exists; nothing is imported then
     */
    List<String> importCircuits(Path file);
}
