/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.registry;

import ai.evacortex.qcircuit.core.circuit.CircuitDraft;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.exceptions.CircuitNotFoundException;
import ai.evacortex.qcircuit.core.exceptions.DuplicateCircuitException;
import ai.evacortex.qcircuit.core.exceptions.InvalidOperationException;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;

import java.util.List;

/**
 * {@code CircuitRegistry} is the process-wide store of named circuits and the only shared
 * mutable state of the engine. It is created once by the owner of the engine and passed by
 * reference to whichever component needs circuit lookup.
 *
 * <p>Circuits are held as immutable {@link QuantumCircuit} snapshots. Mutation happens only by
 * appending operations, which replaces the stored snapshot with a new one carrying a fresh
 * version number. A version number is never reused, even after a circuit is removed and a new
 * one is created under the same name.</p>
 *
 * <p>Implementations must be thread-safe: {@code create}, {@code register},
 * {@code appendOperations} and {@code remove} are mutually exclusive, while {@code get} and
 * {@code list} may run concurrently with each other and always observe a complete snapshot,
 * never a half-applied append.</p>
 *
 * @see QuantumCircuit
 * @see CircuitDraft
 */
public interface CircuitRegistry {

    /**
     * Creates an empty circuit.
     *
     * @param numQubits number of qubits, at least 1
     * @param numClbits number of classical bits, at least 0
     * @param name      explicit name, or {@code null} to generate a unique one
     * @return the stored snapshot
     * @throws DuplicateCircuitException  if {@code name} is already taken
     * @throws InvalidParameterException  if a register size or the name is invalid
     */
    QuantumCircuit create(int numQubits, int numClbits, String name);

    /**
     * Stores a pre-built circuit, e.g. the output of a builder or of the optimizer.
     *
     * <p>The draft's operations are validated exactly as an append would validate them.</p>
     *
     * @param draft content to store
     * @param name  explicit name, or {@code null} to generate one from the draft's name prefix
     * @return the stored snapshot
     * @throws DuplicateCircuitException  if {@code name} is already taken
     * @throws InvalidOperationException  if the draft holds an invalid operation
     */
    QuantumCircuit register(CircuitDraft draft, String name);

    /**
     * Returns the current snapshot of a circuit.
     *
     * @throws CircuitNotFoundException if no circuit has this name
     */
    QuantumCircuit get(String name);

    boolean contains(String name);

    /**
     * Lists all circuits in creation order.
     */
    List<CircuitSummary> list();

    /**
     * Validates and appends operations. All-or-nothing: if any operation is invalid the
     * circuit is left unmodified.
     *
     * @return the new snapshot
     * @throws CircuitNotFoundException   if no circuit has this name
     * @throws InvalidOperationException  naming the first offending operation and the reason
     */
    QuantumCircuit appendOperations(String name, List<? extends Operation> operations);

    /**
     * Removes a circuit.
     *
     * @throws CircuitNotFoundException if no circuit has this name
     */
    QuantumCircuit remove(String name);

    int size();
}
