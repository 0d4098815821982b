/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.engine;

import ai.evacortex.qcircuit.core.circuit.MeasureAllOp;
import ai.evacortex.qcircuit.core.circuit.MeasureOp;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.circuit.UnitaryOp;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import ai.evacortex.qcircuit.core.exceptions.NoMeasurementException;
import ai.evacortex.qcircuit.core.exceptions.NumericalInstabilityException;
import ai.evacortex.qcircuit.core.gates.GateType;
import ai.evacortex.qcircuit.core.math.ComplexMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;

/**
 * Applies unitaries to an amplitude vector and samples measurement outcomes (Born rule).
 *
 * <p>Gate application never materializes the {@code 2^n × 2^n} operator: for a k-qubit gate
 * the amplitudes are visited in groups of {@code 2^k} indices that differ only in the target
 * bits, and each group is multiplied by the gate matrix.</p>
 *
 * <p>Measurement is terminal: {@link #run} evolves the unitary part once and draws every
 * shot independently from the final distribution, projected onto the measured qubits.</p>
 */
public class StatevectorEngine {

    private static final Logger logger = LoggerFactory.getLogger(StatevectorEngine.class);

    private final SimulatorConfig config;

    public StatevectorEngine(SimulatorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public StatevectorEngine() {
        this(SimulatorConfig.defaults());
    }

    public SimulatorConfig config() {
        return config;
    }

    /**
     * Final state of the circuit's unitary part starting from |0…0⟩.
     * Measurement operations are skipped.
     */
    public Statevector evolve(QuantumCircuit circuit) {
        return evolve(Statevector.zero(circuit.numQubits()), circuit.operations());
    }

    /**
     * Applies the unitary operations to a copy of {@code initial}.
     */
    public Statevector evolve(Statevector initial, List<Operation> operations) {
        Statevector state = initial.copy();
        for (Operation op : operations) {
            if (op instanceof UnitaryOp unitary) {
                applyUnitary(state, unitary);
            }
        }
        return state;
    }

    public void applyUnitary(Statevector state, UnitaryOp op) {
        applyUnitary(state, op.gate(), op.targets(), op.params());
    }

    /**
     * Applies {@code gate(params)} to {@code targets} in place.
     *
     * @throws NumericalInstabilityException if the norm drifts beyond the configured tolerance
     */
    public void applyUnitary(Statevector state, GateType gate, int[] targets, double[] params) {
        if (targets.length != gate.arity()) {
            throw new IllegalArgumentException(gate.gateName() + " expects " + gate.arity()
                    + " target(s), got " + targets.length);
        }
        for (int t : targets) {
            if (t < 0 || t >= state.numQubits()) {
                throw new IllegalArgumentException("Target qubit " + t + " out of range for "
                        + state.numQubits() + " qubits");
            }
        }
        double before = config.normCheck() ? state.normSquared() : 0.0;

        applyMatrix(state, gate.matrix(params), targets);

        if (config.normCheck()) {
            double after = state.normSquared();
            double drift = Math.abs(after - before);
            if (drift > config.normTolerance()) {
                logger.warn("Norm drift {} after {} on {}", drift, gate.gateName(), Arrays.toString(targets));
                throw new NumericalInstabilityException("Norm drift " + drift + " after gate '"
                        + gate.gateName() + "' exceeds tolerance " + config.normTolerance());
            }
        }
    }

    static void applyMatrix(Statevector state, ComplexMatrix matrix, int[] targets) {
        int k = targets.length;
        int d = 1 << k;
        int[] offsets = new int[d];
        int mask = 0;
        for (int t : targets) mask |= 1 << t;
        for (int local = 0; local < d; local++) {
            int offset = 0;
            for (int j = 0; j < k; j++) {
                if (((local >>> j) & 1) == 1) offset |= 1 << targets[j];
            }
            offsets[local] = offset;
        }

        double[] mr = new double[d * d];
        double[] mi = new double[d * d];
        for (int r = 0; r < d; r++) {
            for (int c = 0; c < d; c++) {
                mr[r * d + c] = matrix.re(r, c);
                mi[r * d + c] = matrix.im(r, c);
            }
        }

        double[] re = state.re;
        double[] im = state.im;
        double[] tr = new double[d];
        double[] ti = new double[d];
        int dim = re.length;

        for (int base = 0; base < dim; base++) {
            if ((base & mask) != 0) continue;
            for (int l = 0; l < d; l++) {
                tr[l] = re[base | offsets[l]];
                ti[l] = im[base | offsets[l]];
            }
            for (int r = 0; r < d; r++) {
                double sr = 0.0;
                double si = 0.0;
                int row = r * d;
                for (int c = 0; c < d; c++) {
                    double ar = mr[row + c];
                    double ai = mi[row + c];
                    sr += ar * tr[c] - ai * ti[c];
                    si += ar * ti[c] + ai * tr[c];
                }
                re[base | offsets[r]] = sr;
                im[base | offsets[r]] = si;
            }
        }
    }

    /**
     * Draws {@code shots} independent outcomes over all basis states.
     *
     * @return counts keyed by basis bitstring, zero-count outcomes omitted
     */
    public Map<String, Integer> sample(Statevector state, int shots, Random rng) {
        Map<Integer, Integer> indices = sampleIndices(state, shots, rng);
        Map<String, Integer> counts = new TreeMap<>();
        indices.forEach((index, count) -> counts.put(state.bitstring(index), count));
        return counts;
    }

    Map<Integer, Integer> sampleIndices(Statevector state, int shots, Random rng) {
        requireShots(shots);
        Objects.requireNonNull(rng, "rng must not be null");

        int dim = state.dimension();
        double[] cdf = new double[dim];
        double acc = 0.0;
        for (int i = 0; i < dim; i++) {
            acc += state.probability(i);
            cdf[i] = acc;
        }
        if (acc <= 0.0) {
            throw new NumericalInstabilityException("Cannot sample from a zero state");
        }

        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int s = 0; s < shots; s++) {
            double u = rng.nextDouble() * acc;
            counts.merge(search(cdf, u), 1, Integer::sum);
        }
        return counts;
    }

    // first index with cdf[i] > u
    private static int search(double[] cdf, double u) {
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cdf[mid] > u) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /**
     * Simulates the circuit and samples its measured qubits.
     *
     * @param seed {@code null} for a non-deterministic run
     * @throws NoMeasurementException   if the circuit has no measurement
     * @throws InvalidParameterException if {@code shots} is not positive
     */
    public RunResult run(QuantumCircuit circuit, int shots, Long seed) {
        requireShots(shots);
        if (!circuit.hasMeasurement()) {
            throw new NoMeasurementException(circuit.name());
        }

        // classical bit -> measured qubit; a later measurement into the same bit wins
        int[] source = new int[circuit.numClbits()];
        Arrays.fill(source, -1);
        for (Operation op : circuit.operations()) {
            if (op instanceof MeasureOp measure) {
                source[measure.classicalBit()] = measure.qubit();
            } else if (op instanceof MeasureAllOp) {
                for (int q = 0; q < circuit.numQubits(); q++) source[q] = q;
            }
        }

        Statevector state = evolve(circuit);
        Random rng = seed == null ? new Random() : new Random(seed);
        Map<Integer, Integer> sampled = sampleIndices(state, shots, rng);

        Map<String, Integer> counts = new TreeMap<>();
        int width = source.length;
        sampled.forEach((index, count) -> {
            char[] bits = new char[width];
            for (int c = 0; c < width; c++) {
                bits[width - 1 - c] = source[c] >= 0 && ((index >>> source[c]) & 1) == 1 ? '1' : '0';
            }
            counts.merge(new String(bits), count, Integer::sum);
        });

        logger.debug("Ran '{}' for {} shots: {} distinct outcomes", circuit.name(), shots, counts.size());
        return new RunResult(circuit.name(), shots, counts, shots);
    }

    private static void requireShots(int shots) {
        if (shots <= 0) {
            throw new InvalidParameterException("shots", shots, "must be a positive integer");
        }
    }
}
