/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.analysis;

import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.engine.Statevector;
import ai.evacortex.qcircuit.core.engine.StatevectorCache;
import ai.evacortex.qcircuit.core.engine.StatevectorEngine;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import ai.evacortex.qcircuit.core.exceptions.MeasurementPresentException;
import ai.evacortex.qcircuit.core.exceptions.NumericalInstabilityException;
import ai.evacortex.qcircuit.core.math.Complex;
import ai.evacortex.qcircuit.core.math.ComplexMatrix;
import ai.evacortex.qcircuit.core.math.HermitianEigenvalues;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derives amplitudes, density matrices, purity and entanglement entropy from the final
 * state of a unitary-only circuit. Entropies use log base 2 (bits): a Bell pair has one bit
 * of entanglement entropy across either qubit.
 */
public class StateAnalyzer {

    private static final double PROBABILITY_EPS = 1e-12;
    private static final double EIGEN_EPS = 1e-12;
    private static final double CONSISTENCY_TOLERANCE = 1e-6;
    private static final double PURE_THRESHOLD = 0.99;
    private static final double ENTANGLED_THRESHOLD = 0.01;
    private static final int TOP_K = 10;

    private final StatevectorEngine engine;
    private final StatevectorCache cache;

    public StateAnalyzer(StatevectorEngine engine, StatevectorCache cache) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.cache = cache;
    }

    public StateAnalyzer(StatevectorEngine engine) {
        this(engine, null);
    }

    /**
     * Final pure state of the circuit.
     *
     * @throws MeasurementPresentException if the circuit contains any measurement
     */
    public Statevector statevector(QuantumCircuit circuit) {
        if (circuit.hasMeasurement()) {
            throw new MeasurementPresentException(circuit.name());
        }
        return cache == null ? engine.evolve(circuit) : cache.get(circuit, engine::evolve);
    }

    public StatevectorAnalysis analyzeStatevector(QuantumCircuit circuit) {
        Statevector psi = statevector(circuit);
        int dim = psi.dimension();

        Map<String, Complex> amplitudes = new LinkedHashMap<>();
        Map<String, Double> probabilities = new LinkedHashMap<>();
        double total = 0.0;
        int best = 0;
        for (int i = 0; i < dim; i++) {
            String bits = psi.bitstring(i);
            double p = psi.probability(i);
            amplitudes.put(bits, psi.amplitude(i));
            if (p > PROBABILITY_EPS) probabilities.put(bits, p);
            total += p;
            if (p > psi.probability(best)) best = i;
        }

        Map<String, Double> top = new LinkedHashMap<>();
        probabilities.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_K)
                .forEach(e -> top.put(e.getKey(), e.getValue()));

        return new StatevectorAnalysis(circuit.name(), circuit.numQubits(), dim,
                amplitudes, probabilities, top, total, psi.bitstring(best), psi.probability(best));
    }

    /**
     * @throws InvalidParameterException if the register exceeds the configured density-matrix limit
     */
    public DensityMatrix densityMatrix(QuantumCircuit circuit) {
        return densityMatrix(statevector(circuit));
    }

    public DensityMatrix densityMatrix(Statevector psi) {
        int limit = engine.config().maxDensityQubits();
        if (psi.numQubits() > limit) {
            throw new InvalidParameterException("num_qubits", psi.numQubits(),
                    "density matrices are materialized for at most " + limit + " qubits");
        }
        return DensityMatrix.fromStatevector(psi);
    }

    /** Tr(ρ²) */
    public double purity(DensityMatrix rho) {
        // Tr(ρ²) = Σ|ρ_ij|² for Hermitian ρ
        return rho.matrix().frobeniusSquared();
    }

    /**
     * Von Neumann entropy −Tr(ρ log₂ ρ). Negative eigenvalues from rounding are clipped to
     * zero and zero eigenvalues contribute nothing.
     */
    public double entropy(DensityMatrix rho) {
        double sum = 0.0;
        for (double lambda : HermitianEigenvalues.of(rho.matrix())) {
            if (lambda > EIGEN_EPS) {
                sum -= lambda * Math.log(lambda);
            }
        }
        return Math.max(0.0, sum / Math.log(2));
    }

    /**
     * Reduces ρ to the kept qubits; kept qubit {@code keep[j]} becomes bit {@code j} of the result.
     */
    public DensityMatrix partialTrace(DensityMatrix rho, int... keep) {
        Subsystem sub = Subsystem.of(rho.numQubits(), keep);
        int dk = sub.keptOffsets.length;
        ComplexMatrix full = rho.matrix();
        ComplexMatrix reduced = new ComplexMatrix(dk);
        for (int a = 0; a < dk; a++) {
            for (int b = 0; b < dk; b++) {
                double sr = 0.0;
                double si = 0.0;
                for (int e : sub.tracedOffsets) {
                    int row = sub.keptOffsets[a] | e;
                    int col = sub.keptOffsets[b] | e;
                    sr += full.re(row, col);
                    si += full.im(row, col);
                }
                reduced.set(a, b, sr, si);
            }
        }
        return checked(new DensityMatrix(keep.length, reduced));
    }

    /**
     * Same reduction computed directly from the amplitudes, without materializing the full
     * {@code 4^n} density matrix.
     */
    public DensityMatrix partialTrace(Statevector psi, int... keep) {
        Subsystem sub = Subsystem.of(psi.numQubits(), keep);
        int dk = sub.keptOffsets.length;
        ComplexMatrix reduced = new ComplexMatrix(dk);
        double[] vr = new double[dk];
        double[] vi = new double[dk];
        for (int e : sub.tracedOffsets) {
            for (int a = 0; a < dk; a++) {
                Complex amp = psi.amplitude(sub.keptOffsets[a] | e);
                vr[a] = amp.real;
                vi[a] = amp.imag;
            }
            for (int a = 0; a < dk; a++) {
                if (vr[a] == 0.0 && vi[a] == 0.0) continue;
                for (int b = 0; b < dk; b++) {
                    reduced.add(a, b, vr[a] * vr[b] + vi[a] * vi[b], vi[a] * vr[b] - vr[a] * vi[b]);
                }
            }
        }
        return checked(new DensityMatrix(keep.length, reduced));
    }

    /**
     * Entropy of the reduced state on {@code subsystem}; non-zero means the circuit's state is
     * entangled across that cut.
     */
    public double entanglementEntropy(QuantumCircuit circuit, int... subsystem) {
        return entropy(partialTrace(statevector(circuit), subsystem));
    }

    public DensityMatrixAnalysis analyzeDensityMatrix(QuantumCircuit circuit) {
        Statevector psi = statevector(circuit);
        DensityMatrix rho = checked(densityMatrix(psi));

        double purity = purity(rho);
        double entropy = entropy(rho);

        Map<Integer, Double> perQubit = new LinkedHashMap<>();
        boolean entangled = false;
        if (psi.numQubits() >= 2) {
            for (int q = 0; q < psi.numQubits(); q++) {
                double s = entropy(partialTrace(psi, q));
                perQubit.put(q, s);
                entangled |= s > ENTANGLED_THRESHOLD;
            }
        }
        return new DensityMatrixAnalysis(circuit.name(), circuit.numQubits(), purity, entropy,
                rho.trace(), purity > PURE_THRESHOLD, perQubit, entangled);
    }

    private static DensityMatrix checked(DensityMatrix rho) {
        double trace = rho.trace();
        if (Math.abs(trace - 1.0) > CONSISTENCY_TOLERANCE) {
            throw new NumericalInstabilityException("Density matrix trace " + trace + " is not 1");
        }
        if (!rho.matrix().isHermitian(CONSISTENCY_TOLERANCE)) {
            throw new NumericalInstabilityException("Density matrix is not Hermitian");
        }
        return rho;
    }

    private record Subsystem(int[] keptOffsets, int[] tracedOffsets) {

        static Subsystem of(int numQubits, int[] keep) {
            if (keep == null || keep.length == 0) {
                throw new InvalidParameterException("subsystem", "[]", "must name at least one qubit");
            }
            boolean[] kept = new boolean[numQubits];
            for (int q : keep) {
                if (q < 0 || q >= numQubits) {
                    throw new InvalidParameterException("subsystem", Arrays.toString(keep),
                            "qubit " + q + " out of range [0, " + numQubits + ")");
                }
                if (kept[q]) {
                    throw new InvalidParameterException("subsystem", Arrays.toString(keep),
                            "duplicate qubit " + q);
                }
                kept[q] = true;
            }
            int[] traced = new int[numQubits - keep.length];
            int t = 0;
            for (int q = 0; q < numQubits; q++) {
                if (!kept[q]) traced[t++] = q;
            }
            return new Subsystem(offsets(keep), offsets(traced));
        }

        // every assignment of the given qubits, as amplitude-index bit masks
        private static int[] offsets(int[] qubits) {
            int[] out = new int[1 << qubits.length];
            for (int local = 0; local < out.length; local++) {
                int offset = 0;
                for (int j = 0; j < qubits.length; j++) {
                    if (((local >>> j) & 1) == 1) offset |= 1 << qubits[j];
                }
                out[local] = offset;
            }
            return out;
        }
    }
}
