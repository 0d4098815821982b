/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.optimizer;

import ai.evacortex.qcircuit.core.circuit.CircuitDraft;
import ai.evacortex.qcircuit.core.circuit.Operation;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import ai.evacortex.qcircuit.core.exceptions.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Produces an equivalent, smaller circuit at one of four cumulative effort levels:
 * <ul>
 *     <li>0: identity, baseline for reports</li>
 *     <li>1: adjacent inverse-pair cancellation ({@link CancellationPass})</li>
 *     <li>2: plus cancellation across commuting gates ({@link CommutativeCancellationPass})</li>
 *     <li>3: plus same-axis rotation merging ({@link RotationMergePass})</li>
 * </ul>
 * The selected pass is repeated until the gate count stops shrinking, so optimizing an
 * already optimized circuit at the same level changes nothing.
 */
public class CircuitOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(CircuitOptimizer.class);

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 3;

    public OptimizationResult optimize(QuantumCircuit circuit, int level) {
        OptimizationPass pass = passFor(level);
        List<Operation> ops = circuit.operations();

        if (pass != null) {
            int before;
            int rounds = 0;
            do {
                before = ops.size();
                ops = pass.run(ops, circuit.numQubits());
                rounds++;
            } while (ops.size() < before);
            logger.debug("Pass '{}' reached a fixpoint on '{}' after {} round(s)", pass.name(), circuit.name(), rounds);
        }

        CircuitDraft draft = new CircuitDraft(circuit.numQubits(), circuit.numClbits(), ops,
                circuit.name() + "_opt" + level);
        OptimizationReport report = new OptimizationReport(level,
                circuit.size(), draft.size(), circuit.depth(), draft.depth());

        logger.info("Optimized '{}' at level {}: {} -> {} operations, depth {} -> {}",
                circuit.name(), level, report.originalGateCount(), report.optimizedGateCount(),
                report.originalDepth(), report.optimizedDepth());
        return new OptimizationResult(draft, report);
    }

    static OptimizationPass passFor(int level) {
        return switch (level) {
            case 0 -> null;
            case 1 -> new CancellationPass();
            case 2 -> new CommutativeCancellationPass();
            case 3 -> new RotationMergePass();
            default -> throw new InvalidParameterException("optimization_level", level,
                    "must be between " + MIN_LEVEL + " and " + MAX_LEVEL);
        };
    }
}
