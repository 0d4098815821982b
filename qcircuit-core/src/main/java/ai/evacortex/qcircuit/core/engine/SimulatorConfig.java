/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.engine;

/**
 * Tunables for simulation and analysis.
 */
public record SimulatorConfig(
        int defaultShots,           // shots used when the caller does not give any
        double normTolerance,       // allowed |‖ψ‖² − 1| drift after a unitary step
        boolean normCheck,          // verify the norm after every unitary step
        int maxDensityQubits,       // largest register for a materialized density matrix
        long cacheMaxBytes          // weight bound of the statevector cache
) {

    public static SimulatorConfig defaults() {
        return new SimulatorConfig(1000, 1e-6, true, 8, 64L << 20);
    }

    /**
     * Reads {@code qcircuit.*} system properties, falling back to {@link #defaults()}.
     */
    public static SimulatorConfig fromSystemProperties() {
        SimulatorConfig d = defaults();
        return new SimulatorConfig(
                Integer.parseInt(System.getProperty("qcircuit.shots.default", String.valueOf(d.defaultShots()))),
                Double.parseDouble(System.getProperty("qcircuit.norm.tolerance", String.valueOf(d.normTolerance()))),
                Boolean.parseBoolean(System.getProperty("qcircuit.norm.check", String.valueOf(d.normCheck()))),
                Integer.parseInt(System.getProperty("qcircuit.density.maxQubits", String.valueOf(d.maxDensityQubits()))),
                Long.parseLong(System.getProperty("qcircuit.cache.maxBytes", String.valueOf(d.cacheMaxBytes())))
        );
    }
}
