/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulatorConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("qcircuit.shots.default");
        System.clearProperty("qcircuit.density.maxQubits");
    }

    @Test
    void defaultsMatchDocumentedValues() {
        SimulatorConfig config = SimulatorConfig.defaults();
        assertEquals(1000, config.defaultShots());
        assertEquals(1e-6, config.normTolerance());
        assertTrue(config.normCheck());
        assertEquals(8, config.maxDensityQubits());
        assertEquals(64L * 1024 * 1024, config.cacheMaxBytes());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("qcircuit.shots.default", "256");
        System.setProperty("qcircuit.density.maxQubits", "4");
        SimulatorConfig config = SimulatorConfig.fromSystemProperties();
        assertEquals(256, config.defaultShots());
        assertEquals(4, config.maxDensityQubits());
        assertEquals(SimulatorConfig.defaults().normTolerance(), config.normTolerance());
    }
}
