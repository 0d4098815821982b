/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.engine;

import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.io.Closeable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Final statevectors of unitary-only circuits, keyed by {@code (name, version)}.
 *
 * <p>An append gives the circuit a new version, so a stale entry can never be returned;
 * it simply ages out. Callers always receive a private copy.</p>
 */
public class StatevectorCache implements Closeable {

    private record Key(String name, long version) {}

    private final Cache<Key, Statevector> cache;
    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    public StatevectorCache(long maxBytes) {
        this.cache = Caffeine.newBuilder()
                .maximumWeight(maxBytes)
                .weigher((Key k, Statevector v) -> (int) Math.min(v.sizeInBytes(), Integer.MAX_VALUE))
                .recordStats()
                .build();
    }

    public Statevector get(QuantumCircuit circuit, Function<QuantumCircuit, Statevector> simulator) {
        if (isClosed.get()) return simulator.apply(circuit);
        Key key = new Key(circuit.name(), circuit.version());
        return cache.get(key, k -> simulator.apply(circuit)).copy();
    }

    public void invalidate(String name) {
        cache.asMap().keySet().removeIf(k -> k.name().equals(name));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    @Override
    public void close() {
        isClosed.set(true);
        cache.invalidateAll();
        cache.cleanUp();
    }
}
