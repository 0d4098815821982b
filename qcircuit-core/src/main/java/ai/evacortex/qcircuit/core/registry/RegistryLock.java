/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.registry;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Whole-registry read/write lock handed out as try-with-resources handles.
 * Lookups and listings share the read side; create, append and remove take the write side.
 */
final class RegistryLock {

    /** Held lock; closing releases it. */
    static final class Held implements AutoCloseable {
        private final Lock lock;

        private Held(Lock lock) {
            this.lock = lock;
            lock.lock();
        }

        @Override
        public void close() {
            lock.unlock();
        }
    }

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    Held read() {
        return new Held(rw.readLock());
    }

    Held write() {
        return new Held(rw.writeLock());
    }

    boolean heldForWrite() {
        return rw.isWriteLockedByCurrentThread();
    }
}
