package io.github.goodees.cqrs.saga;

/*-
 * #%L
 * cqrs
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive locks per saga instance. Locks are created on first acquire and removed when the last holder or
 * waiter releases them, so the table only holds keys in use.
 */
public class SagaLockTable {
    private final Object tableLock = new Object();
    private final Map<SagaReference, LockReference> locks = new HashMap<>();

    /**
     * Block until the saga is locked exclusively.
     * @param reference the saga
     * @return the held lock, to be closed once the saga is saved
     */
    public SagaLock acquire(SagaReference reference) {
        Objects.requireNonNull(reference, "Saga reference must be specified");
        LockReference lock;
        synchronized (tableLock) {
            lock = locks.get(reference);
            if (lock == null) {
                lock = new LockReference();
                locks.put(reference, lock);
            }
            lock.references++;
        }
        lock.lock.lock();
        return new SagaLock(reference, lock);
    }

    public SagaLock acquire(Class<? extends Saga> sagaType, String sagaId) {
        return acquire(new SagaReference(sagaType, sagaId));
    }

    private void release(SagaReference reference, LockReference lock) {
        lock.lock.unlock();
        synchronized (tableLock) {
            if (--lock.references == 0) {
                locks.remove(reference);
            }
        }
    }

    /**
     * Number of keys currently locked or waited for.
     */
    public int size() {
        synchronized (tableLock) {
            return locks.size();
        }
    }

    private static class LockReference {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by tableLock
        private int references;
    }

    /**
     * Lock held on single saga.
     */
    public final class SagaLock implements AutoCloseable {
        private final SagaReference reference;
        private final LockReference lock;
        private boolean released;

        private SagaLock(SagaReference reference, LockReference lock) {
            this.reference = reference;
            this.lock = lock;
        }

        public SagaReference getReference() {
            return reference;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                release(reference, lock);
            }
        }
    }
}
