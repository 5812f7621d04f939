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

import io.github.goodees.cqrs.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Saga store decorator keeping copies of recently used sagas. Completed sagas are evicted and never cached.
 */
public class CachedSagaStore implements SagaStore {
    private static final Logger logger = LoggerFactory.getLogger(CachedSagaStore.class);

    private final SagaStore store;
    private final Map<SagaReference, Saga> cache;

    public CachedSagaStore(SagaStore store, int capacity) {
        this.store = Objects.requireNonNull(store, "Saga store must be specified");
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, was " + capacity);
        }
        this.cache = new LinkedHashMap<SagaReference, Saga>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<SagaReference, Saga> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public Saga createSaga(Class<? extends Saga> sagaType, String sagaId) {
        return store.createSaga(sagaType, sagaId);
    }

    @Override
    public Optional<Saga> tryGetSaga(Class<? extends Saga> sagaType, String sagaId) {
        SagaReference key = new SagaReference(sagaType, sagaId);
        Saga cached;
        synchronized (cache) {
            cached = cache.get(key);
        }
        if (cached != null) {
            logger.trace("Cache hit for {}", cached);
            return Optional.of(cached.copy());
        }
        Optional<Saga> saga = store.tryGetSaga(sagaType, sagaId);
        if (saga.isPresent()) {
            Saga copy = saga.get().copy();
            synchronized (cache) {
                cache.put(key, copy);
            }
        }
        return saga;
    }

    @Override
    public Saga save(Saga saga, SagaContext context) throws EventStoreException {
        SagaReference key = new SagaReference(saga.getClass(), saga.getCorrelationId());
        evict(key);
        Saga result;
        try {
            result = store.save(saga, context);
        } catch (EventStoreException | RuntimeException e) {
            evict(key);
            throw e;
        }
        if (!result.isCompleted()) {
            Saga copy = result.copy();
            synchronized (cache) {
                cache.put(key, copy);
            }
        }
        return result;
    }

    private void evict(SagaReference key) {
        synchronized (cache) {
            cache.remove(key);
        }
    }

    @Override
    public List<SagaTimeout> getScheduledTimeouts(Instant maximumTimeout) {
        return store.getScheduledTimeouts(maximumTimeout);
    }

    @Override
    public void purge() {
        synchronized (cache) {
            cache.clear();
        }
        store.purge();
    }

    int size() {
        synchronized (cache) {
            return cache.size();
        }
    }
}
