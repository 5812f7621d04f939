package io.github.goodees.cqrs.domain;

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

import io.github.goodees.cqrs.commanding.CommandContext;
import io.github.goodees.cqrs.config.AggregateStoreSettings;
import io.github.goodees.cqrs.dispatch.RetryTimeoutException;
import io.github.goodees.cqrs.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate store decorator keeping copies of recently used aggregates. Callers always receive their own copy, so
 * changes to a loaded aggregate never reach the cache. An entry is evicted before every save and refreshed only
 * when the save succeeds.
 */
public class CachedAggregateStore implements AggregateStore {
    private static final Logger logger = LoggerFactory.getLogger(CachedAggregateStore.class);

    private final AggregateStore store;
    private final Map<String, Aggregate> cache;

    public CachedAggregateStore(AggregateStore store) {
        this(store, AggregateStoreSettings.defaults().getCacheCapacity());
    }

    public CachedAggregateStore(AggregateStore store, int capacity) {
        this.store = Objects.requireNonNull(store, "Aggregate store must be specified");
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, was " + capacity);
        }
        this.cache = new LinkedHashMap<String, Aggregate>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Aggregate> eldest) {
                return size() > capacity;
            }
        };
    }

    private static String key(Class<?> type, String id) {
        return type.getName() + "-" + id;
    }

    @Override
    public <T extends Aggregate> T get(Class<T> type, String id) {
        String key = key(type, id);
        Aggregate cached;
        synchronized (cache) {
            cached = cache.get(key);
        }
        if (cached != null) {
            logger.trace("Cache hit for {}", cached);
            return type.cast(cached.copy());
        }
        T aggregate = store.get(type, id);
        Aggregate copy = aggregate.copy();
        synchronized (cache) {
            cache.put(key, copy);
        }
        return aggregate;
    }

    @Override
    public SaveResult save(Aggregate aggregate, CommandContext context)
            throws EventStoreException, RetryTimeoutException {
        String key = key(aggregate.getClass(), aggregate.getId());
        evict(key);
        SaveResult result;
        try {
            result = store.save(aggregate, context);
        } catch (EventStoreException e) {
            if (e.isOptimisticLock()) {
                logger.debug("Evicting stale {}", aggregate);
            }
            evict(key);
            throw e;
        }
        if (!result.isDuplicate()) {
            Aggregate copy = result.getAggregate().copy();
            synchronized (cache) {
                cache.put(key, copy);
            }
        }
        return result;
    }

    private void evict(String key) {
        synchronized (cache) {
            cache.remove(key);
        }
    }

    int size() {
        synchronized (cache) {
            return cache.size();
        }
    }
}
