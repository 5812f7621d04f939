package io.github.goodees.cqrs.store.inmemory;

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

import io.github.goodees.cqrs.ObjectCopier;
import io.github.goodees.cqrs.saga.Saga;
import io.github.goodees.cqrs.saga.SagaContext;
import io.github.goodees.cqrs.saga.SagaReference;
import io.github.goodees.cqrs.saga.SagaStore;
import io.github.goodees.cqrs.saga.SagaTimeout;
import io.github.goodees.cqrs.saga.SagaTypeRegistry;
import io.github.goodees.cqrs.store.EventStoreException;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Keeps copies of sagas in memory. Versions are checked on save the same way a database store does.
 */
public class InMemorySagaStore implements SagaStore {
    private final SagaTypeRegistry types;
    private final Map<SagaReference, Saga> sagas = new HashMap<>();

    public InMemorySagaStore(SagaTypeRegistry types) {
        this.types = Objects.requireNonNull(types, "Saga type registry must be specified");
    }

    @Override
    public Saga createSaga(Class<? extends Saga> sagaType, String sagaId) {
        return types.createInstance(sagaType, sagaId);
    }

    @Override
    public synchronized Optional<Saga> tryGetSaga(Class<? extends Saga> sagaType, String sagaId) {
        types.getTypeId(sagaType);
        Saga saga = sagas.get(new SagaReference(sagaType, sagaId));
        return saga == null ? Optional.<Saga>empty() : Optional.of(copy(saga));
    }

    @Override
    public synchronized Saga save(Saga saga, SagaContext context) throws EventStoreException {
        types.getTypeId(saga.getClass());
        if (saga.getVersion() == 0 && saga.isCompleted()) {
            return saga;
        }
        SagaReference reference = new SagaReference(saga.getClass(), saga.getCorrelationId());
        Saga stored = sagas.get(reference);
        int storedVersion = stored == null ? 0 : stored.getVersion();
        if (storedVersion != saga.getVersion()) {
            throw EventStoreException.sagaConflict(saga.getClass(), saga.getCorrelationId(), saga.getVersion());
        }
        saga.incrementVersion();
        if (saga.isCompleted()) {
            sagas.remove(reference);
        } else {
            sagas.put(reference, copy(saga));
        }
        return saga;
    }

    @Override
    public synchronized List<SagaTimeout> getScheduledTimeouts(Instant maximumTimeout) {
        return sagas.values().stream()
                .filter(s -> s.getTimeout() != null && s.getTimeout().isBefore(maximumTimeout))
                .sorted(Comparator.comparing(Saga::getTimeout))
                .map(s -> new SagaTimeout(s.getClass(), s.getCorrelationId(), s.getTimeout()))
                .collect(toList());
    }

    @Override
    public synchronized void purge() {
        sagas.clear();
    }

    private static Saga copy(Saga saga) {
        return ObjectCopier.copy(saga);
    }
}
