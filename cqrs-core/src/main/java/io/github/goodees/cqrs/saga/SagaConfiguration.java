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

import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.mapping.MappingException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Builder of {@link SagaMetadata}, passed to {@link Saga#configure(SagaConfiguration)}.
 * <pre>
 * protected void configure(SagaConfiguration saga) {
 *     saga.canStartWith(TransferRequested.class, e -&gt; e.getTransferId())
 *         .canHandle(MoneyWithdrawn.class, e -&gt; e.getTransferId())
 *         .canHandle(Timeout.class, Timeout::getSagaId);
 * }
 * </pre>
 */
public final class SagaConfiguration {
    private final Class<? extends Saga> sagaType;
    private final Map<Class<?>, Function<Object, String>> correlations = new LinkedHashMap<>();
    private final Set<Class<?>> startingEvents = new HashSet<>();

    SagaConfiguration(Class<? extends Saga> sagaType) {
        this.sagaType = sagaType;
    }

    /**
     * Declare an event that creates the saga when no saga with its correlation id exists.
     */
    public <E extends Event> SagaConfiguration canStartWith(Class<E> eventType,
            Function<? super E, String> correlationId) {
        canHandle(eventType, correlationId);
        startingEvents.add(eventType);
        return this;
    }

    /**
     * Declare an event handled by existing saga. Events for sagas that do not exist are ignored.
     */
    public <E extends Event> SagaConfiguration canHandle(Class<E> eventType,
            Function<? super E, String> correlationId) {
        Objects.requireNonNull(correlationId, "Correlation id function must be specified");
        if (correlations.containsKey(eventType)) {
            throw MappingException.duplicateCorrelation(sagaType, eventType);
        }
        correlations.put(eventType, e -> correlationId.apply(eventType.cast(e)));
        return this;
    }

    SagaMetadata build() {
        return new SagaMetadata(sagaType, correlations, startingEvents);
    }
}
