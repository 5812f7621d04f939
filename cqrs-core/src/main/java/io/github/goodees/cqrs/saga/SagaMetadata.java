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

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Events a saga type handles, which of them start it, and how each maps to the saga's correlation id.
 */
public final class SagaMetadata {
    private final Class<? extends Saga> sagaType;
    private final Map<Class<?>, Function<Object, String>> correlations;
    private final Set<Class<?>> startingEvents;

    SagaMetadata(Class<? extends Saga> sagaType, Map<Class<?>, Function<Object, String>> correlations,
            Set<Class<?>> startingEvents) {
        this.sagaType = sagaType;
        this.correlations = Collections.unmodifiableMap(new LinkedHashMap<>(correlations));
        this.startingEvents = Collections.unmodifiableSet(new HashSet<>(startingEvents));
    }

    /**
     * Metadata of a saga type.
     * @param sagaType the saga type
     * @return its metadata
     */
    public static SagaMetadata of(Class<? extends Saga> sagaType) {
        return SagaTypeRegistry.instantiate(sagaType).getMetadata();
    }

    public Class<? extends Saga> getSagaType() {
        return sagaType;
    }

    public boolean canStartWith(Class<?> eventType) {
        return startingEvents.contains(eventType);
    }

    public boolean canHandle(Class<?> eventType) {
        return correlations.containsKey(eventType);
    }

    public Set<Class<?>> handledEvents() {
        return correlations.keySet();
    }

    public String getCorrelationId(Event event) {
        Function<Object, String> correlation = correlations.get(event.getClass());
        if (correlation == null) {
            throw MappingException.missingCorrelation(sagaType, event.getClass());
        }
        String id = correlation.apply(event);
        if (id == null) {
            throw new IllegalArgumentException("Correlation id of " + event + " for " + sagaType.getSimpleName()
                    + " is null");
        }
        return id;
    }
}
