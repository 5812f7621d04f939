package io.github.goodees.cqrs.mapping;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable map from message type to the handler of a target type. Lookup is by exact message type, a handler for
 * a supertype does not handle its subtypes.
 * @param <C> type of context passed to handlers
 */
public final class HandlerTable<C> {
    private final Class<?> targetType;
    private final Map<Class<?>, HandlerFunction<C>> handlers;

    public HandlerTable(Class<?> targetType, Map<Class<?>, HandlerFunction<C>> handlers) {
        this.targetType = Objects.requireNonNull(targetType, "Target type must be specified");
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public Class<?> getTargetType() {
        return targetType;
    }

    public Optional<HandlerFunction<C>> lookup(Class<?> messageType) {
        return Optional.ofNullable(handlers.get(messageType));
    }

    public boolean canHandle(Class<?> messageType) {
        return handlers.containsKey(messageType);
    }

    public Set<Class<?>> handledTypes() {
        return handlers.keySet();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    @Override
    public String toString() {
        return "HandlerTable[" + targetType.getName() + ": " + handlers.keySet() + "]";
    }
}
