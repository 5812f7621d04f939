package io.github.goodees.cqrs.eventing;

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

import io.github.goodees.cqrs.mapping.ConventionMapping;
import io.github.goodees.cqrs.mapping.HandlerTable;
import io.github.goodees.cqrs.mapping.HandlerTableBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Event handlers by event type. An event may have any number of handlers, which are invoked in order of
 * registration.
 */
public class EventHandlerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EventHandlerRegistry.class);

    private final HandlerTableBuilder<EventContext> mapping;
    private final Map<Class<?>, List<EventHandler>> handlers = new ConcurrentHashMap<>();

    /**
     * Create registry discovering methods named {@code handle}.
     */
    public EventHandlerRegistry() {
        this(new ConventionMapping<>("handle", Event.class, EventContext.class));
    }

    public EventHandlerRegistry(HandlerTableBuilder<EventContext> mapping) {
        this.mapping = Objects.requireNonNull(mapping, "Mapping must be specified");
    }

    /**
     * Register all handler methods of a type.
     * @param handlerType type declaring handler methods
     * @param factory supplies instances to invoke, e.g. a singleton
     * @param <T> handler type
     * @return this registry
     */
    public <T> EventHandlerRegistry register(Class<T> handlerType, Supplier<? extends T> factory) {
        HandlerTable<EventContext> table = mapping.build(handlerType);
        if (table.isEmpty()) {
            logger.warn("{} declares no event handlers", handlerType.getName());
        }
        for (Class<?> eventType : table.handledTypes()) {
            register(new EventHandler(handlerType, eventType, factory, table.lookup(eventType).get()));
        }
        return this;
    }

    public EventHandlerRegistry register(EventHandler handler) {
        handlers.computeIfAbsent(handler.getEventType(), t -> new CopyOnWriteArrayList<>()).add(handler);
        logger.debug("Registered {}", handler);
        return this;
    }

    public List<EventHandler> getHandlersFor(Event event) {
        List<EventHandler> result = handlers.get(event.getClass());
        return result == null ? Collections.<EventHandler>emptyList() : Collections.unmodifiableList(result);
    }
}
