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

import io.github.goodees.cqrs.mapping.HandlerFunction;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Delivers one event type to one handler type.
 */
public class EventHandler {
    private final Class<?> handlerType;
    private final Class<?> eventType;
    private final Supplier<?> handlerFactory;
    private final HandlerFunction<EventContext> executor;

    /**
     * Create handler invoking a method on instances obtained from factory.
     * @param handlerType type declaring the handler method
     * @param eventType handled event type
     * @param handlerFactory supplies the instance to invoke, per event
     * @param executor invocation of the handler method
     */
    public EventHandler(Class<?> handlerType, Class<?> eventType, Supplier<?> handlerFactory,
            HandlerFunction<EventContext> executor) {
        this.handlerType = Objects.requireNonNull(handlerType, "Handler type must be specified");
        this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
        this.handlerFactory = Objects.requireNonNull(handlerFactory, "Handler factory must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
    }

    /**
     * Constructor for subclasses that override {@link #handle(EventContext)}.
     * @param handlerType type handling the event
     * @param eventType handled event type
     */
    protected EventHandler(Class<?> handlerType, Class<?> eventType) {
        this.handlerType = Objects.requireNonNull(handlerType, "Handler type must be specified");
        this.eventType = Objects.requireNonNull(eventType, "Event type must be specified");
        this.handlerFactory = null;
        this.executor = null;
    }

    public Class<?> getHandlerType() {
        return handlerType;
    }

    public Class<?> getEventType() {
        return eventType;
    }

    public void handle(EventContext context) throws Exception {
        executor.invoke(handlerFactory.get(), context.getEvent(), context);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + eventType.getSimpleName() + " -> " + handlerType.getSimpleName()
                + "]";
    }
}
