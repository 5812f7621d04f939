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

import io.github.goodees.cqrs.commanding.CommandPublisher;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.eventing.EventContext;
import io.github.goodees.cqrs.eventing.EventHandler;
import io.github.goodees.cqrs.eventing.EventHandlerRegistry;
import io.github.goodees.cqrs.mapping.ConventionMapping;
import io.github.goodees.cqrs.mapping.HandlerFunction;
import io.github.goodees.cqrs.mapping.HandlerTable;
import io.github.goodees.cqrs.mapping.HandlerTableBuilder;
import io.github.goodees.cqrs.mapping.MappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Delivers one event type to the saga it correlates to. The saga is locked for the whole load, handle and save
 * cycle. Commands it publishes are sent only after it is saved.
 */
public class SagaEventHandler extends EventHandler {
    private static final Logger logger = LoggerFactory.getLogger(SagaEventHandler.class);

    private final Class<? extends Saga> sagaType;
    private final SagaMetadata metadata;
    private final SagaStore store;
    private final SagaLockTable locks;
    private final CommandPublisher commandPublisher;
    private final HandlerFunction<SagaContext> executor;

    public SagaEventHandler(Class<? extends Saga> sagaType, Class<?> eventType, SagaStore store, SagaLockTable locks,
            CommandPublisher commandPublisher, HandlerFunction<SagaContext> executor) {
        super(sagaType, eventType);
        this.sagaType = sagaType;
        this.metadata = SagaMetadata.of(sagaType);
        this.store = Objects.requireNonNull(store, "Saga store must be specified");
        this.locks = Objects.requireNonNull(locks, "Lock table must be specified");
        this.commandPublisher = Objects.requireNonNull(commandPublisher, "Command publisher must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
        if (!metadata.canHandle(eventType)) {
            throw MappingException.missingCorrelation(sagaType, eventType);
        }
    }

    /**
     * Create handlers for all events of a saga, discovering methods named {@code handle}.
     */
    public static List<SagaEventHandler> forSaga(Class<? extends Saga> sagaType, SagaStore store,
            SagaLockTable locks, CommandPublisher commandPublisher) {
        return forSaga(sagaType, store, locks, commandPublisher,
            new ConventionMapping<>("handle", Event.class, SagaContext.class));
    }

    /**
     * Create handlers for all events of a saga.
     * @throws MappingException when handler methods and saga configuration do not match
     */
    public static List<SagaEventHandler> forSaga(Class<? extends Saga> sagaType, SagaStore store,
            SagaLockTable locks, CommandPublisher commandPublisher, HandlerTableBuilder<SagaContext> mapping) {
        SagaMetadata metadata = SagaMetadata.of(sagaType);
        HandlerTable<SagaContext> table = mapping.build(sagaType);
        for (Class<?> eventType : metadata.handledEvents()) {
            if (!table.canHandle(eventType)) {
                throw MappingException.missingSagaHandler(sagaType, eventType);
            }
        }
        List<SagaEventHandler> result = new ArrayList<>();
        for (Class<?> eventType : table.handledTypes()) {
            result.add(new SagaEventHandler(sagaType, eventType, store, locks, commandPublisher,
                    table.lookup(eventType).get()));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Register handlers of a saga into event handler registry.
     */
    public static EventHandlerRegistry register(EventHandlerRegistry registry, Class<? extends Saga> sagaType,
            SagaStore store, SagaLockTable locks, CommandPublisher commandPublisher) {
        for (SagaEventHandler handler : forSaga(sagaType, store, locks, commandPublisher)) {
            registry.register(handler);
        }
        return registry;
    }

    public Class<? extends Saga> getSagaType() {
        return sagaType;
    }

    @Override
    public void handle(EventContext context) throws Exception {
        Event event = context.getEvent();
        if (event instanceof Timeout && !((Timeout) event).isFor(sagaType)) {
            return;
        }
        String sagaId = metadata.getCorrelationId(event);
        SagaContext sagaContext = new SagaContext(sagaType, sagaId, event, context.getHeaders());
        try (SagaLockTable.SagaLock lock = locks.acquire(sagaType, sagaId)) {
            Optional<Saga> existing = store.tryGetSaga(sagaType, sagaId);
            Saga saga;
            if (existing.isPresent()) {
                saga = existing.get();
            } else if (metadata.canStartWith(event.getClass())) {
                saga = store.createSaga(sagaType, sagaId);
                logger.debug("Starting {} with {}", saga, event);
            } else {
                logger.debug("No {} with id {} to handle {}", sagaType.getSimpleName(), sagaId, event);
                return;
            }
            if (event instanceof Timeout) {
                Timeout timeout = (Timeout) event;
                if (!timeout.getScheduled().equals(saga.getTimeout())) {
                    logger.debug("Ignoring stale {}, {} has timeout {}", timeout, saga, saga.getTimeout());
                    return;
                }
                saga.timeoutElapsed();
            }
            executor.invoke(saga, event, sagaContext);
            store.save(saga, sagaContext);
        }
        for (SagaCommand command : sagaContext.getPublishedCommands()) {
            commandPublisher.publish(command.getAggregateId(), command.getCommand(), command.getHeaders());
        }
    }
}
