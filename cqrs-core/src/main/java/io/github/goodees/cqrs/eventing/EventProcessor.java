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

import io.github.goodees.cqrs.HandlerNotFoundException;
import io.github.goodees.cqrs.Message;
import io.github.goodees.cqrs.config.ProcessorSettings;
import io.github.goodees.cqrs.dispatch.Dispatcher;
import io.github.goodees.cqrs.dispatch.ExponentialBackoff;
import io.github.goodees.cqrs.dispatch.SimpleDispatcherConfiguration;
import io.github.goodees.cqrs.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Processes event messages. Events with the same partition key, by default the id of the aggregate that raised
 * them, are processed one at a time in order of arrival.
 * <p>Every handler is retried on its own when it fails with optimistic lock conflict, until retry timeout passes.</p>
 */
public class EventProcessor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventProcessor.class);

    private final EventHandlerRegistry registry;
    private final Duration retryTimeout;
    private final boolean requireHandlers;
    private final Function<EventEnvelope, Object> partitionKey;
    private final Dispatcher dispatcher;
    private final ExecutorService ownedExecutor;

    public EventProcessor(EventHandlerRegistry registry, ProcessorSettings settings) {
        this(registry, settings, Executors.newFixedThreadPool(settings.getMaximumConcurrencyLevel()),
                EventEnvelope::getAggregateId, true);
    }

    public EventProcessor(EventHandlerRegistry registry, ProcessorSettings settings, ExecutorService executor,
            Function<EventEnvelope, Object> partitionKey) {
        this(registry, settings, executor, partitionKey, false);
    }

    private EventProcessor(EventHandlerRegistry registry, ProcessorSettings settings, ExecutorService executor,
            Function<EventEnvelope, Object> partitionKey, boolean ownsExecutor) {
        this.registry = Objects.requireNonNull(registry, "Registry must be specified");
        this.retryTimeout = settings.getRetryTimeout();
        this.requireHandlers = settings.isRequireEventHandlers();
        this.partitionKey = Objects.requireNonNull(partitionKey, "Partition key function must be specified");
        this.dispatcher = new Dispatcher(new SimpleDispatcherConfiguration("events", executor, settings));
        this.ownedExecutor = ownsExecutor ? executor : null;
    }

    public CompletableFuture<Void> processAsync(Message<EventEnvelope> message) {
        return dispatcher.execute(partitionKey.apply(message.getPayload()), () -> {
            process(message);
            return null;
        });
    }

    public void process(Message<EventEnvelope> message) throws Exception {
        EventEnvelope envelope = message.getPayload();
        List<EventHandler> handlers = registry.getHandlersFor(envelope.getEvent());
        if (handlers.isEmpty()) {
            if (requireHandlers) {
                throw HandlerNotFoundException.forEvent(envelope.getEvent().getClass());
            }
            logger.debug("No handlers for {}", envelope);
            return;
        }
        for (EventHandler handler : handlers) {
            executeHandler(handler, message);
        }
    }

    private void executeHandler(EventHandler handler, Message<EventEnvelope> message) throws Exception {
        ExponentialBackoff backoff = null;
        while (true) {
            EventContext context = new EventContext(message.getPayload(), message.getHeaders());
            try {
                handler.handle(context);
                return;
            } catch (EventStoreException e) {
                if (!e.isOptimisticLock()) {
                    throw e;
                }
                if (backoff == null) {
                    backoff = new ExponentialBackoff(retryTimeout);
                }
                logger.warn("Concurrency conflict in {} handling {}: {}", handler, message.getPayload(),
                    e.getMessage());
                backoff.waitOrTimeout(e, "Concurrency conflict of " + handler + " handling " + message.getPayload()
                        + " (message " + message.getId() + ") not resolved within " + retryTimeout);
            }
        }
    }

    @Override
    public void close() throws InterruptedException {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            if (!ownedExecutor.awaitTermination(retryTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Event processor did not terminate within {}", retryTimeout);
            }
        }
    }
}
