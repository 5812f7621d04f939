package io.github.goodees.cqrs.commanding;

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

import io.github.goodees.cqrs.Message;
import io.github.goodees.cqrs.config.ProcessorSettings;
import io.github.goodees.cqrs.dispatch.Dispatcher;
import io.github.goodees.cqrs.dispatch.ExponentialBackoff;
import io.github.goodees.cqrs.dispatch.SimpleDispatcherConfiguration;
import io.github.goodees.cqrs.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Processes command messages. Commands for the same aggregate are processed one at a time in order of arrival,
 * commands for different aggregates in parallel.
 * <p>When saving fails on optimistic lock conflict the whole handling is repeated with freshly loaded aggregate,
 * until retry timeout passes. Any other failure is not retried.</p>
 */
public class CommandProcessor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    private final CommandHandlerRegistry registry;
    private final Duration retryTimeout;
    private final Dispatcher dispatcher;
    private final ExecutorService ownedExecutor;

    public CommandProcessor(CommandHandlerRegistry registry, ProcessorSettings settings) {
        this(registry, settings, Executors.newFixedThreadPool(settings.getMaximumConcurrencyLevel()), true);
    }

    public CommandProcessor(CommandHandlerRegistry registry, ProcessorSettings settings, ExecutorService executor) {
        this(registry, settings, executor, false);
    }

    private CommandProcessor(CommandHandlerRegistry registry, ProcessorSettings settings, ExecutorService executor,
            boolean ownsExecutor) {
        this.registry = Objects.requireNonNull(registry, "Registry must be specified");
        this.retryTimeout = settings.getRetryTimeout();
        this.dispatcher = new Dispatcher(new SimpleDispatcherConfiguration("commands", executor, settings));
        this.ownedExecutor = ownsExecutor ? executor : null;
    }

    /**
     * Queue command for processing, blocking while the processor is at its capacity.
     * @param message the command message
     * @return promise completing when the command is processed
     */
    public CompletableFuture<Void> processAsync(Message<CommandEnvelope> message) {
        return dispatcher.execute(message.getPayload().getAggregateId(), () -> {
            process(message);
            return null;
        });
    }

    /**
     * Process command on the calling thread.
     * @param message the command message
     * @throws Exception when handling fails, {@link io.github.goodees.cqrs.dispatch.RetryTimeoutException} when
     *                   conflicts persist for the whole retry timeout
     */
    public void process(Message<CommandEnvelope> message) throws Exception {
        CommandEnvelope envelope = message.getPayload();
        CommandHandler handler = registry.getHandlerFor(envelope.getCommand());
        ExponentialBackoff backoff = null;
        while (true) {
            CommandContext context = new CommandContext(message.getId(), message.getHeaders(), envelope);
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
                logger.warn("Concurrency conflict handling {}: {}", envelope, e.getMessage());
                backoff.waitOrTimeout(e, "Concurrency conflict of " + envelope + " (message " + message.getId()
                        + ") not resolved within " + retryTimeout);
            }
        }
    }

    @Override
    public void close() throws InterruptedException {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            if (!ownedExecutor.awaitTermination(retryTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Command processor did not terminate within {}", retryTimeout);
            }
        }
    }
}
