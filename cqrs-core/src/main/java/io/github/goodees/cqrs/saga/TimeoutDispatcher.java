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

import io.github.goodees.cqrs.Header;
import io.github.goodees.cqrs.eventing.EventEnvelope;
import io.github.goodees.cqrs.eventing.EventPublisher;
import io.github.goodees.cqrs.eventing.EventVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically publishes {@link Timeout} events for sagas whose timeout elapsed. A timeout is published once per
 * scheduled time while it stays pending in the store, a saga rescheduling its timeout gets the new one published
 * again.
 */
public class TimeoutDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TimeoutDispatcher.class);

    private final SagaStore store;
    private final EventPublisher publisher;
    private final Duration pollInterval;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Map<SagaReference, Instant> dispatched = new HashMap<>();
    private ScheduledFuture<?> pollTask;

    public TimeoutDispatcher(SagaStore store, EventPublisher publisher, Duration pollInterval) {
        this(store, publisher, pollInterval, Clock.systemUTC(), Executors.newSingleThreadScheduledExecutor(), true);
    }

    public TimeoutDispatcher(SagaStore store, EventPublisher publisher, Duration pollInterval, Clock clock,
            ScheduledExecutorService scheduler) {
        this(store, publisher, pollInterval, clock, scheduler, false);
    }

    private TimeoutDispatcher(SagaStore store, EventPublisher publisher, Duration pollInterval, Clock clock,
            ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.store = Objects.requireNonNull(store, "Saga store must be specified");
        this.publisher = Objects.requireNonNull(publisher, "Event publisher must be specified");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive, was " + pollInterval);
        }
        this.pollInterval = pollInterval;
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler must be specified");
        this.ownsScheduler = ownsScheduler;
    }

    public synchronized void start() {
        if (pollTask != null) {
            throw new IllegalStateException("Timeout dispatcher is already started");
        }
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Polling saga timeouts every {}", pollInterval);
    }

    private void poll() {
        try {
            dispatchElapsedTimeouts();
        } catch (RuntimeException e) {
            logger.error("Dispatching saga timeouts failed", e);
        }
    }

    /**
     * Publish timeouts that elapsed and were not published yet.
     * @return number of published timeouts
     */
    public synchronized int dispatchElapsedTimeouts() {
        Instant now = clock.instant();
        List<SagaTimeout> timeouts = store.getScheduledTimeouts(now);
        Set<SagaReference> pending = new HashSet<>();
        int count = 0;
        for (SagaTimeout timeout : timeouts) {
            SagaReference reference = timeout.getReference();
            pending.add(reference);
            if (timeout.getTimeout().equals(dispatched.get(reference))) {
                continue;
            }
            Timeout event = new Timeout(timeout.getSagaType(), timeout.getSagaId(), timeout.getTimeout());
            publisher.publish(Header.with(null, Header.ORIGIN, "timeout"),
                new EventEnvelope(timeout.getSagaId(), EventVersion.EMPTY, event));
            dispatched.put(reference, timeout.getTimeout());
            count++;
        }
        dispatched.keySet().retainAll(pending);
        if (count > 0) {
            logger.debug("Dispatched {} saga timeouts", count);
        }
        return count;
    }

    @Override
    public synchronized void close() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (ownsScheduler) {
            scheduler.shutdown();
        }
    }
}
