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

import io.github.goodees.cqrs.ObjectCopier;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Long running process reacting to events of multiple aggregates. Every saga instance is identified by a
 * correlation id extracted from the events it handles, see {@link #configure(SagaConfiguration)}.
 * <p>Handler methods are named {@code handle} and accept an event followed optionally by {@link SagaContext}.
 * Sagas need a no-argument constructor and are stored as JSON through their fields.</p>
 */
public abstract class Saga {
    private static final ConcurrentMap<Class<?>, SagaMetadata> metadata = new ConcurrentHashMap<>();

    private String correlationId;
    private int version;
    private Instant timeout;
    private boolean completed;

    protected Saga() {
    }

    /**
     * Declare events the saga handles and how their correlation id is obtained.
     * @param saga configuration to fill
     */
    protected abstract void configure(SagaConfiguration saga);

    public final SagaMetadata getMetadata() {
        return metadata.computeIfAbsent(getClass(), t -> {
            SagaConfiguration configuration = new SagaConfiguration(getClass());
            configure(configuration);
            return configuration.build();
        });
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Number of times the saga was stored, 0 for saga that was never stored.
     */
    public int getVersion() {
        return version;
    }

    public Instant getTimeout() {
        return timeout;
    }

    public boolean isCompleted() {
        return completed;
    }

    protected void markCompleted() {
        this.completed = true;
    }

    /**
     * Restore identity and storage state. Used by saga stores.
     * @param correlationId id of the saga
     * @param version stored version
     * @param timeout stored timeout
     */
    public final void restore(String correlationId, int version, Instant timeout) {
        this.correlationId = Objects.requireNonNull(correlationId, "Correlation id must be specified");
        this.version = version;
        this.timeout = timeout;
    }

    /**
     * Record successful store of the saga. Used by saga stores.
     */
    public final void incrementVersion() {
        this.version++;
    }

    protected void scheduleTimeout(Duration delay) {
        scheduleTimeout(Instant.now().plus(delay));
    }

    /**
     * Schedule a {@link Timeout} to be delivered to this saga. The time is truncated to milliseconds, the
     * precision stores keep.
     * @param at time of the timeout
     * @throws IllegalStateException when the saga does not handle timeouts or has one scheduled already
     */
    protected void scheduleTimeout(Instant at) {
        Objects.requireNonNull(at, "Timeout must be specified");
        if (!getMetadata().canHandle(Timeout.class)) {
            throw new IllegalStateException(getClass().getSimpleName() + " does not handle timeouts");
        }
        if (timeout != null) {
            throw new IllegalStateException(this + " has timeout scheduled already at " + timeout);
        }
        this.timeout = at.truncatedTo(ChronoUnit.MILLIS);
    }

    protected void clearTimeout() {
        if (timeout == null) {
            throw new IllegalStateException(this + " has no timeout scheduled");
        }
        this.timeout = null;
    }

    protected void rescheduleTimeout(Instant at) {
        clearTimeout();
        scheduleTimeout(at);
    }

    protected void rescheduleTimeout(Duration delay) {
        rescheduleTimeout(Instant.now().plus(delay));
    }

    /**
     * Clear the timeout the saga is being woken up for. Used by saga event handler.
     */
    final void timeoutElapsed() {
        this.timeout = null;
    }

    protected Saga copy() {
        return ObjectCopier.copy(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + correlationId + " v" + version + "]";
    }
}
