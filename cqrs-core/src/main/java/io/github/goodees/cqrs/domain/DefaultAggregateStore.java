package io.github.goodees.cqrs.domain;

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
import io.github.goodees.cqrs.commanding.CommandContext;
import io.github.goodees.cqrs.config.AggregateStoreSettings;
import io.github.goodees.cqrs.dispatch.ExponentialBackoff;
import io.github.goodees.cqrs.dispatch.RetryTimeoutException;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.EventStore;
import io.github.goodees.cqrs.store.EventStoreException;
import io.github.goodees.cqrs.store.Snapshot;
import io.github.goodees.cqrs.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate store over a commit log and snapshot store. Aggregates are recovered from their latest snapshot and
 * the commits that follow it.
 * <p>Saving distinguishes three failures. A duplicate commit means the command was already handled and is treated as
 * success. An optimistic lock conflict is rethrown for the caller to reload and retry. Any other failure is retried
 * with exponential backoff and fresh commit id until the save retry timeout passes.</p>
 */
public class DefaultAggregateStore implements AggregateStore {
    private static final Logger logger = LoggerFactory.getLogger(DefaultAggregateStore.class);

    private final AggregateUpdater updater;
    private final SnapshotStore snapshotStore;
    private final EventStore eventStore;
    private final int snapshotInterval;
    private final Duration retryTimeout;

    /**
     * Create store applying events by convention, skipping or rejecting events without apply method as
     * {@link AggregateStoreSettings#isApplyOptional()} says.
     */
    public DefaultAggregateStore(SnapshotStore snapshotStore, EventStore eventStore,
            AggregateStoreSettings settings) {
        this(new AggregateUpdater(settings.isApplyOptional()), snapshotStore, eventStore, settings);
    }

    public DefaultAggregateStore(AggregateUpdater updater, SnapshotStore snapshotStore, EventStore eventStore) {
        this(updater, snapshotStore, eventStore, AggregateStoreSettings.defaults());
    }

    public DefaultAggregateStore(AggregateUpdater updater, SnapshotStore snapshotStore, EventStore eventStore,
            AggregateStoreSettings settings) {
        this.updater = Objects.requireNonNull(updater, "Aggregate updater must be specified");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.snapshotInterval = settings.getSnapshotInterval();
        this.retryTimeout = settings.getSaveRetryTimeout();
    }

    @Override
    public <T extends Aggregate> T get(Class<T> type, String id) {
        Objects.requireNonNull(id, "Aggregate id must be specified");
        T aggregate = getOrCreate(type, id);
        for (Commit commit : eventStore.getStream(id, aggregate.getVersion() + 1)) {
            applyCommit(commit, aggregate);
        }
        return aggregate;
    }

    private <T extends Aggregate> T getOrCreate(Class<T> type, String id) {
        Optional<Snapshot> snapshot = snapshotStore.getLastSnapshot(type, id);
        if (snapshot.isPresent()) {
            Object state = snapshot.get().getState();
            if (type.isInstance(state)) {
                T aggregate = type.cast(state);
                aggregate.setId(id);
                aggregate.setVersion(snapshot.get().getVersion());
                return aggregate;
            }
            logger.warn("Ignoring snapshot of {} {} holding {}", type.getSimpleName(), id, state.getClass());
        }
        return AggregateActivator.createInstance(type, id);
    }

    @Override
    public SaveResult save(Aggregate aggregate, CommandContext context)
            throws EventStoreException, RetryTimeoutException {
        Objects.requireNonNull(aggregate, "Aggregate must be specified");
        Objects.requireNonNull(context, "Context must be specified");
        Commit commit = createCommit(aggregate, context, context.getCommandId());
        ExponentialBackoff backoff = null;
        Commit stored = null;
        while (stored == null) {
            try {
                stored = eventStore.save(commit);
            } catch (EventStoreException e) {
                switch (e.getFault()) {
                    case DUPLICATE_COMMIT:
                        logger.warn("Duplicate commit {} ignored", commit);
                        return new SaveResult(aggregate, commit);
                    case OPTIMISTIC_LOCK:
                        throw e;
                    default:
                        backoff = waitForRetry(backoff, commit, e);
                        commit = createCommit(aggregate, context, UUID.randomUUID());
                }
            } catch (RuntimeException e) {
                backoff = waitForRetry(backoff, commit, e);
                commit = createCommit(aggregate, context, UUID.randomUUID());
            }
        }
        applyCommit(stored, aggregate);
        if (aggregate.getVersion() % snapshotInterval == 0) {
            saveSnapshot(aggregate);
        }
        return new SaveResult(aggregate, stored);
    }

    private ExponentialBackoff waitForRetry(ExponentialBackoff backoff, Commit commit, Exception error)
            throws RetryTimeoutException {
        if (backoff == null) {
            backoff = new ExponentialBackoff(retryTimeout);
        }
        logger.warn("Saving {} failed, will retry: {}", commit, error.getMessage());
        backoff.waitOrTimeout(error, "Saving version " + commit.getVersion() + " of stream "
                + commit.getStreamId() + " did not succeed within " + retryTimeout);
        return backoff;
    }

    private Commit createCommit(Aggregate aggregate, CommandContext context, UUID commitId) {
        Map<String, String> headers = context.getHeaders();
        if (aggregate.getVersion() == 0) {
            headers = Header.with(headers, Header.AGGREGATE, aggregate.getClass().getName());
        }
        return new Commit(commitId, aggregate.getId(), aggregate.getVersion() + 1, headers,
                context.getRaisedEvents());
    }

    private void applyCommit(Commit commit, Aggregate aggregate) {
        int expected = aggregate.getVersion() + 1;
        if (commit.getVersion() != expected) {
            throw new IllegalStateException("Stream " + commit.getStreamId() + " expected version " + expected
                    + " but read " + commit.getVersion());
        }
        for (Event event : commit.getEvents()) {
            updater.apply(event, aggregate);
        }
        aggregate.setVersion(commit.getVersion());
    }

    private void saveSnapshot(Aggregate aggregate) {
        try {
            snapshotStore.save(new Snapshot(aggregate.getId(), aggregate.getVersion(), aggregate));
        } catch (RuntimeException e) {
            logger.error("Storing snapshot of {} failed", aggregate, e);
        }
    }
}
