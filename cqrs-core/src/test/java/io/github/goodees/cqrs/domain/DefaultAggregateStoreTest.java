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
import io.github.goodees.cqrs.commanding.Command;
import io.github.goodees.cqrs.commanding.CommandContext;
import io.github.goodees.cqrs.commanding.CommandEnvelope;
import io.github.goodees.cqrs.config.AggregateStoreSettings;
import io.github.goodees.cqrs.dispatch.RetryTimeoutException;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.example.Account;
import io.github.goodees.cqrs.example.AccountCommands;
import io.github.goodees.cqrs.example.AccountEvents;
import io.github.goodees.cqrs.mapping.MappingException;
import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.EventStoreException;
import io.github.goodees.cqrs.store.inmemory.InMemoryEventStore;
import io.github.goodees.cqrs.store.inmemory.InMemorySnapshotStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DefaultAggregateStoreTest {
    private FlakyEventStore eventStore;
    private InMemorySnapshotStore snapshotStore;
    private DefaultAggregateStore store;

    static class FlakyEventStore extends InMemoryEventStore {
        int failures;
        final List<UUID> attemptedCommitIds = new ArrayList<>();

        @Override
        public synchronized Commit save(Commit commit) throws EventStoreException {
            attemptedCommitIds.add(commit.getCommitId());
            if (failures > 0) {
                failures--;
                throw EventStoreException.storeFailed(commit.getStreamId(), new IllegalStateException("flaky"));
            }
            return super.save(commit);
        }
    }

    @Before
    public void setUp() {
        eventStore = new FlakyEventStore();
        snapshotStore = new InMemorySnapshotStore();
        store = new DefaultAggregateStore(new AggregateUpdater(), snapshotStore, eventStore,
                AggregateStoreSettings.defaults().withSnapshotInterval(3)
                        .withSaveRetryTimeout(Duration.ofMillis(200)));
    }

    static CommandContext context(String id, Command command, Event... events) {
        CommandContext context = new CommandContext(UUID.randomUUID(), null, new CommandEnvelope(id, command));
        for (Event event : events) {
            context.raise(event);
        }
        return context;
    }

    private Account execute(String id, Event... events) throws Exception {
        Account account = store.get(Account.class, id);
        store.save(account, context(id, new AccountCommands.Touch(), events));
        return account;
    }

    @Test
    public void unknown_aggregate_is_new() {
        Account account = store.get(Account.class, "acc");
        assertEquals("acc", account.getId());
        assertEquals(0, account.getVersion());
    }

    @Test
    public void saved_events_are_applied() throws Exception {
        Account account = execute("acc", new AccountEvents.Opened("joe"), new AccountEvents.Deposited(10));
        assertEquals(1, account.getVersion());
        assertEquals(10, account.getBalance());
        assertEquals("joe", account.getOwner());
    }

    @Test
    public void aggregate_is_replayed_from_stream() throws Exception {
        execute("acc", new AccountEvents.Opened("joe"));
        execute("acc", new AccountEvents.Deposited(10));
        execute("acc", new AccountEvents.Withdrawn(3));
        execute("acc", new AccountEvents.Deposited(5));
        Account account = store.get(Account.class, "acc");
        assertEquals(4, account.getVersion());
        assertEquals(12, account.getBalance());
    }

    @Test
    public void events_without_apply_method_are_skipped_by_default() throws Exception {
        execute("acc", new AccountEvents.Deposited(10), new AccountEvents.TransferReceived("t1"));
        assertEquals(10, store.get(Account.class, "acc").getBalance());
    }

    @Test
    public void strict_store_rejects_events_without_apply_method() throws Exception {
        execute("acc", new AccountEvents.Deposited(10), new AccountEvents.TransferReceived("t1"));
        DefaultAggregateStore strict = new DefaultAggregateStore(snapshotStore, eventStore,
                AggregateStoreSettings.defaults().withApplyOptional(false));
        try {
            strict.get(Account.class, "acc");
            fail("Event without apply method should be rejected");
        } catch (MappingException e) {
            assertTrue(e.getMessage().contains(AccountEvents.TransferReceived.class.getName()));
        }
    }

    @Test
    public void strict_store_applies_known_events() throws Exception {
        execute("acc", new AccountEvents.Opened("joe"), new AccountEvents.Deposited(10));
        DefaultAggregateStore strict = new DefaultAggregateStore(snapshotStore, eventStore,
                AggregateStoreSettings.defaults().withApplyOptional(false));
        assertEquals(10, strict.get(Account.class, "acc").getBalance());
    }

    @Test
    public void first_commit_carries_aggregate_type() throws Exception {
        execute("acc", new AccountEvents.Opened("joe"));
        execute("acc", new AccountEvents.Deposited(10));
        List<Commit> commits = new ArrayList<>();
        eventStore.getStream("acc").forEach(commits::add);
        assertEquals(Account.class.getName(), commits.get(0).getHeaders().get(Header.AGGREGATE));
        assertNull(commits.get(1).getHeaders().get(Header.AGGREGATE));
    }

    @Test
    public void snapshot_is_taken_at_interval() throws Exception {
        execute("acc", new AccountEvents.Opened("joe"));
        execute("acc", new AccountEvents.Deposited(10));
        assertFalse(snapshotStore.getLastSnapshot(Account.class, "acc").isPresent());
        execute("acc", new AccountEvents.Deposited(10));
        assertEquals(3, snapshotStore.getLastSnapshot(Account.class, "acc").get().getVersion());
    }

    @Test
    public void aggregate_is_recovered_from_snapshot_and_later_commits() throws Exception {
        for (int i = 0; i < 4; i++) {
            execute("acc", new AccountEvents.Deposited(10));
        }
        Account account = store.get(Account.class, "acc");
        assertEquals(4, account.getVersion());
        assertEquals(40, account.getBalance());
        assertEquals(4, account.getDeposits());
    }

    @Test
    public void duplicate_commit_is_ignored() throws Exception {
        Account account = store.get(Account.class, "acc");
        CommandContext context = context("acc", new AccountCommands.Touch(), new AccountEvents.Deposited(10));
        store.save(account, context);
        Account stale = store.get(Account.class, "acc");
        CommandContext redelivered = new CommandContext(context.getCommandId(), null,
                new CommandEnvelope("acc", new AccountCommands.Touch()));
        redelivered.raise(new AccountEvents.Deposited(10));
        SaveResult result = store.save(stale, redelivered);
        assertTrue(result.isDuplicate());
        assertEquals(1, stale.getVersion());
        assertEquals(10, store.get(Account.class, "acc").getBalance());
    }

    @Test
    public void optimistic_lock_is_rethrown() throws Exception {
        Account first = store.get(Account.class, "acc");
        Account second = store.get(Account.class, "acc");
        store.save(first, context("acc", new AccountCommands.Touch(), new AccountEvents.Deposited(1)));
        try {
            store.save(second, context("acc", new AccountCommands.Touch(), new AccountEvents.Deposited(1)));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertTrue(e.isOptimisticLock());
        }
    }

    @Test
    public void transient_failure_is_retried_with_fresh_commit_id() throws Exception {
        eventStore.failures = 2;
        Account account = execute("acc", new AccountEvents.Deposited(10));
        assertEquals(1, account.getVersion());
        assertEquals(3, eventStore.attemptedCommitIds.size());
        assertEquals(3, eventStore.attemptedCommitIds.stream().distinct().count());
    }

    @Test(expected = RetryTimeoutException.class)
    public void persistent_failure_times_out() throws Exception {
        eventStore.failures = Integer.MAX_VALUE;
        execute("acc", new AccountEvents.Deposited(10));
    }
}
