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

import io.github.goodees.cqrs.commanding.CommandContext;
import io.github.goodees.cqrs.commanding.CommandEnvelope;
import io.github.goodees.cqrs.domain.AggregateUpdater;
import io.github.goodees.cqrs.domain.DefaultAggregateStore;
import io.github.goodees.cqrs.domain.HookableAggregateStore;
import io.github.goodees.cqrs.example.Account;
import io.github.goodees.cqrs.example.AccountCommands;
import io.github.goodees.cqrs.example.AccountEvents;
import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.inmemory.InMemoryEventStore;
import io.github.goodees.cqrs.store.inmemory.InMemorySnapshotStore;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EventDispatcherTest {
    private final List<EventEnvelope> published = new ArrayList<>();
    private final List<Map<String, String>> publishedHeaders = new ArrayList<>();
    private InMemoryEventStore eventStore;
    private EventDispatcher dispatcher;
    private HookableAggregateStore store;

    @Before
    public void setUp() {
        eventStore = new InMemoryEventStore();
        dispatcher = new EventDispatcher(eventStore, (headers, envelope) -> {
            publishedHeaders.add(headers);
            published.add(envelope);
        });
        store = new HookableAggregateStore(new DefaultAggregateStore(new AggregateUpdater(),
                new InMemorySnapshotStore(), eventStore), Collections.singletonList(dispatcher));
    }

    private CommandContext save(UUID commandId, Event... events) throws Exception {
        Account account = store.get(Account.class, "acc");
        CommandContext context = new CommandContext(commandId, Collections.singletonMap("user", "joe"),
                new CommandEnvelope("acc", new AccountCommands.Touch()));
        for (Event event : events) {
            context.raise(event);
        }
        store.save(account, context);
        return context;
    }

    @Test
    public void stored_commit_is_published_and_marked_dispatched() throws Exception {
        save(UUID.randomUUID(), new AccountEvents.Opened("joe"), new AccountEvents.Deposited(5));
        assertEquals(2, published.size());
        assertEquals(new EventVersion(1, 2, 0), published.get(0).getVersion());
        assertEquals(new EventVersion(1, 2, 1), published.get(1).getVersion());
        assertTrue(published.get(1).getEvent() instanceof AccountEvents.Deposited);
        assertEquals("acc", published.get(0).getAggregateId());
        assertEquals("joe", publishedHeaders.get(0).get("user"));
        assertFalse(eventStore.getUndispatched().iterator().hasNext());
    }

    @Test
    public void duplicate_commit_is_not_published_again() throws Exception {
        UUID commandId = UUID.randomUUID();
        save(commandId, new AccountEvents.Deposited(5));
        save(commandId, new AccountEvents.Deposited(5));
        assertEquals(1, published.size());
    }

    @Test
    public void undispatched_commits_are_published_on_startup() throws Exception {
        eventStore.save(new Commit(UUID.randomUUID(), "other", 1, null,
                Arrays.<Event>asList(new AccountEvents.Opened("ann"))));
        assertEquals(1, dispatcher.ensurePersistedCommitsDispatched());
        assertEquals("other", published.get(0).getAggregateId());
        assertEquals(0, dispatcher.ensurePersistedCommitsDispatched());
    }
}
