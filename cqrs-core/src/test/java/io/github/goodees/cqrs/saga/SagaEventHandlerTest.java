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
import io.github.goodees.cqrs.commanding.Command;
import io.github.goodees.cqrs.commanding.CommandPublisher;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.eventing.EventContext;
import io.github.goodees.cqrs.eventing.EventEnvelope;
import io.github.goodees.cqrs.eventing.EventHandler;
import io.github.goodees.cqrs.eventing.EventHandlerRegistry;
import io.github.goodees.cqrs.eventing.EventVersion;
import io.github.goodees.cqrs.example.AccountCommands;
import io.github.goodees.cqrs.example.AccountEvents;
import io.github.goodees.cqrs.example.TransferSaga;
import io.github.goodees.cqrs.mapping.MappingException;
import io.github.goodees.cqrs.store.EventStoreException;
import io.github.goodees.cqrs.store.inmemory.InMemorySagaStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SagaEventHandlerTest {
    private final List<SagaCommand> published = new ArrayList<>();
    private final CommandPublisher publisher = new CommandPublisher() {
        @Override
        public void publish(String aggregateId, Command command, Map<String, String> headers) {
            published.add(new SagaCommand(aggregateId, headers, command));
        }
    };
    private SagaTypeRegistry types;
    private FailingSagaStore store;
    private SagaLockTable locks;
    private EventHandlerRegistry registry;

    public static class OpeningSaga extends Saga {
        @Override
        protected void configure(SagaConfiguration saga) {
            saga.canStartWith(AccountEvents.Opened.class, AccountEvents.Opened::getOwner)
                    .canHandle(Timeout.class, Timeout::getSagaId);
        }

        public void handle(AccountEvents.Opened event) {
        }

        public void handle(Timeout timeout) {
            markCompleted();
        }
    }

    public static class HandlerlessSaga extends Saga {
        @Override
        protected void configure(SagaConfiguration saga) {
            saga.canStartWith(AccountEvents.Opened.class, AccountEvents.Opened::getOwner);
        }
    }

    static class FailingSagaStore extends InMemorySagaStore {
        boolean fail;

        FailingSagaStore(SagaTypeRegistry types) {
            super(types);
        }

        @Override
        public synchronized Saga save(Saga saga, SagaContext context) throws EventStoreException {
            if (fail) {
                throw EventStoreException.sagaConflict(saga.getClass(), saga.getCorrelationId(), saga.getVersion());
            }
            return super.save(saga, context);
        }
    }

    @Before
    public void setUp() {
        types = new SagaTypeRegistry(Arrays.<Class<? extends Saga>>asList(TransferSaga.class, OpeningSaga.class));
        store = new FailingSagaStore(types);
        locks = new SagaLockTable();
        registry = new EventHandlerRegistry();
        SagaEventHandler.register(registry, TransferSaga.class, store, locks, publisher);
        SagaEventHandler.register(registry, OpeningSaga.class, store, locks, publisher);
    }

    private void deliver(Event event, Map<String, String> headers) throws Exception {
        EventEnvelope envelope = new EventEnvelope("acc", new EventVersion(1, 1, 0), event);
        for (EventHandler handler : registry.getHandlersFor(event)) {
            handler.handle(new EventContext(envelope, headers));
        }
    }

    private void deliver(Event event) throws Exception {
        deliver(event, null);
    }

    private TransferSaga saga(String id) {
        return (TransferSaga) store.tryGetSaga(TransferSaga.class, id).orElse(null);
    }

    @Test
    public void starting_event_creates_saga() throws Exception {
        Map<String, String> headers = new HashMap<>();
        headers.put(Header.USER_NAME, "joe");
        headers.put("unrelated", "x");
        deliver(new AccountEvents.TransferInitiated("t1", "a", "b", 30), headers);

        TransferSaga saga = saga("t1");
        assertNotNull(saga);
        assertEquals(1, saga.getVersion());
        assertEquals("a", saga.getSource());
        assertNotNull(saga.getTimeout());

        assertEquals(1, published.size());
        SagaCommand command = published.get(0);
        assertEquals("b", command.getAggregateId());
        assertEquals(30, ((AccountCommands.Deposit) command.getCommand()).getAmount());
        assertEquals("joe", command.getHeaders().get(Header.USER_NAME));
        assertFalse(command.getHeaders().containsKey("unrelated"));
    }

    @Test
    public void event_for_missing_saga_is_ignored() throws Exception {
        deliver(new AccountEvents.TransferReceived("t1"));
        assertNull(saga("t1"));
        assertTrue(published.isEmpty());
    }

    @Test
    public void completed_saga_is_removed() throws Exception {
        deliver(new AccountEvents.TransferInitiated("t1", "a", "b", 30));
        deliver(new AccountEvents.TransferReceived("t1"));
        assertNull(saga("t1"));
        assertTrue(store.getScheduledTimeouts(Instant.MAX).isEmpty());
    }

    @Test
    public void current_timeout_is_delivered() throws Exception {
        deliver(new AccountEvents.TransferInitiated("t1", "a", "b", 30));
        Instant scheduled = saga("t1").getTimeout();
        deliver(new Timeout(TransferSaga.class, "t1", scheduled));
        assertNull(saga("t1"));
        assertEquals(2, published.size());
        assertEquals("a", published.get(1).getAggregateId());
    }

    @Test
    public void stale_timeout_is_ignored() throws Exception {
        deliver(new AccountEvents.TransferInitiated("t1", "a", "b", 30));
        Instant scheduled = saga("t1").getTimeout();
        deliver(new Timeout(TransferSaga.class, "t1", scheduled.minusSeconds(1)));
        TransferSaga saga = saga("t1");
        assertFalse(saga.isRefunded());
        assertEquals(1, saga.getVersion());
        assertEquals(1, published.size());
    }

    @Test
    public void timeout_of_other_saga_type_is_ignored() throws Exception {
        deliver(new AccountEvents.TransferInitiated("t1", "a", "b", 30));
        deliver(new Timeout(OpeningSaga.class, "t1", saga("t1").getTimeout()));
        assertFalse(saga("t1").isRefunded());
    }

    @Test
    public void event_may_be_handled_by_multiple_saga_types() {
        assertEquals(2, registry.getHandlersFor(new Timeout(TransferSaga.class, "t1", Instant.now())).size());
        assertEquals(1, registry.getHandlersFor(new AccountEvents.Opened("joe")).size());
    }

    @Test
    public void commands_are_not_published_when_save_fails() throws Exception {
        store.fail = true;
        try {
            deliver(new AccountEvents.TransferInitiated("t1", "a", "b", 30));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertTrue(e.isOptimisticLock());
        }
        assertTrue(published.isEmpty());
        assertEquals(0, locks.size());
    }

    @Test
    public void configured_event_without_handler_is_rejected() {
        try {
            SagaEventHandler.forSaga(HandlerlessSaga.class, store, locks, publisher);
            fail("should have failed");
        } catch (MappingException e) {
            assertTrue(e.getMessage().contains("no handler"));
        }
    }

    @Test(expected = MappingException.class)
    public void handler_without_correlation_is_rejected() {
        new SagaEventHandler(TransferSaga.class, AccountEvents.Opened.class, store, locks, publisher,
            (saga, event, context) -> { });
    }

    @Test
    public void saga_commands_keep_explicit_headers() {
        SagaContext context = new SagaContext(TransferSaga.class, "t1", new AccountEvents.TransferReceived("t1"),
                Collections.singletonMap(Header.USER_NAME, "joe"));
        context.publish("a", new AccountCommands.Touch(), Collections.singletonMap(Header.USER_NAME, "saga"));
        assertEquals("saga", context.getPublishedCommands().get(0).getHeaders().get(Header.USER_NAME));
    }
}
