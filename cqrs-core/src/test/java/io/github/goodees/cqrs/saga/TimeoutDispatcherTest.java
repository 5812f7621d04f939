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
import io.github.goodees.cqrs.eventing.EventVersion;
import io.github.goodees.cqrs.example.AccountEvents;
import io.github.goodees.cqrs.example.TransferSaga;
import io.github.goodees.cqrs.store.inmemory.InMemorySagaStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TimeoutDispatcherTest {
    private final List<EventEnvelope> published = new CopyOnWriteArrayList<>();
    private final List<Map<String, String>> headers = new CopyOnWriteArrayList<>();
    private InMemorySagaStore store;
    private ScheduledExecutorService scheduler;

    @Before
    public void setUp() {
        store = new InMemorySagaStore(new SagaTypeRegistry(Collections.<Class<? extends Saga>>singletonList(
                TransferSaga.class)));
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @After
    public void tearDown() {
        scheduler.shutdownNow();
    }

    private TimeoutDispatcher dispatcher(Instant now) {
        return new TimeoutDispatcher(store, (h, envelope) -> {
            headers.add(h);
            published.add(envelope);
        }, Duration.ofMillis(20), Clock.fixed(now, ZoneOffset.UTC), scheduler);
    }

    private TransferSaga start(String id) throws Exception {
        TransferSaga saga = (TransferSaga) store.createSaga(TransferSaga.class, id);
        AccountEvents.TransferInitiated event = new AccountEvents.TransferInitiated(id, "a", "b", 10);
        SagaContext context = new SagaContext(TransferSaga.class, id, event, null);
        saga.handle(event, context);
        store.save(saga, context);
        return saga;
    }

    @Test
    public void elapsed_timeout_is_published() throws Exception {
        TransferSaga saga = start("t1");
        TimeoutDispatcher dispatcher = dispatcher(saga.getTimeout().plusMillis(1));
        assertEquals(1, dispatcher.dispatchElapsedTimeouts());

        EventEnvelope envelope = published.get(0);
        assertEquals("t1", envelope.getAggregateId());
        assertEquals(EventVersion.EMPTY, envelope.getVersion());
        Timeout timeout = (Timeout) envelope.getEvent();
        assertTrue(timeout.isFor(TransferSaga.class));
        assertEquals("t1", timeout.getSagaId());
        assertEquals(saga.getTimeout(), timeout.getScheduled());
        assertEquals("timeout", headers.get(0).get(Header.ORIGIN));
    }

    @Test
    public void pending_timeout_is_not_published() throws Exception {
        TransferSaga saga = start("t1");
        assertEquals(0, dispatcher(saga.getTimeout()).dispatchElapsedTimeouts());
        assertTrue(published.isEmpty());
    }

    @Test
    public void timeout_is_published_once() throws Exception {
        TransferSaga saga = start("t1");
        TimeoutDispatcher dispatcher = dispatcher(saga.getTimeout().plusSeconds(1));
        assertEquals(1, dispatcher.dispatchElapsedTimeouts());
        assertEquals(0, dispatcher.dispatchElapsedTimeouts());
        assertEquals(1, published.size());
    }

    @Test
    public void rescheduled_timeout_is_published_again() throws Exception {
        TransferSaga saga = start("t1");
        TimeoutDispatcher dispatcher = dispatcher(saga.getTimeout().plus(Duration.ofHours(1)));
        dispatcher.dispatchElapsedTimeouts();

        TransferSaga stored = (TransferSaga) store.tryGetSaga(TransferSaga.class, "t1").get();
        stored.rescheduleTimeout(stored.getTimeout().plusSeconds(10));
        store.save(stored, new SagaContext(TransferSaga.class, "t1", new AccountEvents.TransferReceived("t1"),
                null));
        assertEquals(1, dispatcher.dispatchElapsedTimeouts());
        assertEquals(2, published.size());
        assertEquals(saga.getTimeout().plusSeconds(10), ((Timeout) published.get(1).getEvent()).getScheduled());
    }

    @Test
    public void started_dispatcher_polls_store() throws Exception {
        TransferSaga saga = start("t1");
        try (TimeoutDispatcher dispatcher = dispatcher(saga.getTimeout().plusSeconds(1))) {
            dispatcher.start();
            for (int i = 0; i < 100 && published.isEmpty(); i++) {
                TimeUnit.MILLISECONDS.sleep(10);
            }
        }
        assertEquals(1, published.size());
    }

    @Test(expected = IllegalStateException.class)
    public void dispatcher_cannot_be_started_twice() {
        try (TimeoutDispatcher dispatcher = dispatcher(Instant.now())) {
            dispatcher.start();
            dispatcher.start();
        }
    }
}
