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

import io.github.goodees.cqrs.domain.Aggregate;
import io.github.goodees.cqrs.domain.PipelineHook;
import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Pipeline hook publishing events of every stored commit and marking the commit dispatched afterwards. Commits
 * stored but not dispatched, e.g. due to a crash, are published again by
 * {@link #ensurePersistedCommitsDispatched()}, so delivery is at least once.
 */
public class EventDispatcher extends PipelineHook {
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final EventStore eventStore;
    private final EventPublisher publisher;

    public EventDispatcher(EventStore eventStore, EventPublisher publisher) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.publisher = Objects.requireNonNull(publisher, "Event publisher must be specified");
    }

    /**
     * Publish all commits not yet marked dispatched. Meant to be called once on startup.
     * @return number of dispatched commits
     */
    public int ensurePersistedCommitsDispatched() {
        int count = 0;
        for (Commit commit : eventStore.getUndispatched()) {
            logger.warn("Dispatching previously undispatched {}", commit);
            dispatch(commit);
            count++;
        }
        return count;
    }

    @Override
    public void postSave(Aggregate aggregate, Commit commit, Exception error) {
        if (commit != null && commit.getId() != null) {
            dispatch(commit);
        }
    }

    private void dispatch(Commit commit) {
        List<Event> events = commit.getEvents();
        for (int i = 0; i < events.size(); i++) {
            publisher.publish(commit.getHeaders(), new EventEnvelope(commit.getStreamId(),
                    new EventVersion(commit.getVersion(), events.size(), i), events.get(i)));
        }
        eventStore.markDispatched(commit.getId());
    }
}
