package io.github.goodees.cqrs.store;

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

import io.github.goodees.cqrs.eventing.Event;

import java.util.List;
import java.util.Map;

/**
 * Append-only commit log. Each stream holds commits with contiguous versions starting at 1.
 */
public interface EventStore {

    /**
     * Store a commit.
     * @param commit commit to store
     * @return the stored commit with its sequence id assigned
     * @throws EventStoreException with fault {@code OPTIMISTIC_LOCK} when the stream already contains the version,
     *                             {@code DUPLICATE_COMMIT} when the commit id was stored before, or
     *                             {@code TX_ERROR} for transient storage failures.
     */
    Commit save(Commit commit) throws EventStoreException;

    /**
     * Read commits of a stream in version order.
     * @param streamId the stream
     * @param minimumVersion lowest version to return
     * @return lazily read commits
     */
    Iterable<Commit> getStream(String streamId, int minimumVersion);

    default Iterable<Commit> getStream(String streamId) {
        return getStream(streamId, 0);
    }

    /**
     * All known stream ids, in ascending order.
     */
    Iterable<String> getStreams();

    /**
     * Commits not yet marked dispatched, in sequence order.
     */
    Iterable<Commit> getUndispatched();

    void markDispatched(long id);

    /**
     * Commits across all streams in sequence order.
     */
    List<Commit> getRange(long skip, long take);

    default List<Commit> getRange(Page page) {
        return getRange(page.getSkip(), page.getTake());
    }

    void deleteStream(String streamId);

    void purge();

    /**
     * Rewrite headers and events of stored commit. Used for offline upgrades of stored events.
     * @param id sequence id of the commit
     * @param headers new headers
     * @param events new events
     */
    void migrate(long id, Map<String, String> headers, List<Event> events);
}
