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

import io.github.goodees.cqrs.Header;
import io.github.goodees.cqrs.eventing.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Atomic unit of persistence. All events raised while handling a single command are stored together as one commit
 * at the next version of the stream.
 * <p>The sequence id is assigned by the store, commits that were not stored yet have none.</p>
 */
public final class Commit {
    private final Long id;
    private final Instant timestamp;
    private final UUID commitId;
    private final String streamId;
    private final int version;
    private final Map<String, String> headers;
    private final List<Event> events;

    public Commit(UUID commitId, String streamId, int version, Map<String, String> headers, List<Event> events) {
        this(null, Instant.now(), commitId, streamId, version, headers, events);
    }

    public Commit(Long id, Instant timestamp, UUID commitId, String streamId, int version,
            Map<String, String> headers, List<Event> events) {
        this.id = id;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp must be specified");
        this.commitId = Objects.requireNonNull(commitId, "Commit id must be specified");
        this.streamId = Objects.requireNonNull(streamId, "Stream id must be specified");
        if (version < 1) {
            throw new IllegalArgumentException("Commit version must be positive, was " + version);
        }
        this.version = version;
        this.headers = Header.copyOf(headers);
        this.events = events == null ? Collections.<Event>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(events));
    }

    /**
     * Copy of this commit with sequence id assigned by the store.
     * @param id the sequence id
     * @return stored commit
     */
    public Commit withId(long id) {
        return new Commit(id, timestamp, commitId, streamId, version, headers, events);
    }

    public Long getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public UUID getCommitId() {
        return commitId;
    }

    public String getStreamId() {
        return streamId;
    }

    public int getVersion() {
        return version;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public List<Event> getEvents() {
        return events;
    }

    @Override
    public String toString() {
        return "Commit[id=" + id + ", commitId=" + commitId + ", stream=" + streamId + ", version=" + version
                + ", events=" + events.size() + "]";
    }
}
