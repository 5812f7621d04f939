package io.github.goodees.cqrs.store.inmemory;

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
import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.EventStore;
import io.github.goodees.cqrs.store.EventStoreException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Commit log kept in memory. Intended for tests and single process setups.
 */
public class InMemoryEventStore implements EventStore {
    private final boolean detectDuplicateCommits;
    private final NavigableMap<Long, Commit> commits = new TreeMap<>();
    private final Map<UUID, Long> commitIds = new HashMap<>();
    private final Map<String, NavigableMap<Integer, Long>> streams = new TreeMap<>();
    private final TreeSet<Long> undispatched = new TreeSet<>();
    private long lastId;

    public InMemoryEventStore() {
        this(true);
    }

    public InMemoryEventStore(boolean detectDuplicateCommits) {
        this.detectDuplicateCommits = detectDuplicateCommits;
    }

    @Override
    public synchronized Commit save(Commit commit) throws EventStoreException {
        if (detectDuplicateCommits && commitIds.containsKey(commit.getCommitId())) {
            throw EventStoreException.duplicateCommit(commit.getCommitId(), null);
        }
        NavigableMap<Integer, Long> stream = streams.get(commit.getStreamId());
        int lastVersion = stream == null || stream.isEmpty() ? 0 : stream.lastKey();
        if (commit.getVersion() <= lastVersion) {
            throw EventStoreException.optimisticLock(commit.getStreamId(), commit.getVersion());
        }
        if (commit.getVersion() != lastVersion + 1) {
            throw EventStoreException.nonMonotonic(commit.getStreamId(), lastVersion + 1, commit.getVersion());
        }
        Commit stored = commit.withId(++lastId);
        commits.put(stored.getId(), stored);
        commitIds.put(stored.getCommitId(), stored.getId());
        streams.computeIfAbsent(stored.getStreamId(), s -> new TreeMap<>()).put(stored.getVersion(), stored.getId());
        undispatched.add(stored.getId());
        return stored;
    }

    @Override
    public synchronized Iterable<Commit> getStream(String streamId, int minimumVersion) {
        NavigableMap<Integer, Long> stream = streams.get(streamId);
        List<Commit> result = new ArrayList<>();
        if (stream != null) {
            for (Long id : stream.tailMap(minimumVersion, true).values()) {
                result.add(commits.get(id));
            }
        }
        return result;
    }

    @Override
    public synchronized Iterable<String> getStreams() {
        return new ArrayList<>(streams.keySet());
    }

    @Override
    public synchronized Iterable<Commit> getUndispatched() {
        List<Commit> result = new ArrayList<>();
        for (Long id : undispatched) {
            result.add(commits.get(id));
        }
        return result;
    }

    @Override
    public synchronized void markDispatched(long id) {
        undispatched.remove(id);
    }

    @Override
    public synchronized List<Commit> getRange(long skip, long take) {
        List<Commit> result = new ArrayList<>();
        long index = 0;
        for (Commit commit : commits.values()) {
            if (result.size() >= take) {
                break;
            }
            if (index++ >= skip) {
                result.add(commit);
            }
        }
        return result;
    }

    @Override
    public synchronized void deleteStream(String streamId) {
        NavigableMap<Integer, Long> stream = streams.remove(streamId);
        if (stream != null) {
            for (Long id : stream.values()) {
                Commit removed = commits.remove(id);
                commitIds.remove(removed.getCommitId());
                undispatched.remove(id);
            }
        }
    }

    @Override
    public synchronized void purge() {
        commits.clear();
        commitIds.clear();
        streams.clear();
        undispatched.clear();
    }

    @Override
    public synchronized void migrate(long id, Map<String, String> headers, List<Event> events) {
        Commit commit = commits.get(id);
        if (commit == null) {
            throw new IllegalArgumentException("Commit " + id + " does not exist");
        }
        commits.put(id, new Commit(id, commit.getTimestamp(), commit.getCommitId(), commit.getStreamId(),
                commit.getVersion(), headers, events));
    }
}
