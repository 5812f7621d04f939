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

import io.github.goodees.cqrs.ObjectCopier;
import io.github.goodees.cqrs.store.Snapshot;
import io.github.goodees.cqrs.store.SnapshotStore;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps copies of snapshots in memory, so that later changes to an aggregate do not leak into its snapshot.
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private final boolean replaceExisting;
    private final ConcurrentMap<String, NavigableMap<Integer, Object>> snapshots = new ConcurrentHashMap<>();

    public InMemorySnapshotStore() {
        this(true);
    }

    public InMemorySnapshotStore(boolean replaceExisting) {
        this.replaceExisting = replaceExisting;
    }

    @Override
    public Optional<Snapshot> getSnapshot(Class<?> type, String streamId, int maximumVersion) {
        NavigableMap<Integer, Object> versions = snapshots.get(streamId);
        if (versions == null) {
            return Optional.empty();
        }
        Map.Entry<Integer, Object> entry;
        synchronized (versions) {
            entry = versions.floorEntry(maximumVersion);
        }
        if (entry == null || !type.isInstance(entry.getValue())) {
            return Optional.empty();
        }
        return Optional.of(new Snapshot(streamId, entry.getKey(), ObjectCopier.copy(entry.getValue())));
    }

    @Override
    public void save(Snapshot snapshot) {
        Object state = ObjectCopier.copy(snapshot.getState());
        NavigableMap<Integer, Object> versions = snapshots.computeIfAbsent(snapshot.getStreamId(),
            id -> new TreeMap<>());
        synchronized (versions) {
            if (replaceExisting) {
                versions.clear();
            }
            versions.put(snapshot.getVersion(), state);
        }
    }

    @Override
    public void purge() {
        snapshots.clear();
    }

    /**
     * Number of snapshots kept for a stream.
     * @param streamId the stream
     * @return count of stored versions
     */
    public int countSnapshots(String streamId) {
        NavigableMap<Integer, Object> versions = snapshots.get(streamId);
        if (versions == null) {
            return 0;
        }
        synchronized (versions) {
            return versions.size();
        }
    }
}
