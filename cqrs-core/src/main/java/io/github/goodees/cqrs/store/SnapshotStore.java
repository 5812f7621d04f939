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

import java.util.Optional;

/**
 * Storage of aggregate snapshots. Failing to store a snapshot never fails the operation that requested it, snapshots
 * only shorten replay.
 */
public interface SnapshotStore {

    /**
     * Latest snapshot of stream not newer than given version.
     * @param type expected type of state
     * @param streamId the stream
     * @param maximumVersion highest acceptable version
     * @return the snapshot, if any
     */
    Optional<Snapshot> getSnapshot(Class<?> type, String streamId, int maximumVersion);

    default Optional<Snapshot> getLastSnapshot(Class<?> type, String streamId) {
        return getSnapshot(type, streamId, Integer.MAX_VALUE);
    }

    void save(Snapshot snapshot);

    void purge();
}
