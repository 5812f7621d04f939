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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Common logic for snapshot stores that keep serialized state. Failures of reading or writing a snapshot are logged
 * and swallowed, as the aggregate can always be recovered by replaying its whole stream.
 */
public abstract class SerializingSnapshotStore implements SnapshotStore {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    protected final Serialization<Object> serialization;

    protected SerializingSnapshotStore(Serialization<Object> serialization) {
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
    }

    @Override
    public Optional<Snapshot> getSnapshot(Class<?> type, String streamId, int maximumVersion) {
        SnapshotRecord record;
        try {
            record = retrieveSnapshotRecord(streamId, maximumVersion);
        } catch (RuntimeException e) {
            logger.error("Cannot read snapshot of {}", streamId, e);
            return Optional.empty();
        }
        if (record != null) {
            try {
                Object state = serialization.deserialize(record.getPayloadVersion(), record.getPayload(),
                    record.getType());
                if (type.isInstance(state)) {
                    return Optional.of(new Snapshot(streamId, record.getVersion(), state));
                }
                logger.error("Snapshot of {} is of type {}, expected {}", streamId, record.getType(), type.getName());
            } catch (Exception e) {
                logger.error("Failure during deserialization of snapshot of {}", streamId, e);
            }
        }
        return Optional.empty();
    }

    @Override
    public void save(Snapshot snapshot) {
        try {
            Object state = serialization.toSerializable(snapshot.getState());
            if (state == null) {
                logger.error("Snapshot is not supported for serialization: {}", snapshot);
                return;
            }
            storeSnapshotRecord(new SnapshotRecord(snapshot.getStreamId(), snapshot.getVersion(),
                    state.getClass().getName(), serialization.payloadVersion(state), serialization.serialize(state),
                    Instant.now()));
        } catch (Exception e) {
            logger.error("Creating snapshot of {} failed", snapshot.getStreamId(), e);
        }
    }

    /**
     * Retrieve most recent snapshot record of a stream not newer than given version.
     * @param streamId the stream
     * @param maximumVersion highest acceptable version
     * @return the record or {@code null}
     */
    protected abstract SnapshotRecord retrieveSnapshotRecord(String streamId, int maximumVersion);

    /**
     * Actually commit the snapshot record into underlying storage.
     *
     * @param snapshotRecord the record to store.
     */
    protected abstract void storeSnapshotRecord(SnapshotRecord snapshotRecord);

    /**
     * Serialized snapshot along with its metadata.
     */
    public static class SnapshotRecord {
        private final String streamId;
        private final int version;
        private final String type;
        private final int payloadVersion;
        private final String payload;
        private final Instant timestamp;

        public SnapshotRecord(String streamId, int version, String type, int payloadVersion, String payload,
                Instant timestamp) {
            this.streamId = streamId;
            this.version = version;
            this.type = type;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
            this.timestamp = timestamp;
        }

        public String getStreamId() {
            return streamId;
        }

        public int getVersion() {
            return version;
        }

        public String getType() {
            return type;
        }

        public int getPayloadVersion() {
            return payloadVersion;
        }

        public String getPayload() {
            return payload;
        }

        public Instant getTimestamp() {
            return timestamp;
        }
    }
}
