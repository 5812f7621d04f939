package io.github.goodees.cqrs.store.jdbc;

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

import io.github.goodees.cqrs.config.SnapshotStoreSettings;
import io.github.goodees.cqrs.store.JacksonSerialization;
import io.github.goodees.cqrs.store.Serialization;
import io.github.goodees.cqrs.store.SerializingSnapshotStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot store in a relational database. By default only the latest snapshot of a stream is kept.
 */
public class JdbcSnapshotStore extends SerializingSnapshotStore implements AutoCloseable {
    private final DataSource ds;
    private final JdbcSchema schema;
    private final SnapshotStoreSettings settings;
    private final JdbcBatchOperation<SnapshotRecord> batch;

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema, SnapshotStoreSettings settings) {
        this(ds, schema, new JacksonSerialization<>(Object.class), settings);
    }

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema, Serialization<Object> serialization,
            SnapshotStoreSettings settings) {
        super(serialization);
        this.ds = Objects.requireNonNull(ds, "Data source must be specified");
        this.schema = Objects.requireNonNull(schema, "Schema must be specified");
        this.settings = Objects.requireNonNull(settings, "Settings must be specified");
        this.batch = settings.isAsync()
                ? new JdbcBatchOperation<>("snapshots", ds, this::writeRecords, settings.getBatchSize(),
                    settings.getFlushInterval())
                : null;
    }

    @Override
    protected SnapshotRecord retrieveSnapshotRecord(String streamId, int maximumVersion) {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshot(connection, streamId, maximumVersion);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readSnapshot(rs) : null;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access datastore", e);
        }
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        if (batch != null) {
            batch.add(snapshotRecord);
            return;
        }
        try (Connection connection = ds.getConnection()) {
            writeRecords(connection, Collections.singletonList(snapshotRecord));
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot store snapshot of " + snapshotRecord.getStreamId(), e);
        }
    }

    private void writeRecords(Connection connection, List<SnapshotRecord> records) throws SQLException {
        for (SnapshotRecord record : records) {
            if (settings.isReplaceExisting()) {
                try (PreparedStatement update = schema.updateSnapshot(connection, record)) {
                    if (update.executeUpdate() > 0) {
                        continue;
                    }
                }
            }
            try (PreparedStatement insert = schema.insertSnapshot(connection, record)) {
                insert.executeUpdate();
            } catch (SQLException e) {
                if (!schema.isIntegrityViolation(e)) {
                    throw e;
                }
                logger.warn("Snapshot of {} at version {} is already stored", record.getStreamId(),
                    record.getVersion());
            }
        }
    }

    public void flush() throws InterruptedException {
        if (batch != null) {
            batch.flush();
        }
    }

    @Override
    public void purge() {
        try (Connection connection = ds.getConnection();
                PreparedStatement delete = schema.deleteSnapshots(connection)) {
            delete.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot purge snapshots", e);
        }
    }

    @Override
    public void close() throws InterruptedException {
        if (batch != null) {
            batch.close();
        }
    }
}
