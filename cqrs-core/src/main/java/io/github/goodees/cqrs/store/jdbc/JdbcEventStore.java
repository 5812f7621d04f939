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

import io.github.goodees.cqrs.config.EventStoreSettings;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.CommitData;
import io.github.goodees.cqrs.store.EventStore;
import io.github.goodees.cqrs.store.EventStoreException;
import io.github.goodees.cqrs.store.JacksonSerialization;
import io.github.goodees.cqrs.store.PagedResult;
import io.github.goodees.cqrs.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Commit log in a relational database. Each commit is a single row, its headers and events serialized together.
 * Version conflicts are detected by the unique constraint on stream and version, so no locking is needed.
 * <p>Reads are paged by {@linkplain EventStoreSettings#getPageSize() page size}, each page using its own
 * connection.</p>
 */
public class JdbcEventStore implements EventStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<CommitData> serialization;
    private final EventStoreSettings settings;
    private final JdbcBatchOperation<Long> dispatchedMarks;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, EventStoreSettings settings) {
        this(dataSource, schema, new JacksonSerialization<>(CommitData.class), settings);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<CommitData> serialization,
            EventStoreSettings settings) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.schema = Objects.requireNonNull(schema, "Schema must be specified");
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
        this.settings = Objects.requireNonNull(settings, "Settings must be specified");
        this.dispatchedMarks = settings.isAsync()
                ? new JdbcBatchOperation<>("dispatched", dataSource, this::writeDispatched, settings.getBatchSize(),
                    settings.getFlushInterval())
                : null;
    }

    /**
     * Create tables unless they exist.
     */
    public void initialize() {
        try (Connection connection = dataSource.getConnection()) {
            schema.createTables(connection, settings.isDetectDuplicateCommits());
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot create commit tables", e);
        }
    }

    @Override
    public Commit save(Commit commit) throws EventStoreException {
        CommitData data = new CommitData(commit.getHeaders(), commit.getEvents());
        String payload = serialization.serialize(data);
        try (Connection connection = dataSource.getConnection()) {
            // lower versions are rejected by the unique constraint, gaps have to be checked
            int lastVersion = lastVersion(connection, commit.getStreamId());
            if (commit.getVersion() > lastVersion + 1) {
                throw EventStoreException.nonMonotonic(commit.getStreamId(), lastVersion + 1, commit.getVersion());
            }
            try (PreparedStatement insert = schema.insertCommit(connection, commit, serialization.payloadVersion(data),
                    payload)) {
                insert.executeUpdate();
                try (ResultSet keys = insert.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new IllegalStateException("No sequence id generated for " + commit);
                    }
                    return commit.withId(keys.getLong(1));
                }
            }
        } catch (SQLException e) {
            throw translate(e, commit);
        }
    }

    private int lastVersion(Connection connection, String streamId) throws SQLException {
        try (PreparedStatement select = schema.selectLastVersion(connection, streamId);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    protected EventStoreException translate(SQLException e, Commit commit) {
        if (!schema.isIntegrityViolation(e)) {
            return EventStoreException.storeFailed(commit.getStreamId(), e);
        }
        if (settings.isDetectDuplicateCommits() && isStored(commit)) {
            return EventStoreException.duplicateCommit(commit.getCommitId(), e);
        }
        return EventStoreException.optimisticLock(commit.getStreamId(), commit.getVersion(), e);
    }

    private boolean isStored(Commit commit) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectCommitById(connection, commit.getCommitId());
                ResultSet rs = select.executeQuery()) {
            return rs.next();
        } catch (SQLException e) {
            logger.warn("Cannot check whether commit {} is stored", commit.getCommitId(), e);
            return false;
        }
    }

    @Override
    public Iterable<Commit> getStream(String streamId, int minimumVersion) {
        return new PagedResult<Commit>(settings.getPageSize(), (last, page) -> {
            int from = last == null ? minimumVersion : last.getVersion() + 1;
            return queryCommits(connection -> schema.selectStream(connection, streamId, from, page.getTake()));
        });
    }

    @Override
    public Iterable<String> getStreams() {
        return new PagedResult<String>(settings.getPageSize(), (last, page) -> {
            List<String> result = new ArrayList<>();
            try (Connection connection = dataSource.getConnection();
                    PreparedStatement select = schema.selectStreams(connection, last, page.getTake());
                    ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    result.add(schema.readStreamId(rs));
                }
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
            return result;
        });
    }

    @Override
    public Iterable<Commit> getUndispatched() {
        return new PagedResult<Commit>(settings.getPageSize(), (last, page) -> {
            long after = last == null ? 0 : last.getId();
            return queryCommits(connection -> schema.selectUndispatched(connection, after, page.getTake()));
        });
    }

    @Override
    public void markDispatched(long id) {
        if (dispatchedMarks != null) {
            dispatchedMarks.add(id);
            return;
        }
        try (Connection connection = dataSource.getConnection()) {
            writeDispatched(connection, Collections.singletonList(id));
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot mark commit " + id + " dispatched", e);
        }
    }

    private void writeDispatched(Connection connection, List<Long> ids) throws SQLException {
        try (PreparedStatement update = schema.markDispatched(connection)) {
            for (Long id : ids) {
                schema.prepareMarkDispatched(update, id);
                update.addBatch();
            }
            update.executeBatch();
        }
    }

    /**
     * Write dispatched marks collected in background.
     */
    public void flush() throws InterruptedException {
        if (dispatchedMarks != null) {
            dispatchedMarks.flush();
        }
    }

    @Override
    public List<Commit> getRange(long skip, long take) {
        return queryCommits(connection -> schema.selectRange(connection, skip, take));
    }

    @Override
    public void deleteStream(String streamId) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement delete = schema.deleteStream(connection, streamId)) {
            int deleted = delete.executeUpdate();
            logger.debug("Deleted {} commits of stream {}", deleted, streamId);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot delete stream " + streamId, e);
        }
    }

    @Override
    public void purge() {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement delete = schema.deleteCommits(connection)) {
            delete.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot purge commits", e);
        }
    }

    @Override
    public void migrate(long id, Map<String, String> headers, List<Event> events) {
        CommitData data = new CommitData(headers, events);
        try (Connection connection = dataSource.getConnection();
                PreparedStatement update = schema.updateCommitData(connection, id, serialization.payloadVersion(data),
                    serialization.serialize(data))) {
            if (update.executeUpdate() != 1) {
                throw new IllegalArgumentException("Commit " + id + " does not exist");
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot migrate commit " + id, e);
        }
    }

    @FunctionalInterface
    private interface Query {
        PreparedStatement prepare(Connection connection) throws SQLException;
    }

    private List<Commit> queryCommits(Query query) {
        List<Commit> result = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = query.prepare(connection);
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                result.add(toCommit(schema.readCommit(rs)));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access datastore", e);
        }
        return result;
    }

    private Commit toCommit(JdbcSchema.CommitRecord record) {
        CommitData data = serialization.deserialize(record.getPayloadVersion(), record.getPayload(), null);
        return new Commit(record.getId(), record.getTimestamp(), record.getCommitId(), record.getStreamId(),
                record.getVersion(), data.getHeaders(), data.getEvents());
    }

    @Override
    public void close() throws InterruptedException {
        if (dispatchedMarks != null) {
            dispatchedMarks.close();
        }
    }
}
