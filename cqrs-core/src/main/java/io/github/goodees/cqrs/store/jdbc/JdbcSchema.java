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

import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.SerializingSnapshotStore.SnapshotRecord;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Statements of the JDBC commit log and snapshot store. Subclasses adapt table layout and SQL dialect, see
 * {@link DefaultJdbcSchema}.
 */
public abstract class JdbcSchema {

    /**
     * Create tables and indexes unless they exist.
     * @param connection connection to use
     * @param uniqueCommitIds whether a unique index on commit id is created
     * @throws SQLException when creation fails
     */
    public void createTables(Connection connection, boolean uniqueCommitIds) throws SQLException {
        for (String statement : tableDefinitions(uniqueCommitIds)) {
            try (CallableStatement cst = connection.prepareCall(statement)) {
                cst.execute();
            }
        }
    }

    protected abstract List<String> tableDefinitions(boolean uniqueCommitIds);

    /**
     * Prepare insert of a commit, returning generated sequence id as first generated key.
     */
    protected abstract PreparedStatement insertCommit(Connection connection, Commit commit, int payloadVersion,
            String payload) throws SQLException;

    protected abstract PreparedStatement selectCommitById(Connection connection, UUID commitId)
            throws SQLException;

    /**
     * Select highest version of a stream as single integer column, {@code NULL} or no row for an empty stream.
     */
    protected abstract PreparedStatement selectLastVersion(Connection connection, String streamId)
            throws SQLException;

    protected abstract PreparedStatement selectStream(Connection connection, String streamId, int minimumVersion,
            long limit) throws SQLException;

    /**
     * @param afterStreamId last stream id of previous page, {@code null} for first page
     */
    protected abstract PreparedStatement selectStreams(Connection connection, String afterStreamId, long limit)
            throws SQLException;

    protected abstract PreparedStatement selectUndispatched(Connection connection, long afterId, long limit)
            throws SQLException;

    protected abstract PreparedStatement selectRange(Connection connection, long skip, long take)
            throws SQLException;

    protected abstract PreparedStatement markDispatched(Connection connection) throws SQLException;

    protected abstract void prepareMarkDispatched(PreparedStatement statement, long id) throws SQLException;

    protected abstract PreparedStatement deleteStream(Connection connection, String streamId) throws SQLException;

    protected abstract PreparedStatement deleteCommits(Connection connection) throws SQLException;

    protected abstract PreparedStatement updateCommitData(Connection connection, long id, int payloadVersion,
            String payload) throws SQLException;

    /**
     * Read commit row of any commit select.
     */
    protected abstract CommitRecord readCommit(ResultSet rs) throws SQLException;

    protected abstract String readStreamId(ResultSet rs) throws SQLException;

    /**
     * Select the most recent snapshot of a stream not newer than given version.
     */
    protected abstract PreparedStatement selectSnapshot(Connection connection, String streamId, int maximumVersion)
            throws SQLException;

    protected abstract SnapshotRecord readSnapshot(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, SnapshotRecord record)
            throws SQLException;

    /**
     * Replace whatever snapshot the stream has with given one.
     */
    protected abstract PreparedStatement updateSnapshot(Connection connection, SnapshotRecord record)
            throws SQLException;

    protected abstract PreparedStatement deleteSnapshots(Connection connection) throws SQLException;

    /**
     * Whether the exception reports violation of a unique constraint.
     */
    protected boolean isIntegrityViolation(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            String state = current.getSQLState();
            if (state != null && state.startsWith("23")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Stored commit with its data still serialized.
     */
    public static class CommitRecord {
        private final long id;
        private final Instant timestamp;
        private final UUID commitId;
        private final String streamId;
        private final int version;
        private final int payloadVersion;
        private final String payload;

        public CommitRecord(long id, Instant timestamp, UUID commitId, String streamId,
                int version, int payloadVersion, String payload) {
            this.id = id;
            this.timestamp = timestamp;
            this.commitId = commitId;
            this.streamId = streamId;
            this.version = version;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
        }

        public long getId() {
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

        public int getPayloadVersion() {
            return payloadVersion;
        }

        public String getPayload() {
            return payload;
        }
    }
}
