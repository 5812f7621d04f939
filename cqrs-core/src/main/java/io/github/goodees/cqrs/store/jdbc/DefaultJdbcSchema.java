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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JDBC schema with one commit table and one snapshot table:
 * <ul>
 * <li><em>commitTable</em>(ID identity, COMMITTED_AT, COMMIT_ID, STREAM_ID, VERSION, DISPATCHED, PAYLOAD_VERSION,
 * DATA) unique (STREAM_ID, VERSION), optionally unique (COMMIT_ID)</li>
 * <li><em>snapshotTable</em>(STREAM_ID, VERSION, CREATED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD) primary key
 * (STREAM_ID, VERSION)</li>
 * </ul>
 * The statements run on H2 and PostgreSQL. Override {@link #payloadColumnType()} where {@code CLOB} is not known.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private final String commitTable;
    private final String snapshotTable;

    public DefaultJdbcSchema() {
        this("cqrs_commit", "cqrs_snapshot");
    }

    public DefaultJdbcSchema(String commitTable, String snapshotTable) {
        this.commitTable = commitTable;
        this.snapshotTable = snapshotTable;
    }

    protected String getCommitTable() {
        return commitTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    protected String payloadColumnType() {
        return "CLOB";
    }

    @Override
    protected List<String> tableDefinitions(boolean uniqueCommitIds) {
        List<String> result = new ArrayList<>();
        result.add("CREATE TABLE IF NOT EXISTS " + getCommitTable()
                + " (ID BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, COMMITTED_AT TIMESTAMP NOT NULL,"
                + " COMMIT_ID VARCHAR(36) NOT NULL, STREAM_ID VARCHAR(255) NOT NULL, VERSION INT NOT NULL,"
                + " DISPATCHED BOOLEAN DEFAULT FALSE NOT NULL, PAYLOAD_VERSION INT NOT NULL, DATA "
                + payloadColumnType() + " NOT NULL, CONSTRAINT " + getCommitTable()
                + "_STREAM_VERSION UNIQUE (STREAM_ID, VERSION))");
        if (uniqueCommitIds) {
            result.add("CREATE UNIQUE INDEX IF NOT EXISTS " + getCommitTable() + "_COMMIT_ID ON " + getCommitTable()
                    + " (COMMIT_ID)");
        }
        result.add("CREATE TABLE IF NOT EXISTS " + getSnapshotTable()
                + " (STREAM_ID VARCHAR(255) NOT NULL, VERSION INT NOT NULL, CREATED_AT TIMESTAMP NOT NULL,"
                + " TYPE VARCHAR(255) NOT NULL, PAYLOAD_VERSION INT NOT NULL, PAYLOAD " + payloadColumnType()
                + " NOT NULL, PRIMARY KEY (STREAM_ID, VERSION))");
        return result;
    }

    private String commitColumns() {
        return "SELECT ID, COMMITTED_AT, COMMIT_ID, STREAM_ID, VERSION, PAYLOAD_VERSION, DATA FROM "
                + getCommitTable();
    }

    @Override
    protected PreparedStatement insertCommit(Connection connection, Commit commit, int payloadVersion,
            String payload) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getCommitTable()
                + " (COMMITTED_AT, COMMIT_ID, STREAM_ID, VERSION, PAYLOAD_VERSION, DATA) VALUES (?, ?, ?, ?, ?, ?)",
            Statement.RETURN_GENERATED_KEYS);
        st.setTimestamp(1, Timestamp.from(commit.getTimestamp()));
        st.setString(2, commit.getCommitId().toString());
        st.setString(3, commit.getStreamId());
        st.setInt(4, commit.getVersion());
        st.setInt(5, payloadVersion);
        st.setString(6, payload);
        return st;
    }

    @Override
    protected PreparedStatement selectCommitById(Connection connection, UUID commitId) throws SQLException {
        PreparedStatement st = connection.prepareStatement(commitColumns() + " WHERE COMMIT_ID = ?");
        st.setString(1, commitId.toString());
        return st;
    }

    @Override
    protected PreparedStatement selectLastVersion(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT MAX(VERSION) FROM " + getCommitTable()
                + " WHERE STREAM_ID = ?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected PreparedStatement selectStream(Connection connection, String streamId, int minimumVersion, long limit)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement(commitColumns()
                + " WHERE STREAM_ID = ? AND VERSION >= ? ORDER BY VERSION LIMIT ?");
        st.setString(1, streamId);
        st.setInt(2, minimumVersion);
        st.setLong(3, limit);
        return st;
    }

    @Override
    protected PreparedStatement selectStreams(Connection connection, String afterStreamId, long limit)
            throws SQLException {
        PreparedStatement st;
        if (afterStreamId == null) {
            st = connection.prepareStatement("SELECT DISTINCT STREAM_ID FROM " + getCommitTable()
                    + " ORDER BY STREAM_ID LIMIT ?");
            st.setLong(1, limit);
        } else {
            st = connection.prepareStatement("SELECT DISTINCT STREAM_ID FROM " + getCommitTable()
                    + " WHERE STREAM_ID > ? ORDER BY STREAM_ID LIMIT ?");
            st.setString(1, afterStreamId);
            st.setLong(2, limit);
        }
        return st;
    }

    @Override
    protected PreparedStatement selectUndispatched(Connection connection, long afterId, long limit)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement(commitColumns()
                + " WHERE DISPATCHED = FALSE AND ID > ? ORDER BY ID LIMIT ?");
        st.setLong(1, afterId);
        st.setLong(2, limit);
        return st;
    }

    @Override
    protected PreparedStatement selectRange(Connection connection, long skip, long take) throws SQLException {
        PreparedStatement st = connection.prepareStatement(commitColumns() + " ORDER BY ID LIMIT ? OFFSET ?");
        st.setLong(1, take);
        st.setLong(2, skip);
        return st;
    }

    @Override
    protected PreparedStatement markDispatched(Connection connection) throws SQLException {
        return connection.prepareStatement("UPDATE " + getCommitTable() + " SET DISPATCHED = TRUE WHERE ID = ?");
    }

    @Override
    protected void prepareMarkDispatched(PreparedStatement statement, long id) throws SQLException {
        statement.setLong(1, id);
    }

    @Override
    protected PreparedStatement deleteStream(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getCommitTable() + " WHERE STREAM_ID = ?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected PreparedStatement deleteCommits(Connection connection) throws SQLException {
        return connection.prepareStatement("DELETE FROM " + getCommitTable());
    }

    @Override
    protected PreparedStatement updateCommitData(Connection connection, long id, int payloadVersion, String payload)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getCommitTable()
                + " SET PAYLOAD_VERSION = ?, DATA = ? WHERE ID = ?");
        st.setInt(1, payloadVersion);
        st.setString(2, payload);
        st.setLong(3, id);
        return st;
    }

    @Override
    protected CommitRecord readCommit(ResultSet rs) throws SQLException {
        return new CommitRecord(rs.getLong(1), rs.getTimestamp(2).toInstant(), UUID.fromString(rs.getString(3)),
                rs.getString(4), rs.getInt(5), rs.getInt(6), rs.getString(7));
    }

    @Override
    protected String readStreamId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected PreparedStatement selectSnapshot(Connection connection, String streamId, int maximumVersion)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT STREAM_ID, VERSION, CREATED_AT, TYPE,"
                + " PAYLOAD_VERSION, PAYLOAD FROM " + getSnapshotTable()
                + " WHERE STREAM_ID = ? AND VERSION <= ? ORDER BY VERSION DESC LIMIT 1");
        ps.setString(1, streamId);
        ps.setInt(2, maximumVersion);
        return ps;
    }

    @Override
    protected SnapshotRecord readSnapshot(ResultSet rs) throws SQLException {
        return new SnapshotRecord(rs.getString(1), rs.getInt(2), rs.getString(4), rs.getInt(5), rs.getString(6),
                rs.getTimestamp(3).toInstant());
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, SnapshotRecord record) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (STREAM_ID, VERSION, CREATED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD) VALUES (?, ?, ?, ?, ?, ?)");
        ps.setString(1, record.getStreamId());
        ps.setInt(2, record.getVersion());
        ps.setTimestamp(3, Timestamp.from(record.getTimestamp()));
        ps.setString(4, record.getType());
        ps.setInt(5, record.getPayloadVersion());
        ps.setString(6, record.getPayload());
        return ps;
    }

    @Override
    protected PreparedStatement updateSnapshot(Connection connection, SnapshotRecord record) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getSnapshotTable()
                + " SET VERSION = ?, CREATED_AT = ?, TYPE = ?, PAYLOAD_VERSION = ?, PAYLOAD = ? WHERE STREAM_ID = ?");
        ps.setInt(1, record.getVersion());
        ps.setTimestamp(2, Timestamp.from(record.getTimestamp()));
        ps.setString(3, record.getType());
        ps.setInt(4, record.getPayloadVersion());
        ps.setString(5, record.getPayload());
        ps.setString(6, record.getStreamId());
        return ps;
    }

    @Override
    protected PreparedStatement deleteSnapshots(Connection connection) throws SQLException {
        return connection.prepareStatement("DELETE FROM " + getSnapshotTable());
    }
}
