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

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.UUID;

/**
 * Statements of the JDBC saga store. Sagas are kept in single table:
 * <em>sagaTable</em>(TYPE_ID, ID, VERSION, TIMEOUT_AT, PAYLOAD_VERSION, STATE) primary key (TYPE_ID, ID).
 * Override the statements to adapt it to another layout.
 */
public class SagaJdbcSchema {
    private final String sagaTable;

    public SagaJdbcSchema() {
        this("cqrs_saga");
    }

    public SagaJdbcSchema(String sagaTable) {
        this.sagaTable = sagaTable;
    }

    protected String getSagaTable() {
        return sagaTable;
    }

    protected String payloadColumnType() {
        return "CLOB";
    }

    public void createTables(Connection connection) throws SQLException {
        String[] statements = {
            "CREATE TABLE IF NOT EXISTS " + getSagaTable() + " (TYPE_ID VARCHAR(36) NOT NULL,"
                    + " ID VARCHAR(255) NOT NULL, VERSION INT NOT NULL, TIMEOUT_AT TIMESTAMP,"
                    + " PAYLOAD_VERSION INT NOT NULL, STATE " + payloadColumnType() + " NOT NULL,"
                    + " PRIMARY KEY (TYPE_ID, ID))",
            "CREATE INDEX IF NOT EXISTS " + getSagaTable() + "_TIMEOUT ON " + getSagaTable() + " (TIMEOUT_AT)" };
        for (String statement : statements) {
            try (CallableStatement cst = connection.prepareCall(statement)) {
                cst.execute();
            }
        }
    }

    protected PreparedStatement selectSaga(Connection connection, UUID typeId, String id) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION, TIMEOUT_AT, PAYLOAD_VERSION, STATE FROM "
                + getSagaTable() + " WHERE TYPE_ID = ? AND ID = ?");
        st.setString(1, typeId.toString());
        st.setString(2, id);
        return st;
    }

    protected int readVersion(ResultSet rs) throws SQLException {
        return rs.getInt(1);
    }

    protected Instant readTimeout(ResultSet rs) throws SQLException {
        Timestamp timeout = rs.getTimestamp(2);
        return timeout == null ? null : timeout.toInstant();
    }

    protected int readPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(3);
    }

    protected String readState(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    protected PreparedStatement insertSaga(Connection connection, UUID typeId, String id, Instant timeout,
            int payloadVersion, String state) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getSagaTable()
                + " (TYPE_ID, ID, VERSION, TIMEOUT_AT, PAYLOAD_VERSION, STATE) VALUES (?, ?, 1, ?, ?, ?)");
        st.setString(1, typeId.toString());
        st.setString(2, id);
        setTimeout(st, 3, timeout);
        st.setInt(4, payloadVersion);
        st.setString(5, state);
        return st;
    }

    protected PreparedStatement updateSaga(Connection connection, UUID typeId, String id, int expectedVersion,
            Instant timeout, int payloadVersion, String state) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getSagaTable()
                + " SET VERSION = ?, TIMEOUT_AT = ?, PAYLOAD_VERSION = ?, STATE = ?"
                + " WHERE TYPE_ID = ? AND ID = ? AND VERSION = ?");
        st.setInt(1, expectedVersion + 1);
        setTimeout(st, 2, timeout);
        st.setInt(3, payloadVersion);
        st.setString(4, state);
        st.setString(5, typeId.toString());
        st.setString(6, id);
        st.setInt(7, expectedVersion);
        return st;
    }

    protected PreparedStatement deleteSaga(Connection connection, UUID typeId, String id, int expectedVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("DELETE FROM " + getSagaTable()
                + " WHERE TYPE_ID = ? AND ID = ? AND VERSION = ?");
        st.setString(1, typeId.toString());
        st.setString(2, id);
        st.setInt(3, expectedVersion);
        return st;
    }

    /**
     * Select TYPE_ID, ID and TIMEOUT_AT of sagas with timeout before given time, ordered by timeout.
     */
    protected PreparedStatement selectTimeouts(Connection connection, Instant maximumTimeout) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT TYPE_ID, ID, TIMEOUT_AT FROM " + getSagaTable()
                + " WHERE TIMEOUT_AT IS NOT NULL AND TIMEOUT_AT < ? ORDER BY TIMEOUT_AT");
        st.setTimestamp(1, Timestamp.from(maximumTimeout));
        return st;
    }

    protected PreparedStatement deleteSagas(Connection connection) throws SQLException {
        return connection.prepareStatement("DELETE FROM " + getSagaTable());
    }

    protected boolean isIntegrityViolation(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }

    private static void setTimeout(PreparedStatement st, int index, Instant timeout) throws SQLException {
        if (timeout == null) {
            st.setNull(index, Types.TIMESTAMP);
        } else {
            st.setTimestamp(index, Timestamp.from(timeout));
        }
    }
}
