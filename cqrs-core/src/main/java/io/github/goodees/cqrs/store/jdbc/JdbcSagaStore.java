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

import io.github.goodees.cqrs.saga.Saga;
import io.github.goodees.cqrs.saga.SagaContext;
import io.github.goodees.cqrs.saga.SagaStore;
import io.github.goodees.cqrs.saga.SagaTimeout;
import io.github.goodees.cqrs.saga.SagaTypeRegistry;
import io.github.goodees.cqrs.store.EventStoreException;
import io.github.goodees.cqrs.store.JacksonSerialization;
import io.github.goodees.cqrs.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Saga store in a relational database. Every write checks the version the saga was loaded at, a saga stored
 * concurrently fails with optimistic lock fault.
 */
public class JdbcSagaStore implements SagaStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSagaStore.class);

    private final DataSource dataSource;
    private final SagaJdbcSchema schema;
    private final SagaTypeRegistry types;
    private final Serialization<Saga> serialization;

    public JdbcSagaStore(DataSource dataSource, SagaJdbcSchema schema, SagaTypeRegistry types) {
        this(dataSource, schema, types, new JacksonSerialization<>(Saga.class));
    }

    public JdbcSagaStore(DataSource dataSource, SagaJdbcSchema schema, SagaTypeRegistry types,
            Serialization<Saga> serialization) {
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.schema = Objects.requireNonNull(schema, "Schema must be specified");
        this.types = Objects.requireNonNull(types, "Saga type registry must be specified");
        this.serialization = Objects.requireNonNull(serialization, "Serialization must be specified");
    }

    public void initialize() {
        try (Connection connection = dataSource.getConnection()) {
            schema.createTables(connection);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot create saga table", e);
        }
    }

    @Override
    public Saga createSaga(Class<? extends Saga> sagaType, String sagaId) {
        return types.createInstance(sagaType, sagaId);
    }

    @Override
    public Optional<Saga> tryGetSaga(Class<? extends Saga> sagaType, String sagaId) {
        UUID typeId = types.getTypeId(sagaType);
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectSaga(connection, typeId, sagaId);
                ResultSet rs = select.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            Saga saga = serialization.deserialize(schema.readPayloadVersion(rs), schema.readState(rs),
                sagaType.getName());
            saga.restore(sagaId, schema.readVersion(rs), schema.readTimeout(rs));
            return Optional.of(saga);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access datastore", e);
        }
    }

    @Override
    public Saga save(Saga saga, SagaContext context) throws EventStoreException {
        UUID typeId = types.getTypeId(saga.getClass());
        String sagaId = saga.getCorrelationId();
        int version = saga.getVersion();
        if (version == 0 && saga.isCompleted()) {
            logger.debug("{} completed before it was stored", saga);
            return saga;
        }
        try (Connection connection = dataSource.getConnection();
                PreparedStatement write = prepareWrite(connection, typeId, saga)) {
            int rows = write.executeUpdate();
            if (rows != 1) {
                throw EventStoreException.sagaConflict(saga.getClass(), sagaId, version);
            }
        } catch (SQLException e) {
            if (version == 0 && schema.isIntegrityViolation(e)) {
                throw EventStoreException.sagaConflict(saga.getClass(), sagaId, version);
            }
            throw EventStoreException.storeFailed(sagaId, e);
        }
        saga.incrementVersion();
        return saga;
    }

    private PreparedStatement prepareWrite(Connection connection, UUID typeId, Saga saga) throws SQLException {
        if (saga.isCompleted()) {
            return schema.deleteSaga(connection, typeId, saga.getCorrelationId(), saga.getVersion());
        }
        int payloadVersion = serialization.payloadVersion(saga);
        String state = serialization.serialize(saga);
        if (saga.getVersion() == 0) {
            return schema.insertSaga(connection, typeId, saga.getCorrelationId(), saga.getTimeout(), payloadVersion,
                state);
        }
        return schema.updateSaga(connection, typeId, saga.getCorrelationId(), saga.getVersion(), saga.getTimeout(),
            payloadVersion, state);
    }

    @Override
    public List<SagaTimeout> getScheduledTimeouts(Instant maximumTimeout) {
        List<SagaTimeout> result = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectTimeouts(connection, maximumTimeout);
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                UUID typeId = UUID.fromString(rs.getString(1));
                result.add(new SagaTimeout(types.getType(typeId), rs.getString(2),
                        rs.getTimestamp(3).toInstant()));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access datastore", e);
        }
        return result;
    }

    @Override
    public void purge() {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement delete = schema.deleteSagas(connection)) {
            delete.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot purge sagas", e);
        }
    }
}
