package io.github.goodees.cqrs.saga;

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

import io.github.goodees.cqrs.UnknownTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Known saga types and their stable type ids. The type id is a name based UUID of the fully qualified class name,
 * so it stays the same across restarts and processes.
 */
public class SagaTypeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SagaTypeRegistry.class);

    private final Map<Class<? extends Saga>, UUID> typeIds;
    private final Map<UUID, Class<? extends Saga>> types;

    public SagaTypeRegistry(Collection<Class<? extends Saga>> sagaTypes) {
        Map<Class<? extends Saga>, UUID> ids = new LinkedHashMap<>();
        Map<UUID, Class<? extends Saga>> byId = new LinkedHashMap<>();
        for (Class<? extends Saga> type : sagaTypes) {
            UUID id = typeIdOf(type);
            ids.put(type, id);
            byId.put(id, type);
        }
        this.typeIds = Collections.unmodifiableMap(ids);
        this.types = Collections.unmodifiableMap(byId);
        logger.debug("Known saga types: {}", typeIds);
    }

    public static UUID typeIdOf(Class<?> sagaType) {
        return UUID.nameUUIDFromBytes(sagaType.getName().getBytes(StandardCharsets.UTF_8));
    }

    public boolean isKnown(Class<?> sagaType) {
        return typeIds.containsKey(sagaType);
    }

    public UUID getTypeId(Class<? extends Saga> sagaType) {
        UUID id = typeIds.get(sagaType);
        if (id == null) {
            throw UnknownTypeException.unknownSaga(sagaType);
        }
        return id;
    }

    public Class<? extends Saga> getType(UUID typeId) {
        Class<? extends Saga> type = types.get(typeId);
        if (type == null) {
            throw UnknownTypeException.unknownSaga(typeId);
        }
        return type;
    }

    /**
     * Create new saga at version 0.
     * @param sagaType registered saga type
     * @param sagaId correlation id
     * @return the saga
     */
    public Saga createInstance(Class<? extends Saga> sagaType, String sagaId) {
        getTypeId(sagaType);
        Saga saga = instantiate(sagaType);
        saga.restore(sagaId, 0, null);
        return saga;
    }

    static <T extends Saga> T instantiate(Class<T> sagaType) {
        if (Modifier.isAbstract(sagaType.getModifiers())) {
            throw UnknownTypeException.unknownSaga(sagaType);
        }
        try {
            Constructor<T> constructor = sagaType.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate saga " + sagaType.getName(), e);
        }
    }
}
