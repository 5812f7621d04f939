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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.cqrs.UnknownTypeException;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON serialization of state objects. Objects are mapped by their fields, so aggregates, sagas and events need
 * neither getters nor annotations. Fields marked {@code transient} are not stored.
 * @param <T> base type of serialized objects
 */
public class JacksonSerialization<T> implements Serialization<T> {
    private final ObjectMapper mapper;
    private final Class<T> baseType;
    private final int payloadVersion;

    public JacksonSerialization(Class<T> baseType) {
        this(defaultMapper(), baseType, 1);
    }

    public JacksonSerialization(ObjectMapper mapper, Class<T> baseType, int payloadVersion) {
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be specified");
        this.baseType = Objects.requireNonNull(baseType, "Base type must be specified");
        this.payloadVersion = payloadVersion;
    }

    /**
     * Object mapper configured for field access, with java.time support and ISO dates.
     * @return new object mapper
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY);
        return mapper;
    }

    @Override
    public int payloadVersion(T object) {
        return payloadVersion;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public T deserialize(int payloadVersion, String payload, String type) {
        Class<? extends T> target = type == null ? baseType : resolve(type);
        try {
            return mapper.readValue(payload, target);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot deserialize payload of " + target.getName(), e);
        }
    }

    protected Class<? extends T> resolve(String type) {
        Class<?> result;
        try {
            result = mapper.getTypeFactory().findClass(type);
        } catch (ClassNotFoundException e) {
            throw UnknownTypeException.unknownType(type, e);
        }
        if (!baseType.isAssignableFrom(result)) {
            throw UnknownTypeException.unknownType(type, null);
        }
        return result.asSubclass(baseType);
    }

    @Override
    public T toSerializable(Object o) {
        return baseType.isInstance(o) ? baseType.cast(o) : null;
    }
}
