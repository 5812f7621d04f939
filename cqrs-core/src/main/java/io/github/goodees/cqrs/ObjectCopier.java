package io.github.goodees.cqrs;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.cqrs.store.JacksonSerialization;

import java.io.IOException;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deep copies state objects by passing them through the JSON mapper used for storage. Whatever survives the trip to
 * the store survives the copy, so a copy is exactly what a reload would produce. The same form is used to
 * fingerprint state.
 */
public final class ObjectCopier {
    private static final ObjectMapper mapper = JacksonSerialization.defaultMapper();

    private ObjectCopier() {
    }

    @SuppressWarnings("unchecked")
    public static <T> T copy(T source) {
        if (source == null) {
            return null;
        }
        try {
            return (T) mapper.readValue(mapper.writeValueAsBytes(source), source.getClass());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot copy instance of " + source.getClass().getName(), e);
        }
    }

    /**
     * MD5 digest of the stored form of an object, as hex string.
     * @param source the object
     * @return the fingerprint, equal for objects with equal stored state
     */
    public static String fingerprint(Object source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return String.format("%032x", new BigInteger(1, digest.digest(mapper.writeValueAsBytes(source))));
        } catch (IOException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot fingerprint " + source, e);
        }
    }
}
