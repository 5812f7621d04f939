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

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Inbound unit of work as delivered by a transport. The message id serves for deduplication and audit, headers are
 * forwarded into the downstream context.
 * @param <T> type of payload, a command or event envelope
 */
public final class Message<T> {
    private final UUID id;
    private final Map<String, String> headers;
    private final T payload;

    public Message(UUID id, Map<String, String> headers, T payload) {
        this.id = Objects.requireNonNull(id, "Message id must be specified");
        this.headers = Header.copyOf(headers);
        this.payload = Objects.requireNonNull(payload, "Payload must be specified");
    }

    public static <T> Message<T> create(T payload) {
        return new Message<>(UUID.randomUUID(), null, payload);
    }

    public static <T> Message<T> create(Map<String, String> headers, T payload) {
        return new Message<>(UUID.randomUUID(), headers, payload);
    }

    public UUID getId() {
        return id;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public T getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return id + " - " + payload;
    }
}
