package io.github.goodees.cqrs.eventing;

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

import io.github.goodees.cqrs.Header;

import java.util.Map;
import java.util.Objects;

/**
 * Scope of handling single event by single handler.
 */
public final class EventContext {
    private final String aggregateId;
    private final EventVersion version;
    private final Map<String, String> headers;
    private final Event event;

    public EventContext(EventEnvelope envelope, Map<String, String> headers) {
        Objects.requireNonNull(envelope, "Event envelope must be specified");
        this.aggregateId = envelope.getAggregateId();
        this.version = envelope.getVersion();
        this.event = envelope.getEvent();
        this.headers = Header.copyOf(headers);
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public EventVersion getVersion() {
        return version;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Event getEvent() {
        return event;
    }
}
