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

import java.util.Objects;

/**
 * Event as published from a commit, with the id of the aggregate that raised it.
 */
public final class EventEnvelope {
    private final String aggregateId;
    private final EventVersion version;
    private final Event event;

    public EventEnvelope(String aggregateId, EventVersion version, Event event) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.version = Objects.requireNonNull(version, "Version must be specified");
        this.event = Objects.requireNonNull(event, "Event must be specified");
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public EventVersion getVersion() {
        return version;
    }

    public Event getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return event.getClass().getSimpleName() + " of " + aggregateId + " @" + version;
    }
}
