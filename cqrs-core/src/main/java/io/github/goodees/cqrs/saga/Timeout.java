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

import io.github.goodees.cqrs.eventing.Event;

import java.time.Instant;
import java.util.Objects;

/**
 * Event delivered to a saga when its scheduled timeout elapses. Sagas handling timeouts configure
 * {@code saga.canHandle(Timeout.class, Timeout::getSagaId)}.
 */
public final class Timeout implements Event {
    private String sagaType;
    private String sagaId;
    private Instant scheduled;

    private Timeout() {
    }

    public Timeout(Class<? extends Saga> sagaType, String sagaId, Instant scheduled) {
        this.sagaType = sagaType.getName();
        this.sagaId = Objects.requireNonNull(sagaId, "Saga id must be specified");
        this.scheduled = Objects.requireNonNull(scheduled, "Scheduled time must be specified");
    }

    public String getSagaType() {
        return sagaType;
    }

    public String getSagaId() {
        return sagaId;
    }

    public Instant getScheduled() {
        return scheduled;
    }

    public boolean isFor(Class<? extends Saga> type) {
        return type.getName().equals(sagaType);
    }

    @Override
    public String toString() {
        return "Timeout[" + sagaType + "-" + sagaId + " at " + scheduled + "]";
    }
}
