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

import java.time.Instant;
import java.util.Objects;

/**
 * Saga with a scheduled timeout, as listed by {@link SagaStore#getScheduledTimeouts(Instant)}.
 */
public final class SagaTimeout {
    private final Class<? extends Saga> sagaType;
    private final String sagaId;
    private final Instant timeout;

    public SagaTimeout(Class<? extends Saga> sagaType, String sagaId, Instant timeout) {
        this.sagaType = Objects.requireNonNull(sagaType, "Saga type must be specified");
        this.sagaId = Objects.requireNonNull(sagaId, "Saga id must be specified");
        this.timeout = Objects.requireNonNull(timeout, "Timeout must be specified");
    }

    public Class<? extends Saga> getSagaType() {
        return sagaType;
    }

    public String getSagaId() {
        return sagaId;
    }

    public Instant getTimeout() {
        return timeout;
    }

    public SagaReference getReference() {
        return new SagaReference(sagaType, sagaId);
    }

    @Override
    public String toString() {
        return "SagaTimeout[" + sagaType.getSimpleName() + "-" + sagaId + " at " + timeout + "]";
    }
}
