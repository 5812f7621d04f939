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

import java.util.Objects;

/**
 * Identity of a saga instance: its type and correlation id.
 */
public final class SagaReference {
    private final Class<? extends Saga> sagaType;
    private final String sagaId;

    public SagaReference(Class<? extends Saga> sagaType, String sagaId) {
        this.sagaType = Objects.requireNonNull(sagaType, "Saga type must be specified");
        this.sagaId = Objects.requireNonNull(sagaId, "Saga id must be specified");
    }

    public Class<? extends Saga> getSagaType() {
        return sagaType;
    }

    public String getSagaId() {
        return sagaId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SagaReference)) {
            return false;
        }
        SagaReference other = (SagaReference) o;
        return sagaType.equals(other.sagaType) && sagaId.equals(other.sagaId);
    }

    @Override
    public int hashCode() {
        return 31 * sagaType.hashCode() + sagaId.hashCode();
    }

    @Override
    public String toString() {
        return sagaType.getSimpleName() + "-" + sagaId;
    }
}
