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

import java.util.UUID;

/**
 * Storage references, or a caller requests, a type the runtime does not know. This indicates that stored data and
 * deployed code are out of sync, and is never retried.
 */
public class UnknownTypeException extends RuntimeException {

    protected UnknownTypeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static UnknownTypeException unknownSaga(Class<?> sagaType) {
        return new UnknownTypeException("Saga type " + sagaType.getName() + " is not registered", null);
    }

    public static UnknownTypeException unknownSaga(UUID typeId) {
        return new UnknownTypeException("Saga type with id " + typeId + " is not registered", null);
    }

    public static UnknownTypeException unknownAggregate(Class<?> aggregateType, Throwable cause) {
        return new UnknownTypeException("Aggregate type " + aggregateType.getName() + " cannot be instantiated",
            cause);
    }

    public static UnknownTypeException unknownType(String typeName, Throwable cause) {
        return new UnknownTypeException("Stored type " + typeName + " is not known", cause);
    }
}
