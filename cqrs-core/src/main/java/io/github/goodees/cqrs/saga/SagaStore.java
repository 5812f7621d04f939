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

import io.github.goodees.cqrs.store.EventStoreException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage of saga state. Completed sagas are removed and cannot be retrieved anymore.
 */
public interface SagaStore {

    /**
     * Create new saga instance at version 0.
     * @throws io.github.goodees.cqrs.UnknownTypeException when the saga type is not registered
     */
    Saga createSaga(Class<? extends Saga> sagaType, String sagaId);

    Optional<Saga> tryGetSaga(Class<? extends Saga> sagaType, String sagaId);

    /**
     * Store saga: insert new one, update existing one, or delete completed one. Version of saga is incremented
     * on every write. A saga completed before it was ever stored is not written at all.
     * @param saga the saga
     * @param context context of the handled event
     * @return the saga
     * @throws EventStoreException with {@code OPTIMISTIC_LOCK} fault when the saga was stored concurrently
     */
    Saga save(Saga saga, SagaContext context) throws EventStoreException;

    /**
     * Sagas with timeout earlier than given time, ordered by timeout.
     * @param maximumTimeout exclusive upper bound
     * @return list of timeouts
     */
    List<SagaTimeout> getScheduledTimeouts(Instant maximumTimeout);

    void purge();
}
