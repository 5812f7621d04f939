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

import java.util.UUID;

/**
 * Exception generated when storing of a commit or saga fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Another writer stored the same version first. Callers reload and retry.
         */
        OPTIMISTIC_LOCK,
        /**
         * A commit with the same commit id is already stored. Callers treat this as success.
         */
        DUPLICATE_COMMIT,
        TX_ERROR,
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isOptimisticLock() {
        return fault == Fault.OPTIMISTIC_LOCK;
    }

    public static EventStoreException optimisticLock(String streamId, int version) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + streamId + " already contains version "
                + version, null);
    }

    public static EventStoreException optimisticLock(String streamId, int version, Throwable cause) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + streamId + " already contains version "
                + version, cause);
    }

    public static EventStoreException sagaConflict(Class<?> sagaType, String sagaId, int expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Saga " + sagaType.getName() + " " + sagaId
                + " is no longer at version " + expectedVersion, null);
    }

    public static EventStoreException duplicateCommit(UUID commitId, Throwable cause) {
        return new EventStoreException(Fault.DUPLICATE_COMMIT, "Commit " + commitId + " is already stored", cause);
    }

    public static EventStoreException storeFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of stream " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException nonMonotonic(String streamId, int expectedVersion, int actualVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Commit for stream " + streamId
                + " does not follow sequence. Expected: " + expectedVersion + " actual: " + actualVersion, null);
    }
}
