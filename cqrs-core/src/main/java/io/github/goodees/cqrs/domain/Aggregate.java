package io.github.goodees.cqrs.domain;

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

import io.github.goodees.cqrs.ObjectCopier;
import io.github.goodees.cqrs.commanding.Command;

/**
 * Consistency boundary whose state is derived by replaying its event stream. Subclasses declare command handlers
 * ({@code handle} methods raising events through the command context) and apply methods ({@code apply} methods
 * changing state as a reaction to an event). State must only be changed in apply methods.
 * <p>Aggregates need a no-argument constructor and are stored as JSON through their fields, fields not part of
 * the state should be {@code transient}.</p>
 */
public abstract class Aggregate {
    private String id;
    private int version;
    private transient String checksum;

    protected Aggregate() {
    }

    public String getId() {
        return id;
    }

    /**
     * Number of commits applied to this instance, 0 when the aggregate was never stored.
     * @return version of the aggregate
     */
    public int getVersion() {
        return version;
    }

    void setId(String id) {
        this.id = id;
    }

    void setVersion(int version) {
        this.version = version;
    }

    void updateHash() {
        checksum = ObjectCopier.fingerprint(this);
    }

    /**
     * Check that state did not change since last {@link #updateHash()}. First verification only records the hash.
     */
    void verifyHash() {
        if (checksum == null) {
            updateHash();
        } else if (!checksum.equals(ObjectCopier.fingerprint(this))) {
            throw new IllegalStateException("State of " + this + " was modified outside of apply methods");
        }
    }

    protected boolean isCreated() {
        return version > 0;
    }

    /**
     * Whether a not yet stored aggregate may be created only by commands accepted by
     * {@link #canCreateAggregate(Command)}.
     * @return true by default
     */
    protected boolean requiresExplicitCreate() {
        return true;
    }

    /**
     * Decide whether a command may create this aggregate.
     * @param command the command to be handled
     * @return false by default
     */
    protected boolean canCreateAggregate(Command command) {
        return false;
    }

    /**
     * Verify that the command can be handled by this instance.
     * @param command the command to be handled
     * @throws IllegalStateException when the aggregate does not exist and the command may not create it
     */
    public final void verifyCanHandleCommand(Command command) {
        if (version == 0 && requiresExplicitCreate() && !canCreateAggregate(command)) {
            throw notInitialized();
        }
    }

    protected void verifyInitialized() {
        if (version == 0) {
            throw notInitialized();
        }
    }

    protected void verifyUninitialized() {
        if (version > 0) {
            throw new IllegalStateException(getClass().getSimpleName() + " " + id + " already exists at version "
                    + version);
        }
    }

    private IllegalStateException notInitialized() {
        return new IllegalStateException(getClass().getSimpleName() + " " + id + " has not been created");
    }

    /**
     * Deep copy of this aggregate.
     * @return the copy
     */
    protected Aggregate copy() {
        return ObjectCopier.copy(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + " v" + version + "]";
    }
}
