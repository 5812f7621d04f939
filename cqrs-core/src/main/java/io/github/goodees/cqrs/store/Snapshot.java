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

import java.util.Objects;

/**
 * Stored state of an aggregate at given version.
 */
public final class Snapshot {
    private final String streamId;
    private final int version;
    private final Object state;

    public Snapshot(String streamId, int version, Object state) {
        this.streamId = Objects.requireNonNull(streamId, "Stream id must be specified");
        if (version < 1) {
            throw new IllegalArgumentException("Snapshot version must be positive, was " + version);
        }
        this.version = version;
        this.state = Objects.requireNonNull(state, "Snapshot state must be specified");
    }

    public String getStreamId() {
        return streamId;
    }

    public int getVersion() {
        return version;
    }

    public Object getState() {
        return state;
    }

    @Override
    public String toString() {
        return "Snapshot[" + streamId + " v" + version + "]";
    }
}
