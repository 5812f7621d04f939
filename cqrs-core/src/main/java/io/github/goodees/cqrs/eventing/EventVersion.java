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

/**
 * Position of an event within the stream: version of its commit, number of events in that commit, and index of the
 * event within the commit.
 */
public final class EventVersion implements Comparable<EventVersion> {
    /**
     * Version of events that do not originate from a stored commit.
     */
    public static final EventVersion EMPTY = new EventVersion();

    private final int version;
    private final int count;
    private final int item;

    private EventVersion() {
        this.version = 0;
        this.count = 0;
        this.item = 0;
    }

    public EventVersion(int version, int count, int item) {
        if (version < 1) {
            throw new IllegalArgumentException("Version must be positive, was " + version);
        }
        if (count < 1) {
            throw new IllegalArgumentException("Count must be positive, was " + count);
        }
        if (item < 0 || item >= count) {
            throw new IllegalArgumentException("Item must be within 0 and " + (count - 1) + ", was " + item);
        }
        this.version = version;
        this.count = count;
        this.item = item;
    }

    public int getVersion() {
        return version;
    }

    public int getCount() {
        return count;
    }

    public int getItem() {
        return item;
    }

    @Override
    public int compareTo(EventVersion o) {
        int result = Integer.compare(version, o.version);
        return result != 0 ? result : Integer.compare(item, o.item);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventVersion)) {
            return false;
        }
        EventVersion other = (EventVersion) o;
        return version == other.version && count == other.count && item == other.item;
    }

    @Override
    public int hashCode() {
        return (version * 31 + count) * 31 + item;
    }

    @Override
    public String toString() {
        return version + ":" + item + "/" + count;
    }
}
