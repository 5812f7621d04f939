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

/**
 * Window over an ordered result: skip the first {@code skip} items and take at most {@code take}.
 */
public final class Page {
    private final long skip;
    private final long take;

    public Page(long skip, long take) {
        if (skip < 0) {
            throw new IllegalArgumentException("Skip must not be negative, was " + skip);
        }
        if (take <= 0) {
            throw new IllegalArgumentException("Take must be positive, was " + take);
        }
        this.skip = skip;
        this.take = take;
    }

    public long getSkip() {
        return skip;
    }

    public long getTake() {
        return take;
    }

    public Page nextPage() {
        return new Page(skip + take, take);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Page)) {
            return false;
        }
        Page other = (Page) o;
        return skip == other.skip && take == other.take;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(skip) + Long.hashCode(take);
    }

    @Override
    public String toString() {
        return skip + " - " + (skip + take);
    }
}
