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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy sequence over a paged source. Pages are fetched only as iteration reaches them, and iteration stops after the
 * first page that returns fewer items than the page size.
 * <p>The retriever gets the last item of the previous page, so that stores can continue with keyset pagination
 * instead of offsets.</p>
 * @param <T> type of items
 */
public final class PagedResult<T> implements Iterable<T> {
    private final long pageSize;
    private final PageRetriever<T> retriever;

    @FunctionalInterface
    public interface PageRetriever<T> {
        /**
         * Retrieve single page.
         * @param lastResult last item of previous page, {@code null} for the first page
         * @param page the page to retrieve
         * @return at most {@code page.getTake()} items
         */
        Iterable<T> retrieve(T lastResult, Page page);
    }

    public PagedResult(long pageSize, PageRetriever<T> retriever) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, was " + pageSize);
        }
        this.pageSize = pageSize;
        this.retriever = Objects.requireNonNull(retriever, "Retriever must be specified");
    }

    @Override
    public Iterator<T> iterator() {
        return new PagedIterator();
    }

    class PagedIterator implements Iterator<T> {
        private Page page = new Page(0, pageSize);
        private Iterator<T> current;
        private T lastResult;
        private long count;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            while (true) {
                if (current != null && current.hasNext()) {
                    return true;
                }
                if (exhausted) {
                    return false;
                }
                if (current != null) {
                    if (count < page.getTake()) {
                        exhausted = true;
                        return false;
                    }
                    page = page.nextPage();
                }
                current = fetch();
                count = 0;
            }
        }

        private Iterator<T> fetch() {
            Iterable<T> results = retriever.retrieve(lastResult, page);
            if (results == null) {
                return Collections.emptyIterator();
            }
            if (results instanceof Collection && ((Collection<?>) results).size() > page.getTake()) {
                throw pageExceeded();
            }
            return results.iterator();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T result = current.next();
            if (++count > page.getTake()) {
                throw pageExceeded();
            }
            lastResult = result;
            return result;
        }

        private IllegalStateException pageExceeded() {
            return new IllegalStateException("Retriever returned more than " + page.getTake() + " items for page "
                    + page);
        }
    }
}
