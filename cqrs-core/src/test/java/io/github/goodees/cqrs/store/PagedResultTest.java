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

import org.junit.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

public class PagedResultTest {

    private static List<Long> numbers(long from, long to) {
        return LongStream.range(from, to).boxed().collect(Collectors.toList());
    }

    @Test
    public void all_pages_are_iterated() {
        List<Page> requested = new ArrayList<>();
        PagedResult<Long> result = new PagedResult<>(3, (last, page) -> {
            requested.add(page);
            return numbers(page.getSkip(), Math.min(page.getSkip() + page.getTake(), 7));
        });
        List<Long> items = new ArrayList<>();
        result.forEach(items::add);
        assertEquals(numbers(0, 7), items);
        assertEquals(3, requested.size());
    }

    @Test
    public void full_last_page_is_followed_by_empty_one() {
        List<Page> requested = new ArrayList<>();
        PagedResult<Long> result = new PagedResult<>(3, (last, page) -> {
            requested.add(page);
            return numbers(page.getSkip(), Math.min(page.getSkip() + page.getTake(), 6));
        });
        List<Long> items = new ArrayList<>();
        result.forEach(items::add);
        assertEquals(6, items.size());
        assertEquals(3, requested.size());
    }

    @Test
    public void last_result_is_passed_to_next_page() {
        List<Long> lastResults = new ArrayList<>();
        PagedResult<Long> result = new PagedResult<>(2, (last, page) -> {
            lastResults.add(last);
            long from = last == null ? 0 : last + 1;
            return numbers(from, Math.min(from + page.getTake(), 5));
        });
        result.forEach(i -> { });
        assertNull(lastResults.get(0));
        assertEquals(Long.valueOf(1), lastResults.get(1));
        assertEquals(Long.valueOf(3), lastResults.get(2));
    }

    @Test
    public void pages_are_fetched_lazily() {
        List<Page> requested = new ArrayList<>();
        PagedResult<Long> result = new PagedResult<>(2, (last, page) -> {
            requested.add(page);
            return numbers(page.getSkip(), page.getSkip() + page.getTake());
        });
        Iterator<Long> iterator = result.iterator();
        assertEquals(0, requested.size());
        iterator.next();
        iterator.next();
        assertEquals(1, requested.size());
        iterator.next();
        assertEquals(2, requested.size());
    }

    @Test
    public void empty_source_yields_nothing() {
        PagedResult<Long> result = new PagedResult<>(5, (last, page) -> new ArrayList<>());
        assertFalse(result.iterator().hasNext());
    }

    @Test(expected = IllegalStateException.class)
    public void oversized_page_is_rejected() {
        PagedResult<Long> result = new PagedResult<>(2, (last, page) -> numbers(0, 3));
        result.iterator().next();
    }
}
