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

import static org.junit.Assert.assertEquals;

public class PageTest {

    @Test
    public void next_page_skips_current_one() {
        Page page = new Page(0, 10).nextPage().nextPage();
        assertEquals(new Page(20, 10), page);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negative_skip_is_rejected() {
        new Page(-1, 10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty_page_is_rejected() {
        new Page(0, 0);
    }
}
