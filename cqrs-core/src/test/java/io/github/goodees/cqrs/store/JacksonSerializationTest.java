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

import io.github.goodees.cqrs.UnknownTypeException;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.example.AccountEvents;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;

public class JacksonSerializationTest {
    private final JacksonSerialization<CommitData> serialization = new JacksonSerialization<>(CommitData.class);

    @Test
    public void events_keep_their_types() {
        CommitData data = new CommitData(Collections.singletonMap("user", "joe"),
                Arrays.<Event>asList(new AccountEvents.Opened("joe"), new AccountEvents.Deposited(10)));
        CommitData read = serialization.deserialize(1, serialization.serialize(data), null);
        assertEquals("joe", read.getHeaders().get("user"));
        assertThat(read.getEvents().get(0), instanceOf(AccountEvents.Opened.class));
        assertEquals(10, ((AccountEvents.Deposited) read.getEvents().get(1)).getAmount());
    }

    @Test(expected = UnknownTypeException.class)
    public void unknown_type_name_is_reported() {
        new JacksonSerialization<>(Object.class).deserialize(1, "{}", "com.example.Missing");
    }
}
