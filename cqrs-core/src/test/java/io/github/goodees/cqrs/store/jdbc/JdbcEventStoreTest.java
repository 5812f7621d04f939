package io.github.goodees.cqrs.store.jdbc;

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

import io.github.goodees.cqrs.config.EventStoreSettings;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.example.AccountEvents;
import io.github.goodees.cqrs.store.Commit;
import io.github.goodees.cqrs.store.EventStoreException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JdbcEventStoreTest extends JdbcTest {

    private Commit commit(int version) {
        return commit(UUID.randomUUID(), version);
    }

    private Commit commit(UUID commitId, int version) {
        return new Commit(commitId, name(), version, Collections.singletonMap("user", "joe"),
                Arrays.<Event>asList(new AccountEvents.Deposited(version * 10), new AccountEvents.Withdrawn(1)));
    }

    private static <T> List<T> list(Iterable<T> items) {
        List<T> result = new ArrayList<>();
        items.forEach(result::add);
        return result;
    }

    @Test
    public void commit_is_persisted() throws EventStoreException {
        Commit stored = eventStore.save(commit(1));
        assertNotNull(stored.getId());
        assertDb(1, "select count(*) from commits where stream_id = ?", name());
        assertDb(0, "select count(*) from commits where stream_id = ? and dispatched = true", name());
    }

    @Test
    public void stream_is_read_across_pages() throws EventStoreException {
        for (int i = 1; i <= 5; i++) {
            eventStore.save(commit(i));
        }
        List<Commit> commits = list(eventStore.getStream(name()));
        assertEquals(5, commits.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(i + 1, commits.get(i).getVersion());
        }
        Commit last = commits.get(4);
        assertEquals("joe", last.getHeaders().get("user"));
        assertThat(last.getEvents().get(0), instanceOf(AccountEvents.Deposited.class));
        assertEquals(50, ((AccountEvents.Deposited) last.getEvents().get(0)).getAmount());
    }

    @Test
    public void stream_is_read_from_minimum_version() throws EventStoreException {
        for (int i = 1; i <= 4; i++) {
            eventStore.save(commit(i));
        }
        List<Commit> commits = list(eventStore.getStream(name(), 3));
        assertEquals(2, commits.size());
        assertEquals(3, commits.get(0).getVersion());
    }

    @Test
    public void existing_version_fails_optimistic_lock() throws EventStoreException {
        eventStore.save(commit(1));
        try {
            eventStore.save(commit(1));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
            assertDb(1, "select count(*) from commits where stream_id = ?", name());
        }
    }

    @Test
    public void version_gap_is_rejected() throws EventStoreException {
        eventStore.save(commit(1));
        try {
            eventStore.save(commit(3));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(1, "select count(*) from commits where stream_id = ?", name());
        }
        eventStore.save(commit(2));
        assertDb(2, "select count(*) from commits where stream_id = ?", name());
    }

    @Test
    public void first_commit_must_have_version_one() {
        try {
            eventStore.save(commit(2));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    @Test
    public void repeated_commit_id_is_duplicate() throws EventStoreException {
        UUID commitId = UUID.randomUUID();
        eventStore.save(commit(commitId, 1));
        try {
            eventStore.save(commit(commitId, 2));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.DUPLICATE_COMMIT, e.getFault());
            assertDb(1, "select count(*) from commits where stream_id = ?", name());
        }
    }

    @Test
    public void undispatched_commits_are_listed_until_marked() throws EventStoreException {
        Commit first = eventStore.save(commit(1));
        Commit second = eventStore.save(commit(2));
        eventStore.markDispatched(first.getId());
        List<Long> undispatched = new ArrayList<>();
        for (Commit commit : eventStore.getUndispatched()) {
            undispatched.add(commit.getId());
        }
        assertFalse(undispatched.contains(first.getId()));
        assertTrue(undispatched.contains(second.getId()));
        assertDb(1, "select count(*) from commits where stream_id = ? and dispatched = true", name());
    }

    @Test
    public void dispatched_marks_are_written_in_background() throws Exception {
        try (JdbcEventStore asyncStore = new JdbcEventStore(ds, schema,
                EventStoreSettings.defaults().withAsync(true))) {
            Commit stored = asyncStore.save(commit(1));
            asyncStore.markDispatched(stored.getId());
            asyncStore.flush();
            assertDb(1, "select count(*) from commits where stream_id = ? and dispatched = true", name());
        }
    }

    @Test
    public void streams_are_listed_across_pages() throws EventStoreException {
        for (String suffix : new String[] { "-a", "-b", "-c" }) {
            eventStore.save(new Commit(UUID.randomUUID(), name() + suffix, 1, null,
                    Collections.<Event>emptyList()));
        }
        assertThat(list(eventStore.getStreams()), hasItems(name() + "-a", name() + "-b", name() + "-c"));
    }

    @Test
    public void range_is_ordered_by_sequence() throws EventStoreException {
        eventStore.purge();
        Commit first = eventStore.save(commit(1));
        Commit second = eventStore.save(commit(2));
        Commit third = eventStore.save(commit(3));
        List<Commit> range = eventStore.getRange(1, 10);
        assertEquals(2, range.size());
        assertEquals(second.getId(), range.get(0).getId());
        assertEquals(third.getId(), range.get(1).getId());
        assertTrue(first.getId() < second.getId());
    }

    @Test
    public void deleted_stream_is_gone() throws EventStoreException {
        eventStore.save(commit(1));
        eventStore.save(commit(2));
        eventStore.deleteStream(name());
        assertDb(0, "select count(*) from commits where stream_id = ?", name());
    }

    @Test
    public void migration_rewrites_events() throws EventStoreException {
        Commit stored = eventStore.save(commit(1));
        eventStore.migrate(stored.getId(), Collections.singletonMap("migrated", "yes"),
            Collections.<Event>singletonList(new AccountEvents.Deposited(999)));
        Commit migrated = list(eventStore.getStream(name())).get(0);
        assertEquals("yes", migrated.getHeaders().get("migrated"));
        assertEquals(1, migrated.getEvents().size());
        assertEquals(999, ((AccountEvents.Deposited) migrated.getEvents().get(0)).getAmount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void migrating_missing_commit_fails() {
        eventStore.migrate(-1, Collections.<String, String>emptyMap(), Collections.<Event>emptyList());
    }
}
