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

import io.github.goodees.cqrs.config.SnapshotStoreSettings;
import io.github.goodees.cqrs.example.Account;
import io.github.goodees.cqrs.store.Snapshot;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JdbcSnapshotStoreTest extends JdbcTest {

    static class Counter {
        int value;

        Counter() {
        }

        Counter(int value) {
            this.value = value;
        }
    }

    @Test
    public void first_snapshot_inserted() {
        snapshotStore.save(new Snapshot(name(), 1, new Counter(10)));
        assertDb(1, "select count(*) from snapshots where stream_id = ? and version = ?", name(), 1);
    }

    @Test
    public void next_snapshot_replaces_previous() {
        snapshotStore.save(new Snapshot(name(), 1, new Counter(10)));
        snapshotStore.save(new Snapshot(name(), 2, new Counter(20)));
        assertDb(0, "select count(*) from snapshots where stream_id = ? and version = ?", name(), 1);
        assertDb(1, "select count(*) from snapshots where stream_id = ? and version = ?", name(), 2);
    }

    @Test
    public void snapshots_are_kept_when_not_replacing() {
        JdbcSnapshotStore keeping = new JdbcSnapshotStore(ds, schema,
                SnapshotStoreSettings.defaults().withReplaceExisting(false));
        keeping.save(new Snapshot(name(), 1, new Counter(10)));
        keeping.save(new Snapshot(name(), 2, new Counter(20)));
        assertDb(2, "select count(*) from snapshots where stream_id = ?", name());
        assertEquals(10, ((Counter) keeping.getSnapshot(Counter.class, name(), 1).get().getState()).value);
    }

    @Test
    public void snapshot_deserialized() {
        snapshotStore.save(new Snapshot(name(), 8, new Counter(10)));
        Optional<Snapshot> snapshot = snapshotStore.getLastSnapshot(Counter.class, name());
        assertTrue(snapshot.isPresent());
        assertEquals(8, snapshot.get().getVersion());
        assertEquals(10, ((Counter) snapshot.get().getState()).value);
    }

    @Test
    public void snapshot_of_other_type_is_ignored() {
        snapshotStore.save(new Snapshot(name(), 3, new Counter(10)));
        assertFalse(snapshotStore.getLastSnapshot(Account.class, name()).isPresent());
    }

    @Test
    public void corrupt_snapshot_is_ignored() {
        snapshotStore.save(new Snapshot(name(), 3, new Counter(10)));
        template.update("update snapshots set payload = 'not json' where stream_id = ?", name());
        assertFalse(snapshotStore.getLastSnapshot(Counter.class, name()).isPresent());
    }

    @Test
    public void snapshots_are_written_in_background() throws Exception {
        try (JdbcSnapshotStore asyncStore = new JdbcSnapshotStore(ds, schema,
                SnapshotStoreSettings.defaults().withAsync(true))) {
            asyncStore.save(new Snapshot(name(), 4, new Counter(1)));
            asyncStore.flush();
            assertDb(1, "select count(*) from snapshots where stream_id = ?", name());
        }
    }
}
