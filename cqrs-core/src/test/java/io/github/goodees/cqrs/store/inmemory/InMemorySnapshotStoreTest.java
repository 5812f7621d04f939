package io.github.goodees.cqrs.store.inmemory;

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

import io.github.goodees.cqrs.store.Snapshot;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class InMemorySnapshotStoreTest {

    static class State {
        List<String> items = new ArrayList<>();
    }

    @Test
    public void snapshot_is_copied_on_save() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        State state = new State();
        state.items.add("a");
        store.save(new Snapshot("s", 1, state));
        state.items.add("b");
        State read = (State) store.getLastSnapshot(State.class, "s").get().getState();
        assertEquals(1, read.items.size());
    }

    @Test
    public void latest_snapshot_not_newer_than_maximum_is_returned() {
        InMemorySnapshotStore store = new InMemorySnapshotStore(false);
        store.save(new Snapshot("s", 5, new State()));
        store.save(new Snapshot("s", 10, new State()));
        assertEquals(5, store.getSnapshot(State.class, "s", 9).get().getVersion());
        assertEquals(10, store.getLastSnapshot(State.class, "s").get().getVersion());
        assertFalse(store.getSnapshot(State.class, "s", 4).isPresent());
    }

    @Test
    public void replacing_store_keeps_single_snapshot() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        store.save(new Snapshot("s", 5, new State()));
        store.save(new Snapshot("s", 10, new State()));
        assertEquals(1, store.countSnapshots("s"));
    }

    @Test
    public void snapshot_of_other_type_is_ignored() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        store.save(new Snapshot("s", 5, new State()));
        assertFalse(store.getLastSnapshot(String.class, "s").isPresent());
        assertTrue(store.getLastSnapshot(State.class, "s").isPresent());
    }
}
