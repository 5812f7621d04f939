package io.github.goodees.cqrs.saga;

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

import io.github.goodees.cqrs.example.TransferSaga;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SagaLockTableTest {
    private final SagaLockTable locks = new SagaLockTable();

    private Thread acquireInBackground(String id, CountDownLatch acquired) {
        Thread thread = new Thread(() -> {
            try (SagaLockTable.SagaLock lock = locks.acquire(TransferSaga.class, id)) {
                acquired.countDown();
            }
        });
        thread.start();
        return thread;
    }

    @Test
    public void same_saga_is_locked_exclusively() throws InterruptedException {
        CountDownLatch acquired = new CountDownLatch(1);
        Thread waiter;
        try (SagaLockTable.SagaLock lock = locks.acquire(TransferSaga.class, "t1")) {
            waiter = acquireInBackground("t1", acquired);
            assertFalse(acquired.await(100, TimeUnit.MILLISECONDS));
        }
        assertTrue(acquired.await(1, TimeUnit.SECONDS));
        waiter.join();
    }

    @Test
    public void other_saga_is_not_blocked() throws InterruptedException {
        CountDownLatch acquired = new CountDownLatch(1);
        try (SagaLockTable.SagaLock lock = locks.acquire(TransferSaga.class, "t1")) {
            acquireInBackground("t2", acquired).join(1000);
            assertEquals(0, acquired.getCount());
        }
    }

    @Test
    public void released_locks_are_removed() throws InterruptedException {
        CountDownLatch acquired = new CountDownLatch(1);
        Thread waiter;
        try (SagaLockTable.SagaLock lock = locks.acquire(new SagaReference(TransferSaga.class, "t1"))) {
            waiter = acquireInBackground("t1", acquired);
            assertEquals(1, locks.size());
        }
        waiter.join();
        assertEquals(0, locks.size());
    }

    @Test
    public void closing_twice_releases_once() {
        SagaLockTable.SagaLock first = locks.acquire(TransferSaga.class, "t1");
        SagaLockTable.SagaLock second = locks.acquire(TransferSaga.class, "t1");
        first.close();
        first.close();
        assertEquals(1, locks.size());
        second.close();
        assertEquals(0, locks.size());
    }
}
