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

import org.junit.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JdbcBatchOperationTest extends JdbcTest {

    @Test
    public void items_are_written_in_batches() throws Exception {
        List<Integer> batchSizes = Collections.synchronizedList(new ArrayList<>());
        List<Integer> written = Collections.synchronizedList(new ArrayList<>());
        JdbcBatchOperation<Integer> batch = new JdbcBatchOperation<>(name(), ds, (connection, items) -> {
            batchSizes.add(items.size());
            written.addAll(items);
        }, 3, Duration.ofSeconds(10));
        for (int i = 0; i < 7; i++) {
            batch.add(i);
        }
        batch.close();
        assertEquals(7, written.size());
        for (Integer size : batchSizes) {
            assertTrue("Batch of " + size, size <= 3);
        }
        assertEquals(0, batch.pending());
    }

    @Test
    public void failed_batch_is_dropped() throws Exception {
        List<Integer> written = Collections.synchronizedList(new ArrayList<>());
        JdbcBatchOperation<Integer> batch = new JdbcBatchOperation<>(name(), ds, (connection, items) -> {
            if (items.contains(1)) {
                throw new SQLException("refused");
            }
            written.addAll(items);
        }, 1, Duration.ofMillis(10));
        batch.add(1);
        batch.add(2);
        batch.flush();
        assertEquals(Collections.singletonList(2), written);
        assertEquals(0, batch.pending());
        batch.close();
    }

    @Test
    public void close_waits_for_batch_being_written() throws Exception {
        CountDownLatch writing = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        List<Integer> written = Collections.synchronizedList(new ArrayList<>());
        JdbcBatchOperation<Integer> batch = new JdbcBatchOperation<>(name(), ds, (connection, items) -> {
            writing.countDown();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw new SQLException("Write interrupted", e);
            }
            written.addAll(items);
        }, 1, Duration.ofMillis(10));
        batch.add(1);
        assertTrue(writing.await(1, TimeUnit.SECONDS));
        batch.add(2);
        batch.close();
        assertFalse(interrupted.get());
        assertEquals(Arrays.asList(1, 2), written);
        assertEquals(0, batch.pending());
    }

    @Test
    public void items_accepted_while_closing_are_written() throws Exception {
        AtomicInteger written = new AtomicInteger();
        AtomicInteger accepted = new AtomicInteger();
        JdbcBatchOperation<Integer> batch = new JdbcBatchOperation<>(name(), ds,
            (connection, items) -> written.addAndGet(items.size()), 5, Duration.ofMillis(5));
        ExecutorService producers = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (int p = 0; p < 4; p++) {
            producers.submit(() -> {
                start.await();
                for (int i = 0; i < 1000; i++) {
                    try {
                        batch.add(i);
                    } catch (IllegalStateException e) {
                        return null;
                    }
                    accepted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        Thread.sleep(5);
        batch.close();
        producers.shutdown();
        assertTrue(producers.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(accepted.get(), written.get());
    }

    @Test
    public void closing_twice_is_harmless() throws Exception {
        JdbcBatchOperation<Integer> batch = new JdbcBatchOperation<>(name(), ds, (connection, items) -> {
        }, 1, Duration.ofMillis(10));
        batch.close();
        batch.close();
    }

    @Test(expected = IllegalStateException.class)
    public void closed_operation_rejects_items() throws Exception {
        JdbcBatchOperation<Integer> batch = new JdbcBatchOperation<>(name(), ds, (connection, items) -> {
        }, 1, Duration.ofMillis(10));
        batch.close();
        batch.add(1);
    }
}
