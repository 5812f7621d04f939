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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Background writer collecting items and writing them in batches. A batch is written when it is full, or when no
 * more items arrive within flush interval. Failed batches are logged and dropped, so only writes that may be
 * repeated or lost belong here.
 * <p>Closing lets the worker finish the batch it is writing, and writes everything added before close.</p>
 * @param <T> type of items
 */
public class JdbcBatchOperation<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JdbcBatchOperation.class);
    private static final Object STOP = new Object();

    /**
     * Writes single batch within a connection.
     */
    @FunctionalInterface
    public interface BatchWriter<T> {
        void write(Connection connection, List<T> items) throws SQLException;
    }

    private final String name;
    private final DataSource dataSource;
    private final BatchWriter<T> writer;
    private final int batchSize;
    private final Duration flushInterval;
    // items and the stop marker
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final Object lock = new Object();
    // guarded by lock
    private int unwritten;
    private boolean closed;
    private final Thread worker;

    public JdbcBatchOperation(String name, DataSource dataSource, BatchWriter<T> writer, int batchSize,
            Duration flushInterval) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.dataSource = Objects.requireNonNull(dataSource, "Data source must be specified");
        this.writer = Objects.requireNonNull(writer, "Writer must be specified");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        }
        this.batchSize = batchSize;
        this.flushInterval = Objects.requireNonNull(flushInterval, "Flush interval must be specified");
        this.worker = new Thread(this::run, "jdbc-batch-" + name);
        this.worker.setDaemon(true);
        this.worker.start();
    }

    public void add(T item) {
        Objects.requireNonNull(item, "Item must be specified");
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Batch operation " + name + " is closed");
            }
            unwritten++;
            queue.add(item);
        }
    }

    /**
     * Number of items not written yet.
     */
    public int pending() {
        synchronized (lock) {
            return unwritten;
        }
    }

    private void run() {
        boolean stopping = false;
        while (!stopping) {
            List<T> batch = new ArrayList<>(batchSize);
            try {
                Object next = queue.take();
                while (next != STOP) {
                    batch.add(itemOf(next));
                    next = batch.size() < batchSize
                            ? queue.poll(flushInterval.toMillis(), TimeUnit.MILLISECONDS)
                            : null;
                    if (next == null) {
                        break;
                    }
                }
                stopping = next == STOP;
            } catch (InterruptedException e) {
                logger.warn("Batch operation {} interrupted, remaining items are written on close", name);
                Thread.currentThread().interrupt();
                stopping = true;
            }
            if (!batch.isEmpty()) {
                write(batch);
            }
        }
        logger.debug("Batch operation {} stopped", name);
    }

    @SuppressWarnings("unchecked")
    private T itemOf(Object queued) {
        return (T) queued;
    }

    /**
     * Write queued items in the calling thread and wait for batches the worker is writing.
     * @throws InterruptedException when interrupted while waiting for the worker
     */
    public void flush() throws InterruptedException {
        List<Object> drained = new ArrayList<>();
        queue.drainTo(drained);
        List<T> batch = new ArrayList<>(batchSize);
        for (Object next : drained) {
            if (next == STOP) {
                // belongs to the worker
                queue.add(STOP);
                continue;
            }
            batch.add(itemOf(next));
            if (batch.size() == batchSize) {
                write(batch);
                batch = new ArrayList<>(batchSize);
            }
        }
        if (!batch.isEmpty()) {
            write(batch);
        }
        synchronized (lock) {
            while (unwritten > 0) {
                lock.wait();
            }
        }
    }

    private void write(List<T> batch) {
        try (Connection connection = dataSource.getConnection()) {
            writer.write(connection, batch);
            logger.trace("Batch operation {} wrote {} items", name, batch.size());
        } catch (SQLException | RuntimeException e) {
            logger.error("Batch operation {} failed to write {} items", name, batch.size(), e);
        } finally {
            synchronized (lock) {
                unwritten -= batch.size();
                lock.notifyAll();
            }
        }
    }

    /**
     * Stop accepting items, wait for the worker to finish its batch and write the rest.
     * @throws InterruptedException when interrupted while waiting
     */
    @Override
    public void close() throws InterruptedException {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            queue.add(STOP);
        }
        worker.join();
        flush();
    }
}
