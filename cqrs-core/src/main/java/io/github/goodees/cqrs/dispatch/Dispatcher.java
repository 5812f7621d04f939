package io.github.goodees.cqrs.dispatch;

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

import java.time.Instant;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Partitioned task dispatcher. Every task carries a partition key, and is assigned to one of
 * {@linkplain DispatcherConfiguration#maximumConcurrencyLevel() N} mailboxes by hash of the key. Tasks of the same
 * mailbox run one at a time in submission order, tasks of different mailboxes run in parallel.
 * <p>At most {@linkplain DispatcherConfiguration#boundedCapacity() capacity} tasks may be pending, further
 * submissions block until a task finishes. A task must therefore never submit to the dispatcher it runs on and wait
 * for the result.</p>
 * <p>The dispatcher does not retry tasks, retry policies belong to the tasks themselves.</p>
 */
public class Dispatcher {

    private final DispatcherConfiguration conf;
    private final ConcurrentMap<Integer, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Semaphore capacity;
    private final Logger logger;

    public Dispatcher(DispatcherConfiguration conf) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.capacity = new Semaphore(conf.boundedCapacity(), true);
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Schedule a task.
     * The task is added to mailbox of its partition, and that mailbox is scheduled for dequeue. The response is
     * returned immediately, as it is just a holder for future result that completes when the task completes. It
     * completes exceptionally with whatever exception the task has thrown.
     *
     * @param key  partition key
     * @param task task to run
     * @param <T>  type of result
     * @return the promise for the result
     */
    public <T> CompletableFuture<T> execute(Object key, Callable<T> task) {
        Objects.requireNonNull(key, "Partition key must be specified");
        Objects.requireNonNull(task, "Task must be specified");
        acquireCapacity(key);
        Mailbox mailbox = mailboxes.computeIfAbsent(partitionOf(key), Mailbox::new);
        return mailbox.enqueue(key, task);
    }

    /**
     * Partition a key is assigned to.
     * @param key partition key
     * @return partition number between 0 and maximum concurrency level
     */
    public int partitionOf(Object key) {
        return Math.floorMod(key.hashCode(), conf.maximumConcurrencyLevel());
    }

    /**
     * Number of tasks either queued or running.
     * @return pending task count
     */
    public int pendingTasks() {
        return conf.boundedCapacity() - capacity.availablePermits();
    }

    private void acquireCapacity(Object key) {
        if (!capacity.tryAcquire()) {
            logger.debug("Dispatcher is full, waiting to enqueue task for {}", key);
            try {
                capacity.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RejectedExecutionException("Interrupted while waiting for dispatcher capacity", e);
            }
        }
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Queue of tasks for single partition. At this level we're handling the concurrency between adding new task,
     * and executing only single task.
     */
    class Mailbox implements Runnable {
        private final int partition;
        private final Deque<Invocation<?>> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
        private final AtomicReference<Invocation<?>> currentInvocation = new AtomicReference<>();

        Mailbox(int partition) {
            this.partition = partition;
        }

        <T> CompletableFuture<T> enqueue(Object key, Callable<T> task) {
            Invocation<T> inv = new Invocation<>(key, task);
            queue.add(inv);
            if (canStartProcessing()) {
                conf.executorService().submit(this);
            }
            return inv.result;
        }

        private boolean canStartProcessing() {
            int queueSize = enqueuesWhileBusy.getAndIncrement();
            if (queueSize == 0) {
                logger.trace("Will start processing queue of partition {}", partition);
                return true;
            } else {
                logger.trace("Will not start processing the queue of partition {}, {} tasks enqueued during "
                        + "current execution", partition, queueSize);
                return false;
            }
        }

        private boolean canStopProcessing(int observedEnqueues) {
            return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
        }

        /**
         * Process single task.
         * Called when Mailbox is submitted for execution and not processing, but also at end
         * of processing. This way even tasks that arrive during processing will be processed.
         */
        @Override
        public void run() {
            Invocation<?> inv = nextInvocation();
            if (inv != null) {
                if (currentInvocation.compareAndSet(null, inv)) {
                    inv.run();
                } else {
                    logger.error("Submit has run while invocation is in progress. Current invocation: {}, "
                            + "dequeued invocation: {}", currentInvocation, inv);
                    queue.addFirst(inv);
                }
            }
        }

        private Invocation<?> nextInvocation() {
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Invocation<?> inv = queue.poll();
                if (inv == null) {
                    // A task might have been queued between poll and this point. Either canStartProcessing was
                    // called in between and we poll again, or it will return true past the next statement.
                    if (canStopProcessing(enqueues)) {
                        logger.trace("Stopping processing of queue of partition {}", partition);
                        return null;
                    }
                } else {
                    return inv;
                }
            }
        }

        /**
         * Encapsulation of task processing. Whichever of execution and cancellation claims the response first wins,
         * and capacity of the task is released exactly once by the winner.
         * @param <T> type of result
         */
        class Invocation<T> implements Runnable {
            private final Object key;
            private final Callable<T> task;
            private final TaskResponse<T> result = new TaskResponse<>(this::cancelled);
            private final Instant submission = Instant.now();
            private volatile Instant executionStart;

            Invocation(Object key, Callable<T> task) {
                this.key = key;
                this.task = task;
            }

            @Override
            public void run() {
                if (!result.start()) {
                    // cancelled after it was dequeued, so cancellation could not release it
                    logger.info("Invocation attempted to run after it was cancelled: {}", this);
                    capacity.release();
                    finish();
                    return;
                }
                executionStart = Instant.now();
                try {
                    result.succeeded(task.call());
                } catch (Exception e) {
                    logger.debug("Task for {} failed", key, e);
                    result.failed(e);
                } catch (Error e) {
                    result.failed(e);
                    throw e;
                } finally {
                    capacity.release();
                    finish();
                }
            }

            private void finish() {
                if (currentInvocation.compareAndSet(this, null)) {
                    conf.executorService().submit(Mailbox.this);
                } else {
                    logger.error("Invocation finished, but wasn't current invocation: {}", this);
                }
            }

            private void cancelled() {
                if (queue.remove(this)) {
                    capacity.release();
                }
            }

            @Override
            public String toString() {
                return "Invocation[key=" + key + ", partition=" + partition + ", state=" + result.getState()
                        + ", submissionTime=" + submission + ", executionStart=" + executionStart + "]";
            }
        }
    }
}
