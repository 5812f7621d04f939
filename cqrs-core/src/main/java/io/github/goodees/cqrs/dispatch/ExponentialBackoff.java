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

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Waiting strategy for retries. The first wait is 5 milliseconds, every further wait doubles, capped by the maximum
 * wait and by the time remaining until the timeout. Instances are not thread safe, create one per retried operation.
 */
public final class ExponentialBackoff {
    private static final Duration INITIAL_WAIT = Duration.ofMillis(5);

    private final long deadline;
    private final Duration maximumWait;
    private Duration wait = Duration.ZERO;

    public ExponentialBackoff(Duration timeout) {
        this(timeout, timeout);
    }

    public ExponentialBackoff(Duration timeout, Duration maximumWait) {
        Objects.requireNonNull(timeout, "Timeout must be specified");
        this.maximumWait = Objects.requireNonNull(maximumWait, "Maximum wait must be specified");
        this.deadline = System.nanoTime() + timeout.toNanos();
    }

    boolean canRetry() {
        return System.nanoTime() - deadline < 0;
    }

    /**
     * Sleep before next attempt.
     * @throws InterruptedException when interrupted while sleeping
     */
    public void waitUntilRetry() throws InterruptedException {
        wait = wait.isZero() ? INITIAL_WAIT : wait.multipliedBy(2);
        if (wait.compareTo(maximumWait) > 0) {
            wait = maximumWait;
        }
        long sleep = Math.min(wait.toNanos(), deadline - System.nanoTime());
        if (sleep > 0) {
            TimeUnit.NANOSECONDS.sleep(sleep);
        }
    }

    /**
     * Sleep before next attempt, or fail when the timeout has passed.
     * @param lastFailure the failure that is being retried
     * @param message message of timeout exception
     * @throws RetryTimeoutException when no more retries are possible
     */
    public void waitOrTimeout(Exception lastFailure, String message) throws RetryTimeoutException {
        if (!canRetry()) {
            throw new RetryTimeoutException(message, lastFailure);
        }
        try {
            waitUntilRetry();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            RetryTimeoutException timeout = new RetryTimeoutException(message, lastFailure);
            timeout.addSuppressed(e);
            throw timeout;
        }
    }

    Duration currentWait() {
        return wait;
    }
}
