package io.github.goodees.cqrs.config;

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
import java.util.Properties;

/**
 * Settings of the JDBC commit log.
 * <ul>
 * <li>{@code pageSize}: number of commits read per query. Default 100.</li>
 * <li>{@code detectDuplicateCommits}: whether the unique index on commit id is maintained. Default true.</li>
 * <li>{@code async}: whether dispatched marks are written in background batches. Default false.</li>
 * <li>{@code batchSize}, {@code flushInterval}: parameters of background batches. Defaults 100 and 50 ms.</li>
 * </ul>
 */
public final class EventStoreSettings {
    private final long pageSize;
    private final boolean detectDuplicateCommits;
    private final boolean async;
    private final int batchSize;
    private final Duration flushInterval;

    private EventStoreSettings(long pageSize, boolean detectDuplicateCommits, boolean async, int batchSize,
            Duration flushInterval) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, was " + pageSize);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        }
        this.pageSize = pageSize;
        this.detectDuplicateCommits = detectDuplicateCommits;
        this.async = async;
        this.batchSize = batchSize;
        this.flushInterval = flushInterval;
    }

    public static EventStoreSettings defaults() {
        return new EventStoreSettings(100, true, false, 100, Duration.ofMillis(50));
    }

    public static EventStoreSettings fromProperties(Properties properties, String prefix) {
        EventStoreSettings defaults = defaults();
        PropertyReader reader = new PropertyReader(properties, prefix);
        return new EventStoreSettings(reader.getLong("pageSize", defaults.pageSize),
                reader.getBoolean("detectDuplicateCommits", defaults.detectDuplicateCommits),
                reader.getBoolean("async", defaults.async),
                reader.getInt("batchSize", defaults.batchSize),
                reader.getDuration("flushInterval", defaults.flushInterval));
    }

    public long getPageSize() {
        return pageSize;
    }

    public boolean isDetectDuplicateCommits() {
        return detectDuplicateCommits;
    }

    public boolean isAsync() {
        return async;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public EventStoreSettings withPageSize(long pageSize) {
        return new EventStoreSettings(pageSize, detectDuplicateCommits, async, batchSize, flushInterval);
    }

    public EventStoreSettings withDetectDuplicateCommits(boolean detectDuplicateCommits) {
        return new EventStoreSettings(pageSize, detectDuplicateCommits, async, batchSize, flushInterval);
    }

    public EventStoreSettings withAsync(boolean async) {
        return new EventStoreSettings(pageSize, detectDuplicateCommits, async, batchSize, flushInterval);
    }

    public EventStoreSettings withBatchSize(int batchSize) {
        return new EventStoreSettings(pageSize, detectDuplicateCommits, async, batchSize, flushInterval);
    }

    public EventStoreSettings withFlushInterval(Duration flushInterval) {
        return new EventStoreSettings(pageSize, detectDuplicateCommits, async, batchSize, flushInterval);
    }
}
