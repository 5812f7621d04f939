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
 * Settings of the JDBC snapshot store.
 * <ul>
 * <li>{@code replaceExisting}: keep only latest snapshot per stream. Default true.</li>
 * <li>{@code async}: write snapshots in background batches. Default false.</li>
 * <li>{@code batchSize}, {@code flushInterval}: parameters of background batches. Defaults 100 and 50 ms.</li>
 * </ul>
 */
public final class SnapshotStoreSettings {
    private final boolean replaceExisting;
    private final boolean async;
    private final int batchSize;
    private final Duration flushInterval;

    private SnapshotStoreSettings(boolean replaceExisting, boolean async, int batchSize, Duration flushInterval) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        }
        this.replaceExisting = replaceExisting;
        this.async = async;
        this.batchSize = batchSize;
        this.flushInterval = flushInterval;
    }

    public static SnapshotStoreSettings defaults() {
        return new SnapshotStoreSettings(true, false, 100, Duration.ofMillis(50));
    }

    public static SnapshotStoreSettings fromProperties(Properties properties, String prefix) {
        SnapshotStoreSettings defaults = defaults();
        PropertyReader reader = new PropertyReader(properties, prefix);
        return new SnapshotStoreSettings(reader.getBoolean("replaceExisting", defaults.replaceExisting),
                reader.getBoolean("async", defaults.async),
                reader.getInt("batchSize", defaults.batchSize),
                reader.getDuration("flushInterval", defaults.flushInterval));
    }

    public boolean isReplaceExisting() {
        return replaceExisting;
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

    public SnapshotStoreSettings withReplaceExisting(boolean replaceExisting) {
        return new SnapshotStoreSettings(replaceExisting, async, batchSize, flushInterval);
    }

    public SnapshotStoreSettings withAsync(boolean async) {
        return new SnapshotStoreSettings(replaceExisting, async, batchSize, flushInterval);
    }

    public SnapshotStoreSettings withBatchSize(int batchSize) {
        return new SnapshotStoreSettings(replaceExisting, async, batchSize, flushInterval);
    }

    public SnapshotStoreSettings withFlushInterval(Duration flushInterval) {
        return new SnapshotStoreSettings(replaceExisting, async, batchSize, flushInterval);
    }
}
