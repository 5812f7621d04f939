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
import java.util.Objects;
import java.util.Properties;

/**
 * Settings of aggregate stores.
 * <ul>
 * <li>{@code snapshotInterval}: a snapshot is stored whenever aggregate version is a multiple of it. Default 10.</li>
 * <li>{@code saveRetryTimeout}: how long transient failures of commit storage are retried. Default 10 seconds.</li>
 * <li>{@code cacheCapacity}: number of aggregates kept by caching store. Default 1000.</li>
 * <li>{@code applyOptional}: whether aggregates may ignore events they have no apply method for. Default true.</li>
 * </ul>
 */
public final class AggregateStoreSettings {
    private static final AggregateStoreSettings DEFAULTS = new AggregateStoreSettings(10, Duration.ofSeconds(10),
            1000, true);

    private final int snapshotInterval;
    private final Duration saveRetryTimeout;
    private final int cacheCapacity;
    private final boolean applyOptional;

    private AggregateStoreSettings(int snapshotInterval, Duration saveRetryTimeout, int cacheCapacity,
            boolean applyOptional) {
        if (snapshotInterval < 1) {
            throw new IllegalArgumentException("Snapshot interval must be positive, was " + snapshotInterval);
        }
        if (cacheCapacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive, was " + cacheCapacity);
        }
        this.snapshotInterval = snapshotInterval;
        this.saveRetryTimeout = Objects.requireNonNull(saveRetryTimeout, "Save retry timeout must be specified");
        this.cacheCapacity = cacheCapacity;
        this.applyOptional = applyOptional;
    }

    public static AggregateStoreSettings defaults() {
        return DEFAULTS;
    }

    public static AggregateStoreSettings fromProperties(Properties properties, String prefix) {
        PropertyReader reader = new PropertyReader(properties, prefix);
        return new AggregateStoreSettings(reader.getInt("snapshotInterval", DEFAULTS.snapshotInterval),
                reader.getDuration("saveRetryTimeout", DEFAULTS.saveRetryTimeout),
                reader.getInt("cacheCapacity", DEFAULTS.cacheCapacity),
                reader.getBoolean("applyOptional", DEFAULTS.applyOptional));
    }

    public int getSnapshotInterval() {
        return snapshotInterval;
    }

    public Duration getSaveRetryTimeout() {
        return saveRetryTimeout;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public boolean isApplyOptional() {
        return applyOptional;
    }

    public AggregateStoreSettings withSnapshotInterval(int snapshotInterval) {
        return new AggregateStoreSettings(snapshotInterval, saveRetryTimeout, cacheCapacity, applyOptional);
    }

    public AggregateStoreSettings withSaveRetryTimeout(Duration saveRetryTimeout) {
        return new AggregateStoreSettings(snapshotInterval, saveRetryTimeout, cacheCapacity, applyOptional);
    }

    public AggregateStoreSettings withCacheCapacity(int cacheCapacity) {
        return new AggregateStoreSettings(snapshotInterval, saveRetryTimeout, cacheCapacity, applyOptional);
    }

    public AggregateStoreSettings withApplyOptional(boolean applyOptional) {
        return new AggregateStoreSettings(snapshotInterval, saveRetryTimeout, cacheCapacity, applyOptional);
    }

    @Override
    public String toString() {
        return "AggregateStoreSettings[snapshotInterval=" + snapshotInterval + ", saveRetryTimeout="
                + saveRetryTimeout + ", cacheCapacity=" + cacheCapacity + ", applyOptional=" + applyOptional + "]";
    }
}
