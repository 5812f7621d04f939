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
 * Settings of command and event processors.
 * <ul>
 * <li>{@code retryTimeout}: how long concurrency conflicts are retried. Default 10 seconds.</li>
 * <li>{@code maximumConcurrencyLevel}: number of partitions processed in parallel. Defaults to number of
 * processors.</li>
 * <li>{@code boundedCapacity}: number of messages pending at once. Defaults to three times concurrency level.</li>
 * <li>{@code requireEventHandlers}: whether an event nobody handles is an error. Default false.</li>
 * </ul>
 */
public final class ProcessorSettings {
    private final Duration retryTimeout;
    private final int maximumConcurrencyLevel;
    private final int boundedCapacity;
    private final boolean requireEventHandlers;

    private ProcessorSettings(Duration retryTimeout, int maximumConcurrencyLevel, int boundedCapacity,
            boolean requireEventHandlers) {
        if (maximumConcurrencyLevel < 1) {
            throw new IllegalArgumentException("Maximum concurrency level must be positive, was "
                    + maximumConcurrencyLevel);
        }
        if (boundedCapacity < 1) {
            throw new IllegalArgumentException("Bounded capacity must be positive, was " + boundedCapacity);
        }
        this.retryTimeout = Objects.requireNonNull(retryTimeout, "Retry timeout must be specified");
        this.maximumConcurrencyLevel = maximumConcurrencyLevel;
        this.boundedCapacity = boundedCapacity;
        this.requireEventHandlers = requireEventHandlers;
    }

    public static ProcessorSettings defaults() {
        int processors = Runtime.getRuntime().availableProcessors();
        return new ProcessorSettings(Duration.ofSeconds(10), processors, processors * 3, false);
    }

    public static ProcessorSettings fromProperties(Properties properties, String prefix) {
        ProcessorSettings defaults = defaults();
        PropertyReader reader = new PropertyReader(properties, prefix);
        int concurrency = reader.getInt("maximumConcurrencyLevel", defaults.maximumConcurrencyLevel);
        return new ProcessorSettings(reader.getDuration("retryTimeout", defaults.retryTimeout),
                concurrency,
                reader.getInt("boundedCapacity", concurrency * 3),
                reader.getBoolean("requireEventHandlers", defaults.requireEventHandlers));
    }

    public Duration getRetryTimeout() {
        return retryTimeout;
    }

    public int getMaximumConcurrencyLevel() {
        return maximumConcurrencyLevel;
    }

    public int getBoundedCapacity() {
        return boundedCapacity;
    }

    public boolean isRequireEventHandlers() {
        return requireEventHandlers;
    }

    public ProcessorSettings withRetryTimeout(Duration retryTimeout) {
        return new ProcessorSettings(retryTimeout, maximumConcurrencyLevel, boundedCapacity, requireEventHandlers);
    }

    public ProcessorSettings withMaximumConcurrencyLevel(int maximumConcurrencyLevel) {
        return new ProcessorSettings(retryTimeout, maximumConcurrencyLevel, boundedCapacity, requireEventHandlers);
    }

    public ProcessorSettings withBoundedCapacity(int boundedCapacity) {
        return new ProcessorSettings(retryTimeout, maximumConcurrencyLevel, boundedCapacity, requireEventHandlers);
    }

    public ProcessorSettings withRequireEventHandlers(boolean requireEventHandlers) {
        return new ProcessorSettings(retryTimeout, maximumConcurrencyLevel, boundedCapacity, requireEventHandlers);
    }

    @Override
    public String toString() {
        return "ProcessorSettings[retryTimeout=" + retryTimeout + ", maximumConcurrencyLevel="
                + maximumConcurrencyLevel + ", boundedCapacity=" + boundedCapacity + ", requireEventHandlers="
                + requireEventHandlers + "]";
    }
}
