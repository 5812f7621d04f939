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

import io.github.goodees.cqrs.config.ProcessorSettings;

import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * General Dispatcher configuration implementation, as alternative to defining own subclass.
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final int maximumConcurrencyLevel;
    private final int boundedCapacity;

    /**
     * Create dispatcher configuration.
     * @param name The name of the dispatcher
     * @param executorService executor service to use
     * @param maximumConcurrencyLevel number of partitions
     * @param boundedCapacity maximum number of pending tasks
     */
    public SimpleDispatcherConfiguration(String name, ExecutorService executorService, int maximumConcurrencyLevel,
            int boundedCapacity) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        if (maximumConcurrencyLevel < 1) {
            throw new IllegalArgumentException("Maximum concurrency level must be positive");
        }
        if (boundedCapacity < 1) {
            throw new IllegalArgumentException("Bounded capacity must be positive");
        }
        this.maximumConcurrencyLevel = maximumConcurrencyLevel;
        this.boundedCapacity = boundedCapacity;
    }

    /**
     * Create dispatcher configuration from processor settings.
     * @param name the name of the dispatcher
     * @param executorService executor service to use
     * @param settings settings to take concurrency and capacity from
     */
    public SimpleDispatcherConfiguration(String name, ExecutorService executorService, ProcessorSettings settings) {
        this(name, executorService, settings.getMaximumConcurrencyLevel(), settings.getBoundedCapacity());
    }

    @Override
    public String dispatcherName() {
        return name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public int maximumConcurrencyLevel() {
        return maximumConcurrencyLevel;
    }

    @Override
    public int boundedCapacity() {
        return boundedCapacity;
    }
}
