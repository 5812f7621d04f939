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

import java.util.concurrent.ExecutorService;

/**
 * Configuration of a {@link Dispatcher}.
 */
public interface DispatcherConfiguration {
    /**
     * Name of the dispatcher, used as suffix of its logger name.
     * @return the name
     */
    String dispatcherName();

    /**
     * Executor the partitions are run on. It should offer at least {@link #maximumConcurrencyLevel()} threads.
     * @return executor service
     */
    ExecutorService executorService();

    /**
     * Number of partitions. Tasks of the same partition never run concurrently.
     * @return number of partitions
     */
    int maximumConcurrencyLevel();

    /**
     * Number of tasks that may be queued or running at once. Submitters block while the dispatcher is full.
     * @return capacity of the dispatcher
     */
    int boundedCapacity();
}
