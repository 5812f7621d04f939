package io.github.goodees.cqrs.domain;

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

import io.github.goodees.cqrs.commanding.CommandContext;
import io.github.goodees.cqrs.dispatch.RetryTimeoutException;
import io.github.goodees.cqrs.store.EventStoreException;

/**
 * Loads and saves aggregates. Implementations are decorated by {@link CachedAggregateStore} and
 * {@link HookableAggregateStore}.
 */
public interface AggregateStore {

    /**
     * Load an aggregate, returning a fresh instance at version 0 if it was never stored.
     * @param type concrete aggregate type
     * @param id aggregate id
     * @param <T> aggregate type
     * @return the aggregate
     */
    <T extends Aggregate> T get(Class<T> type, String id);

    /**
     * Store events raised in the context as next commit of the aggregate.
     * @param aggregate the aggregate that handled the command
     * @param context context holding raised events
     * @return saved aggregate and commit
     * @throws EventStoreException with {@code OPTIMISTIC_LOCK} fault when the aggregate was changed concurrently
     * @throws RetryTimeoutException when storage kept failing for the whole retry timeout
     */
    SaveResult save(Aggregate aggregate, CommandContext context) throws EventStoreException, RetryTimeoutException;
}
