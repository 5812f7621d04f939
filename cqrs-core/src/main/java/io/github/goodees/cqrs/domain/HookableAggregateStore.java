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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import static java.util.stream.Collectors.toList;

/**
 * Aggregate store decorator running {@link PipelineHook pipeline hooks} around the decorated store.
 */
public class HookableAggregateStore implements AggregateStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HookableAggregateStore.class);

    private final AggregateStore store;
    private final List<PipelineHook> hooks;
    private final List<PipelineHook> preGetHooks;
    private final List<PipelineHook> postGetHooks;
    private final List<PipelineHook> preSaveHooks;
    private final List<PipelineHook> postSaveHooks;

    public HookableAggregateStore(AggregateStore store, Collection<? extends PipelineHook> hooks) {
        this.store = Objects.requireNonNull(store, "Aggregate store must be specified");
        this.hooks = hooks.stream()
                .sorted(Comparator.comparingInt(PipelineHook::getOrder).thenComparing(h -> h.getClass().getName()))
                .collect(toList());
        this.preGetHooks = select(PipelineHook::implementsPreGet, false);
        this.postGetHooks = select(PipelineHook::implementsPostGet, true);
        this.preSaveHooks = select(PipelineHook::implementsPreSave, false);
        this.postSaveHooks = select(PipelineHook::implementsPostSave, true);
        logger.debug("Pipeline hooks: {}", this.hooks);
    }

    private List<PipelineHook> select(Predicate<PipelineHook> implemented, boolean reversed) {
        List<PipelineHook> result = hooks.stream().filter(implemented).collect(toList());
        if (reversed) {
            Collections.reverse(result);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public <T extends Aggregate> T get(Class<T> type, String id) {
        for (PipelineHook hook : preGetHooks) {
            hook.preGet(type, id);
        }
        T aggregate = store.get(type, id);
        for (PipelineHook hook : postGetHooks) {
            hook.postGet(aggregate);
        }
        return aggregate;
    }

    @Override
    public SaveResult save(Aggregate aggregate, CommandContext context)
            throws EventStoreException, RetryTimeoutException {
        for (PipelineHook hook : preSaveHooks) {
            hook.preSave(aggregate, context);
        }
        SaveResult result;
        try {
            result = store.save(aggregate, context);
        } catch (EventStoreException | RetryTimeoutException | RuntimeException e) {
            for (PipelineHook hook : postSaveHooks) {
                hook.postSave(aggregate, null, e);
            }
            throw e;
        }
        for (PipelineHook hook : postSaveHooks) {
            hook.postSave(result.getAggregate(), result.getCommit(), null);
        }
        return result;
    }

    List<PipelineHook> getPreGetHooks() {
        return preGetHooks;
    }

    List<PipelineHook> getPostGetHooks() {
        return postGetHooks;
    }

    List<PipelineHook> getPreSaveHooks() {
        return preSaveHooks;
    }

    List<PipelineHook> getPostSaveHooks() {
        return postSaveHooks;
    }

    @Override
    public void close() {
        List<PipelineHook> reversed = new ArrayList<>(hooks);
        Collections.reverse(reversed);
        for (PipelineHook hook : reversed) {
            try {
                hook.close();
            } catch (RuntimeException e) {
                logger.error("Closing hook {} failed", hook, e);
            }
        }
    }
}
