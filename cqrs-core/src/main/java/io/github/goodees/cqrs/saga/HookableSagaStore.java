package io.github.goodees.cqrs.saga;

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

import io.github.goodees.cqrs.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import static java.util.stream.Collectors.toList;

/**
 * Saga store decorator running {@link SagaPipelineHook saga hooks} around the decorated store.
 */
public class HookableSagaStore implements SagaStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HookableSagaStore.class);

    private final SagaStore store;
    private final List<SagaPipelineHook> hooks;
    private final List<SagaPipelineHook> preGetHooks;
    private final List<SagaPipelineHook> postGetHooks;
    private final List<SagaPipelineHook> preSaveHooks;
    private final List<SagaPipelineHook> postSaveHooks;

    public HookableSagaStore(SagaStore store, Collection<? extends SagaPipelineHook> hooks) {
        this.store = Objects.requireNonNull(store, "Saga store must be specified");
        this.hooks = hooks.stream()
                .sorted(Comparator.comparingInt(SagaPipelineHook::getOrder)
                        .thenComparing(h -> h.getClass().getName()))
                .collect(toList());
        this.preGetHooks = select(SagaPipelineHook::implementsPreGet, false);
        this.postGetHooks = select(SagaPipelineHook::implementsPostGet, true);
        this.preSaveHooks = select(SagaPipelineHook::implementsPreSave, false);
        this.postSaveHooks = select(SagaPipelineHook::implementsPostSave, true);
    }

    private List<SagaPipelineHook> select(Predicate<SagaPipelineHook> implemented, boolean reversed) {
        List<SagaPipelineHook> result = hooks.stream().filter(implemented).collect(toList());
        if (reversed) {
            Collections.reverse(result);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public Saga createSaga(Class<? extends Saga> sagaType, String sagaId) {
        for (SagaPipelineHook hook : preGetHooks) {
            hook.preGet(sagaType, sagaId);
        }
        Saga saga = store.createSaga(sagaType, sagaId);
        for (SagaPipelineHook hook : postGetHooks) {
            hook.postGet(saga);
        }
        return saga;
    }

    @Override
    public Optional<Saga> tryGetSaga(Class<? extends Saga> sagaType, String sagaId) {
        for (SagaPipelineHook hook : preGetHooks) {
            hook.preGet(sagaType, sagaId);
        }
        Optional<Saga> saga = store.tryGetSaga(sagaType, sagaId);
        if (saga.isPresent()) {
            for (SagaPipelineHook hook : postGetHooks) {
                hook.postGet(saga.get());
            }
        }
        return saga;
    }

    @Override
    public Saga save(Saga saga, SagaContext context) throws EventStoreException {
        for (SagaPipelineHook hook : preSaveHooks) {
            hook.preSave(saga, context);
        }
        Saga result;
        try {
            result = store.save(saga, context);
        } catch (EventStoreException | RuntimeException e) {
            for (SagaPipelineHook hook : postSaveHooks) {
                hook.postSave(saga, context, e);
            }
            throw e;
        }
        for (SagaPipelineHook hook : postSaveHooks) {
            hook.postSave(result, context, null);
        }
        return result;
    }

    @Override
    public List<SagaTimeout> getScheduledTimeouts(Instant maximumTimeout) {
        return store.getScheduledTimeouts(maximumTimeout);
    }

    @Override
    public void purge() {
        store.purge();
    }

    @Override
    public void close() {
        List<SagaPipelineHook> reversed = new ArrayList<>(hooks);
        Collections.reverse(reversed);
        for (SagaPipelineHook hook : reversed) {
            try {
                hook.close();
            } catch (RuntimeException e) {
                logger.error("Closing hook {} failed", hook, e);
            }
        }
    }
}
