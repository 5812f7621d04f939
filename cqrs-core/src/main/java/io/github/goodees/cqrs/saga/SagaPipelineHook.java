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

/**
 * Observer of saga loads and saves, run by {@link HookableSagaStore}. Ordering follows the same rules as
 * {@link io.github.goodees.cqrs.domain.PipelineHook}.
 */
public abstract class SagaPipelineHook implements AutoCloseable {
    private final int order;
    private final boolean implementsPreGet;
    private final boolean implementsPostGet;
    private final boolean implementsPreSave;
    private final boolean implementsPostSave;

    protected SagaPipelineHook() {
        this(0);
    }

    protected SagaPipelineHook(int order) {
        this.order = order;
        this.implementsPreGet = overrides("preGet", Class.class, String.class);
        this.implementsPostGet = overrides("postGet", Saga.class);
        this.implementsPreSave = overrides("preSave", Saga.class, SagaContext.class);
        this.implementsPostSave = overrides("postSave", Saga.class, SagaContext.class, Exception.class);
    }

    private boolean overrides(String method, Class<?>... parameterTypes) {
        try {
            return getClass().getMethod(method, parameterTypes).getDeclaringClass() != SagaPipelineHook.class;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Hook method " + method + " not found", e);
        }
    }

    public int getOrder() {
        return order;
    }

    boolean implementsPreGet() {
        return implementsPreGet;
    }

    boolean implementsPostGet() {
        return implementsPostGet;
    }

    boolean implementsPreSave() {
        return implementsPreSave;
    }

    boolean implementsPostSave() {
        return implementsPostSave;
    }

    public void preGet(Class<? extends Saga> type, String id) {
    }

    /**
     * Invoked for sagas that were found or created.
     */
    public void postGet(Saga saga) {
    }

    public void preSave(Saga saga, SagaContext context) {
    }

    public void postSave(Saga saga, SagaContext context, Exception error) {
    }

    @Override
    public void close() {
    }
}
