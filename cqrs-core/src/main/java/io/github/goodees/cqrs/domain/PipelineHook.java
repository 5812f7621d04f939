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
import io.github.goodees.cqrs.store.Commit;

/**
 * Observer of aggregate loads and saves, run by {@link HookableAggregateStore}. Subclasses override only the
 * extension points they need, the store skips the others. Exceptions thrown by a hook abort the operation.
 * <p>Hooks run in ascending {@linkplain #getOrder() order}, then by class name. Post hooks run in reverse.</p>
 */
public abstract class PipelineHook implements AutoCloseable {
    private final int order;
    private final boolean implementsPreGet;
    private final boolean implementsPostGet;
    private final boolean implementsPreSave;
    private final boolean implementsPostSave;

    protected PipelineHook() {
        this(0);
    }

    protected PipelineHook(int order) {
        this.order = order;
        this.implementsPreGet = overrides("preGet", Class.class, String.class);
        this.implementsPostGet = overrides("postGet", Aggregate.class);
        this.implementsPreSave = overrides("preSave", Aggregate.class, CommandContext.class);
        this.implementsPostSave = overrides("postSave", Aggregate.class, Commit.class, Exception.class);
    }

    private boolean overrides(String method, Class<?>... parameterTypes) {
        try {
            return getClass().getMethod(method, parameterTypes).getDeclaringClass() != PipelineHook.class;
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

    public void preGet(Class<? extends Aggregate> type, String id) {
    }

    public void postGet(Aggregate aggregate) {
    }

    public void preSave(Aggregate aggregate, CommandContext context) {
    }

    /**
     * Invoked after save, whether it succeeded or not.
     * @param aggregate the aggregate being saved
     * @param commit the stored commit, {@code null} when save failed
     * @param error the failure, {@code null} when save succeeded
     */
    public void postSave(Aggregate aggregate, Commit commit, Exception error) {
    }

    @Override
    public void close() {
    }
}
