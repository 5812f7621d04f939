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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Result of a dispatched task as handed to the submitter. Only the dispatcher completes it. The submitter may cancel
 * it while the task still waits in its mailbox, which takes the task out of the mailbox and frees its capacity.
 */
final class TaskResponse<T> extends CompletableFuture<T> {
    enum State {
        QUEUED, RUNNING, CANCELLED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);
    private final Runnable dequeue;

    TaskResponse(Runnable dequeue) {
        this.dequeue = dequeue;
    }

    /**
     * Claim the task for execution.
     * @return false when the submitter cancelled the task first
     */
    boolean start() {
        return state.compareAndSet(State.QUEUED, State.RUNNING);
    }

    State getState() {
        return state.get();
    }

    void succeeded(T value) {
        super.complete(value);
    }

    void failed(Throwable t) {
        super.completeExceptionally(t);
    }

    /**
     * Cancel a queued task. Running or finished task cannot be cancelled.
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (!state.compareAndSet(State.QUEUED, State.CANCELLED)) {
            return false;
        }
        dequeue.run();
        return super.cancel(mayInterruptIfRunning);
    }

    @Override
    public boolean complete(T value) {
        throw readOnly();
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw readOnly();
    }

    @Override
    public void obtrudeValue(T value) {
        throw readOnly();
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw readOnly();
    }

    private static UnsupportedOperationException readOnly() {
        return new UnsupportedOperationException("Response of dispatched task is completed by the dispatcher only");
    }
}
