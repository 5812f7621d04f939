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
 * Detects aggregates modified outside of apply methods, e.g. by a command handler changing a field directly.
 * State is fingerprinted after load and after every successful save, and verified before a save and after a failed
 * one. Serializing the aggregate on every step is expensive, use it in development and tests.
 */
public class AggregateStateValidator extends PipelineHook {

    @Override
    public void postGet(Aggregate aggregate) {
        aggregate.verifyHash();
    }

    @Override
    public void preSave(Aggregate aggregate, CommandContext context) {
        aggregate.verifyHash();
    }

    @Override
    public void postSave(Aggregate aggregate, Commit commit, Exception error) {
        if (error != null) {
            aggregate.verifyHash();
        }
        if (commit != null) {
            aggregate.updateHash();
        }
    }
}
