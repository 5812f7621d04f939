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

import io.github.goodees.cqrs.store.Commit;

/**
 * Outcome of saving an aggregate: the updated aggregate and the commit that was stored. When the commit was already
 * stored before, the commit has no sequence id and the aggregate version is unchanged.
 */
public final class SaveResult {
    private final Aggregate aggregate;
    private final Commit commit;

    public SaveResult(Aggregate aggregate, Commit commit) {
        this.aggregate = aggregate;
        this.commit = commit;
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    public Commit getCommit() {
        return commit;
    }

    public boolean isDuplicate() {
        return commit.getId() == null;
    }
}
