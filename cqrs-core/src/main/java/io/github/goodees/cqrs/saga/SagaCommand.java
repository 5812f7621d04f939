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

import io.github.goodees.cqrs.Header;
import io.github.goodees.cqrs.commanding.Command;

import java.util.Map;
import java.util.Objects;

/**
 * Command published by a saga, sent after the saga state is saved.
 */
public final class SagaCommand {
    private final String aggregateId;
    private final Map<String, String> headers;
    private final Command command;

    public SagaCommand(String aggregateId, Map<String, String> headers, Command command) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        this.headers = Header.copyOf(headers);
        this.command = Objects.requireNonNull(command, "Command must be specified");
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Command getCommand() {
        return command;
    }

    @Override
    public String toString() {
        return command.getClass().getSimpleName() + " for " + aggregateId;
    }
}
