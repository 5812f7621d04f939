package io.github.goodees.cqrs.commanding;

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

import io.github.goodees.cqrs.domain.Aggregate;
import io.github.goodees.cqrs.domain.AggregateStore;
import io.github.goodees.cqrs.mapping.HandlerFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Handles one command type: loads the target aggregate, invokes its handler method and saves the raised events.
 */
public class CommandHandler {
    private static final Logger logger = LoggerFactory.getLogger(CommandHandler.class);

    private final Class<? extends Aggregate> aggregateType;
    private final Class<?> commandType;
    private final AggregateStore aggregateStore;
    private final HandlerFunction<CommandContext> executor;

    public CommandHandler(Class<? extends Aggregate> aggregateType, Class<?> commandType,
            AggregateStore aggregateStore, HandlerFunction<CommandContext> executor) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        this.commandType = Objects.requireNonNull(commandType, "Command type must be specified");
        this.aggregateStore = Objects.requireNonNull(aggregateStore, "Aggregate store must be specified");
        this.executor = Objects.requireNonNull(executor, "Executor must be specified");
    }

    public Class<? extends Aggregate> getAggregateType() {
        return aggregateType;
    }

    public Class<?> getCommandType() {
        return commandType;
    }

    public void handle(CommandContext context) throws Exception {
        Command command = context.getCommand();
        Aggregate aggregate = aggregateStore.get(aggregateType, context.getAggregateId());
        logger.trace("Executing {} on {}", command, aggregate);
        aggregate.verifyCanHandleCommand(command);
        executor.invoke(aggregate, command, context);
        if (context.hasRaisedEvents()) {
            aggregateStore.save(aggregate, context);
        } else {
            logger.warn("Executing {} on {} raised no events", command, aggregate);
        }
    }

    @Override
    public String toString() {
        return "CommandHandler[" + commandType.getSimpleName() + " -> " + aggregateType.getSimpleName() + "]";
    }
}
