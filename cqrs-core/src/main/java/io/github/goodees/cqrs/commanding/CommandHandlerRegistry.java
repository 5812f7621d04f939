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

import io.github.goodees.cqrs.HandlerNotFoundException;
import io.github.goodees.cqrs.domain.Aggregate;
import io.github.goodees.cqrs.domain.AggregateStore;
import io.github.goodees.cqrs.mapping.ConventionMapping;
import io.github.goodees.cqrs.mapping.HandlerTable;
import io.github.goodees.cqrs.mapping.HandlerTableBuilder;
import io.github.goodees.cqrs.mapping.MappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command handlers of all known aggregate types, built at startup. Every command type must be handled by exactly one
 * aggregate type.
 */
public class CommandHandlerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CommandHandlerRegistry.class);

    private final Map<Class<?>, CommandHandler> handlers;

    /**
     * Create registry discovering methods named {@code handle}.
     * @param aggregateStore store to load and save aggregates through
     * @param aggregateTypes known aggregate types
     */
    public CommandHandlerRegistry(AggregateStore aggregateStore,
            Collection<Class<? extends Aggregate>> aggregateTypes) {
        this(aggregateStore, aggregateTypes, new ConventionMapping<>("handle", Command.class, CommandContext.class));
    }

    public CommandHandlerRegistry(AggregateStore aggregateStore, Collection<Class<? extends Aggregate>> aggregateTypes,
            HandlerTableBuilder<CommandContext> mapping) {
        Map<Class<?>, CommandHandler> result = new LinkedHashMap<>();
        for (Class<? extends Aggregate> aggregateType : aggregateTypes) {
            HandlerTable<CommandContext> table = mapping.build(aggregateType);
            for (Class<?> commandType : table.handledTypes()) {
                CommandHandler existing = result.get(commandType);
                if (existing != null) {
                    throw MappingException.duplicateHandler(commandType, existing.getAggregateType(), aggregateType);
                }
                result.put(commandType, new CommandHandler(aggregateType, commandType, aggregateStore,
                        table.lookup(commandType).get()));
            }
        }
        this.handlers = Collections.unmodifiableMap(result);
        logger.debug("Discovered command handlers: {}", handlers.values());
    }

    public CommandHandler getHandlerFor(Command command) {
        CommandHandler handler = handlers.get(command.getClass());
        if (handler == null) {
            throw HandlerNotFoundException.forCommand(command.getClass());
        }
        return handler;
    }
}
