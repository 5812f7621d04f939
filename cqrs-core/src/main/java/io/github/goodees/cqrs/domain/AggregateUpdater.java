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

import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.mapping.ConventionMapping;
import io.github.goodees.cqrs.mapping.HandlerFunction;
import io.github.goodees.cqrs.mapping.HandlerTable;
import io.github.goodees.cqrs.mapping.HandlerTableBuilder;
import io.github.goodees.cqrs.mapping.MappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Applies events to aggregates through their apply methods. By default these are methods named {@code apply}
 * accepting single event.
 */
public class AggregateUpdater {
    private static final Logger logger = LoggerFactory.getLogger(AggregateUpdater.class);

    private final HandlerTableBuilder<Void> mapping;
    private final boolean applyOptional;
    private final ConcurrentMap<Class<?>, HandlerTable<Void>> tables = new ConcurrentHashMap<>();

    public AggregateUpdater() {
        this(true);
    }

    public AggregateUpdater(boolean applyOptional) {
        this(new ConventionMapping<>("apply", Event.class, Void.class), applyOptional);
    }

    /**
     * Create updater.
     * @param mapping discovery of apply methods
     * @param applyOptional when true, events without apply method are skipped, otherwise they fail
     */
    public AggregateUpdater(HandlerTableBuilder<Void> mapping, boolean applyOptional) {
        this.mapping = Objects.requireNonNull(mapping, "Mapping must be specified");
        this.applyOptional = applyOptional;
    }

    public void apply(Event event, Aggregate aggregate) {
        HandlerTable<Void> table = tables.computeIfAbsent(aggregate.getClass(), mapping::build);
        Optional<HandlerFunction<Void>> apply = table.lookup(event.getClass());
        if (!apply.isPresent()) {
            if (applyOptional) {
                logger.trace("{} has no apply method for {}", aggregate, event);
                return;
            }
            throw MappingException.missingApplyMethod(aggregate.getClass(), event.getClass());
        }
        try {
            apply.get().invoke(aggregate, event, null);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Applying " + event + " to " + aggregate + " failed", e);
        }
    }
}
