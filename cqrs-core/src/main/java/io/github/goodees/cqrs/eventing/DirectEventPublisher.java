package io.github.goodees.cqrs.eventing;

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

import io.github.goodees.cqrs.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Publishes events straight to an in-process event processor. Failures of processing are logged.
 */
public class DirectEventPublisher implements EventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(DirectEventPublisher.class);

    private final EventProcessor processor;

    public DirectEventPublisher(EventProcessor processor) {
        this.processor = Objects.requireNonNull(processor, "Event processor must be specified");
    }

    @Override
    public void publish(Map<String, String> headers, EventEnvelope envelope) {
        Message<EventEnvelope> message = new Message<>(UUID.randomUUID(), headers, envelope);
        processor.processAsync(message).whenComplete((r, t) -> {
            if (t != null) {
                logger.error("Processing of {} failed", message, t);
            }
        });
    }
}
