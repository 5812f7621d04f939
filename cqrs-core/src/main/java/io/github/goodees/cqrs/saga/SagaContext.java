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
import io.github.goodees.cqrs.eventing.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scope of handling single event by single saga. Commands published by the saga are collected and sent only once
 * the saga state is stored, so a failed save never leaves commands behind.
 */
public final class SagaContext {
    private static final String[] FORWARDED_HEADERS = { Header.REMOTE_ADDRESS, Header.USER_ADDRESS,
            Header.USER_NAME };

    private final Class<? extends Saga> sagaType;
    private final String sagaId;
    private final Event event;
    private final Map<String, String> headers;
    private final List<SagaCommand> publishedCommands = new ArrayList<>();

    public SagaContext(Class<? extends Saga> sagaType, String sagaId, Event event, Map<String, String> headers) {
        this.sagaType = Objects.requireNonNull(sagaType, "Saga type must be specified");
        this.sagaId = Objects.requireNonNull(sagaId, "Saga id must be specified");
        this.event = Objects.requireNonNull(event, "Event must be specified");
        this.headers = Header.copyOf(headers);
    }

    public Class<? extends Saga> getSagaType() {
        return sagaType;
    }

    public String getSagaId() {
        return sagaId;
    }

    public Event getEvent() {
        return event;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void publish(String aggregateId, Command command) {
        publish(aggregateId, command, Collections.<String, String>emptyMap());
    }

    /**
     * Publish command after the saga is saved. Headers identifying the user of the originating event are
     * forwarded, unless the given headers override them.
     */
    public void publish(String aggregateId, Command command, Map<String, String> commandHeaders) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : FORWARDED_HEADERS) {
            String value = headers.get(name);
            if (value != null) {
                result.put(name, value);
            }
        }
        result.putAll(commandHeaders);
        publishedCommands.add(new SagaCommand(aggregateId, result, command));
    }

    public List<SagaCommand> getPublishedCommands() {
        return Collections.unmodifiableList(new ArrayList<>(publishedCommands));
    }
}
