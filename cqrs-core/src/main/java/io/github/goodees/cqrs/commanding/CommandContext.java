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

import io.github.goodees.cqrs.Header;
import io.github.goodees.cqrs.eventing.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Scope of handling single command. Handlers raise events through it, and the aggregate store stores them as one
 * commit. The context is confined to the thread handling the command and a fresh one is created for every attempt.
 */
public final class CommandContext {
    private final UUID commandId;
    private final Map<String, String> headers;
    private final CommandEnvelope envelope;
    private final List<Event> raisedEvents = new ArrayList<>();

    public CommandContext(UUID commandId, Map<String, String> headers, CommandEnvelope envelope) {
        this.commandId = Objects.requireNonNull(commandId, "Command id must be specified");
        this.headers = Header.copyOf(headers);
        this.envelope = Objects.requireNonNull(envelope, "Command envelope must be specified");
    }

    /**
     * Id of the command message. It becomes the commit id, so that redelivered command is stored at most once.
     */
    public UUID getCommandId() {
        return commandId;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getAggregateId() {
        return envelope.getAggregateId();
    }

    public Command getCommand() {
        return envelope.getCommand();
    }

    public void raise(Event event) {
        raisedEvents.add(Objects.requireNonNull(event, "Event must be specified"));
    }

    public boolean hasRaisedEvents() {
        return !raisedEvents.isEmpty();
    }

    public List<Event> getRaisedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(raisedEvents));
    }
}
