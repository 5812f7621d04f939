package io.github.goodees.cqrs.store;

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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The serialized part of a commit: its headers and events.
 */
public class CommitData {
    private Map<String, String> headers = new LinkedHashMap<>();
    private List<Event> events = new ArrayList<>();

    CommitData() {
    }

    public CommitData(Map<String, String> headers, List<Event> events) {
        this.headers = new LinkedHashMap<>(headers);
        this.events = new ArrayList<>(events);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public List<Event> getEvents() {
        return events;
    }
}
