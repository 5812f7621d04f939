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

import java.util.Collections;
import java.util.Map;

/**
 * Sends commands to their processor. Transports implement this, {@link DirectCommandPublisher} sends within the
 * process.
 */
public interface CommandPublisher {

    void publish(String aggregateId, Command command, Map<String, String> headers);

    default void publish(String aggregateId, Command command) {
        publish(aggregateId, command, Collections.<String, String>emptyMap());
    }
}
