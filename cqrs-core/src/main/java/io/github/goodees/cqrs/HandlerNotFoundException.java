package io.github.goodees.cqrs;

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

/**
 * No handler is registered for a message type.
 */
public class HandlerNotFoundException extends RuntimeException {

    protected HandlerNotFoundException(String message) {
        super(message);
    }

    public static HandlerNotFoundException forCommand(Class<?> commandType) {
        return new HandlerNotFoundException("No command handler registered for " + commandType.getName());
    }

    public static HandlerNotFoundException forEvent(Class<?> eventType) {
        return new HandlerNotFoundException("No event handlers registered for " + eventType.getName());
    }
}
