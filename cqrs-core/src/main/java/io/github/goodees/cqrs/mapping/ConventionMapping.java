package io.github.goodees.cqrs.mapping;

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

import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Handlers are all methods with given name, e.g. {@code handle} for commands and events or {@code apply} for
 * applying events to aggregates.
 * @param <C> type of context passed to handlers
 */
public class ConventionMapping<C> extends ReflectiveMapping<C> {
    private final String methodName;

    public ConventionMapping(String methodName, Class<?> messageType, Class<C> contextType) {
        super(messageType, contextType);
        this.methodName = Objects.requireNonNull(methodName, "Method name must be specified");
    }

    @Override
    protected boolean isHandlerMethod(Method method) {
        return methodName.equals(method.getName());
    }
}
