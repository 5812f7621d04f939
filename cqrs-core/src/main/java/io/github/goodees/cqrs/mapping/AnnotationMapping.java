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

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Handlers are methods annotated with given annotation, like {@link Handles} or {@link Applies}.
 * @param <C> type of context passed to handlers
 */
public class AnnotationMapping<C> extends ReflectiveMapping<C> {
    private final Class<? extends Annotation> annotation;

    public AnnotationMapping(Class<? extends Annotation> annotation, Class<?> messageType, Class<C> contextType) {
        super(messageType, contextType);
        this.annotation = Objects.requireNonNull(annotation, "Annotation must be specified");
    }

    @Override
    protected boolean isHandlerMethod(Method method) {
        return method.isAnnotationPresent(annotation);
    }
}
