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

/**
 * Handler methods of a type are not valid, or an event could not be applied. This is a programming error and is
 * never retried.
 */
public class MappingException extends RuntimeException {

    protected MappingException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MappingException invalidReturnType(Method method) {
        return new MappingException("Handler method " + describe(method) + " must return void", null);
    }

    public static MappingException invalidParameters(Method method, Class<?> messageType, Class<?> contextType) {
        return new MappingException("Handler method " + describe(method) + " must accept a "
                + messageType.getSimpleName() + " optionally followed by " + contextType.getSimpleName(), null);
    }

    public static MappingException ambiguous(Class<?> targetType, Class<?> messageType) {
        return new MappingException(targetType.getName() + " declares multiple handlers of "
                + messageType.getName(), null);
    }

    public static MappingException duplicateHandler(Class<?> messageType, Class<?> first, Class<?> second) {
        return new MappingException(messageType.getName() + " is handled by both " + first.getName() + " and "
                + second.getName(), null);
    }

    public static MappingException missingApplyMethod(Class<?> aggregateType, Class<?> eventType) {
        return new MappingException(aggregateType.getName() + " cannot apply " + eventType.getName(), null);
    }

    public static MappingException missingCorrelation(Class<?> sagaType, Class<?> eventType) {
        return new MappingException("Saga " + sagaType.getName() + " handles " + eventType.getName()
                + " but does not configure its correlation", null);
    }

    public static MappingException missingSagaHandler(Class<?> sagaType, Class<?> eventType) {
        return new MappingException("Saga " + sagaType.getName() + " configures " + eventType.getName()
                + " but has no handler for it", null);
    }

    public static MappingException duplicateCorrelation(Class<?> sagaType, Class<?> eventType) {
        return new MappingException("Saga " + sagaType.getName() + " configures " + eventType.getName()
                + " more than once", null);
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
