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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Discovers handler methods by reflection. A handler method returns void and accepts the message, optionally
 * followed by the context. Methods of subclasses take precedence over methods of superclasses handling the same
 * message type.
 * @param <C> type of context passed to handlers
 */
public abstract class ReflectiveMapping<C> implements HandlerTableBuilder<C> {
    private final Class<?> messageType;
    private final Class<C> contextType;

    protected ReflectiveMapping(Class<?> messageType, Class<C> contextType) {
        this.messageType = Objects.requireNonNull(messageType, "Message type must be specified");
        this.contextType = Objects.requireNonNull(contextType, "Context type must be specified");
    }

    /**
     * Decide whether a method is meant to be a handler. Selected methods that do not have valid signature cause
     * {@link MappingException}.
     * @param method candidate method
     * @return true if method should be a handler
     */
    protected abstract boolean isHandlerMethod(Method method);

    @Override
    public HandlerTable<C> build(Class<?> targetType) {
        Map<Class<?>, HandlerFunction<C>> handlers = new LinkedHashMap<>();
        for (Class<?> type = targetType; type != null && type != Object.class; type = type.getSuperclass()) {
            Map<Class<?>, HandlerFunction<C>> declared = new HashMap<>();
            for (Method method : type.getDeclaredMethods()) {
                if (method.isBridge() || method.isSynthetic() || Modifier.isStatic(method.getModifiers())
                        || !isHandlerMethod(method)) {
                    continue;
                }
                Class<?> handled = verify(method);
                if (declared.put(handled, invoker(method)) != null) {
                    throw MappingException.ambiguous(type, handled);
                }
            }
            for (Map.Entry<Class<?>, HandlerFunction<C>> entry : declared.entrySet()) {
                handlers.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        return new HandlerTable<>(targetType, handlers);
    }

    private Class<?> verify(Method method) {
        if (method.getReturnType() != void.class) {
            throw MappingException.invalidReturnType(method);
        }
        Class<?>[] params = method.getParameterTypes();
        if (params.length < 1 || params.length > 2 || !messageType.isAssignableFrom(params[0])
                || (params.length == 2 && !params[1].isAssignableFrom(contextType))) {
            throw MappingException.invalidParameters(method, messageType, contextType);
        }
        return params[0];
    }

    private HandlerFunction<C> invoker(Method method) {
        method.setAccessible(true);
        boolean withContext = method.getParameterCount() == 2;
        return (target, message, context) -> {
            try {
                if (withContext) {
                    method.invoke(target, message, context);
                } else {
                    method.invoke(target, message);
                }
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                } else if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        };
    }
}
