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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlers registered explicitly per target type, without reflection. Target types without registrations have no
 * handlers.
 * <pre>
 * new RegistrationMapping&lt;CommandContext&gt;()
 *     .register(Account.class, OpenAccount.class, (account, command, context) -&gt; account.open(command, context))
 *     .register(Account.class, Deposit.class, (account, command, context) -&gt; account.deposit(command, context));
 * </pre>
 * @param <C> type of context passed to handlers
 */
public class RegistrationMapping<C> implements HandlerTableBuilder<C> {
    private final Map<Class<?>, Map<Class<?>, HandlerFunction<C>>> registrations = new ConcurrentHashMap<>();

    /**
     * Typed handler.
     */
    @FunctionalInterface
    public interface Handler<T, M, C> {
        void handle(T target, M message, C context) throws Exception;
    }

    public <T, M> RegistrationMapping<C> register(Class<T> targetType, Class<M> messageType,
            Handler<? super T, ? super M, ? super C> handler) {
        Map<Class<?>, HandlerFunction<C>> handlers = registrations.computeIfAbsent(targetType,
            t -> Collections.synchronizedMap(new LinkedHashMap<>()));
        HandlerFunction<C> function = (target, message, context) -> handler.handle(targetType.cast(target),
            messageType.cast(message), context);
        if (handlers.putIfAbsent(messageType, function) != null) {
            throw MappingException.ambiguous(targetType, messageType);
        }
        return this;
    }

    @Override
    public HandlerTable<C> build(Class<?> targetType) {
        Map<Class<?>, HandlerFunction<C>> handlers = registrations.get(targetType);
        if (handlers == null) {
            return new HandlerTable<>(targetType, Collections.<Class<?>, HandlerFunction<C>>emptyMap());
        }
        synchronized (handlers) {
            return new HandlerTable<>(targetType, handlers);
        }
    }
}
