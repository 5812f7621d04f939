package io.github.goodees.cqrs.domain;

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

import io.github.goodees.cqrs.UnknownTypeException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

final class AggregateActivator {

    private AggregateActivator() {
    }

    static <T extends Aggregate> T createInstance(Class<T> type, String id) {
        if (Modifier.isAbstract(type.getModifiers())) {
            throw UnknownTypeException.unknownAggregate(type, null);
        }
        T aggregate;
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            aggregate = constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw UnknownTypeException.unknownAggregate(type, e);
        }
        aggregate.setId(id);
        return aggregate;
    }
}
