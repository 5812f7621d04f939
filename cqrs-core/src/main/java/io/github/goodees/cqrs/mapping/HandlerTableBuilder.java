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

/**
 * Strategy discovering handlers of a target type.
 * @param <C> type of context passed to handlers
 * @see ConventionMapping
 * @see AnnotationMapping
 * @see RegistrationMapping
 */
@FunctionalInterface
public interface HandlerTableBuilder<C> {
    /**
     * Build handler table of a target type.
     * @param targetType type of objects the handlers will be invoked on
     * @return handlers of the type
     * @throws MappingException when handler methods are not valid
     */
    HandlerTable<C> build(Class<?> targetType);
}
