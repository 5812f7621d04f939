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

import io.github.goodees.cqrs.eventing.EventContext;
import io.github.goodees.cqrs.example.AccountEvents;
import io.github.goodees.cqrs.example.AuditLog;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RegistrationMappingTest {

    static class Projection {
        final List<String> owners = new ArrayList<>();
    }

    @Test
    public void registered_handlers_are_invoked() throws Exception {
        RegistrationMapping<EventContext> mapping = new RegistrationMapping<EventContext>()
                .register(Projection.class, AccountEvents.Opened.class,
                    (projection, event, context) -> projection.owners.add(event.getOwner()));
        HandlerTable<EventContext> table = mapping.build(Projection.class);
        Projection projection = new Projection();
        table.lookup(AccountEvents.Opened.class).get().invoke(projection, new AccountEvents.Opened("ann"), null);
        assertEquals("[ann]", projection.owners.toString());
    }

    @Test
    public void unregistered_type_has_no_handlers() {
        assertTrue(new RegistrationMapping<EventContext>().build(AuditLog.class).isEmpty());
    }

    @Test(expected = MappingException.class)
    public void second_registration_of_message_type_fails() {
        new RegistrationMapping<EventContext>()
                .register(Projection.class, AccountEvents.Opened.class, (p, e, c) -> { })
                .register(Projection.class, AccountEvents.Opened.class, (p, e, c) -> { });
    }
}
