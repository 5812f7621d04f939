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

import io.github.goodees.cqrs.commanding.Command;
import io.github.goodees.cqrs.commanding.CommandContext;
import io.github.goodees.cqrs.eventing.Event;
import io.github.goodees.cqrs.example.Account;
import io.github.goodees.cqrs.example.AccountCommands;
import io.github.goodees.cqrs.example.AccountEvents;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConventionMappingTest {
    private final ConventionMapping<CommandContext> commands = new ConventionMapping<>("handle", Command.class,
            CommandContext.class);
    private final ConventionMapping<Void> appliers = new ConventionMapping<>("apply", Event.class, Void.class);

    static class Base {
        final List<String> calls = new ArrayList<>();

        void apply(AccountEvents.Opened event) {
            calls.add("base-opened");
        }

        void apply(AccountEvents.Deposited event) {
            calls.add("base-deposited");
        }
    }

    static class Derived extends Base {
        @Override
        void apply(AccountEvents.Deposited event) {
            calls.add("derived-deposited");
        }

        private void apply(AccountEvents.Withdrawn event) {
            calls.add("derived-withdrawn");
        }
    }

    static class WrongReturn {
        String apply(AccountEvents.Opened event) {
            return "nope";
        }
    }

    static class WrongParameter {
        void apply(String event) {
        }
    }

    static class Failing {
        void apply(AccountEvents.Opened event) {
            throw new IllegalStateException("boom");
        }
    }

    @Test
    public void handler_methods_are_discovered_by_name() {
        HandlerTable<CommandContext> table = commands.build(Account.class);
        assertTrue(table.canHandle(AccountCommands.Open.class));
        assertTrue(table.canHandle(AccountCommands.Deposit.class));
        assertTrue(table.canHandle(AccountCommands.Touch.class));
        assertFalse(table.canHandle(AccountCommands.Audit.class));
        assertSame(Account.class, table.getTargetType());
    }

    @Test
    public void subclass_handler_takes_precedence() throws Exception {
        HandlerTable<Void> table = appliers.build(Derived.class);
        Derived target = new Derived();
        table.lookup(AccountEvents.Deposited.class).get().invoke(target, new AccountEvents.Deposited(1), null);
        table.lookup(AccountEvents.Opened.class).get().invoke(target, new AccountEvents.Opened("joe"), null);
        table.lookup(AccountEvents.Withdrawn.class).get().invoke(target, new AccountEvents.Withdrawn(1), null);
        assertEquals(3, table.handledTypes().size());
        assertEquals("[derived-deposited, base-opened, derived-withdrawn]", target.calls.toString());
    }

    @Test
    public void lookup_is_by_exact_type() {
        HandlerTable<CommandContext> table = commands.build(Account.class);
        assertFalse(table.lookup(Command.class).isPresent());
    }

    @Test
    public void handler_must_return_void() {
        try {
            appliers.build(WrongReturn.class);
            fail("should have failed");
        } catch (MappingException e) {
            assertThat(e.getMessage(), containsString("must return void"));
        }
    }

    @Test(expected = MappingException.class)
    public void handler_must_accept_message() {
        appliers.build(WrongParameter.class);
    }

    @Test
    public void handler_exception_is_unwrapped() throws Exception {
        HandlerTable<Void> table = appliers.build(Failing.class);
        try {
            table.lookup(AccountEvents.Opened.class).get().invoke(new Failing(), new AccountEvents.Opened("x"), null);
            fail("should have failed");
        } catch (IllegalStateException e) {
            assertEquals("boom", e.getMessage());
        }
    }
}
