/*
 * ServiceRegistryTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of jabberwock, an XMPP client library.
 *
 * jabberwock is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * jabberwock is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with jabberwock.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.jabberwock.service;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import org.bluezoo.jabberwock.DeclarationException;
import org.bluezoo.jabberwock.stanza.Message;
import org.bluezoo.jabberwock.stanza.MessageType;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for ServiceRegistry ordering and declaration checks.
 */
public class ServiceRegistryTest {

    public static class Foo extends Service {
        public Foo(ServiceContext context) {
            super(context);
        }
    }

    public static class Bar extends Service {
        public Bar(ServiceContext context) {
            super(context);
        }
    }

    public static class Baz extends Service {
        public Baz(ServiceContext context) {
            super(context);
        }
    }

    public static class Fourth extends Service {
        public Fourth(ServiceContext context) {
            super(context);
        }
    }

    public static class ParentService extends Service {
        public ParentService(ServiceContext context) {
            super(context);
        }

        void onMessage(Message message) {
        }
    }

    public static class ChildService extends ParentService {
        public ChildService(ServiceContext context) {
            super(context);
        }
    }

    public static class Source extends Service {
        final Signal<String> changed = new Signal<>("changed");

        public Source(ServiceContext context) {
            super(context);
        }
    }

    public static class Listener extends Service {
        public Listener(ServiceContext context) {
            super(context);
        }

        void onChanged(String value) {
        }

        void onMessage(Message message) {
        }
    }

    private ServiceRegistry registry;

    @Before
    public void setUp() {
        registry = new ServiceRegistry();
    }

    private static Set<ServiceClass<?>> set(ServiceClass<?>... classes) {
        return new HashSet<ServiceClass<?>>(Arrays.asList(classes));
    }

    private ServiceClass<Foo> foo() {
        return ServiceClass.builder(Foo.class, Foo::new).declare(registry);
    }

    @Test
    public void testDirectOrdering() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<Bar> bar = ServiceClass.builder(Bar.class, Bar::new)
            .orderBefore(foo)
            .declare(registry);
        ServiceClass<Baz> baz = ServiceClass.builder(Baz.class, Baz::new)
            .orderAfter(bar)
            .declare(registry);

        assertEquals(set(bar), foo.getOrderAfter());
        assertEquals(set(bar), baz.getOrderAfter());
        assertEquals(set(foo, baz), bar.getOrderBefore());
        assertTrue(bar.getOrderAfter().isEmpty());
        assertTrue(registry.isBefore(bar, foo));
        assertTrue(registry.isBefore(bar, baz));
        assertFalse(registry.isBefore(foo, baz));
        assertFalse(registry.isBefore(baz, foo));
        assertSame(registry, foo.getRegistry());
    }

    @Test
    public void testClosureExtendsEarlierDeclarations() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<Bar> bar = ServiceClass.builder(Bar.class, Bar::new).declare(registry);
        ServiceClass<Baz> a = ServiceClass.builder(Baz.class, Baz::new)
            .orderBefore(foo)
            .orderAfter(bar)
            .declare(registry);
        ServiceClass<Fourth> b = ServiceClass.builder(Fourth.class, Fourth::new)
            .orderAfter(foo)
            .declare(registry);

        assertEquals(set(bar, a), foo.getOrderAfter());
        assertEquals(set(foo, a, b), bar.getOrderBefore());
        assertEquals(set(foo, bar, a), b.getOrderAfter());
        assertTrue(registry.isBefore(bar, b));
    }

    @Test
    public void testSnapshotsDoNotChange() {
        ServiceClass<Foo> foo = foo();
        Set<ServiceClass<?>> before = foo.getOrderAfter();
        ServiceClass.builder(Bar.class, Bar::new).orderBefore(foo).declare(registry);
        assertTrue(before.isEmpty());
        assertEquals(1, foo.getOrderAfter().size());
    }

    @Test
    public void testInheritedOrdering() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<ParentService> parent = ServiceClass.builder(ParentService.class, ParentService::new)
            .orderAfter(foo)
            .declare(registry);
        ServiceClass<ChildService> child = ServiceClass.builder(ChildService.class, ChildService::new)
            .parent(parent)
            .declare(registry);
        assertEquals(set(foo), child.getOrderAfter());
        assertTrue(child.isSubclassOf(parent));
        assertFalse(parent.isSubclassOf(child));
    }

    @Test
    public void testInheritanceWithoutDependencies() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<ParentService> parent = ServiceClass.builder(ParentService.class, ParentService::new)
            .orderAfter(foo)
            .declare(registry);
        ServiceClass<ChildService> child = ServiceClass.builder(ChildService.class, ChildService::new)
            .parent(parent)
            .inheritDependencies(false)
            .declare(registry);
        assertTrue(child.getOrderAfter().isEmpty());
    }

    @Test(expected = DeclarationException.class)
    public void testParentMustBeSuperclass() {
        ServiceClass<Foo> foo = foo();
        ServiceClass.builder(Bar.class, Bar::new).parent(foo);
    }

    @Test
    public void testInheritFromClassWithHandlers() {
        ServiceClass<ParentService> parent = ServiceClass.builder(ParentService.class, ParentService::new)
            .handler("onMessage", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
            .declare(registry);
        try {
            ServiceClass.builder(ChildService.class, ChildService::new).parent(parent).declare(registry);
            fail("expected DeclarationException");
        } catch (DeclarationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("inheritance from service class with handlers"));
        }
    }

    @Test
    public void testDependencyLoopRejected() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<Bar> bar = ServiceClass.builder(Bar.class, Bar::new)
            .orderAfter(foo)
            .declare(registry);
        try {
            ServiceClass.builder(Baz.class, Baz::new)
                .orderBefore(foo)
                .orderAfter(bar)
                .declare(registry);
            fail("expected DeclarationException");
        } catch (DeclarationException e) {
            assertEquals("dependency loop: " + Baz.class.getName() + " loops through " + Foo.class.getName(),
                         e.getMessage());
        }
        // Registry unchanged
        assertEquals(2, registry.getServiceClasses().size());
        assertEquals(set(bar), foo.getOrderBefore());
        assertTrue(foo.getOrderAfter().isEmpty());
    }

    @Test(expected = DeclarationException.class)
    public void testDirectLoopRejected() {
        ServiceClass<Foo> foo = foo();
        ServiceClass.builder(Bar.class, Bar::new)
            .orderBefore(foo)
            .orderAfter(foo)
            .declare(registry);
    }

    @Test
    @SuppressWarnings("deprecation")
    public void testMixedOrderingRejected() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<Bar> bar = ServiceClass.builder(Bar.class, Bar::new).declare(registry);
        try {
            ServiceClass.builder(Baz.class, Baz::new)
                .orderBefore(foo)
                .serviceAfter(bar)
                .declare(registry);
            fail("expected DeclarationException");
        } catch (DeclarationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("mixes old and new ordering"));
        }
    }

    @Test
    @SuppressWarnings("deprecation")
    public void testLegacyOrdering() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<Bar> bar = ServiceClass.builder(Bar.class, Bar::new)
            .serviceBefore(foo)
            .declare(registry);
        assertEquals(set(bar), foo.getServiceAfter());
        assertEquals(set(foo), bar.getServiceBefore());
    }

    @Test
    public void testUndeclaredReference() {
        ServiceRegistry other = new ServiceRegistry();
        ServiceClass<Foo> foreign = ServiceClass.builder(Foo.class, Foo::new).declare(other);
        try {
            ServiceClass.builder(Bar.class, Bar::new).orderAfter(foreign).declare(registry);
            fail("expected DeclarationException");
        } catch (DeclarationException e) {
            // expected
        }
        try {
            registry.getOrderAfter(foreign);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertFalse(registry.isDeclared(foreign));
        assertTrue(other.isDeclared(foreign));
    }

    @Test(expected = DeclarationException.class)
    public void testAlreadyDeclared() {
        ServiceClass<Foo> foo = foo();
        registry.declare(foo);
    }

    @Test
    public void testHandlerConflict() {
        try {
            ServiceClass.builder(Listener.class, Listener::new)
                .handler("first", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
                .handler("second", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
                .declare(registry);
            fail("expected DeclarationException");
        } catch (DeclarationException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("handler conflict between first and second"));
        }
        ServiceClass.builder(Listener.class, Listener::new)
            .handler("first", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
            .handler("second", s -> s::onMessage, Handlers.messageHandler(MessageType.NORMAL, null))
            .declare(registry);
    }

    @Test(expected = DeclarationException.class)
    public void testDuplicateHandlerName() {
        ServiceClass.builder(Listener.class, Listener::new)
            .handler("same", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
            .handler("same", s -> s::onMessage, Handlers.messageHandler(MessageType.NORMAL, null));
    }

    @Test
    public void testHandlerRequiresDependency() {
        ServiceClass<Source> source = ServiceClass.builder(Source.class, Source::new).declare(registry);
        HandlerSpec<Consumer<? super String>> spec =
            Handlers.dependencySignal(source, "changed", s -> s.changed, false);
        assertEquals(Collections.singleton(source), spec.getRequiredDependencies());
        try {
            ServiceClass.builder(Listener.class, Listener::new)
                .handler("onChanged", s -> s::onChanged, spec)
                .declare(registry);
            fail("expected DeclarationException");
        } catch (DeclarationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("requires dependency"));
        }
        ServiceClass<Listener> listener = ServiceClass.builder(Listener.class, Listener::new)
            .orderAfter(source)
            .handler("onChanged", s -> s::onChanged, spec)
            .declare(registry);
        assertEquals(set(source), listener.getRequiredDependencies());
    }

    @Test
    public void testLinearizationIndependentOfInputOrder() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<Bar> bar = ServiceClass.builder(Bar.class, Bar::new)
            .orderBefore(foo)
            .declare(registry);
        ServiceClass<Baz> baz = ServiceClass.builder(Baz.class, Baz::new)
            .orderBefore(bar)
            .declare(registry);
        ServiceClass<Fourth> fourth = ServiceClass.builder(Fourth.class, Fourth::new)
            .orderBefore(bar)
            .declare(registry);

        List<ServiceClass<?>> expected = Arrays.<ServiceClass<?>>asList(baz, fourth, bar, foo);
        assertEquals(expected, registry.linearize());
        assertEquals(expected, registry.sort(Arrays.<ServiceClass<?>>asList(foo, fourth, bar, baz)));
        assertEquals(expected, registry.sort(Arrays.<ServiceClass<?>>asList(bar, foo, baz, fourth)));
        assertEquals(expected, registry.sort(Arrays.<ServiceClass<?>>asList(fourth, baz, foo, bar)));
        assertEquals(0, registry.indexOf(baz));
        assertEquals(3, registry.indexOf(foo));
        assertTrue(registry.comparator().compare(bar, foo) < 0);
    }

    @Test
    public void testUnrelatedClassesKeepDeclarationOrder() {
        ServiceClass<Foo> foo = foo();
        ServiceClass<Bar> bar = ServiceClass.builder(Bar.class, Bar::new).declare(registry);
        ServiceClass<Baz> baz = ServiceClass.builder(Baz.class, Baz::new).declare(registry);
        assertEquals(Arrays.<ServiceClass<?>>asList(foo, bar, baz),
                     registry.sort(Arrays.<ServiceClass<?>>asList(baz, foo, bar)));
    }

    @Test
    public void testClosedRegistry() {
        foo();
        assertFalse(registry.isClosed());
        registry.close();
        assertTrue(registry.isClosed());
        try {
            ServiceClass.builder(Bar.class, Bar::new).declare(registry);
            fail("expected DeclarationException");
        } catch (DeclarationException e) {
            // expected
        }
        assertEquals(1, registry.getServiceClasses().size());
    }

}
