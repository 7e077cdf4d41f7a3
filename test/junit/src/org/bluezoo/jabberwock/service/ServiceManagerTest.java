/*
 * ServiceManagerTest.java
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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.stanza.IQ;
import org.bluezoo.jabberwock.stanza.IQType;
import org.bluezoo.jabberwock.stanza.Message;
import org.bluezoo.jabberwock.stanza.MessageType;
import org.bluezoo.jabberwock.stanza.Stanza;
import org.bluezoo.jabberwock.stream.SimpleStanzaStream;
import org.bluezoo.jabberwock.xso.XSO;
import org.bluezoo.jabberwock.xso.XSOClass;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for ServiceManager and the service lifecycle.
 */
public class ServiceManagerTest {

    /**
     * Records its lifecycle in a shared journal.
     */
    public static class Recording extends Service {
        private final List<String> journal;
        private final String failure;

        public Recording(ServiceContext context, List<String> journal, String failure) {
            super(context);
            this.journal = journal;
            this.failure = failure;
            journal.add("start " + name());
        }

        String name() {
            return getServiceClass().getJavaClass().getSimpleName() + "@" + Integer.toHexString(
                System.identityHashCode(getServiceClass()));
        }

        @Override
        protected void doShutdown() throws Exception {
            journal.add("stop " + name());
            if (failure != null) {
                throw new IOException(failure);
            }
        }
    }

    public static class Source extends Service {
        final Signal<String> changed = new Signal<>("changed");

        public Source(ServiceContext context) {
            super(context);
        }
    }

    public static class Echo extends Service {
        final List<String> received = new ArrayList<>();

        public Echo(ServiceContext context) {
            super(context);
        }

        void onMessage(Message message) {
            received.add(message.getBody());
        }

        void onChanged(String value) {
            received.add("changed " + value);
        }

        Message tag(Message message) {
            message.setBody(message.getBody() + "[echo]");
            return message;
        }
    }

    public static class Tagger extends Service {
        public Tagger(ServiceContext context) {
            super(context);
        }

        Message tag(Message message) {
            message.setBody(message.getBody() + "[tagger]");
            return message;
        }
    }

    /**
     * Hands out a string resource and records its release.
     */
    static class Label extends ServiceDescriptor<String> {
        final List<String> released;
        final String name;
        final boolean fail;

        Label(boolean fail) {
            this(new ArrayList<String>(), "label", fail);
        }

        Label(List<String> released, String name, boolean fail) {
            this.released = released;
            this.name = name;
            this.fail = fail;
        }

        @Override
        protected ScopedResource<String> acquire(Service service) throws Exception {
            if (fail) {
                throw new IOException("cannot acquire");
            }
            return ScopedResource.of(name, () -> released.add(name));
        }
    }

    /**
     * Holds handlers and resources, and fails its shutdown hook with an
     * error.
     */
    public static class Crashing extends Service {
        final List<String> received = new ArrayList<>();

        public Crashing(ServiceContext context) {
            super(context);
        }

        void onMessage(Message message) {
            received.add(message.getBody());
        }

        Message mark(Message message) {
            message.setBody(message.getBody() + "[crashing]");
            return message;
        }

        @Override
        protected void doShutdown() throws Exception {
            throw new AssertionError("hook failed");
        }
    }

    private ServiceRegistry registry;
    private List<Stanza> sent;
    private SimpleStanzaStream stream;
    private ServiceManager manager;
    private List<String> journal;

    @Before
    public void setUp() {
        registry = new ServiceRegistry();
        sent = new ArrayList<>();
        stream = new SimpleStanzaStream(sent::add, Runnable::run);
        manager = new ServiceManager(registry, stream, Logger.getLogger("test"));
        journal = new ArrayList<>();
    }

    private ServiceClass<Recording> recording(String failure, ServiceClass<?>... after) {
        return ServiceClass.builder(Recording.class, c -> new Recording(c, journal, failure))
            .orderAfter(after)
            .declare(registry);
    }

    private static Message chat(String body) {
        Message message = new Message(MessageType.CHAT);
        message.setBody(body);
        return message;
    }

    @Test
    public void testSummonInstantiatesDependenciesFirst() throws Exception {
        ServiceClass<Recording> first = recording(null);
        ServiceClass<Recording> second = recording(null, first);
        ServiceClass<Recording> third = recording(null, second);

        Recording service = manager.summon(third);
        assertEquals(3, manager.getServices().size());
        assertSame(manager.get(first), manager.getServices().get(0));
        assertSame(manager.get(second), manager.getServices().get(1));
        assertSame(service, manager.getServices().get(2));

        assertSame(manager.get(first), service.getDependencies().get(first));
        assertSame(manager.get(second), service.getDependencies().get(second));
        assertEquals(2, service.getDependencies().size());
        assertSame(stream, service.getStream());
        assertSame(third, service.getServiceClass());
        assertEquals("test.service.Recording", service.getLogger().getName());

        assertSame(service, manager.summon(third));
        assertEquals(3, manager.getServices().size());
    }

    @Test
    public void testGetBeforeSummon() {
        ServiceClass<Recording> first = recording(null);
        assertNull(manager.get(first));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingDependencyLookup() throws Exception {
        ServiceClass<Recording> first = recording(null);
        ServiceClass<Recording> other = recording(null);
        manager.summon(first).getDependencies().get(other);
    }

    @Test
    public void testShutdownInReverseOrder() throws Exception {
        ServiceClass<Recording> first = recording(null);
        ServiceClass<Recording> second = recording(null, first);
        Recording a = manager.summon(first);
        Recording b = manager.summon(second);
        journal.clear();

        manager.shutdown();
        assertEquals(Arrays.asList("stop " + b.name(), "stop " + a.name()), journal);
        assertTrue(a.isShutdown());
        assertTrue(b.isShutdown());
        assertTrue(manager.getServices().isEmpty());
        assertNull(manager.get(first));
    }

    @Test
    public void testShutdownContinuesPastFailures() throws Exception {
        ServiceClass<Recording> first = recording("first failed");
        ServiceClass<Recording> second = recording(null, first);
        ServiceClass<Recording> third = recording("third failed", second);
        manager.summon(third);
        journal.clear();
        try {
            manager.shutdown();
            fail("expected ServiceShutdownException");
        } catch (ServiceShutdownException e) {
            assertEquals("2 services failed to shut down", e.getMessage());
            assertEquals(2, e.getSuppressed().length);
            assertEquals("third failed", e.getSuppressed()[0].getMessage());
            assertEquals("first failed", e.getSuppressed()[1].getMessage());
        }
        assertEquals(3, journal.size());
        assertTrue(manager.getServices().isEmpty());
    }

    @Test
    public void testServiceShutdownIdempotent() throws Exception {
        ServiceClass<Recording> first = recording(null);
        Recording service = manager.summon(first);
        journal.clear();
        service.shutdown();
        service.shutdown();
        assertEquals(1, journal.size());
    }

    @Test
    public void testHandlersWiredAndReleased() throws Exception {
        ServiceClass<Echo> echo = ServiceClass.builder(Echo.class, Echo::new)
            .handler("onMessage", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
            .declare(registry);
        Echo service = manager.summon(echo);
        stream.dispatch(chat("hello"));
        assertEquals(Arrays.asList("hello"), service.received);

        manager.shutdown();
        stream.dispatch(chat("again"));
        assertEquals(1, service.received.size());
        // The key is free again
        stream.registerMessageHandler(MessageType.CHAT, null, m -> { }).close();
    }

    @Test
    public void testFiltersFollowServiceOrder() throws Exception {
        ServiceClass<Echo> echo = ServiceClass.builder(Echo.class, Echo::new)
            .handler("tag", s -> s::tag, Handlers.outboundMessageFilter())
            .declare(registry);
        ServiceClass<Tagger> tagger = ServiceClass.builder(Tagger.class, Tagger::new)
            .orderBefore(echo)
            .handler("tag", s -> s::tag, Handlers.outboundMessageFilter())
            .declare(registry);
        // Summoned in the opposite order to the declared ordering
        manager.summon(echo);
        manager.summon(tagger);
        stream.send(chat(""));
        assertEquals("[tagger][echo]", ((Message) sent.get(0)).getBody());
    }

    @Test
    public void testIQHandler() throws Exception {
        ServiceClass<Pong> pong = ServiceClass.builder(Pong.class, Pong::new)
            .handler("ping", s -> s::handlePing, Handlers.iqHandler(IQType.GET, Ping.CLASS))
            .declare(registry);
        manager.summon(pong);
        IQ request = new IQ(IQType.GET, new Ping());
        request.setId("p");
        stream.dispatch(request);
        assertEquals(1, sent.size());
        assertEquals(IQType.RESULT, ((IQ) sent.get(0)).getType());
    }

    @Test
    public void testDependencySignal() throws Exception {
        ServiceClass<Source> source = ServiceClass.builder(Source.class, Source::new).declare(registry);
        ServiceClass<Echo> echo = ServiceClass.builder(Echo.class, Echo::new)
            .orderAfter(source)
            .handler("onChanged", s -> s::onChanged,
                     Handlers.<Source, String>dependencySignal(source, "changed", s -> s.changed, true))
            .declare(registry);
        Echo service = manager.summon(echo);
        Source dependency = manager.get(source);
        assertNotNull(dependency);
        dependency.changed.fire("x");
        assertEquals(Arrays.asList("changed x"), service.received);

        service.shutdown();
        assertEquals(0, dependency.changed.getListenerCount());
    }

    @Test
    public void testDescriptorResource() throws Exception {
        Label label = new Label(false);
        ServiceClass<Source> source = ServiceClass.builder(Source.class, Source::new)
            .descriptor(label)
            .declare(registry);
        Source service = manager.summon(source);
        assertEquals("label", label.get(service));
        service.shutdown();
        assertEquals(Arrays.asList("label"), label.released);
        try {
            label.get(service);
            fail("expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("resource manager descriptor has not been initialised", e.getMessage());
        }
    }

    @Test
    public void testFailedSetupIsRolledBack() throws Exception {
        Label good = new Label(false);
        ServiceClass<Echo> echo = ServiceClass.builder(Echo.class, Echo::new)
            .handler("onMessage", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
            .descriptor(good)
            .descriptor(new Label(true))
            .declare(registry);
        try {
            manager.summon(echo);
            fail("expected IOException");
        } catch (IOException e) {
            assertEquals("cannot acquire", e.getMessage());
        }
        assertNull(manager.get(echo));
        assertEquals(Arrays.asList("label"), good.released);
        // Handler registration was undone
        stream.registerMessageHandler(MessageType.CHAT, null, m -> { }).close();
    }

    @Test
    public void testShutdownHookFailureStillReleasesResources() throws Exception {
        Label label = new Label(false);
        ServiceClass<Recording> failing = ServiceClass.builder(Recording.class,
                                                               c -> new Recording(c, journal, "hook failed"))
            .descriptor(label)
            .declare(registry);
        Recording service = manager.summon(failing);
        try {
            service.shutdown();
            fail("expected IOException");
        } catch (IOException e) {
            assertEquals("hook failed", e.getMessage());
        }
        assertEquals(Arrays.asList("label"), label.released);
        assertTrue(service.isShutdown());
    }

    @Test
    public void testShutdownHookErrorStillReleasesEverything() throws Exception {
        List<String> released = new ArrayList<>();
        ServiceClass<Crashing> crashing = ServiceClass.builder(Crashing.class, Crashing::new)
            .handler("onMessage", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
            .handler("mark", s -> s::mark, Handlers.outboundMessageFilter())
            .descriptor(new Label(released, "first", false))
            .descriptor(new Label(released, "second", false))
            .declare(registry);
        Crashing service = manager.summon(crashing);
        stream.dispatch(chat("before"));
        stream.send(chat(""));
        assertEquals(Arrays.asList("before"), service.received);
        assertEquals("[crashing]", ((Message) sent.get(0)).getBody());

        try {
            service.shutdown();
            fail("expected AssertionError from the hook");
        } catch (AssertionError e) {
            assertEquals("hook failed", e.getMessage());
        }
        assertTrue(service.isShutdown());
        assertEquals(Arrays.asList("second", "first"), released);

        stream.dispatch(chat("after"));
        stream.send(chat(""));
        assertEquals(Arrays.asList("before"), service.received);
        assertEquals("", ((Message) sent.get(1)).getBody());
        // Both handler keys are free again
        stream.registerMessageHandler(MessageType.CHAT, null, m -> { }).close();
    }

    @Test
    public void testManagerShutdownContinuesPastErrors() throws Exception {
        ServiceClass<Crashing> crashing = ServiceClass.builder(Crashing.class, Crashing::new)
            .declare(registry);
        ServiceClass<Recording> after = recording(null, crashing);
        Recording last = manager.summon(after);
        journal.clear();
        try {
            manager.shutdown();
            fail("expected ServiceShutdownException");
        } catch (ServiceShutdownException e) {
            assertEquals("one service failed to shut down", e.getMessage());
            assertTrue(e.getSuppressed()[0] instanceof AssertionError);
        }
        assertEquals(Arrays.asList("stop " + last.name()), journal);
        assertTrue(manager.getServices().isEmpty());
    }

    @Test
    public void testSetupErrorIsRolledBack() throws Exception {
        List<String> released = new ArrayList<>();
        ServiceDescriptor<String> broken = new ServiceDescriptor<String>() {
            @Override
            protected ScopedResource<String> acquire(Service service) {
                throw new AssertionError("cannot acquire");
            }
        };
        ServiceClass<Echo> echo = ServiceClass.builder(Echo.class, Echo::new)
            .handler("onMessage", s -> s::onMessage, Handlers.messageHandler(MessageType.CHAT, null))
            .descriptor(new Label(released, "first", false))
            .descriptor(broken)
            .declare(registry);
        try {
            manager.summon(echo);
            fail("expected AssertionError from the descriptor");
        } catch (AssertionError e) {
            assertEquals("cannot acquire", e.getMessage());
        }
        assertNull(manager.get(echo));
        assertEquals(Arrays.asList("first"), released);
        stream.registerMessageHandler(MessageType.CHAT, null, m -> { }).close();
    }

    public static class Ping extends XSO {
        static final XSOClass<Ping> CLASS = XSOClass.builder(Ping.class, Ping::new)
            .tag("urn:example:service", "ping")
            .build();

        static {
            IQ.PAYLOAD.register(CLASS);
        }

        @Override
        public XSOClass<Ping> getXSOClass() {
            return CLASS;
        }
    }

    public static class Pong extends Service {
        public Pong(ServiceContext context) {
            super(context);
        }

        XSO handlePing(IQ request) {
            return null;
        }
    }

}
