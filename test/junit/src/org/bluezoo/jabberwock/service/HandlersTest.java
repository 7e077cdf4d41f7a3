/*
 * HandlersTest.java
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

import org.bluezoo.jabberwock.JID;
import org.bluezoo.jabberwock.stanza.IQ;
import org.bluezoo.jabberwock.stanza.IQType;
import org.bluezoo.jabberwock.stanza.Message;
import org.bluezoo.jabberwock.stanza.MessageType;
import org.bluezoo.jabberwock.stanza.Presence;
import org.bluezoo.jabberwock.stanza.PresenceType;
import org.bluezoo.jabberwock.xso.XSO;
import org.bluezoo.jabberwock.xso.XSOClass;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the handler specifications and their predicates.
 */
public class HandlersTest {

    public static class Query extends XSO {
        static final XSOClass<Query> CLASS = XSOClass.builder(Query.class, Query::new)
            .tag("urn:example:handlers", "query")
            .build();

        @Override
        public XSOClass<Query> getXSOClass() {
            return CLASS;
        }
    }

    public static class Source extends Service {
        final Signal<String> changed = new Signal<>("changed");

        public Source(ServiceContext context) {
            super(context);
        }
    }

    public static class Everything extends Service {
        public Everything(ServiceContext context) {
            super(context);
        }

        XSO query(IQ request) {
            return null;
        }

        void message(Message message) {
        }

        void presence(Presence presence) {
        }

        Message filterMessage(Message message) {
            return message;
        }

        Presence filterPresence(Presence presence) {
            return presence;
        }

        void changed(String value) {
        }
    }

    private static final JID PEER = JID.fromString("peer@example.com");

    private ServiceRegistry registry;
    private ServiceClass<Source> source;
    private ServiceClass<Everything> everything;

    @Before
    public void setUp() {
        registry = new ServiceRegistry();
        source = ServiceClass.builder(Source.class, Source::new).declare(registry);
        everything = ServiceClass.builder(Everything.class, Everything::new)
            .orderAfter(source)
            .handler("query", s -> s::query, Handlers.iqHandler(IQType.GET, Query.CLASS))
            .handler("message", s -> s::message, Handlers.messageHandler(MessageType.CHAT, PEER))
            .handler("presence", s -> s::presence,
                     Handlers.presenceHandler(PresenceType.AVAILABLE, null),
                     Handlers.presenceHandler(PresenceType.UNAVAILABLE, null))
            .handler("inMessage", s -> s::filterMessage, Handlers.inboundMessageFilter())
            .handler("outMessage", s -> s::filterMessage, Handlers.outboundMessageFilter())
            .handler("inPresence", s -> s::filterPresence, Handlers.inboundPresenceFilter())
            .handler("outPresence", s -> s::filterPresence, Handlers.outboundPresenceFilter())
            .handler("changed", s -> s::changed,
                     Handlers.<Source, String>dependencySignal(source, "changed", s -> s.changed, false))
            .declare(registry);
    }

    @Test
    public void testIQHandlerPredicate() {
        assertTrue(Handlers.isIQHandler(everything, "query", IQType.GET, Query.CLASS));
        assertFalse(Handlers.isIQHandler(everything, "query", IQType.SET, Query.CLASS));
        assertFalse(Handlers.isIQHandler(everything, "message", IQType.GET, Query.CLASS));
    }

    @Test
    public void testStanzaHandlerPredicates() {
        assertTrue(Handlers.isMessageHandler(everything, "message", MessageType.CHAT, PEER));
        assertFalse(Handlers.isMessageHandler(everything, "message", MessageType.CHAT, null));
        assertTrue(Handlers.isPresenceHandler(everything, "presence", PresenceType.AVAILABLE, null));
        assertTrue(Handlers.isPresenceHandler(everything, "presence", PresenceType.UNAVAILABLE, null));
        assertFalse(Handlers.isPresenceHandler(everything, "presence", PresenceType.SUBSCRIBE, null));
    }

    @Test
    public void testFilterPredicates() {
        assertTrue(Handlers.isInboundMessageFilter(everything, "inMessage"));
        assertTrue(Handlers.isOutboundMessageFilter(everything, "outMessage"));
        assertTrue(Handlers.isInboundPresenceFilter(everything, "inPresence"));
        assertTrue(Handlers.isOutboundPresenceFilter(everything, "outPresence"));
        assertFalse(Handlers.isInboundMessageFilter(everything, "outMessage"));
        assertFalse(Handlers.isOutboundPresenceFilter(everything, "inPresence"));
    }

    @Test
    public void testDependencySignalPredicate() {
        assertTrue(Handlers.isDependencySignalHandler(everything, "changed", source, "changed"));
        assertFalse(Handlers.isDependencySignalHandler(everything, "changed", source, "other"));
        assertFalse(Handlers.isDependencySignalHandler(everything, "query", source, "changed"));
    }

    @Test
    public void testSpecEquality() {
        HandlerSpec<?> a = Handlers.messageHandler(MessageType.CHAT, PEER);
        HandlerSpec<?> b = Handlers.messageHandler(MessageType.CHAT, PEER);
        HandlerSpec<?> c = Handlers.messageHandler(MessageType.NORMAL, PEER);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertEquals(Handlers.MESSAGE_HANDLER, a.getKind());
        assertEquals(Arrays.<Object>asList(MessageType.CHAT, PEER), a.getArguments());
        assertTrue(a.isUnique());
        assertTrue(a.getRequiredDependencies().isEmpty());
    }

    @Test
    public void testDependencySignalDiscriminator() {
        HandlerSpec<?> spec = Handlers.<Source, String>dependencySignal(source, "changed", s -> s.changed, true);
        assertEquals(Arrays.<Object>asList(source, "changed"), spec.getDiscriminator());
        assertEquals(4, spec.getArguments().size());
        assertTrue(spec.matches(Handlers.DEPENDENCY_SIGNAL, Arrays.asList(source, "changed")));
    }

    @Test
    public void testHandlerEntries() {
        assertEquals(8, everything.getHandlers().size());
        assertEquals("presence", everything.getHandlers().get(2).getName());
        assertEquals(2, everything.getHandlers().get(2).getSpecs().size());
        assertEquals(Arrays.asList(source), Arrays.asList(everything.getRequiredDependencies().toArray()));
    }

}
