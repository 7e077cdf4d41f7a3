/*
 * SimpleStanzaStreamTest.java
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

package org.bluezoo.jabberwock.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.bluezoo.jabberwock.JID;
import org.bluezoo.jabberwock.stanza.ErrorType;
import org.bluezoo.jabberwock.stanza.IQ;
import org.bluezoo.jabberwock.stanza.IQType;
import org.bluezoo.jabberwock.stanza.Message;
import org.bluezoo.jabberwock.stanza.MessageType;
import org.bluezoo.jabberwock.stanza.Presence;
import org.bluezoo.jabberwock.stanza.PresenceType;
import org.bluezoo.jabberwock.stanza.Stanza;
import org.bluezoo.jabberwock.stanza.StanzaError;
import org.bluezoo.jabberwock.stanza.StanzaException;
import org.bluezoo.jabberwock.util.Registration;
import org.bluezoo.jabberwock.xso.Tag;
import org.bluezoo.jabberwock.xso.XSO;
import org.bluezoo.jabberwock.xso.XSOClass;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for SimpleStanzaStream.
 */
public class SimpleStanzaStreamTest {

    public static class Query extends XSO {
        static final XSOClass<Query> CLASS = XSOClass.builder(Query.class, Query::new)
            .tag("urn:example:query", "query")
            .build();

        static {
            IQ.PAYLOAD.register(CLASS);
        }

        @Override
        public XSOClass<Query> getXSOClass() {
            return CLASS;
        }
    }

    private static final JID FULL = JID.fromString("juliet@example.com/balcony");

    private List<Stanza> sent;
    private SimpleStanzaStream stream;

    @Before
    public void setUp() {
        sent = new ArrayList<>();
        stream = new SimpleStanzaStream(sent::add, Runnable::run);
    }

    private static Message message(MessageType type, JID from) {
        Message message = new Message(type);
        message.setFrom(from);
        return message;
    }

    private static IQ request(IQType type) {
        IQ iq = new IQ(type, new Query());
        iq.setId("q1");
        iq.setFrom(FULL);
        return iq;
    }

    private IQ onlyResponse() {
        assertEquals(1, sent.size());
        assertTrue(sent.get(0) instanceof IQ);
        return (IQ) sent.get(0);
    }

    @Test
    public void testMessageHandlerLookupOrder() {
        final List<String> calls = new ArrayList<>();
        stream.registerMessageHandler(MessageType.CHAT, null, m -> calls.add("wildcard"));
        Registration bare = stream.registerMessageHandler(MessageType.CHAT, FULL.bare(), m -> calls.add("bare"));
        Registration full = stream.registerMessageHandler(MessageType.CHAT, FULL, m -> calls.add("full"));

        stream.dispatch(message(MessageType.CHAT, FULL));
        full.close();
        stream.dispatch(message(MessageType.CHAT, FULL));
        bare.close();
        stream.dispatch(message(MessageType.CHAT, FULL));
        stream.dispatch(message(MessageType.CHAT, null));
        stream.dispatch(message(MessageType.NORMAL, FULL));

        assertEquals(Arrays.asList("full", "bare", "wildcard", "wildcard"), calls);
    }

    @Test
    public void testPresenceHandler() {
        final List<Presence> received = new ArrayList<>();
        stream.registerPresenceHandler(PresenceType.AVAILABLE, null, received::add);
        Presence presence = new Presence();
        presence.setFrom(FULL);
        stream.dispatch(presence);
        stream.dispatch(new Presence(PresenceType.UNAVAILABLE));
        assertEquals(1, received.size());
        assertSame(presence, received.get(0));
    }

    @Test(expected = IllegalStateException.class)
    public void testDuplicateRegistration() {
        stream.registerMessageHandler(MessageType.CHAT, FULL, m -> { });
        stream.registerMessageHandler(MessageType.CHAT, FULL, m -> { });
    }

    @Test
    public void testRegistrationReleasesKey() {
        Registration registration = stream.registerIQHandler(IQType.GET, Query.CLASS, iq -> null);
        registration.close();
        stream.registerIQHandler(IQType.GET, Query.CLASS, iq -> null).close();
    }

    @Test
    public void testInboundFilterCanDrop() {
        final List<Message> received = new ArrayList<>();
        stream.registerMessageHandler(MessageType.CHAT, null, received::add);
        stream.getInboundMessageFilter().register(m -> m.getBody() == null ? null : m, 0);
        stream.dispatch(message(MessageType.CHAT, FULL));
        Message withBody = message(MessageType.CHAT, FULL);
        withBody.setBody("hello");
        stream.dispatch(withBody);
        assertEquals(1, received.size());
        assertEquals("hello", received.get(0).getBody());
    }

    @Test
    public void testOutboundFiltersInOrder() {
        stream.getOutboundMessageFilter().register(m -> {
            m.setBody(m.getBody() + "b");
            return m;
        }, 2);
        stream.getOutboundMessageFilter().register(m -> {
            m.setBody(m.getBody() + "a");
            return m;
        }, 1);
        Message message = new Message(MessageType.CHAT);
        message.setBody("");
        stream.send(message);
        assertEquals(1, sent.size());
        assertEquals("ab", ((Message) sent.get(0)).getBody());
    }

    @Test
    public void testOutboundFilterDrop() {
        stream.getOutboundPresenceFilter().register(p -> null, 0);
        stream.send(new Presence());
        assertTrue(sent.isEmpty());
        // IQs are not filtered
        stream.send(new IQ(IQType.GET));
        assertEquals(1, sent.size());
    }

    @Test
    public void testIQResult() {
        final Query answer = new Query();
        stream.registerIQHandler(IQType.GET, Query.CLASS, iq -> answer);
        stream.dispatch(request(IQType.GET));
        IQ response = onlyResponse();
        assertEquals(IQType.RESULT, response.getType());
        assertEquals("q1", response.getId());
        assertEquals(FULL, response.getTo());
        assertSame(answer, response.getPayload());
    }

    @Test
    public void testUnhandledIQIsServiceUnavailable() {
        stream.registerIQHandler(IQType.GET, Query.CLASS, iq -> null);
        stream.dispatch(request(IQType.SET));
        IQ response = onlyResponse();
        assertEquals(IQType.ERROR, response.getType());
        StanzaError error = response.getError();
        assertEquals(ErrorType.CANCEL, error.getType());
        assertEquals(Tag.of(StanzaError.CONDITIONS_NAMESPACE, "service-unavailable"), error.getCondition());
    }

    @Test
    public void testIQWithoutPayloadIsServiceUnavailable() {
        IQ iq = new IQ(IQType.GET);
        iq.setId("empty");
        stream.dispatch(iq);
        assertEquals("service-unavailable", onlyResponse().getError().getCondition().getLocalName());
    }

    @Test
    public void testStanzaExceptionBecomesErrorReply() {
        stream.registerIQHandler(IQType.SET, Query.CLASS, iq -> {
            throw new StanzaException(ErrorType.AUTH, "forbidden", "no");
        });
        stream.dispatch(request(IQType.SET));
        StanzaError error = onlyResponse().getError();
        assertEquals(ErrorType.AUTH, error.getType());
        assertEquals("forbidden", error.getCondition().getLocalName());
        assertEquals("no", error.getText());
    }

    @Test
    public void testRuntimeExceptionBecomesInternalServerError() {
        stream.registerIQHandler(IQType.GET, Query.CLASS, iq -> {
            throw new IllegalStateException("boom");
        });
        stream.dispatch(request(IQType.GET));
        StanzaError error = onlyResponse().getError();
        assertEquals(ErrorType.CANCEL, error.getType());
        assertEquals("internal-server-error", error.getCondition().getLocalName());
    }

    @Test
    public void testResponsesAreNotAnswered() {
        stream.dispatch(new IQ(IQType.RESULT));
        stream.dispatch(new IQ(IQType.ERROR));
        assertTrue(sent.isEmpty());
    }

}
