/*
 * SimpleStanzaStream.java
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

import java.text.MessageFormat;
import java.util.Map;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

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
import org.bluezoo.jabberwock.xso.XSO;
import org.bluezoo.jabberwock.xso.XSOClass;

/**
 * An in-memory stanza stream.
 *
 * <p>Incoming stanzas are handed to {@link #dispatch}, typically as the
 * callback of a {@code SAXDriver}. Messages and presence pass through the
 * inbound filters and are then delivered to the handler registered for
 * their type and sender, trying the full sender JID first, then its bare
 * JID, then the wildcard. IQ requests are answered with the result of the
 * handler registered for their type and payload class; requests nobody
 * handles are answered with {@code service-unavailable}. Outgoing stanzas
 * pass through the outbound filters and are handed to the output
 * consumer given at construction.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SimpleStanzaStream implements StanzaStream {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.jabberwock.stream.L10N");

    private static final Logger LOGGER = Logger.getLogger(SimpleStanzaStream.class.getName());

    /**
     * Handler key: a stanza type and an optional qualifier, the sender JID
     * or the payload class.
     */
    private static final class Key {
        final Object type;
        final Object qualifier;

        Key(Object type, Object qualifier) {
            this.type = type;
            this.qualifier = qualifier;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Key)) {
                return false;
            }
            Key other = (Key) obj;
            return type.equals(other.type) && Objects.equals(qualifier, other.qualifier);
        }

        @Override
        public int hashCode() {
            return type.hashCode() * 31 + Objects.hashCode(qualifier);
        }

        @Override
        public String toString() {
            return "(" + type + ", " + qualifier + ")";
        }
    }

    private final Consumer<? super Stanza> output;
    private final Executor executor;
    private final Map<Key, IQRequestHandler> iqHandlers = new ConcurrentHashMap<>();
    private final Map<Key, Consumer<? super Message>> messageHandlers = new ConcurrentHashMap<>();
    private final Map<Key, Consumer<? super Presence>> presenceHandlers = new ConcurrentHashMap<>();
    private final StanzaFilter<Message> inboundMessageFilter = new StanzaFilter<>();
    private final StanzaFilter<Presence> inboundPresenceFilter = new StanzaFilter<>();
    private final StanzaFilter<Message> outboundMessageFilter = new StanzaFilter<>();
    private final StanzaFilter<Presence> outboundPresenceFilter = new StanzaFilter<>();

    /**
     * Creates a stream using the common fork-join pool for deferred work.
     *
     * @param output receives every stanza sent
     */
    public SimpleStanzaStream(Consumer<? super Stanza> output) {
        this(output, ForkJoinPool.commonPool());
    }

    /**
     * Creates a stream.
     *
     * @param output receives every stanza sent
     * @param executor runs deferred work
     */
    public SimpleStanzaStream(Consumer<? super Stanza> output, Executor executor) {
        this.output = output;
        this.executor = executor;
    }

    @Override
    public Registration registerIQHandler(IQType type, XSOClass<?> payloadClass, IQRequestHandler handler) {
        return register(iqHandlers, new Key(type, payloadClass), handler);
    }

    @Override
    public Registration registerMessageHandler(MessageType type, JID from, Consumer<? super Message> handler) {
        return register(messageHandlers, new Key(type, from), handler);
    }

    @Override
    public Registration registerPresenceHandler(PresenceType type, JID from, Consumer<? super Presence> handler) {
        return register(presenceHandlers, new Key(type, from), handler);
    }

    private static <H> Registration register(final Map<Key, H> handlers, final Key key, final H handler) {
        if (handlers.putIfAbsent(key, handler) != null) {
            String msg = MessageFormat.format(L10N.getString("err.handler_registered"), key);
            throw new IllegalStateException(msg);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.handler_registered"), key));
        }
        return () -> handlers.remove(key, handler);
    }

    @Override
    public StanzaFilter<Message> getInboundMessageFilter() {
        return inboundMessageFilter;
    }

    @Override
    public StanzaFilter<Presence> getInboundPresenceFilter() {
        return inboundPresenceFilter;
    }

    @Override
    public StanzaFilter<Message> getOutboundMessageFilter() {
        return outboundMessageFilter;
    }

    @Override
    public StanzaFilter<Presence> getOutboundPresenceFilter() {
        return outboundPresenceFilter;
    }

    @Override
    public Executor getExecutor() {
        return executor;
    }

    @Override
    public void send(Stanza stanza) {
        Stanza filtered = stanza;
        if (stanza instanceof Message) {
            filtered = outboundMessageFilter.filter((Message) stanza);
        } else if (stanza instanceof Presence) {
            filtered = outboundPresenceFilter.filter((Presence) stanza);
        }
        if (filtered == null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.outbound_dropped"), stanza));
            }
            return;
        }
        output.accept(filtered);
    }

    /**
     * Routes an incoming stanza.
     *
     * @param xso the stanza
     */
    public void dispatch(XSO xso) {
        if (xso instanceof Message) {
            Message message = inboundMessageFilter.filter((Message) xso);
            if (message != null) {
                deliver(messageHandlers, message.getType(), message.getFrom(), message);
            }
        } else if (xso instanceof Presence) {
            Presence presence = inboundPresenceFilter.filter((Presence) xso);
            if (presence != null) {
                deliver(presenceHandlers, presence.getType(), presence.getFrom(), presence);
            }
        } else if (xso instanceof IQ) {
            dispatchIQ((IQ) xso);
        } else {
            LOGGER.warning(MessageFormat.format(L10N.getString("log.unknown_stanza"), xso));
        }
    }

    private <S extends Stanza> void deliver(Map<Key, Consumer<? super S>> handlers,
                                            Object type, JID from, S stanza) {
        Consumer<? super S> handler = null;
        if (from != null) {
            handler = handlers.get(new Key(type, from));
            if (handler == null && !from.isBare()) {
                handler = handlers.get(new Key(type, from.bare()));
            }
        }
        if (handler == null) {
            handler = handlers.get(new Key(type, null));
        }
        if (handler == null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.unhandled"), stanza));
            }
            return;
        }
        handler.accept(stanza);
    }

    private void dispatchIQ(IQ iq) {
        IQType type = iq.getType();
        if (!type.isRequest()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.unhandled"), iq));
            }
            return;
        }
        XSO payload = iq.getPayload();
        IQRequestHandler handler = payload == null ? null
            : iqHandlers.get(new Key(type, payload.getXSOClass()));
        if (handler == null) {
            send(iq.makeError(new StanzaError(ErrorType.CANCEL, "service-unavailable", null)));
            return;
        }
        IQ response;
        try {
            response = iq.makeResult(handler.handleRequest(iq));
        } catch (StanzaException e) {
            response = iq.makeError(e.toStanzaError());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, MessageFormat.format(L10N.getString("log.handler_failed"), iq), e);
            response = iq.makeError(new StanzaError(ErrorType.CANCEL, "internal-server-error", null));
        }
        send(response);
    }

}
