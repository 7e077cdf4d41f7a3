/*
 * StanzaStream.java
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

import java.util.concurrent.Executor;
import java.util.function.Consumer;

import org.bluezoo.jabberwock.JID;
import org.bluezoo.jabberwock.stanza.IQType;
import org.bluezoo.jabberwock.stanza.Message;
import org.bluezoo.jabberwock.stanza.MessageType;
import org.bluezoo.jabberwock.stanza.Presence;
import org.bluezoo.jabberwock.stanza.PresenceType;
import org.bluezoo.jabberwock.stanza.Stanza;
import org.bluezoo.jabberwock.util.Registration;
import org.bluezoo.jabberwock.xso.XSOClass;

/**
 * The live stanza stream of a client session, as seen by services.
 *
 * <p>Services register handlers and filters here; each registration
 * returns a {@link Registration} which undoes it when closed. Registering
 * a second handler for a key already taken fails with an
 * {@link IllegalStateException}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface StanzaStream {

    /**
     * Registers the handler for IQ requests of a type and payload class.
     *
     * @param type {@code GET} or {@code SET}
     * @param payloadClass the class of the request payload
     * @param handler the handler
     * @return the registration
     * @throws IllegalStateException if a handler is already registered
     */
    Registration registerIQHandler(IQType type, XSOClass<?> payloadClass, IQRequestHandler handler);

    /**
     * Registers a handler for incoming messages.
     *
     * @param type the message type
     * @param from the sender, a bare JID matching every resource, or null
     *        for any sender
     * @param handler the handler
     * @return the registration
     * @throws IllegalStateException if a handler is already registered
     */
    Registration registerMessageHandler(MessageType type, JID from, Consumer<? super Message> handler);

    /**
     * Registers a handler for incoming presence.
     *
     * @param type the presence type
     * @param from the sender, a bare JID matching every resource, or null
     *        for any sender
     * @param handler the handler
     * @return the registration
     * @throws IllegalStateException if a handler is already registered
     */
    Registration registerPresenceHandler(PresenceType type, JID from, Consumer<? super Presence> handler);

    StanzaFilter<Message> getInboundMessageFilter();

    StanzaFilter<Presence> getInboundPresenceFilter();

    StanzaFilter<Message> getOutboundMessageFilter();

    StanzaFilter<Presence> getOutboundPresenceFilter();

    /**
     * Returns the executor used for deferred work, such as deferred signal
     * delivery.
     *
     * @return the executor
     */
    Executor getExecutor();

    /**
     * Sends a stanza, running the outbound filters first.
     *
     * @param stanza the stanza
     */
    void send(Stanza stanza);

}
