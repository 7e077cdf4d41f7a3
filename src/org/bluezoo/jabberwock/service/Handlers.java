/*
 * Handlers.java
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
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import org.bluezoo.jabberwock.JID;
import org.bluezoo.jabberwock.stanza.IQType;
import org.bluezoo.jabberwock.stanza.Message;
import org.bluezoo.jabberwock.stanza.MessageType;
import org.bluezoo.jabberwock.stanza.Presence;
import org.bluezoo.jabberwock.stanza.PresenceType;
import org.bluezoo.jabberwock.stream.IQRequestHandler;
import org.bluezoo.jabberwock.stream.StanzaFilter;
import org.bluezoo.jabberwock.stream.StanzaStream;
import org.bluezoo.jabberwock.util.Registration;
import org.bluezoo.jabberwock.xso.XSOClass;

/**
 * Handler specifications for the standard stream hooks, and predicates
 * telling which hooks a service class declares.
 *
 * <pre>
 * public static final ServiceClass&lt;PingService&gt; CLASS =
 *     ServiceClass.builder(PingService.class, PingService::new)
 *         .handler("handlePing", s -&gt; s::handlePing,
 *                  Handlers.iqHandler(IQType.GET, Ping.CLASS))
 *         .declare();
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Handlers {

    public static final String IQ_HANDLER = "iq_handler";
    public static final String MESSAGE_HANDLER = "message_handler";
    public static final String PRESENCE_HANDLER = "presence_handler";
    public static final String INBOUND_MESSAGE_FILTER = "inbound_message_filter";
    public static final String INBOUND_PRESENCE_FILTER = "inbound_presence_filter";
    public static final String OUTBOUND_MESSAGE_FILTER = "outbound_message_filter";
    public static final String OUTBOUND_PRESENCE_FILTER = "outbound_presence_filter";
    public static final String DEPENDENCY_SIGNAL = "depsignal";

    private Handlers() {
    }

    /**
     * Answers IQ requests of a type and payload class.
     *
     * @param type {@code GET} or {@code SET}
     * @param payloadClass the class of the request payload
     * @return the specification
     */
    public static HandlerSpec<IQRequestHandler> iqHandler(IQType type, XSOClass<?> payloadClass) {
        return new HandlerSpec<IQRequestHandler>(IQ_HANDLER, Handlers::applyIQHandler, type, payloadClass);
    }

    private static Registration applyIQHandler(Service service, StanzaStream stream,
                                               IQRequestHandler callback, List<Object> arguments) {
        return stream.registerIQHandler((IQType) arguments.get(0), (XSOClass<?>) arguments.get(1), callback);
    }

    /**
     * Receives messages of a type from a sender.
     *
     * @param type the message type
     * @param from the sender, or null for any
     * @return the specification
     */
    public static HandlerSpec<Consumer<? super Message>> messageHandler(MessageType type, JID from) {
        return new HandlerSpec<Consumer<? super Message>>(MESSAGE_HANDLER, Handlers::applyMessageHandler,
                                                          type, from);
    }

    private static Registration applyMessageHandler(Service service, StanzaStream stream,
                                                    Consumer<? super Message> callback, List<Object> arguments) {
        return stream.registerMessageHandler((MessageType) arguments.get(0), (JID) arguments.get(1), callback);
    }

    /**
     * Receives presence of a type from a sender.
     *
     * @param type the presence type
     * @param from the sender, or null for any
     * @return the specification
     */
    public static HandlerSpec<Consumer<? super Presence>> presenceHandler(PresenceType type, JID from) {
        return new HandlerSpec<Consumer<? super Presence>>(PRESENCE_HANDLER, Handlers::applyPresenceHandler,
                                                           type, from);
    }

    private static Registration applyPresenceHandler(Service service, StanzaStream stream,
                                                     Consumer<? super Presence> callback, List<Object> arguments) {
        return stream.registerPresenceHandler((PresenceType) arguments.get(0), (JID) arguments.get(1), callback);
    }

    /**
     * Filters incoming messages. Filters of different services run in the
     * order of their service classes.
     *
     * @return the specification
     */
    public static HandlerSpec<UnaryOperator<Message>> inboundMessageFilter() {
        return new HandlerSpec<UnaryOperator<Message>>(INBOUND_MESSAGE_FILTER,
            (service, stream, callback, arguments) ->
                applyFilter(service, stream.getInboundMessageFilter(), callback));
    }

    public static HandlerSpec<UnaryOperator<Presence>> inboundPresenceFilter() {
        return new HandlerSpec<UnaryOperator<Presence>>(INBOUND_PRESENCE_FILTER,
            (service, stream, callback, arguments) ->
                applyFilter(service, stream.getInboundPresenceFilter(), callback));
    }

    public static HandlerSpec<UnaryOperator<Message>> outboundMessageFilter() {
        return new HandlerSpec<UnaryOperator<Message>>(OUTBOUND_MESSAGE_FILTER,
            (service, stream, callback, arguments) ->
                applyFilter(service, stream.getOutboundMessageFilter(), callback));
    }

    public static HandlerSpec<UnaryOperator<Presence>> outboundPresenceFilter() {
        return new HandlerSpec<UnaryOperator<Presence>>(OUTBOUND_PRESENCE_FILTER,
            (service, stream, callback, arguments) ->
                applyFilter(service, stream.getOutboundPresenceFilter(), callback));
    }

    private static <S> Registration applyFilter(Service service, StanzaFilter<S> filter, UnaryOperator<S> callback) {
        ServiceClass<?> serviceClass = service.getServiceClass();
        return filter.register(callback, serviceClass.getRegistry().indexOf(serviceClass));
    }

    /**
     * Connects to a signal of a dependency.
     *
     * @param dependency the service class owning the signal
     * @param signalName the name identifying the signal
     * @param signal returns the signal of a dependency instance
     * @param defer whether to deliver on the stream's executor
     * @return the specification, requiring {@code dependency}
     */
    public static <D extends Service, A> HandlerSpec<Consumer<? super A>> dependencySignal(
            final ServiceClass<D> dependency, String signalName,
            final Function<? super D, Signal<A>> signal, final boolean defer) {
        HandlerApplier<Consumer<? super A>> applier = (service, stream, callback, arguments) -> {
            Signal<A> target = signal.apply(service.getDependencies().get(dependency));
            return defer ? target.connectDeferred(callback, stream.getExecutor()) : target.connect(callback);
        };
        return new HandlerSpec<Consumer<? super A>>(DEPENDENCY_SIGNAL, applier,
                                                    Arrays.asList(dependency, signalName, signal, defer),
                                                    Arrays.asList(dependency, signalName),
                                                    true,
                                                    Collections.singleton(dependency));
    }

    // -- predicates --

    /**
     * Indicates whether a service class declares the named callback as a
     * handler of IQ requests of a type and payload class.
     *
     * @param serviceClass the service class
     * @param name the callback name
     * @param type the IQ type
     * @param payloadClass the payload class
     * @return true if so
     */
    public static boolean isIQHandler(ServiceClass<?> serviceClass, String name, IQType type,
                                      XSOClass<?> payloadClass) {
        return hasSpec(serviceClass, name, IQ_HANDLER, Arrays.asList(type, payloadClass));
    }

    public static boolean isMessageHandler(ServiceClass<?> serviceClass, String name, MessageType type, JID from) {
        return hasSpec(serviceClass, name, MESSAGE_HANDLER, Arrays.asList(type, from));
    }

    public static boolean isPresenceHandler(ServiceClass<?> serviceClass, String name, PresenceType type,
                                            JID from) {
        return hasSpec(serviceClass, name, PRESENCE_HANDLER, Arrays.asList(type, from));
    }

    public static boolean isInboundMessageFilter(ServiceClass<?> serviceClass, String name) {
        return hasSpec(serviceClass, name, INBOUND_MESSAGE_FILTER, Collections.emptyList());
    }

    public static boolean isInboundPresenceFilter(ServiceClass<?> serviceClass, String name) {
        return hasSpec(serviceClass, name, INBOUND_PRESENCE_FILTER, Collections.emptyList());
    }

    public static boolean isOutboundMessageFilter(ServiceClass<?> serviceClass, String name) {
        return hasSpec(serviceClass, name, OUTBOUND_MESSAGE_FILTER, Collections.emptyList());
    }

    public static boolean isOutboundPresenceFilter(ServiceClass<?> serviceClass, String name) {
        return hasSpec(serviceClass, name, OUTBOUND_PRESENCE_FILTER, Collections.emptyList());
    }

    /**
     * Indicates whether a service class connects the named callback to a
     * signal of a dependency.
     *
     * @param serviceClass the service class
     * @param name the callback name
     * @param dependency the service class owning the signal
     * @param signalName the signal name
     * @return true if so
     */
    public static boolean isDependencySignalHandler(ServiceClass<?> serviceClass, String name,
                                                    ServiceClass<?> dependency, String signalName) {
        return hasSpec(serviceClass, name, DEPENDENCY_SIGNAL, Arrays.asList(dependency, signalName));
    }

    private static boolean hasSpec(ServiceClass<?> serviceClass, String name, String kind, List<?> discriminator) {
        for (HandlerEntry<?, ?> entry : serviceClass.getHandlers()) {
            if (!entry.getName().equals(name)) {
                continue;
            }
            for (HandlerSpec<?> spec : entry.getSpecs()) {
                if (spec.matches(kind, discriminator)) {
                    return true;
                }
            }
        }
        return false;
    }

}
