/*
 * Signal.java
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

import java.text.MessageFormat;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.util.Registration;

/**
 * An event source services expose to each other.
 *
 * <p>Listeners are called in connection order. A listener which throws
 * is logged and does not prevent delivery to the others. Deferred
 * listeners are called on an executor rather than by the thread firing
 * the signal.
 *
 * @param <T> the event type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Signal<T> {

    private static final Logger LOGGER = Logger.getLogger(Signal.class.getName());

    private final String name;
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    public Signal(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Connects a listener called synchronously by {@link #fire}.
     *
     * @param listener the listener
     * @return a registration disconnecting the listener when closed
     */
    public Registration connect(Consumer<? super T> listener) {
        final Consumer<? super T> entry = listener;
        listeners.add(entry);
        return () -> listeners.remove(entry);
    }

    /**
     * Connects a listener called on an executor.
     *
     * @param listener the listener
     * @param executor the executor running each call
     * @return a registration disconnecting the listener when closed
     */
    public Registration connectDeferred(final Consumer<? super T> listener, final Executor executor) {
        final Consumer<T> entry = value -> executor.execute(() -> deliver(listener, value));
        listeners.add(entry);
        return () -> listeners.remove(entry);
    }

    /**
     * Delivers an event to every listener.
     *
     * @param value the event
     */
    public void fire(T value) {
        for (Consumer<? super T> listener : listeners) {
            deliver(listener, value);
        }
    }

    private void deliver(Consumer<? super T> listener, T value) {
        try {
            listener.accept(value);
        } catch (RuntimeException e) {
            String msg = MessageFormat.format(ServiceRegistry.L10N.getString("log.listener_failed"), name);
            LOGGER.log(Level.WARNING, msg, e);
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }

    @Override
    public String toString() {
        return "Signal(" + name + ")";
    }

}
