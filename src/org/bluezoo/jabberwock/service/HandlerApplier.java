/*
 * HandlerApplier.java
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

import java.util.List;

import org.bluezoo.jabberwock.stream.StanzaStream;
import org.bluezoo.jabberwock.util.Registration;

/**
 * Wires a bound service callback into a stream.
 *
 * @param <C> the callback type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@FunctionalInterface
public interface HandlerApplier<C> {

    /**
     * Performs the registration.
     *
     * @param service the service instance being set up
     * @param stream the stream it is bound to
     * @param callback the callback bound to the instance
     * @param arguments the arguments of the handler specification
     * @return a registration undoing the wiring when closed
     */
    Registration apply(Service service, StanzaStream stream, C callback, List<Object> arguments);

}
