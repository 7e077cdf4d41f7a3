/*
 * package-info.java
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

/**
 * Pluggable protocol services.
 *
 * <p>A {@link org.bluezoo.jabberwock.service.ServiceClass} declares how a
 * {@link org.bluezoo.jabberwock.service.Service} is ordered relative to
 * other services, which callbacks it wires into the
 * {@link org.bluezoo.jabberwock.stream.StanzaStream} and which resources
 * it holds. The {@link org.bluezoo.jabberwock.service.ServiceRegistry}
 * maintains the transitive ordering of all declared classes and rejects
 * inconsistent declarations. A
 * {@link org.bluezoo.jabberwock.service.ServiceManager} instantiates
 * services with their dependencies and shuts them down in reverse order.
 */
package org.bluezoo.jabberwock.service;
