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
 * Jabberwock, an XMPP client library core.
 *
 * <p>Jabberwock provides the two engines every protocol extension is
 * built on:
 *
 * <ul>
 *   <li>{@link org.bluezoo.jabberwock.xso} - declarative binding of XML
 *       stream objects (XSOs) to typed records, with an incremental,
 *       event-driven parser and a SAX adapter</li>
 *   <li>{@link org.bluezoo.jabberwock.service} - ordering and lifecycle of
 *       pluggable protocol services wired into a live stanza stream</li>
 * </ul>
 *
 * <p>This package holds the types shared by both: {@link
 * org.bluezoo.jabberwock.JID} addresses and {@link
 * org.bluezoo.jabberwock.DeclarationException}.
 */
package org.bluezoo.jabberwock;
