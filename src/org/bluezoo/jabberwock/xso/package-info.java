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
 * Declarative binding of XML stream objects.
 *
 * <p>An XSO is a typed Java object bound to one XML element. Protocol
 * authors declare the binding with an {@link
 * org.bluezoo.jabberwock.xso.XSOClass} and a list of descriptors:
 *
 * <ul>
 *   <li>{@link org.bluezoo.jabberwock.xso.Attr} for attributes</li>
 *   <li>{@link org.bluezoo.jabberwock.xso.Text} for character data</li>
 *   <li>{@link org.bluezoo.jabberwock.xso.ChildText} for the text of a
 *       simple child element</li>
 *   <li>{@link org.bluezoo.jabberwock.xso.ChildTag} for a value expressed
 *       by which child element is present</li>
 *   <li>{@link org.bluezoo.jabberwock.xso.Child}, {@link
 *       org.bluezoo.jabberwock.xso.ChildList} and {@link
 *       org.bluezoo.jabberwock.xso.ChildMap} for nested XSOs</li>
 *   <li>{@link org.bluezoo.jabberwock.xso.Collector} for content nothing
 *       else claims</li>
 * </ul>
 *
 * <p>Incoming XML is parsed incrementally by an {@link
 * org.bluezoo.jabberwock.xso.XSOParser} fed one event at a time,
 * usually through a {@link org.bluezoo.jabberwock.xso.SAXDriver}.
 * Instances are written back out with {@link
 * org.bluezoo.jabberwock.xso.XSOWriter}.
 */
package org.bluezoo.jabberwock.xso;
