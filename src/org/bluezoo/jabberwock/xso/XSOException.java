/*
 * XSOException.java
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

package org.bluezoo.jabberwock.xso;

/**
 * Base class for errors raised while parsing, building or serialising
 * XML stream objects.
 *
 * <p>These exceptions are unchecked because they may be raised by plain
 * field assignment through a descriptor. When raised during parsing they
 * abort the parse of the affected element only; whether the enclosing
 * stream survives is for the transport to decide.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class XSOException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public XSOException(String message) {
        super(message);
    }

    public XSOException(String message, Throwable cause) {
        super(message, cause);
    }

}
