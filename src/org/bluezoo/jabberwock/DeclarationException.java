/*
 * DeclarationException.java
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

package org.bluezoo.jabberwock;

/**
 * Thrown when a schema or service declaration is inconsistent.
 *
 * <p>Declaration errors are raised once, while an {@code XSOClass} or
 * {@code ServiceClass} is being built. They are not recoverable: the
 * offending declaration never comes into existence and any registry it
 * was being added to is left unchanged.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DeclarationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new declaration exception with the specified message.
     *
     * @param message the error message
     */
    public DeclarationException(String message) {
        super(message);
    }

    /**
     * Creates a new declaration exception with the specified message and
     * cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public DeclarationException(String message, Throwable cause) {
        super(message, cause);
    }

}
