/*
 * StanzaException.java
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

package org.bluezoo.jabberwock.stanza;

/**
 * A stanza-level error, raised by request handlers to answer with an error
 * response, or raised to callers when a peer answered with one.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StanzaException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorType type;
    private final String condition;
    private final String text;

    /**
     * Creates a stanza exception.
     *
     * @param type the error type
     * @param condition the local name of the defined condition
     * @param text descriptive text, or null
     */
    public StanzaException(ErrorType type, String condition, String text) {
        super(text == null ? condition : condition + ": " + text);
        this.type = type;
        this.condition = condition;
        this.text = text;
    }

    public ErrorType getType() {
        return type;
    }

    public String getCondition() {
        return condition;
    }

    public String getText() {
        return text;
    }

    /**
     * Returns the error element describing this exception.
     *
     * @return the error
     */
    public StanzaError toStanzaError() {
        return new StanzaError(type, condition, text);
    }

}
