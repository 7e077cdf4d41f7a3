/*
 * IQRequestHandler.java
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

import org.bluezoo.jabberwock.stanza.IQ;
import org.bluezoo.jabberwock.stanza.StanzaException;
import org.bluezoo.jabberwock.xso.XSO;

/**
 * Answers IQ requests of one type and payload class.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@FunctionalInterface
public interface IQRequestHandler {

    /**
     * Handles a request.
     *
     * @param request the request
     * @return the payload of the result response, or null for an empty
     *         result
     * @throws StanzaException to answer with an error response
     */
    XSO handleRequest(IQ request) throws StanzaException;

}
