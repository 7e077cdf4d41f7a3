/*
 * ClientFactory.java
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

package org.bluezoo.jabberwock.provision;

import java.io.IOException;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.JID;

/**
 * Creates clients for a provisioner. Implementations own the transport.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@FunctionalInterface
public interface ClientFactory {

    /**
     * Creates an unconnected client for a fresh account.
     *
     * @param host the server to log in to
     * @param tls how to verify the server certificate
     * @param logger the logger of the client
     * @return the client
     * @throws IOException if the client cannot be created
     */
    ProvisionedClient createClient(JID host, TLSConfiguration tls, Logger logger) throws IOException;

}
