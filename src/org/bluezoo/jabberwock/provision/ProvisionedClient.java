/*
 * ProvisionedClient.java
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

import org.bluezoo.jabberwock.service.Service;
import org.bluezoo.jabberwock.service.ServiceClass;

/**
 * A client connected to a provisioned account.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface ProvisionedClient {

    Logger getLogger();

    /**
     * Returns the running instance of a service, instantiating it and its
     * dependencies if necessary.
     *
     * @param serviceClass the service class
     * @return the instance
     * @throws Exception if the service cannot be instantiated
     */
    <T extends Service> T summon(ServiceClass<T> serviceClass) throws Exception;

    /**
     * Establishes the session.
     *
     * @throws IOException if the connection fails
     */
    void connect() throws IOException;

    boolean isConnected();

    /**
     * Ends the session and shuts down the services of the client.
     *
     * @throws Exception if the session or a service cannot be shut down
     *         cleanly
     */
    void disconnect() throws Exception;

}
