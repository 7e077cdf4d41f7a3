/*
 * StreamClient.java
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
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.service.Service;
import org.bluezoo.jabberwock.service.ServiceClass;
import org.bluezoo.jabberwock.service.ServiceManager;
import org.bluezoo.jabberwock.service.ServiceRegistry;
import org.bluezoo.jabberwock.stream.StanzaStream;

/**
 * A client whose services run on a stanza stream supplied by the caller.
 * Connecting and disconnecting only track the session state; the
 * transport behind the stream is managed elsewhere.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StreamClient implements ProvisionedClient {

    private final Logger logger;
    private final ServiceManager services;
    private volatile boolean connected;

    public StreamClient(StanzaStream stream, ServiceRegistry registry, Logger logger) {
        this.logger = logger;
        this.services = new ServiceManager(registry, stream, logger);
    }

    @Override
    public Logger getLogger() {
        return logger;
    }

    public ServiceManager getServiceManager() {
        return services;
    }

    @Override
    public <T extends Service> T summon(ServiceClass<T> serviceClass) throws Exception {
        return services.summon(serviceClass);
    }

    @Override
    public void connect() throws IOException {
        connected = true;
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("connected");
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() throws Exception {
        if (!connected) {
            return;
        }
        connected = false;
        services.shutdown();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("disconnected");
        }
    }

}
