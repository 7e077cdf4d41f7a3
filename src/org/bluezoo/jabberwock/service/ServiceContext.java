/*
 * ServiceContext.java
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

package org.bluezoo.jabberwock.service;

import java.util.logging.Logger;

import org.bluezoo.jabberwock.stream.StanzaStream;

/**
 * Everything a service instance is constructed with.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ServiceContext {

    private final ServiceClass<?> serviceClass;
    private final StanzaStream stream;
    private final Dependencies dependencies;
    private final Logger logger;

    ServiceContext(ServiceClass<?> serviceClass, StanzaStream stream, Dependencies dependencies, Logger logger) {
        this.serviceClass = serviceClass;
        this.stream = stream;
        this.dependencies = dependencies;
        this.logger = logger;
    }

    public ServiceClass<?> getServiceClass() {
        return serviceClass;
    }

    public StanzaStream getStream() {
        return stream;
    }

    public Dependencies getDependencies() {
        return dependencies;
    }

    public Logger getLogger() {
        return logger;
    }

}
