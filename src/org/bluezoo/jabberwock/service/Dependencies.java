/*
 * Dependencies.java
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

import java.text.MessageFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The instances of the services a service depends on, keyed by class.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Dependencies {

    private static final Dependencies EMPTY = new Dependencies(Collections.<ServiceClass<?>, Service>emptyMap());

    private final Map<ServiceClass<?>, Service> services;

    private Dependencies(Map<ServiceClass<?>, Service> services) {
        this.services = services;
    }

    public static Dependencies empty() {
        return EMPTY;
    }

    /**
     * Returns dependencies backed by a copy of the given map.
     *
     * @param services the instances by class
     * @return the dependencies
     */
    public static Dependencies of(Map<ServiceClass<?>, ? extends Service> services) {
        return new Dependencies(Collections.unmodifiableMap(new LinkedHashMap<ServiceClass<?>, Service>(services)));
    }

    /**
     * Returns the instance of a dependency.
     *
     * @param serviceClass the class of the dependency
     * @return the instance
     * @throws IllegalArgumentException if there is no such dependency
     */
    public <D extends Service> D get(ServiceClass<D> serviceClass) {
        Service service = services.get(serviceClass);
        if (service == null) {
            String msg = MessageFormat.format(ServiceRegistry.L10N.getString("err.no_dependency"), serviceClass);
            throw new IllegalArgumentException(msg);
        }
        return serviceClass.getJavaClass().cast(service);
    }

    public boolean contains(ServiceClass<?> serviceClass) {
        return services.containsKey(serviceClass);
    }

    public int size() {
        return services.size();
    }

}
