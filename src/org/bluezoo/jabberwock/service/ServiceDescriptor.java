/*
 * ServiceDescriptor.java
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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.bluezoo.jabberwock.util.Registration;
import org.bluezoo.jabberwock.util.ResourceStack;

/**
 * A resource acquired for every instance of a service class and released
 * when the instance shuts down.
 *
 * <p>Subclasses implement {@link #acquire}. The acquired value is then
 * available through {@link #get} for as long as the instance is running.
 *
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class ServiceDescriptor<V> {

    private final Set<ServiceClass<?>> requiredDependencies;

    /**
     * @param requiredDependencies services {@link #acquire} needs; the
     *        owning service class must order itself after them
     */
    protected ServiceDescriptor(ServiceClass<?>... requiredDependencies) {
        this.requiredDependencies =
            Collections.unmodifiableSet(new LinkedHashSet<ServiceClass<?>>(Arrays.asList(requiredDependencies)));
    }

    public Set<ServiceClass<?>> getRequiredDependencies() {
        return requiredDependencies;
    }

    /**
     * Acquires the resource for a service instance.
     *
     * @param service the instance being set up
     * @return the resource, closed when the instance shuts down
     * @throws Exception if the resource cannot be acquired
     */
    protected abstract ScopedResource<V> acquire(Service service) throws Exception;

    /**
     * Returns the value acquired for a service instance.
     *
     * @param service the instance
     * @return the value
     * @throws IllegalStateException if the instance has not acquired the
     *         resource, or has released it
     */
    @SuppressWarnings("unchecked")
    public V get(Service service) {
        if (!service.hasResource(this)) {
            throw new IllegalStateException(ServiceRegistry.L10N.getString("err.descriptor_uninitialised"));
        }
        return (V) service.getResource(this);
    }

    void addTo(final Service service, ResourceStack stack) throws Exception {
        ScopedResource<V> resource = acquire(service);
        Registration release = () -> service.removeResource(this);
        stack.push(release);
        stack.push(resource);
        service.putResource(this, resource.get());
    }

    @Override
    public String toString() {
        return getClass().getName();
    }

}
