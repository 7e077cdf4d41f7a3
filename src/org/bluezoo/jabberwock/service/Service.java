/*
 * Service.java
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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.stream.StanzaStream;
import org.bluezoo.jabberwock.util.ResourceStack;

/**
 * A protocol service bound to one stanza stream.
 *
 * <p>Every concrete service declares a {@link ServiceClass} describing its
 * ordering relative to other services, the callbacks it wires into the
 * stream and the resources it holds. Instances are created by
 * {@link ServiceClass#instantiate} or a {@link ServiceManager}, which
 * register the handlers and acquire the resources; {@link #shutdown}
 * releases them in reverse order.
 *
 * <pre>
 * public class PingService extends Service {
 *
 *     public static final ServiceClass&lt;PingService&gt; CLASS =
 *         ServiceClass.builder(PingService.class, PingService::new)
 *             .handler("handlePing", s -&gt; s::handlePing,
 *                      Handlers.iqHandler(IQType.GET, Ping.CLASS))
 *             .declare();
 *
 *     public PingService(ServiceContext context) {
 *         super(context);
 *     }
 *
 *     XSO handlePing(IQ request) {
 *         return null;
 *     }
 * }
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Service {

    private final ServiceClass<?> serviceClass;
    private final StanzaStream stream;
    private final Dependencies dependencies;
    private final Logger logger;
    private final ResourceStack resourceStack = new ResourceStack();
    private final Map<ServiceDescriptor<?>, Object> resources =
        Collections.synchronizedMap(new IdentityHashMap<ServiceDescriptor<?>, Object>());
    private final AtomicBoolean shutdown = new AtomicBoolean();

    protected Service(ServiceContext context) {
        this.serviceClass = context.getServiceClass();
        this.stream = context.getStream();
        this.dependencies = context.getDependencies();
        this.logger = context.getLogger();
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

    /**
     * Returns the logger of this instance, named after the service class
     * below the logger of the client owning the stream.
     *
     * @return the logger
     */
    public Logger getLogger() {
        return logger;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Shuts this service down. {@link #doShutdown} runs first; every
     * handler registration and resource is then released in reverse order
     * of acquisition, whether or not the hook succeeded. Calling this
     * again has no effect.
     *
     * @throws Exception the failure of the hook, or else of the first
     *         release, with later release failures suppressed
     */
    public final void shutdown() throws Exception {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        Throwable failure = null;
        try {
            doShutdown();
        } catch (Throwable t) {
            failure = t;
        }
        try {
            resourceStack.close();
        } catch (Throwable t) {
            if (failure == null) {
                failure = t;
            } else {
                failure.addSuppressed(t);
            }
        }
        if (failure != null) {
            ResourceStack.rethrow(failure);
        }
    }

    /**
     * Called by {@link #shutdown} before handlers and resources are
     * released. The default does nothing.
     *
     * @throws Exception if shutting down fails
     */
    protected void doShutdown() throws Exception {
    }

    ResourceStack getResourceStack() {
        return resourceStack;
    }

    boolean hasResource(ServiceDescriptor<?> descriptor) {
        return resources.containsKey(descriptor);
    }

    Object getResource(ServiceDescriptor<?> descriptor) {
        return resources.get(descriptor);
    }

    void putResource(ServiceDescriptor<?> descriptor, Object value) {
        resources.put(descriptor, value);
    }

    void removeResource(ServiceDescriptor<?> descriptor) {
        resources.remove(descriptor);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

}
