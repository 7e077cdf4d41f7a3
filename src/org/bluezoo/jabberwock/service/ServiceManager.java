/*
 * ServiceManager.java
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
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.stream.StanzaStream;

/**
 * Instantiates services on a stream, together with their dependencies,
 * and shuts them down again.
 *
 * <p>Each service class is instantiated at most once per manager. Summoning
 * a class first summons every class in its after-set, in linearised order,
 * so that a service is always created after the services it depends on
 * and receives them in its {@link Dependencies}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ServiceManager {

    private static final Logger LOGGER = Logger.getLogger(ServiceManager.class.getName());

    private final ServiceRegistry registry;
    private final StanzaStream stream;
    private final Logger loggerBase;
    private final Map<ServiceClass<?>, Service> services = new IdentityHashMap<>();
    private final List<Service> summoned = new ArrayList<>();

    /**
     * @param registry the registry the summoned classes are declared in
     * @param stream the stream services are bound to
     * @param loggerBase the logger service loggers are named below, or null
     */
    public ServiceManager(ServiceRegistry registry, StanzaStream stream, Logger loggerBase) {
        this.registry = registry;
        this.stream = stream;
        this.loggerBase = loggerBase;
    }

    public StanzaStream getStream() {
        return stream;
    }

    /**
     * Returns the instance of a service class, creating it and its
     * dependencies if necessary.
     *
     * @param serviceClass the service class
     * @return the instance
     * @throws Exception if a service cannot be instantiated
     */
    public synchronized <T extends Service> T summon(ServiceClass<T> serviceClass) throws Exception {
        T existing = get(serviceClass);
        if (existing != null) {
            return existing;
        }
        for (ServiceClass<?> dependency : registry.sort(serviceClass.getOrderAfter())) {
            if (!services.containsKey(dependency)) {
                instantiate(dependency);
            }
        }
        return instantiate(serviceClass);
    }

    private <T extends Service> T instantiate(ServiceClass<T> serviceClass) throws Exception {
        Map<ServiceClass<?>, Service> dependencies = new LinkedHashMap<>();
        for (ServiceClass<?> dependency : serviceClass.getOrderAfter()) {
            dependencies.put(dependency, services.get(dependency));
        }
        T service = serviceClass.instantiate(stream, Dependencies.of(dependencies), loggerBase);
        services.put(serviceClass, service);
        summoned.add(service);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(ServiceRegistry.L10N.getString("log.summoned"), serviceClass));
        }
        return service;
    }

    /**
     * Returns the instance of a service class if it has been summoned.
     *
     * @param serviceClass the service class
     * @return the instance, or null
     */
    public synchronized <T extends Service> T get(ServiceClass<T> serviceClass) {
        Service service = services.get(serviceClass);
        return service == null ? null : serviceClass.getJavaClass().cast(service);
    }

    /**
     * Returns the running services in the order they were summoned.
     *
     * @return a snapshot of the services
     */
    public synchronized List<Service> getServices() {
        return new ArrayList<Service>(summoned);
    }

    /**
     * Shuts down every summoned service, most recently summoned first.
     * Every service is shut down even if others fail.
     *
     * @throws ServiceShutdownException if any service failed to shut down
     */
    public synchronized void shutdown() throws ServiceShutdownException {
        List<Throwable> failures = new ArrayList<>();
        for (int i = summoned.size() - 1; i >= 0; i--) {
            Service service = summoned.get(i);
            try {
                service.shutdown();
            } catch (Throwable t) {
                String msg = MessageFormat.format(ServiceRegistry.L10N.getString("log.shutdown_failed"),
                                                  service.getServiceClass());
                LOGGER.log(Level.WARNING, msg, t);
                failures.add(t);
            }
        }
        summoned.clear();
        services.clear();
        if (!failures.isEmpty()) {
            String msg = MessageFormat.format(ServiceRegistry.L10N.getString("err.shutdown_failed"),
                                              failures.size());
            ServiceShutdownException exception = new ServiceShutdownException(msg);
            for (Throwable failure : failures) {
                exception.addSuppressed(failure);
            }
            throw exception;
        }
    }

}
