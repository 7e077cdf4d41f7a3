/*
 * ServiceClass.java
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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.DeclarationException;
import org.bluezoo.jabberwock.stream.StanzaStream;
import org.bluezoo.jabberwock.util.ResourceStack;

/**
 * The declaration of a service: its ordering relative to other services,
 * the callbacks it wires into the stream and the resources it holds.
 *
 * <p>Service classes are created with a {@link Builder} and come into
 * existence only once accepted by a {@link ServiceRegistry}. The ordering
 * sets reported by {@link #getOrderBefore} and {@link #getOrderAfter} are
 * the transitive closures computed by the registry, and grow as later
 * service classes order themselves relative to this one.
 *
 * @param <T> the service type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ServiceClass<T extends Service> {

    private static final Logger LOGGER = Logger.getLogger(ServiceClass.class.getName());

    private final Class<T> javaClass;
    private final ServiceFactory<T> factory;
    private final ServiceClass<?> parent;
    private final boolean inheritDependencies;
    private final Set<ServiceClass<?>> declaredBefore;
    private final Set<ServiceClass<?>> declaredAfter;
    private final List<HandlerEntry<T, ?>> handlers;
    private final List<ServiceDescriptor<?>> descriptors;
    private final Set<ServiceClass<?>> requiredDependencies;
    private volatile ServiceRegistry registry;

    private ServiceClass(Builder<T> builder) {
        this.javaClass = builder.javaClass;
        this.factory = builder.factory;
        this.parent = builder.parent;
        this.inheritDependencies = builder.inheritDependencies;
        this.declaredBefore = Collections.unmodifiableSet(new LinkedHashSet<ServiceClass<?>>(builder.before));
        this.declaredAfter = Collections.unmodifiableSet(new LinkedHashSet<ServiceClass<?>>(builder.after));
        this.handlers = Collections.unmodifiableList(new ArrayList<HandlerEntry<T, ?>>(builder.handlers));
        this.descriptors = Collections.unmodifiableList(new ArrayList<ServiceDescriptor<?>>(builder.descriptors));
        Set<ServiceClass<?>> required = new LinkedHashSet<>();
        for (HandlerEntry<T, ?> entry : handlers) {
            for (HandlerSpec<?> spec : entry.getSpecs()) {
                required.addAll(spec.getRequiredDependencies());
            }
        }
        for (ServiceDescriptor<?> descriptor : descriptors) {
            required.addAll(descriptor.getRequiredDependencies());
        }
        this.requiredDependencies = Collections.unmodifiableSet(required);
    }

    /**
     * Starts the declaration of a service class.
     *
     * @param javaClass the service implementation
     * @param factory creates instances, usually the constructor taking a
     *        {@link ServiceContext}
     * @return the builder
     */
    public static <T extends Service> Builder<T> builder(Class<T> javaClass, ServiceFactory<T> factory) {
        return new Builder<T>(javaClass, factory);
    }

    public Class<T> getJavaClass() {
        return javaClass;
    }

    public String getName() {
        return javaClass.getName();
    }

    public ServiceClass<?> getParent() {
        return parent;
    }

    /**
     * Returns the registry this service class was declared in.
     *
     * @return the registry
     */
    public ServiceRegistry getRegistry() {
        return registry;
    }

    /**
     * Returns the service classes ordered after this one.
     *
     * @return a snapshot of the transitive before-set
     */
    public Set<ServiceClass<?>> getOrderBefore() {
        return registry.getOrderBefore(this);
    }

    /**
     * Returns the service classes ordered before this one. These are the
     * dependencies of this service: a {@link ServiceManager} instantiates
     * them first and passes them in the {@link ServiceContext}.
     *
     * @return a snapshot of the transitive after-set
     */
    public Set<ServiceClass<?>> getOrderAfter() {
        return registry.getOrderAfter(this);
    }

    /**
     * @deprecated use {@link #getOrderBefore}
     */
    @Deprecated
    public Set<ServiceClass<?>> getServiceBefore() {
        return getOrderBefore();
    }

    /**
     * @deprecated use {@link #getOrderAfter}
     */
    @Deprecated
    public Set<ServiceClass<?>> getServiceAfter() {
        return getOrderAfter();
    }

    /**
     * Returns the services which handlers and descriptors of this class
     * need at runtime.
     *
     * @return the required dependencies
     */
    public Set<ServiceClass<?>> getRequiredDependencies() {
        return requiredDependencies;
    }

    public List<HandlerEntry<T, ?>> getHandlers() {
        return handlers;
    }

    public List<ServiceDescriptor<?>> getDescriptors() {
        return descriptors;
    }

    Set<ServiceClass<?>> getDeclaredBefore() {
        return declaredBefore;
    }

    Set<ServiceClass<?>> getDeclaredAfter() {
        return declaredAfter;
    }

    boolean isInheritDependencies() {
        return inheritDependencies;
    }

    void setRegistry(ServiceRegistry registry) {
        this.registry = registry;
    }

    /**
     * Indicates whether this service class is, or inherits from, another.
     *
     * @param other the other service class
     * @return true if so
     */
    public boolean isSubclassOf(ServiceClass<?> other) {
        for (ServiceClass<?> c = this; c != null; c = c.parent) {
            if (c == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Creates an instance bound to a stream, registers its handlers and
     * acquires its resources. If any of these fails, everything done so
     * far is undone before the failure is thrown.
     *
     * @param stream the stream
     * @param dependencies the instances of the services this one depends on
     * @param base the logger of the client, or null
     * @return the running instance
     * @throws Exception if a resource cannot be acquired
     */
    public T instantiate(StanzaStream stream, Dependencies dependencies, Logger base) throws Exception {
        String loggerName = base == null ? javaClass.getName()
            : base.getName() + ".service." + javaClass.getSimpleName();
        ServiceContext context = new ServiceContext(this, stream, dependencies, Logger.getLogger(loggerName));
        T service = factory.create(context);
        ResourceStack stack = service.getResourceStack();
        try {
            for (HandlerEntry<T, ?> entry : handlers) {
                entry.apply(service, stream, stack);
            }
            for (ServiceDescriptor<?> descriptor : descriptors) {
                descriptor.addTo(service, stack);
            }
        } catch (Throwable t) {
            try {
                stack.close();
            } catch (Throwable ct) {
                t.addSuppressed(ct);
            }
            ResourceStack.rethrow(t);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(ServiceRegistry.L10N.getString("log.instantiated"), this));
        }
        return service;
    }

    @Override
    public String toString() {
        return javaClass.getName();
    }

    /**
     * Declares a service class.
     *
     * @param <T> the service type
     */
    public static final class Builder<T extends Service> {

        private final Class<T> javaClass;
        private final ServiceFactory<T> factory;
        private ServiceClass<?> parent;
        private boolean inheritDependencies = true;
        private final Set<ServiceClass<?>> before = new LinkedHashSet<>();
        private final Set<ServiceClass<?>> after = new LinkedHashSet<>();
        private boolean orderDeclared;
        private boolean legacyDeclared;
        private final List<HandlerEntry<T, ?>> handlers = new ArrayList<>();
        private final List<ServiceDescriptor<?>> descriptors = new ArrayList<>();

        Builder(Class<T> javaClass, ServiceFactory<T> factory) {
            if (javaClass == null || factory == null) {
                throw new NullPointerException();
            }
            this.javaClass = javaClass;
            this.factory = factory;
        }

        /**
         * Names the service class this one extends.
         *
         * @param parent the parent, whose implementation must be a
         *        superclass of this one's
         * @return this builder
         */
        public Builder<T> parent(ServiceClass<?> parent) {
            if (!parent.getJavaClass().isAssignableFrom(javaClass)) {
                String msg = MessageFormat.format(ServiceRegistry.L10N.getString("err.not_subclass"),
                                                  javaClass.getName(), parent);
                throw new DeclarationException(msg);
            }
            this.parent = parent;
            return this;
        }

        /**
         * Sets whether the ordering of the parent applies to this class.
         * The default is true.
         *
         * @param flag false to start from empty ordering sets
         * @return this builder
         */
        public Builder<T> inheritDependencies(boolean flag) {
            this.inheritDependencies = flag;
            return this;
        }

        /**
         * Orders this service before others.
         *
         * @param services the services to run after this one
         * @return this builder
         */
        public Builder<T> orderBefore(ServiceClass<?>... services) {
            orderDeclared = true;
            before.addAll(Arrays.asList(services));
            return this;
        }

        /**
         * Orders this service after others, making them dependencies.
         *
         * @param services the services to run before this one
         * @return this builder
         */
        public Builder<T> orderAfter(ServiceClass<?>... services) {
            orderDeclared = true;
            after.addAll(Arrays.asList(services));
            return this;
        }

        /**
         * @deprecated use {@link #orderBefore}
         */
        @Deprecated
        public Builder<T> serviceBefore(ServiceClass<?>... services) {
            legacyDeclared = true;
            warnLegacy("serviceBefore", "orderBefore");
            before.addAll(Arrays.asList(services));
            return this;
        }

        /**
         * @deprecated use {@link #orderAfter}
         */
        @Deprecated
        public Builder<T> serviceAfter(ServiceClass<?>... services) {
            legacyDeclared = true;
            warnLegacy("serviceAfter", "orderAfter");
            after.addAll(Arrays.asList(services));
            return this;
        }

        private void warnLegacy(String legacy, String replacement) {
            if (LOGGER.isLoggable(Level.WARNING)) {
                String msg = ServiceRegistry.L10N.getString("log.legacy_ordering");
                LOGGER.warning(MessageFormat.format(msg, javaClass.getName(), legacy, replacement));
            }
        }

        /**
         * Declares a callback wired into the stream on instantiation.
         *
         * @param name the name of the callback, unique within the class
         * @param binder binds the callback to an instance, usually
         *        {@code s -> s::method}
         * @param specs how the callback is wired
         * @return this builder
         */
        @SafeVarargs
        public final <C> Builder<T> handler(String name, Function<? super T, ? extends C> binder,
                                            HandlerSpec<? super C>... specs) {
            for (HandlerEntry<T, ?> entry : handlers) {
                if (entry.getName().equals(name)) {
                    String msg = MessageFormat.format(ServiceRegistry.L10N.getString("err.duplicate_handler"),
                                                      javaClass.getName(), name);
                    throw new DeclarationException(msg);
                }
            }
            handlers.add(new HandlerEntry<T, C>(name, binder, Arrays.asList(specs)));
            return this;
        }

        /**
         * Declares a resource acquired on instantiation.
         *
         * @param descriptor the descriptor
         * @return this builder
         */
        public Builder<T> descriptor(ServiceDescriptor<?> descriptor) {
            descriptors.add(descriptor);
            return this;
        }

        /**
         * Declares the service class in the default registry.
         *
         * @return the service class
         * @throws DeclarationException if the declaration is inconsistent
         */
        public ServiceClass<T> declare() {
            return declare(ServiceRegistry.getDefault());
        }

        /**
         * Declares the service class in a registry.
         *
         * @param registry the registry
         * @return the service class
         * @throws DeclarationException if the declaration is inconsistent
         */
        public ServiceClass<T> declare(ServiceRegistry registry) {
            if (orderDeclared && legacyDeclared) {
                String msg = MessageFormat.format(ServiceRegistry.L10N.getString("err.mixed_ordering"),
                                                  javaClass.getName());
                throw new DeclarationException(msg);
            }
            ServiceClass<T> serviceClass = new ServiceClass<T>(this);
            registry.declare(serviceClass);
            return serviceClass;
        }

    }

}
