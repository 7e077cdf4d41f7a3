/*
 * HandlerSpec.java
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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Describes how a service callback is wired into the stream when the
 * service is instantiated.
 *
 * <p>A specification has a kind, such as {@code iq_handler}, whose
 * applier performs the wiring, the arguments passed to it, and a
 * discriminator identifying the stream slot it occupies. Two unique
 * specifications of the same kind and discriminator cannot be declared on
 * one service class. Specifications may require other services as
 * dependencies, which the service class must then order itself after.
 *
 * <p>The factories in {@link Handlers} create the specifications for the
 * standard stream hooks.
 *
 * @param <C> the callback type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HandlerSpec<C> {

    private final String kind;
    private final HandlerApplier<C> applier;
    private final List<Object> arguments;
    private final List<Object> discriminator;
    private final boolean unique;
    private final Set<ServiceClass<?>> requiredDependencies;

    /**
     * Creates a unique specification whose discriminator is its arguments
     * and which requires no dependencies.
     *
     * @param kind the kind of wiring
     * @param applier performs the wiring
     * @param arguments the arguments passed to the applier
     */
    public HandlerSpec(String kind, HandlerApplier<C> applier, Object... arguments) {
        this(kind, applier, Arrays.asList(arguments), null, true, Collections.<ServiceClass<?>>emptySet());
    }

    /**
     * Creates a specification.
     *
     * @param kind the kind of wiring
     * @param applier performs the wiring
     * @param arguments the arguments passed to the applier
     * @param discriminator identifies the stream slot, or null to use the
     *        arguments
     * @param unique whether the slot may be used once per service class
     * @param requiredDependencies services the wiring needs
     */
    public HandlerSpec(String kind, HandlerApplier<C> applier, List<?> arguments, List<?> discriminator,
                       boolean unique, Collection<? extends ServiceClass<?>> requiredDependencies) {
        this.kind = kind;
        this.applier = applier;
        this.arguments = Collections.unmodifiableList(Arrays.asList(arguments.toArray()));
        this.discriminator = discriminator == null ? this.arguments
            : Collections.unmodifiableList(Arrays.asList(discriminator.toArray()));
        this.unique = unique;
        this.requiredDependencies = Collections.unmodifiableSet(new LinkedHashSet<ServiceClass<?>>(requiredDependencies));
    }

    public String getKind() {
        return kind;
    }

    public HandlerApplier<C> getApplier() {
        return applier;
    }

    public List<Object> getArguments() {
        return arguments;
    }

    public List<Object> getDiscriminator() {
        return discriminator;
    }

    public boolean isUnique() {
        return unique;
    }

    public Set<ServiceClass<?>> getRequiredDependencies() {
        return requiredDependencies;
    }

    /**
     * Returns the stream slot this specification occupies, for conflict
     * detection.
     *
     * @return the kind followed by the discriminator
     */
    String getKey() {
        return kind + discriminator;
    }

    /**
     * Indicates whether this specification has the given kind and
     * discriminator.
     *
     * @param kind the kind
     * @param discriminator the discriminator
     * @return true on a match
     */
    public boolean matches(String kind, List<?> discriminator) {
        return this.kind.equals(kind) && this.discriminator.equals(discriminator);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof HandlerSpec)) {
            return false;
        }
        HandlerSpec<?> other = (HandlerSpec<?>) obj;
        return kind.equals(other.kind)
            && arguments.equals(other.arguments)
            && discriminator.equals(other.discriminator)
            && unique == other.unique
            && requiredDependencies.equals(other.requiredDependencies);
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + discriminator.hashCode();
    }

    @Override
    public String toString() {
        return kind + arguments;
    }

}
