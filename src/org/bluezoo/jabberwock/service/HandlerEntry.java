/*
 * HandlerEntry.java
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
import java.util.List;
import java.util.function.Function;

import org.bluezoo.jabberwock.stream.StanzaStream;
import org.bluezoo.jabberwock.util.Registration;
import org.bluezoo.jabberwock.util.ResourceStack;

/**
 * A named service callback together with the specifications wiring it
 * into the stream.
 *
 * @param <T> the service type
 * @param <C> the callback type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HandlerEntry<T extends Service, C> {

    private final String name;
    private final Function<? super T, ? extends C> binder;
    private final List<HandlerSpec<? super C>> specs;

    HandlerEntry(String name, Function<? super T, ? extends C> binder,
                 List<HandlerSpec<? super C>> specs) {
        this.name = name;
        this.binder = binder;
        this.specs = Collections.unmodifiableList(specs);
    }

    /**
     * Returns the name of the callback, usually the name of the method.
     *
     * @return the name
     */
    public String getName() {
        return name;
    }

    public List<HandlerSpec<? super C>> getSpecs() {
        return specs;
    }

    /**
     * Binds the callback to an instance and applies every specification,
     * pushing each registration onto the stack as soon as it is made.
     */
    void apply(T service, StanzaStream stream, ResourceStack stack) {
        C callback = binder.apply(service);
        for (HandlerSpec<? super C> spec : specs) {
            stack.push(applySpec(spec, service, stream, callback));
        }
    }

    private static <X> Registration applySpec(HandlerSpec<X> spec, Service service, StanzaStream stream,
                                              X callback) {
        return spec.getApplier().apply(service, stream, callback, spec.getArguments());
    }

    @Override
    public String toString() {
        return name;
    }

}
