/*
 * ScopedResource.java
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

/**
 * A value acquired for the lifetime of a service instance, released when
 * the service shuts down.
 *
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface ScopedResource<V> extends AutoCloseable {

    /**
     * Returns the acquired value.
     *
     * @return the value
     */
    V get();

    /**
     * Returns a scoped resource for a value and its release action.
     *
     * @param value the value
     * @param release releases the value, or null if nothing is to be done
     * @return the resource
     */
    static <V> ScopedResource<V> of(final V value, final AutoCloseable release) {
        return new ScopedResource<V>() {
            @Override
            public V get() {
                return value;
            }

            @Override
            public void close() throws Exception {
                if (release != null) {
                    release.close();
                }
            }
        };
    }

}
