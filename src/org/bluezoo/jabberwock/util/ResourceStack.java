/*
 * ResourceStack.java
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

package org.bluezoo.jabberwock.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A stack of acquired resources released in reverse order of acquisition.
 *
 * <p>Closing the stack releases every resource even if some releases
 * fail. The first failure is thrown once all resources have been
 * released, with any later failures attached to it as suppressed
 * exceptions. Resources pushed after the stack was closed are kept for
 * the next close.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ResourceStack implements AutoCloseable {

    private final Deque<AutoCloseable> resources = new ArrayDeque<>();

    /**
     * Pushes a resource.
     *
     * @param resource the resource
     * @return the resource, for chaining
     */
    public synchronized <R extends AutoCloseable> R push(R resource) {
        if (resource == null) {
            throw new NullPointerException("resource");
        }
        resources.push(resource);
        return resource;
    }

    public synchronized int size() {
        return resources.size();
    }

    /**
     * Releases every resource, most recently pushed first.
     *
     * @throws Exception the first release failure, with later failures
     *         suppressed. An {@link Error} raised by a release is rethrown
     *         the same way once the stack is empty.
     */
    @Override
    public void close() throws Exception {
        Throwable failure = null;
        AutoCloseable resource;
        while ((resource = pop()) != null) {
            try {
                resource.close();
            } catch (Throwable t) {
                if (failure == null) {
                    failure = t;
                } else {
                    failure.addSuppressed(t);
                }
            }
        }
        if (failure != null) {
            rethrow(failure);
        }
    }

    /**
     * Throws a caught throwable again, preserving its type.
     *
     * @param t an {@link Exception} or {@link Error}
     * @throws Exception if t is an exception
     */
    public static void rethrow(Throwable t) throws Exception {
        if (t instanceof Error) {
            throw (Error) t;
        }
        if (t instanceof Exception) {
            throw (Exception) t;
        }
        throw new IllegalStateException(t);
    }

    private synchronized AutoCloseable pop() {
        return resources.poll();
    }

}
