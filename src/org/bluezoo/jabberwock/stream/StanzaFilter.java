/*
 * StanzaFilter.java
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

package org.bluezoo.jabberwock.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

import org.bluezoo.jabberwock.util.Registration;

/**
 * An ordered chain of functions applied to stanzas passing through a
 * stream.
 *
 * <p>Each function receives the stanza returned by the previous one and
 * may return it unchanged, return a replacement, or return null to drop
 * the stanza, which ends the chain. Functions run in ascending order of
 * their order key; functions with equal keys run in registration order.
 *
 * @param <T> the stanza type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StanzaFilter<T> {

    private static final class Entry<T> implements Comparable<Entry<T>> {
        final UnaryOperator<T> function;
        final int order;
        final long sequence;

        Entry(UnaryOperator<T> function, int order, long sequence) {
            this.function = function;
            this.order = order;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(Entry<T> other) {
            if (order != other.order) {
                return Integer.compare(order, other.order);
            }
            return Long.compare(sequence, other.sequence);
        }
    }

    private volatile List<Entry<T>> entries = Collections.emptyList();
    private long sequence;

    /**
     * Adds a function to the chain.
     *
     * @param function the function
     * @param order the order key
     * @return a registration removing the function when closed
     */
    public synchronized Registration register(UnaryOperator<T> function, int order) {
        final Entry<T> entry = new Entry<>(function, order, sequence++);
        List<Entry<T>> copy = new ArrayList<>(entries);
        copy.add(entry);
        Collections.sort(copy);
        entries = Collections.unmodifiableList(copy);
        return () -> unregister(entry);
    }

    private synchronized void unregister(Entry<T> entry) {
        List<Entry<T>> copy = new ArrayList<>(entries);
        if (copy.remove(entry)) {
            entries = Collections.unmodifiableList(copy);
        }
    }

    /**
     * Runs a stanza through the chain.
     *
     * @param stanza the stanza
     * @return the resulting stanza, or null if it was dropped
     */
    public T filter(T stanza) {
        T result = stanza;
        for (Entry<T> entry : entries) {
            result = entry.function.apply(result);
            if (result == null) {
                return null;
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

}
