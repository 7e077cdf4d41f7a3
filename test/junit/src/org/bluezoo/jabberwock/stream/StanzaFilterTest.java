/*
 * StanzaFilterTest.java
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
import java.util.List;

import org.bluezoo.jabberwock.util.Registration;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for StanzaFilter.
 */
public class StanzaFilterTest {

    @Test
    public void testEmptyFilterPassesThrough() {
        StanzaFilter<String> filter = new StanzaFilter<>();
        assertEquals("a", filter.filter("a"));
        assertEquals(0, filter.size());
    }

    @Test
    public void testOrderThenRegistrationSequence() {
        StanzaFilter<String> filter = new StanzaFilter<>();
        filter.register(s -> s + "2", 5);
        filter.register(s -> s + "1", 1);
        filter.register(s -> s + "3", 5);
        assertEquals("x123", filter.filter("x"));
    }

    @Test
    public void testNullStopsChain() {
        final List<String> seen = new ArrayList<>();
        StanzaFilter<String> filter = new StanzaFilter<>();
        filter.register(s -> null, 0);
        filter.register(s -> {
            seen.add(s);
            return s;
        }, 1);
        assertNull(filter.filter("x"));
        assertTrue(seen.isEmpty());
    }

    @Test
    public void testUnregister() {
        StanzaFilter<String> filter = new StanzaFilter<>();
        Registration registration = filter.register(s -> s + "!", 0);
        assertEquals("x!", filter.filter("x"));
        registration.close();
        assertEquals("x", filter.filter("x"));
        assertEquals(0, filter.size());
        // Closing twice is harmless
        registration.close();
    }

}
