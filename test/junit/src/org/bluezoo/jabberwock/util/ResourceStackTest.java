/*
 * ResourceStackTest.java
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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for ResourceStack.
 */
public class ResourceStackTest {

    @Test
    public void testReleaseInReverseOrder() throws Exception {
        final List<String> released = new ArrayList<>();
        ResourceStack stack = new ResourceStack();
        for (final String name : Arrays.asList("first", "second", "third")) {
            AutoCloseable resource = () -> released.add(name);
            stack.push(resource);
        }
        assertEquals(3, stack.size());
        stack.close();
        assertEquals(Arrays.asList("third", "second", "first"), released);
        assertEquals(0, stack.size());
    }

    @Test
    public void testFailuresCollected() {
        final List<String> released = new ArrayList<>();
        ResourceStack stack = new ResourceStack();
        AutoCloseable first = () -> released.add("first");
        AutoCloseable second = () -> {
            throw new IOException("second");
        };
        AutoCloseable third = () -> {
            throw new IllegalStateException("third");
        };
        stack.push(first);
        stack.push(second);
        stack.push(third);
        try {
            stack.close();
            fail("expected exception");
        } catch (Exception e) {
            assertEquals("third", e.getMessage());
            assertEquals(1, e.getSuppressed().length);
            assertEquals("second", e.getSuppressed()[0].getMessage());
        }
        assertEquals(Arrays.asList("first"), released);
    }

    @Test
    public void testErrorDoesNotStopRelease() throws Exception {
        final List<String> released = new ArrayList<>();
        ResourceStack stack = new ResourceStack();
        AutoCloseable first = () -> released.add("first");
        AutoCloseable second = () -> {
            throw new AssertionError("second");
        };
        AutoCloseable third = () -> {
            throw new IOException("third");
        };
        stack.push(first);
        stack.push(second);
        stack.push(third);
        try {
            stack.close();
            fail("expected IOException");
        } catch (IOException e) {
            assertEquals("third", e.getMessage());
            assertEquals(1, e.getSuppressed().length);
            assertTrue(e.getSuppressed()[0] instanceof AssertionError);
        }
        assertEquals(Arrays.asList("first"), released);
        assertEquals(0, stack.size());
    }

    @Test
    public void testErrorRethrownAfterRelease() throws Exception {
        final List<String> released = new ArrayList<>();
        ResourceStack stack = new ResourceStack();
        AutoCloseable first = () -> released.add("first");
        AutoCloseable second = () -> {
            throw new AssertionError("second");
        };
        stack.push(first);
        stack.push(second);
        try {
            stack.close();
            fail("expected AssertionError");
        } catch (AssertionError e) {
            assertEquals("second", e.getMessage());
        }
        assertEquals(Arrays.asList("first"), released);
    }

    @Test
    public void testPushReturnsResource() {
        ResourceStack stack = new ResourceStack();
        Registration registration = () -> { };
        assertSame(registration, stack.push(registration));
    }

    @Test(expected = NullPointerException.class)
    public void testPushNull() {
        new ResourceStack().push(null);
    }

    @Test
    public void testReusableAfterClose() throws Exception {
        final List<String> released = new ArrayList<>();
        ResourceStack stack = new ResourceStack();
        stack.close();
        Registration late = () -> released.add("late");
        stack.push(late);
        stack.close();
        assertEquals(Arrays.asList("late"), released);
    }

}
