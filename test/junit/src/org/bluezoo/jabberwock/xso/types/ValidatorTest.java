/*
 * ValidatorTest.java
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

package org.bluezoo.jabberwock.xso.types;

import org.bluezoo.jabberwock.xso.XSOValidationException;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the built-in validators.
 */
public class ValidatorTest {

    @Test
    public void testRestrictToSet() {
        RestrictToSet<String> validator = RestrictToSet.of("a", "b");
        assertTrue(validator.isValid("a"));
        assertFalse(validator.isValid("c"));
        validator.validate("b");
        assertEquals(2, validator.getAllowed().size());
    }

    @Test(expected = XSOValidationException.class)
    public void testRestrictToSetRejects() {
        RestrictToSet.of(Integer.valueOf(1)).validate(Integer.valueOf(2));
    }

    @Test
    public void testNmtoken() {
        assertTrue(Nmtoken.INSTANCE.isValid("foo-bar.baz:1"));
        assertTrue(Nmtoken.INSTANCE.isValid("123"));
        assertFalse(Nmtoken.INSTANCE.isValid("foo bar"));
        assertFalse(Nmtoken.INSTANCE.isValid(""));
        assertFalse(Nmtoken.INSTANCE.isValid("a<b"));
    }

}
