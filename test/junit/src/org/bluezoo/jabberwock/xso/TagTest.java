/*
 * TagTest.java
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

package org.bluezoo.jabberwock.xso;

import java.util.Arrays;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for Tag.
 */
public class TagTest {

    @Test
    public void testParseBraceNotation() {
        Tag tag = Tag.parse("{jabber:client}message");
        assertEquals("jabber:client", tag.getNamespaceURI());
        assertEquals("message", tag.getLocalName());
        assertEquals("{jabber:client}message", tag.toString());
    }

    @Test
    public void testParseBareLocalName() {
        Tag tag = Tag.parse("body");
        assertNull(tag.getNamespaceURI());
        assertEquals("body", tag.getLocalName());
        assertEquals("body", tag.toString());
    }

    @Test
    public void testEmptyNamespaceIsAbsent() {
        assertEquals(Tag.of(null, "x"), Tag.parse("{}x"));
        assertEquals(Tag.of(null, "x"), Tag.of("", "x"));
    }

    @Test
    public void testRoundTrip() {
        String[] forms = { "{urn:a}b", "{http://www.w3.org/XML/1998/namespace}lang", "{x}y" };
        for (String s : forms) {
            assertEquals(s, Tag.normalize(s).toString());
        }
        Tag tag = Tag.of("urn:xmpp:ping", "ping");
        assertEquals(tag, Tag.normalize(tag.toString()));
    }

    @Test
    public void testNormalizeForms() {
        Tag expected = Tag.of("urn:a", "b");
        assertSame(expected, Tag.normalize(expected));
        assertEquals(expected, Tag.normalize("{urn:a}b"));
        assertEquals(expected, Tag.normalize(new Object[] { "urn:a", "b" }));
        assertEquals(expected, Tag.normalize(Arrays.asList("urn:a", "b")));
        assertEquals(Tag.of(null, "b"), Tag.normalize(new Object[] { null, "b" }));
    }

    @Test(expected = TagFormatException.class)
    public void testUnclosedBrace() {
        Tag.parse("{urn:a");
    }

    @Test(expected = TagFormatException.class)
    public void testStrayBrace() {
        Tag.parse("urn:a}b");
    }

    @Test(expected = TagFormatException.class)
    public void testEmptyLocalName() {
        Tag.parse("{urn:a}");
    }

    @Test(expected = TagFormatException.class)
    public void testPairLength() {
        Tag.normalize(new Object[] { "urn:a", "b", "c" });
    }

    @Test(expected = TagFormatException.class)
    public void testPairMemberType() {
        Tag.normalize(Arrays.asList("urn:a", Integer.valueOf(1)));
    }

    @Test(expected = TagFormatException.class)
    public void testUnsupportedForm() {
        Tag.normalize(Integer.valueOf(42));
    }

    @Test
    public void testEquality() {
        assertEquals(Tag.of("a", "b"), Tag.of("a", "b"));
        assertEquals(Tag.of("a", "b").hashCode(), Tag.of("a", "b").hashCode());
        assertNotEquals(Tag.of("a", "b"), Tag.of(null, "b"));
        assertNotEquals(Tag.of("a", "b"), Tag.of("a", "c"));
    }

}
