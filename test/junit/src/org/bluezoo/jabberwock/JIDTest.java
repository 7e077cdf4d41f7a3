/*
 * JIDTest.java
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

package org.bluezoo.jabberwock;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for JID.
 */
public class JIDTest {

    @Test
    public void testFullJID() {
        JID jid = JID.fromString("romeo@Montague.lit/orchard");
        assertEquals("romeo", jid.getLocalpart());
        assertEquals("montague.lit", jid.getDomain());
        assertEquals("orchard", jid.getResource());
        assertFalse(jid.isBare());
        assertEquals("romeo@montague.lit/orchard", jid.toString());
    }

    @Test
    public void testBare() {
        JID jid = JID.fromString("romeo@montague.lit/orchard");
        JID bare = jid.bare();
        assertTrue(bare.isBare());
        assertEquals(JID.fromString("romeo@montague.lit"), bare);
        assertSame(bare, bare.bare());
    }

    @Test
    public void testDomainJID() {
        JID jid = JID.fromString("montague.lit");
        assertTrue(jid.isDomain());
        assertNull(jid.getLocalpart());
        assertEquals("montague.lit", jid.toString());
    }

    @Test
    public void testResourceMayContainSlashAndAt() {
        JID jid = JID.fromString("juliet@capulet.lit/balcony/a@b");
        assertEquals("balcony/a@b", jid.getResource());
        assertEquals("juliet", jid.getLocalpart());
    }

    @Test
    public void testEquality() {
        assertEquals(JID.fromString("a@b/c"), new JID("a", "B", "c"));
        assertEquals(JID.fromString("a@b/c").hashCode(), new JID("a", "b", "c").hashCode());
        assertNotEquals(JID.fromString("a@b/c"), JID.fromString("a@b/d"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyDomain() {
        JID.fromString("romeo@");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyResource() {
        JID.fromString("romeo@montague.lit/");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyLocalpart() {
        JID.fromString("@montague.lit");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLocalpartExcludedCharacter() {
        new JID("ro<meo", "montague.lit", null);
    }

    @Test
    public void testWithResource() {
        JID jid = JID.fromString("romeo@montague.lit").withResource("garden");
        assertEquals("romeo@montague.lit/garden", jid.toString());
    }

}
