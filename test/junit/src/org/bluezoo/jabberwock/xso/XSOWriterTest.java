/*
 * XSOWriterTest.java
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

import java.util.List;

import org.bluezoo.jabberwock.xso.XSOParserTest.Apple;
import org.bluezoo.jabberwock.xso.XSOParserTest.Basket;
import org.bluezoo.jabberwock.xso.XSOParserTest.Item;
import org.bluezoo.jabberwock.xso.XSOParserTest.Msg;
import org.bluezoo.jabberwock.xso.XSOParserTest.Pear;
import org.bluezoo.jabberwock.xso.types.StringType;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for XSOWriter.
 */
public class XSOWriterTest {

    @Test
    public void testWriteAttributesAndChildText() throws Exception {
        Msg msg = new Msg();
        msg.set(Msg.ID, 42);
        msg.set(Msg.BODY, "a < b & c");
        String xml = XSOWriter.toString(msg);
        assertFalse(xml.startsWith("<?xml"));
        assertTrue(xml, xml.contains("xmlns=\"x\""));
        assertTrue(xml, xml.contains("id=\"42\""));
        assertTrue(xml, xml.contains("a &lt; b &amp; c"));

        Msg copy = XSOReader.read(Msg.CLASS, xml);
        assertEquals(Long.valueOf(42), copy.get(Msg.ID));
        assertEquals("a < b & c", copy.get(Msg.BODY));
    }

    @Test
    public void testAbsentOptionalChildOmitted() {
        Msg msg = new Msg();
        msg.set(Msg.ID, 1);
        String xml = XSOWriter.toString(msg);
        assertFalse(xml, xml.contains("body"));
    }

    @Test(expected = MissingDataException.class)
    public void testMissingRequiredAttribute() {
        XSOWriter.toString(new Msg());
    }

    @Test
    public void testNestedObjects() throws Exception {
        Basket basket = new Basket();
        Apple apple = new Apple();
        apple.set(Item.NAME, "cox");
        Pear pear = new Pear();
        pear.set(Item.NAME, "comice");
        Basket.ITEMS.get(basket).add(apple);
        Basket.ITEMS.get(basket).add(pear);
        basket.set(Basket.STATE, Tag.of(XSOParserTest.NS, "full"));

        Basket copy = XSOReader.read(Basket.CLASS, XSOWriter.toString(basket));
        List<Item> items = Basket.ITEMS.get(copy);
        assertEquals(2, items.size());
        assertTrue(items.get(0) instanceof Apple);
        assertEquals("cox", items.get(0).get(Item.NAME));
        assertTrue(items.get(1) instanceof Pear);
        assertEquals("comice", items.get(1).get(Item.NAME));
        assertEquals(Tag.of(XSOParserTest.NS, "full"), copy.get(Basket.STATE));
        assertNull(copy.get(Basket.NOTE));
    }

    @Test
    public void testXmlLangAttribute() throws Exception {
        String xml = XSOWriter.toString(XSOReader.read(Labelled.CLASS,
                                                       "<label xmlns='x' xml:lang='de'/>"));
        assertTrue(xml, xml.contains("xml:lang=\"de\""));
        Labelled copy = XSOReader.read(Labelled.CLASS, xml);
        assertEquals("de", copy.get(Labelled.LANG));
    }

    public static class Labelled extends XSO {
        static final Attr<String> LANG = new Attr<>(Tag.of(Tag.XML_NAMESPACE, "lang"), StringType.INSTANCE);
        static final XSOClass<Labelled> CLASS = XSOClass.builder(Labelled.class, Labelled::new)
            .tag(XSOParserTest.NS, "label")
            .add(LANG)
            .build();

        @Override
        public XSOClass<Labelled> getXSOClass() {
            return CLASS;
        }
    }

}
