/*
 * SAXDriverTest.java
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

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.bluezoo.jabberwock.xso.XSOParserTest.Msg;
import org.bluezoo.jabberwock.xso.XSOParserTest.Note;

import org.junit.Test;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.AttributesImpl;
import static org.junit.Assert.*;

/**
 * Unit tests for SAXDriver.
 */
public class SAXDriverTest {

    private static void parse(String xml, SAXDriver driver) throws Exception {
        XSOReader.parse(new InputSource(new StringReader(xml)), driver);
    }

    @Test
    public void testTopLevelElements() throws Exception {
        List<Msg> messages = new ArrayList<>();
        List<Note> notes = new ArrayList<>();
        SAXDriver driver = new SAXDriver();
        driver.addClass(Msg.CLASS, messages::add);
        driver.addClass(Note.CLASS, notes::add);
        parse("<msg xmlns='x' id='1'><body>one</body></msg>", driver);
        parse("<note xmlns='x'>low</note>", driver);
        assertEquals(1, messages.size());
        assertEquals(Long.valueOf(1), messages.get(0).get(Msg.ID));
        assertEquals("one", messages.get(0).get(Msg.BODY));
        assertEquals(1, notes.size());
        assertEquals("low", notes.get(0).get(Note.TEXT));
        assertTrue(notes.get(0).loaded);
    }

    @Test
    public void testStreamRoot() throws Exception {
        List<Msg> messages = new ArrayList<>();
        SAXDriver driver = new SAXDriver(true);
        driver.addClass(Msg.CLASS, messages::add);
        parse("<stream:stream xmlns:stream='http://etherx.jabber.org/streams' xmlns='x'>"
              + "<msg id='1'/><msg id='2'><body>two</body></msg>"
              + "</stream:stream>", driver);
        assertEquals(2, messages.size());
        assertEquals(Long.valueOf(1), messages.get(0).get(Msg.ID));
        assertNull(messages.get(0).get(Msg.BODY));
        assertEquals("two", messages.get(1).get(Msg.BODY));
    }

    @Test
    public void testUnknownTopLevelHandler() throws Exception {
        List<Msg> messages = new ArrayList<>();
        List<UnknownTopLevelTagException> unknown = new ArrayList<>();
        SAXDriver driver = new SAXDriver(true);
        driver.addClass(Msg.CLASS, messages::add);
        driver.setUnknownTopLevelTagHandler(unknown::add);
        parse("<root xmlns='x'><other kind='k'><msg id='9'/></other><msg id='3'/></root>", driver);
        assertEquals(1, unknown.size());
        assertEquals(Tag.of("x", "other"), unknown.get(0).getTag());
        assertEquals("k", unknown.get(0).getAttributes().get(Tag.of(null, "kind")));
        // The msg nested in the unknown element is not top-level
        assertEquals(1, messages.size());
        assertEquals(Long.valueOf(3), messages.get(0).get(Msg.ID));
    }

    @Test
    public void testUnknownTopLevelWithoutHandler() throws Exception {
        List<Msg> messages = new ArrayList<>();
        SAXDriver driver = new SAXDriver(true);
        driver.addClass(Msg.CLASS, messages::add);
        parse("<root xmlns='x'><other/><msg id='4'/></root>", driver);
        assertEquals(1, messages.size());
    }

    @Test
    public void testFailureWrapsXSOException() throws Exception {
        SAXDriver driver = new SAXDriver();
        driver.addClass(Msg.CLASS, m -> fail("unexpected delivery"));
        try {
            parse("<msg xmlns='x' id='nope'/>", driver);
            fail("expected SAXException");
        } catch (SAXException e) {
            assertTrue(e.getException() instanceof XSOException);
        }
    }

    @Test
    public void testDriverContinuesAfterFailure() throws Exception {
        List<Msg> messages = new ArrayList<>();
        SAXDriver driver = new SAXDriver();
        driver.addClass(Msg.CLASS, messages::add);
        AttributesImpl bad = new AttributesImpl();
        bad.addAttribute("", "id", "id", "CDATA", "nope");
        AttributesImpl good = new AttributesImpl();
        good.addAttribute("", "id", "id", "CDATA", "5");
        AttributesImpl none = new AttributesImpl();

        try {
            driver.startElement("x", "msg", "msg", bad);
            fail("expected SAXException");
        } catch (SAXException e) {
            assertTrue(e.getException() instanceof XSOTypeException);
        }
        // Remainder of the failed element is swallowed
        driver.startElement("x", "body", "body", none);
        driver.characters("ignored".toCharArray(), 0, 7);
        driver.endElement("x", "body", "body");
        driver.endElement("x", "msg", "msg");
        assertTrue(messages.isEmpty());

        driver.startElement("x", "msg", "msg", good);
        driver.endElement("x", "msg", "msg");
        assertEquals(1, messages.size());
        assertEquals(Long.valueOf(5), messages.get(0).get(Msg.ID));
    }

    @Test
    public void testAddClassRejectsDuplicateTag() {
        SAXDriver driver = new SAXDriver();
        driver.addClass(Msg.CLASS, m -> { });
        try {
            driver.addClass(Msg.CLASS, m -> { });
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testAddClassRejectsAbstract() {
        SAXDriver driver = new SAXDriver();
        try {
            driver.addClass(XSOParserTest.Item.CLASS, i -> { });
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testRemoveClass() throws Exception {
        List<Msg> messages = new ArrayList<>();
        List<UnknownTopLevelTagException> unknown = new ArrayList<>();
        SAXDriver driver = new SAXDriver();
        driver.addClass(Msg.CLASS, messages::add);
        driver.setUnknownTopLevelTagHandler(unknown::add);
        assertTrue(driver.removeClass(Msg.CLASS));
        assertFalse(driver.removeClass(Msg.CLASS));
        parse("<msg xmlns='x' id='1'/>", driver);
        assertTrue(messages.isEmpty());
        assertEquals(1, unknown.size());
    }

    @Test
    public void testReadSingleElement() throws Exception {
        Msg msg = XSOReader.read(Msg.CLASS, "<msg xmlns='x' id='7'><body>seven</body></msg>");
        assertEquals(Long.valueOf(7), msg.get(Msg.ID));
        assertEquals("seven", msg.get(Msg.BODY));
    }

    @Test(expected = XSOException.class)
    public void testReadMissingRequired() throws Exception {
        XSOReader.read(Msg.CLASS, "<msg xmlns='x'/>");
    }

    @Test(expected = SAXException.class)
    public void testReadWrongRoot() throws Exception {
        XSOReader.read(Msg.CLASS, "<note xmlns='x'>low</note>");
    }

}
