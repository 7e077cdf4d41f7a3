/*
 * XSOReader.java
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

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;

import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;

/**
 * Reads XSOs from complete XML documents using the platform SAX parser.
 *
 * <p>Network streams are fed to a {@link SAXDriver} by the transport;
 * this class covers the simpler case of a document held in full, such as
 * stored state or test fixtures.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class XSOReader {

    private XSOReader() {
    }

    /**
     * Parses a document into a driver.
     *
     * @param in the document source
     * @param driver the driver receiving the events
     * @throws IOException if the source cannot be read
     * @throws SAXException if the document is not well-formed or an
     *         element fails to parse
     */
    public static void parse(InputSource in, SAXDriver driver) throws IOException, SAXException {
        XMLReader reader = newXMLReader();
        reader.setContentHandler(driver);
        reader.setErrorHandler(driver);
        reader.parse(in);
    }

    /**
     * Parses a document consisting of a single element of the given class.
     *
     * @param xsoClass the class of the element
     * @param xml the document text
     * @return the parsed instance
     * @throws XSOException if the element fails to parse
     * @throws SAXException if the document is not well-formed or its root
     *         element is of a different class
     */
    public static <T extends XSO> T read(XSOClass<T> xsoClass, String xml) throws SAXException {
        final List<T> result = new ArrayList<>(1);
        final List<UnknownTopLevelTagException> unknown = new ArrayList<>(1);
        SAXDriver driver = new SAXDriver();
        driver.addClass(xsoClass, result::add);
        driver.setUnknownTopLevelTagHandler(unknown::add);
        try {
            parse(new InputSource(new StringReader(xml)), driver);
        } catch (SAXException e) {
            if (e.getException() instanceof XSOException) {
                throw (XSOException) e.getException();
            }
            throw e;
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException(e);
        }
        if (!unknown.isEmpty()) {
            throw new SAXException(unknown.get(0));
        }
        return result.get(0);
    }

    static XMLReader newXMLReader() throws SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        try {
            return factory.newSAXParser().getXMLReader();
        } catch (ParserConfigurationException e) {
            throw new SAXException(e);
        }
    }

}
