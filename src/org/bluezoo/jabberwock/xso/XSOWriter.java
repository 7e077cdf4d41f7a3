/*
 * XSOWriter.java
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

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.sax.SAXTransformerFactory;
import javax.xml.transform.sax.TransformerHandler;
import javax.xml.transform.stream.StreamResult;

import org.xml.sax.SAXException;

/**
 * Serialises XSOs as UTF-8 XML without an XML declaration.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class XSOWriter {

    private XSOWriter() {
    }

    /**
     * Writes an XSO to a stream.
     *
     * @param xso the object
     * @param out the stream
     * @throws MissingDataException if a required value is missing
     * @throws SAXException if serialisation fails
     */
    public static void write(XSO xso, OutputStream out) throws SAXException {
        TransformerHandler handler = newTransformerHandler();
        handler.setResult(new StreamResult(out));
        handler.startDocument();
        xso.unparseToSax(handler);
        handler.endDocument();
    }

    /**
     * Returns the serialised form of an XSO.
     *
     * @param xso the object
     * @return the XML text
     * @throws MissingDataException if a required value is missing
     */
    public static String toString(XSO xso) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(xso, out);
        } catch (SAXException e) {
            throw new IllegalStateException(e);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private static TransformerHandler newTransformerHandler() throws SAXException {
        try {
            SAXTransformerFactory factory = (SAXTransformerFactory) TransformerFactory.newInstance();
            TransformerHandler handler = factory.newTransformerHandler();
            Transformer transformer = handler.getTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            return handler;
        } catch (TransformerConfigurationException e) {
            throw new SAXException(e);
        }
    }

}
