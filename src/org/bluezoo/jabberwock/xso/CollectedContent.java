/*
 * CollectedContent.java
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Content of an element which no descriptor claimed, kept verbatim.
 *
 * <p>Unknown child elements are held as DOM elements owned by a private
 * document, unknown attributes by tag, and unknown character data as one
 * string. All three collections are live and written back when the
 * owning instance is serialised.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CollectedContent {

    private final List<Element> elements = new ArrayList<>();
    private final Map<Tag, String> attributes = new LinkedHashMap<>();
    private final StringBuilder text = new StringBuilder();
    private Document document;

    CollectedContent() {
    }

    /**
     * Returns the collected child elements, in document order.
     *
     * @return the live list
     */
    public List<Element> getElements() {
        return elements;
    }

    /**
     * Returns the collected attributes, in document order.
     *
     * @return the live map
     */
    public Map<Tag, String> getAttributes() {
        return attributes;
    }

    public String getText() {
        return text.toString();
    }

    public void appendText(String s) {
        text.append(s);
    }

    public boolean isEmpty() {
        return elements.isEmpty() && attributes.isEmpty() && text.length() == 0;
    }

    /**
     * Returns the document owning the collected elements. Elements added
     * to {@link #getElements} should be created by this document.
     *
     * @return the document
     */
    public Document getDocument() {
        if (document == null) {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            try {
                document = factory.newDocumentBuilder().newDocument();
            } catch (ParserConfigurationException e) {
                throw new IllegalStateException(e);
            }
        }
        return document;
    }

}
