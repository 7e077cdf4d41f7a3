/*
 * Collector.java
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

import java.util.LinkedHashMap;
import java.util.Map;

import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Catches content no other descriptor claims.
 *
 * <p>A class with a collector defaults to the {@code COLLECT} policy for
 * unknown children, attributes and text.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Collector extends Descriptor {

    private static final String XMLNS_NAMESPACE = "http://www.w3.org/2000/xmlns/";

    /**
     * Returns the collected content of an instance.
     *
     * @param instance the instance
     * @return the live content
     */
    public CollectedContent get(XSO instance) {
        CollectedContent content = (CollectedContent) instance.getSlot(this);
        if (content == null) {
            content = new CollectedContent();
            instance.setSlot(this, content);
        }
        return content;
    }

    @Override
    void unparseAttributes(XSO instance, Map<Tag, String> attributes) {
        if (instance.hasSlot(this)) {
            for (Map.Entry<Tag, String> entry : get(instance).getAttributes().entrySet()) {
                if (!attributes.containsKey(entry.getKey())) {
                    attributes.put(entry.getKey(), entry.getValue());
                }
            }
        }
    }

    @Override
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
        if (!instance.hasSlot(this)) {
            return;
        }
        CollectedContent content = get(instance);
        String text = content.getText();
        if (!text.isEmpty()) {
            out.characters(text);
        }
        for (Element element : content.getElements()) {
            replay(element, out);
        }
    }

    private static void replay(Element element, SAXUnparser out) throws SAXException {
        Map<Tag, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            if (XMLNS_NAMESPACE.equals(attr.getNamespaceURI())) {
                continue;
            }
            String localName = attr.getLocalName() != null ? attr.getLocalName() : attr.getNodeName();
            attributes.put(Tag.of(attr.getNamespaceURI(), localName), attr.getNodeValue());
        }
        String localName = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
        out.startElement(Tag.of(element.getNamespaceURI(), localName), attributes);
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE:
                    replay((Element) child, out);
                    break;
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    out.characters(child.getNodeValue());
                    break;
                default:
                    break;
            }
        }
        out.endElement();
    }

    @Override
    public String toString() {
        return "Collector";
    }

}
