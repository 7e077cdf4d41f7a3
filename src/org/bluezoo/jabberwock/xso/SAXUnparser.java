/*
 * SAXUnparser.java
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.AttributesImpl;

/**
 * Writes XSO elements to a SAX content handler, declaring namespaces as
 * they are needed.
 *
 * <p>Element namespaces are bound to the default prefix. The XML
 * namespace always uses {@code xml:}; other attribute namespaces get
 * generated prefixes {@code ns0}, {@code ns1} and so on, declared on the
 * element where they are first used.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class SAXUnparser {

    private final ContentHandler handler;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private int prefixCounter;

    private static final class Frame {
        final Tag tag;
        final String defaultNamespace;
        final List<String> declared = new ArrayList<>(1);
        final List<String[]> bindings = new ArrayList<>(1);

        Frame(Tag tag, String defaultNamespace) {
            this.tag = tag;
            this.defaultNamespace = defaultNamespace;
        }
    }

    SAXUnparser(ContentHandler handler) {
        this.handler = handler;
    }

    void startElement(Tag tag, Map<Tag, String> attributes) throws SAXException {
        String ns = tag.getNamespaceURI() == null ? "" : tag.getNamespaceURI();
        String currentDefault = stack.isEmpty() ? "" : stack.peek().defaultNamespace;
        Frame frame = new Frame(tag, ns);
        if (!ns.equals(currentDefault)) {
            handler.startPrefixMapping("", ns);
            frame.declared.add("");
        }
        stack.push(frame);
        AttributesImpl atts = new AttributesImpl();
        for (Map.Entry<Tag, String> entry : attributes.entrySet()) {
            Tag name = entry.getKey();
            String uri = name.getNamespaceURI();
            String qName;
            if (uri == null) {
                uri = "";
                qName = name.getLocalName();
            } else if (Tag.XML_NAMESPACE.equals(uri)) {
                qName = "xml:" + name.getLocalName();
            } else {
                qName = prefixFor(uri, frame) + ":" + name.getLocalName();
            }
            atts.addAttribute(uri, name.getLocalName(), qName, "CDATA", entry.getValue());
        }
        handler.startElement(ns, tag.getLocalName(), tag.getLocalName(), atts);
    }

    private String prefixFor(String uri, Frame frame) throws SAXException {
        for (Frame f : stack) {
            for (String[] binding : f.bindings) {
                if (binding[1].equals(uri)) {
                    return binding[0];
                }
            }
        }
        String prefix = "ns" + (prefixCounter++);
        handler.startPrefixMapping(prefix, uri);
        frame.declared.add(prefix);
        frame.bindings.add(new String[] { prefix, uri });
        return prefix;
    }

    void characters(String text) throws SAXException {
        char[] chars = text.toCharArray();
        handler.characters(chars, 0, chars.length);
    }

    void endElement() throws SAXException {
        Frame frame = stack.pop();
        String ns = frame.tag.getNamespaceURI() == null ? "" : frame.tag.getNamespaceURI();
        handler.endElement(ns, frame.tag.getLocalName(), frame.tag.getLocalName());
        for (String prefix : frame.declared) {
            handler.endPrefixMapping(prefix);
        }
    }

}
