/*
 * CollectingConsumer.java
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
import java.util.Deque;
import java.util.Map;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Builds a DOM element from the events of an unknown child.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class CollectingConsumer extends ElementConsumer<Element> {

    private final Document document;
    private final Deque<Element> stack = new ArrayDeque<>();

    CollectingConsumer(Document document) {
        this.document = document;
    }

    @Override
    FeedResult<Element> feed(XSOEvent event) {
        switch (event.getKind()) {
            case START:
                Tag tag = event.getTag();
                Element element = document.createElementNS(tag.getNamespaceURI(), tag.getLocalName());
                for (Map.Entry<Tag, String> entry : event.getAttributes().entrySet()) {
                    Tag name = entry.getKey();
                    if (Tag.XML_NAMESPACE.equals(name.getNamespaceURI())) {
                        element.setAttributeNS(Tag.XML_NAMESPACE, "xml:" + name.getLocalName(), entry.getValue());
                    } else {
                        element.setAttributeNS(name.getNamespaceURI(), name.getLocalName(), entry.getValue());
                    }
                }
                if (!stack.isEmpty()) {
                    stack.peek().appendChild(element);
                }
                stack.push(element);
                return FeedResult.proceed();
            case END:
                Element done = stack.pop();
                if (stack.isEmpty()) {
                    return FeedResult.complete(done);
                }
                return FeedResult.proceed();
            default:
                stack.peek().appendChild(document.createTextNode(event.getText()));
                return FeedResult.proceed();
        }
    }

}
