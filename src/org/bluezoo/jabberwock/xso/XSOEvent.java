/*
 * XSOEvent.java
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single parse event fed to an {@link XSOParser}.
 *
 * <p>There are three kinds: the start of an element with its tag and
 * attributes, the end of the innermost open element, and a chunk of
 * character data. Attributes keep document order.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class XSOEvent {

    /**
     * Event kinds.
     */
    public enum Kind {
        START,
        END,
        TEXT
    }

    private static final XSOEvent END_EVENT = new XSOEvent(Kind.END, null, Collections.<Tag, String>emptyMap(), null);

    private final Kind kind;
    private final Tag tag;
    private final Map<Tag, String> attributes;
    private final String text;

    private XSOEvent(Kind kind, Tag tag, Map<Tag, String> attributes, String text) {
        this.kind = kind;
        this.tag = tag;
        this.attributes = attributes;
        this.text = text;
    }

    /**
     * Creates an element start event.
     *
     * @param tag the element tag
     * @param attributes the attributes in document order, may be null
     * @return the event
     */
    public static XSOEvent start(Tag tag, Map<Tag, String> attributes) {
        if (tag == null) {
            throw new NullPointerException("tag");
        }
        Map<Tag, String> copy = attributes == null || attributes.isEmpty()
            ? Collections.<Tag, String>emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        return new XSOEvent(Kind.START, tag, copy, null);
    }

    /**
     * Creates an element start event without attributes.
     *
     * @param tag the element tag
     * @return the event
     */
    public static XSOEvent start(Tag tag) {
        return start(tag, null);
    }

    /**
     * Returns the element end event.
     *
     * @return the event
     */
    public static XSOEvent end() {
        return END_EVENT;
    }

    /**
     * Creates a character data event.
     *
     * @param chunk the characters
     * @return the event
     */
    public static XSOEvent text(String chunk) {
        return new XSOEvent(Kind.TEXT, null, Collections.<Tag, String>emptyMap(), chunk);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the element tag of a start event.
     *
     * @return the tag, or null for other kinds
     */
    public Tag getTag() {
        return tag;
    }

    /**
     * Returns the attributes of a start event.
     *
     * @return an unmodifiable map, empty for other kinds
     */
    public Map<Tag, String> getAttributes() {
        return attributes;
    }

    /**
     * Returns the characters of a text event.
     *
     * @return the text, or null for other kinds
     */
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        switch (kind) {
            case START:
                return "start(" + tag + ", " + attributes + ")";
            case TEXT:
                return "text(" + text + ")";
            default:
                return "end()";
        }
    }

}
