/*
 * Tag.java
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

import java.text.MessageFormat;
import java.util.List;

/**
 * An XML element or attribute name as a {@code (namespace, localname)} pair.
 *
 * <p>The namespace URI is {@code null} for names in no namespace; an empty
 * namespace string is treated the same way, matching the SAX convention.
 * Tags are immutable and compare by value, so they serve as map keys
 * wherever schema lookup takes place.
 *
 * <p>The external string form uses brace notation: {@code
 * {jabber:client}message}, or just the localname when there is no
 * namespace.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Tag {

    /** The namespace bound to the {@code xml} prefix. */
    public static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";

    private final String namespaceURI;
    private final String localName;

    // Cache hash code, tags are used heavily as map keys
    private final int hash;

    /**
     * Creates a new tag.
     *
     * @param namespaceURI the namespace URI, or null/empty for none
     * @param localName the local name, never null or empty
     * @throws TagFormatException if the local name is null or empty
     */
    public Tag(String namespaceURI, String localName) {
        if (localName == null || localName.isEmpty()) {
            throw new TagFormatException(XSOClass.L10N.getString("err.tag_no_localname"));
        }
        this.namespaceURI = (namespaceURI == null || namespaceURI.isEmpty()) ? null : namespaceURI;
        this.localName = localName;
        int result = this.namespaceURI == null ? 0 : this.namespaceURI.hashCode();
        this.hash = 31 * result + localName.hashCode();
    }

    /**
     * Returns the tag for the given namespace and local name.
     *
     * @param namespaceURI the namespace URI, or null for none
     * @param localName the local name
     * @return the tag
     */
    public static Tag of(String namespaceURI, String localName) {
        return new Tag(namespaceURI, localName);
    }

    /**
     * Parses a tag from brace notation, or from a bare local name.
     *
     * @param tag the string form, e.g. {@code {jabber:client}iq} or {@code iq}
     * @return the tag
     * @throws TagFormatException if an opening brace has no closing brace,
     *         or a closing brace has no opening brace
     */
    public static Tag parse(String tag) {
        if (tag.startsWith("{")) {
            int end = tag.indexOf('}');
            if (end < 0) {
                String msg = MessageFormat.format(XSOClass.L10N.getString("err.tag_unclosed_brace"), tag);
                throw new TagFormatException(msg);
            }
            return new Tag(tag.substring(1, end), tag.substring(end + 1));
        }
        if (tag.indexOf('}') >= 0 || tag.indexOf('{') >= 0) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.tag_stray_brace"), tag);
            throw new TagFormatException(msg);
        }
        return new Tag(null, tag);
    }

    /**
     * Normalises any accepted tag representation to a {@code Tag}.
     *
     * <p>Accepted forms are:
     * <ul>
     * <li>a {@code Tag}, returned as is</li>
     * <li>a {@code String} in brace notation or a bare local name</li>
     * <li>a two-element {@code Object[]} or {@code List} holding the
     *     namespace URI (a string or null) and the local name (a string)</li>
     * </ul>
     *
     * @param tag the tag in one of the accepted forms
     * @return the canonical tag
     * @throws TagFormatException if the value is not a well-formed tag
     */
    public static Tag normalize(Object tag) {
        if (tag instanceof Tag) {
            return (Tag) tag;
        }
        if (tag instanceof String) {
            return parse((String) tag);
        }
        if (tag instanceof Object[]) {
            return fromPair((Object[]) tag);
        }
        if (tag instanceof List) {
            return fromPair(((List<?>) tag).toArray());
        }
        String msg = MessageFormat.format(XSOClass.L10N.getString("err.tag_unsupported"), tag);
        throw new TagFormatException(msg);
    }

    private static Tag fromPair(Object[] pair) {
        if (pair.length != 2) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.tag_pair_length"), pair.length);
            throw new TagFormatException(msg);
        }
        for (Object part : pair) {
            if (part != null && !(part instanceof String)) {
                String msg = MessageFormat.format(XSOClass.L10N.getString("err.tag_pair_member"),
                                                  part.getClass().getName());
                throw new TagFormatException(msg);
            }
        }
        if (pair[1] == null) {
            throw new TagFormatException(XSOClass.L10N.getString("err.tag_no_localname"));
        }
        return new Tag((String) pair[0], (String) pair[1]);
    }

    /**
     * Returns the namespace URI.
     *
     * @return the namespace URI, or null if the name is in no namespace
     */
    public String getNamespaceURI() {
        return namespaceURI;
    }

    /**
     * Returns the local name.
     *
     * @return the local name
     */
    public String getLocalName() {
        return localName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Tag)) {
            return false;
        }
        Tag other = (Tag) obj;
        if (hash != other.hash || !localName.equals(other.localName)) {
            return false;
        }
        return namespaceURI == null ? other.namespaceURI == null : namespaceURI.equals(other.namespaceURI);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (namespaceURI == null) {
            return localName;
        }
        return "{" + namespaceURI + "}" + localName;
    }

}
