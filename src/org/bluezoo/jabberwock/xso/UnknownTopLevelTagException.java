/*
 * UnknownTopLevelTagException.java
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes a top-level element for which no XSO class is registered with
 * a {@link SAXDriver}.
 *
 * <p>This exception is normally delivered to the driver's unknown-tag
 * handler rather than thrown, so that the surrounding transport can
 * decide whether the stream survives.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnknownTopLevelTagException extends XSOException {

    private static final long serialVersionUID = 1L;

    private final Tag tag;
    private final Map<Tag, String> attributes;

    public UnknownTopLevelTagException(Tag tag, Map<Tag, String> attributes) {
        super(MessageFormat.format(XSOClass.L10N.getString("err.unknown_top_level_tag"), tag));
        this.tag = tag;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Returns the tag of the unrecognised element.
     *
     * @return the tag
     */
    public Tag getTag() {
        return tag;
    }

    /**
     * Returns the attributes of the unrecognised element, in document order.
     *
     * @return an unmodifiable map of attributes
     */
    public Map<Tag, String> getAttributes() {
        return attributes;
    }

}
