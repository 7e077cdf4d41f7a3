/*
 * UnknownAttrPolicy.java
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

/**
 * What an {@link XSOParser} does with attribute content that no descriptor of
 * the schema claims.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum UnknownAttrPolicy {

    /** Abort the element with an {@link UnknownContentException}. */
    FAIL,

    /** Silently discard the content. */
    DROP,

    /** Keep the content in the schema's {@link Collector}. */
    COLLECT

}
