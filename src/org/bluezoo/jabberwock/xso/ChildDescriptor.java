/*
 * ChildDescriptor.java
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

import java.util.Collection;

/**
 * A descriptor which claims child elements by tag.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
interface ChildDescriptor {

    /**
     * Returns the child tags currently claimed.
     */
    Collection<Tag> getTags();

    /**
     * Returns a consumer for a child element with the given tag. The
     * consumer is fed the child's start event next.
     */
    ElementConsumer<?> createConsumer(XSO instance, Tag tag);

    /**
     * Stores a completed child on the instance.
     */
    void attach(XSO instance, Tag tag, Object value);

}
