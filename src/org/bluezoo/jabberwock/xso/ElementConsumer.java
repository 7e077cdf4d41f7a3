/*
 * ElementConsumer.java
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
 * Consumes the events of exactly one element, beginning with its start
 * event, and produces a value when the element ends.
 *
 * @param <T> the produced value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
abstract class ElementConsumer<T> {

    /**
     * Feeds the next event.
     *
     * @param event the event
     * @return the outcome
     */
    abstract FeedResult<T> feed(XSOEvent event);

}
