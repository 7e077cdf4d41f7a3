/*
 * SkippingConsumer.java
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
 * Discards an element and everything inside it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class SkippingConsumer extends ElementConsumer<Void> {

    private int depth;

    SkippingConsumer() {
        this(0);
    }

    /**
     * Creates a consumer which starts inside an element already open.
     *
     * @param depth the number of elements already open
     */
    SkippingConsumer(int depth) {
        this.depth = depth;
    }

    @Override
    FeedResult<Void> feed(XSOEvent event) {
        switch (event.getKind()) {
            case START:
                depth++;
                break;
            case END:
                depth--;
                if (depth <= 0) {
                    return FeedResult.complete(null);
                }
                break;
            default:
                break;
        }
        return FeedResult.proceed();
    }

}
