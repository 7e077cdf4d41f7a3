/*
 * JIDType.java
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

package org.bluezoo.jabberwock.xso.types;

import org.bluezoo.jabberwock.JID;

/**
 * XMPP addresses. Assignment also accepts the string form.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class JIDType extends XSOType<JID> {

    public static final JIDType INSTANCE = new JIDType();

    private JIDType() {
        super(JID.class);
    }

    @Override
    public JID parse(String text) {
        try {
            return JID.fromString(text);
        } catch (IllegalArgumentException e) {
            throw parseError(text, e);
        }
    }

    @Override
    public String format(JID value) {
        return value.toString();
    }

    @Override
    public JID coerce(Object value) {
        if (value instanceof String) {
            return parse((String) value);
        }
        return super.coerce(value);
    }

}
