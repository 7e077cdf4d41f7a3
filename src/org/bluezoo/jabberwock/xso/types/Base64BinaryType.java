/*
 * Base64BinaryType.java
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

import java.util.Base64;

/**
 * {@code xs:base64Binary}. Whitespace inside the text is ignored, as it
 * commonly appears in line-wrapped payloads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Base64BinaryType extends XSOType<byte[]> {

    public static final Base64BinaryType INSTANCE = new Base64BinaryType();

    private Base64BinaryType() {
        super(byte[].class);
    }

    @Override
    public byte[] parse(String text) {
        StringBuilder buf = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                buf.append(c);
            }
        }
        try {
            return Base64.getDecoder().decode(buf.toString());
        } catch (IllegalArgumentException e) {
            throw parseError(text, e);
        }
    }

    @Override
    public String format(byte[] value) {
        return Base64.getEncoder().encodeToString(value);
    }

}
