/*
 * IntegerType.java
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

import java.math.BigInteger;

/**
 * Base-10 integers in the range of a Java {@code long}.
 *
 * <p>Assignment accepts any integral {@link Number} whose value fits,
 * including a {@link BigInteger}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class IntegerType extends XSOType<Long> {

    public static final IntegerType INSTANCE = new IntegerType();

    private static final BigInteger MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private IntegerType() {
        super(Long.class);
    }

    @Override
    public Long parse(String text) {
        String s = text.trim();
        // xs:integer permits a leading plus sign
        if (s.startsWith("+")) {
            s = s.substring(1);
        }
        try {
            return Long.valueOf(s, 10);
        } catch (NumberFormatException e) {
            throw parseError(text, e);
        }
    }

    @Override
    public String format(Long value) {
        return value.toString();
    }

    @Override
    public Long coerce(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Long.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            BigInteger b = (BigInteger) value;
            if (b.compareTo(MIN) >= 0 && b.compareTo(MAX) <= 0) {
                return Long.valueOf(b.longValue());
            }
        }
        throw coerceError(value);
    }

}
