/*
 * HexBinaryType.java
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

/**
 * {@code xs:hexBinary}. Parsing accepts either case, formatting produces
 * lowercase digits.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class HexBinaryType extends XSOType<byte[]> {

    public static final HexBinaryType INSTANCE = new HexBinaryType();

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HexBinaryType() {
        super(byte[].class);
    }

    @Override
    public byte[] parse(String text) {
        String s = text.trim();
        if (s.length() % 2 != 0) {
            throw parseError(text, null);
        }
        byte[] result = new byte[s.length() / 2];
        for (int i = 0; i < result.length; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw parseError(text, null);
            }
            result[i] = (byte) ((hi << 4) | lo);
        }
        return result;
    }

    @Override
    public String format(byte[] value) {
        char[] buf = new char[value.length * 2];
        for (int i = 0; i < value.length; i++) {
            buf[2 * i] = HEX[(value[i] >> 4) & 0x0f];
            buf[2 * i + 1] = HEX[value[i] & 0x0f];
        }
        return new String(buf);
    }

}
