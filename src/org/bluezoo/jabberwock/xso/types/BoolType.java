/*
 * BoolType.java
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
 * {@code xs:boolean}: {@code true} or {@code 1}, {@code false} or
 * {@code 0}. Formats as {@code true} or {@code false}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BoolType extends XSOType<Boolean> {

    public static final BoolType INSTANCE = new BoolType();

    private BoolType() {
        super(Boolean.class);
    }

    @Override
    public Boolean parse(String text) {
        switch (text.trim()) {
            case "true":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "0":
                return Boolean.FALSE;
            default:
                throw parseError(text, null);
        }
    }

    @Override
    public String format(Boolean value) {
        return value.booleanValue() ? "true" : "false";
    }

}
