/*
 * Nmtoken.java
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

import java.util.regex.Pattern;

/**
 * Accepts strings matching the XML {@code Nmtoken} production.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Nmtoken implements Validator<String> {

    public static final Nmtoken INSTANCE = new Nmtoken();

    // NameChar from XML 1.0 fifth edition
    private static final String NAME_START_CHAR =
        ":A-Z_a-z\\u00C0-\\u00D6\\u00D8-\\u00F6\\u00F8-\\u02FF\\u0370-\\u037D"
        + "\\u037F-\\u1FFF\\u200C-\\u200D\\u2070-\\u218F\\u2C00-\\u2FEF"
        + "\\u3001-\\uD7FF\\uF900-\\uFDCF\\uFDF0-\\uFFFD\\x{10000}-\\x{EFFFF}";
    private static final String NAME_CHAR =
        NAME_START_CHAR + "\\-.0-9\\u00B7\\u0300-\\u036F\\u203F-\\u2040";
    private static final Pattern NMTOKEN = Pattern.compile("[" + NAME_CHAR + "]+");

    private Nmtoken() {
    }

    @Override
    public boolean isValid(String value) {
        return NMTOKEN.matcher(value).matches();
    }

    @Override
    public String toString() {
        return "Nmtoken";
    }

}
