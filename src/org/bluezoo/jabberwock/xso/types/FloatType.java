/*
 * FloatType.java
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
 * {@code xs:double} values, including {@code INF}, {@code -INF} and
 * {@code NaN}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FloatType extends XSOType<Double> {

    public static final FloatType INSTANCE = new FloatType();

    private FloatType() {
        super(Double.class);
    }

    @Override
    public Double parse(String text) {
        String s = text.trim();
        switch (s) {
            case "INF":
            case "+INF":
                return Double.POSITIVE_INFINITY;
            case "-INF":
                return Double.NEGATIVE_INFINITY;
            case "NaN":
                return Double.NaN;
            default:
                break;
        }
        // Reject the Java-only spellings Double.parseDouble accepts
        if (s.isEmpty() || s.indexOf('I') >= 0 || s.indexOf('N') >= 0
                || s.indexOf('x') >= 0 || s.indexOf('X') >= 0
                || s.endsWith("d") || s.endsWith("D") || s.endsWith("f") || s.endsWith("F")) {
            throw parseError(text, null);
        }
        try {
            return Double.valueOf(s);
        } catch (NumberFormatException e) {
            throw parseError(text, e);
        }
    }

    @Override
    public String format(Double value) {
        double d = value.doubleValue();
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (d == Double.POSITIVE_INFINITY) {
            return "INF";
        }
        if (d == Double.NEGATIVE_INFINITY) {
            return "-INF";
        }
        return value.toString();
    }

    @Override
    public Double coerce(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return Double.valueOf(((Number) value).doubleValue());
        }
        throw coerceError(value);
    }

}
