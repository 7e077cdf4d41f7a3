/*
 * EnumType.java
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

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps the constants of an enum to and from XML string values.
 *
 * <p>By default a constant's XML value is its name in lower case with
 * underscores replaced by hyphens, so {@code SERVICE_UNAVAILABLE} reads
 * and writes as {@code service-unavailable}.
 *
 * @param <E> the enum type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class EnumType<E extends Enum<E>> extends XSOType<E> {

    private final Map<String, E> byValue = new LinkedHashMap<>();
    private final Map<E, String> byConstant;

    /**
     * Creates an enum type using the default naming.
     *
     * @param enumClass the enum class
     */
    public EnumType(Class<E> enumClass) {
        this(enumClass, EnumType::defaultName);
    }

    /**
     * Creates an enum type with explicit naming.
     *
     * @param enumClass the enum class
     * @param naming maps each constant to its XML value
     */
    public EnumType(Class<E> enumClass, Function<? super E, String> naming) {
        super(enumClass);
        byConstant = new EnumMap<>(enumClass);
        for (E constant : enumClass.getEnumConstants()) {
            String value = naming.apply(constant);
            byValue.put(value, constant);
            byConstant.put(constant, value);
        }
    }

    /**
     * Returns the default XML value of a constant.
     *
     * @param constant the constant
     * @return its name in lower case, with hyphens for underscores
     */
    public static String defaultName(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @Override
    public E parse(String text) {
        E constant = byValue.get(text.trim());
        if (constant == null) {
            throw parseError(text, null);
        }
        return constant;
    }

    @Override
    public String format(E value) {
        return byConstant.get(value);
    }

    @Override
    public String toString() {
        return "EnumType(" + getValueClass().getSimpleName() + ")";
    }

}
