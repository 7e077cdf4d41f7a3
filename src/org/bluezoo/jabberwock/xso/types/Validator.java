/*
 * Validator.java
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

import java.text.MessageFormat;

import org.bluezoo.jabberwock.xso.XSOValidationException;

/**
 * A constraint on the values of a descriptor.
 *
 * @param <T> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface Validator<T> {

    /**
     * Tests whether a value satisfies this constraint.
     *
     * @param value the value, never null
     * @return true if the value is acceptable
     */
    boolean isValid(T value);

    /**
     * Checks a value, raising if it is not acceptable.
     *
     * @param value the value, never null
     * @throws XSOValidationException if the value is rejected
     */
    default void validate(T value) {
        if (!isValid(value)) {
            String msg = MessageFormat.format(XSOType.L10N.getString("err.invalid"), value, this);
            throw new XSOValidationException(msg);
        }
    }

}
