/*
 * XSOType.java
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
import java.util.ResourceBundle;

import org.bluezoo.jabberwock.xso.XSOTypeException;

/**
 * Conversion between the XML text form of a value and its Java form.
 *
 * <p>A type parses character data received from the wire, formats values
 * for serialisation and coerces values assigned in code. All three
 * operations report failure with an {@link XSOTypeException} naming the
 * offending input and this type.
 *
 * @param <T> the Java value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class XSOType<T> {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.jabberwock.xso.types.L10N");

    private final Class<T> valueClass;

    protected XSOType(Class<T> valueClass) {
        this.valueClass = valueClass;
    }

    /**
     * Returns the class of values of this type.
     *
     * @return the value class
     */
    public Class<T> getValueClass() {
        return valueClass;
    }

    /**
     * Parses the XML text form of a value.
     *
     * @param text the character data
     * @return the value
     * @throws XSOTypeException if the text is not in the lexical space of
     *         this type
     */
    public abstract T parse(String text);

    /**
     * Formats a value as XML text.
     *
     * @param value the value, never null
     * @return the character data
     */
    public abstract String format(T value);

    /**
     * Converts a value assigned in code to this type.
     *
     * <p>The default implementation accepts instances of the value class
     * only. Subclasses widen this where a lossless conversion exists.
     *
     * @param value the assigned value, never null
     * @return the value as this type
     * @throws XSOTypeException if the value cannot be converted
     */
    public T coerce(Object value) {
        if (valueClass.isInstance(value)) {
            return valueClass.cast(value);
        }
        throw coerceError(value);
    }

    /**
     * Returns an error for text that could not be parsed.
     *
     * @param text the offending text
     * @param cause the underlying failure, or null
     * @return the exception to throw
     */
    protected XSOTypeException parseError(String text, Throwable cause) {
        String msg = MessageFormat.format(L10N.getString("err.parse"), text, this);
        return new XSOTypeException(msg, cause);
    }

    /**
     * Returns an error for a value that could not be coerced.
     *
     * @param value the offending value
     * @return the exception to throw
     */
    protected XSOTypeException coerceError(Object value) {
        String msg = MessageFormat.format(L10N.getString("err.coerce"),
                                          value, value.getClass().getName(), this);
        return new XSOTypeException(msg);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

}
