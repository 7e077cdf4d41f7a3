/*
 * Attr.java
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

package org.bluezoo.jabberwock.xso;

import java.util.Map;

import org.bluezoo.jabberwock.xso.types.Validator;
import org.bluezoo.jabberwock.xso.types.XSOType;

/**
 * Binds a typed value to an attribute of the element.
 *
 * <pre>
 * public static final Attr&lt;Long&gt; ID =
 *     new Attr&lt;&gt;("id", IntegerType.INSTANCE).required();
 * </pre>
 *
 * <p>Only values which were explicitly set are written when the instance
 * is serialised; a default value is never written.
 *
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Attr<V> extends TypedScalarDescriptor<V> {

    private final Tag tag;

    /**
     * Creates an attribute descriptor.
     *
     * @param tag the attribute name, in any form accepted by {@link Tag#normalize}
     * @param type the value type
     */
    public Attr(Object tag, XSOType<V> type) {
        super(type);
        this.tag = Tag.normalize(tag);
    }

    public Tag getTag() {
        return tag;
    }

    /**
     * Marks the attribute as required.
     *
     * @return this descriptor
     */
    public Attr<V> required() {
        setRequired(true);
        return this;
    }

    /**
     * Sets the value returned when the attribute is absent.
     *
     * @param value the default value
     * @return this descriptor
     */
    public Attr<V> defaultValue(V value) {
        setDefault(value);
        return this;
    }

    /**
     * Sets the validator and when it runs.
     *
     * @param validator the validator
     * @param mode when to validate
     * @return this descriptor
     */
    public Attr<V> validator(Validator<? super V> validator, ValidateMode mode) {
        setValidator(validator, mode);
        return this;
    }

    /**
     * Sets a validator which runs on received values.
     *
     * @param validator the validator
     * @return this descriptor
     */
    public Attr<V> validator(Validator<? super V> validator) {
        return validator(validator, ValidateMode.FROM_RECV);
    }

    @Override
    void unparseAttributes(XSO instance, Map<Tag, String> attributes) {
        String value = formatValue(instance);
        if (value != null) {
            attributes.put(tag, value);
        }
    }

    @Override
    public String toString() {
        return "Attr(" + tag + ")";
    }

}
