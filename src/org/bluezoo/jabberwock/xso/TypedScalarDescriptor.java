/*
 * TypedScalarDescriptor.java
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

import org.bluezoo.jabberwock.xso.types.Validator;
import org.bluezoo.jabberwock.xso.types.XSOType;

/**
 * A scalar descriptor whose value is converted from character data by an
 * {@link XSOType} and optionally checked by a {@link Validator}.
 *
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class TypedScalarDescriptor<V> extends ScalarDescriptor<V> {

    private final XSOType<V> type;
    private Validator<? super V> validator;
    private ValidateMode validateMode = ValidateMode.FROM_RECV;

    TypedScalarDescriptor(XSOType<V> type) {
        if (type == null) {
            throw new NullPointerException("type");
        }
        this.type = type;
    }

    public XSOType<V> getType() {
        return type;
    }

    public Validator<? super V> getValidator() {
        return validator;
    }

    public ValidateMode getValidateMode() {
        return validateMode;
    }

    void setValidator(Validator<? super V> validator, ValidateMode mode) {
        checkMutable();
        this.validator = validator;
        this.validateMode = mode == null ? ValidateMode.FROM_RECV : mode;
    }

    @Override
    V coerce(Object value) {
        return type.coerce(value);
    }

    @Override
    void validateAssigned(V value) {
        if (validator != null && validateMode.onAssign()) {
            validator.validate(value);
        }
    }

    /**
     * Parses character data received from the wire into this descriptor.
     *
     * @param instance the instance being parsed
     * @param raw the character data
     * @throws XSOTypeException if the text cannot be parsed
     * @throws XSOValidationException if the parsed value is rejected
     */
    void fromValue(XSO instance, String raw) {
        V value = type.parse(raw);
        if (validator != null && validateMode.onReceive()) {
            validator.validate(value);
        }
        store(instance, value);
    }

    /**
     * Formats the current value of an instance, or returns null if unset.
     */
    String formatValue(XSO instance) {
        if (!isSet(instance)) {
            return null;
        }
        return type.format(get(instance));
    }

}
