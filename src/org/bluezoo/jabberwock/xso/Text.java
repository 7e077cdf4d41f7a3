/*
 * Text.java
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
import org.xml.sax.SAXException;

/**
 * Binds a typed value to the character data of the element itself.
 * Character data split across several events is joined before parsing.
 *
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Text<V> extends TypedScalarDescriptor<V> {

    public Text(XSOType<V> type) {
        super(type);
    }

    public Text<V> required() {
        setRequired(true);
        return this;
    }

    public Text<V> defaultValue(V value) {
        setDefault(value);
        return this;
    }

    public Text<V> validator(Validator<? super V> validator, ValidateMode mode) {
        setValidator(validator, mode);
        return this;
    }

    @Override
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
        String value = formatValue(instance);
        if (value != null) {
            out.characters(value);
        }
    }

    @Override
    public String toString() {
        return "Text";
    }

}
