/*
 * ChildText.java
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

import java.text.MessageFormat;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import org.bluezoo.jabberwock.DeclarationException;
import org.bluezoo.jabberwock.xso.types.Validator;
import org.bluezoo.jabberwock.xso.types.XSOType;
import org.xml.sax.SAXException;

/**
 * Binds a typed value to the text of a child element, as in
 * {@code <body>hello</body>}.
 *
 * <p>Attributes and grandchildren of that element are governed by this
 * descriptor's own policies, {@code FAIL} by default. If the child occurs
 * more than once the last occurrence wins.
 *
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ChildText<V> extends TypedScalarDescriptor<V> implements ChildDescriptor {

    private final Tag tag;
    private UnknownAttrPolicy attrPolicy = UnknownAttrPolicy.FAIL;
    private UnknownChildPolicy childPolicy = UnknownChildPolicy.FAIL;

    public ChildText(Object tag, XSOType<V> type) {
        super(type);
        this.tag = Tag.normalize(tag);
    }

    public Tag getTag() {
        return tag;
    }

    public ChildText<V> required() {
        setRequired(true);
        return this;
    }

    public ChildText<V> defaultValue(V value) {
        setDefault(value);
        return this;
    }

    public ChildText<V> validator(Validator<? super V> validator, ValidateMode mode) {
        setValidator(validator, mode);
        return this;
    }

    public ChildText<V> attrPolicy(UnknownAttrPolicy policy) {
        checkMutable();
        checkLeafPolicy(this, policy == UnknownAttrPolicy.COLLECT);
        this.attrPolicy = policy;
        return this;
    }

    public ChildText<V> childPolicy(UnknownChildPolicy policy) {
        checkMutable();
        checkLeafPolicy(this, policy == UnknownChildPolicy.COLLECT);
        this.childPolicy = policy;
        return this;
    }

    static void checkLeafPolicy(Descriptor descriptor, boolean collect) {
        if (collect) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.leaf_policy"), descriptor);
            throw new DeclarationException(msg);
        }
    }

    @Override
    public Collection<Tag> getTags() {
        return Collections.singleton(tag);
    }

    @Override
    public ElementConsumer<?> createConsumer(XSO instance, Tag childTag) {
        return new LeafElementConsumer(attrPolicy, childPolicy, UnknownTextPolicy.FAIL, true);
    }

    @Override
    public void attach(XSO instance, Tag childTag, Object value) {
        fromValue(instance, (String) value);
    }

    @Override
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
        String value = formatValue(instance);
        if (value != null) {
            out.startElement(tag, Collections.<Tag, String>emptyMap());
            out.characters(value);
            out.endElement();
        }
    }

    @Override
    public String toString() {
        return "ChildText(" + tag + ")";
    }

}
