/*
 * Child.java
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

import org.xml.sax.SAXException;

/**
 * Binds a single nested XSO.
 *
 * <p>The concrete class of the nested object is chosen by the child's
 * tag among the registered classes. Further classes can be registered at
 * any time with {@link #register}, which lets extension modules plug
 * their payloads into existing schemas. If the child occurs more than once
 * the last occurrence wins.
 *
 * @param <V> the common supertype of the accepted classes
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Child<V extends XSO> extends ScalarDescriptor<V> implements ChildDescriptor {

    private final Class<V> valueClass;
    private final ChildClassMap<V> classes = new ChildClassMap<>(this);

    /**
     * Creates a child descriptor.
     *
     * @param valueClass the common supertype of the accepted classes
     * @param xsoClasses the initially accepted classes
     */
    @SafeVarargs
    public Child(Class<V> valueClass, XSOClass<? extends V>... xsoClasses) {
        this.valueClass = valueClass;
        for (XSOClass<? extends V> xsoClass : xsoClasses) {
            classes.register(xsoClass);
        }
    }

    public Child<V> required() {
        setRequired(true);
        return this;
    }

    /**
     * Accepts a further class as the nested object.
     *
     * @param xsoClass the class
     * @throws org.bluezoo.jabberwock.DeclarationException if the class is
     *         abstract or its tag is already claimed in an owning class
     */
    public void register(XSOClass<? extends V> xsoClass) {
        classes.register(xsoClass);
    }

    public Collection<XSOClass<? extends V>> getClasses() {
        return classes.getClasses();
    }

    @Override
    V coerce(Object value) {
        if (value instanceof XSO && valueClass.isInstance(value)) {
            XSOClass<?> xsoClass = ((XSO) value).getXSOClass();
            if (classes.get(xsoClass.getTag()) == xsoClass) {
                return valueClass.cast(value);
            }
        }
        throw new XSOTypeException(MessageFormat.format(
            XSOClass.L10N.getString("err.child_type"), value, this));
    }

    @Override
    public Collection<Tag> getTags() {
        return classes.getTags();
    }

    @Override
    public ElementConsumer<?> createConsumer(XSO instance, Tag tag) {
        return new XSOParser<>(classes.get(tag));
    }

    @Override
    public void attach(XSO instance, Tag tag, Object value) {
        store(instance, valueClass.cast(value));
    }

    @Override
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
        V value = get(instance);
        if (value != null) {
            value.unparse(out);
        }
    }

    @Override
    public String toString() {
        return "Child(" + valueClass.getSimpleName() + ")";
    }

}
