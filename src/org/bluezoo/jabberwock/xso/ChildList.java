/*
 * ChildList.java
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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.xml.sax.SAXException;

/**
 * Binds an ordered sequence of nested XSOs.
 *
 * <p>The list returned by {@link #get} is live: it belongs to the
 * instance and is modified directly.
 *
 * @param <V> the common supertype of the accepted classes
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ChildList<V extends XSO> extends Descriptor implements ChildDescriptor {

    private final Class<V> valueClass;
    private final ChildClassMap<V> classes = new ChildClassMap<>(this);

    @SafeVarargs
    public ChildList(Class<V> valueClass, XSOClass<? extends V>... xsoClasses) {
        this.valueClass = valueClass;
        for (XSOClass<? extends V> xsoClass : xsoClasses) {
            classes.register(xsoClass);
        }
    }

    public void register(XSOClass<? extends V> xsoClass) {
        classes.register(xsoClass);
    }

    public Collection<XSOClass<? extends V>> getClasses() {
        return classes.getClasses();
    }

    /**
     * Returns the list of nested objects of an instance.
     *
     * @param instance the instance
     * @return the live list
     */
    @SuppressWarnings("unchecked")
    public List<V> get(XSO instance) {
        List<V> list = (List<V>) instance.getSlot(this);
        if (list == null) {
            list = new ArrayList<>();
            instance.setSlot(this, list);
        }
        return list;
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
        get(instance).add(valueClass.cast(value));
    }

    @Override
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
        if (instance.hasSlot(this)) {
            for (V value : get(instance)) {
                value.unparse(out);
            }
        }
    }

    @Override
    public String toString() {
        return "ChildList(" + valueClass.getSimpleName() + ")";
    }

}
