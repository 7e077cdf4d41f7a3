/*
 * ChildMap.java
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.xml.sax.SAXException;

/**
 * Binds nested XSOs grouped by a key derived from each child.
 *
 * <p>The map returned by {@link #get} is live and keeps the order in
 * which keys were first seen. Each key maps to the children sharing it,
 * in document order. By default the key is the child's tag.
 *
 * @param <K> the key type
 * @param <V> the common supertype of the accepted classes
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ChildMap<K, V extends XSO> extends Descriptor implements ChildDescriptor {

    private final Class<V> valueClass;
    private final Function<? super V, ? extends K> projection;
    private final ChildClassMap<V> classes = new ChildClassMap<>(this);

    /**
     * Creates a map descriptor.
     *
     * @param valueClass the common supertype of the accepted classes
     * @param projection derives the key of a child
     * @param xsoClasses the initially accepted classes
     */
    @SafeVarargs
    public ChildMap(Class<V> valueClass, Function<? super V, ? extends K> projection,
                    XSOClass<? extends V>... xsoClasses) {
        this.valueClass = valueClass;
        this.projection = projection;
        for (XSOClass<? extends V> xsoClass : xsoClasses) {
            classes.register(xsoClass);
        }
    }

    /**
     * Creates a map descriptor keyed by child tag.
     *
     * @param valueClass the common supertype of the accepted classes
     * @param xsoClasses the initially accepted classes
     * @return the descriptor
     */
    @SafeVarargs
    public static <V extends XSO> ChildMap<Tag, V> byTag(Class<V> valueClass,
                                                           XSOClass<? extends V>... xsoClasses) {
        return new ChildMap<Tag, V>(valueClass, XSO::getTag, xsoClasses);
    }

    public void register(XSOClass<? extends V> xsoClass) {
        classes.register(xsoClass);
    }

    public Collection<XSOClass<? extends V>> getClasses() {
        return classes.getClasses();
    }

    /**
     * Returns the grouped nested objects of an instance.
     *
     * @param instance the instance
     * @return the live map
     */
    @SuppressWarnings("unchecked")
    public Map<K, List<V>> get(XSO instance) {
        Map<K, List<V>> map = (Map<K, List<V>>) instance.getSlot(this);
        if (map == null) {
            map = new LinkedHashMap<>();
            instance.setSlot(this, map);
        }
        return map;
    }

    /**
     * Adds a child under its projected key.
     *
     * @param instance the instance
     * @param value the child
     */
    public void add(XSO instance, V value) {
        K key = projection.apply(value);
        List<V> list = get(instance).get(key);
        if (list == null) {
            list = new ArrayList<>();
            get(instance).put(key, list);
        }
        list.add(value);
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
        add(instance, valueClass.cast(value));
    }

    @Override
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
        if (instance.hasSlot(this)) {
            for (List<V> values : get(instance).values()) {
                for (V value : values) {
                    value.unparse(out);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "ChildMap(" + valueClass.getSimpleName() + ")";
    }

}
