/*
 * XSO.java
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
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

/**
 * Base class of XML stream objects.
 *
 * <p>An XSO is a typed object bound to the structure of one XML element.
 * Its fields are declared as {@link Descriptor}s on an {@link XSOClass};
 * the instance itself only holds the values, keyed by descriptor. A
 * minimal XSO looks like this:
 *
 * <pre>
 * public class Ping extends XSO {
 *
 *     public static final XSOClass&lt;Ping&gt; CLASS =
 *         XSOClass.builder(Ping.class, Ping::new)
 *             .tag("{urn:xmpp:ping}ping")
 *             .build();
 *
 *     &#64;Override
 *     public XSOClass&lt;Ping&gt; getXSOClass() {
 *         return CLASS;
 *     }
 *
 * }
 * </pre>
 *
 * <p>Instances are not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class XSO {

    private final Map<Descriptor, Object> slots = new IdentityHashMap<>();

    /**
     * Returns the schema of this object.
     *
     * @return the XSO class
     */
    public abstract XSOClass<? extends XSO> getXSOClass();

    /**
     * Returns the tag of this object's element.
     *
     * @return the tag
     */
    public Tag getTag() {
        return getXSOClass().getTag();
    }

    /**
     * Returns the value of a scalar descriptor.
     *
     * @param descriptor the descriptor
     * @return the value or its default
     */
    public <V> V get(ScalarDescriptor<V> descriptor) {
        return descriptor.get(this);
    }

    /**
     * Assigns the value of a scalar descriptor.
     *
     * @param descriptor the descriptor
     * @param value the value, or null to clear it
     */
    public void set(ScalarDescriptor<?> descriptor, Object value) {
        descriptor.set(this, value);
    }

    /**
     * Checks that every required descriptor has a value.
     *
     * @throws MissingDataException naming the first missing descriptor
     */
    public void validate() {
        for (Descriptor descriptor : getXSOClass().getDescriptors()) {
            if (descriptor.isRequired() && !descriptor.isPresent(this)) {
                String msg = MessageFormat.format(XSOClass.L10N.getString("err.missing"),
                                                  descriptor, getTag());
                throw new MissingDataException(msg);
            }
        }
    }

    /**
     * Called when parsing of this object has completed successfully, after
     * validation. Subclasses may derive state or check cross-field
     * constraints here; an {@link XSOException} fails the parse.
     */
    protected void afterLoad() {
    }

    /**
     * Emits this object as SAX events: one element with its attributes
     * and content. Document start and end events are not emitted.
     *
     * @param handler the receiving handler
     * @throws MissingDataException if a required value is missing
     * @throws SAXException if the handler raises
     */
    public void unparseToSax(ContentHandler handler) throws SAXException {
        unparse(new SAXUnparser(handler));
    }

    void unparse(SAXUnparser out) throws SAXException {
        validate();
        XSOClass<?> xsoClass = getXSOClass();
        Map<Tag, String> attributes = new LinkedHashMap<>();
        for (Descriptor descriptor : xsoClass.getDescriptors()) {
            descriptor.unparseAttributes(this, attributes);
        }
        out.startElement(xsoClass.getTag(), attributes);
        for (Descriptor descriptor : xsoClass.getDescriptors()) {
            descriptor.unparseContent(this, out);
        }
        out.endElement();
    }

    boolean hasSlot(Descriptor descriptor) {
        return slots.containsKey(descriptor);
    }

    Object getSlot(Descriptor descriptor) {
        return slots.get(descriptor);
    }

    void setSlot(Descriptor descriptor, Object value) {
        slots.put(descriptor, value);
    }

    void clearSlot(Descriptor descriptor) {
        slots.remove(descriptor);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getTag() + ")";
    }

}
