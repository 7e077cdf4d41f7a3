/*
 * Descriptor.java
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.bluezoo.jabberwock.DeclarationException;
import org.xml.sax.SAXException;

/**
 * A field binding between an XSO and part of its XML element.
 *
 * <p>A descriptor is declared once, as a static field of the XSO's Java
 * class, and added to its {@link XSOClass}. Values are stored per
 * instance: the descriptor is the key under which each {@link XSO} keeps
 * its own value. Once a descriptor belongs to a class its configuration
 * can no longer change.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Descriptor {

    private final List<XSOClass<?>> owners = new CopyOnWriteArrayList<>();
    private volatile boolean frozen;

    Descriptor() {
    }

    /**
     * Indicates whether an instance is incomplete without a value for this
     * descriptor.
     *
     * @return true if a value is required
     */
    public boolean isRequired() {
        return false;
    }

    /**
     * Indicates whether the given instance carries a value for this
     * descriptor. Only meaningful for descriptors that can be required.
     *
     * @param instance the instance
     * @return true if a value is present
     */
    public boolean isPresent(XSO instance) {
        return true;
    }

    /**
     * Ensures the descriptor has not been added to a class yet.
     *
     * @throws DeclarationException if it has
     */
    protected final void checkMutable() {
        if (frozen) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.descriptor_frozen"), this);
            throw new DeclarationException(msg);
        }
    }

    void addOwner(XSOClass<?> owner) {
        frozen = true;
        owners.add(owner);
    }

    /**
     * Returns the classes this descriptor has been added to, including
     * classes which inherited it.
     */
    List<XSOClass<?>> getOwners() {
        return owners;
    }

    /**
     * Contributes attributes of the instance's start tag.
     */
    void unparseAttributes(XSO instance, Map<Tag, String> attributes) {
    }

    /**
     * Emits element content for the instance.
     */
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
    }

}
