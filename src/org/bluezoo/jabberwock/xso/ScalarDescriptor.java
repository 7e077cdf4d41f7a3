/*
 * ScalarDescriptor.java
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

/**
 * A descriptor holding at most one value per instance.
 *
 * <p>Reading an unset descriptor yields its default value. Assigning
 * {@code null} clears the value. Any other assignment is first coerced to
 * the descriptor's value type, failing with an {@link XSOTypeException}
 * if that is not possible.
 *
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class ScalarDescriptor<V> extends Descriptor {

    private V defaultValue;
    private boolean required;

    ScalarDescriptor() {
    }

    /**
     * Returns the value of this descriptor on an instance.
     *
     * @param instance the instance
     * @return the value, or the default value if unset
     */
    @SuppressWarnings("unchecked")
    public V get(XSO instance) {
        if (instance.hasSlot(this)) {
            return (V) instance.getSlot(this);
        }
        return defaultValue;
    }

    /**
     * Assigns the value of this descriptor on an instance.
     *
     * @param instance the instance
     * @param value the value, or null to clear it
     * @throws XSOTypeException if the value cannot be coerced
     * @throws XSOValidationException if the value is rejected
     */
    public void set(XSO instance, Object value) {
        if (value == null) {
            clear(instance);
            return;
        }
        V v = coerce(value);
        validateAssigned(v);
        instance.setSlot(this, v);
    }

    /**
     * Removes any value from an instance, so that reads yield the default.
     *
     * @param instance the instance
     */
    public void clear(XSO instance) {
        instance.clearSlot(this);
    }

    /**
     * Indicates whether a value has been assigned or parsed on an instance.
     *
     * @param instance the instance
     * @return true if set
     */
    public boolean isSet(XSO instance) {
        return instance.hasSlot(this);
    }

    @Override
    public boolean isPresent(XSO instance) {
        return isSet(instance);
    }

    @Override
    public boolean isRequired() {
        return required;
    }

    public V getDefault() {
        return defaultValue;
    }

    void setRequired(boolean required) {
        checkMutable();
        this.required = required;
    }

    void setDefault(V defaultValue) {
        checkMutable();
        this.defaultValue = defaultValue;
    }

    /**
     * Stores an already converted value without assignment validation.
     */
    void store(XSO instance, V value) {
        instance.setSlot(this, value);
    }

    abstract V coerce(Object value);

    void validateAssigned(V value) {
    }

}
