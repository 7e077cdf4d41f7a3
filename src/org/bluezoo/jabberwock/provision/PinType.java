/*
 * PinType.java
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

package org.bluezoo.jabberwock.provision;

import java.text.MessageFormat;

/**
 * What a pin in the pin store is computed from.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum PinType {

    /** The subject public key info of the certificate. */
    PUBLIC_KEY(0),

    /** The whole certificate. */
    CERTIFICATE(1);

    private final int value;

    PinType(int value) {
        this.value = value;
    }

    /**
     * Returns the configuration value of this pin type.
     *
     * @return 0 or 1
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the pin type for a configuration value.
     *
     * @param value the configuration value
     * @return the pin type
     * @throws ProvisioningException if there is no such pin type
     */
    public static PinType fromValue(int value) throws ProvisioningException {
        for (PinType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        String msg = MessageFormat.format(Provisioner.L10N.getString("err.pin_type"), value);
        throw new ProvisioningException(msg);
    }

}
