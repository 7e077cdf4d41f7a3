/*
 * ValidateMode.java
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
 * When a descriptor runs its validator.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum ValidateMode {

    /** Validate values read from the wire only. */
    FROM_RECV,

    /** Validate values assigned in code only. */
    FROM_CODE,

    /** Validate both received and assigned values. */
    ALWAYS,

    /** Never validate. */
    NEVER;

    boolean onReceive() {
        return this == FROM_RECV || this == ALWAYS;
    }

    boolean onAssign() {
        return this == FROM_CODE || this == ALWAYS;
    }

}
