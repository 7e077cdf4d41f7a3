/*
 * Quirk.java
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
 * Behaviour of a server environment which does not violate the standards
 * but disables some features of the library.
 *
 * <p>Quirks are identified by URI. In configuration they may be written
 * in a short form starting with {@code #}, relative to {@link #BASE_URI}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum Quirk {

    /**
     * The multi-user chat service rewrites message IDs when it reflects
     * messages, which breaks tracking of sent messages.
     */
    MUC_REWRITES_MESSAGE_ID(Quirk.BASE_URI + "#muc-id-rewrite");

    public static final String BASE_URI = "https://zombofant.net/xmlns/aioxmpp/e2etest/quirks";

    private final String uri;

    Quirk(String uri) {
        this.uri = uri;
    }

    public String getURI() {
        return uri;
    }

    /**
     * Expands a short form quirk identifier.
     *
     * @param s a full URI, or a fragment starting with {@code #}
     * @return the full URI
     */
    public static String expand(String s) {
        if (s.startsWith("#")) {
            return BASE_URI + s;
        }
        return s;
    }

    /**
     * Returns the quirk identified by a URI or short form.
     *
     * @param s the identifier
     * @return the quirk
     * @throws ProvisioningException if there is no such quirk
     */
    public static Quirk fromString(String s) throws ProvisioningException {
        String expanded = expand(s);
        for (Quirk quirk : values()) {
            if (quirk.uri.equals(expanded)) {
                return quirk;
            }
        }
        String msg = MessageFormat.format(Provisioner.L10N.getString("err.unknown_quirk"), s);
        throw new ProvisioningException(msg);
    }

    @Override
    public String toString() {
        return uri;
    }

}
