/*
 * JID.java
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

package org.bluezoo.jabberwock;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.ResourceBundle;

/**
 * An XMPP address of the form {@code localpart@domainpart/resourcepart}.
 *
 * <p>The localpart and resourcepart are optional. Instances are immutable.
 * Only structural checks are performed: the domainpart is lowercased and
 * the localpart must not contain any of the characters excluded by
 * RFC 7622. Full PRECIS preparation is left to the transport layer.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class JID {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.jabberwock.L10N");

    /** Maximum length of each part, in characters. */
    public static final int MAX_PART_LENGTH = 1023;

    private static final String LOCALPART_EXCLUDED = "\"&'/:<>@";

    private final String localpart;
    private final String domain;
    private final String resource;

    /**
     * Creates a new JID from its parts.
     *
     * @param localpart the localpart, or null
     * @param domain the domainpart, never null or empty
     * @param resource the resourcepart, or null
     * @throws IllegalArgumentException if any part is malformed
     */
    public JID(String localpart, String domain, String resource) {
        if (domain == null || domain.isEmpty()) {
            throw new IllegalArgumentException(L10N.getString("err.jid_empty_domain"));
        }
        checkLength(domain);
        if (localpart != null) {
            if (localpart.isEmpty()) {
                throw new IllegalArgumentException(L10N.getString("err.jid_empty_localpart"));
            }
            checkLength(localpart);
            for (int i = 0; i < localpart.length(); i++) {
                char c = localpart.charAt(i);
                if (LOCALPART_EXCLUDED.indexOf(c) >= 0 || Character.isWhitespace(c)) {
                    String msg = MessageFormat.format(L10N.getString("err.jid_localpart_char"),
                                                      String.valueOf(c));
                    throw new IllegalArgumentException(msg);
                }
            }
        }
        if (resource != null) {
            if (resource.isEmpty()) {
                throw new IllegalArgumentException(L10N.getString("err.jid_empty_resource"));
            }
            checkLength(resource);
        }
        this.localpart = localpart;
        this.domain = domain.toLowerCase(Locale.ROOT);
        this.resource = resource;
    }

    private static void checkLength(String part) {
        if (part.length() > MAX_PART_LENGTH) {
            String msg = MessageFormat.format(L10N.getString("err.jid_part_too_long"), part.length());
            throw new IllegalArgumentException(msg);
        }
    }

    /**
     * Parses a JID from its string form.
     *
     * @param s the string form
     * @return the JID
     * @throws IllegalArgumentException if the string is not a valid JID
     */
    public static JID fromString(String s) {
        if (s == null) {
            throw new IllegalArgumentException(L10N.getString("err.jid_empty_domain"));
        }
        String resource = null;
        int slash = s.indexOf('/');
        String rest = s;
        if (slash >= 0) {
            resource = s.substring(slash + 1);
            rest = s.substring(0, slash);
        }
        String localpart = null;
        int at = rest.indexOf('@');
        if (at >= 0) {
            localpart = rest.substring(0, at);
            rest = rest.substring(at + 1);
        }
        return new JID(localpart, rest, resource);
    }

    public String getLocalpart() {
        return localpart;
    }

    public String getDomain() {
        return domain;
    }

    public String getResource() {
        return resource;
    }

    /**
     * Returns this JID without its resourcepart.
     *
     * @return the bare JID, which is this instance if already bare
     */
    public JID bare() {
        if (resource == null) {
            return this;
        }
        return new JID(localpart, domain, null);
    }

    public boolean isBare() {
        return resource == null;
    }

    public boolean isDomain() {
        return localpart == null && resource == null;
    }

    /**
     * Returns a copy of this JID with the given resourcepart.
     *
     * @param resource the new resourcepart, or null for a bare JID
     * @return the new JID
     */
    public JID withResource(String resource) {
        return new JID(localpart, domain, resource);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JID)) {
            return false;
        }
        JID other = (JID) obj;
        return domain.equals(other.domain)
            && (localpart == null ? other.localpart == null : localpart.equals(other.localpart))
            && (resource == null ? other.resource == null : resource.equals(other.resource));
    }

    @Override
    public int hashCode() {
        int result = domain.hashCode();
        result = 31 * result + (localpart == null ? 0 : localpart.hashCode());
        result = 31 * result + (resource == null ? 0 : resource.hashCode());
        return result;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        if (localpart != null) {
            buf.append(localpart).append('@');
        }
        buf.append(domain);
        if (resource != null) {
            buf.append('/').append(resource);
        }
        return buf.toString();
    }

}
