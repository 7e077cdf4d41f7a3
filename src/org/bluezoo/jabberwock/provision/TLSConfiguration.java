/*
 * TLSConfiguration.java
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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * How provisioned clients verify the server certificate.
 *
 * <p>Either verification is disabled altogether, or certificates are
 * checked against a pin store mapping host names to base64 pins, or the
 * default verification applies. Disabling verification takes precedence
 * over pinning.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TLSConfiguration {

    /** Default verification without pinning. */
    public static final TLSConfiguration DEFAULT = new TLSConfiguration(null, null, false);

    private final Map<String, List<String>> pinStore;
    private final PinType pinType;
    private final boolean noVerify;

    /**
     * @param pinStore host names to base64 pins, or null
     * @param pinType what the pins are computed from, null if there is no
     *        pin store
     * @param noVerify whether to skip certificate verification
     */
    public TLSConfiguration(Map<String, List<String>> pinStore, PinType pinType, boolean noVerify) {
        if (noVerify) {
            pinStore = null;
            pinType = null;
        }
        this.pinStore = pinStore == null ? null : Collections.unmodifiableMap(pinStore);
        this.pinType = pinStore == null ? null : pinType;
        this.noVerify = noVerify;
    }

    public Map<String, List<String>> getPinStore() {
        return pinStore;
    }

    public PinType getPinType() {
        return pinType;
    }

    public boolean isNoVerify() {
        return noVerify;
    }

    /**
     * Returns the pins configured for a host.
     *
     * @param host the host name
     * @return the base64 pins, empty if there are none
     */
    public List<String> getPins(String host) {
        if (pinStore == null) {
            return Collections.emptyList();
        }
        List<String> pins = pinStore.get(host);
        return pins == null ? Collections.<String>emptyList() : pins;
    }

    @Override
    public String toString() {
        if (noVerify) {
            return "TLSConfiguration(no_verify)";
        }
        if (pinStore != null) {
            return "TLSConfiguration(" + pinType + " pins for " + pinStore.keySet() + ")";
        }
        return "TLSConfiguration(default)";
    }

}
