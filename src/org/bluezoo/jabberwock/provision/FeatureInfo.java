/*
 * FeatureInfo.java
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

import org.bluezoo.jabberwock.JID;

/**
 * Where in the provisioned environment a feature is available.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FeatureInfo {

    private final JID supportedAtEntity;

    public FeatureInfo(JID supportedAtEntity) {
        if (supportedAtEntity == null) {
            throw new NullPointerException("supportedAtEntity");
        }
        this.supportedAtEntity = supportedAtEntity;
    }

    /**
     * Returns the entity providing the feature, such as the server or
     * one of its components.
     *
     * @return the address of the entity
     */
    public JID getSupportedAtEntity() {
        return supportedAtEntity;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FeatureInfo
            && supportedAtEntity.equals(((FeatureInfo) obj).supportedAtEntity);
    }

    @Override
    public int hashCode() {
        return supportedAtEntity.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureInfo(" + supportedAtEntity + ")";
    }

}
