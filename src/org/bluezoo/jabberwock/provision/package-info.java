/*
 * package-info.java
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

/**
 * Provisioning of clients for end-to-end tests against a real server.
 *
 * <p>A {@link org.bluezoo.jabberwock.provision.Provisioner} hands out
 * clients connected to fresh accounts and disconnects them after each
 * test. {@link org.bluezoo.jabberwock.provision.ProvisionConfiguration}
 * reads the configuration keys shared by provisioners.
 */
package org.bluezoo.jabberwock.provision;
