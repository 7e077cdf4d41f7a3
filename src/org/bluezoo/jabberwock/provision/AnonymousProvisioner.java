/*
 * AnonymousProvisioner.java
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

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.JID;

/**
 * Provisions clients logging in anonymously to a single server.
 *
 * <p>Configuration needs the {@code host} to connect to and optionally the
 * TLS and quirks settings read by {@link ProvisionConfiguration}:
 *
 * <pre>
 * host=localhost
 * no_verify=true
 * quirks=[]
 * </pre>
 *
 * <p>The server must allow anonymous login and must let the clients
 * logged in that way talk to each other.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AnonymousProvisioner extends Provisioner {

    private final ClientFactory clientFactory;
    private JID host;
    private TLSConfiguration tls = TLSConfiguration.DEFAULT;

    public AnonymousProvisioner(ClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    public AnonymousProvisioner(ClientFactory clientFactory, Logger logger, Executor executor) {
        super(logger, executor);
        this.clientFactory = clientFactory;
    }

    @Override
    public void configure(Map<String, String> section) throws ProvisioningException {
        String value = ProvisionConfiguration.getRequired(section, ProvisionConfiguration.HOST);
        try {
            host = JID.fromString(value);
        } catch (IllegalArgumentException e) {
            String msg = MessageFormat.format(L10N.getString("err.host"), value);
            throw new ProvisioningException(msg, e);
        }
        tls = ProvisionConfiguration.getTLSConfiguration(section);
        setQuirks(ProvisionConfiguration.getQuirks(section));
        if (logger.isLoggable(Level.INFO)) {
            logger.info(MessageFormat.format(L10N.getString("log.configured"), this, host, tls, getQuirks()));
        }
    }

    public JID getHost() {
        return host;
    }

    public TLSConfiguration getTLSConfiguration() {
        return tls;
    }

    @Override
    protected ProvisionedClient makeClient(Logger clientLogger) throws IOException {
        if (host == null) {
            throw new IllegalStateException(L10N.getString("err.not_configured"));
        }
        return clientFactory.createClient(host, tls, clientLogger);
    }

    @Override
    public void initialise() throws ProvisioningException {
        if (logger.isLoggable(Level.INFO)) {
            logger.info(MessageFormat.format(L10N.getString("log.initialising"), this, host));
        }
    }

}
