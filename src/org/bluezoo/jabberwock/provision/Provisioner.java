/*
 * Provisioner.java
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.service.ServiceClass;

/**
 * Supplies test code with clients connected to fresh accounts and with
 * information about the environment those accounts live in.
 *
 * <p>Subclasses implement {@link #configure} and {@link #makeClient}. The
 * lifecycle is:
 * <ol>
 *   <li>{@link #configure} with the provisioner's configuration section</li>
 *   <li>{@link #initialise} once, before any test runs</li>
 *   <li>{@link #setup} and {@link #teardown} around each test</li>
 *   <li>{@link #finalise} once at the end, bounded by
 *       {@link #FINALISE_TIMEOUT_SECONDS}</li>
 * </ol>
 *
 * <p>{@link #getConnectedClient} may be called concurrently. Every client
 * it returns is distinct and is disconnected by the next
 * {@link #teardown}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Provisioner {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.jabberwock.provision.L10N");

    public static final long FINALISE_TIMEOUT_SECONDS = 10;

    protected final Logger logger;
    protected final Executor executor;
    private final AtomicInteger counter = new AtomicInteger();
    private final List<ProvisionedClient> clients = Collections.synchronizedList(new ArrayList<ProvisionedClient>());
    private final Map<String, FeatureInfo> features = new ConcurrentHashMap<>();
    private volatile Set<Quirk> quirks = Collections.unmodifiableSet(EnumSet.noneOf(Quirk.class));

    protected Provisioner() {
        this(Logger.getLogger(Provisioner.class.getName()), ForkJoinPool.commonPool());
    }

    /**
     * @param logger the logger; client loggers are named below it
     * @param executor runs teardown of clients and finalisation
     */
    protected Provisioner(Logger logger, Executor executor) {
        this.logger = logger;
        this.executor = executor;
    }

    /**
     * Reads the configuration.
     *
     * @param section configuration keys and values
     * @throws ProvisioningException if the configuration is invalid
     */
    public abstract void configure(Map<String, String> section) throws ProvisioningException;

    /**
     * Creates an unconnected client for a fresh account.
     *
     * @param clientLogger the logger to give the client
     * @return the client
     * @throws IOException if the client cannot be created
     */
    protected abstract ProvisionedClient makeClient(Logger clientLogger) throws IOException;

    /**
     * Returns a client connected to a unique account, with the given
     * services summoned before it connects. The client is disconnected by
     * the next {@link #teardown}.
     *
     * @param services services to summon
     * @return the connected client
     * @throws IOException if the connection fails
     * @throws ProvisioningException if a service cannot be summoned
     */
    public ProvisionedClient getConnectedClient(ServiceClass<?>... services)
            throws IOException, ProvisioningException {
        int id = counter.getAndIncrement();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(MessageFormat.format(L10N.getString("log.obtaining_client"), id, this));
        }
        ProvisionedClient client = makeClient(Logger.getLogger(logger.getName() + ".client" + id));
        for (ServiceClass<?> service : services) {
            try {
                client.summon(service);
            } catch (Exception e) {
                String msg = MessageFormat.format(L10N.getString("err.summon"), service, id);
                throw new ProvisioningException(msg, e);
            }
        }
        client.connect();
        clients.add(client);
        return client;
    }

    /**
     * Returns where a feature is available.
     *
     * @param featureNamespace the service discovery namespace of the feature
     * @return the feature information, or null if it is unsupported
     */
    public FeatureInfo getFeatureInfo(String featureNamespace) {
        return features.get(featureNamespace);
    }

    /**
     * Records that a feature is available.
     *
     * @param featureNamespace the service discovery namespace of the feature
     * @param info where it is available
     */
    protected void addFeature(String featureNamespace, FeatureInfo info) {
        features.put(featureNamespace, info);
    }

    public boolean hasQuirk(Quirk quirk) {
        return quirks.contains(quirk);
    }

    protected void setQuirks(Set<Quirk> quirks) {
        Set<Quirk> copy = EnumSet.noneOf(Quirk.class);
        copy.addAll(quirks);
        this.quirks = Collections.unmodifiableSet(copy);
    }

    public Set<Quirk> getQuirks() {
        return quirks;
    }

    /**
     * Returns the number of clients awaiting teardown.
     *
     * @return the number of connected clients
     */
    public int getClientCount() {
        return clients.size();
    }

    /**
     * Called once before any test runs. The default does nothing.
     *
     * @throws ProvisioningException if the environment cannot be probed
     */
    public void initialise() throws ProvisioningException {
    }

    /**
     * Called once at the end of all tests. {@link #doFinalise} is given
     * {@link #FINALISE_TIMEOUT_SECONDS} to complete.
     *
     * @throws ProvisioningException if finalisation fails or times out
     */
    public final void finalise() throws ProvisioningException {
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
            try {
                doFinalise();
            } catch (ProvisioningException e) {
                throw new CompletionException(e);
            }
        }, executor);
        try {
            future.get(FINALISE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            String msg = MessageFormat.format(L10N.getString("err.finalise_timeout"), FINALISE_TIMEOUT_SECONDS);
            throw new ProvisioningException(msg, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException(L10N.getString("err.interrupted"), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProvisioningException) {
                throw (ProvisioningException) cause;
            }
            throw new ProvisioningException(L10N.getString("err.finalise"), cause);
        }
    }

    /**
     * Finalisation work of subclasses. The default does nothing.
     *
     * @throws ProvisioningException if finalisation fails
     */
    protected void doFinalise() throws ProvisioningException {
    }

    /**
     * Called before each test. The default does nothing.
     *
     * @throws ProvisioningException if the test environment cannot be
     *         prepared
     */
    public void setup() throws ProvisioningException {
    }

    /**
     * Called after each test. Disconnects every client obtained since the
     * last teardown, all at once, and waits for all of them. A client that
     * fails to disconnect does not prevent the others from being
     * disconnected.
     *
     * @throws ProvisioningException if any client failed to disconnect,
     *         with the individual failures suppressed
     */
    public void teardown() throws ProvisioningException {
        List<ProvisionedClient> toDispose;
        synchronized (clients) {
            toDispose = new ArrayList<ProvisionedClient>(clients);
            clients.clear();
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(toDispose.size());
        for (final ProvisionedClient client : toDispose) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    client.disconnect();
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor));
        }
        List<Throwable> failures = new ArrayList<>();
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                interrupted = true;
                failures.add(e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                String msg = MessageFormat.format(L10N.getString("log.disconnect_failed"),
                                                  toDispose.get(i).getLogger().getName());
                logger.log(Level.WARNING, msg, cause);
                failures.add(cause);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (!failures.isEmpty()) {
            String msg = MessageFormat.format(L10N.getString("err.teardown"), failures.size(), toDispose.size());
            ProvisioningException exception = new ProvisioningException(msg);
            for (Throwable failure : failures) {
                exception.addSuppressed(failure);
            }
            throw exception;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

}
