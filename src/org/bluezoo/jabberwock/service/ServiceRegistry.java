/*
 * ServiceRegistry.java
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

package org.bluezoo.jabberwock.service;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.DeclarationException;

/**
 * The universe of declared service classes and their ordering.
 *
 * <p>Each declaration contributes edges: {@code A.orderBefore(B)} and
 * {@code B.orderAfter(A)} both mean that A runs before B. The registry
 * keeps the transitive closure of these edges over every declared class,
 * recomputing it when a class is declared, so that a class declared later
 * can extend the ordering sets of classes declared earlier. A declaration
 * that would make the ordering cyclic, or that is otherwise inconsistent,
 * is rejected with a {@link DeclarationException} and leaves the registry
 * unchanged.
 *
 * <p>The {@link #comparator} orders classes by a linearisation of the
 * closure. Unrelated classes are ordered by declaration order, so the
 * linearisation of an unchanged registry is always the same.
 *
 * <p>Once {@link #close closed}, the registry accepts no further
 * declarations.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ServiceRegistry {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.jabberwock.service.L10N");

    private static final Logger LOGGER = Logger.getLogger(ServiceRegistry.class.getName());

    private static final ServiceRegistry DEFAULT = new ServiceRegistry();

    private final List<ServiceClass<?>> declared = new ArrayList<>();
    private Map<ServiceClass<?>, Set<ServiceClass<?>>> edges = new IdentityHashMap<>();
    private Map<ServiceClass<?>, Set<ServiceClass<?>>> closedAfter = new IdentityHashMap<>();
    private Map<ServiceClass<?>, Set<ServiceClass<?>>> closedBefore = new IdentityHashMap<>();
    private Map<ServiceClass<?>, Integer> linearisation;
    private boolean closed;

    /**
     * Returns the registry used by {@link ServiceClass.Builder#declare()}.
     *
     * @return the default registry
     */
    public static ServiceRegistry getDefault() {
        return DEFAULT;
    }

    /**
     * Adds a service class to this registry.
     *
     * @param serviceClass the new class
     * @throws DeclarationException if the registry is closed or the
     *         declaration is inconsistent
     */
    synchronized void declare(ServiceClass<?> serviceClass) {
        if (closed) {
            throw new DeclarationException(format("err.registry_closed", serviceClass));
        }
        if (serviceClass.getRegistry() != null || edges.containsKey(serviceClass)) {
            throw new DeclarationException(format("err.already_declared", serviceClass));
        }
        ServiceClass<?> parent = serviceClass.getParent();
        if (parent != null) {
            checkMember(serviceClass, parent);
            if (!parent.getHandlers().isEmpty()) {
                throw new DeclarationException(format("err.inherit_handlers", serviceClass, parent));
            }
            if (!parent.getDescriptors().isEmpty()) {
                throw new DeclarationException(format("err.inherit_descriptors", serviceClass, parent));
            }
        }
        for (ServiceClass<?> other : serviceClass.getDeclaredBefore()) {
            checkMember(serviceClass, other);
        }
        for (ServiceClass<?> other : serviceClass.getDeclaredAfter()) {
            checkMember(serviceClass, other);
        }
        checkHandlerConflicts(serviceClass);

        // Edges map a class to the classes it runs after.
        Set<ServiceClass<?>> after = new LinkedHashSet<>(serviceClass.getDeclaredAfter());
        Set<ServiceClass<?>> before = new LinkedHashSet<>(serviceClass.getDeclaredBefore());
        if (parent != null && serviceClass.isInheritDependencies()) {
            after.addAll(closedAfter.get(parent));
            before.addAll(closedBefore.get(parent));
        }
        Map<ServiceClass<?>, Set<ServiceClass<?>>> newEdges = new IdentityHashMap<>();
        for (Map.Entry<ServiceClass<?>, Set<ServiceClass<?>>> entry : edges.entrySet()) {
            newEdges.put(entry.getKey(), new LinkedHashSet<ServiceClass<?>>(entry.getValue()));
        }
        newEdges.put(serviceClass, after);
        for (ServiceClass<?> other : before) {
            newEdges.get(other).add(serviceClass);
        }
        List<ServiceClass<?>> universe = new ArrayList<>(declared);
        universe.add(serviceClass);
        Map<ServiceClass<?>, Set<ServiceClass<?>>> newAfter = close(universe, newEdges);
        Map<ServiceClass<?>, Set<ServiceClass<?>>> newBefore = invert(universe, newAfter);

        Set<ServiceClass<?>> ownAfter = newAfter.get(serviceClass);
        Set<ServiceClass<?>> ownBefore = newBefore.get(serviceClass);
        if (ownAfter.contains(serviceClass)) {
            ServiceClass<?> member = serviceClass;
            for (ServiceClass<?> other : ownAfter) {
                if (other != serviceClass && ownBefore.contains(other)) {
                    member = other;
                    break;
                }
            }
            throw new DeclarationException(format("err.dependency_loop", serviceClass, member));
        }
        checkRequiredDependencies(serviceClass, ownAfter);

        declared.add(serviceClass);
        edges = newEdges;
        closedAfter = newAfter;
        closedBefore = newBefore;
        linearisation = null;
        serviceClass.setRegistry(this);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.declared"), serviceClass, ownAfter, ownBefore));
        }
    }

    private void checkMember(ServiceClass<?> serviceClass, ServiceClass<?> other) {
        if (!edges.containsKey(other)) {
            throw new DeclarationException(format("err.undeclared_reference", serviceClass, other));
        }
    }

    private static void checkHandlerConflicts(ServiceClass<?> serviceClass) {
        Map<String, String> owners = new HashMap<>();
        for (HandlerEntry<?, ?> entry : serviceClass.getHandlers()) {
            Set<String> keys = new LinkedHashSet<>();
            for (HandlerSpec<?> spec : entry.getSpecs()) {
                if (spec.isUnique()) {
                    keys.add(spec.getKey());
                }
            }
            for (String key : keys) {
                String owner = owners.put(key, entry.getName());
                if (owner != null) {
                    throw new DeclarationException(format("err.handler_conflict", owner, entry.getName(), key));
                }
            }
        }
    }

    private static void checkRequiredDependencies(ServiceClass<?> serviceClass, Set<ServiceClass<?>> after) {
        for (HandlerEntry<?, ?> entry : serviceClass.getHandlers()) {
            for (HandlerSpec<?> spec : entry.getSpecs()) {
                for (ServiceClass<?> dependency : spec.getRequiredDependencies()) {
                    if (!after.contains(dependency)) {
                        throw new DeclarationException(format("err.handler_dependency",
                                                              entry.getName(), dependency));
                    }
                }
            }
        }
        for (ServiceDescriptor<?> descriptor : serviceClass.getDescriptors()) {
            for (ServiceClass<?> dependency : descriptor.getRequiredDependencies()) {
                if (!after.contains(dependency)) {
                    throw new DeclarationException(format("err.descriptor_dependency", descriptor, dependency));
                }
            }
        }
    }

    /**
     * Computes, for every class, the classes it runs after directly or
     * transitively. Each set lists classes in declaration order.
     */
    private static Map<ServiceClass<?>, Set<ServiceClass<?>>> close(
            List<ServiceClass<?>> universe, Map<ServiceClass<?>, Set<ServiceClass<?>>> edges) {
        Map<ServiceClass<?>, Set<ServiceClass<?>>> result = new IdentityHashMap<>();
        for (ServiceClass<?> start : universe) {
            Set<ServiceClass<?>> reached = Collections.newSetFromMap(new IdentityHashMap<ServiceClass<?>, Boolean>());
            List<ServiceClass<?>> pending = new ArrayList<>(edges.get(start));
            while (!pending.isEmpty()) {
                ServiceClass<?> next = pending.remove(pending.size() - 1);
                if (reached.add(next)) {
                    pending.addAll(edges.get(next));
                }
            }
            Set<ServiceClass<?>> ordered = new LinkedHashSet<>();
            for (ServiceClass<?> c : universe) {
                if (reached.contains(c)) {
                    ordered.add(c);
                }
            }
            result.put(start, ordered);
        }
        return result;
    }

    private static Map<ServiceClass<?>, Set<ServiceClass<?>>> invert(
            List<ServiceClass<?>> universe, Map<ServiceClass<?>, Set<ServiceClass<?>>> after) {
        Map<ServiceClass<?>, Set<ServiceClass<?>>> result = new IdentityHashMap<>();
        for (ServiceClass<?> c : universe) {
            result.put(c, new LinkedHashSet<ServiceClass<?>>());
        }
        for (ServiceClass<?> c : universe) {
            for (ServiceClass<?> earlier : after.get(c)) {
                result.get(earlier).add(c);
            }
        }
        return result;
    }

    private static String format(String key, Object... args) {
        return MessageFormat.format(L10N.getString(key), args);
    }

    // -- queries --

    public synchronized boolean isDeclared(ServiceClass<?> serviceClass) {
        return edges.containsKey(serviceClass);
    }

    /**
     * Returns the declared service classes in declaration order.
     *
     * @return a snapshot of the declared classes
     */
    public synchronized List<ServiceClass<?>> getServiceClasses() {
        return Collections.unmodifiableList(new ArrayList<ServiceClass<?>>(declared));
    }

    /**
     * Returns the classes which run after a class.
     *
     * @param serviceClass a declared class
     * @return a snapshot of the transitive before-set
     */
    public synchronized Set<ServiceClass<?>> getOrderBefore(ServiceClass<?> serviceClass) {
        return Collections.unmodifiableSet(new LinkedHashSet<ServiceClass<?>>(lookup(closedBefore, serviceClass)));
    }

    /**
     * Returns the classes which run before a class.
     *
     * @param serviceClass a declared class
     * @return a snapshot of the transitive after-set
     */
    public synchronized Set<ServiceClass<?>> getOrderAfter(ServiceClass<?> serviceClass) {
        return Collections.unmodifiableSet(new LinkedHashSet<ServiceClass<?>>(lookup(closedAfter, serviceClass)));
    }

    private Set<ServiceClass<?>> lookup(Map<ServiceClass<?>, Set<ServiceClass<?>>> map,
                                        ServiceClass<?> serviceClass) {
        Set<ServiceClass<?>> set = map.get(serviceClass);
        if (set == null) {
            throw new IllegalArgumentException(format("err.not_declared", serviceClass));
        }
        return set;
    }

    /**
     * Indicates whether one class must run before another.
     *
     * @param a a declared class
     * @param b a declared class
     * @return true if {@code a} is in the after-set of {@code b}
     */
    public synchronized boolean isBefore(ServiceClass<?> a, ServiceClass<?> b) {
        return lookup(closedAfter, b).contains(a);
    }

    /**
     * Returns the position of a class in the linearisation.
     *
     * @param serviceClass a declared class
     * @return the position, from 0
     */
    public synchronized int indexOf(ServiceClass<?> serviceClass) {
        Integer index = linearisationIndex().get(serviceClass);
        if (index == null) {
            throw new IllegalArgumentException(format("err.not_declared", serviceClass));
        }
        return index.intValue();
    }

    /**
     * Returns a comparator ordering classes by the linearisation. It is
     * consistent with {@link #isBefore} and reflects the registry as it is
     * when each comparison is made.
     *
     * @return the comparator
     */
    public Comparator<ServiceClass<?>> comparator() {
        return (a, b) -> Integer.compare(indexOf(a), indexOf(b));
    }

    /**
     * Sorts service classes so that each runs after its dependencies.
     *
     * @param serviceClasses declared classes
     * @return a new sorted list
     */
    public synchronized List<ServiceClass<?>> sort(Collection<? extends ServiceClass<?>> serviceClasses) {
        List<ServiceClass<?>> result = new ArrayList<ServiceClass<?>>(serviceClasses);
        Collections.sort(result, comparator());
        return result;
    }

    /**
     * Returns every declared class in an order where each runs after its
     * dependencies. Unrelated classes keep their declaration order.
     *
     * @return the linearisation
     */
    public synchronized List<ServiceClass<?>> linearize() {
        ServiceClass<?>[] order = new ServiceClass<?>[declared.size()];
        for (Map.Entry<ServiceClass<?>, Integer> entry : linearisationIndex().entrySet()) {
            order[entry.getValue().intValue()] = entry.getKey();
        }
        List<ServiceClass<?>> result = new ArrayList<>(order.length);
        Collections.addAll(result, order);
        return Collections.unmodifiableList(result);
    }

    private Map<ServiceClass<?>, Integer> linearisationIndex() {
        if (linearisation == null) {
            // Kahn's algorithm, always taking the earliest declared ready class
            Map<ServiceClass<?>, Integer> pendingCount = new IdentityHashMap<>();
            for (ServiceClass<?> c : declared) {
                pendingCount.put(c, Integer.valueOf(edges.get(c).size()));
            }
            Map<ServiceClass<?>, Integer> result = new LinkedHashMap<>();
            while (result.size() < declared.size()) {
                ServiceClass<?> ready = null;
                for (ServiceClass<?> c : declared) {
                    if (!result.containsKey(c) && pendingCount.get(c).intValue() == 0) {
                        ready = c;
                        break;
                    }
                }
                result.put(ready, Integer.valueOf(result.size()));
                for (ServiceClass<?> c : declared) {
                    if (edges.get(c).contains(ready)) {
                        pendingCount.put(c, Integer.valueOf(pendingCount.get(c).intValue() - 1));
                    }
                }
            }
            linearisation = result;
        }
        return linearisation;
    }

    /**
     * Ends registration. Later declarations fail.
     */
    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

}
