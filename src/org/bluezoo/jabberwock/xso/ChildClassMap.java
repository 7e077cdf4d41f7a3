/*
 * ChildClassMap.java
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

import java.text.MessageFormat;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.DeclarationException;

/**
 * The dispatch table of a child descriptor: the concrete XSO classes it
 * accepts, keyed by their tags.
 *
 * <p>Registration updates the child dispatch of every class owning the
 * descriptor and fails if a tag would become ambiguous in any of them.
 *
 * @param <V> the common supertype of the accepted classes
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ChildClassMap<V extends XSO> {

    private static final Logger LOGGER = Logger.getLogger(ChildClassMap.class.getName());

    private final ChildDescriptor descriptor;
    private final Map<Tag, XSOClass<? extends V>> classes = new ConcurrentHashMap<>();

    ChildClassMap(ChildDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    Collection<Tag> getTags() {
        return Collections.unmodifiableSet(classes.keySet());
    }

    XSOClass<? extends V> get(Tag tag) {
        return classes.get(tag);
    }

    Collection<XSOClass<? extends V>> getClasses() {
        return Collections.unmodifiableCollection(classes.values());
    }

    void register(XSOClass<? extends V> xsoClass) {
        synchronized (XSOClass.LOCK) {
            Tag tag = xsoClass.getTag();
            if (tag == null || !xsoClass.isConcrete()) {
                String msg = MessageFormat.format(XSOClass.L10N.getString("err.abstract_child"), xsoClass);
                throw new DeclarationException(msg);
            }
            XSOClass<? extends V> existing = classes.get(tag);
            if (existing == xsoClass) {
                return;
            }
            if (existing != null) {
                throw ambiguous(tag, descriptor);
            }
            for (XSOClass<?> owner : ((Descriptor) descriptor).getOwners()) {
                ChildDescriptor claimant = owner.getChildDescriptor(tag);
                if (claimant != null && claimant != descriptor) {
                    throw ambiguous(tag, owner);
                }
            }
            classes.put(tag, xsoClass);
            for (XSOClass<?> owner : ((Descriptor) descriptor).getOwners()) {
                owner.claimChild(tag, descriptor);
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(XSOClass.L10N.getString("log.child_registered"),
                                                  xsoClass, descriptor);
                LOGGER.fine(msg);
            }
        }
    }

    private static DeclarationException ambiguous(Tag tag, Object where) {
        String msg = MessageFormat.format(XSOClass.L10N.getString("err.ambiguous_children"), tag, where);
        return new DeclarationException(msg);
    }

}
