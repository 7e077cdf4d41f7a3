/*
 * Presence.java
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

package org.bluezoo.jabberwock.stanza;

import org.bluezoo.jabberwock.xso.Attr;
import org.bluezoo.jabberwock.xso.ChildText;
import org.bluezoo.jabberwock.xso.CollectedContent;
import org.bluezoo.jabberwock.xso.Collector;
import org.bluezoo.jabberwock.xso.Tag;
import org.bluezoo.jabberwock.xso.UnknownAttrPolicy;
import org.bluezoo.jabberwock.xso.UnknownChildPolicy;
import org.bluezoo.jabberwock.xso.XSOClass;
import org.bluezoo.jabberwock.xso.types.EnumType;
import org.bluezoo.jabberwock.xso.types.IntegerType;
import org.bluezoo.jabberwock.xso.types.StringType;

/**
 * A presence stanza.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Presence extends Stanza {

    public static final Attr<PresenceType> TYPE =
        new Attr<>("type", new EnumType<>(PresenceType.class)).defaultValue(PresenceType.AVAILABLE);

    public static final ChildText<PresenceShow> SHOW =
        new ChildText<>(Tag.of(NAMESPACE, "show"), new EnumType<>(PresenceShow.class));

    public static final ChildText<String> STATUS =
        new ChildText<>(Tag.of(NAMESPACE, "status"), StringType.INSTANCE).attrPolicy(UnknownAttrPolicy.DROP);

    public static final ChildText<Long> PRIORITY =
        new ChildText<>(Tag.of(NAMESPACE, "priority"), IntegerType.INSTANCE).defaultValue(0L);

    public static final Collector PAYLOADS = new Collector();

    public static final XSOClass<Presence> CLASS =
        XSOClass.builder(Presence.class, Presence::new)
            .parent(Stanza.CLASS)
            .tag(NAMESPACE, "presence")
            .add(TYPE, SHOW, STATUS, PRIORITY, PAYLOADS)
            .unknownChildPolicy(UnknownChildPolicy.COLLECT)
            .build();

    public Presence() {
    }

    public Presence(PresenceType type) {
        setType(type);
    }

    @Override
    public XSOClass<Presence> getXSOClass() {
        return CLASS;
    }

    public PresenceType getType() {
        return TYPE.get(this);
    }

    /**
     * Sets the presence type. Available presence is expressed by the
     * absence of the attribute.
     *
     * @param type the type
     */
    public void setType(PresenceType type) {
        if (type == PresenceType.AVAILABLE) {
            TYPE.clear(this);
        } else {
            TYPE.set(this, type);
        }
    }

    public PresenceShow getShow() {
        return SHOW.get(this);
    }

    public void setShow(PresenceShow show) {
        SHOW.set(this, show);
    }

    public String getStatus() {
        return STATUS.get(this);
    }

    public void setStatus(String status) {
        STATUS.set(this, status);
    }

    public int getPriority() {
        return PRIORITY.get(this).intValue();
    }

    public void setPriority(int priority) {
        PRIORITY.set(this, priority);
    }

    public CollectedContent getPayloads() {
        return PAYLOADS.get(this);
    }

}
