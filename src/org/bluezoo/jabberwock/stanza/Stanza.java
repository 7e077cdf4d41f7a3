/*
 * Stanza.java
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

import java.util.UUID;

import org.bluezoo.jabberwock.JID;
import org.bluezoo.jabberwock.xso.Attr;
import org.bluezoo.jabberwock.xso.Child;
import org.bluezoo.jabberwock.xso.Tag;
import org.bluezoo.jabberwock.xso.UnknownAttrPolicy;
import org.bluezoo.jabberwock.xso.UnknownChildPolicy;
import org.bluezoo.jabberwock.xso.UnknownTextPolicy;
import org.bluezoo.jabberwock.xso.XSO;
import org.bluezoo.jabberwock.xso.XSOClass;
import org.bluezoo.jabberwock.xso.types.JIDType;
import org.bluezoo.jabberwock.xso.types.StringType;

/**
 * Common base of message, presence and IQ stanzas.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Stanza extends XSO {

    /** The client stream namespace. */
    public static final String NAMESPACE = "jabber:client";

    public static final Attr<JID> FROM = new Attr<>("from", JIDType.INSTANCE);
    public static final Attr<JID> TO = new Attr<>("to", JIDType.INSTANCE);
    public static final Attr<String> ID = new Attr<>("id", StringType.INSTANCE);
    public static final Attr<String> LANG = new Attr<>(Tag.of(Tag.XML_NAMESPACE, "lang"), StringType.INSTANCE);
    public static final Child<StanzaError> ERROR = new Child<>(StanzaError.class, StanzaError.CLASS);

    public static final XSOClass<Stanza> CLASS =
        XSOClass.builder(Stanza.class)
            .add(FROM, TO, ID, LANG, ERROR)
            .unknownAttrPolicy(UnknownAttrPolicy.DROP)
            .unknownChildPolicy(UnknownChildPolicy.DROP)
            .unknownTextPolicy(UnknownTextPolicy.DROP)
            .build();

    public JID getFrom() {
        return FROM.get(this);
    }

    public void setFrom(JID from) {
        FROM.set(this, from);
    }

    public JID getTo() {
        return TO.get(this);
    }

    public void setTo(JID to) {
        TO.set(this, to);
    }

    public String getId() {
        return ID.get(this);
    }

    public void setId(String id) {
        ID.set(this, id);
    }

    public String getLang() {
        return LANG.get(this);
    }

    public void setLang(String lang) {
        LANG.set(this, lang);
    }

    public StanzaError getError() {
        return ERROR.get(this);
    }

    public void setError(StanzaError error) {
        ERROR.set(this, error);
    }

    /**
     * Assigns a random id if the stanza has none.
     *
     * @return the id
     */
    public String autosetId() {
        if (!ID.isSet(this)) {
            ID.set(this, UUID.randomUUID().toString());
        }
        return getId();
    }

    /**
     * Copies addressing for a response: the sender becomes the recipient
     * and the other way round, and the id is kept.
     */
    void addressReply(Stanza reply) {
        reply.setFrom(getTo());
        reply.setTo(getFrom());
        reply.setId(getId());
    }

}
