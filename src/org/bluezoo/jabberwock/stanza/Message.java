/*
 * Message.java
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
import org.bluezoo.jabberwock.xso.types.StringType;

/**
 * A message stanza. Extension payloads are kept in the collector.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Message extends Stanza {

    public static final Attr<MessageType> TYPE =
        new Attr<>("type", new EnumType<>(MessageType.class)).defaultValue(MessageType.NORMAL);

    public static final ChildText<String> BODY =
        new ChildText<>(Tag.of(NAMESPACE, "body"), StringType.INSTANCE).attrPolicy(UnknownAttrPolicy.DROP);

    public static final ChildText<String> SUBJECT =
        new ChildText<>(Tag.of(NAMESPACE, "subject"), StringType.INSTANCE).attrPolicy(UnknownAttrPolicy.DROP);

    public static final ChildText<String> THREAD =
        new ChildText<>(Tag.of(NAMESPACE, "thread"), StringType.INSTANCE).attrPolicy(UnknownAttrPolicy.DROP);

    public static final Collector PAYLOADS = new Collector();

    public static final XSOClass<Message> CLASS =
        XSOClass.builder(Message.class, Message::new)
            .parent(Stanza.CLASS)
            .tag(NAMESPACE, "message")
            .add(TYPE, BODY, SUBJECT, THREAD, PAYLOADS)
            .unknownChildPolicy(UnknownChildPolicy.COLLECT)
            .build();

    public Message() {
    }

    public Message(MessageType type) {
        setType(type);
    }

    @Override
    public XSOClass<Message> getXSOClass() {
        return CLASS;
    }

    public MessageType getType() {
        return TYPE.get(this);
    }

    public void setType(MessageType type) {
        TYPE.set(this, type);
    }

    public String getBody() {
        return BODY.get(this);
    }

    public void setBody(String body) {
        BODY.set(this, body);
    }

    public String getSubject() {
        return SUBJECT.get(this);
    }

    public void setSubject(String subject) {
        SUBJECT.set(this, subject);
    }

    public String getThread() {
        return THREAD.get(this);
    }

    public void setThread(String thread) {
        THREAD.set(this, thread);
    }

    /**
     * Returns the extension payloads of this message.
     *
     * @return the live collected content
     */
    public CollectedContent getPayloads() {
        return PAYLOADS.get(this);
    }

    /**
     * Creates a reply of the same type, addressed to the sender and
     * carrying the same thread.
     *
     * @return the reply
     */
    public Message makeReply() {
        Message reply = new Message(getType());
        reply.setFrom(getTo());
        reply.setTo(getFrom());
        reply.setThread(getThread());
        return reply;
    }

}
