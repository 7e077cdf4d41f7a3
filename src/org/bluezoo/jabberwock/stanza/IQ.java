/*
 * IQ.java
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
import org.bluezoo.jabberwock.xso.Child;
import org.bluezoo.jabberwock.xso.XSO;
import org.bluezoo.jabberwock.xso.XSOClass;
import org.bluezoo.jabberwock.xso.types.EnumType;

/**
 * An IQ stanza.
 *
 * <p>The payload is polymorphic. Protocol extensions make their payload
 * classes known with {@code IQ.PAYLOAD.register(MyPayload.CLASS)};
 * payloads of unregistered classes are dropped during parsing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class IQ extends Stanza {

    public static final Attr<IQType> TYPE =
        new Attr<>("type", new EnumType<>(IQType.class)).required();

    public static final Child<XSO> PAYLOAD = new Child<>(XSO.class);

    public static final XSOClass<IQ> CLASS =
        XSOClass.builder(IQ.class, IQ::new)
            .parent(Stanza.CLASS)
            .tag(NAMESPACE, "iq")
            .add(TYPE, PAYLOAD)
            .build();

    public IQ() {
    }

    public IQ(IQType type) {
        setType(type);
    }

    public IQ(IQType type, XSO payload) {
        setType(type);
        setPayload(payload);
    }

    @Override
    public XSOClass<IQ> getXSOClass() {
        return CLASS;
    }

    public IQType getType() {
        return TYPE.get(this);
    }

    public void setType(IQType type) {
        TYPE.set(this, type);
    }

    public XSO getPayload() {
        return PAYLOAD.get(this);
    }

    /**
     * Sets the payload. Its class must have been registered with
     * {@link #PAYLOAD}.
     *
     * @param payload the payload, or null
     */
    public void setPayload(XSO payload) {
        PAYLOAD.set(this, payload);
    }

    /**
     * Creates a result response to this request.
     *
     * @param payload the response payload, or null
     * @return the response
     */
    public IQ makeResult(XSO payload) {
        IQ reply = new IQ(IQType.RESULT, payload);
        addressReply(reply);
        return reply;
    }

    /**
     * Creates an error response to this request.
     *
     * @param error the error
     * @return the response
     */
    public IQ makeError(StanzaError error) {
        IQ reply = new IQ(IQType.ERROR);
        reply.setError(error);
        addressReply(reply);
        return reply;
    }

}
