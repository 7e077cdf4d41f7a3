/*
 * StanzaError.java
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
import org.bluezoo.jabberwock.xso.ChildTag;
import org.bluezoo.jabberwock.xso.ChildText;
import org.bluezoo.jabberwock.xso.Tag;
import org.bluezoo.jabberwock.xso.UnknownAttrPolicy;
import org.bluezoo.jabberwock.xso.UnknownChildPolicy;
import org.bluezoo.jabberwock.xso.UnknownTextPolicy;
import org.bluezoo.jabberwock.xso.XSO;
import org.bluezoo.jabberwock.xso.XSOClass;
import org.bluezoo.jabberwock.xso.types.EnumType;
import org.bluezoo.jabberwock.xso.types.StringType;

/**
 * The {@code <error/>} child of a stanza (RFC 6120 section 8.3).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StanzaError extends XSO {

    /** Namespace of the defined conditions. */
    public static final String CONDITIONS_NAMESPACE = "urn:ietf:params:xml:ns:xmpp-stanzas";

    public static final Attr<ErrorType> TYPE =
        new Attr<>("type", new EnumType<>(ErrorType.class)).required();

    public static final ChildTag CONDITION = ChildTag.of(CONDITIONS_NAMESPACE,
        "bad-request",
        "conflict",
        "feature-not-implemented",
        "forbidden",
        "gone",
        "internal-server-error",
        "item-not-found",
        "jid-malformed",
        "not-acceptable",
        "not-allowed",
        "not-authorized",
        "policy-violation",
        "recipient-unavailable",
        "redirect",
        "registration-required",
        "remote-server-not-found",
        "remote-server-timeout",
        "resource-constraint",
        "service-unavailable",
        "subscription-required",
        "undefined-condition",
        "unexpected-request")
        .attrPolicy(UnknownAttrPolicy.DROP)
        .textPolicy(UnknownTextPolicy.DROP);

    public static final ChildText<String> TEXT =
        new ChildText<>(Tag.of(CONDITIONS_NAMESPACE, "text"), StringType.INSTANCE)
            .attrPolicy(UnknownAttrPolicy.DROP);

    public static final XSOClass<StanzaError> CLASS =
        XSOClass.builder(StanzaError.class, StanzaError::new)
            .tag(Stanza.NAMESPACE, "error")
            .add(TYPE, CONDITION, TEXT)
            .unknownAttrPolicy(UnknownAttrPolicy.DROP)
            .unknownChildPolicy(UnknownChildPolicy.DROP)
            .unknownTextPolicy(UnknownTextPolicy.DROP)
            .build();

    public StanzaError() {
    }

    /**
     * Creates an error with a defined condition.
     *
     * @param type the error type
     * @param condition the local name of the condition, e.g.
     *        {@code item-not-found}
     * @param text descriptive text, or null
     */
    public StanzaError(ErrorType type, String condition, String text) {
        TYPE.set(this, type);
        CONDITION.set(this, Tag.of(CONDITIONS_NAMESPACE, condition));
        TEXT.set(this, text);
    }

    @Override
    public XSOClass<StanzaError> getXSOClass() {
        return CLASS;
    }

    public ErrorType getType() {
        return TYPE.get(this);
    }

    public Tag getCondition() {
        return CONDITION.get(this);
    }

    public String getText() {
        return TEXT.get(this);
    }

    /**
     * Converts this error into an exception.
     *
     * @return the exception
     */
    public StanzaException toException() {
        Tag condition = getCondition();
        return new StanzaException(getType(), condition == null ? null : condition.getLocalName(), getText());
    }

}
