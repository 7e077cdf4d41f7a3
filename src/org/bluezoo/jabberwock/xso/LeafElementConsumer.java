/*
 * LeafElementConsumer.java
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

/**
 * Consumes a child element which carries no structure of its own, only
 * its tag and optionally its text. Content beyond that is handled by the
 * owning descriptor's attribute, child and text policies, which are
 * limited to {@code FAIL} and {@code DROP}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class LeafElementConsumer extends ElementConsumer<String> {

    private final UnknownAttrPolicy attrPolicy;
    private final UnknownChildPolicy childPolicy;
    private final UnknownTextPolicy textPolicy;
    private final boolean collectText;
    private final StringBuilder text = new StringBuilder();
    private Tag tag;
    private int depth;

    LeafElementConsumer(UnknownAttrPolicy attrPolicy, UnknownChildPolicy childPolicy,
                        UnknownTextPolicy textPolicy, boolean collectText) {
        this.attrPolicy = attrPolicy;
        this.childPolicy = childPolicy;
        this.textPolicy = textPolicy;
        this.collectText = collectText;
    }

    @Override
    FeedResult<String> feed(XSOEvent event) {
        switch (event.getKind()) {
            case START:
                depth++;
                if (depth == 1) {
                    tag = event.getTag();
                    if (!event.getAttributes().isEmpty() && attrPolicy == UnknownAttrPolicy.FAIL) {
                        Tag attr = event.getAttributes().keySet().iterator().next();
                        String msg = MessageFormat.format(XSOClass.L10N.getString("err.unknown_attribute"),
                                                          attr, tag);
                        return FeedResult.failed(new UnknownContentException(msg));
                    }
                } else if (depth == 2 && childPolicy == UnknownChildPolicy.FAIL) {
                    String msg = MessageFormat.format(XSOClass.L10N.getString("err.unknown_child"),
                                                      event.getTag(), tag);
                    return FeedResult.failed(new UnknownContentException(msg));
                }
                return FeedResult.proceed();
            case END:
                depth--;
                if (depth == 0) {
                    return FeedResult.complete(text.toString());
                }
                return FeedResult.proceed();
            default:
                if (depth == 1) {
                    if (collectText) {
                        text.append(event.getText());
                    } else if (textPolicy == UnknownTextPolicy.FAIL && !isWhitespace(event.getText())) {
                        String msg = MessageFormat.format(XSOClass.L10N.getString("err.unknown_text"), tag);
                        return FeedResult.failed(new UnknownContentException(msg));
                    }
                }
                return FeedResult.proceed();
        }
    }

    static boolean isWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
                return false;
            }
        }
        return true;
    }

}
