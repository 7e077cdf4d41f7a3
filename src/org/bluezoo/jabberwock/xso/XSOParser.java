/*
 * XSOParser.java
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
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.w3c.dom.Element;

/**
 * Parses one element into an instance of an {@link XSOClass}, one event at
 * a time.
 *
 * <p>The parser is a state machine. It is fed the element's start event
 * first, then the events of its content, and finally its end event. Each
 * call to {@link #feed} returns at once with {@link FeedResult.Status#CONTINUE
 * CONTINUE}, {@link FeedResult.Status#COMPLETE COMPLETE} carrying the
 * populated instance, or {@link FeedResult.Status#FAILED FAILED} carrying
 * the error. The parser never blocks and never needs more than the
 * current event, so it can be driven directly by non-blocking network
 * input.
 *
 * <p>Child elements are delegated to nested consumers chosen by the
 * class's child descriptors; content no descriptor claims is handled by
 * the class's unknown-content policies. Once the parser has completed or
 * failed it must not be fed again.
 *
 * @param <T> the Java class of the parsed objects
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class XSOParser<T extends XSO> extends ElementConsumer<T> {

    private static final Logger LOGGER = Logger.getLogger(XSOParser.class.getName());

    /**
     * Parser states.
     */
    public enum State {
        AWAITING_START,
        CONSUMING_ATTRIBUTES,
        CONSUMING_CONTENT,
        COMPLETE,
        FAILED
    }

    private final XSOClass<T> xsoClass;
    private State state = State.AWAITING_START;
    private T instance;

    // Nested consumer for the child element currently open
    private ElementConsumer<?> child;
    private ChildDescriptor childDescriptor;
    private Tag childTag;

    private StringBuilder text;

    /**
     * Creates a parser for the given class.
     *
     * @param xsoClass the class of the element to parse
     * @throws IllegalArgumentException if the class is abstract
     */
    public XSOParser(XSOClass<T> xsoClass) {
        if (!xsoClass.isConcrete()) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.abstract_class"), xsoClass);
            throw new IllegalArgumentException(msg);
        }
        this.xsoClass = xsoClass;
    }

    public State getState() {
        return state;
    }

    /**
     * Feeds the next event of the element.
     *
     * @param event the event
     * @return the outcome
     * @throws IllegalStateException if the parser has already completed
     *         or failed, or if the first event is not a start event
     */
    @Override
    public FeedResult<T> feed(XSOEvent event) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(xsoClass.getTag() + " " + state + " <- " + event);
        }
        switch (state) {
            case AWAITING_START:
                if (event.getKind() != XSOEvent.Kind.START) {
                    String msg = MessageFormat.format(XSOClass.L10N.getString("err.expected_start"), event);
                    throw new IllegalStateException(msg);
                }
                try {
                    return start(event);
                } catch (XSOException e) {
                    return fail(e);
                }
            case CONSUMING_CONTENT:
                try {
                    return content(event);
                } catch (XSOException e) {
                    return fail(e);
                }
            default:
                throw new IllegalStateException(XSOClass.L10N.getString("err.parser_done"));
        }
    }

    private FeedResult<T> start(XSOEvent event) {
        Tag tag = event.getTag();
        if (!tag.equals(xsoClass.getTag())) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.unexpected_element"),
                                              xsoClass.getTag(), tag);
            throw new UnknownContentException(msg);
        }
        instance = xsoClass.newInstance();
        state = State.CONSUMING_ATTRIBUTES;
        for (Map.Entry<Tag, String> entry : event.getAttributes().entrySet()) {
            Attr<?> attr = xsoClass.getAttribute(entry.getKey());
            if (attr != null) {
                attr.fromValue(instance, entry.getValue());
                continue;
            }
            switch (xsoClass.getUnknownAttrPolicy()) {
                case FAIL:
                    String msg = MessageFormat.format(XSOClass.L10N.getString("err.unknown_attribute"),
                                                      entry.getKey(), tag);
                    throw new UnknownContentException(msg);
                case COLLECT:
                    xsoClass.getCollector().get(instance).getAttributes().put(entry.getKey(), entry.getValue());
                    break;
                default:
                    break;
            }
        }
        if (xsoClass.getText() != null) {
            text = new StringBuilder();
        }
        state = State.CONSUMING_CONTENT;
        return FeedResult.proceed();
    }

    private FeedResult<T> content(XSOEvent event) {
        if (child != null) {
            FeedResult<?> result = child.feed(event);
            switch (result.getStatus()) {
                case COMPLETE:
                    ElementConsumer<?> done = child;
                    child = null;
                    if (childDescriptor != null) {
                        childDescriptor.attach(instance, childTag, result.getValue());
                    } else if (done instanceof CollectingConsumer) {
                        xsoClass.getCollector().get(instance).getElements().add((Element) result.getValue());
                    }
                    childDescriptor = null;
                    childTag = null;
                    return FeedResult.proceed();
                case FAILED:
                    child = null;
                    return fail(result.getError());
                default:
                    return FeedResult.proceed();
            }
        }
        switch (event.getKind()) {
            case START:
                return startChild(event);
            case TEXT:
                text(event.getText());
                return FeedResult.proceed();
            default:
                return end();
        }
    }

    private FeedResult<T> startChild(XSOEvent event) {
        Tag tag = event.getTag();
        ChildDescriptor descriptor = xsoClass.getChildDescriptor(tag);
        if (descriptor != null) {
            child = descriptor.createConsumer(instance, tag);
            childDescriptor = descriptor;
            childTag = tag;
        } else {
            switch (xsoClass.getUnknownChildPolicy()) {
                case FAIL:
                    String msg = MessageFormat.format(XSOClass.L10N.getString("err.unknown_child"),
                                                      tag, xsoClass.getTag());
                    throw new UnknownContentException(msg);
                case COLLECT:
                    child = new CollectingConsumer(xsoClass.getCollector().get(instance).getDocument());
                    break;
                default:
                    child = new SkippingConsumer();
                    break;
            }
        }
        FeedResult<?> result = child.feed(event);
        if (result.isFailed()) {
            child = null;
            return fail(result.getError());
        }
        return FeedResult.proceed();
    }

    private void text(String chunk) {
        if (text != null) {
            text.append(chunk);
            return;
        }
        if (LeafElementConsumer.isWhitespace(chunk)) {
            return;
        }
        switch (xsoClass.getUnknownTextPolicy()) {
            case FAIL:
                String msg = MessageFormat.format(XSOClass.L10N.getString("err.unknown_text"),
                                                  xsoClass.getTag());
                throw new UnknownContentException(msg);
            case COLLECT:
                xsoClass.getCollector().get(instance).appendText(chunk);
                break;
            default:
                break;
        }
    }

    private FeedResult<T> end() {
        if (text != null && text.length() > 0) {
            xsoClass.getText().fromValue(instance, text.toString());
        }
        instance.validate();
        instance.afterLoad();
        state = State.COMPLETE;
        T result = instance;
        instance = null;
        return FeedResult.complete(result);
    }

    private FeedResult<T> fail(XSOException error) {
        state = State.FAILED;
        instance = null;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(XSOClass.L10N.getString("log.parse_failed"),
                                             xsoClass, error.getMessage()));
        }
        return FeedResult.failed(error);
    }

}
