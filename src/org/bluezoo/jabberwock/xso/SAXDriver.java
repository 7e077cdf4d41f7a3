/*
 * SAXDriver.java
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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Drives XSO parsing from SAX events.
 *
 * <p>The driver recognises top-level elements by tag among the classes
 * registered with {@link #addClass}, parses each into an instance and
 * hands the instance to the callback registered with its class. Only the
 * element being parsed is held in memory, so the driver is suitable for
 * an XMPP stream of unbounded length; in that case construct it with
 * {@code streamRoot} set, so that the enclosing {@code <stream:stream>}
 * element is passed over and its children are treated as top-level.
 *
 * <p>A top-level element with no registered class is skipped and
 * reported to the unknown-tag handler as an {@link
 * UnknownTopLevelTagException}; without a handler it is logged. When an
 * element fails to parse, the rest of that element is skipped and the
 * failure is raised as a {@link SAXException} wrapping the {@link
 * XSOException}. The driver remains usable for subsequent elements; it is
 * for the caller to decide whether the stream survives.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SAXDriver extends DefaultHandler {

    private static final Logger LOGGER = Logger.getLogger(SAXDriver.class.getName());

    private static final String XMLNS_NAMESPACE = "http://www.w3.org/2000/xmlns/";

    private final Map<Tag, Registration<?>> classes = new ConcurrentHashMap<>();
    private final boolean streamRoot;
    private Consumer<? super UnknownTopLevelTagException> unknownTopLevelTagHandler;

    // Document depth outside the current top-level element
    private int rootDepth;
    // Open elements inside the current top-level element
    private int depth;
    private ElementConsumer<?> current;
    private Registration<?> currentRegistration;

    private static final class Registration<T extends XSO> {
        final XSOClass<T> xsoClass;
        final Consumer<? super T> callback;

        Registration(XSOClass<T> xsoClass, Consumer<? super T> callback) {
            this.xsoClass = xsoClass;
            this.callback = callback;
        }

        void deliver(Object value) {
            callback.accept(xsoClass.getJavaClass().cast(value));
        }
    }

    /**
     * Creates a driver for a sequence of top-level elements.
     */
    public SAXDriver() {
        this(false);
    }

    /**
     * Creates a driver.
     *
     * @param streamRoot if true, the outermost element of the document is
     *        a stream wrapper and its children are the top-level elements
     */
    public SAXDriver(boolean streamRoot) {
        this.streamRoot = streamRoot;
    }

    /**
     * Registers a top-level class.
     *
     * @param xsoClass the class
     * @param callback receives each parsed instance
     * @throws IllegalArgumentException if the class is abstract or another
     *         class is registered for its tag
     */
    public <T extends XSO> void addClass(XSOClass<T> xsoClass, Consumer<? super T> callback) {
        if (!xsoClass.isConcrete()) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.abstract_class"), xsoClass);
            throw new IllegalArgumentException(msg);
        }
        Registration<?> existing = classes.putIfAbsent(xsoClass.getTag(), new Registration<>(xsoClass, callback));
        if (existing != null) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.duplicate_top_level"),
                                              xsoClass.getTag(), existing.xsoClass);
            throw new IllegalArgumentException(msg);
        }
    }

    /**
     * Unregisters a top-level class.
     *
     * @param xsoClass the class
     * @return true if the class was registered
     */
    public boolean removeClass(XSOClass<?> xsoClass) {
        Registration<?> registration = classes.get(xsoClass.getTag());
        if (registration != null && registration.xsoClass == xsoClass) {
            return classes.remove(xsoClass.getTag(), registration);
        }
        return false;
    }

    /**
     * Sets the handler for top-level elements with no registered class.
     *
     * @param handler the handler, or null to log such elements instead
     */
    public void setUnknownTopLevelTagHandler(Consumer<? super UnknownTopLevelTagException> handler) {
        this.unknownTopLevelTagHandler = handler;
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes atts)
            throws SAXException {
        Tag tag = Tag.of(uri, localName.isEmpty() ? qName : localName);
        if (current == null && streamRoot && rootDepth == 0) {
            rootDepth++;
            return;
        }
        Map<Tag, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < atts.getLength(); i++) {
            String attrURI = atts.getURI(i);
            String attrQName = atts.getQName(i);
            if (XMLNS_NAMESPACE.equals(attrURI) || "xmlns".equals(attrQName) || attrQName.startsWith("xmlns:")) {
                continue;
            }
            String attrLocal = atts.getLocalName(i);
            attributes.put(Tag.of(attrURI, attrLocal == null || attrLocal.isEmpty() ? attrQName : attrLocal),
                           atts.getValue(i));
        }
        if (current == null) {
            Registration<?> registration = classes.get(tag);
            if (registration != null) {
                current = new XSOParser<>(registration.xsoClass);
                currentRegistration = registration;
            } else {
                current = new SkippingConsumer();
                currentRegistration = null;
                reportUnknown(new UnknownTopLevelTagException(tag, attributes));
            }
            depth = 0;
        }
        depth++;
        feed(XSOEvent.start(tag, attributes));
    }

    @Override
    public void endElement(String uri, String localName, String qName) throws SAXException {
        if (current == null) {
            if (rootDepth > 0) {
                rootDepth--;
            }
            return;
        }
        depth--;
        feed(XSOEvent.end());
    }

    @Override
    public void characters(char[] ch, int start, int length) throws SAXException {
        if (current != null) {
            feed(XSOEvent.text(new String(ch, start, length)));
        }
    }

    @Override
    public void ignorableWhitespace(char[] ch, int start, int length) throws SAXException {
        characters(ch, start, length);
    }

    private void feed(XSOEvent event) throws SAXException {
        FeedResult<?> result = current.feed(event);
        switch (result.getStatus()) {
            case COMPLETE:
                Registration<?> registration = currentRegistration;
                current = null;
                currentRegistration = null;
                if (registration != null) {
                    registration.deliver(result.getValue());
                }
                break;
            case FAILED:
                // Swallow what remains of the failed element
                current = depth > 0 ? new SkippingConsumer(depth) : null;
                currentRegistration = null;
                throw new SAXException(result.getError());
            default:
                break;
        }
    }

    private void reportUnknown(UnknownTopLevelTagException e) {
        Consumer<? super UnknownTopLevelTagException> handler = unknownTopLevelTagHandler;
        if (handler != null) {
            handler.accept(e);
        } else if (LOGGER.isLoggable(Level.WARNING)) {
            LOGGER.warning(MessageFormat.format(XSOClass.L10N.getString("log.unknown_top_level_tag"),
                                                e.getTag()));
        }
    }

}
