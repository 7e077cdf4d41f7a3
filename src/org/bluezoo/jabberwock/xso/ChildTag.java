/*
 * ChildTag.java
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.xml.sax.SAXException;

/**
 * Represents a value by which of several empty child elements is present.
 *
 * <p>The value is the {@link Tag} of the child, drawn from a declared set.
 * A typical use is the condition of a stanza error, where the presence of
 * {@code <item-not-found/>} in the stanza error namespace is the value.
 * Unless {@link #allowNone()} is used, a value is required once the
 * element has been parsed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ChildTag extends ScalarDescriptor<Tag> implements ChildDescriptor {

    private final Set<Tag> allowed;
    private boolean allowNone;
    private UnknownAttrPolicy attrPolicy = UnknownAttrPolicy.FAIL;
    private UnknownChildPolicy childPolicy = UnknownChildPolicy.FAIL;
    private UnknownTextPolicy textPolicy = UnknownTextPolicy.FAIL;

    /**
     * Creates a tag descriptor.
     *
     * @param tags the allowed tags, each in any form accepted by
     *        {@link Tag#normalize}
     */
    public ChildTag(Collection<?> tags) {
        Set<Tag> set = new LinkedHashSet<>();
        for (Object tag : tags) {
            set.add(Tag.normalize(tag));
        }
        this.allowed = Collections.unmodifiableSet(set);
        setRequired(true);
    }

    /**
     * Creates a tag descriptor for several local names in one namespace.
     *
     * @param namespaceURI the namespace of every allowed tag
     * @param localNames the allowed local names
     * @return the descriptor
     */
    public static ChildTag of(String namespaceURI, String... localNames) {
        List<Tag> tags = new ArrayList<>();
        for (String localName : localNames) {
            tags.add(Tag.of(namespaceURI, localName));
        }
        return new ChildTag(tags);
    }

    /**
     * Permits the absence of any of the allowed children.
     *
     * @return this descriptor
     */
    public ChildTag allowNone() {
        setRequired(false);
        this.allowNone = true;
        return this;
    }

    public ChildTag defaultValue(Tag value) {
        setDefault(value);
        return this;
    }

    public ChildTag attrPolicy(UnknownAttrPolicy policy) {
        checkMutable();
        ChildText.checkLeafPolicy(this, policy == UnknownAttrPolicy.COLLECT);
        this.attrPolicy = policy;
        return this;
    }

    public ChildTag childPolicy(UnknownChildPolicy policy) {
        checkMutable();
        ChildText.checkLeafPolicy(this, policy == UnknownChildPolicy.COLLECT);
        this.childPolicy = policy;
        return this;
    }

    public ChildTag textPolicy(UnknownTextPolicy policy) {
        checkMutable();
        ChildText.checkLeafPolicy(this, policy == UnknownTextPolicy.COLLECT);
        this.textPolicy = policy;
        return this;
    }

    public Set<Tag> getAllowed() {
        return allowed;
    }

    public boolean isAllowNone() {
        return allowNone;
    }

    @Override
    Tag coerce(Object value) {
        Tag tag;
        try {
            tag = Tag.normalize(value);
        } catch (TagFormatException e) {
            throw new XSOTypeException(e.getMessage(), e);
        }
        if (!allowed.contains(tag)) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.tag_not_allowed"), tag, this);
            throw new XSOValidationException(msg);
        }
        return tag;
    }

    @Override
    public void set(XSO instance, Object value) {
        if (value == null && !allowNone) {
            String msg = MessageFormat.format(XSOClass.L10N.getString("err.none_not_allowed"), this);
            throw new XSOValidationException(msg);
        }
        super.set(instance, value);
    }

    @Override
    public Collection<Tag> getTags() {
        return allowed;
    }

    @Override
    public ElementConsumer<?> createConsumer(XSO instance, Tag childTag) {
        return new LeafElementConsumer(attrPolicy, childPolicy, textPolicy, false);
    }

    @Override
    public void attach(XSO instance, Tag childTag, Object value) {
        store(instance, childTag);
    }

    @Override
    void unparseContent(XSO instance, SAXUnparser out) throws SAXException {
        if (isSet(instance)) {
            out.startElement(get(instance), Collections.<Tag, String>emptyMap());
            out.endElement();
        }
    }

    @Override
    public String toString() {
        return "ChildTag" + allowed;
    }

}
