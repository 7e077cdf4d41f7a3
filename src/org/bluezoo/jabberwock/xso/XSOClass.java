/*
 * XSOClass.java
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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.jabberwock.DeclarationException;

/**
 * The schema of an XSO: its element tag, its descriptors and the policies
 * for content no descriptor claims.
 *
 * <p>An XSO class is built once, at class initialisation of the Java
 * class it describes, and is immutable thereafter apart from late
 * registration of child classes through {@link Child#register} and its
 * list and map counterparts. Building validates the declaration: a
 * concrete class needs a tag, attribute tags must be unique, there can be
 * at most one {@link Text} and one {@link Collector}, and no child tag may
 * be claimed by two descriptors.
 *
 * <p>A class may extend a parent class, in which case it inherits the
 * parent's descriptors (unless {@link Builder#inheritDescriptors} is
 * false) and unknown-content policies. Abstract classes, built without a
 * factory, serve as such parents and as the value type of polymorphic
 * children.
 *
 * @param <T> the Java class of the described objects
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class XSOClass<T extends XSO> {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.jabberwock.xso.L10N");

    private static final Logger LOGGER = Logger.getLogger(XSOClass.class.getName());

    /** Guards declaration and late registration. */
    static final Object LOCK = new Object();

    private final Class<T> javaClass;
    private final Supplier<? extends T> factory;
    private final Tag tag;
    private final XSOClass<? super T> parent;
    private final List<Descriptor> descriptors;
    private final Map<Tag, Attr<?>> attributes;
    private final Map<Tag, ChildDescriptor> children = new ConcurrentHashMap<>();
    private final Text<?> text;
    private final Collector collector;
    private final UnknownChildPolicy unknownChildPolicy;
    private final UnknownAttrPolicy unknownAttrPolicy;
    private final UnknownTextPolicy unknownTextPolicy;

    private XSOClass(Builder<T> builder, List<Descriptor> descriptors, Map<Tag, Attr<?>> attributes,
                     Text<?> text, Collector collector) {
        this.javaClass = builder.javaClass;
        this.factory = builder.factory;
        this.tag = builder.tag;
        this.parent = builder.parent;
        this.descriptors = Collections.unmodifiableList(descriptors);
        this.attributes = Collections.unmodifiableMap(attributes);
        this.text = text;
        this.collector = collector;
        this.unknownChildPolicy = builder.childPolicy;
        this.unknownAttrPolicy = builder.attrPolicy;
        this.unknownTextPolicy = builder.textPolicy;
    }

    /**
     * Starts the declaration of a concrete XSO class.
     *
     * @param javaClass the Java class of the objects
     * @param factory creates empty instances for parsing
     * @return a builder
     */
    public static <T extends XSO> Builder<T> builder(Class<T> javaClass, Supplier<? extends T> factory) {
        if (factory == null) {
            throw new NullPointerException("factory");
        }
        return new Builder<>(javaClass, factory);
    }

    /**
     * Starts the declaration of an abstract XSO class, which cannot be
     * instantiated and need not have a tag.
     *
     * @param javaClass the Java class of the objects
     * @return a builder
     */
    public static <T extends XSO> Builder<T> builder(Class<T> javaClass) {
        return new Builder<>(javaClass, null);
    }

    public Class<T> getJavaClass() {
        return javaClass;
    }

    /**
     * Returns the element tag.
     *
     * @return the tag, or null for an abstract class without one
     */
    public Tag getTag() {
        return tag;
    }

    public XSOClass<? super T> getParent() {
        return parent;
    }

    /**
     * Indicates whether instances of this class can be created.
     *
     * @return true if the class has a factory
     */
    public boolean isConcrete() {
        return factory != null;
    }

    /**
     * Returns the descriptors in declaration order, inherited ones first.
     *
     * @return an unmodifiable list
     */
    public List<Descriptor> getDescriptors() {
        return descriptors;
    }

    public Attr<?> getAttribute(Tag name) {
        return attributes.get(name);
    }

    public Text<?> getText() {
        return text;
    }

    public Collector getCollector() {
        return collector;
    }

    public UnknownChildPolicy getUnknownChildPolicy() {
        return unknownChildPolicy;
    }

    public UnknownAttrPolicy getUnknownAttrPolicy() {
        return unknownAttrPolicy;
    }

    public UnknownTextPolicy getUnknownTextPolicy() {
        return unknownTextPolicy;
    }

    /**
     * Indicates whether a child element with the given tag is claimed by
     * one of the descriptors.
     *
     * @param childTag the tag
     * @return true if the tag is recognised
     */
    public boolean isChildTag(Tag childTag) {
        return children.containsKey(childTag);
    }

    /**
     * Returns the tags of every child element currently recognised.
     *
     * @return an unmodifiable set
     */
    public Set<Tag> getChildTags() {
        return Collections.unmodifiableSet(children.keySet());
    }

    ChildDescriptor getChildDescriptor(Tag childTag) {
        return children.get(childTag);
    }

    void claimChild(Tag childTag, ChildDescriptor descriptor) {
        children.put(childTag, descriptor);
    }

    /**
     * Creates an empty instance.
     *
     * @return the instance
     * @throws IllegalStateException if the class is abstract
     */
    public T newInstance() {
        if (factory == null) {
            String msg = MessageFormat.format(L10N.getString("err.abstract_class"), this);
            throw new IllegalStateException(msg);
        }
        return factory.get();
    }

    /**
     * Indicates whether this class is the given class or extends it.
     *
     * @param other the candidate ancestor
     * @return true if {@code other} is this class or one of its parents
     */
    public boolean isSubclassOf(XSOClass<?> other) {
        for (XSOClass<?> c = this; c != null; c = c.parent) {
            if (c == other) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return javaClass.getName() + (tag == null ? "" : "(" + tag + ")");
    }

    /**
     * Declares an XSO class.
     *
     * @param <T> the Java class of the described objects
     */
    public static final class Builder<T extends XSO> {

        private final Class<T> javaClass;
        private final Supplier<? extends T> factory;
        private Tag tag;
        private XSOClass<? super T> parent;
        private boolean inheritDescriptors = true;
        private final List<Descriptor> own = new ArrayList<>();
        private UnknownChildPolicy childPolicy;
        private UnknownAttrPolicy attrPolicy;
        private UnknownTextPolicy textPolicy;

        private Builder(Class<T> javaClass, Supplier<? extends T> factory) {
            if (javaClass == null) {
                throw new NullPointerException("javaClass");
            }
            this.javaClass = javaClass;
            this.factory = factory;
        }

        /**
         * Sets the element tag.
         *
         * @param tag the tag, in any form accepted by {@link Tag#normalize}
         * @return this builder
         */
        public Builder<T> tag(Object tag) {
            this.tag = Tag.normalize(tag);
            return this;
        }

        public Builder<T> tag(String namespaceURI, String localName) {
            this.tag = Tag.of(namespaceURI, localName);
            return this;
        }

        public Builder<T> parent(XSOClass<? super T> parent) {
            this.parent = parent;
            return this;
        }

        /**
         * Controls whether the parent's descriptors are inherited.
         *
         * @param inherit false to start without descriptors
         * @return this builder
         */
        public Builder<T> inheritDescriptors(boolean inherit) {
            this.inheritDescriptors = inherit;
            return this;
        }

        public Builder<T> add(Descriptor... descriptors) {
            for (Descriptor descriptor : descriptors) {
                own.add(descriptor);
            }
            return this;
        }

        public Builder<T> unknownChildPolicy(UnknownChildPolicy policy) {
            this.childPolicy = policy;
            return this;
        }

        public Builder<T> unknownAttrPolicy(UnknownAttrPolicy policy) {
            this.attrPolicy = policy;
            return this;
        }

        public Builder<T> unknownTextPolicy(UnknownTextPolicy policy) {
            this.textPolicy = policy;
            return this;
        }

        /**
         * Validates the declaration and creates the class.
         *
         * @return the XSO class
         * @throws DeclarationException if the declaration is inconsistent
         */
        public XSOClass<T> build() {
            synchronized (LOCK) {
                return doBuild();
            }
        }

        private XSOClass<T> doBuild() {
            if (factory != null && tag == null) {
                throw error("err.no_tag", javaClass.getName());
            }
            List<Descriptor> all = new ArrayList<>();
            if (parent != null && inheritDescriptors) {
                all.addAll(parent.getDescriptors());
            }
            all.addAll(own);

            Map<Descriptor, Boolean> seen = new IdentityHashMap<>();
            Map<Tag, Attr<?>> attributes = new LinkedHashMap<>();
            Map<Tag, ChildDescriptor> childTags = new LinkedHashMap<>();
            Text<?> text = null;
            Collector collector = null;
            for (Descriptor descriptor : all) {
                if (seen.put(descriptor, Boolean.TRUE) != null) {
                    throw error("err.duplicate_descriptor", descriptor, javaClass.getName());
                }
                if (descriptor instanceof Attr) {
                    Attr<?> attr = (Attr<?>) descriptor;
                    if (attributes.put(attr.getTag(), attr) != null) {
                        throw error("err.duplicate_attribute", attr.getTag(), javaClass.getName());
                    }
                } else if (descriptor instanceof Text) {
                    if (text != null) {
                        throw error("err.multiple_text", javaClass.getName());
                    }
                    text = (Text<?>) descriptor;
                } else if (descriptor instanceof Collector) {
                    if (collector != null) {
                        throw error("err.multiple_collector", javaClass.getName());
                    }
                    collector = (Collector) descriptor;
                }
                if (descriptor instanceof ChildDescriptor) {
                    for (Tag childTag : ((ChildDescriptor) descriptor).getTags()) {
                        if (childTags.put(childTag, (ChildDescriptor) descriptor) != null) {
                            throw error("err.ambiguous_children", childTag, javaClass.getName());
                        }
                    }
                }
            }

            boolean collecting = collector != null;
            if (childPolicy == null) {
                childPolicy = parent != null ? parent.getUnknownChildPolicy()
                    : collecting ? UnknownChildPolicy.COLLECT : UnknownChildPolicy.FAIL;
            }
            if (attrPolicy == null) {
                attrPolicy = parent != null ? parent.getUnknownAttrPolicy()
                    : collecting ? UnknownAttrPolicy.COLLECT : UnknownAttrPolicy.FAIL;
            }
            if (textPolicy == null) {
                textPolicy = parent != null ? parent.getUnknownTextPolicy()
                    : collecting ? UnknownTextPolicy.COLLECT : UnknownTextPolicy.FAIL;
            }
            if (!collecting && (childPolicy == UnknownChildPolicy.COLLECT
                                || attrPolicy == UnknownAttrPolicy.COLLECT
                                || textPolicy == UnknownTextPolicy.COLLECT)) {
                throw error("err.collect_without_collector", javaClass.getName());
            }

            XSOClass<T> xsoClass = new XSOClass<>(this, all, attributes, text, collector);
            xsoClass.children.putAll(childTags);
            for (Descriptor descriptor : all) {
                descriptor.addOwner(xsoClass);
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.class_declared"),
                                                 xsoClass, all.size()));
            }
            return xsoClass;
        }

        private static DeclarationException error(String key, Object... args) {
            return new DeclarationException(MessageFormat.format(L10N.getString(key), args));
        }

    }

}
