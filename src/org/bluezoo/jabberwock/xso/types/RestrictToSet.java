/*
 * RestrictToSet.java
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

package org.bluezoo.jabberwock.xso.types;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accepts only members of a fixed set of values.
 *
 * @param <T> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RestrictToSet<T> implements Validator<T> {

    private final Set<T> allowed;

    public RestrictToSet(Collection<? extends T> allowed) {
        this.allowed = Collections.unmodifiableSet(new LinkedHashSet<T>(allowed));
    }

    @SafeVarargs
    public static <T> RestrictToSet<T> of(T... allowed) {
        return new RestrictToSet<T>(Arrays.asList(allowed));
    }

    public Set<T> getAllowed() {
        return allowed;
    }

    @Override
    public boolean isValid(T value) {
        return allowed.contains(value);
    }

    @Override
    public String toString() {
        return "RestrictToSet" + allowed;
    }

}
