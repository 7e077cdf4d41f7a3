/*
 * FeedResult.java
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

/**
 * Outcome of feeding one event to an {@link XSOParser}.
 *
 * <p>A parser answers every event with one of three results: it needs
 * more events ({@link Status#CONTINUE}), it has finished the element and
 * carries the parsed value ({@link Status#COMPLETE}), or the element
 * could not be parsed ({@link Status#FAILED}).
 *
 * @param <T> the type of value produced on completion
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FeedResult<T> {

    /**
     * Result status.
     */
    public enum Status {
        CONTINUE,
        COMPLETE,
        FAILED
    }

    private static final FeedResult<Object> CONTINUE = new FeedResult<>(Status.CONTINUE, null, null);

    private final Status status;
    private final T value;
    private final XSOException error;

    private FeedResult(Status status, T value, XSOException error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    /**
     * Returns the result indicating that more events are needed.
     *
     * @return the continue result
     */
    @SuppressWarnings("unchecked")
    public static <T> FeedResult<T> proceed() {
        return (FeedResult<T>) CONTINUE;
    }

    /**
     * Returns a completion result.
     *
     * @param value the parsed value, may be null for elements that carry none
     * @return the result
     */
    public static <T> FeedResult<T> complete(T value) {
        return new FeedResult<>(Status.COMPLETE, value, null);
    }

    /**
     * Returns a failure result.
     *
     * @param error the error which aborted the element
     * @return the result
     */
    public static <T> FeedResult<T> failed(XSOException error) {
        return new FeedResult<>(Status.FAILED, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Returns the parsed value of a completion result.
     *
     * @return the value, or null if not complete
     */
    public T getValue() {
        return value;
    }

    /**
     * Returns the error of a failure result.
     *
     * @return the error, or null if not failed
     */
    public XSOException getError() {
        return error;
    }

    @Override
    public String toString() {
        switch (status) {
            case COMPLETE:
                return "Complete(" + value + ")";
            case FAILED:
                return "Failed(" + error.getMessage() + ")";
            default:
                return "Continue";
        }
    }

}
