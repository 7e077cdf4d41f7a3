/*
 * DateTimeType.java
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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * XEP-0082 date-time values.
 *
 * <p>Accepts {@code CCYY-MM-DDThh:mm:ss[.sss][TZD]} where the time zone
 * designator is {@code Z} or {@code ±hh:mm}; a missing designator means
 * UTC. Values are normalised to UTC, and formatted with a {@code Z}
 * suffix and microsecond precision when there is a fractional part.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DateTimeType extends XSOType<OffsetDateTime> {

    public static final DateTimeType INSTANCE = new DateTimeType();

    private static final Pattern DATETIME = Pattern.compile(
        "(-?\\d{4,})-(\\d{2})-(\\d{2})T(\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d+))?(Z|[+-]\\d{2}:\\d{2})?");

    private DateTimeType() {
        super(OffsetDateTime.class);
    }

    @Override
    public OffsetDateTime parse(String text) {
        Matcher m = DATETIME.matcher(text.trim());
        if (!m.matches()) {
            throw parseError(text, null);
        }
        try {
            int nanos = 0;
            String fraction = m.group(7);
            if (fraction != null) {
                if (fraction.length() > 9) {
                    fraction = fraction.substring(0, 9);
                }
                StringBuilder buf = new StringBuilder(fraction);
                while (buf.length() < 9) {
                    buf.append('0');
                }
                nanos = Integer.parseInt(buf.toString());
            }
            String tzd = m.group(8);
            ZoneOffset offset = (tzd == null || "Z".equals(tzd)) ? ZoneOffset.UTC : ZoneOffset.of(tzd);
            OffsetDateTime value = OffsetDateTime.of(
                Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)),
                Integer.parseInt(m.group(5)),
                Integer.parseInt(m.group(6)),
                nanos,
                offset);
            return value.withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeException | NumberFormatException e) {
            throw parseError(text, e);
        }
    }

    @Override
    public String format(OffsetDateTime value) {
        OffsetDateTime utc = value.withOffsetSameInstant(ZoneOffset.UTC);
        StringBuilder buf = new StringBuilder();
        buf.append(String.format(Locale.ROOT, "%04d-%02d-%02dT%02d:%02d:%02d",
                                 utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth(),
                                 utc.getHour(), utc.getMinute(), utc.getSecond()));
        int micros = utc.getNano() / 1000;
        if (micros != 0) {
            buf.append(String.format(Locale.ROOT, ".%06d", micros));
        }
        buf.append('Z');
        return buf.toString();
    }

    @Override
    public OffsetDateTime coerce(Object value) {
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC);
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant) {
            return ((Instant) value).atOffset(ZoneOffset.UTC);
        }
        throw coerceError(value);
    }

}
