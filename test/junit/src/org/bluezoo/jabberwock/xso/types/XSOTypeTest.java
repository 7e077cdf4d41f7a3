/*
 * XSOTypeTest.java
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

import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.bluezoo.jabberwock.JID;
import org.bluezoo.jabberwock.xso.XSOTypeException;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the built-in XSO types.
 */
public class XSOTypeTest {

    enum Colour {
        RED, DARK_GREEN
    }

    @Test
    public void testString() {
        assertEquals(" a b ", StringType.INSTANCE.parse(" a b "));
        assertEquals("x", StringType.INSTANCE.format("x"));
    }

    @Test(expected = XSOTypeException.class)
    public void testStringCoerceRejectsOtherTypes() {
        StringType.INSTANCE.coerce(Integer.valueOf(1));
    }

    @Test
    public void testInteger() {
        assertEquals(Long.valueOf(42), IntegerType.INSTANCE.parse("42"));
        assertEquals(Long.valueOf(42), IntegerType.INSTANCE.parse(" +42 "));
        assertEquals(Long.valueOf(-7), IntegerType.INSTANCE.parse("-7"));
        assertEquals("-7", IntegerType.INSTANCE.format(Long.valueOf(-7)));
        assertEquals(Long.valueOf(5), IntegerType.INSTANCE.coerce(Integer.valueOf(5)));
    }

    @Test
    public void testIntegerBeyond32Bits() {
        assertEquals(Long.valueOf(2147483647L), IntegerType.INSTANCE.parse("2147483647"));
        assertEquals(Long.valueOf(2147483648L), IntegerType.INSTANCE.parse("2147483648"));
        assertEquals(Long.valueOf(-2147483649L), IntegerType.INSTANCE.parse("-2147483649"));
        assertEquals(Long.valueOf(Long.MAX_VALUE), IntegerType.INSTANCE.parse("9223372036854775807"));
        assertEquals("4294967296", IntegerType.INSTANCE.format(Long.valueOf(1L << 32)));
        assertEquals(Long.valueOf(1L << 40), IntegerType.INSTANCE.coerce(Long.valueOf(1L << 40)));
        assertEquals(Long.valueOf(1L << 40), IntegerType.INSTANCE.coerce(BigInteger.ONE.shiftLeft(40)));
    }

    @Test(expected = XSOTypeException.class)
    public void testIntegerParseOutOfRange() {
        IntegerType.INSTANCE.parse("9223372036854775808");
    }

    @Test(expected = XSOTypeException.class)
    public void testIntegerLexicalError() {
        IntegerType.INSTANCE.parse("4x");
    }

    @Test(expected = XSOTypeException.class)
    public void testIntegerCoerceOutOfRange() {
        IntegerType.INSTANCE.coerce(BigInteger.ONE.shiftLeft(64));
    }

    @Test(expected = XSOTypeException.class)
    public void testIntegerCoerceString() {
        IntegerType.INSTANCE.coerce("1");
    }

    @Test
    public void testFloat() {
        assertEquals(1.5, FloatType.INSTANCE.parse("1.5").doubleValue(), 0.0);
        assertEquals(1.0e3, FloatType.INSTANCE.parse("1e3").doubleValue(), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, FloatType.INSTANCE.parse("INF").doubleValue(), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, FloatType.INSTANCE.parse("-INF").doubleValue(), 0.0);
        assertTrue(FloatType.INSTANCE.parse("NaN").isNaN());
        assertEquals("INF", FloatType.INSTANCE.format(Double.POSITIVE_INFINITY));
        assertEquals("-INF", FloatType.INSTANCE.format(Double.NEGATIVE_INFINITY));
        assertEquals("NaN", FloatType.INSTANCE.format(Double.NaN));
        assertEquals(Double.valueOf(3.0), FloatType.INSTANCE.coerce(Integer.valueOf(3)));
    }

    @Test
    public void testFloatRejectsJavaSpellings() {
        String[] invalid = { "Infinity", "1.0d", "0x1p3", "", "abc" };
        for (String s : invalid) {
            try {
                FloatType.INSTANCE.parse(s);
                fail("accepted " + s);
            } catch (XSOTypeException e) {
                // expected
            }
        }
    }

    @Test
    public void testBool() {
        assertTrue(BoolType.INSTANCE.parse("true"));
        assertTrue(BoolType.INSTANCE.parse("1"));
        assertFalse(BoolType.INSTANCE.parse("false"));
        assertFalse(BoolType.INSTANCE.parse("0"));
        assertEquals("true", BoolType.INSTANCE.format(Boolean.TRUE));
    }

    @Test(expected = XSOTypeException.class)
    public void testBoolRejectsYes() {
        BoolType.INSTANCE.parse("yes");
    }

    @Test
    public void testDateTimeNormalisesToUTC() {
        OffsetDateTime value = DateTimeType.INSTANCE.parse("2002-09-10T23:08:25+02:00");
        assertEquals(ZoneOffset.UTC, value.getOffset());
        assertEquals(21, value.getHour());
        assertEquals("2002-09-10T21:08:25Z", DateTimeType.INSTANCE.format(value));
    }

    @Test
    public void testDateTimeFraction() {
        OffsetDateTime value = DateTimeType.INSTANCE.parse("2002-09-10T23:08:25.123Z");
        assertEquals(123000000, value.getNano());
        assertEquals("2002-09-10T23:08:25.123000Z", DateTimeType.INSTANCE.format(value));
    }

    @Test
    public void testDateTimeWithoutOffsetIsUTC() {
        OffsetDateTime value = DateTimeType.INSTANCE.parse("2002-09-10T23:08:25");
        assertEquals(OffsetDateTime.of(2002, 9, 10, 23, 8, 25, 0, ZoneOffset.UTC), value);
    }

    @Test
    public void testDateTimeCoerce() {
        Instant instant = Instant.parse("2020-01-01T00:00:00Z");
        assertEquals(instant, DateTimeType.INSTANCE.coerce(instant).toInstant());
        OffsetDateTime local = OffsetDateTime.of(2020, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(1));
        assertEquals(ZoneOffset.UTC, DateTimeType.INSTANCE.coerce(local).getOffset());
    }

    @Test(expected = XSOTypeException.class)
    public void testDateTimeInvalid() {
        DateTimeType.INSTANCE.parse("2002-13-10T23:08:25Z");
    }

    @Test
    public void testEnum() {
        EnumType<Colour> type = new EnumType<Colour>(Colour.class);
        assertEquals(Colour.DARK_GREEN, type.parse("dark-green"));
        assertEquals("red", type.format(Colour.RED));
        EnumType<Colour> upper = new EnumType<Colour>(Colour.class, c -> c.name());
        assertEquals(Colour.RED, upper.parse("RED"));
    }

    @Test(expected = XSOTypeException.class)
    public void testEnumUnknownValue() {
        new EnumType<Colour>(Colour.class).parse("blue");
    }

    @Test
    public void testBinary() {
        byte[] data = { 0, 1, (byte) 0xfe, (byte) 0xff };
        assertEquals("0001feff", HexBinaryType.INSTANCE.format(data));
        assertArrayEquals(data, HexBinaryType.INSTANCE.parse("0001FEFF"));
        assertArrayEquals(data, Base64BinaryType.INSTANCE.parse(Base64BinaryType.INSTANCE.format(data)));
    }

    @Test(expected = XSOTypeException.class)
    public void testHexOddLength() {
        HexBinaryType.INSTANCE.parse("abc");
    }

    @Test
    public void testJID() {
        JID jid = JIDType.INSTANCE.parse("juliet@capulet.lit/balcony");
        assertEquals("balcony", jid.getResource());
        assertEquals(jid, JIDType.INSTANCE.coerce("juliet@capulet.lit/balcony"));
    }

    @Test(expected = XSOTypeException.class)
    public void testJIDInvalid() {
        JIDType.INSTANCE.parse("@capulet.lit");
    }

}
