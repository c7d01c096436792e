/**

Copyright (C) SYSTAP, LLC 2006-2007.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA
*/
/*
 * Created on Oct 6, 2026
 */

package com.knowbase.rdf.store;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

import com.knowbase.keys.IKeyBuilder;
import com.knowbase.keys.KeyBuilder;
import com.knowbase.rdf.model.ITerm;
import com.knowbase.rdf.model.Triple;

/**
 * Helper class for assigning 128-bit term identifiers to the values which
 * appear in triples. {@link ITerm}s carry their own identifier. Literals are
 * encoded as an unsigned byte[] key formed by a leading byte that indicates
 * the type of the value followed by the components of that value, and the
 * identifier is a name-based {@link UUID} of that key. A {@link Triple} in the
 * subject or object position is identified by the key formed from the
 * identifiers of its components.
 * <p>
 * Two literals which are {@link Object#equals(Object)} always have the same
 * identifier. Floating point values are encoded by their raw bits so that the
 * identifier agrees with {@link Float#equals(Object)} and
 * {@link Double#equals(Object)}.
 * <p>
 * Note: instances are NOT thread-safe since they reuse a key buffer.
 *
 * @version $Id$
 */
public class TermKeyBuilder {

    public final IKeyBuilder keyBuilder;

    /*
     * Bytes indicating the type of a literal.
     */

    /** indicates a {@link String}. */
    final public static byte CODE_STR = 0x01;

    /** indicates a {@link Boolean}. */
    final public static byte CODE_BOOL = 0x02;

    /** indicates a {@link Character}. */
    final public static byte CODE_CHAR = 0x03;

    /** indicates a {@link Byte}. */
    final public static byte CODE_BYTE = 0x04;

    /** indicates a {@link Short}. */
    final public static byte CODE_SHORT = 0x05;

    /** indicates an {@link Integer}. */
    final public static byte CODE_INT = 0x06;

    /** indicates a {@link Long}. */
    final public static byte CODE_LONG = 0x07;

    /** indicates a {@link Float}. */
    final public static byte CODE_FLOAT = 0x08;

    /** indicates a {@link Double}. */
    final public static byte CODE_DOUBLE = 0x09;

    /** indicates a {@link BigInteger}. */
    final public static byte CODE_BIGINT = 0x0a;

    /** indicates a {@link BigDecimal}. */
    final public static byte CODE_BIGDEC = 0x0b;

    /** indicates a {@link UUID} used as a literal. */
    final public static byte CODE_UUID = 0x0c;

    /** indicates an {@link Enum} constant. */
    final public static byte CODE_ENUM = 0x0d;

    /** indicates a statement used as a term. */
    final public static byte CODE_STMT = 0x10;

    /**
     * The length of the key for a statement: one byte for the code followed by
     * three 128-bit identifiers.
     */
    final public static int stmtKeyLen = 1 + 16 * 3;

    public TermKeyBuilder() {

        this(new KeyBuilder(stmtKeyLen));

    }

    public TermKeyBuilder(final IKeyBuilder keyBuilder) {

        if (keyBuilder == null)
            throw new IllegalArgumentException();

        this.keyBuilder = keyBuilder;

    }

    /**
     * True iff values of this type may be used as the object of a triple.
     */
    public static boolean isSupported(final Object value) {

        return value instanceof ITerm || value instanceof Triple
                || value instanceof String || value instanceof Boolean
                || value instanceof Character || value instanceof Byte
                || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof Float
                || value instanceof Double || value instanceof BigInteger
                || value instanceof BigDecimal || value instanceof UUID
                || value instanceof Enum;

    }

    /**
     * Return the 128-bit identifier for a term.
     *
     * @param value
     *            An {@link ITerm}, a {@link Triple} or a supported literal.
     *
     * @throws IllegalArgumentException
     *             if the value is <code>null</code> or of an unsupported type.
     */
    public UUID termId(final Object value) {

        if (value instanceof ITerm) {

            return ((ITerm) value).getId();

        }

        if (value instanceof Triple) {

            final Triple t = (Triple) value;

            // the component ids are formed first since they reuse the buffer.
            final UUID s = termId(t.s);
            final UUID p = termId(t.p);
            final UUID o = termId(t.o);

            return UUID.nameUUIDFromBytes(statement2Key(s, p, o));

        }

        return UUID.nameUUIDFromBytes(value2Key(value));

    }

    /**
     * Encodes a statement represented as three identifiers as an unsigned
     * byte[] key.
     */
    public byte[] statement2Key(final UUID id1, final UUID id2, final UUID id3) {

        return keyBuilder.reset().append(CODE_STMT).append(id1).append(id2)
                .append(id3).getKey();

    }

    /**
     * Returns the key for a literal.
     *
     * @param value
     *            The literal.
     *
     * @throws IllegalArgumentException
     *             if the value is <code>null</code> or of an unsupported type.
     */
    public byte[] value2Key(final Object value) {

        if (value == null)
            throw new IllegalArgumentException();

        keyBuilder.reset();

        if (value instanceof String) {

            keyBuilder.append(CODE_STR).append((String) value);

        } else if (value instanceof Boolean) {

            keyBuilder.append(CODE_BOOL).append(
                    (byte) (((Boolean) value).booleanValue() ? 1 : 0));

        } else if (value instanceof Character) {

            keyBuilder.append(CODE_CHAR).append(
                    ((Character) value).charValue());

        } else if (value instanceof Byte) {

            keyBuilder.append(CODE_BYTE).append(((Byte) value).byteValue());

        } else if (value instanceof Short) {

            keyBuilder.append(CODE_SHORT).append(((Short) value).shortValue());

        } else if (value instanceof Integer) {

            keyBuilder.append(CODE_INT).append(((Integer) value).intValue());

        } else if (value instanceof Long) {

            keyBuilder.append(CODE_LONG).append(((Long) value).longValue());

        } else if (value instanceof Float) {

            keyBuilder.append(CODE_FLOAT).append(
                    Float.floatToIntBits(((Float) value).floatValue()));

        } else if (value instanceof Double) {

            keyBuilder.append(CODE_DOUBLE).append(
                    Double.doubleToLongBits(((Double) value).doubleValue()));

        } else if (value instanceof BigInteger) {

            final byte[] a = ((BigInteger) value).toByteArray();

            keyBuilder.append(CODE_BIGINT).append(a.length).append(a);

        } else if (value instanceof BigDecimal) {

            // scale is significant: 1.0 and 1.00 are not equal.
            final BigDecimal d = (BigDecimal) value;

            final byte[] a = d.unscaledValue().toByteArray();

            keyBuilder.append(CODE_BIGDEC).append(d.scale()).append(a.length)
                    .append(a);

        } else if (value instanceof UUID) {

            keyBuilder.append(CODE_UUID).append((UUID) value);

        } else if (value instanceof Enum) {

            final Enum<?> e = (Enum<?>) value;

            keyBuilder.append(CODE_ENUM)
                    .append(e.getDeclaringClass().getName()).append(e.name());

        } else {

            throw new IllegalArgumentException("Unsupported type: "
                    + value.getClass().getName());

        }

        return keyBuilder.getKey();

    }

}
