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
 * Created on Oct 2, 2026
 */

package com.knowbase.keys;

import java.util.UUID;

import org.apache.log4j.Logger;

/**
 * Forms multi-component <code>unsigned byte[]</code> keys for literal terms.
 * Fixed width values are written big-endian with the sign bit flipped.
 * Strings are written as their UTF-16 code units, two bytes each, followed by
 * a single <code>nul</code> byte, so every {@link String} has its own key
 * (including strings holding unpaired surrogates).
 *
 * @version $Id$
 */
public class KeyBuilder implements IKeyBuilder {

    protected static final Logger log = Logger.getLogger(KeyBuilder.class);

    /**
     * The capacity used when none is given.
     */
    final public static int DEFAULT_INITIAL_CAPACITY = 64;

    /**
     * The #of bytes written into {@link #buf}.
     */
    protected int len;

    /**
     * The key buffer, reused across {@link #reset()}s and grown on demand.
     */
    protected byte[] buf;

    public KeyBuilder() {

        this(DEFAULT_INITIAL_CAPACITY);

    }

    /**
     * @param initialCapacity
     *            The initial size of the key buffer. Zero selects
     *            {@link #DEFAULT_INITIAL_CAPACITY}.
     *
     * @exception IllegalArgumentException
     *                if the initial capacity is negative.
     */
    public KeyBuilder(final int initialCapacity) {

        if (initialCapacity < 0)
            throw new IllegalArgumentException(
                    "initialCapacity must be non-negative");

        this.buf = new byte[initialCapacity == 0 ? DEFAULT_INITIAL_CAPACITY
                : initialCapacity];

    }

    /**
     * Grows the buffer so that <i>n</i> more bytes fit.
     */
    private void reserve(final int n) {

        final int required = len + n;

        if (required <= buf.length)
            return;

        final int newCapacity = Math.max(required, buf.length * 2);

        if (log.isDebugEnabled())
            log.debug("key buffer: " + buf.length + " => " + newCapacity);

        final byte[] tmp = new byte[newCapacity];

        System.arraycopy(buf, 0, tmp, 0, len);

        buf = tmp;

    }

    final public byte[] getKey() {

        final byte[] key = new byte[len];

        System.arraycopy(buf, 0, key, 0, len);

        return key;

    }

    final public IKeyBuilder reset() {

        len = 0;

        return this;

    }

    final public IKeyBuilder append(final byte[] a) {

        reserve(a.length);

        System.arraycopy(a, 0, buf, len, a.length);

        len += a.length;

        return this;

    }

    final public IKeyBuilder append(final String s) {

        if (s == null)
            throw new IllegalArgumentException();

        final int n = s.length();

        reserve(n * 2 + 1);

        for (int i = 0; i < n; i++) {

            append(s.charAt(i));

        }

        return appendNul();

    }

    final public IKeyBuilder append(final byte v) {

        reserve(1);

        buf[len++] = (byte) (v ^ 0x80);

        return this;

    }

    final public IKeyBuilder append(final short v) {

        reserve(2);

        final int x = v ^ 0x8000;

        buf[len++] = (byte) (x >>> 8);
        buf[len++] = (byte) x;

        return this;

    }

    /**
     * Chars are unsigned, so they are written as is.
     */
    final public IKeyBuilder append(final char v) {

        reserve(2);

        buf[len++] = (byte) (v >>> 8);
        buf[len++] = (byte) v;

        return this;

    }

    final public IKeyBuilder append(final int v) {

        reserve(4);

        final int x = v ^ Integer.MIN_VALUE;

        for (int shift = 24; shift >= 0; shift -= 8) {

            buf[len++] = (byte) (x >>> shift);

        }

        return this;

    }

    final public IKeyBuilder append(final long v) {

        reserve(8);

        final long x = v ^ Long.MIN_VALUE;

        for (int shift = 56; shift >= 0; shift -= 8) {

            buf[len++] = (byte) (x >>> shift);

        }

        return this;

    }

    final public IKeyBuilder append(final UUID uuid) {

        return append(uuid.getMostSignificantBits()).append(
                uuid.getLeastSignificantBits());

    }

    final public IKeyBuilder appendNul() {

        reserve(1);

        buf[len++] = 0;

        return this;

    }

}
