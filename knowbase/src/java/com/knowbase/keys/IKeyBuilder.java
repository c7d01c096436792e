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

/**
 * Builds <code>unsigned byte[]</code> keys from one or more values. Literal
 * terms are given a canonical byte form this way, from which their 128-bit
 * term identifier is derived. Instances carry a buffer: {@link #reset()} one
 * to reuse it, and do not share one between threads.
 *
 * @version $Id$
 */
public interface IKeyBuilder {

    /**
     * A copy of the bytes appended since the last {@link #reset()}.
     */
    public byte[] getKey();

    /**
     * Discards the appended bytes.
     *
     * @return This {@link IKeyBuilder}.
     */
    public IKeyBuilder reset();

    public IKeyBuilder append(byte[] a);

    /**
     * Appends the UTF-16 code units of the string and then a <code>nul</code>
     * byte. Two strings get the same bytes iff they are equal.
     *
     * @throws IllegalArgumentException
     *             if <i>s</i> is <code>null</code>.
     */
    public IKeyBuilder append(String s);

    public IKeyBuilder append(byte v);

    public IKeyBuilder append(short v);

    public IKeyBuilder append(char v);

    public IKeyBuilder append(int v);

    public IKeyBuilder append(long v);

    /**
     * The most significant and then the least significant 64 bits.
     */
    public IKeyBuilder append(UUID uuid);

    public IKeyBuilder appendNul();

}
