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

import java.io.Serializable;
import java.util.UUID;

/**
 * An immutable 128-bit key formed by folding two 128-bit terms together with
 * the {@link CompositeKeyMixer}. Instances are used as the keys of the
 * statement indices, so {@link #equals(Object)} and {@link #hashCode()} are
 * defined over both halves.
 *
 * @version $Id$
 */
public final class CompositeKey implements Comparable<CompositeKey>, Serializable {

    private static final long serialVersionUID = -4412190838705312766L;

    /**
     * The most significant 64 bits.
     */
    public final long high;

    /**
     * The least significant 64 bits.
     */
    public final long low;

    public CompositeKey(final long high, final long low) {

        this.high = high;

        this.low = low;

    }

    /**
     * The #of bits which differ between this key and the other key.
     */
    public int hammingDistance(final CompositeKey o) {

        return Long.bitCount(high ^ o.high) + Long.bitCount(low ^ o.low);

    }

    /**
     * The key expressed as a {@link UUID} (same 128 bits).
     */
    public UUID toUUID() {

        return new UUID(high, low);

    }

    public int hashCode() {

        final long h = high ^ (low * 31);

        return (int) (h ^ (h >>> 32));

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof CompositeKey))
            return false;

        final CompositeKey t = (CompositeKey) o;

        return high == t.high && low == t.low;

    }

    /**
     * Orders keys as 128-bit unsigned integers.
     */
    public int compareTo(final CompositeKey o) {

        final int ret = Long.compareUnsigned(high, o.high);

        if (ret != 0)
            return ret;

        return Long.compareUnsigned(low, o.low);

    }

    /**
     * Externalizes the key as 32 hex digits.
     */
    public String toString() {

        return String.format("%016x%016x", high, low);

    }

}
