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

/**
 * The per-axis parameterization of the {@link CompositeKeyMixer}: a rotation
 * amount and a bit mask for the rotate-mask-xor round, plus a pair of seeds
 * folded into the high and low halves before that round.
 * <p>
 * The rotation MUST be odd (hence co-prime with 64, so repeated rotation
 * cycles through every bit position). The mask MUST contain both set and
 * clear bits, otherwise one half would never see the other.
 *
 * @version $Id$
 */
public final class MixParameters implements Serializable {

    private static final long serialVersionUID = 3906467004592637219L;

    /**
     * Alternating bits (even/odd bit positions).
     */
    public static final long MASK_ALTERNATING_BITS = 0xAAAAAAAAAAAAAAAAL;

    /**
     * Alternating 2-bit groups.
     */
    public static final long MASK_BIT_PAIRS = 0xCCCCCCCCCCCCCCCCL;

    /**
     * Alternating 4-bit nibbles.
     */
    public static final long MASK_NIBBLES = 0xF0F0F0F0F0F0F0F0L;

    public final int rotation;

    public final long mask;

    public final long seedHigh;

    public final long seedLow;

    /**
     * @param rotation
     *            The rotation amount (odd, in [1:63]).
     * @param mask
     *            The mask selecting which bits of one half perturb the other.
     * @param seedHigh
     *            Added to the high half before the rotate-mask-xor round.
     * @param seedLow
     *            Added to the low half before the rotate-mask-xor round.
     *
     * @throws IllegalArgumentException
     *             if the rotation is even or out of range, or if the mask is
     *             all zeros or all ones.
     */
    public MixParameters(final int rotation, final long mask,
            final long seedHigh, final long seedLow) {

        if (rotation <= 0 || rotation >= 64)
            throw new IllegalArgumentException("rotation=" + rotation);

        if ((rotation & 1) == 0)
            throw new IllegalArgumentException("rotation must be odd: "
                    + rotation);

        if (mask == 0L || mask == -1L)
            throw new IllegalArgumentException("mask=" + Long.toHexString(mask));

        this.rotation = rotation;
        this.mask = mask;
        this.seedHigh = seedHigh;
        this.seedLow = seedLow;

    }

    public int hashCode() {

        long h = rotation;
        h = h * 31 + mask;
        h = h * 31 + seedHigh;
        h = h * 31 + seedLow;

        return (int) (h ^ (h >>> 32));

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof MixParameters))
            return false;

        final MixParameters t = (MixParameters) o;

        return rotation == t.rotation && mask == t.mask
                && seedHigh == t.seedHigh && seedLow == t.seedLow;

    }

    public String toString() {

        return "MixParameters{rotation=" + rotation + ",mask="
                + Long.toHexString(mask) + ",seedHigh="
                + Long.toHexString(seedHigh) + ",seedLow="
                + Long.toHexString(seedLow) + "}";

    }

}
