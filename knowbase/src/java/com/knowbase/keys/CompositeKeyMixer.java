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
 * Created on Oct 3, 2026
 */

package com.knowbase.keys;

import java.util.UUID;

/**
 * Folds two 128-bit terms into a single 128-bit {@link CompositeKey} using a
 * rotate-mask-xor (RMX) scheme. This is NOT a cryptographic hash. The
 * guarantees are:
 * <dl>
 * <dt>order sensitivity</dt>
 * <dd><code>mix(a,b) == mix(b,a)</code> iff <code>a == b</code>.</dd>
 * <dt>avalanche</dt>
 * <dd>flipping any single input bit flips about half of the 128 output bits.</dd>
 * <dt>axis separation</dt>
 * <dd>distinct {@link MixParameters} give statistically independent key
 * spaces.</dd>
 * </dl>
 * The steps are:
 * <ol>
 * <li>Each 64-bit half of each term is passed through {@link #fmix(long)}.</li>
 * <li>The halves are folded pairwise as
 * <code>A*G + B*W + (A &gt;&gt;&gt; 63) + seed</code>, where <code>G</code> is
 * the 64-bit golden ratio constant and <code>W = G + 2</code>. Since
 * <code>G - W = -2</code>, exchanging the terms changes the fold unless both
 * halves of the terms agree: the even multiple of the difference can only
 * vanish when the difference is <code>2^63</code>, and in that case the top
 * bits of the two mixed halves differ, so the carry term breaks the tie.</li>
 * <li>One rotate-mask-xor round perturbs the high half with a masked view of
 * the low half and then the low half with the complementary view of the new
 * high half. The round is invertible, so no further collisions between
 * <code>(a,b)</code> and <code>(b,a)</code> are introduced.</li>
 * <li>Each half is passed through {@link #fmix(long)} once more.</li>
 * </ol>
 * All arithmetic is modulo 2^64.
 *
 * @version $Id$
 */
public final class CompositeKeyMixer {

    /**
     * The 64-bit golden ratio constant (odd), used to weight the first term.
     */
    public static final long GOLDEN = 0x9E3779B97F4A7C15L;

    /**
     * The weight of the second term (odd, and <code>GOLDEN - WEIGHT_B == -2</code>).
     */
    public static final long WEIGHT_B = GOLDEN + 2;

    /**
     * First multiplier of the finalizer.
     */
    public static final long FMIX_C1 = 0xff51afd7ed558ccdL;

    /**
     * Second multiplier of the finalizer.
     */
    public static final long FMIX_C2 = 0xc4ceb9fe1a85ec53L;

    /**
     * The shift used by each xor-shift step of the finalizer.
     */
    public static final int FMIX_SHIFT = 33;

    private CompositeKeyMixer() {
        // static methods only.
    }

    /**
     * The 64-bit finalizer: xor-shift, multiply, xor-shift, multiply,
     * xor-shift. This is a bijection on 64-bit values.
     */
    public static long fmix(long x) {

        x ^= x >>> FMIX_SHIFT;
        x *= FMIX_C1;
        x ^= x >>> FMIX_SHIFT;
        x *= FMIX_C2;
        x ^= x >>> FMIX_SHIFT;

        return x;

    }

    /**
     * Mix two terms given as {@link UUID}s.
     *
     * @param a
     *            The first term.
     * @param b
     *            The second term.
     * @param params
     *            The parameterization for the axis.
     *
     * @return The composite key.
     */
    public static CompositeKey mix(final UUID a, final UUID b,
            final MixParameters params) {

        if (a == null)
            throw new IllegalArgumentException();

        if (b == null)
            throw new IllegalArgumentException();

        return mix(a.getMostSignificantBits(), a.getLeastSignificantBits(),
                b.getMostSignificantBits(), b.getLeastSignificantBits(), params);

    }

    /**
     * Mix two terms given as their high and low halves.
     *
     * @return The composite key.
     */
    public static CompositeKey mix(final long aHigh, final long aLow,
            final long bHigh, final long bLow, final MixParameters params) {

        if (params == null)
            throw new IllegalArgumentException();

        final long ah = fmix(aHigh);
        final long al = fmix(aLow);
        final long bh = fmix(bHigh);
        final long bl = fmix(bLow);

        final long high = ah * GOLDEN + bh * WEIGHT_B + (ah >>> 63)
                + params.seedHigh;

        final long low = al * GOLDEN + bl * WEIGHT_B + (al >>> 63)
                + params.seedLow;

        // rotate-mask-xor, each half sees the other through the mask.
        final long rh = Long.rotateLeft(high, params.rotation)
                ^ (low & params.mask);

        final long rl = Long.rotateLeft(low, params.rotation)
                ^ (rh & ~params.mask);

        return new CompositeKey(fmix(rh), fmix(rl));

    }

}
