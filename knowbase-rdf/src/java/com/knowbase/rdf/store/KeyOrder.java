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

import java.util.UUID;

import com.knowbase.keys.CompositeKey;
import com.knowbase.keys.CompositeKeyMixer;
import com.knowbase.keys.MixParameters;

/**
 * Represents the key order used by a statement index. Each index maps the
 * {@link CompositeKey} of two bound terms onto the set of values seen in the
 * third position. Each axis has its own {@link MixParameters} so that the
 * three key spaces are independent.
 *
 * @version $Id$
 */
public enum KeyOrder {

    /** (subject, predicate) to objects. */
    SP("sp", 0, new MixParameters(19, MixParameters.MASK_ALTERNATING_BITS,
            0x6A09E667F3BCC908L, 0xBB67AE8584CAA73BL)),

    /** (predicate, object) to subjects. */
    PO("po", 1, new MixParameters(23, MixParameters.MASK_BIT_PAIRS,
            0x3C6EF372FE94F82BL, 0xA54FF53A5F1D36F1L)),

    /** (object, subject) to predicates. */
    OS("os", 2, new MixParameters(29, MixParameters.MASK_NIBBLES,
            0x510E527FADE682D1L, 0x9B05688C2B3E6C1FL));

    public final String name;

    public final int order;

    public final MixParameters params;

    private KeyOrder(final String name, final int order,
            final MixParameters params) {

        this.name = name;
        this.order = order;
        this.params = params;

    }

    /**
     * Form the key for this axis. The arguments are given in the order named
     * by the axis, e.g., (predicate, object) for {@link #PO}.
     */
    public CompositeKey key(final UUID first, final UUID second) {

        return CompositeKeyMixer.mix(first, second, params);

    }

    /**
     * Return the access path that should be used for the triple pattern. A
     * <code>null</code> argument is unbound. When two or more terms are bound
     * this is the index whose key is formed from two bound terms. When only
     * one term is bound this is the index whose leading term is bound.
     *
     * @param s
     *            The optional subject.
     * @param p
     *            The optional predicate.
     * @param o
     *            The optional object.
     *
     * @return The KeyOrder that identifies the index to use for that triple
     *         pattern.
     */
    public static KeyOrder getKeyOrder(final Object s, final Object p,
            final Object o) {

        if (s != null && p != null && o != null) {

            return SP;

        } else if (s != null && p != null) {

            return SP;

        } else if (s != null && o != null) {

            return OS;

        } else if (p != null && o != null) {

            return PO;

        } else if (s != null) {

            return SP;

        } else if (p != null) {

            return PO;

        } else if (o != null) {

            return OS;

        } else {

            return SP;

        }

    }

}
