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
 * Created on Oct 9, 2026
 */

package com.knowbase.rdf.store;

import java.util.UUID;

import junit.framework.TestCase;

import com.knowbase.keys.CompositeKey;

/**
 * Test suite for {@link KeyOrder}.
 *
 * @version $Id$
 */
public class TestKeyOrder extends TestCase {

    public TestKeyOrder() {
    }

    public TestKeyOrder(String name) {
        super(name);
    }

    public void test_getKeyOrder() {

        final Object s = "s", p = "p", o = "o";

        assertEquals(KeyOrder.SP, KeyOrder.getKeyOrder(s, p, o));
        assertEquals(KeyOrder.SP, KeyOrder.getKeyOrder(s, p, null));
        assertEquals(KeyOrder.OS, KeyOrder.getKeyOrder(s, null, o));
        assertEquals(KeyOrder.PO, KeyOrder.getKeyOrder(null, p, o));
        assertEquals(KeyOrder.SP, KeyOrder.getKeyOrder(s, null, null));
        assertEquals(KeyOrder.PO, KeyOrder.getKeyOrder(null, p, null));
        assertEquals(KeyOrder.OS, KeyOrder.getKeyOrder(null, null, o));
        assertEquals(KeyOrder.SP, KeyOrder.getKeyOrder(null, null, null));

    }

    /**
     * Each axis differs from the others in both rotation and mask.
     */
    public void test_axisParameters() {

        final KeyOrder[] a = KeyOrder.values();

        assertEquals(3, a.length);

        for (int i = 0; i < a.length; i++) {

            assertEquals(i, a[i].order);

            for (int j = i + 1; j < a.length; j++) {

                assertTrue(a[i].params.rotation != a[j].params.rotation);

                assertTrue(a[i].params.mask != a[j].params.mask);

            }

        }

    }

    /**
     * The same pair of terms lands on different keys on each axis.
     */
    public void test_key() {

        final UUID a = UUID.randomUUID();
        final UUID b = UUID.randomUUID();

        final CompositeKey sp = KeyOrder.SP.key(a, b);
        final CompositeKey po = KeyOrder.PO.key(a, b);
        final CompositeKey os = KeyOrder.OS.key(a, b);

        assertEquals(sp, KeyOrder.SP.key(a, b));

        assertFalse(sp.equals(po));
        assertFalse(sp.equals(os));
        assertFalse(po.equals(os));

        assertFalse(sp.equals(KeyOrder.SP.key(b, a)));

    }

}
