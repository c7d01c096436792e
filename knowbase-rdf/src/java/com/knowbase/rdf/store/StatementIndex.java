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

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.knowbase.keys.CompositeKey;

/**
 * An in-memory index for statements on one {@link KeyOrder}. The index maps
 * the {@link CompositeKey} of two terms onto the set of values seen in the
 * third position, e.g., for {@link KeyOrder#SP} the key of (subject,
 * predicate) is mapped onto the objects.
 * <p>
 * Note: the index is NOT thread-safe. The owning store is responsible for
 * concurrency control.
 *
 * @param <E>
 *            The type of the values in the third position.
 *
 * @version $Id$
 */
public class StatementIndex<E> {

    public final KeyOrder keyOrder;

    private final Map<CompositeKey, Set<E>> map;

    private long entryCount = 0L;

    /**
     * Create a new statement index.
     *
     * @param keyOrder
     *            The axis.
     * @param initialCapacity
     *            The initial capacity of the key map.
     */
    public StatementIndex(final KeyOrder keyOrder, final int initialCapacity) {

        if (keyOrder == null)
            throw new IllegalArgumentException();

        this.keyOrder = keyOrder;

        this.map = new HashMap<CompositeKey, Set<E>>(initialCapacity);

    }

    /**
     * Add a value under the key for two terms.
     *
     * @return <code>true</code> iff the value was not already present.
     */
    public boolean add(final UUID first, final UUID second, final E value) {

        final CompositeKey key = keyOrder.key(first, second);

        Set<E> bucket = map.get(key);

        if (bucket == null) {

            bucket = new LinkedHashSet<E>();

            map.put(key, bucket);

        }

        if (bucket.add(value)) {

            entryCount++;

            return true;

        }

        return false;

    }

    /**
     * The values under the key for two terms (read-only view, empty if there
     * are none). The view must not be used once the index has been modified.
     */
    public Set<E> lookup(final UUID first, final UUID second) {

        final Set<E> bucket = map.get(keyOrder.key(first, second));

        if (bucket == null)
            return Collections.emptySet();

        return Collections.unmodifiableSet(bucket);

    }

    /**
     * The #of distinct keys.
     */
    public int getKeyCount() {

        return map.size();

    }

    /**
     * The #of (key, value) entries.
     */
    public long getEntryCount() {

        return entryCount;

    }

    /**
     * Visits the keys and their values (read-only).
     */
    public Iterator<Map.Entry<CompositeKey, Set<E>>> entries() {

        return Collections.unmodifiableMap(map).entrySet().iterator();

    }

    public String toString() {

        return "StatementIndex{" + keyOrder.name + ",keys=" + map.size()
                + ",entries=" + entryCount + "}";

    }

}
