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
 * Created on Oct 7, 2026
 */

package com.knowbase.rdf.query;

import java.util.Set;

import com.knowbase.rdf.model.Predicate;
import com.knowbase.rdf.model.Resource;
import com.knowbase.rdf.model.Triple;
import com.knowbase.rdf.store.ITripleStore;
import com.knowbase.rdf.store.KeyOrder;

/**
 * A triple pattern bound to a store. Each of the subject, predicate and object
 * is either bound or <code>null</code> (a wildcard). The pattern is evaluated
 * against the current state of the store each time {@link #evaluate()} is
 * invoked.
 *
 * @version $Id$
 */
public class Query {

    private final ITripleStore store;

    public final Resource s;

    public final Predicate p;

    public final Object o;

    /**
     * @param store
     *            The store.
     * @param s
     *            The subject or <code>null</code>.
     * @param p
     *            The predicate or <code>null</code>.
     * @param o
     *            The object or <code>null</code>.
     */
    public Query(final ITripleStore store, final Resource s,
            final Predicate p, final Object o) {

        if (store == null)
            throw new IllegalArgumentException();

        this.store = store;
        this.s = s;
        this.p = p;
        this.o = o;

    }

    /**
     * The #of bound positions.
     */
    public int getBoundCount() {

        return (s == null ? 0 : 1) + (p == null ? 0 : 1) + (o == null ? 0 : 1);

    }

    /**
     * The index used to answer the pattern.
     */
    public KeyOrder getKeyOrder() {

        return KeyOrder.getKeyOrder(s, p, o);

    }

    /**
     * The triples in the store matching the pattern.
     */
    public Set<Triple> evaluate() {

        return store.match(s, p, o);

    }

    /**
     * True iff at least one triple matches.
     */
    public boolean exists() {

        return !evaluate().isEmpty();

    }

    public String toString() {

        return "Query{ " + (s == null ? "?s" : s.toString()) + ", "
                + (p == null ? "?p" : p.toString()) + ", "
                + (o == null ? "?o" : o.toString()) + " }";

    }

}
