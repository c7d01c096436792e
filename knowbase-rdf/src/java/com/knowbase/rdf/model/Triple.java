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
 * Created on Oct 5, 2026
 */

package com.knowbase.rdf.model;

/**
 * An immutable (subject, predicate, object) statement. The subject is an
 * {@link Entity} or another {@link Triple} (a statement about a statement).
 * The object is any value: an {@link Entity}, a {@link Triple} or a literal.
 * Two triples are equal iff their components are equal.
 *
 * @version $Id$
 */
public final class Triple implements Resource {

    public final Resource s;

    public final Predicate p;

    public final Object o;

    private final int hashCode;

    /**
     * @param s
     *            The subject.
     * @param p
     *            The predicate.
     * @param o
     *            The object.
     *
     * @throws IllegalArgumentException
     *             if any component is <code>null</code>.
     */
    public Triple(final Resource s, final Predicate p, final Object o) {

        if (s == null)
            throw new IllegalArgumentException("s");

        if (p == null)
            throw new IllegalArgumentException("p");

        if (o == null)
            throw new IllegalArgumentException("o");

        this.s = s;
        this.p = p;
        this.o = o;

        int h = s.hashCode();
        h = 31 * h + p.hashCode();
        h = 31 * h + o.hashCode();

        this.hashCode = h;

    }

    /**
     * True iff the subject is itself a {@link Triple}.
     */
    public boolean isReified() {

        return s instanceof Triple;

    }

    public int hashCode() {

        return hashCode;

    }

    public boolean equals(final Object other) {

        if (this == other)
            return true;

        if (!(other instanceof Triple))
            return false;

        final Triple t = (Triple) other;

        return hashCode == t.hashCode && s.equals(t.s) && p.equals(t.p)
                && o.equals(t.o);

    }

    public String toString() {

        return "< " + s + ", " + p + ", " + o + " >";

    }

}
