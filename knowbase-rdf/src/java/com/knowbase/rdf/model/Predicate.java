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

import java.util.UUID;

/**
 * A labeled relation. A predicate has a 128-bit identifier, a kind, a name
 * (which defaults to the kind) and an optional {@link IValidator} which
 * constrains the objects it may be used with. Identity is the identifier
 * alone, so two predicates of the same kind are distinct.
 *
 * @version $Id$
 */
public final class Predicate implements ITerm {

    /**
     * The kind given to a predicate constructed without one.
     */
    public static final String DEFAULT_KIND = "predicate";

    private final UUID id;

    private final String kind;

    private final String name;

    private final IValidator validator;

    /**
     * @param kind
     *            The kind of relation ({@link #DEFAULT_KIND} when
     *            <code>null</code> or empty).
     */
    public Predicate(final String kind) {

        this(kind, null, null);

    }

    /**
     * @param kind
     *            The kind of relation.
     * @param name
     *            The name (defaults to the kind).
     */
    public Predicate(final String kind, final String name) {

        this(kind, name, null);

    }

    /**
     * @param kind
     *            The kind of relation.
     * @param name
     *            The name (defaults to the kind).
     * @param validator
     *            The built-in validator (optional, accepts everything when
     *            <code>null</code>).
     */
    public Predicate(final String kind, final String name,
            final IValidator validator) {

        this.id = UUID.randomUUID();

        // a missing kind falls back to DEFAULT_KIND.
        this.kind = kind == null || kind.length() == 0 ? DEFAULT_KIND : kind;

        this.name = name == null ? this.kind : name;

        this.validator = validator;

    }

    public UUID getId() {

        return id;

    }

    public String getKind() {

        return kind;

    }

    public String getName() {

        return name;

    }

    /**
     * The built-in validator or <code>null</code>.
     */
    public IValidator getValidator() {

        return validator;

    }

    /**
     * Apply the built-in validator.
     *
     * @return <code>true</code> if there is no built-in validator or if it
     *         accepts the value.
     */
    public boolean validate(final Object value) {

        return validator == null || validator.validate(value);

    }

    public int hashCode() {

        return id.hashCode();

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof Predicate))
            return false;

        return id.equals(((Predicate) o).id);

    }

    public String toString() {

        return name;

    }

}
