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

import java.util.concurrent.ConcurrentHashMap;

import org.apache.log4j.Logger;

import com.knowbase.rdf.model.IValidator;
import com.knowbase.rdf.model.Predicate;

/**
 * Per-store registry of validators which override the built-in validator of a
 * {@link Predicate}. The validator in effect for a predicate is the registered
 * one when there is one and otherwise {@link Predicate#validate(Object)}.
 * <p>
 * Registration only affects later inserts. Triples already in the store are
 * not re-checked.
 *
 * @version $Id$
 */
public class ValidatorRegistry {

    protected static final Logger log = Logger
            .getLogger(ValidatorRegistry.class);

    private final ConcurrentHashMap<Predicate, IValidator> checks = new ConcurrentHashMap<Predicate, IValidator>();

    /**
     * Register a validator for a predicate, replacing any previous
     * registration.
     *
     * @param p
     *            The predicate.
     * @param validator
     *            The validator, or <code>null</code> to remove the
     *            registration so that the built-in validator applies again.
     *
     * @return The previous registration or <code>null</code>.
     */
    public IValidator setCheck(final Predicate p, final IValidator validator) {

        if (p == null)
            throw new IllegalArgumentException();

        final IValidator old;

        if (validator == null) {

            old = checks.remove(p);

        } else {

            old = checks.put(p, validator);

        }

        if (log.isDebugEnabled())
            log.debug("predicate=" + p + ", validator=" + validator
                    + ", previous=" + old);

        return old;

    }

    /**
     * The registered validator or <code>null</code>.
     */
    public IValidator getCheck(final Predicate p) {

        if (p == null)
            throw new IllegalArgumentException();

        return checks.get(p);

    }

    /**
     * The #of registrations.
     */
    public int size() {

        return checks.size();

    }

    /**
     * Apply the validator in effect for the predicate.
     *
     * @throws ValidationException
     *             if the value is rejected or if the validator throws.
     */
    public void validate(final Predicate p, final Object value) {

        final IValidator check = checks.get(p);

        final boolean ok;

        try {

            ok = check != null ? check.validate(value) : p.validate(value);

        } catch (RuntimeException ex) {

            throw new ValidationException(p, value, ex);

        }

        if (!ok) {

            throw new ValidationException(p, value);

        }

    }

    /**
     * True iff the validator in effect accepts the value. A validator which
     * throws rejects the value.
     */
    public boolean isValid(final Predicate p, final Object value) {

        try {

            validate(p, value);

            return true;

        } catch (ValidationException ex) {

            return false;

        }

    }

}
