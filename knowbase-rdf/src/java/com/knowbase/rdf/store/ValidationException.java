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

import com.knowbase.rdf.StoreException;
import com.knowbase.rdf.model.Predicate;

/**
 * Thrown when a proposed object is rejected by the validator in effect for a
 * predicate. A validator which throws is treated as rejecting the value and
 * the thrown exception is reported as the cause.
 *
 * @version $Id$
 */
public class ValidationException extends StoreException {

    private static final long serialVersionUID = -6690741358802247702L;

    private final Predicate predicate;

    private final Object value;

    public ValidationException(final Predicate predicate, final Object value) {

        super(message(predicate, value));

        this.predicate = predicate;

        this.value = value;

    }

    public ValidationException(final Predicate predicate, final Object value,
            final Throwable cause) {

        super(message(predicate, value), cause);

        this.predicate = predicate;

        this.value = value;

    }

    private static String message(final Predicate p, final Object o) {

        return o + " does not match the criteria for predicate " + p;

    }

    public Predicate getPredicate() {

        return predicate;

    }

    public Object getValue() {

        return value;

    }

}
