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

package com.knowbase.rdf;

/**
 * Base class for the exceptions specific to the knowledge base so that they
 * may be filtered as a group. All of these are local, recoverable conditions.
 * A failed write or query never leaves the store in an inconsistent state.
 *
 * @version $Id$
 */
public class StoreException extends RuntimeException {

    private static final long serialVersionUID = -1573921450347614902L;

    /**
     * @param message
     */
    public StoreException(String message) {
        super(message);
    }

    /**
     * @param message
     * @param cause
     */
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @param cause
     */
    public StoreException(Throwable cause) {
        super(cause);
    }

}
