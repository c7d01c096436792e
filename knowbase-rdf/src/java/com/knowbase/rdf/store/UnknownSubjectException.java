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
import com.knowbase.rdf.model.Triple;

/**
 * Thrown when a statement about a statement is inserted but the statement in
 * the subject position is not in the store.
 *
 * @version $Id$
 */
public class UnknownSubjectException extends StoreException {

    private static final long serialVersionUID = 4316213906183001843L;

    private final Triple subject;

    public UnknownSubjectException(final Triple subject) {

        super("Subject is not in the store: " + subject);

        this.subject = subject;

    }

    public Triple getSubject() {

        return subject;

    }

}
