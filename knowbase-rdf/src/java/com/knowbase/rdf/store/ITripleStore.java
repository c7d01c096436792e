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

package com.knowbase.rdf.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import com.knowbase.rdf.model.Entity;
import com.knowbase.rdf.model.IValidator;
import com.knowbase.rdf.model.Predicate;
import com.knowbase.rdf.model.Resource;
import com.knowbase.rdf.model.Triple;
import com.knowbase.rdf.query.AmbiguousResultException;
import com.knowbase.rdf.query.EmptyQueryException;
import com.knowbase.rdf.query.NoResultException;
import com.knowbase.rdf.query.Query;

/**
 * Interface for a triple store. Iteration visits each triple exactly once in
 * insertion order.
 *
 * @version $Id$
 */
public interface ITripleStore extends Iterable<Triple> {

    /**
     * A copy of the properties used to configure the store.
     */
    public Properties getProperties();

    /*
     * Writes.
     */

    /**
     * Insert a triple. Re-inserting a triple which is already present is a
     * no-op.
     *
     * @return The triple.
     *
     * @throws IllegalArgumentException
     *             if an argument is <code>null</code> or the object is of an
     *             unsupported type.
     * @throws ValidationException
     *             if the validator in effect for the predicate rejects the
     *             object. The store is not modified.
     * @throws UnknownSubjectException
     *             if the subject is a {@link Triple} which is not in the
     *             store.
     */
    public Triple add(Resource s, Predicate p, Object o);

    /**
     * Insert a triple.
     *
     * @return <code>true</code> iff the triple was not already present.
     *
     * @see #add(Resource, Predicate, Object)
     */
    public boolean add(Triple t);

    /**
     * Insert a batch of triples. Either all of the triples are applied or, if
     * any triple is rejected, none are.
     *
     * @return The #of triples which were not already present.
     */
    public int addStatements(List<Triple> triples);

    /**
     * Register a validator for a predicate which overrides its built-in
     * validator for future inserts. A <code>null</code> validator removes the
     * registration.
     *
     * @return The previous registration or <code>null</code>.
     */
    public IValidator setCheck(Predicate p, IValidator validator);

    /**
     * Create one new entity per row and give each the value at its row for
     * each predicate. A sequence of length one is broadcast to every row.
     *
     * @param columns
     *            A mapping from predicate to the sequence of objects.
     *
     * @return The new entities in row order.
     *
     * @throws IllegalArgumentException
     *             if the mapping or a sequence is empty, or if a sequence
     *             longer than one has a length other than the row count.
     */
    public List<Entity> createSubjectsWith(Map<Predicate, ? extends List<?>> columns);

    /**
     * Insert the cartesian product of the subjects and the objects under the
     * predicate.
     *
     * @return The triples in the product.
     */
    public List<Triple> addAll(Collection<? extends Resource> subjects,
            Collection<?> objects, Predicate p);

    /**
     * For each subject insert a triple for each (predicate, object) pair in
     * the mapping. The mapping returned by {@link #attributesOf(Resource)} may
     * be used to copy the attributes of one subject onto others.
     *
     * @return The triples which were inserted.
     */
    public List<Triple> setAll(Collection<? extends Resource> subjects,
            Map<Predicate, ? extends Collection<?>> predObjects);

    /*
     * Reads.
     */

    /**
     * The #of triples in the store.
     */
    public int size();

    public boolean contains(Triple t);

    public boolean contains(Resource s, Predicate p, Object o);

    /**
     * The predicates and objects of the triples having the subject (empty if
     * there are none).
     */
    public Map<Predicate, Set<Object>> attributesOf(Resource s);

    /**
     * The entity which was the subject of the most recent net-new triple.
     *
     * @throws EmptyStoreException
     *             if no triple with an entity subject has been added.
     */
    public Entity lastAdded();

    /**
     * The objects completing the pattern <code>(s, p, ?)</code>.
     */
    public Set<Object> objects(Resource s, Predicate p);

    /**
     * The subjects completing the pattern <code>(?, p, o)</code>.
     */
    public Set<Resource> subjects(Predicate p, Object o);

    /**
     * The predicates completing the pattern <code>(s, ?, o)</code>.
     */
    public Set<Predicate> predicates(Resource s, Object o);

    /**
     * The triples matching a pattern. Each argument is either bound or
     * <code>null</code>.
     */
    public Set<Triple> match(Resource s, Predicate p, Object o);

    /**
     * A reusable pattern over this store.
     */
    public Query query(Resource s, Predicate p, Object o);

    /**
     * The subjects satisfying every (predicate, object) constraint.
     *
     * @throws EmptyQueryException
     *             if the filter is empty.
     */
    public Set<Resource> getAll(Map<Predicate, ?> filter);

    /**
     * The unique subject satisfying every constraint.
     *
     * @throws EmptyQueryException
     *             if the filter is empty.
     * @throws NoResultException
     *             if no subject matches.
     * @throws AmbiguousResultException
     *             if more than one subject matches.
     */
    public Resource get(Map<Predicate, ?> filter);

    /**
     * The subjects of the triples <code>(?, p, o)</code>.
     */
    public Set<Resource> getWhich(Predicate p, Object o);

}
