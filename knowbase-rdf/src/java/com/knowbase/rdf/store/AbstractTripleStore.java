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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
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
 * Abstract base class that implements logic for the {@link ITripleStore}
 * interface that is invariant across the choice of the index engine: the
 * configuration, the validator registry, the filter queries and the batch
 * writes, all of which are expressed in terms of the engine primitives.
 *
 * @version $Id$
 */
abstract public class AbstractTripleStore implements ITripleStore {

    /**
     * Options understood by the store.
     */
    public static interface Options {

        /**
         * The initial capacity of the index maps (default
         * {@value #DEFAULT_INITIAL_CAPACITY}).
         */
        public static final String INITIAL_CAPACITY = AbstractTripleStore.class
                .getName()
                + ".initialCapacity";

        public static final String DEFAULT_INITIAL_CAPACITY = "1024";

        /**
         * When <code>true</code> the values found under a composite key are
         * verified against the canonical triple set before they are returned
         * (default {@value #DEFAULT_VERIFY_INDEX_HITS}). This guards against
         * composite key collisions.
         */
        public static final String VERIFY_INDEX_HITS = AbstractTripleStore.class
                .getName()
                + ".verifyIndexHits";

        public static final String DEFAULT_VERIFY_INDEX_HITS = "true";

        /**
         * When <code>true</code> a triple whose subject is a {@link Triple}
         * may only be inserted once that triple is in the store (default
         * {@value #DEFAULT_REQUIRE_KNOWN_REIFIED_SUBJECT}).
         */
        public static final String REQUIRE_KNOWN_REIFIED_SUBJECT = AbstractTripleStore.class
                .getName()
                + ".requireKnownReifiedSubject";

        public static final String DEFAULT_REQUIRE_KNOWN_REIFIED_SUBJECT = "true";

    }

    /**
     * A copy of properties used to configure the {@link ITripleStore}.
     */
    final protected Properties properties;

    /**
     * @see Options#INITIAL_CAPACITY
     */
    final protected int initialCapacity;

    /**
     * @see Options#VERIFY_INDEX_HITS
     */
    final protected boolean verifyIndexHits;

    /**
     * @see Options#REQUIRE_KNOWN_REIFIED_SUBJECT
     */
    final protected boolean requireKnownReifiedSubject;

    /**
     * Validators registered against this store.
     */
    final protected ValidatorRegistry validators = new ValidatorRegistry();

    final public Properties getProperties() {

        /*
         * wrap them up so that people can not easily mess with the initial
         * properties.
         */
        return new Properties(properties);

    }

    /**
     * @param properties
     *            See {@link Options}.
     *
     * @throws IllegalArgumentException
     *             if an option has an illegal value.
     */
    protected AbstractTripleStore(final Properties properties) {

        if (properties == null)
            throw new IllegalArgumentException();

        // Copy the properties object.
        this.properties = (Properties) properties.clone();

        {

            final String val = properties.getProperty(
                    Options.INITIAL_CAPACITY, Options.DEFAULT_INITIAL_CAPACITY);

            try {

                initialCapacity = Integer.parseInt(val.trim());

            } catch (NumberFormatException ex) {

                throw new IllegalArgumentException(Options.INITIAL_CAPACITY
                        + "=" + val, ex);

            }

            if (initialCapacity <= 0)
                throw new IllegalArgumentException(Options.INITIAL_CAPACITY
                        + "=" + val);

        }

        verifyIndexHits = parseBoolean(properties, Options.VERIFY_INDEX_HITS,
                Options.DEFAULT_VERIFY_INDEX_HITS);

        requireKnownReifiedSubject = parseBoolean(properties,
                Options.REQUIRE_KNOWN_REIFIED_SUBJECT,
                Options.DEFAULT_REQUIRE_KNOWN_REIFIED_SUBJECT);

    }

    private static boolean parseBoolean(final Properties properties,
            final String name, final String def) {

        final String val = properties.getProperty(name, def).trim();

        if (val.equalsIgnoreCase("true"))
            return true;

        if (val.equalsIgnoreCase("false"))
            return false;

        throw new IllegalArgumentException(name + "=" + val);

    }

    final public ValidatorRegistry getValidatorRegistry() {

        return validators;

    }

    final public IValidator setCheck(final Predicate p,
            final IValidator validator) {

        return validators.setCheck(p, validator);

    }

    final public boolean contains(final Resource s, final Predicate p,
            final Object o) {

        return contains(new Triple(s, p, o));

    }

    final public Query query(final Resource s, final Predicate p,
            final Object o) {

        return new Query(this, s, p, o);

    }

    /*
     * Filter queries.
     */

    final public Set<Resource> getAll(final Map<Predicate, ?> filter) {

        if (filter == null)
            throw new IllegalArgumentException();

        if (filter.isEmpty())
            throw new EmptyQueryException();

        Set<Resource> result = null;

        for (Map.Entry<Predicate, ?> entry : filter.entrySet()) {

            final Set<Resource> subjects = subjects(entry.getKey(), entry
                    .getValue());

            if (result == null) {

                result = new LinkedHashSet<Resource>(subjects);

            } else {

                result.retainAll(subjects);

            }

            if (result.isEmpty()) {

                // no need to consult the remaining constraints.
                break;

            }

        }

        return result;

    }

    final public Resource get(final Map<Predicate, ?> filter) {

        final Set<Resource> result = getAll(filter);

        if (result.isEmpty())
            throw new NoResultException(filter);

        if (result.size() > 1)
            throw new AmbiguousResultException(filter, result.size());

        return result.iterator().next();

    }

    final public Set<Resource> getWhich(final Predicate p, final Object o) {

        return subjects(p, o);

    }

    /*
     * Batch writes.
     */

    final public List<Entity> createSubjectsWith(
            final Map<Predicate, ? extends List<?>> columns) {

        if (columns == null || columns.isEmpty())
            throw new IllegalArgumentException("no columns");

        // the #of rows is the length of the longest sequence.
        int nrows = 0;

        for (Map.Entry<Predicate, ? extends List<?>> entry : columns.entrySet()) {

            if (entry.getKey() == null)
                throw new IllegalArgumentException("null predicate");

            final List<?> values = entry.getValue();

            if (values == null || values.isEmpty())
                throw new IllegalArgumentException("no values for "
                        + entry.getKey());

            nrows = Math.max(nrows, values.size());

        }

        for (Map.Entry<Predicate, ? extends List<?>> entry : columns.entrySet()) {

            final int n = entry.getValue().size();

            if (n != 1 && n != nrows)
                throw new IllegalArgumentException("Expecting 1 or " + nrows
                        + " values for " + entry.getKey() + ", not " + n);

        }

        final List<Entity> subjects = new ArrayList<Entity>(nrows);

        final List<Triple> triples = new ArrayList<Triple>(nrows * columns.size());

        for (int i = 0; i < nrows; i++) {

            final Entity s = new Entity();

            subjects.add(s);

            for (Map.Entry<Predicate, ? extends List<?>> entry : columns
                    .entrySet()) {

                final List<?> values = entry.getValue();

                final Object o = values.size() == 1 ? values.get(0) : values
                        .get(i);

                triples.add(new Triple(s, entry.getKey(), o));

            }

        }

        addStatements(triples);

        return subjects;

    }

    final public List<Triple> addAll(
            final Collection<? extends Resource> subjects,
            final Collection<?> objects, final Predicate p) {

        if (subjects == null || objects == null || p == null)
            throw new IllegalArgumentException();

        final List<Triple> triples = new ArrayList<Triple>(subjects.size()
                * objects.size());

        for (Resource s : subjects) {

            for (Object o : objects) {

                triples.add(new Triple(s, p, o));

            }

        }

        addStatements(triples);

        return triples;

    }

    final public List<Triple> setAll(
            final Collection<? extends Resource> subjects,
            final Map<Predicate, ? extends Collection<?>> predObjects) {

        if (subjects == null || predObjects == null)
            throw new IllegalArgumentException();

        final List<Triple> triples = new ArrayList<Triple>();

        for (Resource s : subjects) {

            for (Map.Entry<Predicate, ? extends Collection<?>> entry : predObjects
                    .entrySet()) {

                if (entry.getValue() == null)
                    throw new IllegalArgumentException("no values for "
                            + entry.getKey());

                for (Object o : entry.getValue()) {

                    triples.add(new Triple(s, entry.getKey(), o));

                }

            }

        }

        addStatements(triples);

        return triples;

    }

    /*
     * Diagnostics.
     */

    /**
     * Writes the triples on {@link System#err} in insertion order.
     */
    final public void dumpStore() {

        dumpStore(System.err);

    }

    /**
     * Writes the #of triples followed by one line per triple in insertion
     * order.
     */
    final public void dumpStore(final PrintStream out) {

        final int nstmts = size();

        out.println("#statements=" + nstmts);

        final Iterator<Triple> itr = iterator();

        int i = 0;

        while (itr.hasNext()) {

            final Triple t = itr.next();

            i++;

            out.println("#" + i + "\t" + t);

        }

    }

}
