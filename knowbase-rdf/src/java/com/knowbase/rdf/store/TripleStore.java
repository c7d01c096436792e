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
 * Created on Oct 8, 2026
 */

package com.knowbase.rdf.store;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import com.knowbase.rdf.model.Entity;
import com.knowbase.rdf.model.Predicate;
import com.knowbase.rdf.model.Resource;
import com.knowbase.rdf.model.Triple;

/**
 * An in-memory triple store. The store owns the canonical set of triples and
 * derives from it three composite-keyed indices ({@link KeyOrder#SP},
 * {@link KeyOrder#PO} and {@link KeyOrder#OS}), a subject index and an
 * insertion log.
 * <p>
 * The canonical set, the indices and the log are updated together under a
 * single write lock, so readers never observe a triple in one structure but
 * not another. Readers share a read lock. Validation and the computation of
 * term identifiers happen before the write lock is taken, so a rejected
 * insert never modifies the store.
 * <p>
 * Triples are never removed.
 *
 * @version $Id$
 */
public class TripleStore extends AbstractTripleStore {

    static transient public Logger log = Logger.getLogger(TripleStore.class);

    /**
     * True iff the {@link #log} level is INFO or less.
     */
    final public boolean INFO = log.getEffectiveLevel().toInt() <= Level.INFO
            .toInt();

    /**
     * True iff the {@link #log} level is DEBUG or less.
     */
    final public boolean DEBUG = log.getEffectiveLevel().toInt() <= Level.DEBUG
            .toInt();

    /**
     * Guards all of the state below.
     */
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * The canonical set of triples.
     */
    private final Set<Triple> statements;

    private final StatementIndex<Object> ndx_sp;

    private final StatementIndex<Resource> ndx_po;

    private final StatementIndex<Predicate> ndx_os;

    /**
     * subject to predicate to objects.
     */
    private final Map<Resource, Map<Predicate, Set<Object>>> ndx_s;

    /**
     * The net-new triples in the order in which they were inserted
     * (append-only).
     */
    private final ArrayList<Triple> history;

    /**
     * The subject of the most recent net-new triple whose subject is an
     * {@link Entity}, or <code>null</code>. Guarded by the write lock.
     */
    private Entity lastEntity = null;

    /**
     * Key builders are not thread-safe, so each thread gets its own.
     */
    private final ThreadLocal<TermKeyBuilder> keyBuilder = new ThreadLocal<TermKeyBuilder>() {

        protected TermKeyBuilder initialValue() {

            return new TermKeyBuilder();

        }

    };

    /**
     * Create a store using the default {@link Options}.
     */
    public TripleStore() {

        this(new Properties());

    }

    /**
     * @param properties
     *            See {@link Options}.
     */
    public TripleStore(final Properties properties) {

        super(properties);

        statements = new HashSet<Triple>(initialCapacity);

        ndx_sp = new StatementIndex<Object>(KeyOrder.SP, initialCapacity);

        ndx_po = new StatementIndex<Resource>(KeyOrder.PO, initialCapacity);

        ndx_os = new StatementIndex<Predicate>(KeyOrder.OS, initialCapacity);

        ndx_s = new LinkedHashMap<Resource, Map<Predicate, Set<Object>>>(
                initialCapacity);

        history = new ArrayList<Triple>(initialCapacity);

        if (INFO)
            log.info("initialCapacity=" + initialCapacity
                    + ", verifyIndexHits=" + verifyIndexHits
                    + ", requireKnownReifiedSubject="
                    + requireKnownReifiedSubject);

    }

    /**
     * The identifiers of the terms of a triple.
     */
    private static class TermIds {

        final UUID s, p, o;

        TermIds(final UUID s, final UUID p, final UUID o) {

            this.s = s;
            this.p = p;
            this.o = o;

        }

    }

    /**
     * @throws IllegalArgumentException
     *             if the value is <code>null</code> or not a supported type.
     */
    private UUID termId(final Object value) {

        if (value == null)
            throw new IllegalArgumentException();

        return keyBuilder.get().termId(value);

    }

    /**
     * Computes the term identifiers and applies the validator in effect for
     * the predicate. Does not touch the store.
     */
    private TermIds prepare(final Triple t) {

        if (t == null)
            throw new IllegalArgumentException();

        final TermIds ids = new TermIds(termId(t.s), termId(t.p), termId(t.o));

        try {

            validators.validate(t.p, t.o);

        } catch (ValidationException ex) {

            if (DEBUG)
                log.debug("Rejected: " + t + " : " + ex.getMessage());

            throw ex;

        }

        return ids;

    }

    /**
     * Verify that a reified subject is already known. The caller must hold
     * the write lock.
     *
     * @param batch
     *            Triples which will be in the store by the time this triple
     *            is applied (optional).
     */
    private void checkReifiedSubject(final Triple t, final Set<Triple> batch) {

        if (!requireKnownReifiedSubject || !(t.s instanceof Triple))
            return;

        final Triple s = (Triple) t.s;

        if (statements.contains(s))
            return;

        if (batch != null && batch.contains(s))
            return;

        if (DEBUG)
            log.debug("Unknown subject: " + t);

        throw new UnknownSubjectException(s);

    }

    /**
     * Add the triple to the canonical set and, iff it is net-new, to each
     * index and the log. The caller must hold the write lock.
     *
     * @return <code>true</code> iff the triple is net-new.
     */
    private boolean apply(final Triple t, final TermIds ids) {

        if (!statements.add(t)) {

            if (DEBUG)
                log.debug("Already present: " + t);

            return false;

        }

        ndx_sp.add(ids.s, ids.p, t.o);

        ndx_po.add(ids.p, ids.o, t.s);

        ndx_os.add(ids.o, ids.s, t.p);

        Map<Predicate, Set<Object>> attrs = ndx_s.get(t.s);

        if (attrs == null) {

            attrs = new LinkedHashMap<Predicate, Set<Object>>();

            ndx_s.put(t.s, attrs);

        }

        Set<Object> objs = attrs.get(t.p);

        if (objs == null) {

            objs = new LinkedHashSet<Object>();

            attrs.put(t.p, objs);

        }

        objs.add(t.o);

        history.add(t);

        if (t.s instanceof Entity)
            lastEntity = (Entity) t.s;

        return true;

    }

    /*
     * Writes.
     */

    public Triple add(final Resource s, final Predicate p, final Object o) {

        final Triple t = new Triple(s, p, o);

        add(t);

        return t;

    }

    public boolean add(final Triple t) {

        final TermIds ids = prepare(t);

        lock.writeLock().lock();

        try {

            checkReifiedSubject(t, null);

            return apply(t, ids);

        } finally {

            lock.writeLock().unlock();

        }

    }

    public int addStatements(final List<Triple> triples) {

        if (triples == null)
            throw new IllegalArgumentException();

        final int numStmts = triples.size();

        if (numStmts == 0)
            return 0;

        final long begin = System.currentTimeMillis();

        final TermIds[] ids = new TermIds[numStmts];

        for (int i = 0; i < numStmts; i++) {

            ids[i] = prepare(triples.get(i));

        }

        final long elapsedPrepare = System.currentTimeMillis() - begin;

        final long beginInsert = System.currentTimeMillis();

        int nwritten = 0;

        lock.writeLock().lock();

        try {

            if (requireKnownReifiedSubject) {

                // all checks pass before anything is applied.
                final Set<Triple> seen = new HashSet<Triple>(numStmts);

                for (int i = 0; i < numStmts; i++) {

                    final Triple t = triples.get(i);

                    checkReifiedSubject(t, seen);

                    seen.add(t);

                }

            }

            for (int i = 0; i < numStmts; i++) {

                if (apply(triples.get(i), ids[i])) {

                    nwritten++;

                }

            }

        } finally {

            lock.writeLock().unlock();

        }

        final long elapsedInsert = System.currentTimeMillis() - beginInsert;

        if (INFO)
            log.info("Wrote " + nwritten + " of " + numStmts
                    + " statements: prepare=" + elapsedPrepare + "ms, insert="
                    + elapsedInsert + "ms, total="
                    + (System.currentTimeMillis() - begin) + "ms");

        return nwritten;

    }

    /*
     * Reads.
     */

    public int size() {

        lock.readLock().lock();

        try {

            return statements.size();

        } finally {

            lock.readLock().unlock();

        }

    }

    public boolean contains(final Triple t) {

        if (t == null)
            throw new IllegalArgumentException();

        lock.readLock().lock();

        try {

            return statements.contains(t);

        } finally {

            lock.readLock().unlock();

        }

    }

    public Map<Predicate, Set<Object>> attributesOf(final Resource s) {

        if (s == null)
            throw new IllegalArgumentException();

        lock.readLock().lock();

        try {

            final Map<Predicate, Set<Object>> attrs = ndx_s.get(s);

            if (attrs == null)
                return Collections.emptyMap();

            final Map<Predicate, Set<Object>> copy = new LinkedHashMap<Predicate, Set<Object>>(
                    attrs.size());

            for (Map.Entry<Predicate, Set<Object>> entry : attrs.entrySet()) {

                copy.put(entry.getKey(), Collections
                        .unmodifiableSet(new LinkedHashSet<Object>(entry
                                .getValue())));

            }

            return Collections.unmodifiableMap(copy);

        } finally {

            lock.readLock().unlock();

        }

    }

    public Entity lastAdded() {

        final Entity e;

        lock.readLock().lock();

        try {

            e = lastEntity;

        } finally {

            lock.readLock().unlock();

        }

        if (e == null)
            throw new EmptyStoreException();

        return e;

    }

    public Set<Object> objects(final Resource s, final Predicate p) {

        final UUID sid = termId(s);

        final UUID pid = termId(p);

        lock.readLock().lock();

        try {

            final Set<Object> result = new LinkedHashSet<Object>();

            for (Object o : ndx_sp.lookup(sid, pid)) {

                if (!verifyIndexHits || statements.contains(new Triple(s, p, o)))
                    result.add(o);

            }

            return Collections.unmodifiableSet(result);

        } finally {

            lock.readLock().unlock();

        }

    }

    public Set<Resource> subjects(final Predicate p, final Object o) {

        final UUID pid = termId(p);

        final UUID oid = termId(o);

        lock.readLock().lock();

        try {

            final Set<Resource> result = new LinkedHashSet<Resource>();

            for (Resource s : ndx_po.lookup(pid, oid)) {

                if (!verifyIndexHits || statements.contains(new Triple(s, p, o)))
                    result.add(s);

            }

            return Collections.unmodifiableSet(result);

        } finally {

            lock.readLock().unlock();

        }

    }

    public Set<Predicate> predicates(final Resource s, final Object o) {

        final UUID sid = termId(s);

        final UUID oid = termId(o);

        lock.readLock().lock();

        try {

            final Set<Predicate> result = new LinkedHashSet<Predicate>();

            for (Predicate p : ndx_os.lookup(oid, sid)) {

                if (!verifyIndexHits || statements.contains(new Triple(s, p, o)))
                    result.add(p);

            }

            return Collections.unmodifiableSet(result);

        } finally {

            lock.readLock().unlock();

        }

    }

    /**
     * {@inheritDoc}
     * <p>
     * When two terms are bound the pattern is answered by the index chosen by
     * {@link KeyOrder#getKeyOrder(Object, Object, Object)}. A bound subject
     * alone is answered by the subject index. A bound predicate or object
     * alone is answered by a scan.
     */
    public Set<Triple> match(final Resource s, final Predicate p,
            final Object o) {

        final int nbound = (s == null ? 0 : 1) + (p == null ? 0 : 1)
                + (o == null ? 0 : 1);

        final KeyOrder keyOrder = KeyOrder.getKeyOrder(s, p, o);

        final Set<Triple> result = new LinkedHashSet<Triple>();

        switch (nbound) {

        case 3: {

            final Triple t = new Triple(s, p, o);

            if (contains(t))
                result.add(t);

            break;

        }

        case 2: {

            switch (keyOrder) {
            case SP:
                for (Object x : objects(s, p))
                    result.add(new Triple(s, p, x));
                break;
            case PO:
                for (Resource x : subjects(p, o))
                    result.add(new Triple(x, p, o));
                break;
            case OS:
                for (Predicate x : predicates(s, o))
                    result.add(new Triple(s, x, o));
                break;
            default:
                throw new AssertionError();
            }

            break;

        }

        case 1: {

            lock.readLock().lock();

            try {

                if (keyOrder == KeyOrder.SP) {

                    final Map<Predicate, Set<Object>> attrs = ndx_s.get(s);

                    if (attrs != null) {

                        for (Map.Entry<Predicate, Set<Object>> entry : attrs
                                .entrySet()) {

                            for (Object x : entry.getValue())
                                result.add(new Triple(s, entry.getKey(), x));

                        }

                    }

                } else {

                    for (Triple t : history) {

                        if (keyOrder == KeyOrder.PO ? t.p.equals(p) : t.o
                                .equals(o))
                            result.add(t);

                    }

                }

            } finally {

                lock.readLock().unlock();

            }

            break;

        }

        default: {

            lock.readLock().lock();

            try {

                result.addAll(history);

            } finally {

                lock.readLock().unlock();

            }

        }

        }

        return Collections.unmodifiableSet(result);

    }

    /**
     * Visits the triples in insertion order. The iterator is lazy and
     * weakly consistent: it visits the triples present when it was created
     * and does not see triples added afterwards. It never fails due to
     * concurrent writes.
     */
    public Iterator<Triple> iterator() {

        final int limit;

        lock.readLock().lock();

        try {

            limit = history.size();

        } finally {

            lock.readLock().unlock();

        }

        return new Iterator<Triple>() {

            private int i = 0;

            public boolean hasNext() {

                return i < limit;

            }

            public Triple next() {

                if (!hasNext())
                    throw new NoSuchElementException();

                lock.readLock().lock();

                try {

                    return history.get(i++);

                } finally {

                    lock.readLock().unlock();

                }

            }

            public void remove() {

                throw new UnsupportedOperationException();

            }

        };

    }

    /*
     * Diagnostics.
     */

    /**
     * The statement index for the key order.
     * <p>
     * Note: the index is NOT thread-safe. It must not be used while other
     * threads are writing on the store.
     */
    final public StatementIndex<?> getStatementIndex(final KeyOrder keyOrder) {

        if (keyOrder == null)
            throw new IllegalArgumentException();

        switch (keyOrder) {
        case SP:
            return ndx_sp;
        case PO:
            return ndx_po;
        case OS:
            return ndx_os;
        default:
            throw new AssertionError();
        }

    }

    /**
     * The #of distinct subjects.
     */
    public int getSubjectCount() {

        lock.readLock().lock();

        try {

            return ndx_s.size();

        } finally {

            lock.readLock().unlock();

        }

    }

    /**
     * Writes out some usage details on the indices.
     */
    public void usage(final PrintStream out) {

        lock.readLock().lock();

        try {

            out.println("statements: #entries=" + statements.size());

            for (KeyOrder keyOrder : KeyOrder.values()) {

                final StatementIndex<?> ndx = getStatementIndex(keyOrder);

                out.println(keyOrder.name + ": #keys=" + ndx.getKeyCount()
                        + ", #entries=" + ndx.getEntryCount());

            }

            out.println("subjects: #keys=" + ndx_s.size());

        } finally {

            lock.readLock().unlock();

        }

    }

    public String toString() {

        return getClass().getSimpleName() + "{size=" + size() + "}";

    }

}
