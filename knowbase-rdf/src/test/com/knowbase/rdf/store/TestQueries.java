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
 * Created on Oct 11, 2026
 */

package com.knowbase.rdf.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.knowbase.rdf.model.Entity;
import com.knowbase.rdf.model.Predicate;
import com.knowbase.rdf.model.Resource;
import com.knowbase.rdf.model.Triple;
import com.knowbase.rdf.query.AmbiguousResultException;
import com.knowbase.rdf.query.EmptyQueryException;
import com.knowbase.rdf.query.NoResultException;

/**
 * Test suite for the queries and the batch writes exposed by the
 * {@link ITripleStore}.
 *
 * @version $Id$
 */
public class TestQueries extends AbstractTripleStoreTestCase {

    public TestQueries() {
    }

    public TestQueries(String name) {
        super(name);
    }

    final Predicate name = new Predicate("name");

    final Predicate color = new Predicate("color");

    final Predicate has = new Predicate("has");

    final Predicate destroyed = new Predicate("destroyed");

    static Set<Object> asSet(Object... a) {

        return new HashSet<Object>(Arrays.asList(a));

    }

    public void test_getAll_get_getWhich() {

        final Entity apple = new Entity("apple");
        final Entity cherry = new Entity("cherry");
        final Entity lime = new Entity("lime");

        store.add(apple, color, "red");
        store.add(apple, name, "apple");
        store.add(cherry, color, "red");
        store.add(cherry, name, "cherry");
        store.add(lime, color, "green");

        assertEquals(asSet(apple, cherry), store.getWhich(color, "red"));

        final Map<Predicate, Object> filter = new LinkedHashMap<Predicate, Object>();

        filter.put(color, "red");

        assertEquals(asSet(apple, cherry), store.getAll(filter));

        filter.put(name, "cherry");

        assertEquals(asSet(cherry), store.getAll(filter));
        assertSame(cherry, store.get(filter));

        filter.put(name, "lime");

        assertTrue(store.getAll(filter).isEmpty());

        // unknown terms match nothing.
        assertTrue(store.getWhich(new Predicate("weight"), "red").isEmpty());
        assertTrue(store.getWhich(color, Integer.valueOf(7)).isEmpty());

    }

    public void test_get_correctRejection() {

        final Entity a = new Entity();
        final Entity b = new Entity();

        store.add(a, color, "red");
        store.add(b, color, "red");

        try {
            store.get(Collections.singletonMap(color, "red"));
            fail("Expecting: " + AmbiguousResultException.class);
        } catch (AmbiguousResultException ex) {
            assertEquals(2, ex.getCount());
            assertEquals(Collections.singletonMap(color, "red"), ex
                    .getFilter());
        }

        try {
            store.get(Collections.singletonMap(color, "blue"));
            fail("Expecting: " + NoResultException.class);
        } catch (NoResultException ex) {
            assertEquals(Collections.singletonMap(color, "blue"), ex
                    .getFilter());
        }

        try {
            store.getAll(new LinkedHashMap<Predicate, Object>());
            fail("Expecting: " + EmptyQueryException.class);
        } catch (EmptyQueryException ex) {
            // expected.
        }

        try {
            store.get(Collections.<Predicate, Object> emptyMap());
            fail("Expecting: " + EmptyQueryException.class);
        } catch (EmptyQueryException ex) {
            // expected.
        }

        try {
            store.getAll(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // expected.
        }

    }

    /**
     * getAll({p1:o1, p2:o2}) is the intersection of getWhich(p1, o1) and
     * getWhich(p2, o2).
     */
    public void test_setAlgebraEquivalence() {

        final Random r = new Random(17);

        final Predicate[] preds = new Predicate[] { name, color, has };

        final Object[] objs = new Object[] { "a", "b", "c", Integer.valueOf(1),
                Boolean.TRUE };

        final List<Entity> subjects = new ArrayList<Entity>();

        for (int i = 0; i < 50; i++)
            subjects.add(new Entity());

        for (int i = 0; i < 400; i++) {

            store.add(subjects.get(r.nextInt(subjects.size())), preds[r
                    .nextInt(preds.length)], objs[r.nextInt(objs.length)]);

        }

        for (Predicate p1 : preds) {

            for (Predicate p2 : preds) {

                if (p1 == p2)
                    continue;

                for (Object o1 : objs) {

                    for (Object o2 : objs) {

                        final Map<Predicate, Object> filter = new LinkedHashMap<Predicate, Object>();

                        filter.put(p1, o1);
                        filter.put(p2, o2);

                        final Set<Resource> expected = new HashSet<Resource>(
                                store.getWhich(p1, o1));

                        expected.retainAll(store.getWhich(p2, o2));

                        assertEquals(filter.toString(), expected, store
                                .getAll(filter));

                    }

                }

            }

        }

    }

    public void test_twoBound() {

        final Entity a = new Entity("a");
        final Entity b = new Entity("b");

        store.add(a, has, b);
        store.add(a, has, "x");
        store.add(a, name, "a");
        store.add(b, has, "x");
        store.add(a, destroyed, b);

        assertEquals(asSet(b, "x"), store.objects(a, has));
        assertEquals(asSet("x"), store.objects(b, has));
        assertTrue(store.objects(b, name).isEmpty());

        assertEquals(asSet(a, b), store.subjects(has, "x"));
        assertEquals(asSet(a), store.subjects(has, b));

        assertEquals(asSet(has, destroyed), store.predicates(a, b));
        assertEquals(asSet(has), store.predicates(b, "x"));
        assertTrue(store.predicates(b, a).isEmpty());

        // read-only.
        try {
            store.objects(a, has).clear();
            fail("Expecting: " + UnsupportedOperationException.class);
        } catch (UnsupportedOperationException ex) {
            // expected.
        }

        try {
            store.objects(null, has);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // expected.
        }

        try {
            store.subjects(has, new Object());
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // expected.
        }

    }

    /**
     * Each binding of the pattern gives the same answer as a scan of all the
     * triples.
     */
    public void test_match() {

        final Random r = new Random(23);

        final Predicate[] preds = new Predicate[] { name, color, has };

        final List<Entity> subjects = new ArrayList<Entity>();

        for (int i = 0; i < 10; i++)
            subjects.add(new Entity());

        final List<Object> objs = new ArrayList<Object>(subjects);

        objs.add("a");
        objs.add(Integer.valueOf(2));

        for (int i = 0; i < 150; i++) {

            store.add(subjects.get(r.nextInt(subjects.size())), preds[r
                    .nextInt(preds.length)], objs.get(r.nextInt(objs.size())));

        }

        final List<Triple> all = new ArrayList<Triple>();

        for (Triple t : store)
            all.add(t);

        assertEquals(new HashSet<Triple>(all), store.match(null, null, null));

        for (int i = 0; i < 200; i++) {

            final Resource s = r.nextBoolean() ? subjects.get(r
                    .nextInt(subjects.size())) : null;

            final Predicate p = r.nextBoolean() ? preds[r.nextInt(preds.length)]
                    : null;

            final Object o = r.nextBoolean() ? objs.get(r.nextInt(objs.size()))
                    : null;

            final Set<Triple> expected = new HashSet<Triple>();

            for (Triple t : all) {

                if ((s == null || s.equals(t.s)) && (p == null || p.equals(t.p))
                        && (o == null || o.equals(t.o)))
                    expected.add(t);

            }

            assertEquals("(" + s + "," + p + "," + o + ")", expected, store
                    .match(s, p, o));

            assertEquals(expected, store.query(s, p, o).evaluate());

        }

    }

    public void test_createSubjectsWith() {

        final Map<Predicate, List<?>> columns = new LinkedHashMap<Predicate, List<?>>();

        columns.put(name, Arrays.asList("x", "y", "z"));
        columns.put(color, Arrays.asList("red"));
        columns.put(has, Arrays.asList(Integer.valueOf(1), Integer.valueOf(2),
                Integer.valueOf(3)));

        final List<Entity> rows = store.createSubjectsWith(columns);

        assertEquals(3, rows.size());
        assertEquals(9, store.size());
        assertEquals(3, new HashSet<Entity>(rows).size());

        for (int i = 0; i < 3; i++) {

            final Entity e = rows.get(i);

            assertEquals(asSet(columns.get(name).get(i)), store.attributesOf(e)
                    .get(name));
            assertEquals(asSet("red"), store.attributesOf(e).get(color));
            assertEquals(asSet(Integer.valueOf(i + 1)), store.attributesOf(e)
                    .get(has));

        }

        assertSame(rows.get(2), store.lastAdded());

        assertEquals(new HashSet<Resource>(rows), store.getWhich(color, "red"));

        assertIndicesConsistent(store);

    }

    public void test_createSubjectsWith_correctRejection() {

        final Map<Predicate, List<?>> columns = new LinkedHashMap<Predicate, List<?>>();

        try {
            store.createSubjectsWith(columns);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // expected.
        }

        columns.put(name, Collections.emptyList());

        try {
            store.createSubjectsWith(columns);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // expected.
        }

        columns.put(name, Arrays.asList("a", "b", "c"));
        columns.put(color, Arrays.asList("red", "blue"));

        try {
            store.createSubjectsWith(columns);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // expected.
        }

        assertEquals(0, store.size());

    }

    public void test_addAll() {

        final Entity a = new Entity("a");
        final Entity b = new Entity("b");

        final List<Triple> triples = store.addAll(Arrays.asList(a, b), Arrays
                .asList("x", "y", "z"), has);

        assertEquals(6, triples.size());
        assertEquals(6, store.size());

        assertEquals(asSet("x", "y", "z"), store.objects(a, has));
        assertEquals(asSet("x", "y", "z"), store.objects(b, has));
        assertEquals(asSet(a, b), store.subjects(has, "y"));

        // nothing to do.
        assertTrue(store.addAll(Arrays.asList(a), Collections.emptyList(), has)
                .isEmpty());

        assertEquals(6, store.size());

    }

    public void test_setAll() {

        final Entity a = new Entity("a");

        store.add(a, name, "a");
        store.add(a, has, "x");
        store.add(a, has, "y");

        final Entity b = new Entity();
        final Entity c = new Entity();

        final List<Triple> triples = store.setAll(Arrays.asList(b, c), store
                .attributesOf(a));

        assertEquals(6, triples.size());
        assertEquals(9, store.size());

        assertEquals(store.attributesOf(a), store.attributesOf(b));
        assertEquals(store.attributesOf(a), store.attributesOf(c));

        assertSame(c, store.lastAdded());

    }

    /**
     * Create an entity from a mapping, look it up by its attributes and copy its
     * attributes onto a second entity.
     */
    public void test_endToEnd() {

        final Entity e = store.createSubjectsWith(
                Collections.singletonMap(name, Arrays.asList("head"))).get(0);

        final Map<Predicate, Set<Object>> expected = Collections.singletonMap(
                name, asSet("head"));

        assertEquals(expected, store.attributesOf(e));

        assertSame(e, store.get(Collections.singletonMap(name, "head")));

        final Entity e2 = new Entity();

        store.setAll(Arrays.asList(e2), store.attributesOf(e));

        assertSame(e2, store.lastAdded());

        assertSameTriples(new HashSet<Triple>(Arrays.asList(new Triple(e, name,
                "head"), new Triple(e2, name, "head"))), store.iterator());

    }

    /**
     * A fact about a fact.
     */
    public void test_reification() {

        final Entity hand = new Entity("hand");
        final Entity ring = new Entity("ring");

        store.add(hand, has, ring);

        final Triple fact = new Triple(hand, has, ring);

        store.add(fact, destroyed, Boolean.TRUE);

        assertTrue(store.contains(new Triple(hand, has, ring)));
        assertTrue(store.contains(fact, destroyed, Boolean.TRUE));

        assertEquals(asSet(Boolean.TRUE), store.objects(fact, destroyed));
        assertEquals(asSet(fact), store.getWhich(destroyed, Boolean.TRUE));
        assertEquals(asSet(destroyed), store.predicates(fact, Boolean.TRUE));
        assertEquals(asSet(Boolean.TRUE), store.attributesOf(fact).get(
                destroyed));

        assertEquals(asSet(new Triple(fact, destroyed, Boolean.TRUE)), store
                .match(fact, null, null));

        assertSame(hand, store.lastAdded());

        assertIndicesConsistent(store);

    }

    /**
     * A reified subject must already be in the store, or earlier in the same
     * batch.
     */
    public void test_reification_unknownSubject() {

        final Entity hand = new Entity("hand");
        final Entity ring = new Entity("ring");

        final Triple fact = new Triple(hand, has, ring);

        try {
            store.add(fact, destroyed, Boolean.TRUE);
            fail("Expecting: " + UnknownSubjectException.class);
        } catch (UnknownSubjectException ex) {
            assertEquals(fact, ex.getSubject());
        }

        assertEquals(0, store.size());

        // the fact about the fact comes first, so nothing is applied.
        try {
            store.addStatements(Arrays.asList(new Triple(fact, destroyed,
                    Boolean.TRUE), fact));
            fail("Expecting: " + UnknownSubjectException.class);
        } catch (UnknownSubjectException ex) {
            // expected.
        }

        assertEquals(0, store.size());

        assertEquals(2, store.addStatements(Arrays.asList(fact, new Triple(
                fact, destroyed, Boolean.TRUE))));

        assertTrue(store.contains(fact, destroyed, Boolean.TRUE));

    }

}
