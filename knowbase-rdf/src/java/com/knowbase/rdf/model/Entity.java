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
import java.util.regex.Pattern;

/**
 * A thing in the world: a node which may be the subject or the object of a
 * {@link Triple}. An entity has a 128-bit identifier, an optional name and an
 * optional url. Identity (equality and hash code) is the identifier alone.
 *
 * @version $Id$
 */
public final class Entity implements Resource, ITerm {

    /**
     * The canonical 8-4-4-4-12 hex form.
     */
    private static final Pattern CANONICAL = Pattern
            .compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    /**
     * The bare 32 hex digit form.
     */
    private static final Pattern HEX32 = Pattern.compile("[0-9a-fA-F]{32}");

    private final UUID id;

    private final String name;

    private final String url;

    /**
     * An anonymous entity with a fresh random identifier.
     */
    public Entity() {

        this(null, (UUID) null, null);

    }

    /**
     * A named entity with a fresh random identifier.
     *
     * @param name
     *            The name (optional).
     */
    public Entity(final String name) {

        this(name, (UUID) null, null);

    }

    /**
     * @param name
     *            The name (optional). When given it must be an identifier:
     *            letters, digits and underscores, not starting with a digit.
     * @param id
     *            The identifier (optional). A fresh random identifier is
     *            assigned when <code>null</code>.
     * @param url
     *            The url (optional).
     *
     * @throws IllegalArgumentException
     *             if the name is not an identifier.
     */
    public Entity(final String name, final UUID id, final String url) {

        if (name != null && !isIdentifier(name))
            throw new IllegalArgumentException("Not an identifier: '" + name
                    + "'");

        this.name = name;

        this.id = id == null ? UUID.randomUUID() : id;

        this.url = url;

    }

    /**
     * Create an entity from an identifier given in its string form.
     *
     * @param name
     *            The name (optional).
     * @param id
     *            The identifier (optional) as either 32 hex digits or the
     *            canonical 8-4-4-4-12 form.
     * @param url
     *            The url (optional).
     *
     * @throws InvalidIdentifierException
     *             if the identifier is not well-formed.
     */
    public static Entity valueOf(final String name, final String id,
            final String url) {

        return new Entity(name, id == null ? null : parseId(id), url);

    }

    /**
     * Parse a 128-bit identifier.
     *
     * @param id
     *            Either 32 hex digits or the canonical 8-4-4-4-12 form.
     *
     * @throws InvalidIdentifierException
     *             if the identifier is not well-formed.
     */
    public static UUID parseId(final String id) {

        if (id == null)
            throw new IllegalArgumentException();

        if (CANONICAL.matcher(id).matches()) {

            return UUID.fromString(id);

        }

        if (HEX32.matcher(id).matches()) {

            return new UUID(Long.parseUnsignedLong(id.substring(0, 16), 16),
                    Long.parseUnsignedLong(id.substring(16), 16));

        }

        throw new InvalidIdentifierException(id);

    }

    /**
     * True iff the string is non-empty, starts with a letter or an underscore
     * and otherwise contains only letters, digits and underscores.
     */
    static boolean isIdentifier(final String s) {

        if (s.length() == 0)
            return false;

        final char c0 = s.charAt(0);

        if (!Character.isLetter(c0) && c0 != '_')
            return false;

        for (int i = 1; i < s.length(); i++) {

            final char c = s.charAt(i);

            if (!Character.isLetterOrDigit(c) && c != '_')
                return false;

        }

        return true;

    }

    public UUID getId() {

        return id;

    }

    /**
     * The name or <code>null</code> if the entity is anonymous.
     */
    public String getName() {

        return name;

    }

    /**
     * The url or <code>null</code>.
     */
    public String getUrl() {

        return url;

    }

    public boolean isAnonymous() {

        return name == null;

    }

    public int hashCode() {

        return id.hashCode();

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof Entity))
            return false;

        return id.equals(((Entity) o).id);

    }

    /**
     * The name, or for an anonymous entity an underscore followed by the first
     * five characters of the identifier.
     */
    public String toString() {

        if (name != null)
            return name;

        return "_" + id.toString().substring(0, 5);

    }

    /**
     * A developer representation from which the entity may be reconstructed,
     * e.g., <code>Entity(name='head', id='...')</code>. Absent parts are
     * omitted.
     */
    public String toRepr() {

        final StringBuilder sb = new StringBuilder("Entity(");

        if (name != null)
            sb.append("name='").append(name).append("', ");

        sb.append("id='").append(id).append("'");

        if (url != null)
            sb.append(", url='").append(url).append("'");

        return sb.append(")").toString();

    }

}
