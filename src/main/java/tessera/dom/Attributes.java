// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.dom;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import tessera.util.annotation.Nullable;

/**
 * An ordered, immutable set of attributes with unique names.
 */
public final class Attributes implements Iterable<Attribute> {
    private Attributes(final List<Attribute> attributes) {
        this.attributes = attributes;
    }

    /**
     * Returns the empty attribute set.
     */
    public static Attributes empty() {
        return emptyAttributes;
    }

    /**
     * Returns an attribute set containing the given attributes in order.
     * <p>
     * Attributes whose name duplicates an earlier one are dropped, so the first occurrence wins.
     */
    public static Attributes of(final Iterable<Attribute> attributes) {
        final var result = new ArrayList<Attribute>();
        for (final var attribute : attributes) {
            if (find(result, attribute.name()) == null) {
                result.add(attribute);
            }
        }
        return result.isEmpty() ? emptyAttributes : new Attributes(List.copyOf(result));
    }

    /**
     * Returns the value of the attribute with the given name, if present.
     */
    @CheckReturnValue
    public Optional<String> get(final String name) {
        final var attribute = find(attributes, name);
        return (attribute == null) ? Optional.empty() : Optional.of(attribute.value());
    }

    /**
     * Returns the whitespace-separated tokens of the {@code class} attribute.
     */
    public List<String> classes() {
        final var value = get("class").orElse("").strip();
        return value.isEmpty() ? List.of() : List.of(value.split("[\\t\\n\\f\\r ]+"));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public int size() {
        return attributes.size();
    }

    @Override
    public Iterator<Attribute> iterator() {
        return attributes.iterator();
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return other instanceof Attributes that && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }

    private static @Nullable Attribute find(final List<Attribute> attributes, final String name) {
        for (final var attribute : attributes) {
            if (attribute.name().equals(name)) {
                return attribute;
            }
        }
        return null;
    }

    private final List<Attribute> attributes;

    private static final Attributes emptyAttributes = new Attributes(List.of());
}
