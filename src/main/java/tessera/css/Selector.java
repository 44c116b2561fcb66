// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.List;

/**
 * A parsed selector.
 * <p>
 * Simple selectors test a single element. {@link Compound} requires all of its parts to match the same element.
 * Combinators relate the subject, always a simple or compound selector, to another element found by walking the tree.
 * They nest to the left, so {@code a b > c} is {@code Child(Descendant(a, b), c)}.
 */
public sealed interface Selector {
    /**
     * Returns the specificity of this selector.
     */
    default Specificity specificity() {
        return Specificity.of(this);
    }

    record Universal() implements Selector {
        @Override
        public String toString() {
            return "*";
        }
    }

    /**
     * Matches elements by tag name. The name is ASCII-lowercase.
     */
    record Tag(String name) implements Selector {
        @Override
        public String toString() {
            return name;
        }
    }

    record Class(String name) implements Selector {
        @Override
        public String toString() {
            return "." + name;
        }
    }

    record Id(String name) implements Selector {
        @Override
        public String toString() {
            return "#" + name;
        }
    }

    /**
     * Two or more simple selectors that must all match the same element.
     */
    record Compound(List<Selector> parts) implements Selector {
        public Compound {
            parts = List.copyOf(parts);
        }

        @Override
        public String toString() {
            final var builder = new StringBuilder();
            for (final var part : parts) {
                builder.append(part);
            }
            return builder.toString();
        }
    }

    record Descendant(Selector ancestor, Selector subject) implements Selector {
        @Override
        public String toString() {
            return ancestor + " " + subject;
        }
    }

    record Child(Selector parent, Selector subject) implements Selector {
        @Override
        public String toString() {
            return parent + " > " + subject;
        }
    }

    record NextSibling(Selector previous, Selector subject) implements Selector {
        @Override
        public String toString() {
            return previous + " + " + subject;
        }
    }

    record SubsequentSibling(Selector previous, Selector subject) implements Selector {
        @Override
        public String toString() {
            return previous + " ~ " + subject;
        }
    }
}
