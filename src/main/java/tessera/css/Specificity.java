// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.Comparator;
import tessera.util.UnreachableCodeReachedError;

/**
 * Selector specificity: the counts of id, class and tag selectors, compared lexicographically.
 */
public record Specificity(int ids, int classes, int tags) implements Comparable<Specificity> {
    /**
     * Computes the specificity of the given selector.
     */
    public static Specificity of(final Selector selector) {
        if (selector instanceof Selector.Universal) {
            return zero;
        } else if (selector instanceof Selector.Tag) {
            return new Specificity(0, 0, 1);
        } else if (selector instanceof Selector.Class) {
            return new Specificity(0, 1, 0);
        } else if (selector instanceof Selector.Id) {
            return new Specificity(1, 0, 0);
        } else if (selector instanceof Selector.Compound compound) {
            var result = zero;
            for (final var part : compound.parts()) {
                result = result.plus(of(part));
            }
            return result;
        } else if (selector instanceof Selector.Descendant descendant) {
            return of(descendant.ancestor()).plus(of(descendant.subject()));
        } else if (selector instanceof Selector.Child child) {
            return of(child.parent()).plus(of(child.subject()));
        } else if (selector instanceof Selector.NextSibling sibling) {
            return of(sibling.previous()).plus(of(sibling.subject()));
        } else if (selector instanceof Selector.SubsequentSibling sibling) {
            return of(sibling.previous()).plus(of(sibling.subject()));
        }
        throw new UnreachableCodeReachedError("Unknown selector type: " + selector);
    }

    public Specificity plus(final Specificity other) {
        return new Specificity(ids + other.ids, classes + other.classes, tags + other.tags);
    }

    @Override
    public int compareTo(final Specificity other) {
        return comparator.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + ids + "," + classes + "," + tags + ")";
    }

    public static final Specificity zero = new Specificity(0, 0, 0);

    private static final Comparator<Specificity> comparator = Comparator.comparingInt(Specificity::ids)
        .thenComparingInt(Specificity::classes)
        .thenComparingInt(Specificity::tags);
}
