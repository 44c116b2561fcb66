// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import tessera.css.Selector;
import tessera.dom.Document;
import tessera.util.UnreachableCodeReachedError;

/**
 * Matches selectors against elements, right to left: the subject must match the candidate element itself before any
 * combinator walks to its ancestors or preceding siblings.
 */
public final class SelectorMatcher {
    private SelectorMatcher() {
    }

    /**
     * Returns whether the given selector matches the element with the given id.
     */
    public static boolean matches(final Document document, final int element, final Selector selector) {
        if (element == Document.NONE || !document.isElement(element)) {
            return false;
        }
        if (selector instanceof Selector.Universal) {
            return true;
        } else if (selector instanceof Selector.Tag tag) {
            return document.element(element).hasTagName(tag.name());
        } else if (selector instanceof Selector.Class className) {
            return document.element(element).attributes().classes().contains(className.name());
        } else if (selector instanceof Selector.Id id) {
            return document.element(element).attributes().get("id").map(id.name()::equals).orElse(false);
        } else if (selector instanceof Selector.Compound compound) {
            for (final var part : compound.parts()) {
                if (!matches(document, element, part)) {
                    return false;
                }
            }
            return true;
        } else if (selector instanceof Selector.Descendant descendant) {
            if (!matches(document, element, descendant.subject())) {
                return false;
            }
            for (var ancestor = document.parentElement(element);
                 ancestor != Document.NONE;
                 ancestor = document.parentElement(ancestor)) {
                if (matches(document, ancestor, descendant.ancestor())) {
                    return true;
                }
            }
            return false;
        } else if (selector instanceof Selector.Child child) {
            return matches(document, element, child.subject())
                && matches(document, document.parentElement(element), child.parent());
        } else if (selector instanceof Selector.NextSibling sibling) {
            return matches(document, element, sibling.subject())
                && matches(document, document.previousElementSibling(element), sibling.previous());
        } else if (selector instanceof Selector.SubsequentSibling sibling) {
            if (!matches(document, element, sibling.subject())) {
                return false;
            }
            for (var previous = document.previousElementSibling(element);
                 previous != Document.NONE;
                 previous = document.previousElementSibling(previous)) {
                if (matches(document, previous, sibling.previous())) {
                    return true;
                }
            }
            return false;
        }
        throw new UnreachableCodeReachedError("Unknown selector type: " + selector);
    }
}
