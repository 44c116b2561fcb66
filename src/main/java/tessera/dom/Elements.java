// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.dom;

import java.util.Set;

/**
 * Content-model facts about HTML elements shared by the parser and the serializer.
 */
public final class Elements {
    private Elements() {
    }

    /**
     * Returns whether the element with the given tag name can never have children.
     */
    public static boolean isVoid(final String tagName) {
        return voidElements.contains(tagName);
    }

    /**
     * Returns whether the content of the element with the given tag name is raw text, without markup or references.
     */
    public static boolean isRawText(final String tagName) {
        return rawTextElements.contains(tagName);
    }

    private static final Set<String> voidElements = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source", "track", "wbr"
    );
    private static final Set<String> rawTextElements = Set.of("script", "style");
}
