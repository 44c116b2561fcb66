// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.List;

/**
 * A style rule with exactly one selector. A selector list in the source produces one rule per selector, all sharing
 * the same declarations.
 */
public record Rule(Selector selector, List<Declaration> declarations) {
    public Rule {
        declarations = List.copyOf(declarations);
    }
}
