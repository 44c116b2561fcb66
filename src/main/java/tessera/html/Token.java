// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.html;

import tessera.dom.Attributes;

/**
 * A token produced by the {@link Lexer}.
 */
public sealed interface Token {
    record StartTag(String name, Attributes attributes, boolean selfClosing) implements Token {
    }

    record EndTag(String name) implements Token {
    }

    record Text(String content) implements Token {
    }

    record Comment(String content) implements Token {
    }

    /**
     * The last token of every token stream.
     */
    record EndOfFile() implements Token {
    }
}
