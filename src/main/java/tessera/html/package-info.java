// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Permissive HTML parsing: a lexer producing tokens and a tree constructor building a {@link tessera.dom.Document}.
 * <p>
 * Neither stage ever fails. Malformed markup is recovered from and reported as {@link HtmlParseErrorCondition}.
 */
@NonNullByDefault
package tessera.html;

import tessera.util.annotation.NonNullByDefault;
