// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * CSS syntax: tokenization, selectors and rule parsing.
 * <p>
 * This package only knows CSS syntax. What properties mean, and whether their values are valid, is decided by
 * {@code tessera.style}.
 */
@NonNullByDefault
package tessera.css;

import tessera.util.annotation.NonNullByDefault;
