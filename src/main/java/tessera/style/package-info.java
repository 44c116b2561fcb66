// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Selector matching, the cascade and inheritance, producing a {@link tessera.style.ComputedStyle} for every element.
 */
@NonNullByDefault
package tessera.style;

import tessera.util.annotation.NonNullByDefault;
