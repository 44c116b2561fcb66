// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Painting: flattens a box tree into a {@link tessera.paint.DisplayList} for the presentation layer.
 */
@NonNullByDefault
package tessera.paint;

import tessera.util.annotation.NonNullByDefault;
