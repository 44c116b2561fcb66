// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The document tree: an arena of nodes addressed by integer ids.
 */
@NonNullByDefault
package tessera.dom;

import tessera.util.annotation.NonNullByDefault;
