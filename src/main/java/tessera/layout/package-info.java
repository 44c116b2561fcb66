// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Layout: turns a styled document into a {@link tessera.layout.BoxTree} with absolute geometry, breaking inline
 * content into lines with script-aware segmentation.
 */
@NonNullByDefault
package tessera.layout;

import tessera.util.annotation.NonNullByDefault;
