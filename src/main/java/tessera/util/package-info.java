// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small shared utilities: operation traces, sneaky throws and concurrent collection helpers.
 */
@NonNullByDefault
package tessera.util;

import tessera.util.annotation.NonNullByDefault;
