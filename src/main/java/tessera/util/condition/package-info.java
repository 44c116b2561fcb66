// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system used for every diagnostic the pipeline produces.
 * <p>
 * Recoverable problems, such as malformed markup, are signaled as non-fatal conditions and processing continues.
 * Problems that stop a navigation are signaled as fatal conditions, and a handler unwinds to a restart.
 */
@NonNullByDefault
package tessera.util.condition;

import tessera.util.annotation.NonNullByDefault;
