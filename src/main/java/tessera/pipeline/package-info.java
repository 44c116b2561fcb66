// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The pipeline orchestrator: fetches resources and runs parsing, style resolution and layout off the interactive
 * thread, publishing complete frames atomically.
 */
@NonNullByDefault
package tessera.pipeline;

import tessera.util.annotation.NonNullByDefault;
