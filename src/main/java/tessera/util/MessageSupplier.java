// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util;

/**
 * A lazily evaluated {@link Trace} message.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
