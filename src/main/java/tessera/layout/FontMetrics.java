// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

/**
 * The text measurement capability layout depends on.
 * <p>
 * Implementations must be deterministic, returning equal measurements for equal arguments, and safe to call from any
 * thread.
 */
@FunctionalInterface
public interface FontMetrics {
    Measurement measure(FontSpec font, String text);
}
