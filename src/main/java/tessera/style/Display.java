// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

public enum Display {
    BLOCK,
    INLINE,
    NONE,
}
