// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.dom;

/**
 * An element attribute. The name is ASCII-lowercase; the value has entity references decoded already.
 */
public record Attribute(String name, String value) {
}
