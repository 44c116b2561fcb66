// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

/**
 * Where a stylesheet came from.
 */
public enum Origin {
    /**
     * The bundled default stylesheet.
     */
    USER_AGENT,
    /**
     * Stylesheets of the document, from {@code <style>} elements and {@code <link rel="stylesheet">}.
     */
    AUTHOR,
}
