// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

/**
 * The stage the navigator's worker is in.
 */
public enum Status {
    /**
     * Nothing has been requested yet.
     */
    IDLE,
    /**
     * Fetching the document.
     */
    LOAD,
    PARSE,
    /**
     * Fetching stylesheets and resolving styles.
     */
    STYLE,
    LAYOUT,
    /**
     * The latest request was published.
     */
    DONE,
    /**
     * The latest navigation was abandoned after a fatal condition.
     */
    FAILED,
}
