// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.List;

/**
 * An ordered list of rules from one source.
 */
public record Stylesheet(Origin origin, List<Rule> rules) {
    public Stylesheet {
        rules = List.copyOf(rules);
    }

    public static Stylesheet empty(final Origin origin) {
        return new Stylesheet(origin, List.of());
    }
}
