// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.net.URI;
import java.util.List;
import tessera.util.condition.Condition;

/**
 * Describes a navigation abandoned because of a fatal condition.
 *
 * @param url        The URL of the document.
 * @param generation The generation of the failed request.
 * @param condition  The fatal condition.
 * @param traces     The operation trace active when the condition was signaled, innermost first.
 */
public record NavigationFailure(URI url, long generation, Condition condition, List<String> traces) {
    public NavigationFailure {
        traces = List.copyOf(traces);
    }
}
