// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.net.URI;

/**
 * A request to load and render a document, as passed to the navigator's worker.
 *
 * @param url        The URL of the document.
 * @param generation The generation of the request. Later requests have higher generations.
 */
public record NavigationRequest(URI url, long generation) {
}
