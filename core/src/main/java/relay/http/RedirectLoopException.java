/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

import java.net.URI;
import java.util.List;

/**
 * Thrown when a redirect chain reached the hop limit and its last target had already been visited within the same
 * logical request.
 */
public final class RedirectLoopException extends RelayHttpException {
    private final @NonNull List<@NonNull URI> visited;

    public RedirectLoopException(final @NonNull List<@NonNull URI> visited) {
        super("Redirect loop: " + visited);
        this.visited = List.copyOf(visited);
    }

    /**
     * @return the URIs requested by the failed logical request, the original URI first.
     */
    public @NonNull List<@NonNull URI> getVisited() {
        return visited;
    }
}
