/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

import java.net.URI;
import java.util.List;

/**
 * Thrown when a redirect chain without any repeated URI exceeded the configured number of hops.
 */
public final class TooManyRedirectsException extends RelayHttpException {
    private final int hops;
    private final @NonNull List<@NonNull URI> visited;

    public TooManyRedirectsException(final int hops, final @NonNull List<@NonNull URI> visited) {
        super("Too many redirects (" + hops + "): " + visited);
        this.hops = hops;
        this.visited = List.copyOf(visited);
    }

    /**
     * @return the number of redirects that were followed before giving up.
     */
    public int getHops() {
        return hops;
    }

    /**
     * @return the URIs requested by the failed logical request, the original URI first.
     */
    public @NonNull List<@NonNull URI> getVisited() {
        return visited;
    }
}
