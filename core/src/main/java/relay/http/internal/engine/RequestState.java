/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.Metadata;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The mutable state of one logical request. It is confined to the thread that runs this request, and discarded once
 * the request reached its terminal outcome.
 */
final class RequestState {
    private final @NonNull List<@NonNull URI> visited = new ArrayList<>();
    private final @NonNull List<@NonNull Metadata> metadata = new ArrayList<>();
    final int maxHops;
    final int maxRetries;
    // the first attempt occupies the first retry slot
    private int retries = 1;

    RequestState(final @NonNull URI uri, final int maxHops, final int maxRetries) {
        assert uri != null;
        assert maxHops >= 1;
        assert maxRetries >= 1;

        visited.add(uri);
        this.maxHops = maxHops;
        this.maxRetries = maxRetries;
    }

    /**
     * Appends {@code target} to the visited URIs.
     *
     * @return true if {@code target} had already been visited by this request.
     */
    boolean visit(final @NonNull URI target) {
        assert target != null;

        final var seen = visited.contains(target);
        visited.add(target);
        return seen;
    }

    /**
     * @return the number of redirects taken so far.
     */
    int hops() {
        return visited.size() - 1;
    }

    boolean hopLimitExceeded() {
        return visited.size() > maxHops;
    }

    @NonNull
    List<@NonNull URI> visited() {
        return List.copyOf(visited);
    }

    /**
     * Counts one more failure.
     *
     * @return true if the retry limit still allows another attempt.
     */
    boolean failed() {
        retries++;
        return retries < maxRetries;
    }

    int retries() {
        return retries;
    }

    void record(final @NonNull Metadata attempt) {
        assert attempt != null;
        metadata.add(attempt);
    }

    @Nullable
    Metadata lastMetadata() {
        return metadata.isEmpty() ? null : metadata.get(metadata.size() - 1);
    }

    /**
     * @return the metadata of every attempt, the most recent first.
     */
    @NonNull
    List<@NonNull Metadata> newestFirst() {
        final var result = new ArrayList<>(metadata);
        Collections.reverse(result);
        return List.copyOf(result);
    }
}
