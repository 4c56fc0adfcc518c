/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

import java.net.URI;
import java.util.Objects;

/**
 * Thrown by the pagination driver when a page advertises itself as its own {@code rel="next"} page.
 */
public final class CyclicLinkHeaderException extends RelayHttpException {
    private final @NonNull URI uri;

    public CyclicLinkHeaderException(final @NonNull URI uri) {
        super("Cyclic Link header: " + uri);
        this.uri = Objects.requireNonNull(uri);
    }

    public @NonNull URI getUri() {
        return uri;
    }
}
