/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

import java.net.URI;
import java.util.Objects;

/**
 * Thrown when a server answers with a status code the engine cannot act upon: a code outside 100..599, an
 * informational code, or a redirect without a {@code Location} header.
 * <p>
 * The last case includes {@code 304 Not Modified}: conditional requests are left to the caller, who may send
 * {@code If-None-Match} or {@code If-Modified-Since} but then has to expect this exception for an unchanged resource.
 */
public final class UnrecognizedStatusException extends RelayHttpException {
    private final int status;
    private final @NonNull URI uri;

    public UnrecognizedStatusException(final int status, final @NonNull URI uri, final @NonNull String reason) {
        super("Unrecognized HTTP status " + status + " (" + reason + ") for " + uri);
        this.status = status;
        this.uri = Objects.requireNonNull(uri);
    }

    public int getStatus() {
        return status;
    }

    public @NonNull URI getUri() {
        return uri;
    }
}
