/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

import java.net.URI;
import java.util.Objects;

/**
 * Thrown when a logical request ends with a 4xx or 5xx status that the caller did not designate as its failure code.
 * The response body is kept, truncated, so that the error can be logged without another round trip.
 */
public final class HttpStatusException extends RelayHttpException {
    private final int status;
    private final @NonNull String content;
    private final @NonNull URI finalUri;

    public HttpStatusException(final int status, final @NonNull String content, final @NonNull URI finalUri) {
        super("HTTP status " + status + " for " + finalUri + (content.isEmpty() ? "" : ": " + content));
        this.status = status;
        this.content = content;
        this.finalUri = Objects.requireNonNull(finalUri);
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return at most the first 1000 characters of the response body.
     */
    public @NonNull String getContent() {
        return content;
    }

    public @NonNull URI getFinalUri() {
        return finalUri;
    }
}
