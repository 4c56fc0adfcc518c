/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import relay.http.internal.RealMetadata;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * The description of one physical attempt of a logical request: the URI that was actually requested, and what the
 * server answered. A logical request that followed redirects or retried a failure has several of them, see
 * {@link Outcome#getMetadata()}.
 * <p>
 * Instances of this class are immutable.
 */
public sealed interface Metadata permits RealMetadata {
    /**
     * @return the URI requested by this attempt, after the resolution of any prior redirect.
     */
    @NonNull
    URI getUri();

    /**
     * @return the HTTP status code, in [100..599] for any well-behaved server.
     */
    int getStatus();

    /**
     * @return the normalized response headers: lower-cased names, each with all of its values in order.
     */
    @NonNull
    Headers getHeaders();

    /**
     * @return the instant taken immediately before the request was handed to the transport.
     */
    @NonNull
    Instant getStartedAt();

    /**
     * @return the instant taken immediately after the response headers were received.
     */
    @NonNull
    Instant getEndedAt();

    @NonNull
    default Duration getDuration() {
        return Duration.between(getStartedAt(), getEndedAt());
    }

    @NonNull
    HttpVersion getVersion();
}
