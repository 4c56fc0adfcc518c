/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import relay.http.Headers;
import relay.http.HttpVersion;
import relay.http.Metadata;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

public final class RealMetadata implements Metadata {
    private final @NonNull URI uri;
    private final int status;
    private final @NonNull Headers headers;
    private final @NonNull Instant startedAt;
    private final @NonNull Instant endedAt;
    private final @NonNull HttpVersion version;

    public RealMetadata(final @NonNull URI uri,
                        final int status,
                        final @NonNull Headers headers,
                        final @NonNull Instant startedAt,
                        final @NonNull Instant endedAt,
                        final @NonNull HttpVersion version) {
        this.uri = Objects.requireNonNull(uri);
        this.status = status;
        this.headers = Objects.requireNonNull(headers);
        this.startedAt = Objects.requireNonNull(startedAt);
        this.endedAt = Objects.requireNonNull(endedAt);
        this.version = Objects.requireNonNull(version);
    }

    @Override
    public @NonNull URI getUri() {
        return uri;
    }

    @Override
    public int getStatus() {
        return status;
    }

    @Override
    public @NonNull Headers getHeaders() {
        return headers;
    }

    @Override
    public @NonNull Instant getStartedAt() {
        return startedAt;
    }

    @Override
    public @NonNull Instant getEndedAt() {
        return endedAt;
    }

    @Override
    public @NonNull HttpVersion getVersion() {
        return version;
    }

    @Override
    public @NonNull String toString() {
        return "Metadata{" +
                "uri=" + uri +
                ", status=" + status +
                ", version=" + version +
                ", duration=" + getDuration().toMillis() + "ms" +
                '}';
    }
}
