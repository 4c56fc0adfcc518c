/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.Metadata;
import relay.http.Outcome;
import relay.http.RelayHttpException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;

public final class RealOutcome implements Outcome {
    private final @NonNull InputStream body;
    private final boolean successful;
    private final @NonNull List<@NonNull Metadata> metadata;
    private final @Nullable URI next;

    public RealOutcome(final @NonNull InputStream body,
                       final boolean successful,
                       final @NonNull List<@NonNull Metadata> metadata,
                       final @Nullable URI next) {
        assert body != null;
        assert metadata != null;
        assert !metadata.isEmpty();

        this.body = body;
        this.successful = successful;
        this.metadata = List.copyOf(metadata);
        this.next = next;
    }

    @Override
    public @NonNull InputStream getBody() {
        return body;
    }

    @Override
    public boolean isSuccessful() {
        return successful;
    }

    @Override
    public int getStatusCode() {
        return metadata.get(0).getStatus();
    }

    @Override
    public @NonNull URI getFinalUri() {
        return metadata.get(0).getUri();
    }

    @Override
    public @NonNull List<@NonNull Metadata> getMetadata() {
        return metadata;
    }

    @Override
    public @Nullable URI getNext() {
        return next;
    }

    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            throw new RelayHttpException(e);
        }
    }

    @Override
    public @NonNull String toString() {
        return "Outcome{" +
                "status=" + getStatusCode() +
                ", successful=" + successful +
                ", finalUri=" + getFinalUri() +
                ((next != null) ? ", next=" + next : "") +
                '}';
    }
}
