/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Wraps an {@link IOException} with an unchecked exception. This is the root of every exception thrown by the Relay
 * HTTP engine: transport failures surface as a plain {@code RelayHttpException}, protocol-level failures as one of its
 * subtypes.
 */
public class RelayHttpException extends UncheckedIOException {
    public RelayHttpException(final @NonNull String message) {
        super(Objects.requireNonNull(message), new IOException(message));
    }

    public RelayHttpException(final @NonNull IOException cause) {
        super(Objects.requireNonNull(cause).getMessage(), cause);
    }

    public RelayHttpException(final @NonNull String message, final @NonNull IOException cause) {
        super(Objects.requireNonNull(message), Objects.requireNonNull(cause));
    }
}
