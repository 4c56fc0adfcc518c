/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.jspecify.annotations.NonNull;
import relay.http.HttpStatusException;
import relay.http.Outcome;
import relay.http.RequestOptions;
import relay.http.internal.RealOutcome;
import relay.http.tools.HttpMetadataUtils;

import java.io.IOException;
import java.io.InputStream;

import static java.lang.System.Logger.Level.DEBUG;
import static java.net.HttpURLConnection.HTTP_BAD_REQUEST;
import static java.net.HttpURLConnection.HTTP_OK;
import static java.nio.charset.StandardCharsets.UTF_8;
import static relay.http.internal.Utils.closeQuietly;
import static relay.http.internal.Utils.readAtMost;

/**
 * Maps the terminal status code of a logical request onto its caller-visible outcome. The policy only applies when the
 * caller declared a success or a failure status code, and did not ask for the raw status code.
 */
final class StatusPolicy {
    private static final System.Logger LOGGER = System.getLogger("relay.http.StatusPolicy");

    /**
     * Failure content kept in a {@link HttpStatusException}.
     */
    static final int MAX_CONTENT_CHARS = 1000;

    // un-instantiable
    private StatusPolicy() {
    }

    static @NonNull Outcome apply(final @NonNull Outcome outcome, final @NonNull RequestOptions options) {
        assert outcome != null;
        assert options != null;

        if (options.isRawStatus() || (options.getSuccess() == null && options.getFailure() == null)) {
            return outcome;
        }

        final var success = (options.getSuccess() != null) ? options.getSuccess() : HTTP_OK;
        final var failure = (options.getFailure() != null) ? options.getFailure() : HTTP_BAD_REQUEST;
        final var status = outcome.getStatusCode();

        if (status >= 400 && status <= 599) {
            if (status == failure) {
                outcome.close();
                return new RealOutcome(InputStream.nullInputStream(), false, outcome.getMetadata(), outcome.getNext());
            }
            throw failed(outcome);
        }

        if (status >= 200 && status <= 299) {
            if (status != success) {
                LOGGER.log(DEBUG, "Status {0} accepted for {1}, expected {2}", status, outcome.getFinalUri(), success);
            }
            return outcome;
        }

        outcome.close();
        throw new IllegalStateException("Status " + status + " cannot be a terminal status");
    }

    private static @NonNull HttpStatusException failed(final @NonNull Outcome outcome) {
        final var contentType = HttpMetadataUtils.contentType(outcome.getMetadata());
        final var charset = (contentType != null) ? contentType.charset(UTF_8) : UTF_8;
        try {
            final var content = readAtMost(outcome.getBody(), charset, MAX_CONTENT_CHARS);
            return new HttpStatusException(outcome.getStatusCode(), content, outcome.getFinalUri());
        } catch (IOException e) {
            final var exception = new HttpStatusException(outcome.getStatusCode(), "", outcome.getFinalUri());
            exception.addSuppressed(e);
            return exception;
        } finally {
            closeQuietly(outcome.getBody());
        }
    }
}
