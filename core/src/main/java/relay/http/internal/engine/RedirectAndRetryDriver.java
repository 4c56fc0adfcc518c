/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.jspecify.annotations.NonNull;
import relay.http.*;
import relay.http.internal.RealMetadata;
import relay.http.internal.RealOutcome;
import relay.http.tools.HttpMetadataUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.net.URI;
import java.time.Instant;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;
import static relay.http.internal.Utils.closeQuietly;
import static relay.http.internal.Utils.resolve;

/**
 * Sends the physical attempts of one logical request until a terminal outcome is reached. Redirects are followed up to
 * the hop limit of the request, and failure status codes are retried up to its retry limit. It throws a
 * {@link RelayHttpException} for every fatal condition.
 */
final class RedirectAndRetryDriver {
    private static final System.Logger LOGGER = System.getLogger("relay.http.RedirectAndRetryDriver");

    private final @NonNull Transport transport;
    private final @NonNull EventListener eventListener;

    RedirectAndRetryDriver(final @NonNull Transport transport, final @NonNull EventListener eventListener) {
        assert transport != null;
        assert eventListener != null;

        this.transport = transport;
        this.eventListener = eventListener;
    }

    @NonNull
    Outcome drive(final Transport.@NonNull Request firstRequest, final @NonNull RequestState state) {
        assert firstRequest != null;
        assert state != null;

        var request = firstRequest;
        while (true) {
            final var response = attempt(request, state);
            final var status = response.statusCode();
            final var uri = request.uri();

            if (status >= 200 && status <= 299) {
                final var body = request.method().equals("HEAD")
                        ? response.body()
                        : checkContentType(response.body(), uri, state);
                return terminal(body, state);
            }

            if (status >= 300 && status <= 399) {
                closeQuietly(response.body());
                final var target = redirectTarget(uri, status, state);
                final var seen = state.visit(target);
                if (state.hopLimitExceeded()) {
                    if (seen) {
                        throw new RedirectLoopException(state.visited());
                    }
                    throw new TooManyRedirectsException(state.hops(), state.visited());
                }
                LOGGER.log(DEBUG, "Redirect {0} from {1} to {2}", status, uri, target);
                eventListener.redirectDecision(uri, target, state.hops());
                request = request.withUri(target);
                continue;
            }

            if (status == HTTP_UNAUTHORIZED) {
                return terminal(response.body(), state);
            }

            if (status >= 400 && status <= 599) {
                final var retrying = state.failed();
                eventListener.retryDecision(uri, status, state.retries(), retrying);
                if (!retrying) {
                    return terminal(response.body(), state);
                }
                LOGGER.log(DEBUG, "Retry {0} after status {1}", uri, status);
                closeQuietly(response.body());
                continue;
            }

            closeQuietly(response.body());
            throw new UnrecognizedStatusException(status, uri, "unsupported status class");
        }
    }

    private Transport.@NonNull Response attempt(final Transport.@NonNull Request request,
                                                final @NonNull RequestState state) {
        eventListener.attemptStart(request);
        final var startedAt = Instant.now();
        final Transport.Response response;
        try {
            response = transport.open(request);
        } catch (RelayHttpException e) {
            eventListener.attemptFailed(request.uri(), e);
            throw e;
        }
        final var endedAt = Instant.now();

        final var metadata = new RealMetadata(
                request.uri(),
                response.statusCode(),
                Headers.parse(response.headerLines()),
                startedAt,
                endedAt,
                response.version());
        state.record(metadata);
        eventListener.attemptEnd(metadata);
        return response;
    }

    private @NonNull URI redirectTarget(final @NonNull URI uri, final int status, final @NonNull RequestState state) {
        final var lastMetadata = state.lastMetadata();
        assert lastMetadata != null;

        final var location = lastMetadata.getHeaders().get("location");
        if (location == null) {
            throw new UnrecognizedStatusException(status, uri, "redirect without a Location header to follow");
        }
        final var target = resolve(uri, location);
        if (target == null) {
            throw new UnrecognizedStatusException(status, uri, "invalid redirect location " + location);
        }
        return target;
    }

    /**
     * A success without a usable content type is expected to have no content. The check peeks at the first byte
     * without consuming it.
     */
    private @NonNull InputStream checkContentType(final @NonNull InputStream body,
                                                  final @NonNull URI uri,
                                                  final @NonNull RequestState state) {
        final var lastMetadata = state.lastMetadata();
        assert lastMetadata != null;
        final var contentType = lastMetadata.getHeaders().get("content-type");
        if (contentType != null && MediaType.parse(contentType) != null) {
            return body;
        }

        final var peekable = new PushbackInputStream(body, 1);
        final int first;
        try {
            first = peekable.read();
            if (first != -1) {
                peekable.unread(first);
            }
        } catch (IOException e) {
            closeQuietly(peekable);
            throw new RelayHttpException("Failed to read the response body of " + uri, e);
        }
        if (first != -1) {
            LOGGER.log(WARNING, "No content type for the non-empty response of " + uri);
            eventListener.missingContentType(uri);
        }
        return peekable;
    }

    private static @NonNull Outcome terminal(final @NonNull InputStream body, final @NonNull RequestState state) {
        final var metadata = state.newestFirst();
        return new RealOutcome(body, true, metadata, HttpMetadataUtils.link(metadata, "next"));
    }
}
