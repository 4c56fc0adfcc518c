/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.internal.JdkHttpTransport;

import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The raw HTTP transport the engine is layered upon. A transport performs exactly one request/response exchange per
 * {@link #open(Request)} call: it never follows redirects, never retries, and returns the response headers as the raw
 * lines it received so that the engine can normalize them itself.
 *
 * @implSpec Implementations of this interface must be safe for concurrent use.
 */
@FunctionalInterface
public interface Transport {
    /**
     * Sends {@code request} and waits for the response headers.
     *
     * @return the response. Its body stream is open and owned by the caller.
     * @throws RelayHttpException if the exchange failed at the network level.
     */
    @NonNull
    Response open(final @NonNull Request request);

    /**
     * @return a transport relying on {@link java.net.http.HttpClient}, with automatic redirects disabled and a
     * permissive TLS certificate verification.
     */
    static @NonNull Transport jdk() {
        return new JdkHttpTransport();
    }

    /**
     * One physical request.
     *
     * @param uri     the absolute URI to request.
     * @param method  the HTTP method, such as {@code GET} or {@code HEAD}.
     * @param headers the request headers.
     * @param body    the request body, or null for none.
     * @param timeout the timeout of this single exchange.
     */
    record Request(@NonNull URI uri,
                   @NonNull String method,
                   @NonNull Headers headers,
                   byte @Nullable [] body,
                   @NonNull Duration timeout) {
        public Request {
            Objects.requireNonNull(uri);
            Objects.requireNonNull(method);
            Objects.requireNonNull(headers);
            Objects.requireNonNull(timeout);
        }

        /**
         * @return the same request, sent to {@code otherUri}.
         */
        public @NonNull Request withUri(final @NonNull URI otherUri) {
            return new Request(otherUri, method, headers, body, timeout);
        }
    }

    /**
     * The response to one physical request.
     *
     * @param body        the response body. For a HEAD request, this is an empty stream.
     * @param statusCode  the numeric status code.
     * @param headerLines the header lines, as {@code name: value} strings, in the order they were received.
     * @param version     the protocol version of the response.
     */
    record Response(@NonNull InputStream body,
                    int statusCode,
                    @NonNull List<@NonNull String> headerLines,
                    @NonNull HttpVersion version) {
        public Response {
            Objects.requireNonNull(body);
            headerLines = List.copyOf(headerLines);
            Objects.requireNonNull(version);
        }
    }
}
