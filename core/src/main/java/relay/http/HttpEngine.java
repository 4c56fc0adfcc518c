/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.internal.engine.RealHttpEngine;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * A policy-driven HTTP request engine. It sends requests through a {@link Transport} that never follows redirects on
 * its own, and resolves redirects itself, retries failure status codes, maps status codes onto success or failure
 * outcomes and follows the {@code rel="next"} relation of {@code Link} headers.
 * <h2>Open a single resource</h2>
 * <pre>
 * {@code
 * HttpEngine engine = HttpEngine.create();
 * RequestOptions options = RequestOptions.builder()
 *     .accept(MediaType.get("application/json"))
 *     .failure(404)
 *     .build();
 * try (Outcome outcome = engine.open(uri, options)) {
 *   if (outcome.isSuccessful()) {
 *     process(outcome.getBody());
 *   }
 * }
 * }
 * </pre>
 * <h2>Consume every page of a paginated resource</h2>
 * <pre>
 * {@code
 * boolean found = engine.call(uri, body -> process(body), options);
 * }
 * </pre>
 * Instances of this class are immutable and safe to share across threads. Every logical request holds its own state,
 * and runs synchronously on the calling thread.
 */
public sealed interface HttpEngine permits RealHttpEngine {
    static @NonNull Builder builder() {
        return new RealHttpEngine.Builder();
    }

    /**
     * @return a new {@link HttpEngine} with good defaults.
     */
    static @NonNull HttpEngine create() {
        return builder().build();
    }

    @NonNull
    Transport getTransport();

    /**
     * @return the default maximum number of redirects of a logical request. If unset in the builder, it is 5.
     */
    int getNumberOfHops();

    /**
     * @return the default retry limit of a logical request. If unset in the builder, it is 1: failure status codes are
     * not retried.
     */
    int getNumberOfRetries();

    /**
     * @return the default timeout of a single attempt. If unset in the builder, it is 60 seconds.
     */
    @NonNull
    Duration getTimeout();

    @NonNull
    EventListener getEventListener();

    /**
     * @return the directory under which {@link #download(URI)} and {@link #sync(URI)} store files. If unset in the
     * builder, it is the working directory.
     */
    @NonNull
    Path getDownloadDirectory();

    /**
     * Sends a logical request to {@code uri}, following redirects and retrying failures, then applies the status policy
     * of {@code options}.
     *
     * @return the outcome of the logical request. Its body stream must be closed by the caller.
     * @throws RedirectLoopException        if a redirect loop was detected.
     * @throws TooManyRedirectsException    if the redirect limit was exceeded.
     * @throws UnrecognizedStatusException  if a status code could not be interpreted.
     * @throws HttpStatusException          if the status policy rejected a failure status code.
     * @throws RelayHttpException           if the transport failed.
     */
    @NonNull
    Outcome open(final @NonNull URI uri, final @NonNull RequestOptions options);

    /**
     * Sends a {@code GET} request accepting any media type, see {@link #open(URI, RequestOptions)}.
     */
    @NonNull
    Outcome open(final @NonNull URI uri);

    /**
     * Opens {@code uri}, then every page reached through the {@code rel="next"} relation of the {@code Link} header,
     * handing the body of each page to {@code consumer} in order. Each body is closed when {@code consumer} returns or
     * throws, before the following page is opened.
     *
     * @return false if a page ended with the failure status code of {@code options}, true otherwise.
     * @throws CyclicLinkHeaderException if a page designates itself as its {@code next} page.
     * @throws IOException               if {@code consumer} failed.
     */
    boolean call(final @NonNull URI uri,
                 final @NonNull PageConsumer consumer,
                 final @NonNull RequestOptions options) throws IOException;

    boolean call(final @NonNull URI uri, final @NonNull PageConsumer consumer) throws IOException;

    /**
     * @return a lazy iteration over the pages of {@code uri}, see {@link PageIterator}.
     */
    @NonNull
    PageIterator pages(final @NonNull URI uri, final @NonNull RequestOptions options);

    /**
     * Sends a {@code HEAD} request and closes its outcome immediately.
     *
     * @return the success flag of the outcome.
     */
    boolean head(final @NonNull URI uri, final @NonNull RequestOptions options);

    /**
     * Downloads every page of {@code uri} under the download directory, in a file named after the host and the path of
     * {@code uri}.
     *
     * @return the downloaded file.
     */
    @Nullable
    Path download(final @NonNull URI uri) throws IOException;

    @Nullable
    Path download(final @NonNull URI uri, final @NonNull Path file) throws IOException;

    /**
     * Downloads every page of {@code uri} into {@code file}. The content is first written into a sibling file with a
     * {@code .tmp} suffix, then moved into place once complete.
     *
     * @return {@code file}, or null if the failure status code of {@code options} was received. Nothing is written in
     * that case.
     */
    @Nullable
    Path download(final @NonNull URI uri,
                  final @NonNull Path file,
                  final @NonNull RequestOptions options) throws IOException;

    @Nullable
    Path sync(final @NonNull URI uri) throws IOException;

    @Nullable
    Path sync(final @NonNull URI uri, final @NonNull Path file) throws IOException;

    /**
     * Same as {@link #download(URI, Path, RequestOptions)}, except that nothing is requested when {@code file} already
     * exists.
     */
    @Nullable
    Path sync(final @NonNull URI uri,
              final @NonNull Path file,
              final @NonNull RequestOptions options) throws IOException;

    /**
     * Sends a {@code HEAD} request and reads its {@code Last-Modified} header.
     *
     * @return the last modification instant of {@code uri}, or null if the final status code is not 200, or if the
     * header is absent or cannot be parsed.
     */
    @Nullable
    Instant lastModified(final @NonNull URI uri);

    @NonNull
    Builder newBuilder();

    /**
     * Receives the body of one page. The body is closed by the caller of this consumer.
     */
    @FunctionalInterface
    interface PageConsumer {
        void accept(final @NonNull InputStream body) throws IOException;
    }

    /**
     * The builder used to create a {@link HttpEngine} instance.
     */
    sealed interface Builder permits RealHttpEngine.Builder {
        /**
         * Sets the transport used to perform every physical attempt. Default is {@link Transport#jdk()}.
         */
        @NonNull
        Builder transport(final @NonNull Transport transport);

        /**
         * Sets the default maximum number of redirects of a logical request. Must be at least 1.
         */
        @NonNull
        Builder numberOfHops(final int numberOfHops);

        /**
         * Sets the default retry limit of a logical request. Must be at least 1.
         */
        @NonNull
        Builder numberOfRetries(final int numberOfRetries);

        /**
         * Sets the default timeout of a single attempt. Must be positive.
         */
        @NonNull
        Builder timeout(final @NonNull Duration timeout);

        /**
         * Configure a single listener that will receive all the events of this engine.
         */
        @NonNull
        Builder eventListener(final @NonNull EventListener eventListener);

        @NonNull
        Builder downloadDirectory(final @NonNull Path downloadDirectory);

        @NonNull
        HttpEngine build();
    }
}
