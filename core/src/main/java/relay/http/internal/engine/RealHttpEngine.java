/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.*;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import static java.net.HttpURLConnection.HTTP_OK;
import static java.nio.charset.StandardCharsets.UTF_8;
import static relay.http.internal.Utils.USER_AGENT;

public final class RealHttpEngine implements HttpEngine {
    private final @NonNull Transport transport;
    private final int numberOfHops;
    private final int numberOfRetries;
    private final @NonNull Duration timeout;
    private final @NonNull EventListener eventListener;
    private final @NonNull Path downloadDirectory;
    private final @NonNull RedirectAndRetryDriver driver;

    private RealHttpEngine(final @NonNull Builder builder) {
        assert builder != null;

        this.transport = (builder.transport != null) ? builder.transport : Transport.jdk();
        this.numberOfHops = builder.numberOfHops;
        this.numberOfRetries = builder.numberOfRetries;
        this.timeout = builder.timeout;
        this.eventListener = builder.eventListener;
        this.downloadDirectory = builder.downloadDirectory;
        this.driver = new RedirectAndRetryDriver(transport, eventListener);
    }

    @Override
    public @NonNull Transport getTransport() {
        return transport;
    }

    @Override
    public int getNumberOfHops() {
        return numberOfHops;
    }

    @Override
    public int getNumberOfRetries() {
        return numberOfRetries;
    }

    @Override
    public @NonNull Duration getTimeout() {
        return timeout;
    }

    @Override
    public @NonNull EventListener getEventListener() {
        return eventListener;
    }

    @Override
    public @NonNull Path getDownloadDirectory() {
        return downloadDirectory;
    }

    @Override
    public @NonNull Outcome open(final @NonNull URI uri, final @NonNull RequestOptions options) {
        Objects.requireNonNull(uri);
        Objects.requireNonNull(options);
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("uri must be absolute: " + uri);
        }

        final var state = new RequestState(
                uri,
                (options.getNumberOfHops() != null) ? options.getNumberOfHops() : numberOfHops,
                (options.getNumberOfRetries() != null) ? options.getNumberOfRetries() : numberOfRetries);
        final var outcome = driver.drive(newRequest(uri, options), state);
        return StatusPolicy.apply(outcome, options);
    }

    @Override
    public @NonNull Outcome open(final @NonNull URI uri) {
        return open(uri, RequestOptions.DEFAULT);
    }

    Transport.@NonNull Request newRequest(final @NonNull URI uri, final @NonNull RequestOptions options) {
        assert uri != null;
        assert options != null;

        final var headers = options.getHeaders().newBuilder();
        headers.set("Accept", options.getAccept());
        if (options.getHeaders().get("User-Agent") == null) {
            headers.set("User-Agent", USER_AGENT);
        }

        byte[] body = null;
        final var requestBody = options.getBody();
        if (requestBody != null) {
            headers.set("Content-Type", requestBody.contentType().toString());
            body = requestBody.content().getBytes(requestBody.contentType().charset(UTF_8));
        }

        return new Transport.Request(
                uri,
                options.getMethod(),
                headers.build(),
                body,
                (options.getTimeout() != null) ? options.getTimeout() : timeout);
    }

    @Override
    public boolean call(final @NonNull URI uri,
                        final @NonNull PageConsumer consumer,
                        final @NonNull RequestOptions options) throws IOException {
        Objects.requireNonNull(uri);
        Objects.requireNonNull(consumer);
        Objects.requireNonNull(options);

        var current = uri;
        var index = 0;
        while (true) {
            eventListener.pageStart(current, index++);
            try (final var outcome = open(current, options)) {
                if (!outcome.isSuccessful()) {
                    return false;
                }
                final var next = outcome.getNext();
                eventListener.nextPage(current, next);
                if (current.equals(next)) {
                    throw new CyclicLinkHeaderException(next);
                }
                consumer.accept(outcome.getBody());
                if (next == null) {
                    return true;
                }
                current = next;
            }
        }
    }

    @Override
    public boolean call(final @NonNull URI uri, final @NonNull PageConsumer consumer) throws IOException {
        return call(uri, consumer, RequestOptions.DEFAULT);
    }

    @Override
    public @NonNull PageIterator pages(final @NonNull URI uri, final @NonNull RequestOptions options) {
        Objects.requireNonNull(uri);
        Objects.requireNonNull(options);
        return new RealPageIterator(this, uri, options);
    }

    @Override
    public boolean head(final @NonNull URI uri, final @NonNull RequestOptions options) {
        Objects.requireNonNull(options);
        try (final var outcome = open(uri, options.newBuilder().method("HEAD").build())) {
            return outcome.isSuccessful();
        }
    }

    @Override
    public @Nullable Path download(final @NonNull URI uri) throws IOException {
        return download(uri, Downloads.localPath(downloadDirectory, uri));
    }

    @Override
    public @Nullable Path download(final @NonNull URI uri, final @NonNull Path file) throws IOException {
        return download(uri, file, RequestOptions.DEFAULT);
    }

    @Override
    public @Nullable Path download(final @NonNull URI uri,
                                   final @NonNull Path file,
                                   final @NonNull RequestOptions options) throws IOException {
        Objects.requireNonNull(file);
        return Downloads.download(this, uri, file, options);
    }

    @Override
    public @Nullable Path sync(final @NonNull URI uri) throws IOException {
        return sync(uri, Downloads.localPath(downloadDirectory, uri));
    }

    @Override
    public @Nullable Path sync(final @NonNull URI uri, final @NonNull Path file) throws IOException {
        return sync(uri, file, RequestOptions.DEFAULT);
    }

    @Override
    public @Nullable Path sync(final @NonNull URI uri,
                               final @NonNull Path file,
                               final @NonNull RequestOptions options) throws IOException {
        Objects.requireNonNull(file);
        return Downloads.sync(this, uri, file, options);
    }

    @Override
    public @Nullable Instant lastModified(final @NonNull URI uri) {
        final var options = RequestOptions.builder()
                .method("HEAD")
                .rawStatus()
                .build();
        try (final var outcome = open(uri, options)) {
            if (outcome.getStatusCode() != HTTP_OK) {
                return null;
            }
            return outcome.getMetadata().get(0).getHeaders().getInstant("last-modified");
        }
    }

    @Override
    public HttpEngine.@NonNull Builder newBuilder() {
        return new Builder(this);
    }

    public static final class Builder implements HttpEngine.Builder {
        private @Nullable Transport transport = null;
        private int numberOfHops = 5;
        private int numberOfRetries = 1;
        private @NonNull Duration timeout = Duration.ofSeconds(60);
        private @NonNull EventListener eventListener = EventListener.NONE;
        private @NonNull Path downloadDirectory = Path.of("");

        public Builder() {
        }

        private Builder(final @NonNull RealHttpEngine engine) {
            assert engine != null;

            this.transport = engine.transport;
            this.numberOfHops = engine.numberOfHops;
            this.numberOfRetries = engine.numberOfRetries;
            this.timeout = engine.timeout;
            this.eventListener = engine.eventListener;
            this.downloadDirectory = engine.downloadDirectory;
        }

        @Override
        public @NonNull Builder transport(final @NonNull Transport transport) {
            this.transport = Objects.requireNonNull(transport);
            return this;
        }

        @Override
        public @NonNull Builder numberOfHops(final int numberOfHops) {
            if (numberOfHops < 1) {
                throw new IllegalArgumentException("numberOfHops < 1: " + numberOfHops);
            }
            this.numberOfHops = numberOfHops;
            return this;
        }

        @Override
        public @NonNull Builder numberOfRetries(final int numberOfRetries) {
            if (numberOfRetries < 1) {
                throw new IllegalArgumentException("numberOfRetries < 1: " + numberOfRetries);
            }
            this.numberOfRetries = numberOfRetries;
            return this;
        }

        @Override
        public @NonNull Builder timeout(final @NonNull Duration timeout) {
            Objects.requireNonNull(timeout);
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        @Override
        public @NonNull Builder eventListener(final @NonNull EventListener eventListener) {
            this.eventListener = Objects.requireNonNull(eventListener);
            return this;
        }

        @Override
        public @NonNull Builder downloadDirectory(final @NonNull Path downloadDirectory) {
            this.downloadDirectory = Objects.requireNonNull(downloadDirectory);
            return this;
        }

        @Override
        public @NonNull HttpEngine build() {
            return new RealHttpEngine(this);
        }
    }
}
