/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.logging.internal;

import org.jspecify.annotations.NonNull;
import relay.http.Headers;
import relay.http.MediaType;
import relay.http.Metadata;
import relay.http.Transport;
import relay.http.logging.HttpTraceListener;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class RealHttpTraceListener implements HttpTraceListener {
    private final @NonNull Logger logger;
    private final @NonNull Set<@NonNull Category> categories;
    private final @NonNull Set<@NonNull String> headersToRedact;

    private RealHttpTraceListener(final @NonNull Logger logger,
                                  final @NonNull Set<@NonNull Category> categories,
                                  final @NonNull Set<@NonNull String> headersToRedact) {
        assert logger != null;
        assert categories != null;
        assert headersToRedact != null;

        this.logger = logger;
        this.categories = categories;
        this.headersToRedact = headersToRedact;
    }

    @Override
    public void attemptStart(final Transport.@NonNull Request request) {
        if (!categories.contains(Category.SEND_REQUEST)) {
            return;
        }

        logger.log("> " + request.method() + " " + request.uri());
        for (final var header : request.headers()) {
            logHeader("> ", header);
        }

        final var body = request.body();
        if (body != null) {
            final var contentType = request.headers().get("Content-Type");
            final var mediaType = (contentType != null) ? MediaType.parse(contentType) : null;
            final var charset = (mediaType != null) ? mediaType.charset(UTF_8) : UTF_8;
            logger.log("REQUEST BODY\n" + new String(body, charset));
        }
    }

    @Override
    public void attemptEnd(final @NonNull Metadata metadata) {
        if (!categories.contains(Category.RECEIVE_REPLY)) {
            return;
        }

        logger.log("");
        logger.log("< " + metadata.getStatus() + " (" + StatusReasons.reason(metadata.getStatus()) + ")");
        for (final var header : metadata.getHeaders()) {
            logHeader("< ", header);
        }
        logger.log("");
    }

    private void logHeader(final @NonNull String direction, final Headers.@NonNull Header header) {
        final var value = headersToRedact.contains(header.name()) ? "██" : header.value();
        logger.log(direction + header.name() + ": " + value);
    }

    public static final class Builder implements HttpTraceListener.Builder {
        private @NonNull Logger logger = Logger.DEFAULT;
        private final @NonNull Set<@NonNull Category> categories = EnumSet.noneOf(Category.class);
        private final @NonNull Set<@NonNull String> headersToRedact = new HashSet<>();

        @Override
        public @NonNull Builder logger(final @NonNull Logger logger) {
            this.logger = Objects.requireNonNull(logger);
            return this;
        }

        @Override
        public @NonNull Builder categories(final @NonNull Category @NonNull ... categories) {
            Objects.requireNonNull(categories);

            Collections.addAll(this.categories, categories);
            return this;
        }

        @Override
        public @NonNull Builder redactHeader(final @NonNull String name) {
            Objects.requireNonNull(name);

            headersToRedact.add(name);
            return this;
        }

        @Override
        public @NonNull HttpTraceListener build() {
            // build a case-insensitive copy of the current set
            var _headersToRedact = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            _headersToRedact.addAll(this.headersToRedact);

            return new RealHttpTraceListener(
                    logger,
                    categories.isEmpty() ? EnumSet.noneOf(Category.class) : EnumSet.copyOf(categories),
                    _headersToRedact
            );
        }
    }
}
