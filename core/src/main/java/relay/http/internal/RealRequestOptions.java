/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.Headers;
import relay.http.MediaType;
import relay.http.RequestOptions;
import relay.http.tools.AcceptHeaders;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class RealRequestOptions implements RequestOptions {
    private final @NonNull String accept;
    private final @Nullable Integer numberOfHops;
    private final @Nullable Integer numberOfRetries;
    private final @Nullable Integer success;
    private final @Nullable Integer failure;
    private final boolean rawStatus;
    private final @Nullable String method;
    private final @NonNull Headers headers;
    private final @Nullable Body body;
    private final @Nullable Duration timeout;

    private RealRequestOptions(final @NonNull Builder builder) {
        assert builder != null;

        this.accept = builder.accept;
        this.numberOfHops = builder.numberOfHops;
        this.numberOfRetries = builder.numberOfRetries;
        this.success = builder.success;
        this.failure = builder.failure;
        this.rawStatus = builder.rawStatus;
        this.method = builder.method;
        this.headers = builder.headers.build();
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    @Override
    public @NonNull String getAccept() {
        return accept;
    }

    @Override
    public @Nullable Integer getNumberOfHops() {
        return numberOfHops;
    }

    @Override
    public @Nullable Integer getNumberOfRetries() {
        return numberOfRetries;
    }

    @Override
    public @Nullable Integer getSuccess() {
        return success;
    }

    @Override
    public @Nullable Integer getFailure() {
        return failure;
    }

    @Override
    public boolean isRawStatus() {
        return rawStatus;
    }

    @Override
    public @NonNull String getMethod() {
        if (method != null) {
            return method;
        }
        return (body != null) ? "POST" : "GET";
    }

    @Override
    public @NonNull Headers getHeaders() {
        return headers;
    }

    @Override
    public @Nullable Body getBody() {
        return body;
    }

    @Override
    public @Nullable Duration getTimeout() {
        return timeout;
    }

    @Override
    public RequestOptions.@NonNull Builder newBuilder() {
        return new Builder(this);
    }

    @Override
    public @NonNull String toString() {
        return "RequestOptions{" +
                "method=" + getMethod() +
                ", accept=" + accept +
                ((numberOfHops != null) ? ", numberOfHops=" + numberOfHops : "") +
                ((numberOfRetries != null) ? ", numberOfRetries=" + numberOfRetries : "") +
                ((success != null) ? ", success=" + success : "") +
                ((failure != null) ? ", failure=" + failure : "") +
                (rawStatus ? ", rawStatus" : "") +
                '}';
    }

    public static final class Builder implements RequestOptions.Builder {
        private @NonNull String accept = AcceptHeaders.ANY;
        private @Nullable Integer numberOfHops = null;
        private @Nullable Integer numberOfRetries = null;
        private @Nullable Integer success = null;
        private @Nullable Integer failure = null;
        private boolean rawStatus = false;
        private @Nullable String method = null;
        private final Headers.@NonNull Builder headers;
        private @Nullable Body body = null;
        private @Nullable Duration timeout = null;

        public Builder() {
            this.headers = Headers.builder();
        }

        private Builder(final @NonNull RealRequestOptions options) {
            assert options != null;

            this.accept = options.accept;
            this.numberOfHops = options.numberOfHops;
            this.numberOfRetries = options.numberOfRetries;
            this.success = options.success;
            this.failure = options.failure;
            this.rawStatus = options.rawStatus;
            this.method = options.method;
            this.headers = options.headers.newBuilder();
            this.body = options.body;
            this.timeout = options.timeout;
        }

        @Override
        public @NonNull Builder accept(final @NonNull List<@NonNull MediaType> mediaTypes) {
            this.accept = AcceptHeaders.value(mediaTypes);
            return this;
        }

        @Override
        public @NonNull Builder accept(final @NonNull MediaType @NonNull ... mediaTypes) {
            return accept(List.of(mediaTypes));
        }

        @Override
        public @NonNull Builder accept(final @NonNull String extension) {
            return accept(MediaType.forExtension(extension));
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
        public @NonNull Builder success(final int status) {
            if (status < 200 || status > 299) {
                throw new IllegalArgumentException("success must be a 2xx status code: " + status);
            }
            this.success = status;
            return this;
        }

        @Override
        public @NonNull Builder failure(final int status) {
            if (status < 400 || status > 599) {
                throw new IllegalArgumentException("failure must be a 4xx or 5xx status code: " + status);
            }
            this.failure = status;
            return this;
        }

        @Override
        public @NonNull Builder rawStatus() {
            this.rawStatus = true;
            return this;
        }

        @Override
        public @NonNull Builder method(final @NonNull String method) {
            Objects.requireNonNull(method);
            if (method.isBlank()) {
                throw new IllegalArgumentException("method is blank");
            }
            this.method = method.toUpperCase(Locale.ROOT);
            return this;
        }

        @Override
        public @NonNull Builder header(final @NonNull String name, final @NonNull String value) {
            if ("Accept".equalsIgnoreCase(name)) {
                throw new IllegalArgumentException("Use accept(...) to set the Accept header");
            }
            headers.add(name, value);
            return this;
        }

        @Override
        public @NonNull Builder post(final @NonNull String content, final @NonNull MediaType contentType) {
            Objects.requireNonNull(content);
            Objects.requireNonNull(contentType);
            this.body = new Body(content, contentType);
            return this;
        }

        @Override
        public @NonNull Builder post(final @NonNull String content) {
            return post(content, MediaType.get("text/plain; charset=utf-8"));
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
        public @NonNull RequestOptions build() {
            return new RealRequestOptions(this);
        }
    }
}
