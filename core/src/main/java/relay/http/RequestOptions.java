/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.internal.RealRequestOptions;

import java.time.Duration;
import java.util.List;

/**
 * The per-request options of a logical request, see {@link HttpEngine#open(java.net.URI, RequestOptions)}. Every
 * option is optional: unset limits fall back to the {@link HttpEngine} defaults.
 * <p>
 * Instances of this class are immutable. Use {@link #builder()} to create instances.
 */
public sealed interface RequestOptions permits RealRequestOptions {
    static @NonNull Builder builder() {
        return new RealRequestOptions.Builder();
    }

    /**
     * Options that send a plain {@code GET} request accepting any media type.
     */
    @NonNull
    RequestOptions DEFAULT = builder().build();

    /**
     * @return the value of the {@code Accept} header that will be sent.
     */
    @NonNull
    String getAccept();

    /**
     * @return the maximum number of redirects, or null to use the engine default.
     */
    @Nullable
    Integer getNumberOfHops();

    /**
     * @return the retry limit, or null to use the engine default.
     */
    @Nullable
    Integer getNumberOfRetries();

    /**
     * @return the status code mapped onto success, or null if the caller did not declare one.
     */
    @Nullable
    Integer getSuccess();

    /**
     * @return the status code mapped onto a silent negative outcome, or null if the caller did not declare one.
     */
    @Nullable
    Integer getFailure();

    /**
     * @return true if the raw status code is wanted. In this case neither {@link #getSuccess()} nor
     * {@link #getFailure()} is interpreted.
     */
    boolean isRawStatus();

    @NonNull
    String getMethod();

    /**
     * @return the additional request headers, {@code Accept} excluded.
     */
    @NonNull
    Headers getHeaders();

    @Nullable
    Body getBody();

    /**
     * @return the per-attempt timeout, or null to use the engine default.
     */
    @Nullable
    Duration getTimeout();

    @NonNull
    Builder newBuilder();

    /**
     * A request body.
     *
     * @param content     the text to send, encoded with the charset of {@code contentType} or UTF-8.
     * @param contentType the media type of {@code content}, sent as the {@code Content-Type} header.
     */
    record Body(@NonNull String content, @NonNull MediaType contentType) {
    }

    /**
     * The builder used to create a {@link RequestOptions} instance.
     */
    sealed interface Builder permits RealRequestOptions.Builder {
        /**
         * Sets the ranked media types to accept, most preferred first.
         *
         * @throws IllegalArgumentException if {@code mediaTypes} is empty.
         */
        @NonNull
        Builder accept(final @NonNull List<@NonNull MediaType> mediaTypes);

        @NonNull
        Builder accept(final @NonNull MediaType @NonNull ... mediaTypes);

        /**
         * Accepts the media type registered for the file name {@code extension}, see
         * {@link MediaType#forExtension(String)}.
         */
        @NonNull
        Builder accept(final @NonNull String extension);

        /**
         * Sets the maximum number of redirects that a logical request may follow. Must be at least 1.
         */
        @NonNull
        Builder numberOfHops(final int numberOfHops);

        /**
         * Sets the retry limit applied to failure status codes. Must be at least 1. The first attempt counts as the
         * first slot, so a limit of {@code n} performs at most {@code n - 1} attempts, and never fewer than one.
         */
        @NonNull
        Builder numberOfRetries(final int numberOfRetries);

        /**
         * Declares the 2xx status code that means success. Declaring it enables the status policy.
         */
        @NonNull
        Builder success(final int status);

        /**
         * Declares the 4xx or 5xx status code that means a silent negative outcome. Declaring it enables the status
         * policy.
         */
        @NonNull
        Builder failure(final int status);

        /**
         * Requests the raw status code: the status policy is skipped.
         */
        @NonNull
        Builder rawStatus();

        @NonNull
        Builder method(final @NonNull String method);

        @NonNull
        Builder header(final @NonNull String name, final @NonNull String value);

        /**
         * Sends {@code content} as the request body. The method becomes {@code POST} unless set explicitly.
         */
        @NonNull
        Builder post(final @NonNull String content, final @NonNull MediaType contentType);

        /**
         * Sends {@code content} as a {@code text/plain; charset=utf-8} request body.
         */
        @NonNull
        Builder post(final @NonNull String content);

        @NonNull
        Builder timeout(final @NonNull Duration timeout);

        @NonNull
        RequestOptions build();
    }
}
