/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.URI;

/**
 * Listener for the events of an {@link HttpEngine}. Install one with {@link HttpEngine.Builder#eventListener} to trace
 * the protocol exchanges of this engine, or to monitor its redirects and retries.
 * <p>
 * Events are typically nested with this structure:
 * <ul>
 * <li>page ({@link #pageStart(URI, int)}), only when driven by {@link HttpEngine#call} or {@link HttpEngine#pages}
 * <ul>
 * <li>attempt ({@link #attemptStart(Transport.Request)}, {@link #attemptEnd(Metadata)} or
 * {@link #attemptFailed(URI, RelayHttpException)}), then one of
 * <ul>
 * <li>{@link #redirectDecision(URI, URI, int)} followed by another attempt</li>
 * <li>{@link #retryDecision(URI, int, int, boolean)}, followed by another attempt if it retries</li>
 * <li>{@link #missingContentType(URI)} on a success without content type</li>
 * </ul>
 * </li>
 * </ul>
 * </li>
 * </ul>
 * All event methods must execute fast, cannot throw exceptions and must not be re-entrant back into the engine.
 */
public interface EventListener {
    /**
     * A listener that ignores all events.
     */
    @NonNull
    EventListener NONE = new EventListener() {
    };

    /**
     * Invoked when the pagination driver opens a page. The first page has index 0.
     */
    default void pageStart(final @NonNull URI uri, final int index) {
    }

    /**
     * Invoked immediately before {@code request} is handed to the transport.
     */
    default void attemptStart(final Transport.@NonNull Request request) {
    }

    /**
     * Invoked once the response headers of an attempt have been received and normalized.
     */
    default void attemptEnd(final @NonNull Metadata metadata) {
    }

    /**
     * Invoked when the transport failed to perform an attempt. The logical request fails with {@code exception}.
     */
    default void attemptFailed(final @NonNull URI uri, final @NonNull RelayHttpException exception) {
    }

    /**
     * Invoked when a redirect from {@code from} to {@code to} is about to be followed. {@code hop} is the number of
     * redirects taken so far, this one included.
     */
    default void redirectDecision(final @NonNull URI from, final @NonNull URI to, final int hop) {
    }

    /**
     * Invoked after a failure status. {@code retries} is the value of the retry counter after this failure, and
     * {@code retrying} tells whether the same URI is requested again.
     */
    default void retryDecision(final @NonNull URI uri, final int status, final int retries, final boolean retrying) {
    }

    /**
     * Invoked when a success response declares no usable {@code Content-Type} but still carries content.
     */
    default void missingContentType(final @NonNull URI uri) {
    }

    /**
     * Invoked when the pagination driver found the {@code next} page of {@code uri}, or null when it was the last one.
     */
    default void nextPage(final @NonNull URI uri, final @Nullable URI next) {
    }
}
