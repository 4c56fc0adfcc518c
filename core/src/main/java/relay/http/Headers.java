/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.internal.RealHeaders;

import java.time.Instant;
import java.util.List;

/**
 * The header fields of a single HTTP message, in the order they were added. Name lookups are case-insensitive, and a
 * field may repeat: all of its values are kept.
 * <p>
 * Header fields received from a server are normalized by {@link #parse(List)}. Header fields sent with a request are
 * assembled with {@link #builder()}, which validates them.
 */
public sealed interface Headers extends Iterable<Headers.@NonNull Header> permits RealHeaders {
    /**
     * No header field at all.
     */
    @NonNull
    Headers EMPTY = RealHeaders.EMPTY;

    static @NonNull Builder builder() {
        return new RealHeaders.Builder();
    }

    /**
     * Normalizes raw {@code name: value} lines, as received from a transport. Every line is split on its first colon,
     * the name is lower-cased and the value stripped of surrounding spaces and tabs. A line without a colon, with an
     * empty or invalid name, or continuing an obsolete line folding is silently skipped.
     */
    static @NonNull Headers parse(final @NonNull List<@NonNull String> rawLines) {
        return RealHeaders.parse(rawLines);
    }

    /**
     * @return the first value of the field {@code name}, or null if there is none.
     */
    @Nullable
    String get(final @NonNull String name);

    /**
     * @return all values of the field {@code name}, in arrival order.
     */
    @NonNull
    List<@NonNull String> values(final @NonNull String name);

    /**
     * @return the first value of the field {@code name} parsed as an HTTP date, or null if the field is absent or is
     * not a date.
     */
    @Nullable
    Instant getInstant(final @NonNull String name);

    boolean isEmpty();

    @NonNull
    Builder newBuilder();

    /**
     * @return one {@code name: value} line per field. Credentials such as {@code Authorization} and {@code Cookie} are
     * redacted.
     */
    @Override
    @NonNull
    String toString();

    sealed interface Builder permits RealHeaders.Builder {
        /**
         * Adds a field after the existing ones.
         *
         * @throws IllegalArgumentException if {@code name} is not a valid field name or {@code value} holds a control
         *                                  or non-ASCII character.
         */
        @NonNull
        Builder add(final @NonNull String name, final @NonNull String value);

        /**
         * Replaces every value of the field {@code name} by {@code value}.
         */
        @NonNull
        Builder set(final @NonNull String name, final @NonNull String value);

        @NonNull
        Headers build();
    }

    record Header(@NonNull String name, @NonNull String value) {
    }
}
