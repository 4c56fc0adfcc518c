/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.tools;

import org.jspecify.annotations.NonNull;
import relay.http.MediaType;
import relay.http.internal.RealMediaType;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class AcceptHeaders {
    // un-instantiable
    private AcceptHeaders() {
    }

    /**
     * The {@code Accept} value sent when no media type was requested.
     */
    public static final @NonNull String ANY = "*/*";

    /**
     * Builds an {@code Accept} header value from {@code mediaTypes}, most preferred first. The media type at 1-indexed
     * position {@code i} of {@code N} gets the weight {@code i/N}, formatted with three decimals, so that the last one
     * always gets {@code q=1.000}. Media type parameters are written before the weight, as in
     * {@code text/html;charset=utf-8;q=1.000}.
     * <pre>
     * {@code
     * // "text/turtle;q=0.500, application/n-triples;q=1.000"
     * AcceptHeaders.value(List.of(MediaType.get("text/turtle"), MediaType.get("application/n-triples")));
     * }
     * </pre>
     *
     * @throws IllegalArgumentException if {@code mediaTypes} is empty.
     */
    public static @NonNull String value(final @NonNull List<@NonNull MediaType> mediaTypes) {
        Objects.requireNonNull(mediaTypes);
        if (mediaTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one media type is required");
        }

        final var count = mediaTypes.size();
        final var result = new StringBuilder();
        for (var i = 0; i < count; i++) {
            final var mediaType = Objects.requireNonNull(mediaTypes.get(i));
            if (i > 0) {
                result.append(", ");
            }
            result.append(mediaType.getType())
                    .append('/')
                    .append(mediaType.getSubtype());
            mediaType.getParameters().forEach((name, value) ->
                    result.append(';').append(name).append('=').append(parameterValue(value)));
            result.append(";q=")
                    .append(String.format(Locale.ROOT, "%.3f", (double) (i + 1) / count));
        }
        return result.toString();
    }

    private static @NonNull String parameterValue(final @NonNull String value) {
        if (!value.isEmpty() && value.chars().allMatch(c -> RealMediaType.isTokenChar((char) c))) {
            return value;
        }
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
