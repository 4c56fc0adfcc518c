/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.tools;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.MediaType;
import relay.http.Metadata;
import relay.http.internal.Utils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extraction helpers over the metadata of a logical request, as returned by
 * {@link relay.http.Outcome#getMetadata()}. They all read the most recent attempt, the first element of the list.
 */
public final class HttpMetadataUtils {
    // un-instantiable
    private HttpMetadataUtils() {
    }

    /**
     * @return the media type of the {@code Content-Type} header, or null if the header is absent or its value is not a
     * well-formed media type.
     */
    public static @Nullable MediaType contentType(final @NonNull List<@NonNull Metadata> metadata) {
        final var contentType = latest(metadata).getHeaders().get("content-type");
        return (contentType != null) ? MediaType.parse(contentType) : null;
    }

    /**
     * @return the {@code filename} parameter of an {@code attachment} {@code Content-Disposition} header, or null.
     */
    public static @Nullable String fileName(final @NonNull List<@NonNull Metadata> metadata) {
        final var contentDisposition = latest(metadata).getHeaders().get("content-disposition");
        if (contentDisposition == null) {
            return null;
        }

        final var params = contentDisposition.split(";");
        if (!params[0].strip().equalsIgnoreCase("attachment")) {
            return null;
        }
        for (var i = 1; i < params.length; i++) {
            final var param = params[i].strip();
            final var equals = param.indexOf('=');
            if (equals == -1 || !param.substring(0, equals).strip().equalsIgnoreCase("filename")) {
                continue;
            }
            final var fileName = unquote(param.substring(equals + 1).strip());
            return fileName.isEmpty() ? null : fileName;
        }
        return null;
    }

    public static @NonNull URI finalUri(final @NonNull List<@NonNull Metadata> metadata) {
        return latest(metadata).getUri();
    }

    public static int status(final @NonNull List<@NonNull Metadata> metadata) {
        return latest(metadata).getStatus();
    }

    /**
     * Looks up the target of {@code relation} in the {@code Link} header. The values of a repeated header are searched
     * in the order they were received, and the first link-value whose {@code rel} parameter equals {@code relation},
     * ignoring case, wins. A relative target is resolved against the URI of the most recent attempt.
     *
     * @return the target URI, or null if no link-value has this relation.
     */
    public static @Nullable URI link(final @NonNull List<@NonNull Metadata> metadata,
                                     final @NonNull String relation) {
        Objects.requireNonNull(relation);
        final var latest = latest(metadata);
        final var links = latest.getHeaders().values("link");
        if (links.isEmpty()) {
            return null;
        }

        for (final var linkValue : linkValues(String.join(";", links))) {
            final var segments = linkValue.split(";");
            final var target = segments[0].strip();
            if (!target.startsWith("<") || !target.endsWith(">")) {
                continue;
            }
            for (var i = 1; i < segments.length; i++) {
                final var param = segments[i].strip();
                final var equals = param.indexOf('=');
                if (equals == -1 || !param.substring(0, equals).strip().equalsIgnoreCase("rel")) {
                    continue;
                }
                if (hasRelation(unquote(param.substring(equals + 1).strip()), relation)) {
                    return Utils.resolve(latest.getUri(), target.substring(1, target.length() - 1).strip());
                }
            }
        }
        return null;
    }

    /**
     * Splits a {@code Link} header value into its link-values. Link-values are separated by commas, and a segment that
     * starts with {@code <} always begins a new link-value, even after a semicolon.
     */
    static @NonNull List<@NonNull String> linkValues(final @NonNull String link) {
        assert link != null;

        final var result = new ArrayList<String>();
        for (final var comp : link.split(",")) {
            StringBuilder current = null;
            for (final var segment : comp.split(";")) {
                if (segment.strip().startsWith("<") || current == null) {
                    if (current != null) {
                        result.add(current.toString());
                    }
                    current = new StringBuilder(segment);
                } else {
                    current.append(';').append(segment);
                }
            }
            if (current != null && !current.toString().isBlank()) {
                result.add(current.toString());
            }
        }
        return result;
    }

    // a rel parameter may hold several space-separated relation types
    private static boolean hasRelation(final @NonNull String rel, final @NonNull String relation) {
        for (final var candidate : rel.split("[ \t]+")) {
            if (candidate.equalsIgnoreCase(relation)) {
                return true;
            }
        }
        return false;
    }

    private static @NonNull String unquote(final @NonNull String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static @NonNull Metadata latest(final @NonNull List<@NonNull Metadata> metadata) {
        Objects.requireNonNull(metadata);
        if (metadata.isEmpty()) {
            throw new IllegalArgumentException("metadata is empty");
        }
        return metadata.get(0);
    }
}
