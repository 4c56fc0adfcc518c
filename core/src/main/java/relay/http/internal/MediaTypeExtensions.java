/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.MediaType;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static java.util.Map.entry;

/**
 * The registry of file name extensions that can stand for a media type, e.g. in {@code accept("ttl")}.
 */
public final class MediaTypeExtensions {
    // un-instantiable
    private MediaTypeExtensions() {
    }

    private static final @NonNull Map<@NonNull String, @NonNull String> MEDIA_TYPES = Map.ofEntries(
            // web
            entry("css", "text/css"),
            entry("csv", "text/csv"),
            entry("htm", "text/html"),
            entry("html", "text/html"),
            entry("js", "application/javascript"),
            entry("json", "application/json"),
            entry("tsv", "text/tab-separated-values"),
            entry("txt", "text/plain"),
            entry("xml", "application/xml"),
            entry("yaml", "application/yaml"),
            // linked data
            entry("jsonld", "application/ld+json"),
            entry("n3", "text/n3"),
            entry("nq", "application/n-quads"),
            entry("nt", "application/n-triples"),
            entry("owl", "application/owl+xml"),
            entry("rdf", "application/rdf+xml"),
            entry("sparql", "application/sparql-query"),
            entry("trig", "application/trig"),
            entry("ttl", "text/turtle"),
            // binary
            entry("gif", "image/gif"),
            entry("gz", "application/gzip"),
            entry("jpeg", "image/jpeg"),
            entry("jpg", "image/jpeg"),
            entry("pdf", "application/pdf"),
            entry("png", "image/png"),
            entry("svg", "image/svg+xml"),
            entry("tar", "application/x-tar"),
            entry("zip", "application/zip")
    );

    public static @Nullable MediaType lookup(final @NonNull String extension) {
        Objects.requireNonNull(extension);
        var key = extension.toLowerCase(Locale.ROOT);
        if (key.startsWith(".")) {
            key = key.substring(1);
        }
        final var mediaType = MEDIA_TYPES.get(key);
        return (mediaType != null) ? RealMediaType.get(mediaType) : null;
    }
}
