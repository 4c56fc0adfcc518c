/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.internal.MediaTypeExtensions;
import relay.http.internal.RealMediaType;

import java.nio.charset.Charset;
import java.util.Map;

/**
 * An <a href="http://tools.ietf.org/html/rfc2045">RFC 2045</a> Media Type, appropriate to describe the content type of
 * an HTTP request or response body, or one of the ranked entries of an {@code Accept} header.
 */
public sealed interface MediaType permits RealMediaType {
    /**
     * @return a media type for {@code mediaType}.
     *
     * @throws IllegalArgumentException if {@code mediaType} is not a well-formed media type.
     */
    static @NonNull MediaType get(final @NonNull String mediaType) {
        return RealMediaType.get(mediaType);
    }

    /**
     * @return a media type for {@code mediaType}, or null if {@code mediaType} is not a well-formed media type.
     */
    static @Nullable MediaType parse(final @NonNull String mediaType) {
        try {
            return MediaType.get(mediaType);
        } catch (IllegalArgumentException ignored) {
            return null;
        }
    }

    /**
     * @return the media type registered for the file name extension {@code extension}, such as {@code json} or
     * {@code ttl}. The lookup ignores case and a leading dot.
     *
     * @throws IllegalArgumentException if no media type is registered for {@code extension}.
     */
    static @NonNull MediaType forExtension(final @NonNull String extension) {
        final var mediaType = MediaTypeExtensions.lookup(extension);
        if (mediaType == null) {
            throw new IllegalArgumentException("No media type registered for extension: \"" + extension + "\"");
        }
        return mediaType;
    }

    /**
     * @return the high-level media type, such as "text", "image", "audio", "video", or "application".
     */
    @NonNull
    String getType();

    /**
     * @return a specific media subtype, such as "plain" or "png", "mpeg", "mp4" or "xml".
     */
    @NonNull
    String getSubtype();

    /**
     * @return the parameters of this media type in their order of appearance, names lower-cased and values unquoted.
     */
    @NonNull
    Map<@NonNull String, @NonNull String> getParameters();

    /**
     * @return the charset named by the {@code charset} parameter, or {@code defaultCharset} if there is no such
     * parameter or the runtime does not support it.
     */
    @NonNull
    Charset charset(final @NonNull Charset defaultCharset);

    /**
     * @return the encoded media type, like "text/plain; charset=utf-8", appropriate for use in a Content-Type header.
     */
    @Override
    @NonNull
    String toString();
}
