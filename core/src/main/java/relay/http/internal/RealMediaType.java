/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.MediaType;

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class RealMediaType implements MediaType {
    private static final @NonNull String TOKEN_CHARS = "!#$%&'*+-.^_`|~";

    private final @NonNull String mediaType;
    private final @NonNull String type;
    private final @NonNull String subtype;
    private final @NonNull Map<@NonNull String, @NonNull String> parameters;

    private RealMediaType(final @NonNull String mediaType,
                          final @NonNull String type,
                          final @NonNull String subtype,
                          final @NonNull Map<@NonNull String, @NonNull String> parameters) {
        assert mediaType != null;
        assert type != null;
        assert subtype != null;
        assert parameters != null;

        this.mediaType = mediaType;
        this.type = type;
        this.subtype = subtype;
        this.parameters = parameters;
    }

    @Override
    public @NonNull String getType() {
        return type;
    }

    @Override
    public @NonNull String getSubtype() {
        return subtype;
    }

    @Override
    public @NonNull Map<@NonNull String, @NonNull String> getParameters() {
        return parameters;
    }

    @Override
    public @NonNull Charset charset(final @NonNull Charset defaultCharset) {
        Objects.requireNonNull(defaultCharset);

        final var name = parameters.get("charset");
        if (name == null) {
            return defaultCharset;
        }
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException unsupported) {
            return defaultCharset;
        }
    }

    @Override
    public @NonNull String toString() {
        return mediaType;
    }

    @Override
    public int hashCode() {
        return mediaType.hashCode();
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return (other instanceof RealMediaType otherMediaType) && mediaType.equals(otherMediaType.mediaType);
    }

    /**
     * Parses {@code type "/" subtype *( OWS ";" OWS [ name "=" ( token / quoted-string ) ] )}. Empty parameters, as in
     * {@code text/plain;;charset=utf-8}, are tolerated. When a parameter repeats, its first value is kept.
     */
    public static @NonNull MediaType get(final @NonNull String mediaType) {
        Objects.requireNonNull(mediaType);

        final var scanner = new Scanner(mediaType);
        scanner.skipOws();
        final var type = scanner.token();
        if (type == null || !scanner.skip('/')) {
            throw new IllegalArgumentException("No subtype found for: \"" + mediaType + "\"");
        }
        final var subtype = scanner.token();
        if (subtype == null) {
            throw new IllegalArgumentException("No subtype found for: \"" + mediaType + "\"");
        }

        final var parameters = new LinkedHashMap<String, String>();
        scanner.skipOws();
        while (scanner.skip(';')) {
            scanner.skipOws();
            final var name = scanner.token();
            if (name != null) {
                if (!scanner.skip('=')) {
                    throw new IllegalArgumentException(
                            "Parameter " + name + " has no value in: \"" + mediaType + "\"");
                }
                final var value = scanner.peek('"') ? scanner.quotedString() : scanner.token();
                if (value == null) {
                    throw new IllegalArgumentException(
                            "Parameter " + name + " has an invalid value in: \"" + mediaType + "\"");
                }
                parameters.putIfAbsent(name.toLowerCase(Locale.ROOT), value);
            }
            scanner.skipOws();
        }
        if (!scanner.atEnd()) {
            throw new IllegalArgumentException("Unexpected character at " + scanner.position + " in: \"" + mediaType +
                    "\"");
        }

        return new RealMediaType(
                mediaType,
                type.toLowerCase(Locale.ROOT),
                subtype.toLowerCase(Locale.ROOT),
                Collections.unmodifiableMap(parameters));
    }

    public static boolean isTokenChar(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') ||
                TOKEN_CHARS.indexOf(c) != -1;
    }

    private static final class Scanner {
        private final @NonNull String input;
        private int position = 0;

        private Scanner(final @NonNull String input) {
            this.input = input;
        }

        boolean atEnd() {
            return position == input.length();
        }

        boolean peek(final char c) {
            return !atEnd() && input.charAt(position) == c;
        }

        boolean skip(final char c) {
            if (peek(c)) {
                position++;
                return true;
            }
            return false;
        }

        void skipOws() {
            while (peek(' ') || peek('\t')) {
                position++;
            }
        }

        @Nullable
        String token() {
            final var start = position;
            while (!atEnd() && isTokenChar(input.charAt(position))) {
                position++;
            }
            return (position > start) ? input.substring(start, position) : null;
        }

        /**
         * @return the unescaped content of the quoted string at the current position, or null if it is not closed.
         */
        @Nullable
        String quotedString() {
            assert peek('"');
            position++;
            final var sb = new StringBuilder();
            while (!atEnd()) {
                final var c = input.charAt(position++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c == '\\' && !atEnd()) {
                    sb.append(input.charAt(position++));
                } else {
                    sb.append(c);
                }
            }
            return null;
        }
    }
}
