/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.Headers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static relay.http.internal.DateFormatting.toHttpInstantOrNull;
import static relay.http.internal.Utils.isSensitiveHeader;

public final class RealHeaders implements Headers {
    public static final @NonNull Headers EMPTY = new RealHeaders(List.of());

    private final @NonNull List<@NonNull Header> fields;

    private RealHeaders(final @NonNull List<@NonNull Header> fields) {
        assert fields != null;
        this.fields = fields;
    }

    public static @NonNull Headers parse(final @NonNull List<@NonNull String> rawLines) {
        Objects.requireNonNull(rawLines);

        final var fields = new ArrayList<Header>(rawLines.size());
        for (final var line : rawLines) {
            final var field = parseLine(line);
            if (field != null) {
                fields.add(field);
            }
        }
        return new RealHeaders(List.copyOf(fields));
    }

    private static @Nullable Header parseLine(final @NonNull String line) {
        // a leading space or tab continues an obsolete line folding
        if (line.isEmpty() || isOws(line.charAt(0))) {
            return null;
        }
        final var colon = line.indexOf(':');
        if (colon <= 0) {
            return null;
        }
        final var name = line.substring(0, colon);
        if (!isFieldName(name)) {
            return null;
        }
        return new Header(name.toLowerCase(Locale.ROOT), stripOws(line, colon + 1));
    }

    @Override
    public @Nullable String get(final @NonNull String name) {
        Objects.requireNonNull(name);
        for (final var field : fields) {
            if (field.name().equalsIgnoreCase(name)) {
                return field.value();
            }
        }
        return null;
    }

    @Override
    public @NonNull List<@NonNull String> values(final @NonNull String name) {
        Objects.requireNonNull(name);
        return fields.stream()
                .filter(field -> field.name().equalsIgnoreCase(name))
                .map(Header::value)
                .toList();
    }

    @Override
    public @Nullable Instant getInstant(final @NonNull String name) {
        final var value = get(name);
        return (value != null) ? toHttpInstantOrNull(value) : null;
    }

    @Override
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public @NonNull Iterator<@NonNull Header> iterator() {
        return fields.iterator();
    }

    @Override
    public Headers.@NonNull Builder newBuilder() {
        final var builder = new Builder();
        builder.fields.addAll(fields);
        return builder;
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return (other instanceof RealHeaders otherHeaders) && fields.equals(otherHeaders.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public @NonNull String toString() {
        final var sb = new StringBuilder();
        for (final var field : fields) {
            sb.append(field.name())
                    .append(": ")
                    .append(isSensitiveHeader(field.name()) ? "██" : field.value())
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * @return true if {@code name} is a non-empty sequence of visible ASCII characters other than the colon.
     */
    static boolean isFieldName(final @NonNull String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (var i = 0; i < name.length(); i++) {
            final var c = name.charAt(i);
            if (c <= ' ' || c > '~' || c == ':') {
                return false;
            }
        }
        return true;
    }

    private static boolean isOws(final char c) {
        return c == ' ' || c == '\t';
    }

    private static @NonNull String stripOws(final @NonNull String line, final int from) {
        var start = from;
        var end = line.length();
        while (start < end && isOws(line.charAt(start))) {
            start++;
        }
        while (end > start && isOws(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(start, end);
    }

    public static final class Builder implements Headers.Builder {
        private final @NonNull List<@NonNull Header> fields = new ArrayList<>();

        @Override
        public @NonNull Builder add(final @NonNull String name, final @NonNull String value) {
            Objects.requireNonNull(name);
            Objects.requireNonNull(value);
            if (!isFieldName(name)) {
                throw new IllegalArgumentException("Invalid header name: \"" + name + "\"");
            }
            for (var i = 0; i < value.length(); i++) {
                final var c = value.charAt(i);
                if (c != '\t' && (c < ' ' || c > '~')) {
                    // sensitive values are not echoed
                    throw new IllegalArgumentException("Invalid character at " + i + " in the value of header " + name +
                            (isSensitiveHeader(name) ? "" : ": \"" + value + "\""));
                }
            }
            fields.add(new Header(name, value));
            return this;
        }

        @Override
        public @NonNull Builder set(final @NonNull String name, final @NonNull String value) {
            Objects.requireNonNull(name);
            fields.removeIf(field -> field.name().equalsIgnoreCase(name));
            return add(name, value);
        }

        @Override
        public @NonNull Headers build() {
            return new RealHeaders(List.copyOf(fields));
        }
    }
}
