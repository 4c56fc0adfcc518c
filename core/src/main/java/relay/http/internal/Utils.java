/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;

public final class Utils {
    // un-instantiable
    private Utils() {
    }

    /**
     * The {@code User-Agent} sent with every request that does not set its own.
     */
    public static final @NonNull String USER_AGENT = "relayhttp/" + InternalVersion.VERSION;

    static boolean isSensitiveHeader(final @NonNull String name) {
        assert name != null;

        return name.equalsIgnoreCase("Authorization") ||
                name.equalsIgnoreCase("Cookie") ||
                name.equalsIgnoreCase("Proxy-Authorization") ||
                name.equalsIgnoreCase("Set-Cookie");
    }

    /**
     * Closes this {@code closeable}, ignoring any checked exceptions. Only for streams that are abandoned on a path where
     * another outcome, or another exception, is already on its way to the caller.
     */
    public static void closeQuietly(final @NonNull AutoCloseable closeable) {
        assert closeable != null;

        try {
            closeable.close();
        } catch (RuntimeException rethrown) {
            throw rethrown;
        } catch (Exception ignored) {
        }
    }

    /**
     * @return at most {@code maxChars} characters decoded from {@code in}. The stream is not closed.
     */
    public static @NonNull String readAtMost(final @NonNull InputStream in,
                                             final @NonNull Charset charset,
                                             final int maxChars) throws IOException {
        assert in != null;
        assert charset != null;

        final var reader = new InputStreamReader(in, charset);
        final var buffer = new char[maxChars];
        var read = 0;
        while (read < maxChars) {
            final var count = reader.read(buffer, read, maxChars - read);
            if (count == -1) {
                break;
            }
            read += count;
        }
        return new String(buffer, 0, read);
    }

    /**
     * Resolves {@code reference}, as found in a {@code Location} or {@code Link} header, against {@code base} following
     * RFC 3986 section 5.2.2. {@link URI#resolve(URI)} implements the older RFC 2396 rules, which drop the last path
     * segment of the base for a query-only reference such as {@code ?page=2}, and lose the slash between an empty base
     * path and a relative reference.
     *
     * @return the target URI, or null if {@code reference} is not a valid URI reference.
     */
    public static @Nullable URI resolve(final @NonNull URI base, final @NonNull String reference) {
        assert base != null;
        assert reference != null;

        final URI ref;
        try {
            ref = new URI(reference);
        } catch (URISyntaxException ignored) {
            return null;
        }
        if (ref.isAbsolute() || base.isOpaque() || ref.getRawAuthority() != null) {
            return base.resolve(ref);
        }

        final var basePath = (base.getRawPath() != null) ? base.getRawPath() : "";
        final var refPath = (ref.getRawPath() != null) ? ref.getRawPath() : "";
        if (refPath.isEmpty()) {
            final var query = (ref.getRawQuery() != null) ? ref.getRawQuery() : base.getRawQuery();
            return withPath(base, basePath, query, ref.getRawFragment());
        }
        if (basePath.isEmpty() && base.getRawAuthority() != null) {
            return withPath(base, "/", null, null).resolve(ref);
        }
        return base.resolve(ref);
    }

    private static @NonNull URI withPath(final @NonNull URI base,
                                         final @NonNull String rawPath,
                                         final @Nullable String rawQuery,
                                         final @Nullable String rawFragment) {
        final var sb = new StringBuilder();
        if (base.getScheme() != null) {
            sb.append(base.getScheme()).append(':');
        }
        if (base.getRawAuthority() != null) {
            sb.append("//").append(base.getRawAuthority());
        }
        sb.append(rawPath);
        if (rawQuery != null) {
            sb.append('?').append(rawQuery);
        }
        if (rawFragment != null) {
            sb.append('#').append(rawFragment);
        }
        return URI.create(sb.toString());
    }
}
