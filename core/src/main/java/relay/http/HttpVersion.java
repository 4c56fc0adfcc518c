/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

/**
 * The HTTP protocol version a response was received with.
 *
 * @param major the major version, 1 for HTTP/1.1.
 * @param minor the minor version, 1 for HTTP/1.1.
 */
public record HttpVersion(int major, int minor) {
    public static final @NonNull HttpVersion HTTP_1_0 = new HttpVersion(1, 0);
    public static final @NonNull HttpVersion HTTP_1_1 = new HttpVersion(1, 1);
    public static final @NonNull HttpVersion HTTP_2 = new HttpVersion(2, 0);

    public HttpVersion {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Invalid HTTP version " + major + "." + minor);
        }
    }

    @Override
    public @NonNull String toString() {
        return (minor == 0 && major > 1) ? "HTTP/" + major : "HTTP/" + major + "." + minor;
    }
}
