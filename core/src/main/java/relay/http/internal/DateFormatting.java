/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 *
 * Forked from Jayo HTTP (https://github.com/jayo-projects/jayo-http), itself forked from OkHttp
 * (https://github.com/square/okhttp), original copyright is below
 *
 * Copyright (C) 2013 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

import static java.time.ZoneOffset.UTC;

/**
 * Parses the HTTP dates found in headers such as {@code Last-Modified}.
 */
public final class DateFormatting {
    // un-instantiable
    private DateFormatting() {
    }

    /**
     * The IMF-fixdate format of RFC 7231. GMT and UTC are equivalent for our purposes.
     */
    private static final @NonNull DateTimeFormatter STANDARD_DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
                    .withResolverStyle(ResolverStyle.LENIENT)
                    .withZone(UTC);

    /**
     * Obsolete formats that RFC 7231 still requires a recipient to accept, tried in sequence when the standard format
     * does not match.
     */
    private static final @NonNull List<@NonNull DateTimeFormatter> OBSOLETE_DATE_FORMATS = List.of(
            // RFC 822, updated by RFC 1123 with any TZ.
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss zzz", Locale.US).withZone(UTC),
            // RFC 850, obsoleted by RFC 1036 with any TZ.
            DateTimeFormatter.ofPattern("EEEE, dd-MMM-yy HH:mm:ss zzz", Locale.US).withZone(UTC),
            // ANSI C's asctime() format
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US).withZone(UTC)
    );

    public static @Nullable Instant toHttpInstantOrNull(final @NonNull String instantAsString) {
        assert instantAsString != null;

        if (instantAsString.isBlank()) {
            return null;
        }

        final var standard = parseOrNull(STANDARD_DATE_FORMAT, instantAsString, true);
        if (standard != null) {
            return standard;
        }
        for (final var format : OBSOLETE_DATE_FORMATS) {
            final var result = parseOrNull(format, instantAsString, false);
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private static @Nullable Instant parseOrNull(final @NonNull DateTimeFormatter format,
                                                 final @NonNull String instantAsString,
                                                 final boolean exact) {
        final var position = new ParsePosition(0);
        try {
            final var parsed = format.parse(instantAsString, position);
            // The standard format must consume all the text, e.g. no ignored non-standard trailing "+01:00".
            if (exact && position.getIndex() != instantAsString.length()) {
                return null;
            }
            return Instant.from(parsed);
        } catch (DateTimeException unparsable) {
            return null;
        }
    }
}
