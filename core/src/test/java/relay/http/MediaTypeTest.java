/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class MediaTypeTest {
    @Test
    void parse() {
        final var mediaType = MediaType.get("Text/Turtle; charset=\"UTF-8\"; profile=x");

        assertThat(mediaType.getType()).isEqualTo("text");
        assertThat(mediaType.getSubtype()).isEqualTo("turtle");
        assertThat(mediaType.getParameters()).containsExactly(
                Map.entry("charset", "UTF-8"),
                Map.entry("profile", "x"));
        assertThat(mediaType.charset(ISO_8859_1)).isEqualTo(UTF_8);
        assertThat(mediaType.toString()).isEqualTo("Text/Turtle; charset=\"UTF-8\"; profile=x");
    }

    @Test
    void quotedParameterValues() {
        final var mediaType = MediaType.get(
                "application/ld+json;profile=\"http://www.w3.org/ns/json-ld#compacted\";;X=\"a\\\"b\"");

        assertThat(mediaType.getParameters()).containsExactly(
                Map.entry("profile", "http://www.w3.org/ns/json-ld#compacted"),
                Map.entry("x", "a\"b"));
    }

    @Test
    void malformed() {
        assertThatThrownBy(() -> MediaType.get("text"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(MediaType.parse("text/plain; charset")).isNull();
        assertThat(MediaType.parse("")).isNull();
        assertThat(MediaType.parse("text/plain; charset=\"utf-8")).isNull();
        assertThat(MediaType.parse("text/plain garbage")).isNull();
    }

    @Test
    void charsetFallback() {
        assertThat(MediaType.get("text/plain").charset(ISO_8859_1)).isEqualTo(ISO_8859_1);
        assertThat(MediaType.get("text/plain; charset=unknown-charset").charset(ISO_8859_1)).isEqualTo(ISO_8859_1);
    }

    @ParameterizedTest
    @CsvSource({
            "json, application/json",
            "JSON, application/json",
            ".ttl, text/turtle",
            "nt, application/n-triples",
            "jsonld, application/ld+json",
            "html, text/html",
    })
    void forExtension(final String extension, final String expected) {
        assertThat(MediaType.forExtension(extension)).hasToString(expected);
    }

    @Test
    void unknownExtension() {
        assertThatThrownBy(() -> MediaType.forExtension("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }
}
