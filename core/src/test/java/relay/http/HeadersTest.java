/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class HeadersTest {
    @Test
    void parseNormalizesNamesAndValues() {
        final var headers = Headers.parse(List.of(
                "Content-Type: text/turtle",
                "LINK:\t<http://a.test/2>; rel=\"next\" ",
                "Link: <http://a.test/0>; rel=\"prev\""));

        assertThat(headers).containsExactly(
                new Headers.Header("content-type", "text/turtle"),
                new Headers.Header("link", "<http://a.test/2>; rel=\"next\""),
                new Headers.Header("link", "<http://a.test/0>; rel=\"prev\""));
        assertThat(headers.get("Content-Type")).isEqualTo("text/turtle");
        assertThat(headers.values("LINK")).containsExactly(
                "<http://a.test/2>; rel=\"next\"",
                "<http://a.test/0>; rel=\"prev\"");
    }

    @Test
    void parseSkipsMalformedLines() {
        final var headers = Headers.parse(List.of(
                "no colon here",
                ": no name",
                "bad name: value",
                " folded: continuation",
                "\tfolded too",
                "",
                "ok: yes"));

        assertThat(headers).containsExactly(new Headers.Header("ok", "yes"));
    }

    @Test
    void parseKeepsColonsInValues() {
        final var headers = Headers.parse(List.of("location: http://a.test:8080/x"));

        assertThat(headers.get("location")).isEqualTo("http://a.test:8080/x");
    }

    @Test
    void getReturnsTheFirstValue() {
        final var headers = Headers.parse(List.of("b: 1", "a: 2", "c: 3", "a: 4"));

        assertThat(headers.get("A")).isEqualTo("2");
        assertThat(headers.values("a")).containsExactly("2", "4");
        assertThat(headers.values("missing")).isEmpty();
        assertThat(headers.get("missing")).isNull();
    }

    @Test
    void builderValidates() {
        assertThatThrownBy(() -> Headers.builder().add("bad name", "value"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Headers.builder().add("name", "café"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("café");
        assertThatThrownBy(() -> Headers.builder().add("Authorization", "Bearer\nsecret"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageNotContaining("secret");
    }

    @Test
    void builderSetReplacesValues() {
        final var headers = Headers.builder()
                .add("X-A", "1")
                .add("x-a", "2")
                .add("X-B", "b")
                .set("X-A", "3")
                .build();

        assertThat(headers).containsExactly(
                new Headers.Header("X-B", "b"),
                new Headers.Header("X-A", "3"));
        assertThat(headers.newBuilder().build()).isEqualTo(headers);
        assertThat(Headers.EMPTY.isEmpty()).isTrue();
    }

    @Test
    void toStringRedactsSensitiveHeaders() {
        final var headers = Headers.builder()
                .add("Authorization", "Bearer secret")
                .add("Accept", "*/*")
                .build();

        assertThat(headers.toString())
                .isEqualTo("Authorization: ██\nAccept: */*\n")
                .doesNotContain("secret");
    }

    @Test
    void getInstant() {
        final var headers = Headers.parse(List.of(
                "last-modified: Sun, 06 Nov 1994 08:49:37 GMT",
                "date: yesterday"));

        assertThat(headers.getInstant("Last-Modified")).isEqualTo(Instant.parse("1994-11-06T08:49:37Z"));
        assertThat(headers.getInstant("date")).isNull();
        assertThat(headers.getInstant("expires")).isNull();
    }
}
