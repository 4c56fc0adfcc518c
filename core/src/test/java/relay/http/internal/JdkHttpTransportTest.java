/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.junit.jupiter.api.Test;
import relay.http.Headers;
import relay.http.HttpVersion;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

final class JdkHttpTransportTest {
    @Test
    void headerLinesRepeatMultiValuedFields() {
        final var map = new LinkedHashMap<String, List<String>>();
        map.put(":status", List.of("200"));
        map.put("content-type", List.of("text/plain"));
        map.put("link", List.of("<a>; rel=\"next\"", "<b>; rel=\"prev\""));

        final var lines = JdkHttpTransport.headerLines(map);

        assertThat(lines).containsExactly(
                "content-type: text/plain",
                "link: <a>; rel=\"next\"",
                "link: <b>; rel=\"prev\"");
        assertThat(Headers.parse(lines).values("Link")).hasSize(2);
    }

    @Test
    void versions() {
        assertThat(JdkHttpTransport.version(HttpClient.Version.HTTP_1_1)).isEqualTo(HttpVersion.HTTP_1_1);
        assertThat(JdkHttpTransport.version(HttpClient.Version.HTTP_2)).isEqualTo(HttpVersion.HTTP_2);
        assertThat(HttpVersion.HTTP_2).hasToString("HTTP/2");
        assertThat(HttpVersion.HTTP_1_1).hasToString("HTTP/1.1");
    }
}
