/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.logging;

import org.junit.jupiter.api.Test;
import relay.http.HttpEngine;
import relay.http.HttpVersion;
import relay.http.MediaType;
import relay.http.RequestOptions;
import relay.http.Transport;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

final class HttpTraceListenerTest {
    private final List<String> messages = new ArrayList<>();
    private final Transport transport = request -> new Transport.Response(
            new ByteArrayInputStream(new byte[0]),
            404,
            List.of("Content-Type: text/plain", "X-Served-By: cache-1"),
            HttpVersion.HTTP_1_1);

    private HttpEngine engine(final HttpTraceListener listener) {
        return HttpEngine.builder()
                .transport(transport)
                .eventListener(listener)
                .build();
    }

    @Test
    void tracesRequestsAndReplies() {
        final var listener = HttpTraceListener.builder()
                .logger(messages::add)
                .categories(HttpTraceListener.Category.SEND_REQUEST, HttpTraceListener.Category.RECEIVE_REPLY)
                .build();

        engine(listener).open(URI.create("http://a.test/"), RequestOptions.builder()
                .header("Authorization", "Bearer secret")
                .build()).close();

        assertThat(messages).containsExactly(
                "> GET http://a.test/",
                "> Authorization: Bearer secret",
                "> Accept: */*",
                "> User-Agent: relayhttp/0.1.0",
                "",
                "< 404 (Not Found)",
                "< content-type: text/plain",
                "< x-served-by: cache-1",
                "");
    }

    @Test
    void tracesRequestBody() {
        final var listener = HttpTraceListener.builder()
                .logger(messages::add)
                .categories(HttpTraceListener.Category.SEND_REQUEST)
                .build();

        engine(listener).open(URI.create("http://a.test/"), RequestOptions.builder()
                .post("ASK { ?s ?p ?o }", MediaType.get("application/sparql-query"))
                .build()).close();

        assertThat(messages).first().isEqualTo("> POST http://a.test/");
        assertThat(messages).last().isEqualTo("REQUEST BODY\nASK { ?s ?p ?o }");
        assertThat(messages).noneMatch(message -> message.startsWith("<"));
    }

    @Test
    void redactsHeaders() {
        final var listener = HttpTraceListener.builder()
                .logger(messages::add)
                .categories(HttpTraceListener.Category.SEND_REQUEST)
                .redactHeader("authorization")
                .build();

        engine(listener).open(URI.create("http://a.test/"), RequestOptions.builder()
                .header("Authorization", "Bearer secret")
                .build()).close();

        assertThat(messages).contains("> Authorization: ██");
        assertThat(messages).noneMatch(message -> message.contains("secret"));
    }

    @Test
    void redactsReplyHeaders() {
        final var listener = HttpTraceListener.builder()
                .logger(messages::add)
                .categories(HttpTraceListener.Category.RECEIVE_REPLY)
                .redactHeader("Set-Cookie")
                .build();
        final Transport cookieTransport = request -> new Transport.Response(
                new ByteArrayInputStream(new byte[0]),
                200,
                List.of("Set-Cookie: session=secret"),
                HttpVersion.HTTP_1_1);

        HttpEngine.builder()
                .transport(cookieTransport)
                .eventListener(listener)
                .build()
                .open(URI.create("http://a.test/"))
                .close();

        assertThat(messages).containsExactly("", "< 200 (OK)", "< set-cookie: ██", "");
    }

    @Test
    void withoutCategoriesNothingIsTraced() {
        final var listener = HttpTraceListener.builder()
                .logger(messages::add)
                .build();

        engine(listener).open(URI.create("http://a.test/")).close();

        assertThat(messages).isEmpty();
    }
}
