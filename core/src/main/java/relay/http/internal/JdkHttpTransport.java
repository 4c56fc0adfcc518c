/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;
import relay.http.HttpVersion;
import relay.http.RelayHttpException;
import relay.http.Transport;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A {@link Transport} over {@link HttpClient}. Redirects are never followed, and server certificates are not verified.
 */
public final class JdkHttpTransport implements Transport {
    /**
     * Request headers that {@link HttpClient} sets by itself and refuses to receive.
     */
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private final @NonNull HttpClient client;

    public JdkHttpTransport() {
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .sslContext(trustAllSslContext())
                .build();
    }

    @Override
    public @NonNull Response open(final @NonNull Request request) {
        Objects.requireNonNull(request);

        final var builder = HttpRequest.newBuilder(request.uri())
                .timeout(request.timeout());
        final var body = request.body();
        builder.method(request.method(), (body != null)
                ? HttpRequest.BodyPublishers.ofByteArray(body)
                : HttpRequest.BodyPublishers.noBody());
        for (final var header : request.headers()) {
            if (!RESTRICTED_HEADERS.contains(header.name().toLowerCase(Locale.ROOT))) {
                builder.header(header.name(), header.value());
            }
        }

        final HttpResponse<InputStream> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new RelayHttpException("Failed to " + request.method() + " " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayHttpException(new InterruptedIOException("Interrupted while requesting " + request.uri()));
        }

        return new Response(
                response.body(),
                response.statusCode(),
                headerLines(response.headers().map()),
                version(response.version()));
    }

    /**
     * @return one {@code name: value} line per header value. Pseudo-header fields are skipped.
     */
    static @NonNull List<@NonNull String> headerLines(final @NonNull Map<String, List<String>> headers) {
        assert headers != null;

        final var lines = new ArrayList<String>();
        headers.forEach((name, values) -> {
            if (name.startsWith(":")) {
                return;
            }
            for (final var value : values) {
                lines.add(name + ": " + value);
            }
        });
        return lines;
    }

    static @NonNull HttpVersion version(final HttpClient.@NonNull Version version) {
        assert version != null;

        return switch (version) {
            case HTTP_1_1 -> HttpVersion.HTTP_1_1;
            case HTTP_2 -> HttpVersion.HTTP_2;
        };
    }

    private static @NonNull SSLContext trustAllSslContext() {
        final var trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(final X509Certificate[] chain, final String authType) {
            }

            @Override
            public void checkServerTrusted(final X509Certificate[] chain, final String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            final var sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("No TLS support in this runtime", e);
        }
    }
}
