/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * An in-memory transport replaying scripted replies. Replies to the same URI are consumed in order, the last one being
 * repeated forever.
 */
public final class ScriptedTransport implements Transport {
    private final Map<URI, Deque<Reply>> replies = new HashMap<>();
    public final List<Request> requests = new ArrayList<>();
    public final List<TrackedStream> streams = new ArrayList<>();
    /**
     * For each request, the number of body streams that were still open when it was sent.
     */
    public final List<Integer> openStreamsAtRequest = new ArrayList<>();

    public @NonNull ScriptedTransport reply(final @NonNull String uri,
                                            final int status,
                                            final @NonNull String body,
                                            final @NonNull String @NonNull ... headerLines) {
        replies.computeIfAbsent(URI.create(uri), k -> new ArrayDeque<>())
                .add(new Reply(status, List.of(headerLines), body.getBytes(UTF_8)));
        return this;
    }

    public @NonNull ScriptedTransport redirect(final @NonNull String uri,
                                               final int status,
                                               final @NonNull String location) {
        return reply(uri, status, "", "Location: " + location);
    }

    @Override
    public @NonNull Response open(final @NonNull Request request) {
        openStreamsAtRequest.add((int) streams.stream().filter(stream -> !stream.closed).count());
        requests.add(request);

        final var queue = replies.get(request.uri());
        if (queue == null || queue.isEmpty()) {
            throw new RelayHttpException("No reply scripted for " + request.uri());
        }
        final var reply = (queue.size() > 1) ? queue.poll() : queue.peek();
        final var stream = new TrackedStream(reply.body);
        streams.add(stream);
        return new Response(stream, reply.status, reply.headerLines, HttpVersion.HTTP_1_1);
    }

    public @NonNull List<@NonNull URI> requestedUris() {
        return requests.stream().map(Request::uri).toList();
    }

    private record Reply(int status, List<String> headerLines, byte[] body) {
    }

    public static final class TrackedStream extends ByteArrayInputStream {
        public boolean closed = false;

        TrackedStream(final byte @NonNull [] content) {
            super(content);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
