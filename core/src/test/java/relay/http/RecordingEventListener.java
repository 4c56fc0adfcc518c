/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Records the events of an engine as readable strings.
 */
public final class RecordingEventListener implements EventListener {
    public final List<String> events = new ArrayList<>();

    @Override
    public void pageStart(final @NonNull URI uri, final int index) {
        events.add("pageStart " + index + " " + uri);
    }

    @Override
    public void attemptStart(final Transport.@NonNull Request request) {
        events.add("attemptStart " + request.method() + " " + request.uri());
    }

    @Override
    public void attemptEnd(final @NonNull Metadata metadata) {
        events.add("attemptEnd " + metadata.getStatus());
    }

    @Override
    public void attemptFailed(final @NonNull URI uri, final @NonNull RelayHttpException exception) {
        events.add("attemptFailed " + uri);
    }

    @Override
    public void redirectDecision(final @NonNull URI from, final @NonNull URI to, final int hop) {
        events.add("redirectDecision " + hop + " " + to);
    }

    @Override
    public void retryDecision(final @NonNull URI uri, final int status, final int retries, final boolean retrying) {
        events.add("retryDecision " + status + " " + retries + " " + retrying);
    }

    @Override
    public void missingContentType(final @NonNull URI uri) {
        events.add("missingContentType " + uri);
    }

    @Override
    public void nextPage(final @NonNull URI uri, final @Nullable URI next) {
        events.add("nextPage " + next);
    }
}
