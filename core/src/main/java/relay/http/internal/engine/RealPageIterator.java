/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.CyclicLinkHeaderException;
import relay.http.Outcome;
import relay.http.PageIterator;
import relay.http.RequestOptions;

import java.net.URI;
import java.util.NoSuchElementException;

public final class RealPageIterator implements PageIterator {
    private final @NonNull RealHttpEngine engine;
    private final @NonNull RequestOptions options;
    private @Nullable URI nextUri;
    private @Nullable Outcome current = null;
    private int index = 0;

    RealPageIterator(final @NonNull RealHttpEngine engine,
                     final @NonNull URI uri,
                     final @NonNull RequestOptions options) {
        assert engine != null;
        assert uri != null;
        assert options != null;

        this.engine = engine;
        this.nextUri = uri;
        this.options = options;
    }

    @Override
    public boolean hasNext() {
        return nextUri != null;
    }

    @Override
    public @NonNull Outcome next() {
        final var requested = nextUri;
        if (requested == null) {
            throw new NoSuchElementException();
        }
        closeCurrent();

        final var eventListener = engine.getEventListener();
        eventListener.pageStart(requested, index);
        final Outcome outcome;
        try {
            outcome = engine.open(requested, options);
        } catch (RuntimeException e) {
            nextUri = null;
            throw e;
        }
        index++;

        if (!outcome.isSuccessful()) {
            nextUri = null;
            current = outcome;
            return outcome;
        }

        final var next = outcome.getNext();
        eventListener.nextPage(requested, next);
        if (requested.equals(next)) {
            nextUri = null;
            outcome.close();
            throw new CyclicLinkHeaderException(next);
        }
        nextUri = next;
        current = outcome;
        return outcome;
    }

    @Override
    public int nextIndex() {
        return index;
    }

    @Override
    public void close() {
        nextUri = null;
        closeCurrent();
    }

    private void closeCurrent() {
        final var previous = current;
        if (previous != null) {
            current = null;
            previous.close();
        }
    }
}
