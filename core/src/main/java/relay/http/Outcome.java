/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.internal.RealOutcome;

import java.io.Closeable;
import java.io.InputStream;
import java.net.URI;
import java.util.List;

/**
 * The result of one logical request: the body of its terminal attempt, and the description of every physical attempt
 * that led to it. Errors are never represented here, they are thrown by {@link HttpEngine#open(URI, RequestOptions)}.
 * <p>
 * The body stream belongs to the caller. Use this outcome in a try-with-resources block to release it:
 * <pre>
 * {@code
 * try (Outcome outcome = engine.open(uri, options)) {
 *   byte[] content = outcome.getBody().readAllBytes();
 * }
 * }
 * </pre>
 */
public sealed interface Outcome extends Closeable permits RealOutcome {
    /**
     * @return the body of the terminal attempt. For a silent negative outcome, this is an empty stream.
     */
    @NonNull
    InputStream getBody();

    /**
     * @return false if the logical request ended with the status code declared with
     * {@link RequestOptions.Builder#failure(int)}, true otherwise.
     */
    boolean isSuccessful();

    /**
     * @return the status code of the terminal attempt.
     */
    int getStatusCode();

    /**
     * @return the URI requested by the terminal attempt, after following every redirect.
     */
    @NonNull
    URI getFinalUri();

    /**
     * @return an immutable list of all the attempts of this logical request, the most recent one first.
     */
    @NonNull
    List<@NonNull Metadata> getMetadata();

    /**
     * @return the target of the {@code Link} header relation {@code next} of the terminal attempt, or null if there is
     * none.
     */
    @Nullable
    URI getNext();

    /**
     * Closes the body stream.
     */
    @Override
    void close();
}
