/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

final class RequestStateTest {
    private static final URI START = URI.create("http://a.test/");

    @Test
    void retryCounterStartsAtOne() {
        final var state = new RequestState(START, 5, 3);

        assertThat(state.retries()).isEqualTo(1);
        assertThat(state.failed()).isTrue();
        assertThat(state.failed()).isFalse();
        assertThat(state.retries()).isEqualTo(3);
    }

    @Test
    void defaultRetryLimitNeverRetries() {
        assertThat(new RequestState(START, 5, 1).failed()).isFalse();
    }

    @Test
    void visitedUris() {
        final var state = new RequestState(START, 2, 1);

        assertThat(state.visit(URI.create("http://a.test/1"))).isFalse();
        assertThat(state.hopLimitExceeded()).isFalse();
        assertThat(state.visit(START)).isTrue();
        assertThat(state.hopLimitExceeded()).isTrue();
        assertThat(state.hops()).isEqualTo(2);
        assertThat(state.visited()).containsExactly(START, URI.create("http://a.test/1"), START);
    }
}
