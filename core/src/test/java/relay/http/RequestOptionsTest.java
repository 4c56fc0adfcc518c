/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class RequestOptionsTest {
    @Test
    void defaults() {
        final var options = RequestOptions.DEFAULT;

        assertThat(options.getAccept()).isEqualTo("*/*");
        assertThat(options.getMethod()).isEqualTo("GET");
        assertThat(options.getNumberOfHops()).isNull();
        assertThat(options.getNumberOfRetries()).isNull();
        assertThat(options.getSuccess()).isNull();
        assertThat(options.getFailure()).isNull();
        assertThat(options.isRawStatus()).isFalse();
        assertThat(options.getHeaders()).isEmpty();
        assertThat(options.getBody()).isNull();
        assertThat(options.getTimeout()).isNull();
    }

    @Test
    void acceptExtension() {
        assertThat(RequestOptions.builder().accept("ttl").build().getAccept()).isEqualTo("text/turtle;q=1.000");
        assertThatThrownBy(() -> RequestOptions.builder().accept("nope"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RequestOptions.builder().accept(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void postDefaultsToPostMethod() {
        final var options = RequestOptions.builder().post("hello").build();

        assertThat(options.getMethod()).isEqualTo("POST");
        assertThat(options.getBody()).isNotNull();
        assertThat(options.getBody().contentType()).hasToString("text/plain; charset=utf-8");
        assertThat(options.newBuilder().method("put").build().getMethod()).isEqualTo("PUT");
    }

    @Test
    void invalidSettings() {
        final var builder = RequestOptions.builder();

        assertThatThrownBy(() -> builder.numberOfHops(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.numberOfRetries(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.success(404)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.failure(200)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.header("Accept", "*/*")).isInstanceOf(IllegalArgumentException.class);
    }
}
