/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.logging;

import org.jspecify.annotations.NonNull;
import relay.http.EventListener;
import relay.http.logging.internal.RealHttpTraceListener;

import static java.lang.System.Logger.Level.INFO;

/**
 * A Relay HTTP event listener which traces every physical attempt in a cURL-like format. It must be installed on an
 * engine with {@link relay.http.HttpEngine.Builder#eventListener}:
 * <pre>
 * {@code
 * HttpEngine engine = HttpEngine.builder()
 *     .eventListener(HttpTraceListener.curl())
 *     .build();
 * }
 * </pre>
 * The format of the traces created by this class should not be considered stable and may change slightly between
 * releases. If you need a stable logging format, use your own event listener.
 */
public sealed interface HttpTraceListener extends EventListener permits RealHttpTraceListener {
    static @NonNull Builder builder() {
        return new RealHttpTraceListener.Builder();
    }

    /**
     * @return a listener that traces both sent requests and received replies to {@link Logger#DEFAULT}.
     */
    static @NonNull HttpTraceListener curl() {
        return builder()
                .categories(Category.SEND_REQUEST, Category.RECEIVE_REPLY)
                .build();
    }

    enum Category {
        /**
         * Traces the request line, the request headers and the request body of each attempt.
         * <p>
         * Example:
         * ```
         * > GET https://example.com/items
         * > Accept: application/json;q=1.000
         * > User-Agent: relayhttp/0.1.0
         * ```
         */
        SEND_REQUEST,

        /**
         * Traces the status and the normalized headers of each reply.
         * <p>
         * Example:
         * ```
         * <p>
         * < 200 (OK)
         * < content-type: application/json
         * < link: <https://example.com/items?page=2>; rel="next"
         * <p>
         * ```
         */
        RECEIVE_REPLY,
    }

    interface Logger {
        void log(String message);

        /**
         * The default logger used by this listener, relying on {@link System.Logger}.
         */
        @NonNull
        Logger DEFAULT = new SystemLogger();

        final class SystemLogger implements Logger {
            private static final System.Logger LOGGER = System.getLogger("relay.http.logging.HttpTraceListener");

            @Override
            public void log(String message) {
                LOGGER.log(INFO, message);
            }
        }
    }

    /**
     * The builder used to create a {@link HttpTraceListener} instance.
     */
    sealed interface Builder permits RealHttpTraceListener.Builder {
        @NonNull
        Builder logger(final @NonNull Logger logger);

        /**
         * Enables the given trace categories. No category is enabled by default.
         */
        @NonNull
        Builder categories(final @NonNull Category @NonNull ... categories);

        /**
         * Replaces the value of the header {@code name} by a placeholder in the traces, in requests and in replies alike.
         */
        @NonNull
        Builder redactHeader(final @NonNull String name);

        @NonNull
        HttpTraceListener build();
    }
}
