/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

module relay.http.logging {
    requires transitive relay.http;

    requires static org.jspecify;

    exports relay.http.logging;
}
