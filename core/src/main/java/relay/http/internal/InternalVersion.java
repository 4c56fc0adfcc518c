/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal;

import org.jspecify.annotations.NonNull;

final class InternalVersion {
    // un-instantiable
    private InternalVersion() {
    }

    static final @NonNull String VERSION = "0.1.0";
}
