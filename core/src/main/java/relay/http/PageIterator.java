/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http;

import relay.http.internal.engine.RealPageIterator;

import java.io.Closeable;
import java.util.Iterator;

/**
 * A lazy iteration over the pages of a paginated resource, following the {@code rel="next"} relation of each page's
 * {@code Link} header. A page is opened by {@link #next()} only, and the page previously returned is closed first, so
 * that at most one page stream is open at a time.
 * <p>
 * {@link #close()} closes the current page and ends the iteration, it must be called if the iteration is abandoned
 * before {@link #hasNext()} returned false.
 */
public sealed interface PageIterator extends Iterator<Outcome>, Closeable permits RealPageIterator {
    /**
     * @return the index of the page that the next call to {@link #next()} will open, the first page being 0.
     */
    int nextIndex();

    @Override
    void close();
}
