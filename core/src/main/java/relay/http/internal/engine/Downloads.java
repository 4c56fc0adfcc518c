/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import relay.http.HttpEngine;
import relay.http.RequestOptions;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Stores every page of a resource into a local file. The content is written into a temporary sibling file first, so
 * that an interrupted download never leaves a partial file under the target name.
 */
final class Downloads {
    private static final System.Logger LOGGER = System.getLogger("relay.http.Downloads");

    static final @NonNull String TMP_SUFFIX = ".tmp";
    static final @NonNull String INDEX = "index";

    // un-instantiable
    private Downloads() {
    }

    static @Nullable Path download(final @NonNull HttpEngine engine,
                                   final @NonNull URI uri,
                                   final @NonNull Path file,
                                   final @NonNull RequestOptions options) throws IOException {
        assert engine != null;
        assert file != null;

        final var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final var tmp = file.resolveSibling(file.getFileName() + TMP_SUFFIX);

        final boolean complete;
        try (final var out = Files.newOutputStream(tmp)) {
            complete = engine.call(uri, body -> body.transferTo(out), options);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }

        if (!complete) {
            Files.deleteIfExists(tmp);
            return null;
        }

        try {
            Files.move(tmp, file, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ignored) {
            Files.move(tmp, file, REPLACE_EXISTING);
        }
        LOGGER.log(DEBUG, "Downloaded {0} into {1}", uri, file);
        return file;
    }

    static @Nullable Path sync(final @NonNull HttpEngine engine,
                               final @NonNull URI uri,
                               final @NonNull Path file,
                               final @NonNull RequestOptions options) throws IOException {
        if (Files.exists(file)) {
            return file;
        }
        return download(engine, uri, file, options);
    }

    /**
     * @return the local path of {@code uri} under {@code directory}: {@code <directory>/<host>/<path segments>}. The
     * last segment is {@code index} when the path of {@code uri} is empty or ends with a slash.
     */
    static @NonNull Path localPath(final @NonNull Path directory, final @NonNull URI uri) {
        assert directory != null;
        final var host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("uri has no host: " + uri);
        }

        var result = directory.resolve(host);
        final var path = uri.getPath();
        if (path != null) {
            for (final var segment : path.split("/")) {
                // dot segments could escape the download directory
                if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                    continue;
                }
                result = result.resolve(segment);
            }
        }
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            result = result.resolve(INDEX);
        }
        return result;
    }
}
