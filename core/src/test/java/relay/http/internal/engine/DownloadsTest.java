/*
 * Copyright (c) 2025-present, Relay HTTP contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package relay.http.internal.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import relay.http.HttpEngine;
import relay.http.RelayHttpException;
import relay.http.RequestOptions;
import relay.http.ScriptedTransport;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class DownloadsTest {
    @TempDir
    Path directory;

    private final ScriptedTransport transport = new ScriptedTransport();

    private HttpEngine engine() {
        return HttpEngine.builder()
                .transport(transport)
                .downloadDirectory(directory)
                .build();
    }

    @Test
    void localPath() {
        final var dir = Path.of("downloads");

        assertThat(Downloads.localPath(dir, URI.create("http://a.test/data/dump.nt")))
                .isEqualTo(dir.resolve("a.test").resolve("data").resolve("dump.nt"));
        assertThat(Downloads.localPath(dir, URI.create("http://a.test")))
                .isEqualTo(dir.resolve("a.test").resolve("index"));
        assertThat(Downloads.localPath(dir, URI.create("http://a.test/data/")))
                .isEqualTo(dir.resolve("a.test").resolve("data").resolve("index"));
        assertThat(Downloads.localPath(dir, URI.create("http://a.test/../../etc/passwd")))
                .isEqualTo(dir.resolve("a.test").resolve("etc").resolve("passwd"));
        assertThatThrownBy(() -> Downloads.localPath(dir, URI.create("urn:isbn:123")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void downloadConcatenatesEveryPage() throws IOException {
        transport.reply("http://a.test/items", 200, "one\n",
                        "Content-Type: text/plain",
                        "Link: <http://a.test/items?page=2>; rel=\"next\"")
                .reply("http://a.test/items?page=2", 200, "two\n", "Content-Type: text/plain");
        final var file = directory.resolve("items.txt");

        final var result = engine().download(URI.create("http://a.test/items"), file);

        assertThat(result).isEqualTo(file);
        assertThat(Files.readString(file)).isEqualTo("one\ntwo\n");
        assertThat(directory.resolve("items.txt.tmp")).doesNotExist();
    }

    @Test
    void downloadUnderTheDownloadDirectory() throws IOException {
        transport.reply("http://a.test/data/dump.nt", 200, "<a> <b> <c> .", "Content-Type: application/n-triples");

        final var result = engine().download(URI.create("http://a.test/data/dump.nt"));

        assertThat(result).isEqualTo(directory.resolve("a.test").resolve("data").resolve("dump.nt"));
        assertThat(Files.readString(result)).isEqualTo("<a> <b> <c> .");
    }

    @Test
    void downloadOfTheFailureCodeWritesNothing() throws IOException {
        transport.reply("http://a.test/missing", 404, "");
        final var file = directory.resolve("missing");

        final var result = engine().download(URI.create("http://a.test/missing"), file,
                RequestOptions.builder().failure(404).build());

        assertThat(result).isNull();
        assertThat(file).doesNotExist();
        assertThat(directory.resolve("missing.tmp")).doesNotExist();
    }

    @Test
    void failedDownloadLeavesNoFile() {
        transport.reply("http://a.test/broken", 500, "", "Content-Type: text/plain");
        final var file = directory.resolve("broken");

        assertThatThrownBy(() -> engine().download(URI.create("http://a.test/broken"), file,
                RequestOptions.builder().success(200).build()))
                .isInstanceOf(RelayHttpException.class);
        assertThat(file).doesNotExist();
        assertThat(directory.resolve("broken.tmp")).doesNotExist();
    }

    @Test
    void syncSkipsExistingFiles() throws IOException {
        transport.reply("http://a.test/dump", 200, "fresh", "Content-Type: text/plain");
        final var file = directory.resolve("dump");
        Files.writeString(file, "stale");

        assertThat(engine().sync(URI.create("http://a.test/dump"), file)).isEqualTo(file);

        assertThat(Files.readString(file)).isEqualTo("stale");
        assertThat(transport.requests).isEmpty();
    }

    @Test
    void syncDownloadsMissingFiles() throws IOException {
        transport.reply("http://a.test/dump", 200, "fresh", "Content-Type: text/plain");
        final var file = directory.resolve("dump");

        assertThat(engine().sync(URI.create("http://a.test/dump"), file)).isEqualTo(file);

        assertThat(Files.readString(file)).isEqualTo("fresh");
    }
}
