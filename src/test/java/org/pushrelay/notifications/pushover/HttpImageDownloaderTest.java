package org.pushrelay.notifications.pushover;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pushrelay.testutil.StubHttpServer;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpImageDownloaderTest {

    private StubHttpServer images;
    private HttpImageDownloader downloader;

    @BeforeEach
    void setUp() {
        images = new StubHttpServer();
        downloader = new HttpImageDownloader(Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        images.close();
    }

    @Test
    void downloadsBodyAndMediaType() throws IOException {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};
        images.image("/img/logo.png", "image/png; charset=binary", png);

        try (Attachment attachment = downloader.download(images.uri("/img/logo.png").toString(), 1024)) {
            assertThat(attachment.content()).isEqualTo(png);
            assertThat(attachment.contentType()).isEqualTo("image/png");
            assertThat(attachment.fileName()).isEqualTo("logo.png");
            assertThat(attachment.size()).isEqualTo(png.length);
        }
    }

    @Test
    void readsAtMostOneByteOverTheLimit() throws IOException {
        byte[] big = new byte[5000];
        Arrays.fill(big, (byte) 7);
        images.image("/big.gif", "image/gif", big);

        try (Attachment attachment = downloader.download(images.uri("/big.gif").toString(), 100)) {
            assertThat(attachment.size()).isEqualTo(101);
        }
    }

    @Test
    void missingContentTypeIsReportedEmpty() throws IOException {
        images.image("/raw", null, new byte[]{1});

        try (Attachment attachment = downloader.download(images.uri("/raw").toString(), 10)) {
            assertThat(attachment.contentType()).isEmpty();
            assertThat(attachment.fileName()).isEqualTo("raw");
        }
    }

    @Test
    void errorStatusIsAFailure() {
        images.failing("/gone.png", 404);

        assertThatThrownBy(() -> downloader.download(images.uri("/gone.png").toString(), 10))
                .isInstanceOf(IOException.class)
                .hasMessage("HTTP 404");
    }

    @Test
    void malformedUrlIsAFailure() {
        assertThatThrownBy(() -> downloader.download("not a url", 10))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> downloader.download("/relative/path.png", 10))
                .isInstanceOf(IOException.class);
    }

    @Test
    void closingTheAttachmentIsIdempotent() throws IOException {
        images.image("/a.jpg", "image/jpeg", new byte[]{1, 2});
        Attachment attachment = downloader.download(images.uri("/a.jpg").toString(), 10);

        attachment.close();
        attachment.close();

        assertThat(attachment.isClosed()).isTrue();
        assertThatThrownBy(attachment::content).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fileNameFallsBackForBarePaths() {
        assertThat(HttpImageDownloader.fileName(URI.create("https://example.com/"))).isEqualTo("attachment");
        assertThat(HttpImageDownloader.fileName(URI.create("https://example.com"))).isEqualTo("attachment");
        assertThat(HttpImageDownloader.fileName(URI.create("https://example.com/a/b/c.gif?x=1"))).isEqualTo("c.gif");
    }
}
