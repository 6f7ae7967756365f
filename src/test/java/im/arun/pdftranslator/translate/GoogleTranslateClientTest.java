package im.arun.pdftranslator.translate;

import im.arun.pdftranslator.error.ErrorKind;
import im.arun.pdftranslator.error.PdfTranslationException;
import im.arun.pdftranslator.error.TranslationServiceException;
import im.arun.pdftranslator.util.Deadline;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GoogleTranslateClientTest {

    private MockWebServer server;
    private GoogleTranslateClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient http = new OkHttpClient.Builder()
                .readTimeout(5, TimeUnit.SECONDS)
                .build();
        client = new GoogleTranslateClient(http, server.url("/").toString(), 2, 1);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsFormAndConcatenatesSegments() throws InterruptedException {
        server.enqueue(json("[[[\"你好，\",\"Hello, \",null,null,10],[\"世界\",\"world\",null,null,10]],null,\"en\"]"));

        String translated = client.translate("Hello, world", "auto", "zh-CN");

        assertEquals("你好，世界", translated);

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/translate_a/single", request.getRequestUrl().encodedPath());
        assertEquals("gtx", request.getRequestUrl().queryParameter("client"));
        assertEquals("t", request.getRequestUrl().queryParameter("dt"));

        Map<String, String> form = parseForm(request.getBody().readUtf8());
        assertEquals("auto", form.get("sl"));
        assertEquals("zh-CN", form.get("tl"));
        assertEquals("Hello, world", form.get("q"));
    }

    @Test
    void missingSegmentsMeanEmptyTranslation() {
        server.enqueue(json("[null,null,\"en\"]"));

        assertEquals("", client.translate("...", "auto", "de"));
    }

    @Test
    void blankTextIsNotSent() {
        assertEquals("", client.translate("  ", "auto", "de"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void retriesServerErrorsAndRateLimits() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(json("[[[\"Bonjour\",\"Hello\",null,null,1]]]"));

        assertEquals("Bonjour", client.translate("Hello", "auto", "fr"));
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void givesUpAfterConfiguredRetries() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
        }

        TranslationServiceException e = assertThrows(TranslationServiceException.class,
                () -> client.translate("Hello", "auto", "fr"));

        assertEquals(ErrorKind.TRANSLATION_FAILED, e.getKind());
        assertTrue(e.getMessage().contains("3 attempt(s)"));
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("invalid target language"));
        server.enqueue(json("[[[\"never\",\"used\"]]]"));

        TranslationServiceException e = assertThrows(TranslationServiceException.class,
                () -> client.translate("Hello", "auto", "xx"));

        assertTrue(e.getMessage().contains("HTTP 400"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void unreadableResponseIsNotRetried() {
        server.enqueue(json("<html>captcha</html>"));

        assertThrows(TranslationServiceException.class, () -> client.translate("Hello", "auto", "fr"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void retryBackoffNeverOverrunsTheDeadline() {
        GoogleTranslateClient slowBackoff = new GoogleTranslateClient(
                new OkHttpClient(), server.url("/").toString(), 5, 2000);
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(json("[[[\"Bonjour\",\"Hello\"]]]"));

        long started = System.nanoTime();
        PdfTranslationException e = assertThrows(PdfTranslationException.class,
                () -> slowBackoff.translate("Hello", "auto", "fr", Deadline.after(Duration.ofMillis(500))));

        assertEquals(ErrorKind.CANCELLED, e.getKind());
        assertEquals(1, server.getRequestCount());
        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(2), "waited out the backoff");
    }

    @Test
    void slowResponseIsCutOffAtTheDeadline() {
        server.enqueue(json("[[[\"Bonjour\",\"Hello\"]]]").setBodyDelay(3, TimeUnit.SECONDS));

        long started = System.nanoTime();
        PdfTranslationException e = assertThrows(PdfTranslationException.class,
                () -> client.translate("Hello", "auto", "fr", Deadline.after(Duration.ofMillis(300))));

        assertEquals(ErrorKind.CANCELLED, e.getKind());
        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(2), "read ran past the deadline");
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json; charset=utf-8")
                .setBody(body);
    }

    private static Map<String, String> parseForm(String body) {
        Map<String, String> form = new HashMap<>();
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            form.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return form;
    }
}
