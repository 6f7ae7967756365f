package im.arun.pdftranslator.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.pdftranslator.error.ErrorKind;
import im.arun.pdftranslator.error.PdfTranslationException;
import im.arun.pdftranslator.error.TranslationServiceException;
import im.arun.pdftranslator.util.Deadline;
import okhttp3.Call;
import okhttp3.ConnectionPool;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Client for the public Google Translate web endpoint ({@code client=gtx}).
 * Retries transient failures (I/O errors, HTTP 429 and 5xx) with exponential backoff.
 */
public class GoogleTranslateClient implements Translator {
    private static final Logger logger = LoggerFactory.getLogger(GoogleTranslateClient.class);
    public static final String DEFAULT_BASE_URL = "https://translate.googleapis.com";
    private static final long BASE_BACKOFF_MS = 1000;
    private static final long MAX_BACKOFF_MS = 30000;

    private final OkHttpClient httpClient;
    private final HttpUrl endpoint;
    private final int maxRetries;
    private final long baseBackoffMs;
    private final ObjectMapper objectMapper;

    public GoogleTranslateClient() {
        this(DEFAULT_BASE_URL, 2);
    }

    public GoogleTranslateClient(String baseUrl, int maxRetries) {
        this(defaultHttpClient(), baseUrl, maxRetries, BASE_BACKOFF_MS);
    }

    public GoogleTranslateClient(OkHttpClient httpClient, String baseUrl, int maxRetries, long baseBackoffMs) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid translate base URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.endpoint = base.newBuilder()
                .addPathSegments("translate_a/single")
                .addQueryParameter("client", "gtx")
                .addQueryParameter("dt", "t")
                .build();
        this.maxRetries = Math.max(0, maxRetries);
        this.baseBackoffMs = baseBackoffMs;
        this.objectMapper = new ObjectMapper();
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(60, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(8, 5, TimeUnit.MINUTES))
                .build();
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        return translate(text, sourceLanguage, targetLanguage, Deadline.none());
    }

    /**
     * Retries stop as soon as the next backoff would run past {@code deadline}.
     */
    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage, Deadline deadline) {
        if (text == null || text.isBlank()) {
            return "";
        }

        int attempts = maxRetries + 1;
        for (int attempt = 0; ; attempt++) {
            deadline.checkpoint("translation attempt " + (attempt + 1));
            try {
                return executeRequest(text, sourceLanguage, targetLanguage, deadline);
            } catch (IOException e) {
                if (deadline.isExpired()) {
                    throw new PdfTranslationException(ErrorKind.CANCELLED,
                            "Deadline exceeded during translation attempt " + (attempt + 1), e);
                }
                if (attempt + 1 >= attempts) {
                    throw new TranslationServiceException(
                            "Translation failed after " + attempts + " attempt(s): " + e.getMessage(), e);
                }
                logger.error("Translate call failed (attempt {}/{}): {}", attempt + 1, attempts, e.getMessage());
                sleepBeforeRetry(attempt, deadline);
            }
        }
    }

    /**
     * @throws IOException                 for failures worth retrying
     * @throws TranslationServiceException for requests the service will keep rejecting
     */
    private String executeRequest(String text, String sourceLanguage, String targetLanguage, Deadline deadline)
            throws IOException {
        FormBody body = new FormBody.Builder()
                .add("sl", sourceLanguage)
                .add("tl", targetLanguage)
                .add("q", text)
                .build();

        Request request = new Request.Builder()
                .url(endpoint)
                .post(body)
                .build();

        Call call = httpClient.newCall(request);
        long remaining = deadline.remainingNanos();
        if (remaining != Long.MAX_VALUE) {
            // a zero okio timeout means none
            call.timeout().timeout(Math.max(remaining, 1), TimeUnit.NANOSECONDS);
        }
        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                String message = "Translate API error (HTTP " + response.code() + "): " + abbreviate(payload);
                if (response.code() == 429 || response.code() >= 500) {
                    throw new IOException(message);
                }
                throw new TranslationServiceException(message);
            }
            return parseTranslation(payload);
        }
    }

    /**
     * The response is a nested array; element [0] lists the translated segments,
     * each segment's element [0] being its translated text.
     */
    String parseTranslation(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new TranslationServiceException("Unreadable translate response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new TranslationServiceException("Unexpected translate response: " + abbreviate(payload));
        }

        JsonNode segments = root.get(0);
        if (segments == null || segments.isNull()) {
            return "";
        }
        StringBuilder translated = new StringBuilder();
        for (JsonNode segment : segments) {
            JsonNode segmentText = segment.get(0);
            if (segmentText != null && segmentText.isTextual()) {
                translated.append(segmentText.asText());
            }
        }
        return translated.toString();
    }

    private void sleepBeforeRetry(int attempt, Deadline deadline) {
        long backoff = Math.min(baseBackoffMs * (1L << Math.min(attempt, 20)), MAX_BACKOFF_MS);
        if (TimeUnit.MILLISECONDS.toNanos(backoff) >= deadline.remainingNanos()) {
            throw new PdfTranslationException(ErrorKind.CANCELLED,
                    "Deadline exceeded before retry " + (attempt + 1) + " of translation request");
        }
        logger.debug("Retrying in {}ms", backoff);
        try {
            Thread.sleep(backoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PdfTranslationException(ErrorKind.CANCELLED, "Interrupted during retry wait", ie);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
