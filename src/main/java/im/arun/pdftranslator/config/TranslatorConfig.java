package im.arun.pdftranslator.config;

import lombok.Data;

@Data
public class TranslatorConfig {
    public static final int DEFAULT_DPI = 300;
    public static final int DEFAULT_MAX_CHUNK_LENGTH = 4500;
    public static final int DEFAULT_OCR_THRESHOLD = 40;

    private int dpi = DEFAULT_DPI;
    private String ocrLanguage = "eng";
    private String sourceLanguage = "auto";
    private String targetLanguage = "zh-CN";
    private int maxChunkLength = DEFAULT_MAX_CHUNK_LENGTH;
    private int ocrThreshold = DEFAULT_OCR_THRESHOLD;
    private PageFailurePolicy pageFailurePolicy = PageFailurePolicy.ISOLATE;
    private int extractionConcurrency = 1;
    private int translationConcurrency = 1;
    private int translationMaxRetries = 2;
    private long timeoutSeconds = 0;
    private String tessdataPath;
    private String translateBaseUrl = "https://translate.googleapis.com";

    public TranslatorConfig copy() {
        TranslatorConfig copy = new TranslatorConfig();
        copy.setDpi(dpi);
        copy.setOcrLanguage(ocrLanguage);
        copy.setSourceLanguage(sourceLanguage);
        copy.setTargetLanguage(targetLanguage);
        copy.setMaxChunkLength(maxChunkLength);
        copy.setOcrThreshold(ocrThreshold);
        copy.setPageFailurePolicy(pageFailurePolicy);
        copy.setExtractionConcurrency(extractionConcurrency);
        copy.setTranslationConcurrency(translationConcurrency);
        copy.setTranslationMaxRetries(translationMaxRetries);
        copy.setTimeoutSeconds(timeoutSeconds);
        copy.setTessdataPath(tessdataPath);
        copy.setTranslateBaseUrl(translateBaseUrl);
        return copy;
    }
}
