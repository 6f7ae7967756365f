package im.arun.pdftranslator.translate;

import im.arun.pdftranslator.error.TranslationServiceException;
import im.arun.pdftranslator.util.Deadline;

/**
 * Machine translation capability. Implementations must be safe to call from several threads.
 */
public interface Translator {

    /**
     * @param text           text to translate, within the service's request-size limit
     * @param sourceLanguage source language code, or {@code "auto"} to let the service detect it
     * @param targetLanguage target language code, e.g. {@code "zh-CN"}
     * @return translated text
     * @throws TranslationServiceException if the service rejected the request or could not be reached
     */
    String translate(String text, String sourceLanguage, String targetLanguage);

    /**
     * Same as {@link #translate(String, String, String)}, bounded by {@code deadline}.
     * Implementations that wait between attempts override this to stop waiting once it expires.
     */
    default String translate(String text, String sourceLanguage, String targetLanguage, Deadline deadline) {
        deadline.checkpoint("translation request");
        return translate(text, sourceLanguage, targetLanguage);
    }
}
