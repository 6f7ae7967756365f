package im.arun.pdftranslator.model;

import lombok.Value;

import java.util.List;

/**
 * End-to-end output for one document.
 */
@Value
public class TranslationResult {
    ExtractedDocument document;
    List<TranslatedChunk> chunks;
    String translatedText;
    String targetLanguage;
}
