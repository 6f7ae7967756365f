package im.arun.pdftranslator.translate;

import im.arun.pdftranslator.chunk.TextChunker;
import im.arun.pdftranslator.config.TranslatorConfig;
import im.arun.pdftranslator.error.PdfTranslationException;
import im.arun.pdftranslator.error.TranslationServiceException;
import im.arun.pdftranslator.model.TextChunk;
import im.arun.pdftranslator.model.TranslatedChunk;
import im.arun.pdftranslator.util.Deadline;
import im.arun.pdftranslator.util.OrderedTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Translates long text by chunking it and sending each chunk to a {@link Translator},
 * then joining the translations back together in chunk order.
 */
public class TranslationOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(TranslationOrchestrator.class);

    private final Translator translator;
    private final TextChunker chunker;
    private final int maxChunkLength;
    private final String sourceLanguage;
    private final int concurrency;

    public TranslationOrchestrator(Translator translator) {
        this(translator, TranslatorConfig.DEFAULT_MAX_CHUNK_LENGTH, "auto", 1);
    }

    /**
     * @param concurrency maximum chunks in flight at once; 1 translates sequentially on the caller thread
     */
    public TranslationOrchestrator(Translator translator, int maxChunkLength, String sourceLanguage, int concurrency) {
        this.translator = translator;
        this.chunker = new TextChunker();
        this.maxChunkLength = maxChunkLength;
        this.sourceLanguage = sourceLanguage;
        this.concurrency = concurrency;
    }

    public String translate(String text, String targetLanguage) {
        return translate(text, targetLanguage, Deadline.none());
    }

    /**
     * @return translated chunks joined by a blank line; empty for empty input
     * @throws TranslationServiceException if any chunk fails; no partial output is returned
     */
    public String translate(String text, String targetLanguage, Deadline deadline) {
        return join(translateChunks(text, targetLanguage, deadline));
    }

    /**
     * Translate every chunk of {@code text}. Result {@code i} is the translation of chunk {@code i}.
     */
    public List<TranslatedChunk> translateChunks(String text, String targetLanguage, Deadline deadline) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<TextChunk> chunks = chunker.chunk(text, maxChunkLength);
        logger.info("Translating {} chars in {} chunk(s) to {}", text.length(), chunks.size(), targetLanguage);

        List<Supplier<TranslatedChunk>> tasks = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            tasks.add(() -> translateChunk(chunk, targetLanguage, deadline));
        }
        return OrderedTaskRunner.run(tasks, concurrency, deadline, "chunk");
    }

    private TranslatedChunk translateChunk(TextChunk chunk, String targetLanguage, Deadline deadline) {
        try {
            String translated = translator.translate(chunk.getText(), sourceLanguage, targetLanguage, deadline);
            logger.debug("Chunk {} translated ({} -> {} chars)", chunk.getIndex(),
                    chunk.length(), translated == null ? 0 : translated.length());
            return new TranslatedChunk(chunk.getIndex(), translated == null ? "" : translated);
        } catch (PdfTranslationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TranslationServiceException(
                    "Translation of chunk " + (chunk.getIndex() + 1) + " failed: " + e.getMessage(), e);
        }
    }

    public static String join(List<TranslatedChunk> chunks) {
        return chunks.stream()
                .map(TranslatedChunk::getText)
                .collect(Collectors.joining(TextChunker.PARAGRAPH_SEPARATOR));
    }
}
