package im.arun.pdftranslator.service;

import im.arun.pdftranslator.config.ConfigLoader;
import im.arun.pdftranslator.config.TranslatorConfig;
import im.arun.pdftranslator.error.EmptyDocumentException;
import im.arun.pdftranslator.error.ErrorKind;
import im.arun.pdftranslator.error.PdfTranslationException;
import im.arun.pdftranslator.model.ExtractedDocument;
import im.arun.pdftranslator.model.PageResult;
import im.arun.pdftranslator.model.TranslatedChunk;
import im.arun.pdftranslator.model.TranslationResult;
import im.arun.pdftranslator.ocr.OcrEngine;
import im.arun.pdftranslator.ocr.TesseractOcrEngine;
import im.arun.pdftranslator.pdf.DocumentExtractor;
import im.arun.pdftranslator.pdf.PageExtractor;
import im.arun.pdftranslator.translate.GoogleTranslateClient;
import im.arun.pdftranslator.translate.TranslationOrchestrator;
import im.arun.pdftranslator.translate.Translator;
import im.arun.pdftranslator.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * PDF in, translated text out: page extraction with OCR fallback, chunking and translation.
 * Holds no per-request state; one instance can serve concurrent requests.
 */
public class PdfTranslationService {
    private static final Logger logger = LoggerFactory.getLogger(PdfTranslationService.class);

    private final TranslatorConfig config;
    private final DocumentExtractor documentExtractor;
    private final TranslationOrchestrator orchestrator;

    /**
     * Production wiring: Tesseract for OCR, Google Translate for translation.
     */
    public PdfTranslationService(TranslatorConfig config) {
        this(config,
                new TesseractOcrEngine(config.getTessdataPath()),
                new GoogleTranslateClient(config.getTranslateBaseUrl(), config.getTranslationMaxRetries()));
    }

    /**
     * @throws im.arun.pdftranslator.error.ConfigurationException if {@code config} is invalid
     */
    public PdfTranslationService(TranslatorConfig config, OcrEngine ocrEngine, Translator translator) {
        ConfigLoader.validate(config);
        this.config = config.copy();
        PageExtractor pageExtractor = new PageExtractor(ocrEngine, config.getOcrThreshold());
        this.documentExtractor = new DocumentExtractor(
                pageExtractor, config.getPageFailurePolicy(), config.getExtractionConcurrency());
        this.orchestrator = new TranslationOrchestrator(
                translator, config.getMaxChunkLength(), config.getSourceLanguage(), config.getTranslationConcurrency());
    }

    /**
     * A deadline for one request, derived from {@code timeoutSeconds}; unbounded when 0.
     */
    public Deadline newDeadline() {
        return Deadline.after(Duration.ofSeconds(config.getTimeoutSeconds()));
    }

    public ExtractedDocument extract(Path pdfPath) {
        return extract(pdfPath, newDeadline());
    }

    public ExtractedDocument extract(Path pdfPath, Deadline deadline) {
        logger.info("Extracting {} (dpi={}, ocr_lang={})", pdfPath, config.getDpi(), config.getOcrLanguage());
        return documentExtractor.extract(pdfPath, config.getDpi(), config.getOcrLanguage(), deadline);
    }

    public ExtractedDocument extract(byte[] pdfBytes, Deadline deadline) {
        logger.info("Extracting {} byte PDF (dpi={}, ocr_lang={})", pdfBytes.length, config.getDpi(), config.getOcrLanguage());
        return documentExtractor.extract(pdfBytes, config.getDpi(), config.getOcrLanguage(), deadline);
    }

    public TranslationResult translate(Path pdfPath) {
        return translate(pdfPath, newDeadline());
    }

    public TranslationResult translate(Path pdfPath, Deadline deadline) {
        return translateExtracted(extract(pdfPath, deadline), config.getTargetLanguage(), deadline);
    }

    public TranslationResult translate(byte[] pdfBytes) {
        return translate(pdfBytes, config.getTargetLanguage(), newDeadline());
    }

    /**
     * @param targetLanguage overrides the configured target for this request
     * @throws im.arun.pdftranslator.error.InvalidDocumentException if the bytes are not a readable PDF
     * @throws PdfTranslationException of kind {@link ErrorKind#EXTRACTION_FAILED} if every page failed to extract
     * @throws EmptyDocumentException if the pages were read but none yields any text
     * @throws im.arun.pdftranslator.error.TranslationServiceException if translating any chunk fails
     */
    public TranslationResult translate(byte[] pdfBytes, String targetLanguage, Deadline deadline) {
        return translateExtracted(extract(pdfBytes, deadline), targetLanguage, deadline);
    }

    /**
     * Translate an already extracted document.
     */
    public TranslationResult translateExtracted(ExtractedDocument document, String targetLanguage, Deadline deadline) {
        if (document.allPagesFailed()) {
            PageResult first = document.firstFailedPage().orElseThrow();
            throw new PdfTranslationException(ErrorKind.EXTRACTION_FAILED,
                    "No page of the PDF could be read; page " + first.getPageNumber() + ": " + first.getFailureReason(),
                    first.getFailureCause());
        }
        if (!document.hasText()) {
            throw new EmptyDocumentException("Could not extract any text from the PDF (even with OCR)");
        }
        String target = targetLanguage == null || targetLanguage.isBlank() ? config.getTargetLanguage() : targetLanguage;
        List<TranslatedChunk> chunks = orchestrator.translateChunks(document.getText(), target, deadline);
        String translated = TranslationOrchestrator.join(chunks);
        logger.info("Translated {} pages into {} chars ({})", document.getPageCount(), translated.length(), target);
        return new TranslationResult(document, chunks, translated, target);
    }

    public TranslatorConfig getConfig() {
        return config.copy();
    }
}
