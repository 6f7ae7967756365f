package im.arun.pdftranslator.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.pdftranslator.config.ConfigLoader;
import im.arun.pdftranslator.config.PageFailurePolicy;
import im.arun.pdftranslator.config.TranslatorConfig;
import im.arun.pdftranslator.error.PdfTranslationException;
import im.arun.pdftranslator.model.ExtractedDocument;
import im.arun.pdftranslator.model.TranslationReport;
import im.arun.pdftranslator.model.TranslationResult;
import im.arun.pdftranslator.service.PdfTranslationService;
import im.arun.pdftranslator.util.Deadline;
import im.arun.pdftranslator.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line interface: translate a PDF (or only extract its text).
 */
@Command(
    name = "pdf-translate",
    description = "Extract text from a PDF (OCR for scanned pages) and translate it",
    mixinStandardHelpOptions = true,
    version = "PDF Translator 1.0"
)
public class PdfTranslateCLI implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_BAD_ARGUMENTS = 2;
    static final int EXIT_BAD_DOCUMENT = 3;
    static final int EXIT_NOTHING_TO_TRANSLATE = 4;
    static final int EXIT_PROCESSING_FAILED = 5;
    static final int EXIT_CANCELLED = 6;

    @Option(names = {"--pdf-path"}, description = "Path to PDF file", required = true)
    private String pdfPath;

    @Option(names = {"--target"}, description = "Target language (default zh-CN)")
    private String target;

    @Option(names = {"--source"}, description = "Source language (default auto)")
    private String source;

    @Option(names = {"--ocr-lang"}, description = "Tesseract language for scanned pages (default eng)")
    private String ocrLang;

    @Option(names = {"--dpi"}, description = "Render resolution for OCR pages (default 300)")
    private Integer dpi;

    @Option(names = {"--max-chunk-length"}, description = "Max characters per translation request (default 4500)")
    private Integer maxChunkLength;

    @Option(names = {"--ocr-threshold"}, description = "Pages with fewer non-whitespace chars are OCR'd (default 40)")
    private Integer ocrThreshold;

    @Option(names = {"--page-failure-policy"}, description = "ISOLATE or ABORT (default ISOLATE)")
    private PageFailurePolicy pageFailurePolicy;

    @Option(names = {"--extraction-concurrency"}, description = "Pages OCR'd in parallel (default 1)")
    private Integer extractionConcurrency;

    @Option(names = {"--translation-concurrency"}, description = "Chunks translated in parallel (default 1)")
    private Integer translationConcurrency;

    @Option(names = {"--max-retries"}, description = "Retries per chunk on transient errors (default 2)")
    private Integer maxRetries;

    @Option(names = {"--timeout"}, description = "Overall deadline in seconds, 0 for none")
    private Integer timeoutSeconds;

    @Option(names = {"--tessdata"}, description = "Tesseract tessdata directory (or set TESSDATA_PREFIX)")
    private String tessdataPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--extract-only"}, description = "Print the extracted text without translating")
    private boolean extractOnly;

    @Option(names = {"--output"}, description = "Output text file path (default stdout)")
    private String outputPath;

    @Option(names = {"--report"}, description = "Write a JSON run report to this path")
    private String reportPath;

    private final Function<TranslatorConfig, PdfTranslationService> serviceFactory;

    public PdfTranslateCLI() {
        this(PdfTranslationService::new);
    }

    PdfTranslateCLI(Function<TranslatorConfig, PdfTranslationService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() throws Exception {
        Path pdfFilePath = Paths.get(pdfPath);
        if (!Files.exists(pdfFilePath)) {
            System.err.println("Error: PDF file not found: " + pdfPath);
            return EXIT_BAD_ARGUMENTS;
        }

        if (!pdfPath.toLowerCase().endsWith(".pdf")) {
            System.err.println("Error: File must be a PDF: " + pdfPath);
            return EXIT_BAD_ARGUMENTS;
        }

        long started = System.currentTimeMillis();
        TranslationReport report;
        String text;
        try {
            TranslatorConfig config = new ConfigLoader(configPath).load(userOptions());
            PdfTranslationService service = serviceFactory.apply(config);
            Deadline deadline = service.newDeadline();

            if (extractOnly) {
                ExtractedDocument document = service.extract(pdfFilePath, deadline);
                text = document.getText();
                report = TranslationReport.of(pdfFilePath.getFileName().toString(), document);
            } else {
                TranslationResult result = service.translate(pdfFilePath, deadline);
                text = result.getTranslatedText();
                report = TranslationReport.of(pdfFilePath.getFileName().toString(), result);
            }
        } catch (PdfTranslationException e) {
            System.err.println("Error: " + e.getMessage());
            return exitCode(e);
        }
        report.setElapsedMillis(System.currentTimeMillis() - started);

        writeText(text);
        if (reportPath != null) {
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            Files.writeString(Paths.get(reportPath), mapper.writeValueAsString(report), StandardCharsets.UTF_8);
        }
        return EXIT_OK;
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("target", target);
        options.put("source", source);
        options.put("ocr_lang", ocrLang);
        options.put("dpi", dpi);
        options.put("max_chunk_length", maxChunkLength);
        options.put("ocr_threshold", ocrThreshold);
        options.put("page_failure_policy", pageFailurePolicy);
        options.put("extraction_concurrency", extractionConcurrency);
        options.put("translation_concurrency", translationConcurrency);
        options.put("translation_max_retries", maxRetries);
        options.put("timeout_seconds", timeoutSeconds);
        options.put("tessdata_path", tessdataPath);
        return options;
    }

    private void writeText(String text) throws IOException {
        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), text, StandardCharsets.UTF_8);
            System.err.println("Output written to: " + outputPath);
        } else {
            PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
            out.println(text);
            out.flush();
        }
    }

    static int exitCode(PdfTranslationException e) {
        switch (e.getKind()) {
            case INVALID_CONFIGURATION:
                return EXIT_BAD_ARGUMENTS;
            case INVALID_DOCUMENT:
                return EXIT_BAD_DOCUMENT;
            case EMPTY_DOCUMENT:
                return EXIT_NOTHING_TO_TRANSLATE;
            case EXTRACTION_FAILED:
            case TRANSLATION_FAILED:
                return EXIT_PROCESSING_FAILED;
            case CANCELLED:
                return EXIT_CANCELLED;
            default:
                return EXIT_FAILURE;
        }
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new PdfTranslateCLI()).execute(args);
        } finally {
            ExecutorProvider.shutdown();
        }
        System.exit(exitCode);
    }
}
