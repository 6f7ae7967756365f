package im.arun.pdftranslator.pdf;

import im.arun.pdftranslator.config.PageFailurePolicy;
import im.arun.pdftranslator.error.ErrorKind;
import im.arun.pdftranslator.error.InvalidDocumentException;
import im.arun.pdftranslator.error.PdfTranslationException;
import im.arun.pdftranslator.model.ExtractedDocument;
import im.arun.pdftranslator.model.PageResult;
import im.arun.pdftranslator.util.Deadline;
import im.arun.pdftranslator.util.OrderedTaskRunner;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Extracts every page of a PDF with {@link PageExtractor} and lays the results out
 * behind page markers, in page order.
 */
public class DocumentExtractor {
    private static final Logger logger = LoggerFactory.getLogger(DocumentExtractor.class);

    private final PageExtractor pageExtractor;
    private final PageFailurePolicy failurePolicy;
    private final int concurrency;

    public DocumentExtractor(PageExtractor pageExtractor) {
        this(pageExtractor, PageFailurePolicy.ISOLATE, 1);
    }

    /**
     * @param concurrency number of pages that may be in OCR at once; 1 keeps extraction sequential
     */
    public DocumentExtractor(PageExtractor pageExtractor, PageFailurePolicy failurePolicy, int concurrency) {
        this.pageExtractor = pageExtractor;
        this.failurePolicy = failurePolicy;
        this.concurrency = concurrency;
    }

    /**
     * Extract pages from a PDF file.
     *
     * @throws InvalidDocumentException if the file cannot be opened as a PDF
     */
    public ExtractedDocument extract(Path pdfPath, int dpi, String ocrLanguage, Deadline deadline) {
        try (LockedClose document = new LockedClose(Loader.loadPDF(pdfPath.toFile()))) {
            return extract(document.pdf, dpi, ocrLanguage, deadline);
        } catch (IOException e) {
            throw new InvalidDocumentException("Cannot open PDF " + pdfPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extract pages from an in-memory PDF.
     *
     * @throws InvalidDocumentException if the bytes are not a readable PDF
     */
    public ExtractedDocument extract(byte[] pdfBytes, int dpi, String ocrLanguage, Deadline deadline) {
        try (LockedClose document = new LockedClose(Loader.loadPDF(pdfBytes))) {
            return extract(document.pdf, dpi, ocrLanguage, deadline);
        } catch (IOException e) {
            throw new InvalidDocumentException("Cannot open PDF: " + e.getMessage(), e);
        }
    }

    /**
     * Extract pages from a PDF input stream. The stream is read fully but not closed.
     */
    public ExtractedDocument extract(InputStream inputStream, int dpi, String ocrLanguage, Deadline deadline) {
        byte[] bytes;
        try {
            bytes = inputStream.readAllBytes();
        } catch (IOException e) {
            throw new InvalidDocumentException("Cannot read PDF stream: " + e.getMessage(), e);
        }
        return extract(bytes, dpi, ocrLanguage, deadline);
    }

    /**
     * Extract pages from an open document. The caller owns (and closes) the document.
     */
    public ExtractedDocument extract(PDDocument document, int dpi, String ocrLanguage, Deadline deadline) {
        if (document == null) {
            return ExtractedDocument.empty();
        }

        int totalPages = document.getNumberOfPages();
        List<Supplier<PageResult>> tasks = new ArrayList<>(totalPages);
        for (int i = 0; i < totalPages; i++) {
            int pageIndex = i;
            tasks.add(() -> checkPolicy(pageExtractor.extract(document, pageIndex, dpi, ocrLanguage)));
        }

        List<PageResult> pages = OrderedTaskRunner.run(tasks, concurrency, deadline, "page");
        ExtractedDocument extracted = new ExtractedDocument(pages);

        logger.info("Extracted {} pages ({} via OCR, {} failed)", totalPages,
                extracted.getOcrPageNumbers().size(), extracted.getFailedPageNumbers().size());
        return extracted;
    }

    /**
     * Closes the document under its monitor. After a failure or timeout, cancelled page
     * workers may still be rendering it; they hold the same monitor while touching it.
     */
    private static final class LockedClose implements Closeable {
        private final PDDocument pdf;

        LockedClose(PDDocument pdf) {
            this.pdf = pdf;
        }

        @Override
        public void close() throws IOException {
            synchronized (pdf) {
                pdf.close();
            }
        }
    }

    private PageResult checkPolicy(PageResult page) {
        if (!page.isFailed()) {
            return page;
        }
        if (failurePolicy == PageFailurePolicy.ABORT) {
            throw new PdfTranslationException(ErrorKind.EXTRACTION_FAILED,
                    "Page " + page.getPageNumber() + ": " + page.getFailureReason(), page.getFailureCause());
        }
        logger.warn("Page {} could not be extracted, keeping it empty: {}",
                page.getPageNumber(), page.getFailureReason());
        return page;
    }
}
