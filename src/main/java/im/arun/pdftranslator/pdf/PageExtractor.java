package im.arun.pdftranslator.pdf;

import im.arun.pdftranslator.config.TranslatorConfig;
import im.arun.pdftranslator.model.PageResult;
import im.arun.pdftranslator.ocr.OcrEngine;
import im.arun.pdftranslator.ocr.OcrException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Extracts the text of a single page, falling back to OCR when the page carries
 * too little embedded text to be anything but a scan.
 */
public class PageExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PageExtractor.class);

    private final OcrEngine ocrEngine;
    private final int ocrThreshold;

    public PageExtractor(OcrEngine ocrEngine) {
        this(ocrEngine, TranslatorConfig.DEFAULT_OCR_THRESHOLD);
    }

    /**
     * @param ocrThreshold pages with fewer non-whitespace characters than this are OCR'd
     */
    public PageExtractor(OcrEngine ocrEngine, int ocrThreshold) {
        this.ocrEngine = ocrEngine;
        this.ocrThreshold = ocrThreshold;
    }

    /**
     * Extract one page. Never throws for a bad page; the failure is returned as a failed result.
     *
     * @param document    open document; PDFBox access is serialized on it so OCR of
     *                    different pages can overlap
     * @param pageIndex   0-based page index
     * @param dpi         render resolution for OCR (scale dpi/72 from PDF points)
     * @param ocrLanguage Tesseract language code
     */
    public PageResult extract(PDDocument document, int pageIndex, int dpi, String ocrLanguage) {
        int pageNumber = pageIndex + 1;
        try {
            String nativeText = extractNativeText(document, pageIndex);
            int meaningful = meaningfulLength(nativeText);
            if (meaningful >= ocrThreshold) {
                return PageResult.ok(pageNumber, nativeText.strip(), PageResult.Source.NATIVE);
            }

            logger.debug("Page {} has {} meaningful chars (< {}), running OCR at {} dpi",
                    pageNumber, meaningful, ocrThreshold, dpi);
            BufferedImage image = render(document, pageIndex, dpi);
            try {
                String ocrText = ocrEngine.recognize(image, ocrLanguage);
                return PageResult.ok(pageNumber, ocrText == null ? "" : ocrText.strip(), PageResult.Source.OCR);
            } finally {
                image.flush();
            }
        } catch (IOException e) {
            return PageResult.failed(pageNumber, "Failed to read page: " + e.getMessage(), e);
        } catch (OcrException e) {
            return PageResult.failed(pageNumber, "OCR failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // broken content streams surface from PDFBox as unchecked exceptions
            return PageResult.failed(pageNumber, "Failed to process page: " + e, e);
        }
    }

    private String extractNativeText(PDDocument document, int pageIndex) throws IOException {
        synchronized (document) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            String text = stripper.getText(document);
            return text == null ? "" : text;
        }
    }

    private BufferedImage render(PDDocument document, int pageIndex, int dpi) throws IOException {
        synchronized (document) {
            return new PDFRenderer(document).renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        }
    }

    /**
     * Number of non-whitespace code points in {@code text}.
     */
    public static int meaningfulLength(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) text.codePoints()
                .filter(cp -> !Character.isWhitespace(cp) && !Character.isSpaceChar(cp))
                .count();
    }

    public int getOcrThreshold() {
        return ocrThreshold;
    }
}
