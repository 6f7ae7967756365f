package im.arun.pdftranslator.ocr;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Tesseract OCR through tess4j.
 * A new {@link Tesseract} instance is created per call since the native handle is not thread-safe.
 */
public class TesseractOcrEngine implements OcrEngine {
    private static final Logger logger = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final String tessdataPath;

    public TesseractOcrEngine() {
        this(null);
    }

    /**
     * @param tessdataPath directory holding the {@code *.traineddata} files; falls back to
     *                     {@code TESSDATA_PREFIX} and then to the tess4j default when null
     */
    public TesseractOcrEngine(String tessdataPath) {
        this.tessdataPath = tessdataPath != null ? tessdataPath : System.getenv("TESSDATA_PREFIX");
    }

    @Override
    public String recognize(BufferedImage image, String language) throws OcrException {
        ITesseract tesseract = new Tesseract();
        if (tessdataPath != null && !tessdataPath.isBlank()) {
            tesseract.setDatapath(tessdataPath);
        }
        tesseract.setLanguage(language);

        long started = System.currentTimeMillis();
        try {
            String text = tesseract.doOCR(image);
            logger.debug("Tesseract ({}) recognized {} chars from {}x{} image in {}ms", language,
                    text == null ? 0 : text.length(), image.getWidth(), image.getHeight(),
                    System.currentTimeMillis() - started);
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed: " + e.getMessage(), e);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            throw new OcrException("Tesseract unavailable: " + e.getMessage(), e);
        }
    }
}
