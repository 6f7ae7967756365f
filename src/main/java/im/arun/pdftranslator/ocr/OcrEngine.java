package im.arun.pdftranslator.ocr;

import java.awt.image.BufferedImage;

/**
 * Recognizes text in a rendered page image.
 * Implementations may return an empty string when the image holds no readable text.
 */
public interface OcrEngine {

    /**
     * @param image    RGB bitmap of one page
     * @param language engine language code, e.g. {@code "eng"} or {@code "eng+deu"}
     * @return recognized text, never null
     * @throws OcrException if the engine itself failed
     */
    String recognize(BufferedImage image, String language) throws OcrException;
}
