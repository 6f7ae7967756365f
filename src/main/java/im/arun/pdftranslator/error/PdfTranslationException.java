package im.arun.pdftranslator.error;

/**
 * Single terminal error raised by the extraction and translation pipeline.
 */
public class PdfTranslationException extends RuntimeException {
    private final ErrorKind kind;

    public PdfTranslationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PdfTranslationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
