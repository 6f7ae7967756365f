package im.arun.pdftranslator.error;

public class InvalidDocumentException extends PdfTranslationException {

    public InvalidDocumentException(String message, Throwable cause) {
        super(ErrorKind.INVALID_DOCUMENT, message, cause);
    }
}
