package im.arun.pdftranslator.error;

public class EmptyDocumentException extends PdfTranslationException {

    public EmptyDocumentException(String message) {
        super(ErrorKind.EMPTY_DOCUMENT, message);
    }
}
