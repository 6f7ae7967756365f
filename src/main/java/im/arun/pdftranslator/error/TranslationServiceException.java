package im.arun.pdftranslator.error;

public class TranslationServiceException extends PdfTranslationException {

    public TranslationServiceException(String message) {
        super(ErrorKind.TRANSLATION_FAILED, message);
    }

    public TranslationServiceException(String message, Throwable cause) {
        super(ErrorKind.TRANSLATION_FAILED, message, cause);
    }
}
