package im.arun.pdftranslator.error;

public class ConfigurationException extends PdfTranslationException {

    public ConfigurationException(String message) {
        super(ErrorKind.INVALID_CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.INVALID_CONFIGURATION, message, cause);
    }
}
