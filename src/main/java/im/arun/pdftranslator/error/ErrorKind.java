package im.arun.pdftranslator.error;

/**
 * Terminal failure categories of a translation run.
 * Callers at the boundary (CLI, HTTP layer, ...) map each kind to their own status.
 */
public enum ErrorKind {
    /** A numeric or string parameter was rejected before any work started. */
    INVALID_CONFIGURATION,
    /** The input could not be opened as a PDF document. */
    INVALID_DOCUMENT,
    /** No page produced any text, even after OCR. Nothing to translate. */
    EMPTY_DOCUMENT,
    /** A page failed while the page-failure policy was ABORT. */
    EXTRACTION_FAILED,
    /** The translation service failed on a chunk. */
    TRANSLATION_FAILED,
    /** The request deadline passed or the request was cancelled. */
    CANCELLED
}
