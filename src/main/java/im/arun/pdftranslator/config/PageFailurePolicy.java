package im.arun.pdftranslator.config;

/**
 * What happens to the document when a single page cannot be extracted.
 */
public enum PageFailurePolicy {
    /** Record the page as empty text, log a warning and keep going. */
    ISOLATE,
    /** Fail the whole document on the first failed page. */
    ABORT
}
