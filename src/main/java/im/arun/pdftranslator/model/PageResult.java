package im.arun.pdftranslator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of extracting one page: either its text (native or OCR) or the reason it failed.
 * Page numbers are 1-based.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PageResult {

    public enum Source {
        NATIVE,
        OCR,
        NONE
    }

    int pageNumber;
    String text;
    Source source;
    String failureReason;
    Throwable failureCause;

    public static PageResult ok(int pageNumber, String text, Source source) {
        return new PageResult(pageNumber, text == null ? "" : text, source, null, null);
    }

    public static PageResult failed(int pageNumber, String reason, Throwable cause) {
        return new PageResult(pageNumber, "", Source.NONE, reason, cause);
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public boolean isOcr() {
        return source == Source.OCR;
    }
}
