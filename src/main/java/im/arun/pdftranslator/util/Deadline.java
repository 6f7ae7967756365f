package im.arun.pdftranslator.util;

import im.arun.pdftranslator.error.ErrorKind;
import im.arun.pdftranslator.error.PdfTranslationException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Request-scoped cancellation signal, threaded through extraction and translation.
 * Expires after a fixed duration (or never) and can be cancelled explicitly by the owner.
 */
public final class Deadline {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long expiresAtNanos;
    private volatile boolean cancelled;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline none() {
        return new Deadline(NO_DEADLINE);
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return none();
        }
        return new Deadline(System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        return cancelled || (expiresAtNanos != NO_DEADLINE && System.nanoTime() - expiresAtNanos >= 0);
    }

    /**
     * Remaining time in nanoseconds; {@link Long#MAX_VALUE} when unbounded, 0 once expired.
     */
    public long remainingNanos() {
        if (cancelled) {
            return 0;
        }
        if (expiresAtNanos == NO_DEADLINE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, expiresAtNanos - System.nanoTime());
    }

    public long remaining(TimeUnit unit) {
        long nanos = remainingNanos();
        return nanos == Long.MAX_VALUE ? Long.MAX_VALUE : unit.convert(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @throws PdfTranslationException of kind {@link ErrorKind#CANCELLED} if the request must stop
     */
    public void checkpoint(String stage) {
        if (cancelled) {
            throw new PdfTranslationException(ErrorKind.CANCELLED, "Request cancelled before " + stage);
        }
        if (isExpired()) {
            throw new PdfTranslationException(ErrorKind.CANCELLED, "Deadline exceeded before " + stage);
        }
    }
}
