package im.arun.pdftranslator.util;

import im.arun.pdftranslator.error.ErrorKind;
import im.arun.pdftranslator.error.PdfTranslationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    @Test
    void unboundedDeadlineNeverExpires() {
        Deadline deadline = Deadline.none();

        assertFalse(deadline.isExpired());
        assertEquals(Long.MAX_VALUE, deadline.remainingNanos());
        assertDoesNotThrow(() -> deadline.checkpoint("page 1"));
    }

    @Test
    void zeroTimeoutMeansNoDeadline() {
        assertEquals(Long.MAX_VALUE, Deadline.after(Duration.ZERO).remainingNanos());
        assertEquals(Long.MAX_VALUE, Deadline.after(null).remainingNanos());
    }

    @Test
    void boundedDeadlineCountsDown() {
        Deadline deadline = Deadline.after(Duration.ofMinutes(1));

        long seconds = deadline.remaining(TimeUnit.SECONDS);
        assertTrue(seconds > 50 && seconds <= 60);
        assertFalse(deadline.isExpired());
    }

    @Test
    void expiredDeadlineFailsCheckpoint() throws InterruptedException {
        Deadline deadline = Deadline.after(Duration.ofMillis(1));
        Thread.sleep(5);

        PdfTranslationException e = assertThrows(PdfTranslationException.class, () -> deadline.checkpoint("chunk 3"));
        assertEquals(ErrorKind.CANCELLED, e.getKind());
        assertTrue(e.getMessage().contains("chunk 3"));
        assertEquals(0, deadline.remainingNanos());
    }

    @Test
    void cancellationIsImmediate() {
        Deadline deadline = Deadline.after(Duration.ofHours(1));
        deadline.cancel();

        assertTrue(deadline.isCancelled());
        assertTrue(deadline.isExpired());
        PdfTranslationException e = assertThrows(PdfTranslationException.class, () -> deadline.checkpoint("page 1"));
        assertTrue(e.getMessage().startsWith("Request cancelled"));
    }
}
