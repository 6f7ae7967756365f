package im.arun.pdftranslator.util;

import im.arun.pdftranslator.error.ErrorKind;
import im.arun.pdftranslator.error.PdfTranslationException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs independent units of work and returns their results in submission order,
 * whatever order they complete in.
 */
public final class OrderedTaskRunner {

    private OrderedTaskRunner() {}

    /**
     * @param tasks      work items; result {@code i} belongs to task {@code i}
     * @param maxInFlight upper bound on tasks running at once; 1 runs everything on the caller thread
     * @param deadline   checked before each task starts and bounds every wait
     * @param stage      label used in cancellation messages, e.g. {@code "page"} or {@code "chunk"}
     * @throws RuntimeException the first failure of any task, as thrown by the task
     */
    public static <T> List<T> run(List<? extends Supplier<T>> tasks, int maxInFlight, Deadline deadline, String stage) {
        List<T> results = new ArrayList<>(tasks.size());
        if (maxInFlight <= 1 || tasks.size() <= 1) {
            for (int i = 0; i < tasks.size(); i++) {
                deadline.checkpoint(stage + " " + (i + 1));
                results.add(tasks.get(i).get());
            }
            return results;
        }

        ExecutorService executor = ExecutorProvider.getExecutor();
        Semaphore permits = new Semaphore(maxInFlight);
        AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        try {
            for (int i = 0; i < tasks.size(); i++) {
                deadline.checkpoint(stage + " " + (i + 1));
                acquire(permits, deadline, stage);
                if (firstFailure.get() != null) {
                    permits.release();
                    break;
                }
                Supplier<T> task = tasks.get(i);
                futures.add(executor.submit(() -> {
                    try {
                        return task.get();
                    } catch (RuntimeException e) {
                        firstFailure.compareAndSet(null, e);
                        throw e;
                    } finally {
                        permits.release();
                    }
                }));
            }

            for (Future<T> future : futures) {
                results.add(await(future, deadline, stage));
            }
            return results;
        } finally {
            // no-op for completed futures; stops the rest after a failure or timeout
            for (Future<T> future : futures) {
                future.cancel(true);
            }
        }
    }

    private static void acquire(Semaphore permits, Deadline deadline, String stage) {
        try {
            long nanos = deadline.remainingNanos();
            if (nanos == Long.MAX_VALUE) {
                permits.acquire();
            } else if (!permits.tryAcquire(nanos, TimeUnit.NANOSECONDS)) {
                throw new PdfTranslationException(ErrorKind.CANCELLED, "Deadline exceeded while waiting to start " + stage);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PdfTranslationException(ErrorKind.CANCELLED, "Interrupted while waiting to start " + stage, e);
        }
    }

    private static <T> T await(Future<T> future, Deadline deadline, String stage) {
        try {
            long nanos = deadline.remainingNanos();
            return nanos == Long.MAX_VALUE ? future.get() : future.get(nanos, TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Unexpected checked failure in " + stage, cause);
        } catch (TimeoutException e) {
            throw new PdfTranslationException(ErrorKind.CANCELLED, "Deadline exceeded while waiting for " + stage, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PdfTranslationException(ErrorKind.CANCELLED, "Interrupted while waiting for " + stage, e);
        }
    }
}
