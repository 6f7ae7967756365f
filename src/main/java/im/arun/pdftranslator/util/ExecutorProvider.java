package im.arun.pdftranslator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared bounded pool for page OCR and chunk translation.
 * Callers bound their own in-flight work on top of it; the pool only caps total threads.
 */
public final class ExecutorProvider {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorProvider.class);

    /** System property overriding the worker count. */
    public static final String WORKERS_PROPERTY = "pdftranslator.workers";
    private static final int MAX_DEFAULT_WORKERS = 32;
    private static final long IDLE_SECONDS = 30;
    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private static volatile ThreadPoolExecutor instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Returns the shared pool. Sized availableProcessors * 4 (at most 32) unless
     * {@value #WORKERS_PROPERTY} is set; idle workers exit after 30 seconds.
     */
    public static ExecutorService getExecutor() {
        ThreadPoolExecutor executor = instance;
        if (executor == null) {
            synchronized (LOCK) {
                executor = instance;
                if (executor == null) {
                    executor = newPool(workerCount());
                    instance = executor;
                }
            }
        }
        return executor;
    }

    static int workerCount() {
        int fallback = Math.min(Runtime.getRuntime().availableProcessors() * 4, MAX_DEFAULT_WORKERS);
        String configured = System.getProperty(WORKERS_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return fallback;
        }
        int workers;
        try {
            workers = Integer.parseInt(configured.trim());
        } catch (NumberFormatException e) {
            workers = 0;
        }
        if (workers <= 0) {
            logger.warn("Ignoring invalid {}={}, using {} workers", WORKERS_PROPERTY, configured, fallback);
            return fallback;
        }
        return workers;
    }

    private static ThreadPoolExecutor newPool(int workers) {
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(workers, workers,
                IDLE_SECONDS, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "pdftranslator-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        pool.allowCoreThreadTimeOut(true);
        logger.debug("Started worker pool with {} threads", workers);
        return pool;
    }

    /**
     * Stops the shared pool, giving running OCR and translate calls a few seconds to finish.
     * A later {@link #getExecutor()} starts a fresh pool.
     */
    public static void shutdown() {
        ThreadPoolExecutor executor;
        synchronized (LOCK) {
            executor = instance;
            instance = null;
        }
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not stop within {}s, interrupting", SHUTDOWN_GRACE_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
