// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors the send flow runs on.
 *
 * <p>All threads are daemon platform threads so an abandoned orchestrator never keeps the
 * JVM alive.
 *
 * <ul>
 * <li><strong>Engine work</strong> (dry-runs, commits, broadcasts): blocking calls into the
 * wallet engine and the network, on a cached pool</li>
 * <li><strong>Debounce timers</strong>: a single scheduler thread that only hands work off</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class KestrelExecutors {

    private static final AtomicInteger ENGINE_THREAD_ID = new AtomicInteger(0);

    private KestrelExecutors() {
        // Utility class
    }

    /**
     * Creates an executor for blocking wallet-engine calls.
     *
     * <p>Threads are named {@code kestrel-engine-N}.
     *
     * @return a cached thread pool of daemon threads
     */
    public static ExecutorService newEngineExecutor() {
        return Executors.newCachedThreadPool(r -> {
            // Mask off sign bit to keep ids non-negative after overflow
            int id = ENGINE_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "kestrel-engine-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates the scheduler used for debounce timers.
     *
     * @return a single-threaded scheduler named {@code kestrel-debounce}
     */
    public static ScheduledExecutorService newDebounceScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kestrel-debounce");
            t.setDaemon(true);
            return t;
        });
    }
}
