package fun.fengwk.ttp.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of single-use browser handles.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>Acquire reserves a slot and creates a fresh handle, or reports exhaustion without blocking.</li>
 *     <li>Release always destroys the handle and frees its slot; handles are never recycled.</li>
 *     <li>Track all live handles in {@code activeHandles} so shutdown can destroy in-flight handles.</li>
 * </ul>
 *
 * @author fengwk
 */
public class BrowserHandlePool {

    private static final Logger log = LoggerFactory.getLogger(BrowserHandlePool.class);

    /**
     * Current process id used in generated handle ids.
     */
    private static final long CURRENT_PROCESS_ID = ProcessHandle.current().pid();

    private final int maxHandles;
    private final long defaultNavigationTimeoutMs;
    private final BrowserSessionFactory sessionFactory;

    /**
     * Live handle registry for deterministic shutdown.
     */
    private final Set<BrowserHandle> activeHandles = ConcurrentHashMap.newKeySet();

    /**
     * Number of reserved slots (leased + being created).
     */
    private final AtomicInteger activeCount = new AtomicInteger(0);

    private final AtomicInteger handleCounter = new AtomicInteger(1);
    private final AtomicLong createdCount = new AtomicLong(0);
    private final AtomicLong destroyedCount = new AtomicLong(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public BrowserHandlePool(int maxHandles, long defaultNavigationTimeoutMs, BrowserSessionFactory sessionFactory) {
        this.maxHandles = Math.max(1, maxHandles);
        this.defaultNavigationTimeoutMs = Math.max(1L, defaultNavigationTimeoutMs);
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        if (this.maxHandles != maxHandles) {
            log.warn("invalid maxHandles {}, using {}", maxHandles, this.maxHandles);
        }
    }

    public AcquireResult acquire() {
        return acquire(defaultNavigationTimeoutMs);
    }

    public AcquireResult acquire(long navigationTimeoutMs) {
        if (shutdown.get()) {
            return AcquireResult.shutdown();
        }
        // Reserve slot first to guarantee maxHandles boundary under concurrency.
        if (!reserveSlot()) {
            log.debug("browser handle pool exhausted, activeCount={}, maxHandles={}", activeCount.get(), maxHandles);
            return AcquireResult.exhausted();
        }

        String handleId = "handle_" + CURRENT_PROCESS_ID + "_" + handleCounter.getAndIncrement();
        long timeoutMs = navigationTimeoutMs > 0 ? navigationTimeoutMs : defaultNavigationTimeoutMs;
        BrowserSession session;
        try {
            session = sessionFactory.create(BrowserHandleOptions.builder()
                .handleId(handleId)
                .navigationTimeoutMs(timeoutMs)
                .build());
            if (session == null) {
                throw new IllegalStateException("browser session factory returned null");
            }
        } catch (Exception ex) {
            log.warn("create browser handle failed, handle={}, error={}", handleId, ex.getMessage(), ex);
            releaseSlot();
            return AcquireResult.launchFailed(ex);
        }

        BrowserHandle handle = newHandle(handleId, timeoutMs, session);
        activeHandles.add(handle);
        createdCount.incrementAndGet();

        // Shutdown may have started while the session was launching.
        if (shutdown.get()) {
            destroyAndReleaseSlot(handle);
            return AcquireResult.shutdown();
        }
        // shutdownAll may doom the handle between the check above and the lease.
        if (!handle.lease()) {
            destroyAndReleaseSlot(handle);
            return AcquireResult.shutdown();
        }
        log.debug("created browser handle {}, activeCount={}", handleId, activeCount.get());
        return AcquireResult.acquired(handle);
    }

    public void release(BrowserHandle handle) {
        if (handle == null) {
            return;
        }
        destroyAndReleaseSlot(handle);
    }

    public void shutdownAll() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("shutting down browser handle pool, activeHandles={}", activeHandles.size());
            List<BrowserHandle> remainingHandles = List.copyOf(activeHandles);
            for (BrowserHandle handle : remainingHandles) {
                destroyAndReleaseSlot(handle);
            }
            log.info("browser handle pool shutdown completed");
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public int getMaxHandles() {
        return maxHandles;
    }

    public int getActiveCount() {
        return activeCount.get();
    }

    public long getCreatedCount() {
        return createdCount.get();
    }

    public long getDestroyedCount() {
        return destroyedCount.get();
    }

    BrowserHandle newHandle(String handleId, long navigationTimeoutMs, BrowserSession session) {
        return new BrowserHandle(handleId, Instant.now(), navigationTimeoutMs, session);
    }

    private boolean reserveSlot() {
        // Lock-free CAS loop to enforce global max handle count.
        while (true) {
            int currentCount = activeCount.get();
            if (currentCount >= maxHandles) {
                return false;
            }
            if (activeCount.compareAndSet(currentCount, currentCount + 1)) {
                return true;
            }
        }
    }

    private void releaseSlot() {
        activeCount.decrementAndGet();
    }

    private void destroyAndReleaseSlot(BrowserHandle handle) {
        // Idempotent release guard: only first caller removes and destroys the handle.
        if (!activeHandles.remove(handle)) {
            return;
        }
        try {
            handle.destroy();
            destroyedCount.incrementAndGet();
        } finally {
            releaseSlot();
        }
        log.debug("destroyed browser handle {}, activeCount={}", handle.getId(), activeCount.get());
    }

}
