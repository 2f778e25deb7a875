package fun.fengwk.ttp.core.service.timetable.runtime;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide gate limiting how many scrape jobs are in flight.
 *
 * <p>Callers beyond the limit wait in FIFO order on a future instead of failing; no thread is parked
 * while waiting. A released slot is handed directly to the next live waiter.
 *
 * @author fengwk
 */
@Slf4j
public class AdmissionController {

    private final int slots;
    private final Object lock = new Object();
    private final Deque<CompletableFuture<AdmissionSlot>> waiters = new ArrayDeque<>();
    private int available;

    public AdmissionController(int slots) {
        this.slots = Math.max(1, slots);
        this.available = this.slots;
    }

    public CompletableFuture<AdmissionSlot> acquire() {
        CompletableFuture<AdmissionSlot> waiter;
        synchronized (lock) {
            if (available > 0) {
                available--;
                return CompletableFuture.completedFuture(new AdmissionSlot());
            }
            waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            log.debug("admission queued, queued={}, slots={}", waiters.size(), slots);
        }
        // Withdrawn waiters must not keep their place in the queue.
        waiter.whenComplete((slot, ex) -> {
            if (waiter.isCancelled()) {
                synchronized (lock) {
                    waiters.remove(waiter);
                }
            }
        });
        return waiter;
    }

    public int getSlots() {
        return slots;
    }

    public int availableSlots() {
        synchronized (lock) {
            return available;
        }
    }

    public int queuedCount() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    public int inFlightCount() {
        synchronized (lock) {
            return slots - available;
        }
    }

    private void releaseSlot() {
        while (true) {
            CompletableFuture<AdmissionSlot> next;
            synchronized (lock) {
                next = waiters.pollFirst();
                if (next == null) {
                    available++;
                    return;
                }
            }
            // Complete outside the lock, dependent stages may run inline.
            if (next.complete(new AdmissionSlot())) {
                return;
            }
        }
    }

    /**
     * One of the controller's concurrency slots. Releasing more than once has no effect.
     */
    public class AdmissionSlot implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private AdmissionSlot() {
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                releaseSlot();
            }
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            release();
        }

    }

}
