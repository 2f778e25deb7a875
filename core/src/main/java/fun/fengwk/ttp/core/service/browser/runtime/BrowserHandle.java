package fun.fengwk.ttp.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Browser handle that encapsulates one leased browser session.
 *
 * <p>A handle serves exactly one lease and is destroyed afterwards. Close is idempotent.
 *
 * @author fengwk
 */
public class BrowserHandle {

    private static final Logger log = LoggerFactory.getLogger(BrowserHandle.class);

    private final String id;
    private final Instant createdAt;
    private final long navigationTimeoutMs;
    private final BrowserSession session;
    private final AtomicReference<HandleState> state = new AtomicReference<>(HandleState.FREE);

    public BrowserHandle(String id, Instant createdAt, long navigationTimeoutMs, BrowserSession session) {
        this.id = id;
        this.createdAt = createdAt;
        this.navigationTimeoutMs = navigationTimeoutMs;
        this.session = session;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getNavigationTimeoutMs() {
        return navigationTimeoutMs;
    }

    public HandleState getState() {
        return state.get();
    }

    /**
     * Hand the handle to a single caller.
     */
    boolean lease() {
        return state.compareAndSet(HandleState.FREE, HandleState.LEASED);
    }

    public NavigationResult navigate(String url) {
        if (state.get() != HandleState.LEASED) {
            throw new IllegalStateException("handle " + id + " is not leased, state=" + state.get());
        }
        try {
            NavigationResult result = session.render(url);
            if (result == null) {
                return NavigationResult.unexpected("browser session returned no result", null);
            }
            return result;
        } catch (RuntimeException ex) {
            log.warn("navigation failed unexpectedly, handle={}, url={}, error={}", id, url, ex.getMessage(), ex);
            return NavigationResult.unexpected(ex.getMessage(), ex);
        }
    }

    /**
     * Mark the handle doomed and destroy its session.
     *
     * @return true if this call performed the close
     */
    boolean destroy() {
        HandleState previous = state.getAndSet(HandleState.DOOMED);
        if (previous == HandleState.DOOMED) {
            return false;
        }
        try {
            session.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("browser session already closed for handle {}, skip close", id);
            } else {
                log.warn("failed to close browser session for handle {}", id, ex);
            }
        }
        return true;
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

    @Override
    public String toString() {
        return "BrowserHandle{id=" + id + ", state=" + state.get() + "}";
    }

}
