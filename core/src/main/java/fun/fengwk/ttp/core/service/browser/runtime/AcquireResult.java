package fun.fengwk.ttp.core.service.browser.runtime;

/**
 * Outcome of a non-blocking lease attempt on {@link BrowserHandlePool}.
 *
 * @param status acquire status
 * @param handle leased handle, only present when acquired
 * @param cause launch failure, may be null
 * @author fengwk
 */
public record AcquireResult(Status status, BrowserHandle handle, Throwable cause) {

    public enum Status {

        ACQUIRED,

        /**
         * Cap reached, caller should back off.
         */
        EXHAUSTED,

        /**
         * Pool has been shut down.
         */
        SHUTDOWN,

        /**
         * Slot was available but the engine could not be started.
         */
        LAUNCH_FAILED

    }

    static AcquireResult acquired(BrowserHandle handle) {
        return new AcquireResult(Status.ACQUIRED, handle, null);
    }

    static AcquireResult exhausted() {
        return new AcquireResult(Status.EXHAUSTED, null, null);
    }

    static AcquireResult shutdown() {
        return new AcquireResult(Status.SHUTDOWN, null, null);
    }

    static AcquireResult launchFailed(Throwable cause) {
        return new AcquireResult(Status.LAUNCH_FAILED, null, cause);
    }

    public boolean isAcquired() {
        return status == Status.ACQUIRED;
    }

}
