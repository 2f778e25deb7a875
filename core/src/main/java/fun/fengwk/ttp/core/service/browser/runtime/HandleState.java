package fun.fengwk.ttp.core.service.browser.runtime;

/**
 * Lease state of a browser handle.
 *
 * @author fengwk
 */
public enum HandleState {

    /**
     * Created by the pool, not yet handed to a caller.
     */
    FREE,

    /**
     * Owned by exactly one in-flight lease.
     */
    LEASED,

    /**
     * Lease ended, the handle is destroyed and never used again.
     */
    DOOMED

}
