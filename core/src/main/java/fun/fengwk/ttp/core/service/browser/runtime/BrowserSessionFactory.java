package fun.fengwk.ttp.core.service.browser.runtime;

/**
 * Creates fresh browser sessions for the handle pool.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession create(BrowserHandleOptions options) throws Exception;

}
