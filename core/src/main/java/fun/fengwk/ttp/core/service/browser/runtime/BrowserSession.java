package fun.fengwk.ttp.core.service.browser.runtime;

/**
 * One live, isolated automation-engine instance.
 *
 * <p>Implementations convert engine failures into {@link NavigationResult} variants
 * instead of throwing them.
 *
 * @author fengwk
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Navigate to {@code url}, wait for the page to settle and capture the rendered document.
     */
    NavigationResult render(String url);

    @Override
    void close();

}
