package fun.fengwk.ttp.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.extern.slf4j.Slf4j;

/**
 * Playwright backed browser session owning its own driver, browser, context and page.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {

    private final String handleId;
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final long navigationTimeoutMs;
    private final boolean waitForNetworkIdle;
    private final long settleDelayMs;

    public PlaywrightBrowserSession(
        String handleId,
        Playwright playwright,
        Browser browser,
        BrowserContext context,
        Page page,
        long navigationTimeoutMs,
        boolean waitForNetworkIdle,
        long settleDelayMs
    ) {
        this.handleId = handleId;
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.navigationTimeoutMs = navigationTimeoutMs;
        this.waitForNetworkIdle = waitForNetworkIdle;
        this.settleDelayMs = settleDelayMs;
    }

    @Override
    public NavigationResult render(String url) {
        try {
            page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(waitForNetworkIdle ? WaitUntilState.NETWORKIDLE : WaitUntilState.DOMCONTENTLOADED)
                .setTimeout((double) navigationTimeoutMs)
            );
            if (settleDelayMs > 0) {
                page.waitForTimeout((double) settleDelayMs);
            }
            return NavigationResult.loaded(page.content());
        } catch (TimeoutError ex) {
            log.warn("navigation timeout, handle={}, url={}, timeoutMs={}", handleId, url, navigationTimeoutMs);
            return NavigationResult.timeout("navigation timeout after " + navigationTimeoutMs + "ms", ex);
        } catch (PlaywrightException ex) {
            log.warn("browser engine failure, handle={}, url={}, error={}", handleId, url, ex.getMessage());
            return NavigationResult.engineFailure("browser engine failure: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        // Release in strict order: page, context, browser, driver.
        try {
            page.close();
        } finally {
            try {
                context.close();
            } finally {
                try {
                    browser.close();
                } finally {
                    playwright.close();
                }
            }
        }
    }

}
