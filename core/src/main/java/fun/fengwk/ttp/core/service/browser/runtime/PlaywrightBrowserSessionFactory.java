package fun.fengwk.ttp.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import fun.fengwk.ttp.core.service.browser.BrowserProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.Map;

/**
 * Launches one Playwright chromium instance with a fresh incognito context per handle.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

    private final BrowserProperties browserProperties;

    public PlaywrightBrowserSessionFactory(BrowserProperties browserProperties) {
        this.browserProperties = browserProperties;
    }

    @Override
    public BrowserSession create(BrowserHandleOptions options) {
        Playwright playwright = null;
        Browser browser = null;
        BrowserContext context = null;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(buildLaunchOptions());
            // newContext is always a private context: no cookies, storage or cache carried over.
            context = browser.newContext(buildContextOptions());
            Page page = context.newPage();
            page.setDefaultTimeout((double) options.getNavigationTimeoutMs());
            page.setDefaultNavigationTimeout((double) options.getNavigationTimeoutMs());
            return new PlaywrightBrowserSession(
                options.getHandleId(),
                playwright,
                browser,
                context,
                page,
                options.getNavigationTimeoutMs(),
                browserProperties.isWaitForNetworkIdle(),
                browserProperties.getSettleDelayMs()
            );
        } catch (RuntimeException ex) {
            // Creation failure must release all partially initialized resources.
            closeQuietly(options.getHandleId(), context);
            closeQuietly(options.getHandleId(), browser);
            closeQuietly(options.getHandleId(), playwright);
            throw ex;
        }
    }

    BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            launchOptions.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            launchOptions.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            launchOptions.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        return launchOptions;
    }

    Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
            .setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());
        if (StringUtils.hasText(browserProperties.getUserAgent())) {
            contextOptions.setUserAgent(browserProperties.getUserAgent());
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            contextOptions.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            contextOptions.setTimezoneId(browserProperties.getTimezoneId());
        }
        if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
            contextOptions.setExtraHTTPHeaders(Map.of("Accept-Language", browserProperties.getAcceptLanguage()));
        }
        return contextOptions;
    }

    private void closeQuietly(String handleId, AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            log.debug("close resource failed, handle={}", handleId, ex);
        }
    }

}
