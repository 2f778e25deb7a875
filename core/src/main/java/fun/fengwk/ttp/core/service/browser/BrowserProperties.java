package fun.fengwk.ttp.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Browser runtime shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "ttp.browser")
public class BrowserProperties {

    /**
     * Hard cap of live browser handles per process.
     */
    private int maxHandles = 5;

    /**
     * Whether browser handles run without a visible UI.
     */
    private boolean headless = true;

    /**
     * Per-attempt navigation timeout in milliseconds.
     */
    private long navigationTimeoutMs = 30000;

    /**
     * Wait for network idle after navigation instead of DOM content loaded only.
     */
    private boolean waitForNetworkIdle = true;

    /**
     * Fixed delay after navigation before the document is captured, 0 means no delay.
     */
    private long settleDelayMs = 0;

    /**
     * Fixed user agent for every browser context.
     */
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/135.0.0.0 Safari/537.36";

    private int viewportWidth = 1920;

    private int viewportHeight = 1080;

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of(
        "--no-sandbox",
        "--disable-dev-shm-usage",
        "--disable-gpu",
        "--disable-extensions"
    );

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Optional locale for browser context.
     */
    private String locale = "";

    /**
     * Optional timezone id for browser context.
     */
    private String timezoneId = "";

    /**
     * Optional Accept-Language header value.
     */
    private String acceptLanguage = "";

}
