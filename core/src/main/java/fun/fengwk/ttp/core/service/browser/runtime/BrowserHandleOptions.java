package fun.fengwk.ttp.core.service.browser.runtime;

import lombok.Builder;
import lombok.Data;

/**
 * Per-handle options applied when a session is created.
 *
 * @author fengwk
 */
@Data
@Builder
public class BrowserHandleOptions {

    private String handleId;

    private long navigationTimeoutMs;

}
