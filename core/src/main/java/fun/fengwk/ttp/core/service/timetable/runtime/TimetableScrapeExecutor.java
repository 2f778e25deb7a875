package fun.fengwk.ttp.core.service.timetable.runtime;

import fun.fengwk.ttp.core.service.browser.runtime.AcquireResult;
import fun.fengwk.ttp.core.service.browser.runtime.BrowserHandle;
import fun.fengwk.ttp.core.service.browser.runtime.BrowserHandlePool;
import fun.fengwk.ttp.core.service.browser.runtime.NavigationResult;
import fun.fengwk.ttp.core.service.timetable.TimetableProperties;
import fun.fengwk.ttp.core.service.timetable.TimetableUrlValidator;
import fun.fengwk.ttp.core.service.timetable.model.ParseFailureKind;
import fun.fengwk.ttp.core.service.timetable.model.ParseRequest;
import fun.fengwk.ttp.core.service.timetable.model.TimetableParseResult;
import fun.fengwk.ttp.core.service.timetable.parser.ExtractionResult;
import fun.fengwk.ttp.core.service.timetable.parser.TimetableExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs one timetable parse request end to end on the calling thread.
 *
 * <p>Each attempt leases a fresh handle, navigates, extracts and releases the handle. Timeouts, engine
 * failures and empty renders are retried up to {@link ParseRequest#getMaxRetries()} extra times with a
 * fixed backoff; every other outcome is terminal. Running out of attempts reports the kind of the last
 * failure: a timeout as {@link ParseFailureKind#ENGINE_EXHAUSTED}, anything else as
 * {@link ParseFailureKind#ENGINE_FAILURE}. The caller only ever sees the final result.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimetableScrapeExecutor {

    private final TimetableUrlValidator urlValidator;
    private final BrowserHandlePool handlePool;
    private final TimetableExtractor extractor;
    private final TimetableProperties timetableProperties;

    public TimetableParseResult execute(ParseRequest request) {
        String url = request.getUrl();
        transition(url, 0, ScrapeState.VALIDATING);
        TimetableUrlValidator.UrlValidation validation = urlValidator.validate(url);
        if (!validation.valid()) {
            log.info("timetable url rejected, url={}, reason={}", url, validation.reason());
            return TimetableParseResult.failure(ParseFailureKind.VALIDATION, validation.reason(), 0, null);
        }
        url = validation.url();

        int maxAttempts = Math.max(0, request.getMaxRetries()) + 1;
        AttemptResult last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                transition(url, attempt, ScrapeState.RETRYING);
                if (!backoff()) {
                    return TimetableParseResult.failure(
                        ParseFailureKind.UNEXPECTED, "interrupted while waiting to retry", attempt - 1, last.cause());
                }
            }

            last = runAttempt(url, attempt, request.getNavigationTimeoutMs());
            switch (last.status()) {
                case SUCCEEDED:
                    transition(url, attempt, ScrapeState.SUCCEEDED);
                    log.info("timetable parsed, url={}, attempts={}, entries={}", url, attempt, last.entries().size());
                    return TimetableParseResult.success(last.entries());
                case TRANSIENT:
                    log.warn("timetable attempt failed, url={}, attempt={}/{}, error={}",
                        url, attempt, maxAttempts, last.message());
                    break;
                case POOL_EXHAUSTED:
                    transition(url, attempt, ScrapeState.FAILED);
                    log.warn("timetable parse rejected, url={}, attempt={}, error={}", url, attempt, last.message());
                    return TimetableParseResult.failure(ParseFailureKind.POOL_EXHAUSTED, last.message(), attempt, null);
                case EXTRACTION_FAILED:
                    transition(url, attempt, ScrapeState.FAILED);
                    log.warn("timetable page format unreadable, url={}, attempt={}, error={}", url, attempt, last.message());
                    return TimetableParseResult.failure(ParseFailureKind.EXTRACTION, last.message(), attempt, null);
                case UNEXPECTED:
                default:
                    transition(url, attempt, ScrapeState.FAILED);
                    log.error("timetable parse failed unexpectedly, url={}, attempt={}, error={}",
                        url, attempt, last.message(), last.cause());
                    return TimetableParseResult.failure(ParseFailureKind.UNEXPECTED, last.message(), attempt, last.cause());
            }
        }

        transition(url, maxAttempts, ScrapeState.EXHAUSTED);
        ParseFailureKind kind = last.timedOut() ? ParseFailureKind.ENGINE_EXHAUSTED : ParseFailureKind.ENGINE_FAILURE;
        log.warn("timetable parse exhausted, url={}, attempts={}, kind={}, lastError={}",
            url, maxAttempts, kind, last.message());
        return TimetableParseResult.failure(
            kind,
            "timetable page could not be loaded after " + maxAttempts + " attempts: " + last.message(),
            maxAttempts,
            last.cause()
        );
    }

    private AttemptResult runAttempt(String url, int attempt, long navigationTimeoutMs) {
        transition(url, attempt, ScrapeState.ACQUIRING);
        AcquireResult acquired = handlePool.acquire(navigationTimeoutMs);
        switch (acquired.status()) {
            case ACQUIRED:
                break;
            case EXHAUSTED:
                return AttemptResult.poolExhausted();
            case LAUNCH_FAILED:
                return AttemptResult.transientFailure(
                    "browser launch failed: " + messageOf(acquired.cause()), acquired.cause());
            case SHUTDOWN:
            default:
                return AttemptResult.unexpected("browser handle pool is shutdown", null);
        }

        BrowserHandle handle = acquired.handle();
        try {
            transition(url, attempt, ScrapeState.NAVIGATING);
            NavigationResult navigation = handle.navigate(url);
            switch (navigation.status()) {
                case LOADED:
                    break;
                case TIMEOUT:
                    return AttemptResult.timeout(navigation.message(), navigation.cause());
                case ENGINE_FAILURE:
                    return AttemptResult.transientFailure(navigation.message(), navigation.cause());
                case UNEXPECTED:
                default:
                    return AttemptResult.unexpected(navigation.message(), navigation.cause());
            }

            transition(url, attempt, ScrapeState.EXTRACTING);
            ExtractionResult extraction = extractor.extract(navigation.html());
            switch (extraction.status()) {
                case OK:
                    return AttemptResult.succeeded(extraction.entries());
                case EMPTY:
                    // Usually a page that has not finished rendering rather than a truly empty timetable.
                    return AttemptResult.transientFailure(extraction.message(), null);
                case MALFORMED:
                default:
                    return AttemptResult.extractionFailed(extraction.message());
            }
        } catch (RuntimeException ex) {
            return AttemptResult.unexpected(messageOf(ex), ex);
        } finally {
            handlePool.release(handle);
        }
    }

    private boolean backoff() {
        long backoffMs = timetableProperties.getRetryBackoffMs();
        if (backoffMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("timetable retry backoff interrupted");
            return false;
        }
    }

    private void transition(String url, int attempt, ScrapeState state) {
        log.debug("timetable scrape state, url={}, attempt={}, state={}", url, attempt, state);
    }

    private String messageOf(Throwable ex) {
        if (ex == null) {
            return "";
        }
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

}
