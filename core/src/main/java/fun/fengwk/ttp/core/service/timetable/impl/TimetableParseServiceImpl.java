package fun.fengwk.ttp.core.service.timetable.impl;

import fun.fengwk.ttp.core.configuration.TimetableRuntimeConfiguration;
import fun.fengwk.ttp.core.service.browser.BrowserProperties;
import fun.fengwk.ttp.core.service.timetable.TimetableParseService;
import fun.fengwk.ttp.core.service.timetable.TimetableProperties;
import fun.fengwk.ttp.core.service.timetable.TimetableUrlValidator;
import fun.fengwk.ttp.core.service.timetable.model.ParseFailureKind;
import fun.fengwk.ttp.core.service.timetable.model.ParseRequest;
import fun.fengwk.ttp.core.service.timetable.model.TimetableParseResult;
import fun.fengwk.ttp.core.service.timetable.runtime.AdmissionController;
import fun.fengwk.ttp.core.service.timetable.runtime.TimetableScrapeExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Timetable parse service implementation.
 *
 * <p>Admission is awaited on a future, the blocking scrape runs on the dedicated worker pool, and the
 * admission slot is released as soon as that run finishes, whatever its outcome.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class TimetableParseServiceImpl implements TimetableParseService {

    private final TimetableUrlValidator urlValidator;
    private final AdmissionController admissionController;
    private final TimetableScrapeExecutor scrapeExecutor;
    private final ExecutorService workerExecutor;
    private final TimetableProperties timetableProperties;
    private final BrowserProperties browserProperties;

    public TimetableParseServiceImpl(
        TimetableUrlValidator urlValidator,
        AdmissionController admissionController,
        TimetableScrapeExecutor scrapeExecutor,
        @Qualifier(TimetableRuntimeConfiguration.SCRAPE_WORKER_EXECUTOR) ExecutorService workerExecutor,
        TimetableProperties timetableProperties,
        BrowserProperties browserProperties
    ) {
        this.urlValidator = urlValidator;
        this.admissionController = admissionController;
        this.scrapeExecutor = scrapeExecutor;
        this.workerExecutor = workerExecutor;
        this.timetableProperties = timetableProperties;
        this.browserProperties = browserProperties;
    }

    @Override
    public CompletableFuture<TimetableParseResult> parseAsync(String url) {
        // Rejected urls never take an admission slot.
        TimetableUrlValidator.UrlValidation validation = urlValidator.validate(url);
        if (!validation.valid()) {
            log.info("timetable url rejected, url={}, reason={}", url, validation.reason());
            return CompletableFuture.completedFuture(
                TimetableParseResult.failure(ParseFailureKind.VALIDATION, validation.reason(), 0, null));
        }
        ParseRequest request = ParseRequest.builder()
            .url(validation.url())
            .maxRetries(timetableProperties.getMaxRetries())
            .navigationTimeoutMs(browserProperties.getNavigationTimeoutMs())
            .build();

        CompletableFuture<TimetableParseResult> result = new CompletableFuture<>();
        CompletableFuture<AdmissionController.AdmissionSlot> admission = admissionController.acquire();
        admission.whenComplete((slot, ex) -> {
            if (ex != null) {
                // Only reachable through cancellation of the caller's future.
                result.completeExceptionally(ex);
                return;
            }
            if (result.isDone()) {
                slot.release();
                return;
            }
            submit(request, slot).thenAccept(result::complete);
        });
        result.whenComplete((parsed, ex) -> {
            if (result.isCancelled()) {
                admission.cancel(false);
            }
        });
        return result;
    }

    @Override
    public TimetableParseResult parse(String url) {
        try {
            return parseAsync(url).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("timetable parse interrupted, url={}", url);
            return TimetableParseResult.failure(ParseFailureKind.UNEXPECTED, "timetable parse interrupted", 0, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("timetable parse failed, url={}, error={}", url, cause.getMessage(), cause);
            return TimetableParseResult.failure(ParseFailureKind.UNEXPECTED, cause.getMessage(), 0, cause);
        }
    }

    private CompletableFuture<TimetableParseResult> submit(ParseRequest request, AdmissionController.AdmissionSlot slot) {
        CompletableFuture<TimetableParseResult> task;
        try {
            task = CompletableFuture.supplyAsync(() -> scrapeExecutor.execute(request), workerExecutor);
        } catch (RejectedExecutionException ex) {
            slot.release();
            log.warn("scrape worker pool rejected job, url={}, error={}", request.getUrl(), ex.getMessage());
            return CompletableFuture.completedFuture(
                TimetableParseResult.failure(ParseFailureKind.UNEXPECTED, "scrape worker pool is not accepting jobs", 0, ex));
        }
        return task.handle((parsed, ex) -> {
            slot.release();
            if (ex == null) {
                return parsed;
            }
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            log.error("scrape job failed, url={}, error={}", request.getUrl(), cause.getMessage(), cause);
            return TimetableParseResult.failure(ParseFailureKind.UNEXPECTED, cause.getMessage(), 0, cause);
        });
    }

}
