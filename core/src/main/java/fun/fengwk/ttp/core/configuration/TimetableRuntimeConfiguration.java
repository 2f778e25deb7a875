package fun.fengwk.ttp.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fun.fengwk.ttp.core.service.browser.BrowserProperties;
import fun.fengwk.ttp.core.service.browser.runtime.BrowserHandlePool;
import fun.fengwk.ttp.core.service.browser.runtime.BrowserSessionFactory;
import fun.fengwk.ttp.core.service.browser.runtime.PlaywrightBrowserSessionFactory;
import fun.fengwk.ttp.core.service.timetable.TimetableProperties;
import fun.fengwk.ttp.core.service.timetable.runtime.AdmissionController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the browser handle pool, admission gate and scrape worker pool, and ties their lifecycle
 * to the application context.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class TimetableRuntimeConfiguration {

    public static final String SCRAPE_WORKER_EXECUTOR = "timetableScrapeWorkerExecutor";

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Bean
    public BrowserSessionFactory browserSessionFactory(BrowserProperties browserProperties) {
        return new PlaywrightBrowserSessionFactory(browserProperties);
    }

    @Bean(destroyMethod = "shutdownAll")
    public BrowserHandlePool browserHandlePool(
        BrowserProperties browserProperties,
        BrowserSessionFactory browserSessionFactory
    ) {
        BrowserHandlePool pool = new BrowserHandlePool(
            browserProperties.getMaxHandles(),
            browserProperties.getNavigationTimeoutMs(),
            browserSessionFactory
        );
        log.info("browser handle pool initialized, maxHandles={}, navigationTimeoutMs={}, headless={}",
            pool.getMaxHandles(), browserProperties.getNavigationTimeoutMs(), browserProperties.isHeadless());
        return pool;
    }

    @Bean
    public AdmissionController admissionController(
        TimetableProperties timetableProperties,
        BrowserHandlePool browserHandlePool
    ) {
        int slots = Math.max(1, timetableProperties.getAdmissionSlots());
        if (slots > browserHandlePool.getMaxHandles()) {
            log.warn("admissionSlots {} exceeds maxHandles {}, capping admission to the handle limit",
                slots, browserHandlePool.getMaxHandles());
            slots = browserHandlePool.getMaxHandles();
        }
        log.info("timetable admission controller initialized, slots={}", slots);
        return new AdmissionController(slots);
    }

    @Bean(name = SCRAPE_WORKER_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService timetableScrapeWorkerExecutor(
        TimetableProperties timetableProperties,
        BrowserHandlePool browserHandlePool
    ) {
        int threads = Math.max(timetableProperties.getWorkerThreads(), browserHandlePool.getMaxHandles());
        AtomicInteger threadIdGen = new AtomicInteger(1);
        log.info("timetable scrape worker pool initialized, threads={}", threads);
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("ttp-scrape-worker-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

}
