package fun.fengwk.ttp.core.service.timetable;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Timetable parse pipeline configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "ttp.timetable")
public class TimetableProperties {

    /**
     * Hosts a timetable url may point to, subdomains included.
     */
    private List<String> allowedHosts = List.of("everytime.kr");

    /**
     * Extra attempts after the first one for transient engine failures.
     */
    private int maxRetries = 2;

    /**
     * Fixed backoff between attempts.
     */
    private long retryBackoffMs = 1000;

    /**
     * Max scrape jobs in flight per process, capped by the browser handle limit.
     */
    private int admissionSlots = 5;

    /**
     * Worker threads running blocking scrape jobs, never fewer than the browser handle limit.
     */
    private int workerThreads = 10;

    /**
     * Vertical pixels of the rendered timetable grid per hour of the day.
     */
    private int pixelsPerHour = 60;

    private String unknownName = "알 수 없음";

    private String unknownPlace = "장소 미정";

    private String unknownInstructor = "담당자 미정";

}
