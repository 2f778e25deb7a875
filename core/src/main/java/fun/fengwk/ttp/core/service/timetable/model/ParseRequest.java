package fun.fengwk.ttp.core.service.timetable.model;

import lombok.Builder;
import lombok.Data;

/**
 * One logical timetable scrape job.
 *
 * @author fengwk
 */
@Data
@Builder
public class ParseRequest {

    private String url;

    private int maxRetries;

    private long navigationTimeoutMs;

}
