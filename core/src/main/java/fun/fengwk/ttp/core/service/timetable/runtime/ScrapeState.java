package fun.fengwk.ttp.core.service.timetable.runtime;

/**
 * States of one timetable scrape request.
 *
 * @author fengwk
 */
public enum ScrapeState {

    VALIDATING,
    ACQUIRING,
    NAVIGATING,
    EXTRACTING,
    RETRYING,
    SUCCEEDED,
    EXHAUSTED,
    FAILED

}
