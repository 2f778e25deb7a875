package fun.fengwk.ttp.core.service.timetable.model;

/**
 * Caller-facing failure kinds of a timetable parse.
 *
 * @author fengwk
 */
public enum ParseFailureKind {

    /**
     * Malformed or off-domain url, never retried.
     */
    VALIDATION(400),

    /**
     * Browser handle cap reached, caller should retry later.
     */
    POOL_EXHAUSTED(503),

    /**
     * Retries used up and the last attempt timed out.
     */
    ENGINE_EXHAUSTED(504),

    /**
     * Retries used up and the last attempt hit an engine crash, launch failure or empty render.
     */
    ENGINE_FAILURE(503),

    /**
     * Page loaded but its timetable markup could not be read, never retried.
     */
    EXTRACTION(502),

    UNEXPECTED(500);

    private final int httpStatus;

    ParseFailureKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

}
