package fun.fengwk.ttp.core.service.timetable.runtime;

import fun.fengwk.ttp.core.service.timetable.model.TimetableEntry;

import java.util.List;

/**
 * Outcome of a single acquire-navigate-extract attempt.
 *
 * @param status attempt status
 * @param entries extracted entries, only present when succeeded
 * @param message failure message
 * @param cause underlying failure, may be null
 * @param timedOut whether a transient failure was a navigation timeout
 * @author fengwk
 */
record AttemptResult(
    AttemptStatus status,
    List<TimetableEntry> entries,
    String message,
    Throwable cause,
    boolean timedOut
) {

    enum AttemptStatus {

        SUCCEEDED,

        /**
         * Timeout, engine failure, launch failure or empty render: worth another attempt.
         */
        TRANSIENT,

        POOL_EXHAUSTED,

        EXTRACTION_FAILED,

        UNEXPECTED

    }

    static AttemptResult succeeded(List<TimetableEntry> entries) {
        return new AttemptResult(AttemptStatus.SUCCEEDED, entries, "", null, false);
    }

    static AttemptResult timeout(String message, Throwable cause) {
        return new AttemptResult(AttemptStatus.TRANSIENT, List.of(), message, cause, true);
    }

    static AttemptResult transientFailure(String message, Throwable cause) {
        return new AttemptResult(AttemptStatus.TRANSIENT, List.of(), message, cause, false);
    }

    static AttemptResult poolExhausted() {
        return new AttemptResult(AttemptStatus.POOL_EXHAUSTED, List.of(), "browser handle pool is busy, retry later", null, false);
    }

    static AttemptResult extractionFailed(String message) {
        return new AttemptResult(AttemptStatus.EXTRACTION_FAILED, List.of(), message, null, false);
    }

    static AttemptResult unexpected(String message, Throwable cause) {
        return new AttemptResult(AttemptStatus.UNEXPECTED, List.of(), message, cause, false);
    }

}
