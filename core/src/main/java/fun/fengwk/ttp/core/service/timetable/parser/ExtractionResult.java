package fun.fengwk.ttp.core.service.timetable.parser;

import fun.fengwk.ttp.core.service.timetable.model.TimetableEntry;

import java.util.List;

/**
 * Outcome of reading timetable entries from a rendered document.
 *
 * @param status extraction status
 * @param entries extracted entries, non-empty only when {@code OK}
 * @param message reason when not {@code OK}
 * @author fengwk
 */
public record ExtractionResult(Status status, List<TimetableEntry> entries, String message) {

    public enum Status {

        OK,

        /**
         * No timetable structure or no subject block, usually a page that has not finished rendering.
         */
        EMPTY,

        /**
         * Subject blocks present but their layout cannot be read, usually a page format change.
         */
        MALFORMED

    }

    public static ExtractionResult ok(List<TimetableEntry> entries) {
        return new ExtractionResult(Status.OK, List.copyOf(entries), "");
    }

    public static ExtractionResult empty(String message) {
        return new ExtractionResult(Status.EMPTY, List.of(), message);
    }

    public static ExtractionResult malformed(String message) {
        return new ExtractionResult(Status.MALFORMED, List.of(), message);
    }

}
