package fun.fengwk.ttp.core.service.timetable.model;

import java.util.List;

/**
 * Either the extracted timetable or one final failure, never both.
 *
 * @param entries extracted entries, empty on failure
 * @param failure failure, null on success
 * @author fengwk
 */
public record TimetableParseResult(List<TimetableEntry> entries, ParseFailure failure) {

    public static TimetableParseResult success(List<TimetableEntry> entries) {
        return new TimetableParseResult(List.copyOf(entries), null);
    }

    public static TimetableParseResult failure(ParseFailureKind kind, String message, int attempts, Throwable cause) {
        return new TimetableParseResult(List.of(), ParseFailure.builder()
            .kind(kind)
            .message(message)
            .attempts(attempts)
            .cause(cause)
            .build());
    }

    public boolean isSuccess() {
        return failure == null;
    }

}
