package fun.fengwk.ttp.core.service.timetable;

import fun.fengwk.ttp.core.service.timetable.model.TimetableParseResult;

import java.util.concurrent.CompletableFuture;

/**
 * Timetable parse service entry.
 *
 * @author fengwk
 */
public interface TimetableParseService {

    /**
     * Parse the timetable at {@code url} without blocking the caller on browser work.
     *
     * <p>The returned future never completes exceptionally except by cancellation; failures are
     * reported through {@link TimetableParseResult#failure()}.
     */
    CompletableFuture<TimetableParseResult> parseAsync(String url);

    /**
     * Blocking variant of {@link #parseAsync(String)}.
     */
    TimetableParseResult parse(String url);

}
