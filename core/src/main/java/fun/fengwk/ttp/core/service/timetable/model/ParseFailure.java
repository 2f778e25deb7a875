package fun.fengwk.ttp.core.service.timetable.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

/**
 * Final typed failure of a timetable parse.
 *
 * @author fengwk
 */
@Data
@Builder
public class ParseFailure {

    private ParseFailureKind kind;

    private String message;

    /**
     * Navigation attempts made before giving up, 0 when no handle was ever leased.
     */
    private int attempts;

    @JsonIgnore
    private Throwable cause;

    public int getStatus() {
        return kind == null ? ParseFailureKind.UNEXPECTED.getHttpStatus() : kind.getHttpStatus();
    }

}
