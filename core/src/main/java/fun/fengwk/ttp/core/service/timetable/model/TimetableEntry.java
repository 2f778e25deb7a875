package fun.fengwk.ttp.core.service.timetable.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One subject block of a weekly timetable.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimetableEntry {

    /**
     * Weekday name, Monday to Friday.
     */
    private String day;

    private String name;

    /**
     * HH:MM, 24h.
     */
    private String startTime;

    /**
     * HH:MM, 24h.
     */
    private String endTime;

    private String place;

    private String instructor;

}
