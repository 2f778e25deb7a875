package fun.fengwk.ttp.core.service.timetable.parser;

import fun.fengwk.ttp.core.service.timetable.TimetableProperties;
import fun.fengwk.ttp.core.service.timetable.model.TimetableEntry;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts timetable entries from a rendered timetable page.
 *
 * <p>The grid is a table of day columns. Each subject block is absolutely positioned inside its column:
 * {@code top} encodes the start time and {@code height} the duration, on a fixed pixel-per-hour scale
 * starting at midnight.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class TimetableExtractor {

    static final String DAY_COLUMN_SELECTOR = ".wrap .tablebody .tablebody td";

    static final String FALLBACK_DAY_COLUMN_SELECTOR = ".tablebody td";

    static final String SUBJECT_SELECTOR = ".subject";

    static final List<String> WEEKDAYS = List.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday");

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final TimetableProperties timetableProperties;

    public ExtractionResult extract(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        Elements dayColumns = document.select(DAY_COLUMN_SELECTOR);
        if (dayColumns.isEmpty()) {
            dayColumns = document.select(FALLBACK_DAY_COLUMN_SELECTOR);
        }
        if (dayColumns.isEmpty()) {
            return ExtractionResult.empty("timetable day columns not found");
        }

        List<TimetableEntry> entries = new ArrayList<>();
        // Weekend columns, if any, are not part of the schedule.
        int dayCount = Math.min(dayColumns.size(), WEEKDAYS.size());
        for (int dayIndex = 0; dayIndex < dayCount; dayIndex++) {
            String day = WEEKDAYS.get(dayIndex);
            for (Element subject : dayColumns.get(dayIndex).select(SUBJECT_SELECTOR)) {
                BlockPosition position = readPosition(subject);
                if (position == null) {
                    return ExtractionResult.malformed(
                        "subject block on " + day + " has unreadable position: " + subject.attr("style"));
                }
                long startMinutes = toMinutes(position.top());
                long endMinutes = toMinutes(position.top() + position.height());
                if (!isTimeOfDay(startMinutes) || !isTimeOfDay(endMinutes)) {
                    return ExtractionResult.malformed(
                        "subject block on " + day + " falls outside the day: " + subject.attr("style"));
                }
                entries.add(TimetableEntry.builder()
                    .day(day)
                    .name(textOrDefault(subject, "h3", timetableProperties.getUnknownName()))
                    .startTime(formatTime(startMinutes))
                    .endTime(formatTime(endMinutes))
                    .place(textOrDefault(subject, "p span", timetableProperties.getUnknownPlace()))
                    .instructor(textOrDefault(subject, "em", timetableProperties.getUnknownInstructor()))
                    .build());
            }
        }

        if (entries.isEmpty()) {
            return ExtractionResult.empty("timetable has no subject blocks");
        }
        return ExtractionResult.ok(entries);
    }

    private BlockPosition readPosition(Element subject) {
        Map<String, String> declarations = parseStyle(subject.attr("style"));
        Long height = parsePixels(declarations.get("height"));
        Long top = parsePixels(declarations.get("top"));
        if (height == null || top == null) {
            return null;
        }
        return new BlockPosition(top, height);
    }

    private Map<String, String> parseStyle(String style) {
        Map<String, String> declarations = new HashMap<>();
        if (style == null) {
            return declarations;
        }
        for (String declaration : style.split(";")) {
            int separator = declaration.indexOf(':');
            if (separator <= 0) {
                continue;
            }
            String property = declaration.substring(0, separator).trim().toLowerCase(Locale.ROOT);
            declarations.put(property, declaration.substring(separator + 1).trim());
        }
        return declarations;
    }

    private Long parsePixels(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if (normalized.endsWith("px")) {
            normalized = normalized.substring(0, normalized.length() - 2).trim();
        }
        try {
            long pixels = Integer.parseInt(normalized);
            return pixels < 0 ? null : pixels;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private long toMinutes(long pixels) {
        int pixelsPerHour = Math.max(1, timetableProperties.getPixelsPerHour());
        return pixels * 60 / pixelsPerHour;
    }

    private boolean isTimeOfDay(long minutes) {
        return minutes >= 0 && minutes < MINUTES_PER_DAY;
    }

    private String formatTime(long minutes) {
        return String.format(Locale.ROOT, "%02d:%02d", minutes / 60, minutes % 60);
    }

    private String textOrDefault(Element subject, String selector, String defaultValue) {
        Element element = subject.selectFirst(selector);
        if (element == null) {
            return defaultValue;
        }
        String text = element.text().trim();
        return text.isEmpty() ? defaultValue : text;
    }

    private record BlockPosition(long top, long height) {

    }

}
