package fun.fengwk.ttp.core.service.timetable.parser;

import fun.fengwk.ttp.core.service.timetable.TimetableProperties;
import fun.fengwk.ttp.core.service.timetable.model.TimetableEntry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class TimetableExtractorTest {

    @Test
    public void shouldExtractEntriesInDayAndDocumentOrder() {
        String html = grid(
            subject("top: 540px; height: 90px;", "Calculus", "Hall 101", "Kim")
                + subject("top: 780px; height: 60px;", "Physics", "Lab 3", "Lee"),
            "",
            subject("height: 120px; top: 600px;", "Korean History", "Hall 204", "Park")
        );

        ExtractionResult result = extractor(60).extract(html);

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.OK);
        assertThat(result.entries()).containsExactly(
            new TimetableEntry("Monday", "Calculus", "09:00", "10:30", "Hall 101", "Kim"),
            new TimetableEntry("Monday", "Physics", "13:00", "14:00", "Lab 3", "Lee"),
            new TimetableEntry("Wednesday", "Korean History", "10:00", "12:00", "Hall 204", "Park")
        );
    }

    @Test
    public void shouldScaleTimesByConfiguredPixelsPerHour() {
        String html = grid(subject("top: 100px; height: 50px;", "Seminar", "Room 1", "Choi"));

        TimetableEntry halfScale = extractor(50).extract(html).entries().get(0);
        TimetableEntry defaultScale = extractor(60).extract(html).entries().get(0);

        assertThat(halfScale.getStartTime()).isEqualTo("02:00");
        assertThat(halfScale.getEndTime()).isEqualTo("03:00");
        assertThat(defaultScale.getStartTime()).isEqualTo("01:40");
        assertThat(defaultScale.getEndTime()).isEqualTo("02:30");
    }

    @Test
    public void shouldFillPlaceholdersForMissingFields() {
        String html = grid("<div class=\"subject\" style=\"top: 600px; height: 60px;\"><h3>  </h3></div>");

        TimetableEntry entry = extractor(60).extract(html).entries().get(0);

        assertThat(entry.getName()).isEqualTo("알 수 없음");
        assertThat(entry.getPlace()).isEqualTo("장소 미정");
        assertThat(entry.getInstructor()).isEqualTo("담당자 미정");
    }

    @Test
    public void shouldKeepDayMappingAfterEmptyColumns() {
        String html = grid("", "", "", "", subject("top: 60px; height: 60px;", "Friday Lab", "Lab 1", "Yoon"));

        ExtractionResult result = extractor(60).extract(html);

        assertThat(result.entries()).extracting(TimetableEntry::getDay).containsExactly("Friday");
    }

    @Test
    public void shouldIgnoreWeekendColumns() {
        String html = grid(
            subject("top: 60px; height: 60px;", "Monday Class", "A", "B"),
            "", "", "", "",
            subject("top: 60px; height: 60px;", "Saturday Club", "C", "D")
        );

        ExtractionResult result = extractor(60).extract(html);

        assertThat(result.entries()).extracting(TimetableEntry::getName).containsExactly("Monday Class");
    }

    @Test
    public void shouldFallBackToFlatGridLayout() {
        String html = "<div class=\"tablebody\"><table><tr><td></td><td>"
            + subject("top: 120px; height: 60px;", "Tuesday Talk", "Room 2", "Han")
            + "</td></tr></table></div>";

        ExtractionResult result = extractor(60).extract(html);

        assertThat(result.entries()).containsExactly(
            new TimetableEntry("Tuesday", "Tuesday Talk", "02:00", "03:00", "Room 2", "Han"));
    }

    @Test
    public void shouldReportEmptyWhenNoSubjectBlocks() {
        ExtractionResult result = extractor(60).extract(grid("", "", "", "", ""));

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.EMPTY);
        assertThat(result.entries()).isEmpty();
    }

    @Test
    public void shouldReportEmptyWhenGridMissing() {
        ExtractionResult result = extractor(60).extract("<html><body><div id=\"loading\"></div></body></html>");

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.EMPTY);
        assertThat(result.message()).isEqualTo("timetable day columns not found");
        assertThat(extractor(60).extract(null).status()).isEqualTo(ExtractionResult.Status.EMPTY);
    }

    @Test
    public void shouldReportMalformedWhenPositionUnreadable() {
        ExtractionResult missingTop = extractor(60).extract(grid(subject("height: 60px;", "A", "B", "C")));
        ExtractionResult notNumeric = extractor(60).extract(grid(subject("top: auto; height: 60px;", "A", "B", "C")));
        ExtractionResult negative = extractor(60).extract(grid(subject("top: -10px; height: 60px;", "A", "B", "C")));

        assertThat(missingTop.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
        assertThat(notNumeric.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
        assertThat(negative.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
        assertThat(missingTop.message()).startsWith("subject block on Monday has unreadable position");
    }

    @Test
    public void shouldReportMalformedWhenBlockEndsAfterMidnight() {
        ExtractionResult result = extractor(60).extract(grid(subject("top: 1380px; height: 60px;", "A", "B", "C")));

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
        assertThat(result.message()).contains("falls outside the day");
    }

    @Test
    public void shouldReportMalformedWhenBlockStartsAfterMidnight() {
        ExtractionResult result = extractor(60).extract(grid(subject("top: 1500px; height: 0px;", "A", "B", "C")));

        assertThat(result.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
        assertThat(result.entries()).isEmpty();
    }

    @Test
    public void shouldReportMalformedForHugeGeometry() {
        ExtractionResult hugeHeight = extractor(60)
            .extract(grid(subject("height: 2147483000px; top: 2000px;", "A", "B", "C")));
        ExtractionResult hugeBoth = extractor(60)
            .extract(grid(subject("height: 2147483647px; top: 2147483647px;", "A", "B", "C")));
        ExtractionResult beyondInt = extractor(60)
            .extract(grid(subject("height: 60px; top: 99999999999px;", "A", "B", "C")));

        assertThat(hugeHeight.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
        assertThat(hugeBoth.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
        assertThat(beyondInt.status()).isEqualTo(ExtractionResult.Status.MALFORMED);
    }

    private TimetableExtractor extractor(int pixelsPerHour) {
        TimetableProperties properties = new TimetableProperties();
        properties.setPixelsPerHour(pixelsPerHour);
        return new TimetableExtractor(properties);
    }

    private String grid(String... columns) {
        StringBuilder html = new StringBuilder("""
            <html><body>
              <div class="wrap">
                <div class="tablehead"><table><tr><th>Mon</th><th>Tue</th></tr></table></div>
                <div class="tablebody">
                  <table class="tablebody"><tr>
            """);
        for (String column : columns) {
            html.append("<td><div class=\"cols\">").append(column).append("</div></td>");
        }
        html.append("""
                  </tr></table>
                </div>
              </div>
            </body></html>
            """);
        return html.toString();
    }

    private String subject(String style, String name, String place, String instructor) {
        return "<div class=\"subject\" style=\"" + style + "\">"
            + "<h3>" + name + "</h3>"
            + "<p><em>" + instructor + "</em><span>" + place + "</span></p>"
            + "</div>";
    }

}
