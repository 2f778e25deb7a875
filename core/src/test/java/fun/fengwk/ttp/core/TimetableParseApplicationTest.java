package fun.fengwk.ttp.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.ttp.core.service.browser.runtime.BrowserHandlePool;
import fun.fengwk.ttp.core.service.browser.runtime.FakeBrowserSessionFactory;
import fun.fengwk.ttp.core.service.browser.runtime.NavigationResult;
import fun.fengwk.ttp.core.service.timetable.TimetableParseService;
import fun.fengwk.ttp.core.service.timetable.model.ParseFailureKind;
import fun.fengwk.ttp.core.service.timetable.model.TimetableEntry;
import fun.fengwk.ttp.core.service.timetable.model.TimetableParseResult;
import fun.fengwk.ttp.core.service.timetable.runtime.AdmissionController;
import fun.fengwk.ttp.core.support.TimetablePages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
@SpringBootTest(classes = CoreTestApplication.class)
@Import(TimetableParseApplicationTest.FakeEngineConfiguration.class)
public class TimetableParseApplicationTest {

    @Autowired
    private TimetableParseService timetableParseService;

    @Autowired
    private FakeBrowserSessionFactory fakeBrowserSessionFactory;

    @Autowired
    private BrowserHandlePool browserHandlePool;

    @Autowired
    private AdmissionController admissionController;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    public void setUp() {
        fakeBrowserSessionFactory.setRenderer(url -> NavigationResult.loaded(TimetablePages.TWO_SUBJECTS));
    }

    @Test
    public void shouldCapAdmissionToHandleLimit() {
        assertThat(browserHandlePool.getMaxHandles()).isEqualTo(2);
        assertThat(admissionController.getSlots()).isEqualTo(2);
    }

    @Test
    public void shouldParseTimetable() {
        TimetableParseResult result = timetableParseService.parse(TimetablePages.URL);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.entries()).containsExactly(
            new TimetableEntry("Monday", "Calculus", "09:00", "10:30", "Hall 101", "Kim"),
            new TimetableEntry("Tuesday", "Korean History", "10:00", "12:00", "Hall 204", "Park")
        );
        assertThat(browserHandlePool.getActiveCount()).isZero();
    }

    @Test
    public void shouldExhaustConfiguredRetries() throws Exception {
        fakeBrowserSessionFactory.setRenderer(url -> NavigationResult.timeout("navigation timeout after 1000ms", null));
        int rendersBefore = fakeBrowserSessionFactory.getRenderCount();

        TimetableParseResult result = timetableParseService.parseAsync(TimetablePages.URL).get();

        assertThat(result.failure().getKind()).isEqualTo(ParseFailureKind.ENGINE_EXHAUSTED);
        assertThat(result.failure().getAttempts()).isEqualTo(2);
        assertThat(fakeBrowserSessionFactory.getRenderCount() - rendersBefore).isEqualTo(2);
        assertThat(admissionController.availableSlots()).isEqualTo(2);
    }

    @Test
    public void shouldSerializeFailureWithoutCause() throws Exception {
        TimetableParseResult result = timetableParseService.parse("ftp://example.com");

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result.failure()));

        assertThat(json.get("kind").asText()).isEqualTo("VALIDATION");
        assertThat(json.get("status").asInt()).isEqualTo(400);
        assertThat(json.get("message").asText()).isEqualTo("unsupported url protocol");
        assertThat(json.get("attempts").asInt()).isZero();
        assertThat(json.has("cause")).isFalse();
    }

    @TestConfiguration
    static class FakeEngineConfiguration {

        @Bean
        @Primary
        public FakeBrowserSessionFactory fakeBrowserSessionFactory() {
            return FakeBrowserSessionFactory.serving(TimetablePages.TWO_SUBJECTS);
        }

    }

}
