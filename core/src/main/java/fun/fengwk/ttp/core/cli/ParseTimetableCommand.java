package fun.fengwk.ttp.core.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.ttp.core.service.timetable.TimetableParseService;
import fun.fengwk.ttp.core.service.timetable.model.TimetableParseResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-shot timetable parse command runner, enabled by {@code --parse-url=<url>}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ParseTimetableCommand implements ApplicationRunner, ExitCodeGenerator {

    static final String OPTION_PARSE_URL = "parse-url";

    private final TimetableParseService timetableParseService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private volatile int exitCode = 0;

    @Autowired
    public ParseTimetableCommand(TimetableParseService timetableParseService, ObjectMapper objectMapper) {
        this(timetableParseService, objectMapper, System.out);
    }

    ParseTimetableCommand(TimetableParseService timetableParseService, ObjectMapper objectMapper, PrintStream out) {
        this.timetableParseService = timetableParseService;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        if (!args.containsOption(OPTION_PARSE_URL)) {
            return;
        }
        List<String> values = args.getOptionValues(OPTION_PARSE_URL);
        String url = values == null || values.isEmpty() ? "" : values.get(0);

        long startAt = System.currentTimeMillis();
        TimetableParseResult result = timetableParseService.parse(url);
        long elapsedMs = System.currentTimeMillis() - startAt;

        Map<String, Object> body = new LinkedHashMap<>();
        if (result.isSuccess()) {
            body.put("timetable", result.entries());
            body.put("message", "timetable parsed");
            exitCode = 0;
            log.info("parse command finished, url={}, entries={}, elapsedMs={}", url, result.entries().size(), elapsedMs);
        } else {
            body.put("error", result.failure());
            exitCode = 1;
            log.warn("parse command failed, url={}, kind={}, elapsedMs={}", url, result.failure().getKind(), elapsedMs);
        }
        out.println(objectMapper.writeValueAsString(body));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

}
