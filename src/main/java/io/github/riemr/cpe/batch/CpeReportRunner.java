package io.github.riemr.cpe.batch;

import io.github.riemr.cpe.application.dto.CpeReportRow;
import io.github.riemr.cpe.application.service.AttendanceReportReader;
import io.github.riemr.cpe.application.service.CpeReportService;
import io.github.riemr.cpe.application.service.CpeReportWriter;
import io.github.riemr.cpe.config.CpeProperties;
import io.github.riemr.cpe.domain.model.ParsedReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry: reads the export named by {@code cpe.input} or the first argument
 * (standard input when neither is given) and writes the CPE report to {@code cpe.output}.
 */
@Component
@ConditionalOnProperty(prefix = "cpe.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CpeReportRunner implements ApplicationRunner {

    private static final String STANDARD_STREAM = "-";

    private final CpeProperties properties;
    private final AttendanceReportReader reader;
    private final CpeReportService reportService;
    private final CpeReportWriter writer;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String input = properties.getInput();
        if (input == null && !args.getNonOptionArgs().isEmpty()) {
            input = args.getNonOptionArgs().get(0);
        }

        ParsedReport report;
        if (input == null || STANDARD_STREAM.equals(input)) {
            log.info("Reading attendance report from standard input");
            report = reader.read(System.in);
        } else {
            Path path = Path.of(input);
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException("file " + input + " does not exist");
            }
            report = reader.read(path);
        }

        List<CpeReportRow> rows = reportService.generate(report);

        String output = properties.getOutput();
        if (STANDARD_STREAM.equals(output)) {
            Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
            writer.write(rows, out);
        } else {
            try (Writer out = Files.newBufferedWriter(Path.of(output), StandardCharsets.UTF_8)) {
                writer.write(rows, out);
            }
        }
        log.info("Wrote {} CPE record(s) to {}", rows.size(), STANDARD_STREAM.equals(output) ? "standard output" : output);
    }
}
