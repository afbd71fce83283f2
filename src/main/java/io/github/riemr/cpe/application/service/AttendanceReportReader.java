package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.dto.SplitReport;
import io.github.riemr.cpe.domain.model.ParsedReport;
import io.github.riemr.cpe.domain.model.RawTableGroup;
import io.github.riemr.cpe.domain.model.ReportTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads an attendance export (UTF-8, optionally with byte order mark) into its tables. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceReportReader {

    private final ReportTableSplitter splitter;
    private final ReportTableParser parser;

    public ParsedReport read(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            log.info("Reading attendance report {}", path);
            return read(br);
        }
    }

    public ParsedReport read(InputStream in) throws IOException {
        return read(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    }

    private ParsedReport read(BufferedReader br) throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    public ParsedReport parse(List<String> lines) {
        SplitReport split = splitter.split(lines);
        Map<String, ReportTable> tables = new LinkedHashMap<>();
        for (RawTableGroup group : split.groups()) {
            ReportTable table = parser.parse(group);
            tables.put(table.getName(), table);
        }
        ParsedReport report = new ParsedReport(tables, split.generatedAt());
        log.info("Parsed {} table(s): {}", tables.size(), report.titles());
        return report;
    }
}
