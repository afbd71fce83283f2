package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.dto.CpeReportRow;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;

/** Writes report rows as CSV, quoting fields that contain a comma, quote or line break. */
@Component
public class CpeReportWriter {

    public void write(List<CpeReportRow> rows, Writer writer) throws IOException {
        writeLine(writer, CpeReportRow.HEADER);
        for (CpeReportRow row : rows) {
            writeLine(writer, row.toFields());
        }
        writer.flush();
    }

    private static void writeLine(Writer writer, List<String> fields) throws IOException {
        writer.write(fields.stream().map(CpeReportWriter::quote).collect(Collectors.joining(",")));
        writer.write('\n');
    }

    static String quote(String field) {
        if (field == null) return "";
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
