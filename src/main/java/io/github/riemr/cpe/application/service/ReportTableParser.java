package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.domain.model.RawTableGroup;
import io.github.riemr.cpe.domain.model.ReportTable;
import io.github.riemr.cpe.exception.ReportFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns one raw section into a {@link ReportTable}.
 *
 * <p>Rows shorter than the header are padded with blank fields. Longer rows are accepted only
 * when the surplus fields are blank, otherwise the export is rejected. A line with an
 * unbalanced quote is split again loosely, keeping quotes inside unquoted fields literally.</p>
 */
@Service
@Slf4j
public class ReportTableParser {

    public ReportTable parse(RawTableGroup group) {
        List<String> lines = group.lines();
        if (lines.isEmpty()) {
            return new ReportTable(group.title(), List.of(), List.of());
        }
        DelimitedLineTokenizer tokenizer = newTokenizer();

        List<String> columns = new ArrayList<>();
        for (String field : tokenize(tokenizer, lines.get(0))) {
            columns.add(field == null ? "" : field.toLowerCase(Locale.ROOT));
        }

        List<List<String>> rows = new ArrayList<>();
        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            String line = lines.get(lineNo);
            List<String> values = new ArrayList<>(Arrays.asList(tokenize(tokenizer, line)));
            if (values.size() < columns.size() && hasUnbalancedQuote(line)) {
                values = new ArrayList<>(Arrays.asList(splitLoosely(line)));
                log.warn("table '{}' line {}: unbalanced quote, fields split literally",
                        group.title(), lineNo + 1);
            }
            if (values.size() < columns.size()) {
                log.debug("table '{}' line {}: padding {} missing field(s)",
                        group.title(), lineNo + 1, columns.size() - values.size());
                while (values.size() < columns.size()) values.add(null);
            } else if (values.size() > columns.size()) {
                List<String> surplus = values.subList(columns.size(), values.size());
                if (surplus.stream().anyMatch(Objects::nonNull)) {
                    throw new ReportFormatException("table '" + group.title() + "' line " + (lineNo + 1)
                            + ": " + values.size() + " fields but header has " + columns.size());
                }
                surplus.clear();
            }
            rows.add(values);
        }
        return new ReportTable(group.title(), columns, rows);
    }

    private static DelimitedLineTokenizer newTokenizer() {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(DelimitedLineTokenizer.DELIMITER_COMMA);
        tokenizer.setQuoteCharacter(DelimitedLineTokenizer.DEFAULT_QUOTE_CHARACTER);
        return tokenizer;
    }

    private static boolean hasUnbalancedQuote(String line) {
        return line.chars().filter(c -> c == '"').count() % 2 != 0;
    }

    /**
     * Splits on commas, opening a quoted field only at the start of a field. Inside a quoted
     * field {@code ""} is an escaped quote and a quote not followed by a comma is kept.
     */
    static String[] splitLoosely(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else if (c == '"' && (i + 1 == line.length() || line.charAt(i + 1) == ',')) {
                    quoted = false;
                } else {
                    field.append(c);
                }
            } else if (c == '"' && field.toString().isBlank()) {
                field.setLength(0);
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
            i++;
        }
        fields.add(field.toString());
        String[] out = new String[fields.size()];
        for (int j = 0; j < out.length; j++) {
            out[j] = blankToNull(fields.get(j));
        }
        return out;
    }

    private static String blankToNull(String raw) {
        String v = raw == null ? null : raw.trim();
        return (v == null || v.isEmpty()) ? null : v;
    }

    /** Fields of one line, trimmed, with blank fields as {@code null}. */
    private static String[] tokenize(DelimitedLineTokenizer tokenizer, String line) {
        String[] raw = tokenizer.tokenize(line).getValues();
        String[] out = new String[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = blankToNull(raw[i]);
        }
        return out;
    }
}
