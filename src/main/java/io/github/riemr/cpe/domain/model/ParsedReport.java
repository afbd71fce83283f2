package io.github.riemr.cpe.domain.model;

import io.github.riemr.cpe.exception.ReportFormatException;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** All tables of one attendance export, keyed by case-folded title in discovery order. */
public record ParsedReport(Map<String, ReportTable> tables, LocalDateTime generatedAt) {

    public ParsedReport {
        tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public List<String> titles() {
        return List.copyOf(tables.keySet());
    }

    public Optional<ReportTable> findTable(String title) {
        return Optional.ofNullable(tables.get(title));
    }

    public ReportTable table(String title) {
        return findTable(title).orElseThrow(() -> new ReportFormatException(
                "no such table '" + title + "' - defined tables: " + String.join(", ", tables.keySet())));
    }
}
