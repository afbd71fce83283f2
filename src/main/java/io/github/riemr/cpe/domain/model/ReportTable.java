package io.github.riemr.cpe.domain.model;

import io.github.riemr.cpe.exception.ReportFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One parsed section of the attendance export. Column names are case-folded; when a name
 * repeats, the last occurrence wins in the index. Rows are aligned to the header and hold
 * {@code null} for blank fields.
 */
public final class ReportTable {

    private final String name;
    private final List<String> columns;
    private final List<List<String>> rows;
    private final Map<String, Integer> columnIndex;

    public ReportTable(String name, List<String> columns, List<List<String>> rows) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rows = rows.stream()
                .map(r -> Collections.unmodifiableList(new ArrayList<>(r)))
                .toList();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            index.put(this.columns.get(i), i);
        }
        this.columnIndex = Collections.unmodifiableMap(index);
    }

    public String getName() {
        return name;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public int columnIndex(String column) {
        Integer idx = columnIndex.get(column);
        if (idx == null) {
            throw new ReportFormatException("no column '" + column + "' in table '" + name + "' - columns: " + columns);
        }
        return idx;
    }

    /** Value at the given row and column, {@code null} when the field is blank. */
    public String value(int row, String column) {
        if (row < 0 || row >= rows.size()) {
            throw new ReportFormatException("no row " + row + " in table '" + name + "', rows=" + rows.size());
        }
        return rows.get(row).get(columnIndex(column));
    }
}
