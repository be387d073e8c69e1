package io.github.riemr.voucher.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Rectangular table loaded from one named source: ordered column names plus one
 * map per row. A source that could not be found or read is represented by
 * {@link #empty()}.
 * <p>
 * Column renames rewrite every row and are not reversible.
 */
public class Dataset {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private Dataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Dataset empty() {
        return new Dataset(new ArrayList<>(), new ArrayList<>());
    }

    public static Dataset of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            Map<String, Object> r = new LinkedHashMap<>();
            for (String c : columns) {
                r.put(c, row.get(c));
            }
            copy.add(r);
        }
        return new Dataset(new ArrayList<>(columns), copy);
    }

    /** True when there are no rows, whether or not a header was read. */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    /** Renames {@code from} to {@code to}; no-op when {@code from} is absent or equal to {@code to}. */
    public void renameColumn(String from, String to) {
        int idx = columns.indexOf(from);
        if (idx < 0 || from.equals(to)) return;
        if (columns.contains(to)) {
            throw new IllegalStateException("Column already present: " + to);
        }
        columns.set(idx, to);
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> renamed = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : rows.get(i).entrySet()) {
                renamed.put(e.getKey().equals(from) ? to : e.getKey(), e.getValue());
            }
            rows.set(i, renamed);
        }
    }

    /** Replaces every value of {@code column} with {@code fn(value)}; no-op when the column is absent. */
    public void convertColumn(String column, Function<Object, Object> fn) {
        if (!hasColumn(column)) return;
        for (Map<String, Object> row : rows) {
            row.put(column, fn.apply(row.get(column)));
        }
    }

    public List<Object> values(String column) {
        if (!hasColumn(column)) return List.of();
        List<Object> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            out.add(row.get(column));
        }
        return out;
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
