package io.github.riemr.voucher.support;

import io.github.riemr.voucher.domain.model.Dataset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestDatasets {

    private TestDatasets() {}

    /** Positional rows under the given header; short rows are padded with nulls. */
    public static Dataset of(List<String> columns, Object[]... rows) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object[] row : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                m.put(columns.get(i), i < row.length ? row[i] : null);
            }
            out.add(m);
        }
        return Dataset.of(columns, out);
    }

    public static Object[] row(Object... values) {
        return values;
    }
}
