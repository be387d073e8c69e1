package io.github.riemr.voucher.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference mappings built once per run. Iteration order of {@code workingDays}
 * is the order rows appeared in the reference sheet.
 */
@Value
public class LookupTables {
    Map<String, Integer> workingDays;
    Map<String, BigDecimal> dailyValues;

    public LookupTables(Map<String, Integer> workingDays, Map<String, BigDecimal> dailyValues) {
        this.workingDays = Collections.unmodifiableMap(new LinkedHashMap<>(workingDays));
        this.dailyValues = Collections.unmodifiableMap(new LinkedHashMap<>(dailyValues));
    }

    public static LookupTables empty() {
        return new LookupTables(Map.of(), Map.of());
    }
}
