package io.github.riemr.voucher.application.service;

import io.github.riemr.voucher.application.util.CellValues;
import io.github.riemr.voucher.application.util.ColumnResolver;
import io.github.riemr.voucher.config.VoucherProperties;
import io.github.riemr.voucher.domain.model.Dataset;
import io.github.riemr.voucher.domain.model.LookupTables;
import io.github.riemr.voucher.domain.model.Region;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds and queries the two reference tables. The sheets behind them are
 * typed by hand: header-like rows and unparsable values are skipped, never fatal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LookupResolver {

    static final ColumnResolver DAYS_LABEL = ColumnResolver.at(0);
    static final ColumnResolver DAYS_VALUE = ColumnResolver.at(1);
    static final ColumnResolver REGION_LABEL = ColumnResolver.containing("ESTADO").orPosition(0);
    static final ColumnResolver REGION_VALUE = ColumnResolver.containing("VALOR").orPosition(1);

    private static final String UNION_HEADER_TOKEN = "SINDIC";
    private static final String DAYS_HEADER_TOKEN = "DIAS";

    private final VoucherProperties properties;

    public LookupTables build(Dataset workingDaysSource, Dataset dailyValueSource) {
        return new LookupTables(buildWorkingDays(workingDaysSource), buildDailyValues(dailyValueSource));
    }

    /** Union label to working days, in sheet order. */
    public Map<String, Integer> buildWorkingDays(Dataset source) {
        Map<String, Integer> out = new LinkedHashMap<>();
        if (source == null || source.isEmpty() || source.getColumns().isEmpty()) {
            log.info("Working-days mappings: 0");
            return out;
        }
        String labelCol = DAYS_LABEL.resolve(source).orElseThrow();
        String daysCol = DAYS_VALUE.resolve(source).orElseThrow();

        for (Map<String, Object> row : source.getRows()) {
            String label = CellValues.toText(row.get(labelCol)).strip();
            Object days = row.get(daysCol);
            if (label.isEmpty()
                    || label.toUpperCase(Locale.ROOT).contains(UNION_HEADER_TOKEN)
                    || CellValues.toText(days).toUpperCase(Locale.ROOT).contains(DAYS_HEADER_TOKEN)) {
                continue;
            }
            CellValues.toInteger(days).ifPresent(d -> out.put(label, d));
        }
        log.info("Working-days mappings: {}", out.size());
        return out;
    }

    /** Region label to daily value. */
    public Map<String, BigDecimal> buildDailyValues(Dataset source) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        if (source == null || source.isEmpty() || source.getColumns().isEmpty()) {
            log.info("Daily-value mappings: 0");
            return out;
        }
        String regionCol = REGION_LABEL.resolve(source).orElseThrow();
        String valueCol = REGION_VALUE.resolve(source).orElseThrow();

        for (Map<String, Object> row : source.getRows()) {
            String region = CellValues.toText(row.get(regionCol)).strip();
            if (region.isEmpty()) continue;
            CellValues.toDecimal(row.get(valueCol)).ifPresent(v -> out.put(region, v));
        }
        log.info("Daily-value mappings: {}", out.size());
        return out;
    }

    /**
     * Working days for the first table key contained in {@code unionLabel}, or
     * the configured default.
     */
    public int workingDaysFor(String unionLabel, LookupTables tables) {
        String label = unionLabel == null ? "" : unionLabel;
        for (Map.Entry<String, Integer> e : tables.getWorkingDays().entrySet()) {
            if (label.contains(e.getKey())) {
                return e.getValue();
            }
        }
        return properties.getDefaultWorkingDays();
    }

    public BigDecimal dailyValueFor(String unionLabel, LookupTables tables) {
        Region region = Region.classify(unionLabel);
        return Optional.ofNullable(tables.getDailyValues().get(region.getTableKey()))
                .orElseGet(() -> fallbackValue(region));
    }

    private BigDecimal fallbackValue(Region region) {
        return region == Region.SAO_PAULO ? properties.getSaoPauloDailyValue() : properties.getDefaultDailyValue();
    }
}
