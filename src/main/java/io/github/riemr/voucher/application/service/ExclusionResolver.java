package io.github.riemr.voucher.application.service;

import io.github.riemr.voucher.application.util.CellValues;
import io.github.riemr.voucher.config.VoucherProperties;
import io.github.riemr.voucher.domain.model.Dataset;
import io.github.riemr.voucher.domain.model.ExclusionCategory;
import io.github.riemr.voucher.domain.model.SourceColumns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Collects the identifiers of employees who are not entitled to the voucher:
 * everyone listed in a category sheet plus directors found in the roster.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExclusionResolver {

    private final VoucherProperties properties;

    public Set<Long> resolve(Dataset roster, Map<ExclusionCategory, Dataset> categorySources) {
        Set<Long> excluded = new LinkedHashSet<>();

        for (Map.Entry<ExclusionCategory, Dataset> e : categorySources.entrySet()) {
            int before = excluded.size();
            collectIdentifiers(e.getValue(), excluded);
            log.debug("Exclusion source {} added {} identifiers", e.getKey(), excluded.size() - before);
        }

        int before = excluded.size();
        collectDirectors(roster, excluded);
        log.debug("Exclusion source {} added {} identifiers", ExclusionCategory.DIRECTOR, excluded.size() - before);

        log.info("Excluded identifiers: {}", excluded.size());
        return excluded;
    }

    private void collectIdentifiers(Dataset source, Set<Long> into) {
        if (source == null || source.isEmpty()) return;
        String column = source.hasColumn(SourceColumns.MATRICULA) ? SourceColumns.MATRICULA
                : source.hasColumn(SourceColumns.CADASTRO) ? SourceColumns.CADASTRO
                : null;
        if (column == null) return;
        for (Object v : source.values(column)) {
            CellValues.toLong(v).ifPresent(into::add);
        }
    }

    private void collectDirectors(Dataset roster, Set<Long> into) {
        if (roster == null || roster.isEmpty()
                || !roster.hasColumn(SourceColumns.TITULO_DO_CARGO)
                || !roster.hasColumn(SourceColumns.MATRICULA)) {
            return;
        }
        String term = properties.getDirectorTerm().toUpperCase(Locale.ROOT);
        for (Map<String, Object> row : roster.getRows()) {
            String title = CellValues.toText(row.get(SourceColumns.TITULO_DO_CARGO)).toUpperCase(Locale.ROOT);
            if (title.contains(term)) {
                CellValues.toLong(row.get(SourceColumns.MATRICULA)).ifPresent(into::add);
            }
        }
    }
}
