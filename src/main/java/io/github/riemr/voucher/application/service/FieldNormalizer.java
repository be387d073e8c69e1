package io.github.riemr.voucher.application.service;

import io.github.riemr.voucher.application.util.CellValues;
import io.github.riemr.voucher.application.util.ColumnResolver;
import io.github.riemr.voucher.domain.model.Dataset;
import io.github.riemr.voucher.domain.model.SourceColumns;
import org.springframework.stereotype.Component;

/**
 * Brings the identifier, union and admission columns of every sheet to their
 * canonical names so the sheets can be joined. Renames happen in place.
 */
@Component
public class FieldNormalizer {

    static final ColumnResolver IDENTIFIER = ColumnResolver.containing("matric", "cadastro")
            .preferring(SourceColumns.MATRICULA);
    static final ColumnResolver UNION = ColumnResolver.containing("sind")
            .preferring(SourceColumns.SINDICATO);
    static final ColumnResolver ADMISSION = ColumnResolver.containing("admiss")
            .preferring(SourceColumns.ADMISSAO);

    /** Canonical identifier column, coerced to {@code Long} or {@code null}. */
    public Dataset normalizeIdentifier(Dataset dataset) {
        IDENTIFIER.resolve(dataset)
                .ifPresent(col -> dataset.renameColumn(col, SourceColumns.MATRICULA));
        dataset.convertColumn(SourceColumns.MATRICULA, v -> CellValues.toLong(v).orElse(null));
        return dataset;
    }

    public Dataset normalizeUnion(Dataset dataset) {
        UNION.resolve(dataset)
                .ifPresent(col -> dataset.renameColumn(col, SourceColumns.SINDICATO));
        return dataset;
    }

    public Dataset normalizeAdmission(Dataset dataset) {
        ADMISSION.resolve(dataset)
                .ifPresent(col -> dataset.renameColumn(col, SourceColumns.ADMISSAO));
        return dataset;
    }

    public Dataset normalizeRoster(Dataset roster) {
        return normalizeAdmission(normalizeUnion(normalizeIdentifier(roster)));
    }
}
