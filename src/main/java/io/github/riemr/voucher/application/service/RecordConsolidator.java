package io.github.riemr.voucher.application.service;

import io.github.riemr.voucher.application.util.CellValues;
import io.github.riemr.voucher.domain.model.Dataset;
import io.github.riemr.voucher.domain.model.EmployeeRecord;
import io.github.riemr.voucher.domain.model.SourceColumns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Left-joins vacation, termination and admission sheets onto the roster by
 * identifier. Every retained roster employee yields exactly one record; when an
 * auxiliary sheet lists an identifier twice, its first row wins.
 */
@Service
@Slf4j
public class RecordConsolidator {

    /**
     * Roster rows minus excluded identifiers, in roster order. Rows without a
     * usable identifier are kept with a null identifier and never joined.
     */
    public List<EmployeeRecord> baseRecords(Dataset roster, Set<Long> excluded) {
        List<EmployeeRecord> out = new ArrayList<>();
        int withoutId = 0;
        for (Map<String, Object> row : roster.getRows()) {
            Long id = CellValues.toLong(row.get(SourceColumns.MATRICULA)).orElse(null);
            if (id == null) {
                withoutId++;
            } else if (excluded.contains(id)) {
                continue;
            }
            out.add(EmployeeRecord.builder()
                    .matricula(id)
                    .sindicato(CellValues.toText(row.get(SourceColumns.SINDICATO)))
                    .jobTitle(CellValues.toText(row.get(SourceColumns.TITULO_DO_CARGO)))
                    .admissionDate(CellValues.toDate(row.get(SourceColumns.ADMISSAO)).orElse(null))
                    .build());
        }
        if (withoutId > 0) {
            log.warn("Roster rows without identifier kept unjoined: {}", withoutId);
        }
        log.info("Base after exclusions: {} records", out.size());
        return out;
    }

    public List<EmployeeRecord> consolidate(List<EmployeeRecord> base,
                                            Dataset vacation,
                                            Dataset termination,
                                            Dataset admission) {
        Map<Long, Map<String, Object>> vacationById = index(vacation, SourceColumns.DIAS_DE_FERIAS);
        Map<Long, Map<String, Object>> terminationById = index(termination, SourceColumns.DATA_DEMISSAO);
        Map<Long, Map<String, Object>> admissionById = index(admission, SourceColumns.ADMISSAO);

        List<EmployeeRecord> out = new ArrayList<>(base.size());
        for (EmployeeRecord r : base) {
            if (r.getMatricula() == null) {
                out.add(r);
                continue;
            }
            EmployeeRecord.EmployeeRecordBuilder b = r.toBuilder();

            Map<String, Object> vac = vacationById.get(r.getMatricula());
            if (vac != null) {
                b.vacationDays(CellValues.toInteger(vac.get(SourceColumns.DIAS_DE_FERIAS)).orElse(null));
            }

            Map<String, Object> term = terminationById.get(r.getMatricula());
            if (term != null) {
                b.terminationDate(CellValues.toDate(term.get(SourceColumns.DATA_DEMISSAO)).orElse(null));
                Object notice = term.get(SourceColumns.COMUNICADO_DESLIGAMENTO);
                b.noticeStatus(notice == null ? null : CellValues.toText(notice));
            }

            Map<String, Object> adm = admissionById.get(r.getMatricula());
            if (adm != null) {
                CellValues.toDate(adm.get(SourceColumns.ADMISSAO)).ifPresent(b::admissionDate);
            }
            out.add(b.build());
        }
        return out;
    }

    /** First row per identifier; empty when the sheet lacks the identifier or {@code requiredColumn}. */
    private Map<Long, Map<String, Object>> index(Dataset source, String requiredColumn) {
        Map<Long, Map<String, Object>> byId = new LinkedHashMap<>();
        if (source == null || source.isEmpty()
                || !source.hasColumn(SourceColumns.MATRICULA)
                || !source.hasColumn(requiredColumn)) {
            return byId;
        }
        for (Map<String, Object> row : source.getRows()) {
            CellValues.toLong(row.get(SourceColumns.MATRICULA)).ifPresent(id -> byId.putIfAbsent(id, row));
        }
        return byId;
    }
}
