package io.github.riemr.voucher.application.service;

import io.github.riemr.voucher.application.dto.VoucherLedger;
import io.github.riemr.voucher.application.dto.VoucherRunSummary;
import io.github.riemr.voucher.application.exception.RosterUnavailableException;
import io.github.riemr.voucher.application.repository.DatasetRepository;
import io.github.riemr.voucher.application.repository.LedgerWriter;
import io.github.riemr.voucher.config.VoucherProperties;
import io.github.riemr.voucher.domain.model.Dataset;
import io.github.riemr.voucher.domain.model.EmployeeRecord;
import io.github.riemr.voucher.domain.model.ExclusionCategory;
import io.github.riemr.voucher.domain.model.LookupTables;
import io.github.riemr.voucher.domain.model.SourceColumns;
import io.github.riemr.voucher.domain.model.VoucherRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Monthly voucher run: loads the personnel sheets, drops excluded employees,
 * joins life-cycle events and computes one ledger row per remaining employee.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherBenefitService {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final VoucherProperties properties;
    private final DatasetRepository datasetRepository;
    private final LedgerWriter ledgerWriter;
    private final FieldNormalizer fieldNormalizer;
    private final ExclusionResolver exclusionResolver;
    private final LookupResolver lookupResolver;
    private final RecordConsolidator recordConsolidator;
    private final EntitlementCalculator entitlementCalculator;

    /** Parses {@code YYYY-MM}; blank or malformed input falls back to the configured default. */
    public YearMonth resolveCompetence(String raw) {
        if (raw != null && !raw.isBlank()) {
            try {
                return YearMonth.parse(raw.strip());
            } catch (DateTimeParseException e) {
                log.warn("Invalid competence '{}', using {}", raw, properties.getDefaultCompetence());
            }
        }
        return YearMonth.parse(properties.getDefaultCompetence());
    }

    public Path defaultOutputPath(LocalDateTime now) {
        return Path.of(properties.getOutput().getFilePrefix() + now.format(FILE_STAMP) + ".xlsx");
    }

    public VoucherLedger compute(YearMonth competence) {
        log.info("Competence: {}", competence.atDay(1));
        VoucherProperties.Sources src = properties.getSources();

        Dataset roster = fieldNormalizer.normalizeRoster(datasetRepository.load(src.getRoster()));
        if (roster.isEmpty() || !roster.hasColumn(SourceColumns.MATRICULA)) {
            throw new RosterUnavailableException(
                    "Roster " + src.getRoster() + " is empty or has no " + SourceColumns.MATRICULA + " column");
        }

        Dataset vacation = fieldNormalizer.normalizeIdentifier(datasetRepository.load(src.getVacation()));
        Dataset termination = fieldNormalizer.normalizeIdentifier(datasetRepository.load(src.getTermination()));
        Dataset admission = fieldNormalizer.normalizeAdmission(
                fieldNormalizer.normalizeIdentifier(datasetRepository.load(src.getAdmission())));

        Map<ExclusionCategory, Dataset> categories = new EnumMap<>(ExclusionCategory.class);
        categories.put(ExclusionCategory.INTERN, fieldNormalizer.normalizeIdentifier(datasetRepository.load(src.getIntern())));
        categories.put(ExclusionCategory.APPRENTICE, fieldNormalizer.normalizeIdentifier(datasetRepository.load(src.getApprentice())));
        categories.put(ExclusionCategory.LEAVE, fieldNormalizer.normalizeIdentifier(datasetRepository.load(src.getLeave())));
        categories.put(ExclusionCategory.OVERSEAS, fieldNormalizer.normalizeIdentifier(datasetRepository.load(src.getOverseas())));
        Set<Long> excluded = exclusionResolver.resolve(roster, categories);

        List<EmployeeRecord> records = recordConsolidator.consolidate(
                recordConsolidator.baseRecords(roster, excluded), vacation, termination, admission);

        LookupTables tables = lookupResolver.build(
                datasetRepository.load(src.getWorkingDays()),
                datasetRepository.load(src.getRegionValue()));

        LocalDate competenceDate = competence.atDay(1);
        List<VoucherRow> rows = new ArrayList<>(records.size());
        for (EmployeeRecord r : records) {
            rows.add(VoucherRow.of(r, competenceDate, entitlementCalculator.calculate(r, competence, tables)));
        }
        return new VoucherLedger(competence, excluded.size(), rows);
    }

    public void write(VoucherLedger ledger, OutputStream out) throws IOException {
        ledgerWriter.write(ledger.rows(), out);
    }

    public VoucherRunSummary export(YearMonth competence, Path output) throws IOException {
        VoucherLedger ledger = compute(competence);
        Path parent = output.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        // written aside and moved so a failed write never leaves a partial ledger
        Path tmp = Files.createTempFile(parent, ".voucher-", ".xlsx.tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                ledgerWriter.write(ledger.rows(), out);
            }
            Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Generated file: {}", output);
        log.info("Rows: {}", ledger.rows().size());
        return new VoucherRunSummary(competence, ledger.excludedCount(), ledger.rows().size(), output);
    }
}
