package io.github.riemr.voucher.application.service;

import io.github.riemr.voucher.application.dto.VoucherLedger;
import io.github.riemr.voucher.application.dto.VoucherRunSummary;
import io.github.riemr.voucher.application.exception.RosterUnavailableException;
import io.github.riemr.voucher.application.repository.DatasetRepository;
import io.github.riemr.voucher.application.repository.LedgerWriter;
import io.github.riemr.voucher.config.VoucherProperties;
import io.github.riemr.voucher.domain.model.Dataset;
import io.github.riemr.voucher.domain.model.VoucherRow;
import io.github.riemr.voucher.support.TestDatasets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static io.github.riemr.voucher.support.TestDatasets.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class VoucherBenefitServiceTest {

    private static final YearMonth MAY = YearMonth.of(2025, 5);

    /** Fresh dataset per load, since normalization renames columns in place. */
    private final Map<String, Supplier<Dataset>> sources = new HashMap<>();
    private final DatasetRepository repository = name -> sources.getOrDefault(name, Dataset::empty).get();

    private VoucherProperties properties;
    private LedgerWriter writer;
    private VoucherBenefitService service;

    @BeforeEach
    void setup() {
        properties = new VoucherProperties();
        writer = mock(LedgerWriter.class);
        LookupResolver lookupResolver = new LookupResolver(properties);
        service = new VoucherBenefitService(properties, repository, writer,
                new FieldNormalizer(),
                new ExclusionResolver(properties),
                lookupResolver,
                new RecordConsolidator(),
                new EntitlementCalculator(properties, lookupResolver));

        sources.put("ATIVOS.xlsx", () -> TestDatasets.of(
                List.of("MATRICULA", "EMPRESA", "TITULO DO CARGO", "DESC. SITUACAO", "Sindicato"),
                row(1001.0, 1410.0, "ANALISTA", "Trabalhando", "SINDPD SP - SIND.TRAB.EM PROC DADOS"),
                row(1002.0, 1410.0, "DIRETOR DE OPERACOES", "Trabalhando", "SINDPD SP - SIND.TRAB.EM PROC DADOS"),
                row(1003.0, 1410.0, "TECNICO", "Trabalhando", "SITEPD PR - SIND DOS TRAB"),
                row(1004.0, 1410.0, "ESTAGIARIO", "Trabalhando", "SINDPD RJ"),
                row(1005.0, 1410.0, "ANALISTA", "Trabalhando", "SINDPPD RS"),
                row(1006.0, 1410.0, "ANALISTA", "Trabalhando", "SINDPD SP - SIND.TRAB.EM PROC DADOS"),
                row(1007.0, 1410.0, "ANALISTA", "Trabalhando", "SINDPPD RS")));
        sources.put("ESTAGIO.xlsx", () -> TestDatasets.of(List.of("MATRICULA", "TITULO DO CARGO"), row(1004.0, "ESTAGIARIO")));
        sources.put("EXTERIOR.xlsx", () -> TestDatasets.of(List.of("Cadastro", "Valor"), row(1007.0, 0.0)));
        sources.put("FERIAS.xlsx", () -> TestDatasets.of(List.of("MATRICULA", "DESC. SITUACAO", "DIAS DE FÉRIAS"),
                row(1003.0, "Férias", 10.0)));
        sources.put("DESLIGADOS.xlsx", () -> TestDatasets.of(
                List.of("MATRICULA ", "DATA DEMISSÃO", "COMUNICADO DE DESLIGAMENTO"),
                row(1005.0, LocalDate.of(2025, 5, 20), "PENDENTE"),
                row(1006.0, LocalDate.of(2025, 5, 5), "OK")));
        sources.put("ADMISSOABRIL.xlsx", () -> TestDatasets.of(List.of("MATRICULA", "Admissão", "Cargo"),
                row(1001.0, LocalDate.of(2025, 4, 14), "ANALISTA")));
        sources.put("Basediasuteis.xlsx", () -> TestDatasets.of(List.of("BASE DIAS UTEIS DE MAIO", "Unnamed: 1"),
                row("SINDICADO", "DIAS UTEIS"),
                row("SITEPD PR - SIND DOS TRAB", 22.0),
                row("SINDPPD RS", 22.0),
                row("SINDPD SP - SIND.TRAB.EM PROC DADOS", 22.0)));
        sources.put("Basesindicatoxvalor.xlsx", () -> TestDatasets.of(List.of("ESTADO", "VALOR"),
                row("Paraná", 35.0),
                row("Rio Grande do Sul", 35.0),
                row("São Paulo", 37.5)));
    }

    @Test
    void compute_producesOneRowPerRetainedEmployee() {
        VoucherLedger ledger = service.compute(MAY);

        assertThat(ledger.excludedCount()).isEqualTo(3);
        assertThat(ledger.rows()).extracting(VoucherRow::getMatricula)
                .containsExactly(1001L, 1003L, 1005L, 1006L);
        assertThat(ledger.rows()).allSatisfy(r -> assertThat(r.getCompetencia()).isEqualTo(LocalDate.of(2025, 5, 1)));

        VoucherRow first = ledger.rows().get(0);
        assertThat(first.getDias()).isEqualTo(22);
        assertThat(first.getAdmissao()).isEqualTo(LocalDate.of(2025, 4, 14));
        assertThat(first.getTotal()).isEqualTo(new BigDecimal("825.00"));
        assertThat(first.getObs()).isEmpty();

        VoucherRow vacation = ledger.rows().get(1);
        assertThat(vacation.getDias()).isEqualTo(12);
        assertThat(vacation.getObs()).isEqualTo("Férias: -10");

        VoucherRow prorated = ledger.rows().get(2);
        assertThat(prorated.getDias()).isEqualTo(14);
        assertThat(prorated.getValorDiario()).isEqualByComparingTo("35");

        VoucherRow noticed = ledger.rows().get(3);
        assertThat(noticed.getDias()).isZero();
        assertThat(noticed.getTotal()).isEqualByComparingTo("0");
    }

    @Test
    void compute_rowsRespectLedgerInvariants() {
        VoucherLedger ledger = service.compute(MAY);

        assertThat(ledger.rows()).allSatisfy(r -> {
            assertThat(r.getDias()).isBetween(0, 22);
            assertThat(r.getTotal()).isEqualTo(BigDecimal.valueOf(r.getDias())
                    .multiply(r.getValorDiario()).setScale(2, RoundingMode.HALF_EVEN));
            assertThat(r.getCustoEmpresa().add(r.getDescontoProfissional()).subtract(r.getTotal()).abs())
                    .isLessThanOrEqualTo(new BigDecimal("0.01"));
        });
    }

    @Test
    void compute_isIdempotent() {
        assertThat(service.compute(MAY)).isEqualTo(service.compute(MAY));
    }

    @Test
    void compute_withoutVacationSourceKeepsBaseDays() {
        sources.remove("FERIAS.xlsx");

        VoucherRow row = service.compute(MAY).rows().get(1);

        assertThat(row.getMatricula()).isEqualTo(1003L);
        assertThat(row.getDias()).isEqualTo(22);
    }

    @Test
    void compute_keepsRosterRowWithUnreadableIdentifier() {
        sources.put("ATIVOS.xlsx", () -> TestDatasets.of(List.of("MATRICULA", "TITULO DO CARGO", "Sindicato"),
                row(1001.0, "ANALISTA", "SINDPD SP - SIND.TRAB.EM PROC DADOS"),
                row("A-17", "ANALISTA", "SINDPD SP - SIND.TRAB.EM PROC DADOS")));
        sources.put("FERIAS.xlsx", () -> TestDatasets.of(List.of("MATRICULA", "DIAS DE FÉRIAS"),
                row("A-17", 10.0)));

        VoucherLedger ledger = service.compute(MAY);

        assertThat(ledger.rows()).extracting(VoucherRow::getMatricula).containsExactly(1001L, null);
        VoucherRow unidentified = ledger.rows().get(1);
        assertThat(unidentified.getDias()).isEqualTo(22);
        assertThat(unidentified.getValorDiario()).isEqualByComparingTo("37.5");
        assertThat(unidentified.getTotal()).isEqualTo(new BigDecimal("825.00"));
        assertThat(unidentified.getObs()).isEmpty();
    }

    @Test
    void compute_failsWithoutRoster() {
        sources.remove("ATIVOS.xlsx");

        assertThatThrownBy(() -> service.compute(MAY))
                .isInstanceOf(RosterUnavailableException.class)
                .hasMessageContaining("ATIVOS.xlsx");
    }

    @Test
    void compute_failsWhenRosterHasNoIdentifier() {
        sources.put("ATIVOS.xlsx", () -> TestDatasets.of(List.of("NOME", "Sindicato"), row("Ana", "SINDPD SP")));

        assertThatThrownBy(() -> service.compute(MAY)).isInstanceOf(RosterUnavailableException.class);
    }

    @Test
    void export_writesLedgerToPath(@TempDir Path dir) throws Exception {
        doAnswer(inv -> {
            OutputStream out = inv.getArgument(1);
            out.write(new byte[] {1, 2, 3});
            return null;
        }).when(writer).write(anyList(), any(OutputStream.class));
        Path output = dir.resolve("out/VR.xlsx");

        VoucherRunSummary summary = service.export(MAY, output);

        assertThat(summary.rowCount()).isEqualTo(4);
        assertThat(summary.excludedCount()).isEqualTo(3);
        assertThat(summary.output()).isEqualTo(output);
        assertThat(Files.readAllBytes(output)).containsExactly(1, 2, 3);
        try (var files = Files.list(output.getParent())) {
            assertThat(files).containsExactly(output);
        }

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<VoucherRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(writer).write(rows.capture(), any(OutputStream.class));
        assertThat(rows.getValue()).hasSize(4);
    }

    @Test
    void export_doesNotWriteWhenRosterMissing(@TempDir Path dir) throws Exception {
        sources.remove("ATIVOS.xlsx");
        Path output = dir.resolve("VR.xlsx");

        assertThatThrownBy(() -> service.export(MAY, output)).isInstanceOf(RosterUnavailableException.class);

        assertThat(output).doesNotExist();
        verify(writer, never()).write(anyList(), any(OutputStream.class));
    }

    @Test
    void resolveCompetence_fallsBackToDefault() {
        assertThat(service.resolveCompetence("2024-02")).isEqualTo(YearMonth.of(2024, 2));
        assertThat(service.resolveCompetence(" 2025-06 ")).isEqualTo(YearMonth.of(2025, 6));
        assertThat(service.resolveCompetence("2025-13")).isEqualTo(MAY);
        assertThat(service.resolveCompetence(null)).isEqualTo(MAY);
    }

    @Test
    void defaultOutputPath_containsTimestamp() {
        Path p = service.defaultOutputPath(LocalDateTime.of(2025, 6, 1, 9, 5, 7));

        assertThat(p).hasFileName("VR_FINAL_20250601_090507.xlsx");
    }
}
