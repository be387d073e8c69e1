package io.github.riemr.voucher.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One line of the monthly voucher ledger. {@link #HEADERS} is the exact column
 * layout consumers of the ledger depend on.
 */
@Value
@Builder
public class VoucherRow {
    public static final List<String> HEADERS = List.of(
            "Matricula",
            "Admissão",
            "Sindicato do Colaborador",
            "Competência",
            "Dias",
            "VALOR DIÁRIO VR",
            "TOTAL",
            "Custo empresa",
            "Desconto profissional",
            "OBS GERAL");

    Long matricula;
    LocalDate admissao;
    String sindicato;
    LocalDate competencia;
    int dias;
    BigDecimal valorDiario;
    BigDecimal total;
    BigDecimal custoEmpresa;
    BigDecimal descontoProfissional;
    String obs;

    public static VoucherRow of(EmployeeRecord record, LocalDate competencia, EntitlementResult result) {
        return VoucherRow.builder()
                .matricula(record.getMatricula())
                .admissao(record.getAdmissionDate())
                .sindicato(record.getSindicato())
                .competencia(competencia)
                .dias(result.getDays())
                .valorDiario(result.getDailyValue())
                .total(result.getTotal())
                .custoEmpresa(result.getEmployerCost())
                .descontoProfissional(result.getEmployeeDiscount())
                .obs(result.getNotes())
                .build();
    }
}
