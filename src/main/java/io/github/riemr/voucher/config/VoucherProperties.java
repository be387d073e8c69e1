package io.github.riemr.voucher.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters of the voucher run. Every fallback the rule engine applies
 * comes from here so that tests can inject their own values.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "voucher")
public class VoucherProperties {

    /** Target month used when none is given or the given one does not parse (YYYY-MM). */
    @NotBlank
    private String defaultCompetence = "2025-05";

    /** Working days used when no days-reference key matches the union label. */
    @Min(0)
    private int defaultWorkingDays = 22;

    /** Daily value for the default region and fallback for RJ, RS and PR. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal defaultDailyValue = new BigDecimal("35.0");

    @NotNull
    @DecimalMin("0")
    private BigDecimal saoPauloDailyValue = new BigDecimal("37.5");

    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal employerShare = new BigDecimal("0.80");

    @NotBlank
    private String affirmativeNotice = "OK";

    @NotBlank
    private String directorTerm = "DIRETOR";

    @Min(1)
    private int prorationMonthDays = 30;

    @NotEmpty
    private List<String> inputDirs = new ArrayList<>(List.of(".", "Dados", "Uploads"));

    @Valid
    private Sources sources = new Sources();

    @Valid
    private Output output = new Output();

    @Valid
    private Runner runner = new Runner();

    public BigDecimal getEmployeeShare() {
        return BigDecimal.ONE.subtract(employerShare);
    }

    @Data
    public static class Sources {
        @NotBlank private String roster = "ATIVOS.xlsx";
        @NotBlank private String vacation = "FERIAS.xlsx";
        @NotBlank private String termination = "DESLIGADOS.xlsx";
        @NotBlank private String admission = "ADMISSOABRIL.xlsx";
        @NotBlank private String regionValue = "Basesindicatoxvalor.xlsx";
        @NotBlank private String workingDays = "Basediasuteis.xlsx";
        @NotBlank private String leave = "AFASTAMENTOS.xlsx";
        @NotBlank private String intern = "ESTAGIO.xlsx";
        @NotBlank private String apprentice = "APRENDIZ.xlsx";
        @NotBlank private String overseas = "EXTERIOR.xlsx";
    }

    @Data
    public static class Output {
        @NotBlank private String sheetName = "VR Mensal";
        @NotBlank private String filePrefix = "VR_FINAL_";
    }

    @Data
    public static class Runner {
        /** Run the batch from the command line on start-up. */
        private boolean enabled = true;
    }
}
