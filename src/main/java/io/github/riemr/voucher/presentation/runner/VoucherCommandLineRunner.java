package io.github.riemr.voucher.presentation.runner;

import io.github.riemr.voucher.application.dto.VoucherRunSummary;
import io.github.riemr.voucher.application.service.VoucherBenefitService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;

/**
 * Batch entry point: {@code --competencia=YYYY-MM --saida=<file.xlsx>}.
 * A missing roster propagates and aborts start-up with a non-zero exit code.
 */
@Component
@ConditionalOnProperty(name = "voucher.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class VoucherCommandLineRunner implements ApplicationRunner {

    static final String OPT_COMPETENCE = "competencia";
    static final String OPT_OUTPUT = "saida";

    private final VoucherBenefitService voucherBenefitService;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        YearMonth competence = voucherBenefitService.resolveCompetence(option(args, OPT_COMPETENCE));
        String out = option(args, OPT_OUTPUT);
        Path output = out == null || out.isBlank()
                ? voucherBenefitService.defaultOutputPath(LocalDateTime.now())
                : Path.of(out.strip());

        VoucherRunSummary summary = voucherBenefitService.export(competence, output);
        log.info("Voucher run finished. competence={}, excluded={}, rows={}, file={}",
                summary.competence(), summary.excludedCount(), summary.rowCount(), summary.output());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
