package io.github.riemr.voucher.presentation.runner;

import io.github.riemr.voucher.application.dto.VoucherRunSummary;
import io.github.riemr.voucher.application.exception.RosterUnavailableException;
import io.github.riemr.voucher.application.service.VoucherBenefitService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VoucherCommandLineRunnerTest {

    private final VoucherBenefitService service = mock(VoucherBenefitService.class);
    private final VoucherCommandLineRunner runner = new VoucherCommandLineRunner(service);

    @Test
    void run_passesCompetenceAndOutput() throws Exception {
        YearMonth june = YearMonth.of(2025, 6);
        Path out = Path.of("VR_JUNHO.xlsx");
        when(service.resolveCompetence("2025-06")).thenReturn(june);
        when(service.export(june, out)).thenReturn(new VoucherRunSummary(june, 3, 10, out));

        runner.run(new DefaultApplicationArguments("--competencia=2025-06", "--saida=VR_JUNHO.xlsx"));

        verify(service).export(june, out);
    }

    @Test
    void run_generatesOutputNameWhenAbsent() throws Exception {
        YearMonth may = YearMonth.of(2025, 5);
        Path generated = Path.of("VR_FINAL_20250601_120000.xlsx");
        when(service.resolveCompetence(null)).thenReturn(may);
        when(service.defaultOutputPath(any())).thenReturn(generated);
        when(service.export(may, generated)).thenReturn(new VoucherRunSummary(may, 0, 1, generated));

        runner.run(new DefaultApplicationArguments("--saida="));

        verify(service).export(eq(may), eq(generated));
    }

    @Test
    void run_propagatesMissingRoster() throws Exception {
        YearMonth may = YearMonth.of(2025, 5);
        Path out = Path.of("x.xlsx");
        when(service.resolveCompetence(null)).thenReturn(may);
        when(service.export(may, out)).thenThrow(new RosterUnavailableException("no roster"));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("--saida=x.xlsx")))
                .isInstanceOf(RosterUnavailableException.class);
    }
}
