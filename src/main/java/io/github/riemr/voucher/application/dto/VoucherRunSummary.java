package io.github.riemr.voucher.application.dto;

import java.nio.file.Path;
import java.time.YearMonth;

public record VoucherRunSummary(
    YearMonth competence,
    int excludedCount,
    int rowCount,
    Path output
) {}
