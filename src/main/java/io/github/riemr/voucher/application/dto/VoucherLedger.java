package io.github.riemr.voucher.application.dto;

import io.github.riemr.voucher.domain.model.VoucherRow;

import java.time.YearMonth;
import java.util.List;

public record VoucherLedger(
    YearMonth competence,
    int excludedCount,
    List<VoucherRow> rows
) {
    public VoucherLedger {
        rows = List.copyOf(rows);
    }
}
