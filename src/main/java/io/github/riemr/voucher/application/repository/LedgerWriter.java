package io.github.riemr.voucher.application.repository;

import io.github.riemr.voucher.domain.model.VoucherRow;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

public interface LedgerWriter {

    /** Writes the rows as a single sheet with the {@link VoucherRow#HEADERS} layout. */
    void write(List<VoucherRow> rows, OutputStream out) throws IOException;
}
