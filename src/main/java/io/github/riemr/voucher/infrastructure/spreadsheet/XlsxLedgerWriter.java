package io.github.riemr.voucher.infrastructure.spreadsheet;

import io.github.riemr.voucher.application.repository.LedgerWriter;
import io.github.riemr.voucher.config.VoucherProperties;
import io.github.riemr.voucher.domain.model.VoucherRow;
import lombok.RequiredArgsConstructor;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Component
@RequiredArgsConstructor
public class XlsxLedgerWriter implements LedgerWriter {

    private final VoucherProperties properties;

    @Override
    public void write(List<VoucherRow> rows, OutputStream out) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CreationHelper helper = workbook.getCreationHelper();
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(helper.createDataFormat().getFormat("yyyy-mm-dd"));
            CellStyle moneyStyle = workbook.createCellStyle();
            moneyStyle.setDataFormat(helper.createDataFormat().getFormat("0.00"));

            Sheet sheet = workbook.createSheet(properties.getOutput().getSheetName());
            Row header = sheet.createRow(0);
            for (int c = 0; c < VoucherRow.HEADERS.size(); c++) {
                header.createCell(c).setCellValue(VoucherRow.HEADERS.get(c));
            }

            int r = 1;
            for (VoucherRow row : rows) {
                Row line = sheet.createRow(r++);
                int c = 0;
                numeric(line.createCell(c++), row.getMatricula() == null ? null : row.getMatricula().doubleValue(), null);
                date(line.createCell(c++), row.getAdmissao(), dateStyle);
                line.createCell(c++).setCellValue(row.getSindicato() == null ? "" : row.getSindicato());
                date(line.createCell(c++), row.getCompetencia(), dateStyle);
                line.createCell(c++).setCellValue(row.getDias());
                money(line.createCell(c++), row.getValorDiario(), moneyStyle);
                money(line.createCell(c++), row.getTotal(), moneyStyle);
                money(line.createCell(c++), row.getCustoEmpresa(), moneyStyle);
                money(line.createCell(c++), row.getDescontoProfissional(), moneyStyle);
                line.createCell(c).setCellValue(row.getObs() == null ? "" : row.getObs());
            }
            workbook.write(out);
        }
    }

    private static void numeric(Cell cell, Double value, CellStyle style) {
        if (value == null) return;
        cell.setCellValue(value);
        if (style != null) cell.setCellStyle(style);
    }

    private static void money(Cell cell, BigDecimal value, CellStyle style) {
        numeric(cell, value == null ? null : value.doubleValue(), style);
    }

    private static void date(Cell cell, LocalDate value, CellStyle style) {
        if (value == null) return;
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }
}
