package io.github.riemr.voucher.infrastructure.spreadsheet;

import io.github.riemr.voucher.application.repository.DatasetRepository;
import io.github.riemr.voucher.config.VoucherProperties;
import io.github.riemr.voucher.domain.model.Dataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the first sheet of a workbook found in one of the configured input
 * directories. The first row is the header.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ExcelDatasetRepository implements DatasetRepository {

    private final VoucherProperties properties;

    @Override
    public Dataset load(String name) {
        for (String dir : properties.getInputDirs()) {
            Path path = Path.of(dir).resolve(name);
            if (!Files.isRegularFile(path)) continue;
            try (InputStream in = Files.newInputStream(path)) {
                Dataset ds = read(in);
                log.debug("Loaded {} from {}: {} rows", name, path, ds.size());
                return ds;
            } catch (IOException | RuntimeException e) {
                log.error("Failed to read {}", path, e);
                return Dataset.empty();
            }
        }
        log.warn("Source not found: {} (searched {})", name, properties.getInputDirs());
        return Dataset.empty();
    }

    Dataset read(InputStream in) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) return Dataset.empty();
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) return Dataset.empty();

            List<String> columns = headerNames(header);
            List<Map<String, Object>> rows = new ArrayList<>();
            for (int i = sheet.getFirstRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;
                Map<String, Object> values = new LinkedHashMap<>();
                boolean blank = true;
                for (int c = 0; c < columns.size(); c++) {
                    Object v = cellValue(row.getCell(c));
                    if (v != null) blank = false;
                    values.put(columns.get(c), v);
                }
                if (!blank) rows.add(values);
            }
            return Dataset.of(columns, rows);
        }
    }

    /** Header texts; blanks become {@code Unnamed: n} and repeats get a {@code .n} suffix. */
    private List<String> headerNames(Row header) {
        List<String> names = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        int last = Math.max(header.getLastCellNum(), 0);
        for (int c = 0; c < last; c++) {
            Object v = cellValue(header.getCell(c));
            String name = v == null ? "Unnamed: " + c : v.toString().strip();
            if (name.isEmpty()) name = "Unnamed: " + c;
            int n = seen.merge(name, 1, Integer::sum);
            names.add(n == 1 ? name : name + "." + (n - 1));
        }
        return names;
    }

    private Object cellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                String s = cell.getStringCellValue();
                return s == null || s.isBlank() ? null : s;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }
}
