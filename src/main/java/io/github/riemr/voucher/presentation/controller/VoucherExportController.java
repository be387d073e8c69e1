package io.github.riemr.voucher.presentation.controller;

import io.github.riemr.voucher.application.dto.VoucherLedger;
import io.github.riemr.voucher.application.service.VoucherBenefitService;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.time.YearMonth;

@RestController
@RequestMapping("/api/voucher")
@RequiredArgsConstructor
public class VoucherExportController {

    static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final VoucherBenefitService voucherBenefitService;

    @GetMapping("/ledger")
    public VoucherLedger ledger(@RequestParam(name = "competence", required = false) String competence) {
        return voucherBenefitService.compute(voucherBenefitService.resolveCompetence(competence));
    }

    @GetMapping("/export")
    public void exportXlsx(@RequestParam(name = "competence", required = false) String competence,
                           HttpServletResponse response) throws Exception {
        YearMonth ym = voucherBenefitService.resolveCompetence(competence);
        VoucherLedger ledger = voucherBenefitService.compute(ym);

        // buffered so that a failure still leaves the response free for an error body
        ByteArrayOutputStream workbook = new ByteArrayOutputStream();
        voucherBenefitService.write(ledger, workbook);

        response.setContentType(XLSX);
        response.setHeader("Content-Disposition", "attachment; filename=VR_" + ym + ".xlsx");
        response.getOutputStream().write(workbook.toByteArray());
        response.flushBuffer();
    }
}
