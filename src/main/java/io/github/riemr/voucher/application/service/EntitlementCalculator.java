package io.github.riemr.voucher.application.service;

import io.github.riemr.voucher.config.VoucherProperties;
import io.github.riemr.voucher.domain.model.EmployeeRecord;
import io.github.riemr.voucher.domain.model.EntitlementResult;
import io.github.riemr.voucher.domain.model.LookupTables;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;

/**
 * Payable voucher days and their value for one employee in one month.
 * <p>
 * Starting from the union's working days: vacation days are subtracted, then a
 * termination inside the month either zeroes the days (up to day 15 with an
 * affirmative notice) or caps them proportionally (after day 15), then an
 * admission inside the month caps them proportionally. Both proportional caps
 * are computed from the union's working days, not from the running value.
 */
@Service
@RequiredArgsConstructor
public class EntitlementCalculator {

    static final int MID_MONTH_DAY = 15;
    private static final int MONEY_SCALE = 2;

    private final VoucherProperties properties;
    private final LookupResolver lookupResolver;

    public EntitlementResult calculate(EmployeeRecord record, YearMonth competence, LookupTables tables) {
        EntitlementResult.EntitlementResultBuilder result = EntitlementResult.builder();
        int baseDays = lookupResolver.workingDaysFor(record.getSindicato(), tables);
        int days = baseDays;

        if (record.getVacationDays() != null) {
            int vacation = record.getVacationDays();
            days -= vacation;
            result.observation("Férias: -" + vacation);
        }

        LocalDate terminated = record.getTerminationDate();
        if (terminated != null && YearMonth.from(terminated).equals(competence)) {
            int day = terminated.getDayOfMonth();
            if (day <= MID_MONTH_DAY && isAffirmative(record.getNoticeStatus())) {
                days = 0;
                result.observation("Desligado até dia 15 - sem benefício");
            } else if (day > MID_MONTH_DAY) {
                days = Math.min(days, terminationProration(baseDays, day));
                result.observation("Desligado dia " + day + " - proporcional");
            }
            // TODO: day <= 15 without an affirmative notice keeps the full days; awaiting a ruling from payroll.
        }

        LocalDate admitted = record.getAdmissionDate();
        if (admitted != null && YearMonth.from(admitted).equals(competence)) {
            int day = admitted.getDayOfMonth();
            days = Math.min(days, Math.max(0, admissionProration(baseDays, day)));
            result.observation("Admissão dia " + day + " - proporcional");
        }

        days = Math.max(0, days);
        BigDecimal dailyValue = lookupResolver.dailyValueFor(record.getSindicato(), tables);
        BigDecimal total = money(BigDecimal.valueOf(days).multiply(dailyValue));

        return result
                .days(days)
                .dailyValue(dailyValue)
                .total(total)
                .employerCost(money(total.multiply(properties.getEmployerShare())))
                .employeeDiscount(money(total.multiply(properties.getEmployeeShare())))
                .build();
    }

    /** floor(base * day / monthDays), evaluated in double precision. */
    int terminationProration(int baseDays, int day) {
        return (int) Math.floor(baseDays * (day / (double) properties.getProrationMonthDays()));
    }

    /** floor(base * (monthDays - (day - 1)) / monthDays), evaluated in double precision. */
    int admissionProration(int baseDays, int day) {
        int monthDays = properties.getProrationMonthDays();
        return (int) Math.floor(baseDays * ((monthDays - (day - 1)) / (double) monthDays));
    }

    private boolean isAffirmative(String noticeStatus) {
        return noticeStatus != null
                && noticeStatus.strip().toUpperCase(Locale.ROOT)
                        .equals(properties.getAffirmativeNotice().strip().toUpperCase(Locale.ROOT));
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_EVEN);
    }
}
