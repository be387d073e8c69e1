package io.github.riemr.voucher.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One roster employee with the life-cycle fields attached by consolidation.
 * A {@code null} field means the event is not on record; a present date may
 * still fall outside the target month.
 */
@Value
@Builder(toBuilder = true)
public class EmployeeRecord {
    Long matricula;
    String sindicato;
    String jobTitle;
    LocalDate admissionDate;
    Integer vacationDays;
    LocalDate terminationDate;
    String noticeStatus;
}
