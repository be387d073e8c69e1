package io.github.riemr.voucher.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class EntitlementResult {
    public static final String NOTE_DELIMITER = "; ";

    int days;
    BigDecimal dailyValue;
    BigDecimal total;
    BigDecimal employerCost;
    BigDecimal employeeDiscount;
    @Singular
    List<String> observations;

    public String getNotes() {
        return String.join(NOTE_DELIMITER, observations);
    }
}
