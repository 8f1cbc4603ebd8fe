package com.flagship.card_autopay.automation;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class SavingsEstimate {

    public static final SavingsEstimate NONE = new SavingsEstimate(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal interestSaved;
    BigDecimal lateFeePrevented;

    public BigDecimal total() {
        return interestSaved.add(lateFeePrevented);
    }
}
