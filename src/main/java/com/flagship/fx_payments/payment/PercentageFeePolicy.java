package com.flagship.fx_payments.payment;

import com.flagship.fx_payments.config.FeeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Fee as a fraction of the source amount, floored at a configured minimum.
 */
@Component
@RequiredArgsConstructor
public class PercentageFeePolicy implements FeePolicy {

    private final FeeProperties feeProperties;

    @Override
    public BigDecimal feeFor(BigDecimal sourceAmount, String sourceCurrency) {
        BigDecimal fee = sourceAmount.multiply(feeProperties.getPercentage());
        return fee.max(feeProperties.getMinimum());
    }
}
