package com.querygate.cost;

import com.querygate.config.PricingConfig;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts bytes processed into an on-demand cost estimate.
 */
public class CostModel {

    private static final int COST_SCALE = 6;

    private final BigDecimal bytesPerUnit;
    private final BigDecimal pricePerUnitUsd;

    public CostModel(PricingConfig pricing) {
        this.bytesPerUnit = BigDecimal.valueOf(pricing.bytesPerUnit());
        this.pricePerUnitUsd = BigDecimal.valueOf(pricing.pricePerUnitUsd());
    }

    /**
     * Estimate the cost of scanning the given number of bytes.
     *
     * @param bytesProcessed bytes processed, null or non-positive when unknown
     * @return cost in USD rounded to 6 decimal places, 0 for unknown input
     */
    public double estimateCost(Long bytesProcessed) {
        if (bytesProcessed == null || bytesProcessed <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(bytesProcessed)
                .multiply(pricePerUnitUsd)
                .divide(bytesPerUnit, COST_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
