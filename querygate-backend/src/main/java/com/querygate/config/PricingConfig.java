package com.querygate.config;

import org.springframework.core.env.Environment;

/**
 * On-demand pricing constants.
 *
 * @param bytesPerUnit bytes in one billing unit
 * @param pricePerUnitUsd price of one billing unit
 */
public record PricingConfig(long bytesPerUnit, double pricePerUnitUsd) {

    /** 1 TiB. */
    public static final long DEFAULT_BYTES_PER_UNIT = 1_099_511_627_776L;
    public static final double DEFAULT_PRICE_PER_UNIT_USD = 6.25;

    public PricingConfig {
        if (bytesPerUnit <= 0) {
            throw new IllegalArgumentException("bytesPerUnit must be positive");
        }
        if (pricePerUnitUsd < 0) {
            throw new IllegalArgumentException("pricePerUnitUsd must not be negative");
        }
    }

    public static PricingConfig defaults() {
        return new PricingConfig(DEFAULT_BYTES_PER_UNIT, DEFAULT_PRICE_PER_UNIT_USD);
    }

    static PricingConfig fromEnvironment(Environment environment) {
        return new PricingConfig(
                EnvironmentValues.getLong(environment, "querygate.pricing.bytes-per-unit",
                        "QUERYGATE_PRICING_BYTES_PER_UNIT", DEFAULT_BYTES_PER_UNIT),
                EnvironmentValues.getDouble(environment, "querygate.pricing.price-per-unit-usd",
                        "QUERYGATE_PRICING_PRICE_PER_UNIT_USD", DEFAULT_PRICE_PER_UNIT_USD)
        );
    }
}
