package com.adpilot.port;

import java.math.BigDecimal;

/**
 * Raw counters reported by an ad platform.
 *
 * @param conversionValue revenue attributed by the platform; zero when the platform does not report it
 */
public record PlatformMetrics(long impressions, long clicks, long conversions, BigDecimal cost,
        BigDecimal conversionValue) {

    public PlatformMetrics {
        cost = cost != null ? cost : BigDecimal.ZERO;
        conversionValue = conversionValue != null ? conversionValue : BigDecimal.ZERO;
    }

    public PlatformMetrics(long impressions, long clicks, long conversions, BigDecimal cost) {
        this(impressions, clicks, conversions, cost, BigDecimal.ZERO);
    }
}
