package com.adpilot.port;

import java.util.Map;

public record VariantAllocation(String variantId, double trafficPercentage, Map<String, Object> config) {
}
