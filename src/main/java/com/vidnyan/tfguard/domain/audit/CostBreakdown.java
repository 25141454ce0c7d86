package com.vidnyan.tfguard.domain.audit;

import java.util.List;
import java.util.Map;

/**
 * Estimated monthly spend. All amounts are rounded to cents.
 */
public record CostBreakdown(
    double totalMonthly,
    Map<String, Double> byService,
    List<ResourceCost> resources,
    String region
) {

    public CostBreakdown {
        byService = Map.copyOf(byService);
        resources = List.copyOf(resources);
    }

    public static CostBreakdown empty(String region) {
        return new CostBreakdown(0.0, Map.of(), List.of(), region);
    }

    public List<ResourceCost> unestimated() {
        return resources.stream().filter(r -> !r.estimated()).toList();
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
