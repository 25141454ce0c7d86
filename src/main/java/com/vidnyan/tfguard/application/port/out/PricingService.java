package com.vidnyan.tfguard.application.port.out;

import java.util.Map;

/**
 * Port for monthly price estimates.
 */
public interface PricingService {

    /**
     * Estimate the monthly on-demand cost of one resource in USD.
     * May throw; callers record a throw as an unestimated zero, not as free.
     */
    double estimateMonthlyCost(String resourceType, Map<String, Object> properties, String region);
}
