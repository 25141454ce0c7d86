package com.vidnyan.tfguard.adapter.out.pricing;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AwsPricingServiceTest {

    private final AwsPricingService pricing = new AwsPricingService();

    @Test
    void estimateMonthlyCost_ShouldPriceEbsByTypeAndSize() {
        assertEquals(10.0, pricing.estimateMonthlyCost("aws_ebs_volume", Map.of("size", 100L, "type", "gp2"), "us-east-1"), 0.001);
        assertEquals(8.0, pricing.estimateMonthlyCost("aws_ebs_volume", Map.of("size", 100L, "type", "gp3"), "us-east-1"), 0.001);
        assertEquals(1.6, pricing.estimateMonthlyCost("aws_ebs_volume", Map.of(), "us-east-1"), 0.001);
    }

    @Test
    void estimateMonthlyCost_ShouldApplyRegionMultiplierToInstances() {
        double virginia = pricing.estimateMonthlyCost("aws_instance", Map.of("instance_type", "t3.micro"), "us-east-1");
        double saoPaulo = pricing.estimateMonthlyCost("aws_instance", Map.of("instance_type", "t3.micro"), "sa-east-1");

        assertEquals(0.0104 * 730, virginia, 0.0001);
        assertEquals(virginia * 1.20, saoPaulo, 0.0001);
    }

    @Test
    void estimateMonthlyCost_ShouldDefaultBlankRegionToUsEast() {
        double blank = pricing.estimateMonthlyCost("aws_instance", Map.of("instance_type", "t3.small"), "");
        double explicit = pricing.estimateMonthlyCost("aws_instance", Map.of("instance_type", "t3.small"), "us-east-1");

        assertEquals(explicit, blank, 0.0001);
    }

    @Test
    void estimateMonthlyCost_ShouldEstimateUnlistedInstanceTypes() {
        double cost = pricing.estimateMonthlyCost("aws_instance", Map.of("instance_type", "z9.large"), "us-east-1");

        assertTrue(cost > 0);
    }

    @Test
    void estimateMonthlyCost_ShouldRejectUnresolvedReferences() {
        assertThrows(IllegalArgumentException.class,
                () -> pricing.estimateMonthlyCost("aws_instance", Map.of("instance_type", "var.instance_type"), "us-east-1"));
        assertThrows(IllegalArgumentException.class,
                () -> pricing.estimateMonthlyCost("aws_ebs_volume", Map.of("size", "local.size"), "us-east-1"));
    }

    @Test
    void estimateMonthlyCost_ShouldTreatUnknownTypesAsFree() {
        assertEquals(0.0, pricing.estimateMonthlyCost("aws_iam_role", Map.of(), "us-east-1"));
        assertEquals(0.50, pricing.estimateMonthlyCost("aws_s3_bucket", null, null));
    }

    @Test
    void ec2Hourly_ShouldCacheRatesPerRegion() {
        pricing.ec2Hourly("t3.micro", "us-east-1");
        pricing.ec2Hourly("t3.micro", "us-east-1");
        pricing.ec2Hourly("t3.micro", "eu-west-1");

        assertEquals(2, pricing.cachedRates());
    }
}
