package com.vidnyan.tfguard.adapter.out.pricing;

import java.util.Map;

/**
 * Static on-demand prices for us-east-1 in USD. Instance prices are hourly,
 * storage prices per GB-month.
 */
final class AwsPriceCatalog {

    private AwsPriceCatalog() {
    }

    static final double HOURS_IN_MONTH = 730;

    static final Map<String, Double> REGION_MULTIPLIERS = Map.ofEntries(
            Map.entry("us-east-1", 1.0),
            Map.entry("us-east-2", 1.0),
            Map.entry("us-west-1", 1.05),
            Map.entry("us-west-2", 1.02),
            Map.entry("ca-central-1", 1.04),
            Map.entry("eu-west-1", 1.05),
            Map.entry("eu-west-2", 1.07),
            Map.entry("eu-west-3", 1.08),
            Map.entry("eu-central-1", 1.06),
            Map.entry("eu-north-1", 1.05),
            Map.entry("ap-southeast-1", 1.10),
            Map.entry("ap-southeast-2", 1.12),
            Map.entry("ap-northeast-1", 1.15),
            Map.entry("ap-northeast-2", 1.12),
            Map.entry("ap-northeast-3", 1.15),
            Map.entry("ap-south-1", 1.08),
            Map.entry("sa-east-1", 1.20),
            Map.entry("me-south-1", 1.12),
            Map.entry("af-south-1", 1.14));

    static final Map<String, Double> EC2_HOURLY = Map.ofEntries(
            Map.entry("t3.nano", 0.0052),
            Map.entry("t3.micro", 0.0104),
            Map.entry("t3.small", 0.0208),
            Map.entry("t3.medium", 0.0416),
            Map.entry("t3.large", 0.0832),
            Map.entry("t3.xlarge", 0.1664),
            Map.entry("t3.2xlarge", 0.3328),
            Map.entry("t3a.nano", 0.0047),
            Map.entry("t3a.micro", 0.0094),
            Map.entry("t3a.small", 0.0188),
            Map.entry("t3a.medium", 0.0376),
            Map.entry("t3a.large", 0.0752),
            Map.entry("t3a.xlarge", 0.1504),
            Map.entry("t3a.2xlarge", 0.3008),
            Map.entry("t4g.nano", 0.0042),
            Map.entry("t4g.micro", 0.0084),
            Map.entry("t4g.small", 0.0168),
            Map.entry("t4g.medium", 0.0336),
            Map.entry("t4g.large", 0.0672),
            Map.entry("t4g.xlarge", 0.1344),
            Map.entry("t4g.2xlarge", 0.2688),
            Map.entry("m5.large", 0.096),
            Map.entry("m5.xlarge", 0.192),
            Map.entry("m5.2xlarge", 0.384),
            Map.entry("m6i.large", 0.096),
            Map.entry("m6i.xlarge", 0.192),
            Map.entry("m6i.2xlarge", 0.384),
            Map.entry("m6g.medium", 0.0308),
            Map.entry("m6g.large", 0.077),
            Map.entry("m6g.xlarge", 0.154),
            Map.entry("m6g.2xlarge", 0.308),
            Map.entry("m7g.medium", 0.0325),
            Map.entry("m7g.large", 0.0816),
            Map.entry("m7g.xlarge", 0.1632),
            Map.entry("m7g.2xlarge", 0.3264),
            Map.entry("c5.large", 0.085),
            Map.entry("c5.xlarge", 0.17),
            Map.entry("c5.2xlarge", 0.34),
            Map.entry("c6i.large", 0.085),
            Map.entry("c6i.xlarge", 0.17),
            Map.entry("c6i.2xlarge", 0.34),
            Map.entry("c6g.medium", 0.0272),
            Map.entry("c6g.large", 0.068),
            Map.entry("c6g.xlarge", 0.136),
            Map.entry("c6g.2xlarge", 0.272),
            Map.entry("c7g.medium", 0.029),
            Map.entry("c7g.large", 0.0725),
            Map.entry("c7g.xlarge", 0.145),
            Map.entry("c7g.2xlarge", 0.29),
            Map.entry("r5.large", 0.126),
            Map.entry("r5.xlarge", 0.252),
            Map.entry("r5.2xlarge", 0.504),
            Map.entry("r6i.large", 0.126),
            Map.entry("r6i.xlarge", 0.252),
            Map.entry("r6i.2xlarge", 0.504),
            Map.entry("r6g.medium", 0.0403),
            Map.entry("r6g.large", 0.1008),
            Map.entry("r6g.xlarge", 0.2016),
            Map.entry("r6g.2xlarge", 0.4032));

    /**
     * Relative size units used when an instance type is not in the catalog.
     */
    static final Map<String, Double> SIZE_UNITS = Map.ofEntries(
            Map.entry("nano", 0.25),
            Map.entry("micro", 0.5),
            Map.entry("small", 1.0),
            Map.entry("medium", 2.0),
            Map.entry("large", 4.0),
            Map.entry("xlarge", 8.0),
            Map.entry("2xlarge", 16.0),
            Map.entry("4xlarge", 32.0),
            Map.entry("8xlarge", 64.0),
            Map.entry("12xlarge", 96.0),
            Map.entry("16xlarge", 128.0),
            Map.entry("24xlarge", 192.0));

    static final double HOURLY_PER_SIZE_UNIT = 0.012;

    /**
     * Single-AZ MySQL baseline; engines scale it by {@link #RDS_ENGINE_MULTIPLIERS}.
     */
    static final Map<String, Double> RDS_HOURLY = Map.ofEntries(
            Map.entry("db.t3.micro", 0.017),
            Map.entry("db.t3.small", 0.034),
            Map.entry("db.t3.medium", 0.068),
            Map.entry("db.t3.large", 0.136),
            Map.entry("db.t3.xlarge", 0.272),
            Map.entry("db.t3.2xlarge", 0.544),
            Map.entry("db.t4g.micro", 0.016),
            Map.entry("db.t4g.small", 0.032),
            Map.entry("db.t4g.medium", 0.065),
            Map.entry("db.t4g.large", 0.129),
            Map.entry("db.t4g.xlarge", 0.258),
            Map.entry("db.t4g.2xlarge", 0.516),
            Map.entry("db.m5.large", 0.115),
            Map.entry("db.m5.xlarge", 0.230),
            Map.entry("db.m5.2xlarge", 0.460),
            Map.entry("db.m6g.large", 0.105),
            Map.entry("db.m6g.xlarge", 0.210),
            Map.entry("db.m6g.2xlarge", 0.420),
            Map.entry("db.r5.large", 0.145),
            Map.entry("db.r5.xlarge", 0.290),
            Map.entry("db.r5.2xlarge", 0.580),
            Map.entry("db.r6g.large", 0.130),
            Map.entry("db.r6g.xlarge", 0.260),
            Map.entry("db.r6g.2xlarge", 0.520));

    static final double RDS_FALLBACK_HOURLY = 0.10;

    static final Map<String, Double> RDS_ENGINE_MULTIPLIERS = Map.ofEntries(
            Map.entry("mysql", 1.0),
            Map.entry("mariadb", 1.0),
            Map.entry("postgres", 1.08),
            Map.entry("aurora-mysql", 1.15),
            Map.entry("aurora-postgresql", 1.18),
            Map.entry("oracle-ee", 2.8),
            Map.entry("oracle-se2", 1.6),
            Map.entry("sqlserver-ee", 3.2),
            Map.entry("sqlserver-se", 1.9),
            Map.entry("sqlserver-ex", 1.0),
            Map.entry("sqlserver-web", 1.2));

    static final Map<String, Double> ELASTICACHE_HOURLY = Map.ofEntries(
            Map.entry("cache.t3.micro", 0.017),
            Map.entry("cache.t3.small", 0.034),
            Map.entry("cache.t3.medium", 0.068),
            Map.entry("cache.t4g.micro", 0.016),
            Map.entry("cache.t4g.small", 0.032),
            Map.entry("cache.t4g.medium", 0.065),
            Map.entry("cache.m5.large", 0.124),
            Map.entry("cache.m5.xlarge", 0.248),
            Map.entry("cache.m6g.large", 0.113),
            Map.entry("cache.m6g.xlarge", 0.226),
            Map.entry("cache.r5.large", 0.166),
            Map.entry("cache.r5.xlarge", 0.332),
            Map.entry("cache.r6g.large", 0.150),
            Map.entry("cache.r6g.xlarge", 0.300));

    static final double ELASTICACHE_FALLBACK_HOURLY = 0.068;

    static final Map<String, Double> EBS_PER_GB = Map.of(
            "gp3", 0.08,
            "gp2", 0.10,
            "io1", 0.125,
            "io2", 0.125,
            "st1", 0.045,
            "sc1", 0.015,
            "standard", 0.05);

    static final double S3_STANDARD_PER_GB = 0.023;
    static final double RDS_STORAGE_PER_GB = 0.115;
    static final double DYNAMODB_STORAGE_PER_GB = 0.25;
    static final double PIOPS_PER_IOPS = 0.065;
}
