package com.vidnyan.tfguard.adapter.out.pricing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vidnyan.tfguard.application.port.out.PricingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import static com.vidnyan.tfguard.adapter.out.pricing.AwsPriceCatalog.*;

/**
 * Monthly cost estimates from the static AWS catalog.
 *
 * <p>Hourly rates are cached per (service, type, region) for 15 minutes.
 * Values that are references rather than literals (e.g. {@code var.instance_type})
 * cannot be priced and raise {@link IllegalArgumentException}.
 */
@Slf4j
@Component
public class AwsPricingService implements PricingService {

    static final Duration PRICE_TTL = Duration.ofMinutes(15);

    private final Cache<String, Double> hourlyRates;

    public AwsPricingService() {
        this.hourlyRates = Caffeine.newBuilder()
                .expireAfterWrite(PRICE_TTL)
                .maximumSize(1_000)
                .recordStats()
                .build();
    }

    @Override
    public double estimateMonthlyCost(String resourceType, Map<String, Object> properties, String region) {
        Map<String, Object> p = properties == null ? Map.of() : properties;
        String r = region == null || region.isBlank() ? "us-east-1" : region;

        return switch (resourceType) {
            case "aws_instance", "ec2_instance" ->
                    ec2Hourly(text(p, "t3.micro", "instance_type", "instanceType"), r) * HOURS_IN_MONTH;
            case "aws_db_instance", "rds_instance" -> {
                String instanceClass = text(p, "db.t3.micro", "instance_class", "instanceClass");
                String engine = text(p, "postgres", "engine");
                double storage = number(p, 20, "allocated_storage", "allocatedStorage");
                yield rdsHourly(instanceClass, engine, r) * HOURS_IN_MONTH + storage * RDS_STORAGE_PER_GB;
            }
            case "aws_s3_bucket", "s3_bucket" -> 0.50;
            case "aws_ebs_volume", "ebs_volume" -> {
                double size = number(p, 20, "size");
                String volumeType = text(p, "gp3", "type", "volume_type", "volumeType");
                double cost = size * EBS_PER_GB.getOrDefault(volumeType, EBS_PER_GB.get("gp3"));
                if (volumeType.equals("io1") || volumeType.equals("io2")) {
                    cost += number(p, 0, "iops") * PIOPS_PER_IOPS;
                }
                yield cost;
            }
            case "aws_dynamodb_table", "dynamodb_table" -> {
                String billingMode = text(p, "PROVISIONED", "billing_mode", "billingMode");
                if (billingMode.equals("PAY_PER_REQUEST")) {
                    yield 1.25;
                }
                double wcu = number(p, 5, "write_capacity");
                double rcu = number(p, 5, "read_capacity");
                yield (wcu * 0.00065 + rcu * 0.00013) * HOURS_IN_MONTH + DYNAMODB_STORAGE_PER_GB;
            }
            case "aws_lb", "aws_alb", "aws_nlb" -> 0.0225 * HOURS_IN_MONTH + 5.0;
            case "aws_nat_gateway" -> 0.045 * HOURS_IN_MONTH + 10 * 0.045;
            case "aws_eip" -> 3.65;
            case "aws_cloudfront_distribution" -> 1.0;
            case "aws_ecs_service" -> {
                double tasks = number(p, 1, "desired_count", "desiredCount");
                double perTaskHourly = 0.25 * 0.04048 + 0.5 * 0.004445;
                yield tasks * perTaskHourly * HOURS_IN_MONTH;
            }
            case "aws_eks_cluster" -> 0.10 * HOURS_IN_MONTH;
            case "aws_elasticache_cluster" -> {
                String nodeType = text(p, "cache.t3.medium", "node_type", "nodeType");
                double nodes = number(p, 1, "num_cache_nodes", "numCacheNodes");
                yield elastiCacheHourly(nodeType, r) * HOURS_IN_MONTH * nodes;
            }
            case "aws_elasticache_replication_group" -> {
                String nodeType = text(p, "cache.t3.medium", "node_type", "nodeType");
                double clusters = number(p, 2, "number_cache_clusters", "num_cache_clusters");
                yield elastiCacheHourly(nodeType, r) * HOURS_IN_MONTH * clusters;
            }
            case "aws_route53_zone" -> 0.50;
            case "aws_api_gateway_rest_api", "aws_apigatewayv2_api" -> 3.50;
            case "aws_kms_key" -> 1.0;
            case "aws_secretsmanager_secret" -> 0.40;
            case "aws_cloudwatch_log_group" -> 0.50;
            default -> 0.0;
        };
    }

    double ec2Hourly(String instanceType, String region) {
        return hourlyRates.get("ec2:" + instanceType + ":" + region, key -> {
            Double listed = EC2_HOURLY.get(instanceType);
            double base = listed != null ? listed : heuristicHourly(instanceType);
            return base * regionMultiplier(region);
        });
    }

    double rdsHourly(String instanceClass, String engine, String region) {
        String normalizedEngine = engine.toLowerCase(Locale.ROOT).trim();
        return hourlyRates.get("rds:" + instanceClass + ":" + normalizedEngine + ":" + region, key ->
                RDS_HOURLY.getOrDefault(instanceClass, RDS_FALLBACK_HOURLY)
                        * regionMultiplier(region)
                        * RDS_ENGINE_MULTIPLIERS.getOrDefault(normalizedEngine, 1.0));
    }

    double elastiCacheHourly(String nodeType, String region) {
        return hourlyRates.get("elasticache:" + nodeType + ":" + region, key ->
                ELASTICACHE_HOURLY.getOrDefault(nodeType, ELASTICACHE_FALLBACK_HOURLY) * regionMultiplier(region));
    }

    long cachedRates() {
        return hourlyRates.estimatedSize();
    }

    private static double heuristicHourly(String instanceType) {
        String[] parts = instanceType.split("\\.");
        String size = parts.length > 1 ? parts[1] : "large";
        log.debug("No catalog price for {}, estimating from size {}", instanceType, size);
        return HOURLY_PER_SIZE_UNIT * SIZE_UNITS.getOrDefault(size, 4.0);
    }

    private static double regionMultiplier(String region) {
        return REGION_MULTIPLIERS.getOrDefault(region, 1.0);
    }

    /**
     * First present key as a literal string, or the fallback when none is set.
     */
    private static String text(Map<String, Object> p, String fallback, String... keys) {
        for (String key : keys) {
            Object value = p.get(key);
            if (value == null) {
                continue;
            }
            String s = value.toString();
            if (isReference(s)) {
                throw new IllegalArgumentException("Cannot price unresolved " + key + ": " + s);
            }
            return s;
        }
        return fallback;
    }

    private static double number(Map<String, Object> p, double fallback, String... keys) {
        for (String key : keys) {
            Object value = p.get(key);
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            if (value instanceof String s && isReference(s)) {
                throw new IllegalArgumentException("Cannot price unresolved " + key + ": " + s);
            }
        }
        return fallback;
    }

    private static boolean isReference(String value) {
        return value.startsWith("var.") || value.startsWith("local.") || value.startsWith("data.")
                || value.startsWith("module.") || value.contains("${");
    }
}
