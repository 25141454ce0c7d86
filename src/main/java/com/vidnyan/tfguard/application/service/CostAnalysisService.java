package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.application.port.out.PricingService;
import com.vidnyan.tfguard.domain.audit.CostBreakdown;
import com.vidnyan.tfguard.domain.audit.ResourceCost;
import com.vidnyan.tfguard.domain.model.LiveResource;
import com.vidnyan.tfguard.domain.model.ResourceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vidnyan.tfguard.domain.audit.CostBreakdown.round2;

/**
 * Prices every resource of a configuration or inventory.
 *
 * <p>Each line is rounded to cents before it is added, and the per-service and
 * overall totals are rounded again after each addition. A resource whose price
 * lookup throws is listed at $0 with {@code estimated = false}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CostAnalysisService {

    static final String UNABLE_TO_ESTIMATE = "Unable to estimate cost";
    static final String FREE_SUFFIX = " (Free tier / request-based)";

    private final PricingService pricingService;

    public CostBreakdown analyzeTemplateCost(List<ResourceRecord> resources, String region) {
        Accumulator acc = new Accumulator();
        for (ResourceRecord resource : resources) {
            acc.add(resource.fullName(), resource.type(), resource.properties(), region);
        }
        return acc.build(region);
    }

    public CostBreakdown analyzeLiveResources(List<LiveResource> resources, String region) {
        Accumulator acc = new Accumulator();
        List<ResourceRecord> records = LiveResource.toRecords(resources);
        for (int i = 0; i < resources.size(); i++) {
            LiveResource resource = resources.get(i);
            String resourceRegion = resource.region() != null && !resource.region().isBlank()
                    ? resource.region()
                    : region;
            acc.add(records.get(i).fullName(), resource.resourceType(), resource.metadata(), resourceRegion);
        }
        return acc.build(region);
    }

    private final class Accumulator {
        private final List<ResourceCost> lines = new ArrayList<>();
        private final Map<String, Double> byService = new LinkedHashMap<>();
        private double total;

        void add(String ref, String type, Map<String, Object> properties, String region) {
            String service = serviceName(type);
            try {
                double cost = round2(pricingService.estimateMonthlyCost(type, properties, region));
                total = round2(total + cost);
                byService.merge(service, cost, (a, b) -> round2(a + b));
                String description = describe(type, properties);
                lines.add(new ResourceCost(ref, type, service, cost,
                        cost == 0 ? description + FREE_SUFFIX : description, true));
            } catch (RuntimeException e) {
                log.warn("Could not price {}: {}", ref, e.getMessage());
                lines.add(new ResourceCost(ref, type, service, 0.0, UNABLE_TO_ESTIMATE, false));
            }
        }

        CostBreakdown build(String region) {
            return new CostBreakdown(round2(total), byService, lines, region);
        }
    }

    static String serviceName(String type) {
        if (type == null) {
            return "Other";
        }
        if (type.equals("aws_instance") || type.equals("ec2_instance") || type.equals("aws_eip")) {
            return "EC2";
        }
        if (type.equals("aws_db_instance") || type.equals("rds_instance")) {
            return "RDS";
        }
        if (type.contains("s3")) {
            return "S3";
        }
        if (type.contains("dynamodb")) {
            return "DynamoDB";
        }
        if (type.contains("lambda")) {
            return "Lambda";
        }
        if (type.equals("aws_lb") || type.equals("aws_alb") || type.equals("aws_nlb")) {
            return "ELB";
        }
        if (type.equals("aws_nat_gateway")) {
            return "VPC";
        }
        if (type.equals("aws_cloudfront_distribution")) {
            return "CloudFront";
        }
        if (type.contains("ecs")) {
            return "ECS";
        }
        if (type.contains("eks")) {
            return "EKS";
        }
        if (type.contains("elasticache")) {
            return "ElastiCache";
        }
        if (type.contains("route53")) {
            return "Route 53";
        }
        if (type.contains("api_gateway") || type.contains("apigateway")) {
            return "API Gateway";
        }
        if (type.equals("aws_sqs_queue")) {
            return "SQS";
        }
        if (type.equals("aws_sns_topic")) {
            return "SNS";
        }
        if (type.equals("aws_kms_key")) {
            return "KMS";
        }
        if (type.equals("aws_secretsmanager_secret")) {
            return "Secrets Manager";
        }
        if (type.contains("cloudwatch")) {
            return "CloudWatch";
        }
        if (type.contains("ebs")) {
            return "EBS";
        }
        return "Other";
    }

    static String describe(String type, Map<String, Object> p) {
        return switch (type) {
            case "aws_instance", "ec2_instance" -> String.valueOf(p.getOrDefault("instance_type", "t3.micro"));
            case "aws_db_instance", "rds_instance" -> p.getOrDefault("instance_class", "db.t3.micro")
                    + " (" + p.getOrDefault("engine", "postgres") + ")";
            case "aws_s3_bucket" -> "S3 Bucket";
            case "aws_ebs_volume" -> p.getOrDefault("type", "gp3") + " " + p.getOrDefault("size", 20) + " GB";
            case "aws_dynamodb_table" -> "DynamoDB Table (" + p.getOrDefault("billing_mode", "PROVISIONED") + ")";
            case "aws_lb", "aws_alb", "aws_nlb" ->
                    ("network".equals(p.get("load_balancer_type")) ? "NLB" : "ALB") + " Load Balancer";
            case "aws_nat_gateway" -> "NAT Gateway";
            case "aws_eip" -> "Elastic IP";
            case "aws_cloudfront_distribution" -> "CloudFront Distribution";
            case "aws_ecs_service" -> "ECS Service (" + p.getOrDefault("desired_count", 1) + " tasks)";
            case "aws_ecs_cluster" -> "ECS Cluster";
            case "aws_eks_cluster" -> "EKS Cluster";
            case "aws_elasticache_cluster" -> "ElastiCache " + p.getOrDefault("node_type", "cache.t3.medium")
                    + " x" + p.getOrDefault("num_cache_nodes", 1);
            case "aws_route53_zone" -> "Route 53 Hosted Zone";
            case "aws_kms_key" -> "KMS Key";
            case "aws_secretsmanager_secret" -> "Secrets Manager Secret";
            case "aws_lambda_function" -> "Lambda Function";
            default -> type;
        };
    }
}
