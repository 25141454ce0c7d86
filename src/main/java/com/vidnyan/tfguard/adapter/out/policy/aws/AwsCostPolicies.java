package com.vidnyan.tfguard.adapter.out.policy.aws;

import com.vidnyan.tfguard.domain.model.ResourceRecord;
import com.vidnyan.tfguard.domain.policy.PolicyCheck;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition.Category;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition.Severity;
import com.vidnyan.tfguard.domain.policy.PolicyResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.vidnyan.tfguard.adapter.out.policy.aws.AwsPolicySupport.numberOr;
import static com.vidnyan.tfguard.adapter.out.policy.aws.AwsPolicySupport.references;
import static com.vidnyan.tfguard.adapter.out.policy.aws.AwsPolicySupport.round2;

/**
 * Built-in AWS cost optimization policies.
 */
public final class AwsCostPolicies {

    private static final Pattern LARGE_INSTANCE =
            Pattern.compile("\\.(x?large|2xlarge|4xlarge|8xlarge|12xlarge|16xlarge|24xlarge)");
    private static final Pattern VERY_LARGE_INSTANCE =
            Pattern.compile("^(m5|m6i|c5|c6i|r5|r6i)\\.(2xlarge|4xlarge|8xlarge)");

    private static final List<String> NON_PRODUCTION_HINTS =
            List.of("dev", "test", "staging", "qa", "demo", "sandbox");

    static final double GP2_PER_GB = 0.10;
    static final double GP3_PER_GB = 0.08;
    static final double PROVISIONED_IOPS_PER_GB = 0.125;
    static final double PROVISIONED_IOPS_PER_IOPS = 0.065;
    static final long DEFAULT_VOLUME_SIZE_GB = 20;
    static final long LARGE_PIOPS_THRESHOLD_GB = 500;

    private AwsCostPolicies() {
    }

    public static List<PolicyDefinition> policies() {
        return List.of(
                natGateway(),
                oversizedInstance(),
                multiAzNonProduction(),
                unattachedElasticIp(),
                gp2Volumes(),
                largeProvisionedIopsVolumes());
    }

    static PolicyDefinition natGateway() {
        return cost("COST001", "Consider NAT Instance for Cost Savings", Severity.MEDIUM,
                "NAT Gateways cost about $32/month plus data charges. A NAT instance can save 60-80% for dev/test",
                ctx -> ctx.parsed().findByType("aws_nat_gateway").stream()
                        .map(nat -> PolicyResult.forResource(nat)
                                .message("NAT Gateway \"" + nat.name() + "\" costs about $32/month plus data processing fees")
                                .suggestion("For non-production workloads consider a NAT instance (t3.nano, about $3/month)")
                                .metadata(Map.of(
                                        "estimatedMonthlyCost", 32,
                                        "potentialSavings", 29,
                                        "alternativeResource", "aws_instance with source_dest_check = false"))
                                .build())
                        .toList());
    }

    static PolicyDefinition oversizedInstance() {
        return cost("COST002", "Potentially Oversized Instance", Severity.LOW,
                "Detects large instance types that might be oversized for typical workloads",
                ctx -> {
                    List<PolicyResult> results = new ArrayList<>();
                    for (ResourceRecord ec2 : ctx.parsed().findByType("aws_instance")) {
                        Optional<String> instanceType = ec2.getString("instance_type");
                        if (instanceType.isEmpty()) {
                            continue;
                        }
                        String type = instanceType.get();
                        String size = null;
                        if (LARGE_INSTANCE.matcher(type).find()) {
                            size = "large";
                        } else if (VERY_LARGE_INSTANCE.matcher(type).find()) {
                            size = "very large";
                        }
                        if (size != null) {
                            results.add(PolicyResult.forResource(ec2)
                                    .message("Instance \"" + ec2.name() + "\" uses a " + size + " instance type (" + type + ")")
                                    .suggestion("Start smaller and scale up on measured usage. AWS Compute Optimizer can recommend a size")
                                    .metadata(Map.of("currentInstanceType", type))
                                    .build());
                        }
                    }
                    return results;
                });
    }

    static PolicyDefinition multiAzNonProduction() {
        return cost("COST003", "Multi-AZ Enabled (Verify if Needed)", Severity.MEDIUM,
                "Multi-AZ deployments double RDS costs. Ensure this is intended for production workloads",
                ctx -> ctx.parsed().findByType("aws_db_instance").stream()
                        .filter(rds -> rds.isTrue("multi_az"))
                        .map(rds -> {
                            String name = rds.name().toLowerCase(Locale.ROOT);
                            boolean nonProduction = NON_PRODUCTION_HINTS.stream().anyMatch(name::contains);
                            if (nonProduction) {
                                return PolicyResult.forResource(rds)
                                        .message("RDS instance \"" + rds.name() + "\" has Multi-AZ enabled but appears to be non-production")
                                        .suggestion("Disable Multi-AZ for dev/test databases to halve the database cost")
                                        .autoFixable(true)
                                        .metadata(Map.of("environmentIndicator", name))
                                        .build();
                            }
                            return PolicyResult.forResource(rds)
                                    .message("RDS instance \"" + rds.name() + "\" has Multi-AZ enabled (2x cost)")
                                    .suggestion("Multi-AZ is recommended for production but doubles cost. Verify this is a production database")
                                    .build();
                        })
                        .toList());
    }

    static PolicyDefinition unattachedElasticIp() {
        return cost("COST004", "Elastic IP Association Check", Severity.LOW,
                "Unassociated Elastic IPs cost $3.65/month",
                ctx -> {
                    List<ResourceRecord> associations = ctx.parsed().findByType("aws_eip_association");
                    return ctx.parsed().findByType("aws_eip").stream()
                            .filter(eip -> !eip.hasProperty("instance") && !eip.hasProperty("network_interface"))
                            .filter(eip -> associations.stream().noneMatch(a -> references(a.rawText(), eip)))
                            .map(eip -> PolicyResult.forResource(eip)
                                    .message("Elastic IP \"" + eip.name() + "\" may not be associated with any resource")
                                    .suggestion("Attach this EIP to an instance or NAT Gateway, or release it")
                                    .metadata(Map.of("monthlyCost", 3.65))
                                    .build())
                            .toList();
                });
    }

    static PolicyDefinition gp2Volumes() {
        return cost("COST005", "Use gp3 Instead of gp2", Severity.INFO,
                "gp3 volumes cost 20% less than gp2 with equal or better baseline performance",
                ctx -> ctx.parsed().findByType("aws_ebs_volume").stream()
                        .filter(ebs -> "gp2".equals(ebs.getString("type").orElse(null)))
                        .map(ebs -> {
                            double size = numberOr(ebs, "size", DEFAULT_VOLUME_SIZE_GB);
                            return PolicyResult.forResource(ebs)
                                    .message("EBS volume \"" + ebs.name() + "\" uses gp2")
                                    .suggestion("Change type to \"gp3\" for the same performance at lower cost")
                                    .autoFixable(true)
                                    .metadata(Map.of(
                                            "currentMonthlyCost", round2(size * GP2_PER_GB),
                                            "estimatedSavings", round2(size * (GP2_PER_GB - GP3_PER_GB))))
                                    .build();
                        })
                        .toList());
    }

    static PolicyDefinition largeProvisionedIopsVolumes() {
        return cost("COST006", "Large Provisioned IOPS Volume", Severity.INFO,
                "Provisioned IOPS volumes above 500 GB are expensive. Check whether gp3 with provisioned throughput suffices",
                ctx -> ctx.parsed().findByType("aws_ebs_volume").stream()
                        .filter(ebs -> {
                            String type = ebs.getString("type").orElse("");
                            return (type.equals("io1") || type.equals("io2"))
                                    && numberOr(ebs, "size", 0) > LARGE_PIOPS_THRESHOLD_GB;
                        })
                        .map(ebs -> {
                            double size = numberOr(ebs, "size", 0);
                            double iops = numberOr(ebs, "iops", 0);
                            double monthly = round2(size * PROVISIONED_IOPS_PER_GB + iops * PROVISIONED_IOPS_PER_IOPS);
                            return PolicyResult.forResource(ebs)
                                    .message("EBS volume \"" + ebs.name() + "\" is a " + (long) size
                                            + " GB provisioned IOPS volume costing about $" + monthly + "/month")
                                    .suggestion("gp3 supports up to 16,000 IOPS and may meet the workload at lower cost")
                                    .metadata(Map.of("estimatedMonthlyCost", monthly))
                                    .build();
                        })
                        .toList());
    }

    private static PolicyDefinition cost(String code, String name, Severity severity, String description,
                                         PolicyCheck check) {
        return PolicyDefinition.builder()
                .code(code)
                .name(name)
                .description(description)
                .provider(AwsSecurityPolicies.AWS)
                .category(Category.COST)
                .severity(severity)
                .check(check)
                .build();
    }
}
