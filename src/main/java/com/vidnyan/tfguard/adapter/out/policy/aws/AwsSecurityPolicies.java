package com.vidnyan.tfguard.adapter.out.policy.aws;

import com.vidnyan.tfguard.domain.model.ParsedConfig;
import com.vidnyan.tfguard.domain.model.ResourceRecord;
import com.vidnyan.tfguard.domain.policy.PolicyCheck;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition.Category;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition.Severity;
import com.vidnyan.tfguard.domain.policy.PolicyResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.vidnyan.tfguard.adapter.out.policy.aws.AwsPolicySupport.asLong;
import static com.vidnyan.tfguard.adapter.out.policy.aws.AwsPolicySupport.blocks;
import static com.vidnyan.tfguard.adapter.out.policy.aws.AwsPolicySupport.listContains;
import static com.vidnyan.tfguard.adapter.out.policy.aws.AwsPolicySupport.references;

/**
 * Built-in AWS security policies, loosely following the CIS AWS Foundations
 * Benchmark.
 */
public final class AwsSecurityPolicies {

    static final String AWS = "aws";

    private static final List<Integer> DANGEROUS_PORTS = List.of(22, 3389, 3306, 5432, 27017, 6379);

    private static final Pattern WILDCARD_ACTION =
            Pattern.compile("\"?Action\"?\\s*[:=]\\s*(\"\\*\"|\\[\\s*\"\\*\"\\s*])");
    private static final Pattern WILDCARD_RESOURCE =
            Pattern.compile("\"?Resource\"?\\s*[:=]\\s*(\"\\*\"|\\[\\s*\"\\*\"\\s*])");

    private static final List<String> SECRET_LABELS = List.of(
            "password", "secret_key", "api_key", "access_key", "secret",
            "master_password", "db_password", "private_key", "token");
    private static final List<Pattern> SECRET_PATTERNS = SECRET_LABELS.stream()
            .map(label -> Pattern.compile(label + "\\s*=\\s*\"[^\"$]+\""))
            .toList();

    private AwsSecurityPolicies() {
    }

    public static List<PolicyDefinition> policies() {
        return List.of(
                s3PublicAccessBlock(),
                securityGroupOpenPorts(),
                rdsPubliclyAccessible(),
                ebsEncryption(),
                iamWildcards(),
                cloudTrailPresent(),
                cloudTrailLogValidation(),
                vpcFlowLogs(),
                s3AccessLogging(),
                defaultSecurityGroup(),
                subnetPublicIp(),
                rdsEncryption(),
                rdsDeletionProtection(),
                dynamoDbEncryption(),
                snsEncryption(),
                sqsEncryption(),
                inlineIamUserPolicies(),
                imdsV2(),
                hardcodedSecrets());
    }

    static PolicyDefinition s3PublicAccessBlock() {
        return security("SEC001", "S3 Bucket Public Access Blocked", Severity.CRITICAL,
                "Ensures S3 buckets have public access blocked to prevent unintended data exposure",
                ctx -> {
                    ParsedConfig parsed = ctx.parsed();
                    List<ResourceRecord> blocks = parsed.findByType("aws_s3_bucket_public_access_block");
                    List<PolicyResult> results = new ArrayList<>();
                    for (ResourceRecord bucket : parsed.findByType("aws_s3_bucket")) {
                        boolean covered = blocks.stream()
                                .anyMatch(b -> references(b.getString("bucket").orElse(null), bucket));
                        if (!covered) {
                            results.add(PolicyResult.forResource(bucket)
                                    .message("S3 bucket \"" + bucket.name() + "\" does not have a public access block configured")
                                    .suggestion("Add an aws_s3_bucket_public_access_block resource for \"" + bucket.name()
                                            + "\" with block_public_acls, block_public_policy, ignore_public_acls and restrict_public_buckets set to true")
                                    .autoFixable(true)
                                    .build());
                        }
                    }
                    return results;
                });
    }

    static PolicyDefinition securityGroupOpenPorts() {
        return security("SEC002", "Security Group Not Open to World", Severity.CRITICAL,
                "Detects security groups with SSH, RDP or database ports open to 0.0.0.0/0",
                ctx -> {
                    List<PolicyResult> results = new ArrayList<>();
                    for (ResourceRecord sg : ctx.parsed().findByType("aws_security_group")) {
                        for (int port : exposedPorts(blocks(sg, "ingress"))) {
                            results.add(openPortResult(sg, "Security group", port));
                        }
                    }
                    for (ResourceRecord rule : ctx.parsed().findByType("aws_security_group_rule")) {
                        if ("ingress".equals(rule.getString("type").orElse(null))) {
                            for (int port : exposedPorts(List.of(rule.properties()))) {
                                results.add(openPortResult(rule, "Security group rule", port));
                            }
                        }
                    }
                    return results;
                });
    }

    private static List<Integer> exposedPorts(List<Map<String, Object>> ingressRules) {
        List<Integer> ports = new ArrayList<>();
        for (Map<String, Object> ingress : ingressRules) {
            boolean open = listContains(ingress.get("cidr_blocks"), "0.0.0.0/0")
                    || listContains(ingress.get("ipv6_cidr_blocks"), "::/0");
            if (!open) {
                continue;
            }
            for (int port : DANGEROUS_PORTS) {
                if (covers(ingress, port) && !ports.contains(port)) {
                    ports.add(port);
                }
            }
        }
        return ports;
    }

    private static boolean covers(Map<String, Object> rule, int port) {
        Long from = asLong(rule.get("from_port"));
        Long to = asLong(rule.get("to_port"));
        Object protocol = rule.get("protocol");
        if ("-1".equals(protocol) || "all".equals(protocol) || Long.valueOf(-1).equals(protocol)) {
            return true;
        }
        if (from == null || to == null) {
            return false;
        }
        return from <= port && port <= to;
    }

    private static PolicyResult openPortResult(ResourceRecord resource, String kind, int port) {
        return PolicyResult.forResource(resource)
                .message(kind + " \"" + resource.name() + "\" allows inbound traffic on port " + port + " from the internet")
                .suggestion("Restrict the CIDR block to specific IP ranges instead of 0.0.0.0/0")
                .metadata(Map.of("port", port))
                .build();
    }

    static PolicyDefinition rdsPubliclyAccessible() {
        return security("SEC003", "RDS Instance Not Publicly Accessible", Severity.HIGH,
                "Ensures RDS instances are not publicly accessible from the internet",
                ctx -> ctx.parsed().findByType("aws_db_instance").stream()
                        .filter(rds -> rds.isTrue("publicly_accessible"))
                        .map(rds -> PolicyResult.forResource(rds)
                                .message("RDS instance \"" + rds.name() + "\" is publicly accessible")
                                .suggestion("Set publicly_accessible = false to restrict access to your VPC")
                                .autoFixable(true)
                                .build())
                        .toList());
    }

    static PolicyDefinition ebsEncryption() {
        return security("SEC004", "EBS Volumes Encrypted", Severity.HIGH,
                "Ensures EBS volumes have encryption enabled at rest",
                ctx -> {
                    List<PolicyResult> results = new ArrayList<>();
                    for (ResourceRecord ebs : ctx.parsed().findByType("aws_ebs_volume")) {
                        if (!ebs.isTrue("encrypted")) {
                            results.add(PolicyResult.forResource(ebs)
                                    .message("EBS volume \"" + ebs.name() + "\" is not encrypted")
                                    .suggestion("Add encrypted = true to enable encryption at rest")
                                    .autoFixable(true)
                                    .build());
                        }
                    }
                    for (ResourceRecord ec2 : ctx.parsed().findByType("aws_instance")) {
                        if (ec2.hasProperty("root_block_device") && !ec2.isTrue("root_block_device.encrypted")) {
                            results.add(PolicyResult.forResource(ec2)
                                    .message("EC2 instance \"" + ec2.name() + "\" has an unencrypted root block device")
                                    .suggestion("Add encrypted = true inside the root_block_device block")
                                    .autoFixable(true)
                                    .build());
                        }
                    }
                    return results;
                });
    }

    static PolicyDefinition iamWildcards() {
        return security("SEC005", "IAM Policies No Wildcards", Severity.HIGH,
                "Detects IAM policies using wildcard (*) actions or resources",
                ctx -> {
                    List<ResourceRecord> policies = new ArrayList<>(ctx.parsed().findByType("aws_iam_policy"));
                    policies.addAll(ctx.parsed().findByType("aws_iam_role_policy"));
                    List<PolicyResult> results = new ArrayList<>();
                    for (ResourceRecord policy : policies) {
                        if (WILDCARD_ACTION.matcher(policy.rawText()).find()) {
                            results.add(PolicyResult.forResource(policy)
                                    .message("IAM policy \"" + policy.name() + "\" uses wildcard (*) for Action")
                                    .suggestion("Specify explicit actions instead of * to follow least privilege")
                                    .build());
                        }
                        if (WILDCARD_RESOURCE.matcher(policy.rawText()).find()) {
                            results.add(PolicyResult.forResource(policy)
                                    .message("IAM policy \"" + policy.name() + "\" uses wildcard (*) for Resource")
                                    .suggestion("Specify explicit resource ARNs instead of * to limit scope")
                                    .build());
                        }
                    }
                    return results;
                });
    }

    static PolicyDefinition cloudTrailPresent() {
        return security("SEC006", "CloudTrail Enabled", Severity.HIGH,
                "Ensures a CloudTrail trail is defined to log API activity across the account",
                ctx -> {
                    if (ctx.parsed().hasType("aws_cloudtrail")) {
                        return List.of();
                    }
                    return List.of(PolicyResult.builder()
                            .resourceRef(PolicyResult.TEMPLATE_REF)
                            .resourceType("aws_cloudtrail")
                            .message("No aws_cloudtrail resource found. CloudTrail should be enabled for API auditing")
                            .suggestion("Add an aws_cloudtrail resource with is_multi_region_trail = true and enable_logging = true")
                            .build());
                });
    }

    static PolicyDefinition cloudTrailLogValidation() {
        return security("SEC007", "CloudTrail Log File Validation Enabled", Severity.MEDIUM,
                "Ensures CloudTrail log file validation is enabled to detect tampering",
                ctx -> ctx.parsed().findByType("aws_cloudtrail").stream()
                        .filter(trail -> !trail.isTrue("enable_log_file_validation"))
                        .map(trail -> PolicyResult.forResource(trail)
                                .message("CloudTrail \"" + trail.name() + "\" does not have log file validation enabled")
                                .suggestion("Add enable_log_file_validation = true to detect unauthorized log modifications")
                                .autoFixable(true)
                                .build())
                        .toList());
    }

    static PolicyDefinition vpcFlowLogs() {
        return security("SEC008", "VPC Flow Logs Enabled", Severity.MEDIUM,
                "Ensures each VPC has flow logs enabled for network traffic monitoring",
                ctx -> {
                    List<ResourceRecord> flowLogs = ctx.parsed().findByType("aws_flow_log");
                    return ctx.parsed().findByType("aws_vpc").stream()
                            .filter(vpc -> flowLogs.stream().noneMatch(fl -> references(fl.rawText(), vpc)))
                            .map(vpc -> PolicyResult.forResource(vpc)
                                    .message("VPC \"" + vpc.name() + "\" does not have flow logs enabled")
                                    .suggestion("Add an aws_flow_log resource referencing \"" + vpc.name() + "\" to capture network traffic")
                                    .build())
                            .toList();
                });
    }

    static PolicyDefinition s3AccessLogging() {
        return security("SEC009", "S3 Bucket Access Logging Enabled", Severity.MEDIUM,
                "Ensures S3 buckets have server access logging enabled for audit purposes",
                ctx -> {
                    List<ResourceRecord> logging = ctx.parsed().findByType("aws_s3_bucket_logging");
                    return ctx.parsed().findByType("aws_s3_bucket").stream()
                            .filter(bucket -> !bucket.hasProperty("logging"))
                            .filter(bucket -> logging.stream().noneMatch(l -> references(l.rawText(), bucket)))
                            .map(bucket -> PolicyResult.forResource(bucket)
                                    .message("S3 bucket \"" + bucket.name() + "\" does not have access logging configured")
                                    .suggestion("Add an aws_s3_bucket_logging resource for \"" + bucket.name()
                                            + "\" with a target_bucket and target_prefix")
                                    .build())
                            .toList();
                });
    }

    static PolicyDefinition defaultSecurityGroup() {
        return security("SEC010", "Default Security Group Restricts All Traffic", Severity.HIGH,
                "Ensures the default security group of every VPC restricts all inbound and outbound traffic",
                ctx -> ctx.parsed().findByType("aws_default_security_group").stream()
                        .filter(sg -> sg.hasProperty("ingress") || sg.hasProperty("egress"))
                        .map(sg -> PolicyResult.forResource(sg)
                                .message("Default security group \"" + sg.name() + "\" has ingress or egress rules defined")
                                .suggestion("Remove all ingress and egress blocks from aws_default_security_group and use dedicated security groups instead")
                                .build())
                        .toList());
    }

    static PolicyDefinition subnetPublicIp() {
        return security("SEC011", "VPC Subnets Do Not Auto-Assign Public IP", Severity.MEDIUM,
                "Flags subnets that automatically assign public IP addresses to launched instances",
                ctx -> ctx.parsed().findByType("aws_subnet").stream()
                        .filter(subnet -> subnet.isTrue("map_public_ip_on_launch"))
                        .map(subnet -> PolicyResult.forResource(subnet)
                                .message("Subnet \"" + subnet.name() + "\" auto-assigns public IP addresses on launch")
                                .suggestion("Set map_public_ip_on_launch = false and use Elastic IPs or NAT Gateways for internet access")
                                .autoFixable(true)
                                .build())
                        .toList());
    }

    static PolicyDefinition rdsEncryption() {
        return security("SEC012", "RDS Encryption at Rest Enabled", Severity.HIGH,
                "Ensures RDS database instances have encryption at rest enabled",
                ctx -> ctx.parsed().findByType("aws_db_instance").stream()
                        .filter(rds -> !rds.isTrue("storage_encrypted"))
                        .map(rds -> PolicyResult.forResource(rds)
                                .message("RDS instance \"" + rds.name() + "\" does not have encryption at rest enabled")
                                .suggestion("Add storage_encrypted = true and optionally a kms_key_id")
                                .autoFixable(true)
                                .build())
                        .toList());
    }

    static PolicyDefinition rdsDeletionProtection() {
        return security("SEC013", "RDS Deletion Protection Enabled", Severity.MEDIUM,
                "Ensures RDS database instances have deletion protection enabled",
                ctx -> ctx.parsed().findByType("aws_db_instance").stream()
                        .filter(rds -> !rds.isTrue("deletion_protection"))
                        .map(rds -> PolicyResult.forResource(rds)
                                .message("RDS instance \"" + rds.name() + "\" does not have deletion protection enabled")
                                .suggestion("Add deletion_protection = true to prevent accidental database deletion")
                                .autoFixable(true)
                                .build())
                        .toList());
    }

    static PolicyDefinition dynamoDbEncryption() {
        return security("SEC014", "DynamoDB Server-Side Encryption Enabled", Severity.MEDIUM,
                "Ensures DynamoDB tables have server-side encryption configured",
                ctx -> ctx.parsed().findByType("aws_dynamodb_table").stream()
                        .filter(table -> !table.hasProperty("server_side_encryption"))
                        .map(table -> PolicyResult.forResource(table)
                                .message("DynamoDB table \"" + table.name() + "\" does not have a server_side_encryption block")
                                .suggestion("Add a server_side_encryption block with enabled = true and optionally a kms_key_arn")
                                .autoFixable(true)
                                .build())
                        .toList());
    }

    static PolicyDefinition snsEncryption() {
        return security("SEC015", "SNS Topic Encryption Enabled", Severity.MEDIUM,
                "Ensures SNS topics are encrypted at rest using a KMS key",
                ctx -> ctx.parsed().findByType("aws_sns_topic").stream()
                        .filter(topic -> !topic.hasProperty("kms_master_key_id"))
                        .map(topic -> PolicyResult.forResource(topic)
                                .message("SNS topic \"" + topic.name() + "\" does not have encryption enabled")
                                .suggestion("Add kms_master_key_id with a KMS key ARN or alias")
                                .build())
                        .toList());
    }

    static PolicyDefinition sqsEncryption() {
        return security("SEC016", "SQS Queue Encryption Enabled", Severity.MEDIUM,
                "Ensures SQS queues are encrypted at rest using KMS or SQS-managed SSE",
                ctx -> ctx.parsed().findByType("aws_sqs_queue").stream()
                        .filter(queue -> !queue.hasProperty("kms_master_key_id"))
                        .filter(queue -> !queue.isTrue("sqs_managed_sse_enabled"))
                        .map(queue -> PolicyResult.forResource(queue)
                                .message("SQS queue \"" + queue.name() + "\" does not have encryption enabled")
                                .suggestion("Add kms_master_key_id, or set sqs_managed_sse_enabled = true")
                                .build())
                        .toList());
    }

    static PolicyDefinition inlineIamUserPolicies() {
        return security("SEC017", "No Inline IAM User Policies", Severity.MEDIUM,
                "Flags inline IAM user policies, which are harder to audit than managed policies",
                ctx -> ctx.parsed().findByType("aws_iam_user_policy").stream()
                        .map(policy -> PolicyResult.forResource(policy)
                                .message("Inline IAM user policy \"" + policy.name() + "\" found")
                                .suggestion("Replace aws_iam_user_policy with aws_iam_user_policy_attachment and a managed aws_iam_policy")
                                .build())
                        .toList());
    }

    static PolicyDefinition imdsV2() {
        return security("SEC018", "EC2 IMDSv2 Enforced", Severity.HIGH,
                "Ensures EC2 instances require IMDSv2 to mitigate SSRF attacks",
                ctx -> ctx.parsed().findByType("aws_instance").stream()
                        .filter(instance -> !"required".equals(
                                instance.getString("metadata_options.http_tokens").orElse(null)))
                        .map(instance -> PolicyResult.forResource(instance)
                                .message("EC2 instance \"" + instance.name() + "\" does not enforce IMDSv2 (http_tokens = \"required\")")
                                .suggestion("Add a metadata_options block with http_tokens = \"required\" and http_endpoint = \"enabled\"")
                                .autoFixable(true)
                                .build())
                        .toList());
    }

    static PolicyDefinition hardcodedSecrets() {
        return security("SEC019", "No Hardcoded Secrets", Severity.CRITICAL,
                "Scans for hardcoded passwords, secret keys and API keys",
                ctx -> {
                    List<PolicyResult> results = new ArrayList<>();
                    String[] lines = ctx.rawContent().split("\n", -1);
                    for (int i = 0; i < lines.length; i++) {
                        String line = lines[i].trim();
                        if (line.startsWith("#") || line.startsWith("//") || line.startsWith("/*")) {
                            continue;
                        }
                        if (line.contains("var.") || line.contains("local.") || line.contains("data.") || line.contains("\"\"")) {
                            continue;
                        }
                        for (int p = 0; p < SECRET_PATTERNS.size(); p++) {
                            if (SECRET_PATTERNS.get(p).matcher(line).find()) {
                                String label = SECRET_LABELS.get(p);
                                int lineNumber = i + 1;
                                results.add(PolicyResult.builder()
                                        .resourceRef(PolicyResult.TEMPLATE_REF)
                                        .resourceType("hardcoded_secret")
                                        .line(lineNumber)
                                        .message("Potential hardcoded " + label + " on line " + lineNumber)
                                        .suggestion("Use a variable (var." + label + "), aws_secretsmanager_secret or aws_ssm_parameter instead")
                                        .metadata(Map.of("label", label))
                                        .build());
                                break;
                            }
                        }
                    }
                    return results;
                });
    }

    private static PolicyDefinition security(String code, String name, Severity severity, String description,
                                             PolicyCheck check) {
        return PolicyDefinition.builder()
                .code(code)
                .name(name)
                .description(description)
                .provider(AWS)
                .category(Category.SECURITY)
                .severity(severity)
                .check(check)
                .build();
    }
}
