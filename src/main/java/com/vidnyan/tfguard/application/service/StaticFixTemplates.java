package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.domain.model.ParsedConfig;
import com.vidnyan.tfguard.domain.model.ResourceRecord;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.HclBlockEditor;

import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Deterministic fixes for policies whose remedy does not depend on context.
 * A template returns null when it cannot locate what it needs to edit.
 */
final class StaticFixTemplates {

    @FunctionalInterface
    interface FixTemplate {
        FixDiff apply(PolicyResult violation, ParsedConfig parsed);
    }

    private static final Map<String, FixTemplate> TEMPLATES = Map.ofEntries(
            Map.entry("SEC001", StaticFixTemplates::publicAccessBlock),
            Map.entry("SEC003", editBlock(b -> HclBlockEditor.setAttribute(b, "publicly_accessible", "false"))),
            Map.entry("SEC004", StaticFixTemplates::ebsEncryption),
            Map.entry("SEC007", editBlock(b -> HclBlockEditor.setAttribute(b, "enable_log_file_validation", "true"))),
            Map.entry("SEC011", editBlock(b -> HclBlockEditor.setAttribute(b, "map_public_ip_on_launch", "false"))),
            Map.entry("SEC012", editBlock(b -> HclBlockEditor.setAttribute(b, "storage_encrypted", "true"))),
            Map.entry("SEC013", editBlock(b -> HclBlockEditor.setAttribute(b, "deletion_protection", "true"))),
            Map.entry("SEC014", editBlock(b -> HclBlockEditor.setNestedAttribute(b, "server_side_encryption", "enabled", "true"))),
            Map.entry("SEC018", StaticFixTemplates::imdsV2),
            Map.entry("COST003", editBlock(b -> HclBlockEditor.setAttribute(b, "multi_az", "false"))),
            Map.entry("COST005", editBlock(b -> HclBlockEditor.setAttribute(b, "type", "\"gp3\""))));

    private StaticFixTemplates() {
    }

    static Optional<FixTemplate> forPolicy(String policyCode) {
        return Optional.ofNullable(TEMPLATES.get(policyCode));
    }

    private static FixDiff publicAccessBlock(PolicyResult violation, ParsedConfig parsed) {
        String ref = violation.resourceRef();
        int dot = ref.indexOf('.');
        String bucket = dot >= 0 ? ref.substring(dot + 1) : ref;
        String block = """
                resource "aws_s3_bucket_public_access_block" "%1$s_public_access" {
                  bucket = aws_s3_bucket.%1$s.id

                  block_public_acls       = true
                  block_public_policy     = true
                  ignore_public_acls      = true
                  restrict_public_buckets = true
                }""".formatted(bucket);
        return FixDiff.append(block);
    }

    private static FixDiff ebsEncryption(PolicyResult violation, ParsedConfig parsed) {
        return parsed.findByFullName(violation.resourceRef())
                .map(resource -> resource.type().equals("aws_instance")
                        ? edit(resource, b -> HclBlockEditor.setNestedAttribute(b, "root_block_device", "encrypted", "true"))
                        : edit(resource, b -> HclBlockEditor.setAttribute(b, "encrypted", "true")))
                .orElse(null);
    }

    private static FixDiff imdsV2(PolicyResult violation, ParsedConfig parsed) {
        return parsed.findByFullName(violation.resourceRef())
                .map(resource -> edit(resource, b -> {
                    String withTokens = HclBlockEditor.setNestedAttribute(b, "metadata_options", "http_tokens", "\"required\"");
                    if (resource.hasProperty("metadata_options.http_endpoint")) {
                        return withTokens;
                    }
                    return HclBlockEditor.setNestedAttribute(withTokens, "metadata_options", "http_endpoint", "\"enabled\"");
                }))
                .orElse(null);
    }

    private static FixTemplate editBlock(UnaryOperator<String> editor) {
        return (violation, parsed) -> parsed.findByFullName(violation.resourceRef())
                .map(resource -> edit(resource, editor))
                .orElse(null);
    }

    private static FixDiff edit(ResourceRecord resource, UnaryOperator<String> editor) {
        String before = resource.rawText();
        String after = editor.apply(before);
        return after.equals(before) ? null : new FixDiff(before, after);
    }
}
