package com.vidnyan.tfguard.domain.remediation;

import com.vidnyan.tfguard.domain.policy.PolicyDefinition;

/**
 * A proposed fix for one violation.
 */
public record Remediation(
    String id,
    String policyCode,
    String title,
    String description,
    PolicyDefinition.Severity severity,
    PolicyDefinition.Category category,
    String resourceRef,
    FixDiff diff,
    FixImpact impact,
    FixSource source,
    ChangeStatus status
) {

    public boolean isPlaceholder() {
        return source == FixSource.MANUAL_PLACEHOLDER;
    }

    public Remediation withStatus(ChangeStatus newStatus) {
        return new Remediation(id, policyCode, title, description, severity, category,
                resourceRef, diff, impact, source, newStatus);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String policyCode;
        private String title;
        private String description;
        private PolicyDefinition.Severity severity;
        private PolicyDefinition.Category category;
        private String resourceRef;
        private FixDiff diff;
        private FixImpact impact = FixImpact.NONE;
        private FixSource source = FixSource.STATIC_TEMPLATE;
        private ChangeStatus status = ChangeStatus.PROPOSED;

        public Builder id(String id) { this.id = id; return this; }
        public Builder policyCode(String code) { this.policyCode = code; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder severity(PolicyDefinition.Severity sev) { this.severity = sev; return this; }
        public Builder category(PolicyDefinition.Category cat) { this.category = cat; return this; }
        public Builder resourceRef(String ref) { this.resourceRef = ref; return this; }
        public Builder diff(FixDiff diff) { this.diff = diff; return this; }
        public Builder impact(FixImpact impact) { this.impact = impact; return this; }
        public Builder source(FixSource source) { this.source = source; return this; }
        public Builder status(ChangeStatus status) { this.status = status; return this; }

        public Remediation build() {
            return new Remediation(id, policyCode, title, description, severity, category,
                    resourceRef, diff, impact, source, status);
        }
    }
}
