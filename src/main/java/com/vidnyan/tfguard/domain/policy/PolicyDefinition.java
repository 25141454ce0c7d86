package com.vidnyan.tfguard.domain.policy;

/**
 * Policy definition - metadata plus the pure check that implements it.
 * Immutable value object registered at startup.
 */
public record PolicyDefinition(
    String code,
    String name,
    String description,
    String provider,
    Category category,
    Severity severity,
    PolicyCheck check
) {

    public static final String ALL_PROVIDERS = "all";

    public enum Severity {
        CRITICAL(25),
        HIGH(15),
        MEDIUM(5),
        LOW(2),
        INFO(0);

        private final int scoreWeight;

        Severity(int scoreWeight) {
            this.scoreWeight = scoreWeight;
        }

        /**
         * Points deducted from the security score for each violation.
         */
        public int scoreWeight() {
            return scoreWeight;
        }
    }

    public enum Category {
        SECURITY,
        COST,
        RELIABILITY,
        PERFORMANCE,
        COMPLIANCE
    }

    public boolean appliesTo(String targetProvider) {
        return ALL_PROVIDERS.equals(provider) || provider.equalsIgnoreCase(targetProvider);
    }

    /**
     * Builder for PolicyDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String code;
        private String name;
        private String description = "";
        private String provider = ALL_PROVIDERS;
        private Category category = Category.SECURITY;
        private Severity severity = Severity.MEDIUM;
        private PolicyCheck check;

        public Builder code(String code) { this.code = code; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder provider(String provider) { this.provider = provider; return this; }
        public Builder category(Category cat) { this.category = cat; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder check(PolicyCheck check) { this.check = check; return this; }

        public PolicyDefinition build() {
            if (code == null || check == null) {
                throw new IllegalStateException("Policy requires a code and a check");
            }
            return new PolicyDefinition(code, name, description, provider, category, severity, check);
        }
    }
}
