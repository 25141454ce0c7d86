package com.vidnyan.tfguard.domain.policy;

import com.vidnyan.tfguard.domain.model.ResourceRecord;

import java.util.Map;

/**
 * One finding produced by a policy check.
 * {@code resourceRef} is a resource address or {@link #TEMPLATE_REF} for
 * findings about the configuration as a whole.
 */
public record PolicyResult(
    String resourceRef,
    String resourceType,
    Integer line,
    String message,
    String suggestion,
    boolean autoFixable,
    Map<String, Object> metadata
) {

    public static final String TEMPLATE_REF = "template";

    public PolicyResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Read a numeric metadata entry, or zero.
     */
    public double metadataNumber(String key) {
        return metadata.get(key) instanceof Number n ? n.doubleValue() : 0.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with the resource's address, type and first line.
     */
    public static Builder forResource(ResourceRecord resource) {
        return new Builder()
                .resourceRef(resource.fullName())
                .resourceType(resource.type())
                .line(resource.startLine());
    }

    public static class Builder {
        private String resourceRef;
        private String resourceType;
        private Integer line;
        private String message;
        private String suggestion;
        private boolean autoFixable;
        private Map<String, Object> metadata = Map.of();

        public Builder resourceRef(String ref) { this.resourceRef = ref; return this; }
        public Builder resourceType(String type) { this.resourceType = type; return this; }
        public Builder line(Integer line) { this.line = line; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder suggestion(String suggestion) { this.suggestion = suggestion; return this; }
        public Builder autoFixable(boolean fixable) { this.autoFixable = fixable; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }

        public PolicyResult build() {
            return new PolicyResult(resourceRef, resourceType, line, message, suggestion, autoFixable, metadata);
        }
    }
}
