package com.vidnyan.tfguard.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A resource reported by an account inventory, already normalized to
 * Terraform type names and attribute keys.
 */
public record LiveResource(
    String resourceId,
    String name,
    String resourceType,
    String region,
    Map<String, Object> metadata
) {

    public LiveResource {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * View inventory items as parsed records so policies and pricing treat
     * them like template content. Addresses are unique: an item whose name
     * is already taken falls back to its resource id, then to a numbered name.
     *
     * @throws IllegalArgumentException when an item has no resource type
     */
    public static List<ResourceRecord> toRecords(List<LiveResource> resources) {
        Set<String> used = new HashSet<>();
        List<ResourceRecord> records = new ArrayList<>(resources.size());
        for (LiveResource resource : resources) {
            if (resource.resourceType() == null || resource.resourceType().isBlank()) {
                throw new IllegalArgumentException("Live resource " + resource.resourceId() + " has no resourceType");
            }
            String type = resource.resourceType();
            String label = sanitize(resource.name() != null && !resource.name().isBlank()
                    ? resource.name()
                    : resource.resourceId());
            if (used.contains(type + "." + label) && resource.resourceId() != null) {
                label = sanitize(resource.resourceId());
            }
            String unique = label;
            for (int n = 2; !used.add(type + "." + unique); n++) {
                unique = label + "_" + n;
            }
            records.add(new ResourceRecord(type, unique, resource.metadata(), "", 0, 0));
        }
        return records;
    }

    private static String sanitize(String label) {
        return label == null ? "unnamed" : label.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
