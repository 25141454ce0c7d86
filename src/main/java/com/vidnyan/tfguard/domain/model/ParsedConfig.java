package com.vidnyan.tfguard.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured view of one configuration text.
 */
public record ParsedConfig(
    List<ResourceRecord> resources,
    Map<String, Map<String, Object>> variables,
    Map<String, Map<String, Object>> outputs,
    List<String> providers,
    String rawContent
) {

    public ParsedConfig {
        resources = List.copyOf(resources);
        variables = Map.copyOf(variables);
        outputs = Map.copyOf(outputs);
        providers = List.copyOf(providers);
        rawContent = rawContent == null ? "" : rawContent;
    }

    public static ParsedConfig ofResources(List<ResourceRecord> resources) {
        return new ParsedConfig(resources, Map.of(), Map.of(), List.of(), "");
    }

    public List<ResourceRecord> findByType(String type) {
        return resources.stream()
                .filter(r -> r.type().equals(type))
                .toList();
    }

    public Optional<ResourceRecord> findByFullName(String fullName) {
        return resources.stream()
                .filter(r -> r.fullName().equals(fullName))
                .findFirst();
    }

    public boolean hasType(String type) {
        return resources.stream().anyMatch(r -> r.type().equals(type));
    }
}
