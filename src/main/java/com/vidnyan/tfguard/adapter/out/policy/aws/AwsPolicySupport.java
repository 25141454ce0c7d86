package com.vidnyan.tfguard.adapter.out.policy.aws;

import com.vidnyan.tfguard.domain.model.ResourceRecord;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Small predicates shared by the AWS policies.
 */
final class AwsPolicySupport {

    private AwsPolicySupport() {
    }

    /**
     * True when {@code text} refers to {@code target}, either through a
     * {@code type.name} reference or through the target's own {@code bucket}
     * or {@code name} literal.
     */
    static boolean references(String text, ResourceRecord target) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        Pattern address = Pattern.compile(Pattern.quote(target.fullName()) + "(?![A-Za-z0-9_-])");
        if (address.matcher(text).find()) {
            return true;
        }
        return target.getString("bucket").map(text::equals).orElse(false)
                || target.getString("name").map(text::equals).orElse(false);
    }

    /**
     * Nested blocks under {@code key}, whether written once or repeated.
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> blocks(ResourceRecord resource, String key) {
        Object value = resource.properties().get(key);
        if (value instanceof Map<?, ?> single) {
            return List.of((Map<String, Object>) single);
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .filter(Map.class::isInstance)
                    .map(item -> (Map<String, Object>) item)
                    .toList();
        }
        return List.of();
    }

    static boolean listContains(Object value, String expected) {
        if (value instanceof List<?> list) {
            return list.contains(expected);
        }
        return expected.equals(value);
    }

    static Long asLong(Object value) {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Integer i) {
            return i.longValue();
        }
        return null;
    }

    static double numberOr(ResourceRecord resource, String path, double fallback) {
        return resource.getNumber(path).map(Number::doubleValue).orElse(fallback);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
