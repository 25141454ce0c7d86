package com.vidnyan.tfguard.adapter.out.parser;

import com.vidnyan.tfguard.application.port.out.ConfigParser;
import com.vidnyan.tfguard.domain.exception.ParseFailureException;
import com.vidnyan.tfguard.domain.model.ParsedConfig;
import com.vidnyan.tfguard.domain.model.ResourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Brace-scanning implementation of ConfigParser.
 *
 * <p>Reads top-level {@code resource}, {@code variable}, {@code output} and
 * {@code provider} blocks. This is not a full HCL grammar: it understands
 * strings, comments, heredocs and nesting well enough to find block
 * boundaries, and decodes simple literal values. Everything else is kept as
 * raw text.
 */
@Slf4j
@Component
public class HclConfigParser implements ConfigParser {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

    @Override
    public ParsedConfig parse(String content) {
        if (content == null) {
            throw new ParseFailureException("Configuration content is null");
        }

        HclScanner scanner = new HclScanner(content);
        List<ResourceRecord> resources = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Map<String, Map<String, Object>> variables = new LinkedHashMap<>();
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        Set<String> providers = new LinkedHashSet<>();

        int i = scanner.skipTrivia(0);
        while (i < scanner.length()) {
            int headerStart = i;
            String keyword = scanner.readIdentifier(i);
            if (keyword.isEmpty()) {
                i = scanner.skipTrivia(scanner.skipToEndOfLine(i));
                continue;
            }

            List<String> labels = new ArrayList<>();
            int pos = scanner.skipInlineSpace(i + keyword.length());
            while (pos < scanner.length() && scanner.charAt(pos) == '"') {
                int end = scanner.skipString(pos);
                labels.add(unquote(scanner.substring(pos, end)));
                pos = scanner.skipInlineSpace(end);
            }

            if (pos >= scanner.length() || scanner.charAt(pos) != '{') {
                // Top-level attribute or stray text
                i = scanner.skipTrivia(scanner.findValueEnd(pos));
                continue;
            }

            int close = scanner.findMatchingBrace(pos);
            if (close < 0) {
                log.debug("Dropping unterminated {} block header at line {}", keyword, scanner.lineOf(headerStart));
                i = scanner.skipTrivia(scanner.skipToEndOfLine(headerStart));
                continue;
            }

            String body = scanner.substring(pos + 1, close);
            switch (keyword) {
                case "resource" -> {
                    if (labels.size() == 2) {
                        ResourceRecord record = new ResourceRecord(
                                labels.get(0),
                                labels.get(1),
                                parseBody(body),
                                scanner.substring(headerStart, close + 1),
                                scanner.lineOf(headerStart),
                                scanner.lineOf(close));
                        if (seen.add(record.fullName())) {
                            resources.add(record);
                        } else {
                            log.debug("Dropping duplicate resource {} at line {}", record.fullName(), record.startLine());
                        }
                    }
                }
                case "variable" -> {
                    if (labels.size() == 1) {
                        variables.put(labels.get(0), parseBody(body));
                    }
                }
                case "output" -> {
                    if (labels.size() == 1) {
                        outputs.put(labels.get(0), parseBody(body));
                    }
                }
                case "provider" -> {
                    if (labels.size() == 1) {
                        providers.add(labels.get(0));
                    }
                }
                default -> log.trace("Skipping {} block", keyword);
            }
            i = scanner.skipTrivia(close + 1);
        }

        log.debug("Parsed {} resources, {} variables, {} outputs",
                resources.size(), variables.size(), outputs.size());
        return new ParsedConfig(resources, variables, outputs, new ArrayList<>(providers), content);
    }

    /**
     * Parse the inside of a block into attributes and nested blocks.
     */
    Map<String, Object> parseBody(String body) {
        HclScanner scanner = new HclScanner(body);
        Map<String, Object> properties = new LinkedHashMap<>();

        int i = scanner.skipTrivia(0);
        while (i < scanner.length()) {
            String key;
            int pos;
            if (scanner.charAt(i) == '"') {
                int end = scanner.skipString(i);
                key = unquote(scanner.substring(i, end));
                pos = end;
            } else {
                key = scanner.readIdentifier(i);
                pos = i + key.length();
            }
            if (key.isEmpty()) {
                i = scanner.skipTrivia(scanner.skipToEndOfLine(i) + 1);
                continue;
            }

            pos = scanner.skipInlineSpace(pos);
            // Block labels, e.g. dynamic "ingress" { ... }
            while (pos < scanner.length() && scanner.charAt(pos) == '"') {
                pos = scanner.skipInlineSpace(scanner.skipString(pos));
            }

            if (pos < scanner.length() && (scanner.charAt(pos) == '=' || scanner.charAt(pos) == ':')) {
                int valueStart = scanner.skipInlineSpace(pos + 1);
                int valueEnd = scanner.findValueEnd(valueStart);
                properties.put(key, parseValue(scanner.substring(valueStart, valueEnd)));
                i = scanner.skipTrivia(valueEnd);
            } else if (pos < scanner.length() && scanner.charAt(pos) == '{') {
                int close = scanner.findMatchingBrace(pos);
                if (close < 0) {
                    break;
                }
                addBlock(properties, key, parseBody(scanner.substring(pos + 1, close)));
                i = scanner.skipTrivia(close + 1);
            } else {
                i = scanner.skipTrivia(scanner.skipToEndOfLine(pos));
            }
        }
        return properties;
    }

    @SuppressWarnings("unchecked")
    private void addBlock(Map<String, Object> properties, String key, Map<String, Object> block) {
        Object existing = properties.get(key);
        if (existing instanceof Map<?, ?> first) {
            List<Object> blocks = new ArrayList<>();
            blocks.add(first);
            blocks.add(block);
            properties.put(key, blocks);
        } else if (existing instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map) {
            ((List<Object>) list).add(block);
        } else {
            properties.put(key, block);
        }
    }

    /**
     * Decode a literal: booleans, numbers, quoted strings, single-line lists
     * and object literals. Anything else stays as its raw text.
     */
    Object parseValue(String raw) {
        String value = raw.trim();
        if (value.equals("true")) {
            return Boolean.TRUE;
        }
        if (value.equals("false")) {
            return Boolean.FALSE;
        }
        try {
            if (INTEGER.matcher(value).matches()) {
                return Long.parseLong(value);
            }
            if (DECIMAL.matcher(value).matches()) {
                return Double.parseDouble(value);
            }
        } catch (NumberFormatException e) {
            return value;
        }
        if (value.startsWith("\"") && new HclScanner(value).skipString(0) == value.length() && value.length() >= 2) {
            return unquote(value);
        }
        if (value.startsWith("[") && value.endsWith("]") && value.indexOf('\n') < 0) {
            return parseList(value.substring(1, value.length() - 1));
        }
        if (value.startsWith("{") && value.endsWith("}")) {
            // Object literal, e.g. tags = { Name = "x" }
            return parseBody(value.substring(1, value.length() - 1));
        }
        return value;
    }

    private List<Object> parseList(String inner) {
        HclScanner scanner = new HclScanner(inner);
        List<Object> items = new ArrayList<>();
        int start = 0;
        int depth = 0;
        int i = 0;
        while (i <= scanner.length()) {
            if (i == scanner.length() || (depth == 0 && scanner.charAt(i) == ',')) {
                String item = inner.substring(start, i).trim();
                if (!item.isEmpty()) {
                    items.add(parseValue(item));
                }
                start = i + 1;
                i++;
                continue;
            }
            char c = scanner.charAt(i);
            if (c == '"') {
                i = scanner.skipString(i);
                continue;
            }
            if (c == '[' || c == '{' || c == '(') {
                depth++;
            } else if (c == ']' || c == '}' || c == ')') {
                depth--;
            }
            i++;
        }
        return items;
    }

    private static String unquote(String quoted) {
        if (quoted.length() < 2 || !quoted.endsWith("\"")) {
            return quoted.startsWith("\"") ? quoted.substring(1) : quoted;
        }
        return quoted.substring(1, quoted.length() - 1)
                .replace("\\\"", "\"")
                .replace("\\\\", "\\");
    }
}
