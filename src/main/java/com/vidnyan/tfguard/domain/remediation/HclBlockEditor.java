package com.vidnyan.tfguard.domain.remediation;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-based edits on the raw text of one block. Changes are as small as
 * possible: an existing assignment is rewritten in place, otherwise one line
 * is inserted before the closing brace.
 */
public final class HclBlockEditor {

    private static final String INDENT = "  ";

    private HclBlockEditor() {
    }

    /**
     * Set {@code key = value} directly inside the block.
     */
    public static String setAttribute(String block, String key, String value) {
        List<String> lines = Arrays.asList(expandSingleLine(block).split("\n", -1));
        Pattern assignment = assignmentPattern(key);
        int depth = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (depth == 1 && assignment.matcher(line).find()) {
                lines.set(i, indentOf(line) + key + " = " + value);
                return String.join("\n", lines);
            }
            depth += braceDelta(line);
        }
        return insertBeforeClose(block, INDENT + key + " = " + value + "\n");
    }

    /**
     * Set {@code key = value} inside the first nested block called
     * {@code nested}, creating that block when it is missing.
     */
    public static String setNestedAttribute(String block, String nested, String key, String value) {
        List<String> lines = Arrays.asList(expandSingleLine(block).split("\n", -1));
        Pattern opening = Pattern.compile("^\\s*" + Pattern.quote(nested) + "\\s*\\{");
        Pattern assignment = assignmentPattern(key);
        int depth = 0;
        int nestedStart = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (nestedStart < 0 && depth == 1 && opening.matcher(line).find()) {
                if (braceDelta(line) == 0) {
                    // Single-line block, e.g. root_block_device { volume_size = 8 }
                    String indent = indentOf(line);
                    String body = line.substring(line.indexOf('{') + 1, line.lastIndexOf('}')).trim();
                    StringBuilder expanded = new StringBuilder(indent).append(nested).append(" {\n");
                    if (!body.isEmpty() && !assignment.matcher(body).find()) {
                        expanded.append(indent).append(INDENT).append(body).append('\n');
                    }
                    expanded.append(indent).append(INDENT).append(key).append(" = ").append(value).append('\n')
                            .append(indent).append('}');
                    lines.set(i, expanded.toString());
                    return String.join("\n", lines);
                }
                nestedStart = i;
            } else if (nestedStart >= 0) {
                if (depth == 2 && assignment.matcher(line).find()) {
                    lines.set(i, indentOf(line) + key + " = " + value);
                    return String.join("\n", lines);
                }
                if (depth + braceDelta(line) == 1) {
                    String inner = indentOf(lines.get(nestedStart)) + INDENT;
                    StringBuilder sb = new StringBuilder();
                    for (int j = 0; j < lines.size(); j++) {
                        if (j == i) {
                            sb.append(inner).append(key).append(" = ").append(value).append('\n');
                        }
                        sb.append(lines.get(j));
                        if (j < lines.size() - 1) {
                            sb.append('\n');
                        }
                    }
                    return sb.toString();
                }
            }
            depth += braceDelta(line);
        }
        String newBlock = "\n" + INDENT + nested + " {\n" + INDENT + INDENT + key + " = " + value + "\n" + INDENT + "}\n";
        return insertBeforeClose(block, newBlock);
    }

    /**
     * Rewrite a block written on one line, e.g. {@code resource "a" "b" { x = 1 }},
     * so that its body sits on its own line.
     */
    static String expandSingleLine(String block) {
        if (block.indexOf('\n') >= 0) {
            return block;
        }
        int open = block.indexOf('{');
        int close = block.lastIndexOf('}');
        if (open < 0 || close < open || braceDelta(block) != 0) {
            return block;
        }
        String body = block.substring(open + 1, close).trim();
        String header = block.substring(0, open).stripTrailing();
        return header + " {\n" + (body.isEmpty() ? "" : INDENT + body + "\n") + block.substring(close);
    }

    static String insertBeforeClose(String block, String insertion) {
        int close = block.lastIndexOf('}');
        if (close < 0) {
            return block;
        }
        String head = block.substring(0, close);
        if (!head.endsWith("\n")) {
            head = head + "\n";
        }
        return head + insertion + block.substring(close);
    }

    private static Pattern assignmentPattern(String key) {
        return Pattern.compile("^\\s*" + Pattern.quote(key) + "\\s*=");
    }

    private static String indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /**
     * Net brace depth change of a line, ignoring quoted text and comments.
     */
    static int braceDelta(String line) {
        int delta = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
                continue;
            }
            if (c == '"') {
                quoted = true;
            } else if (c == '#' || (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/')) {
                break;
            } else if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }
}
