package com.vidnyan.tfguard.adapter.out.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Low-level lexical helpers over HCL text. Every method takes an index into
 * the text and returns the index just past the construct it skipped.
 * Unterminated constructs run to the end of the text.
 */
final class HclScanner {

    private static final Pattern HEREDOC_START = Pattern.compile("<<-?([A-Za-z_][A-Za-z0-9_]*)");

    private final String text;

    HclScanner(String text) {
        this.text = text;
    }

    int length() {
        return text.length();
    }

    char charAt(int i) {
        return text.charAt(i);
    }

    String substring(int from, int to) {
        return text.substring(from, to);
    }

    boolean startsWith(String prefix, int i) {
        return text.startsWith(prefix, i);
    }

    /**
     * 1-based line of the character at {@code index}.
     */
    int lineOf(int index) {
        int line = 1;
        int end = Math.min(index, text.length());
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Skip spaces, newlines and comments.
     */
    int skipTrivia(int i) {
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isCommentStart(i)) {
                i = skipComment(i);
            } else {
                break;
            }
        }
        return i;
    }

    /**
     * Skip spaces and tabs on the current line only.
     */
    int skipInlineSpace(int i) {
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    boolean isCommentStart(int i) {
        char c = text.charAt(i);
        return c == '#' || startsWith("//", i) || startsWith("/*", i);
    }

    int skipComment(int i) {
        if (startsWith("/*", i)) {
            int end = text.indexOf("*/", i + 2);
            return end < 0 ? text.length() : end + 2;
        }
        return skipToEndOfLine(i);
    }

    int skipToEndOfLine(int i) {
        int end = text.indexOf('\n', i);
        return end < 0 ? text.length() : end;
    }

    /**
     * Skip a quoted string starting at {@code i}, including {@code ${...}}
     * interpolations that may themselves contain strings.
     */
    int skipString(int i) {
        int j = i + 1;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '\\') {
                j += 2;
            } else if (c == '"') {
                return j + 1;
            } else if ((c == '$' || c == '%') && startsWith("{", j + 1)) {
                j = skipTemplate(j + 2);
            } else {
                j++;
            }
        }
        return text.length();
    }

    private int skipTemplate(int i) {
        int depth = 1;
        int j = i;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '"') {
                j = skipString(j);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return j + 1;
                }
            }
            j++;
        }
        return text.length();
    }

    /**
     * If a heredoc opens at {@code i}, return the index past its closing
     * marker line; otherwise -1.
     */
    int skipHeredoc(int i) {
        if (!startsWith("<<", i)) {
            return -1;
        }
        Matcher m = HEREDOC_START.matcher(text);
        m.region(i, text.length());
        if (!m.lookingAt()) {
            return -1;
        }
        String marker = m.group(1);
        int lineEnd = skipToEndOfLine(m.end());
        int pos = lineEnd + 1;
        while (pos < text.length()) {
            int next = skipToEndOfLine(pos);
            if (text.substring(pos, next).trim().equals(marker)) {
                return next;
            }
            pos = next + 1;
        }
        return text.length();
    }

    /**
     * Index of the brace closing the one at {@code open}, or -1 if the block
     * never closes.
     */
    int findMatchingBrace(int open) {
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"') {
                i = skipString(i);
                continue;
            }
            if (isCommentStart(i)) {
                i = skipComment(i);
                continue;
            }
            int heredocEnd = skipHeredoc(i);
            if (heredocEnd >= 0) {
                i = heredocEnd;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * End of an attribute value starting at {@code i}: the first newline or
     * comment outside any bracket, string or heredoc.
     */
    int findValueEnd(int i) {
        int depth = 0;
        int j = i;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '"') {
                j = skipString(j);
                continue;
            }
            int heredocEnd = skipHeredoc(j);
            if (heredocEnd >= 0) {
                j = heredocEnd;
                continue;
            }
            if (depth == 0 && (c == '\n' || isCommentStart(j))) {
                return j;
            }
            if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                if (depth == 0) {
                    return j;
                }
                depth--;
            }
            j++;
        }
        return text.length();
    }

    /**
     * Read an identifier ({@code [A-Za-z0-9_-]}) starting at {@code i}.
     */
    String readIdentifier(int i) {
        int j = i;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                j++;
            } else {
                break;
            }
        }
        return text.substring(i, j);
    }
}
