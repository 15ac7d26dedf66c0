package me.golemcore.agentloop.domain.parser;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Best-effort normalizer for JSON-ish text produced by language models.
 *
 * <p>
 * This is not a JSON grammar. It applies a fixed sequence of textual
 * transformations, each of which leaves well-formed JSON untouched:
 * <ol>
 * <li>keep only the interior of the first fenced block, if any</li>
 * <li>keep only the first balanced top-level object</li>
 * <li>append missing closers and drop unmatched ones</li>
 * <li>drop commas directly before a closing brace or bracket</li>
 * <li>rewrite single-quoted tokens as double-quoted strings</li>
 * <li>escape raw newlines, tabs and other control characters inside
 * strings</li>
 * </ol>
 * Only the transformations pinned by tests are guaranteed; arbitrary malformed
 * input may still fail to parse afterwards.
 */
public final class JsonRepair {

    private static final String FENCE = "```";
    private static final Pattern LANGUAGE_TAG = Pattern.compile("\\s*[A-Za-z0-9_+-]*\\s*");

    private JsonRepair() {
    }

    /**
     * Runs the full repair pipeline.
     */
    public static String repair(String raw) {
        if (raw == null) {
            return "";
        }
        String text = extractFencedBlock(raw);
        text = keepFirstObject(text);
        text = balanceBrackets(text);
        text = stripTrailingCommas(text);
        text = normalizeSingleQuotes(text);
        return escapeControlCharsInStrings(text);
    }

    /**
     * Step 1. Returns the interior of the first fenced block, skipping a
     * language tag on the opening line. Text that already looks like a bare
     * object is returned trimmed, so fences inside string values survive.
     */
    static String extractFencedBlock(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return trimmed;
        }
        int afterFence = open + FENCE.length();
        int lineEnd = text.indexOf('\n', afterFence);
        String openingLine = lineEnd >= 0 ? text.substring(afterFence, lineEnd) : text.substring(afterFence);
        int start = afterFence;
        if (LANGUAGE_TAG.matcher(openingLine).matches()) {
            start = lineEnd >= 0 ? lineEnd + 1 : text.length();
        }
        int close = text.indexOf(FENCE, start);
        String inner = close >= 0 ? text.substring(start, close) : text.substring(start);
        return inner.trim();
    }

    /**
     * Step 2. Drops anything before the first {@code '{'} and anything after
     * the point where that object closes. An object that never closes is kept
     * to the end of the text.
     */
    static String keepFirstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return text.trim();
        }
        boolean inString = false;
        boolean escaped = false;
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return text.substring(start).trim();
    }

    /**
     * Step 3. Closes an unterminated string, closes every open brace/bracket in
     * nesting order and discards closers that match nothing.
     */
    static String balanceBrackets(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
            case '"' -> {
                inString = true;
                out.append(c);
            }
            case '{', '[' -> {
                open.push(c);
                out.append(c);
            }
            case '}', ']' -> closeBracket(c, open, out);
            default -> out.append(c);
            }
        }
        if (inString) {
            if (escaped) {
                out.setLength(out.length() - 1);
            }
            out.append('"');
        }
        while (!open.isEmpty()) {
            out.append(closerFor(open.pop()));
        }
        return out.toString();
    }

    private static void closeBracket(char closer, Deque<Character> open, StringBuilder out) {
        char opener = closer == '}' ? '{' : '[';
        if (!open.contains(opener)) {
            return;
        }
        while (open.peek() != opener) {
            out.append(closerFor(open.pop()));
        }
        open.pop();
        out.append(closer);
    }

    /**
     * Step 4. Removes a comma when the next non-whitespace character closes an
     * object or array.
     */
    static String stripTrailingCommas(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == ',') {
                int next = i + 1;
                while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
                    next++;
                }
                if (next < text.length() && (text.charAt(next) == '}' || text.charAt(next) == ']')) {
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Step 5. A single quote outside any double-quoted string starts a
     * single-quoted token, which is rewritten as a double-quoted string: the
     * delimiters become double quotes, embedded double quotes are escaped and
     * {@code \'} is unescaped. Apostrophes inside double-quoted strings are
     * left alone.
     */
    static String normalizeSingleQuotes(String text) {
        if (text.indexOf('\'') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + 8);
        boolean inString = false;
        boolean escaped = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                i++;
                continue;
            }
            if (c == '"') {
                inString = true;
                out.append(c);
                i++;
            } else if (c == '\'') {
                i = copySingleQuoted(text, i + 1, out);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int copySingleQuoted(String text, int from, StringBuilder out) {
        out.append('"');
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == '\'') {
                    out.append('\'');
                } else {
                    out.append(c).append(next);
                }
                i += 2;
                continue;
            }
            if (c == '\'') {
                out.append('"');
                return i + 1;
            }
            if (c == '"') {
                out.append("\\\"");
            } else {
                out.append(c);
            }
            i++;
        }
        out.append('"');
        return i;
    }

    /**
     * Step 6. Escapes literal control characters that appear inside string
     * values.
     */
    static String escapeControlCharsInStrings(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!inString) {
                if (c == '"') {
                    inString = true;
                }
                out.append(c);
                continue;
            }
            if (escaped) {
                escaped = false;
                out.append(c);
            } else if (c == '\\') {
                escaped = true;
                out.append(c);
            } else if (c == '"') {
                inString = false;
                out.append(c);
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c < 0x20) {
                out.append(String.format("\\u%04x", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static char closerFor(char opener) {
        return opener == '{' ? '}' : ']';
    }
}
