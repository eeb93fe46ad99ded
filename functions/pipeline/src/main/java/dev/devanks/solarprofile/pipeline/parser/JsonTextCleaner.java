package dev.devanks.solarprofile.pipeline.parser;

import org.springframework.web.util.HtmlUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Repairs the defects the monitoring API is known to put into its JSON:
 * leaked JavaScript members and expressions, HTML entities, invalid escapes,
 * raw control characters inside strings, trailing commas and unclosed brackets.
 */
public class JsonTextCleaner {

    // viewDashboard:true, viewReports : someFn(), ...
    private static final Pattern JS_VIEW_MEMBER = Pattern.compile("\\s*view[A-Za-z]+\\s*:\\s*[^,\\n]+,?");
    // "isPublic": true && false && true,
    private static final Pattern JS_BOOLEAN_EXPRESSION = Pattern.compile("\\s*:\\s*true\\s*&&.*?,");

    private static final String VALID_ESCAPES = "\"\\/bfnrtu";

    public String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = JS_VIEW_MEMBER.matcher(text).replaceAll("");
        cleaned = JS_BOOLEAN_EXPRESSION.matcher(cleaned).replaceAll(": false,");
        cleaned = HtmlUtils.htmlUnescape(cleaned);
        return repairStructure(cleaned);
    }

    /**
     * Single pass over the text that keeps track of string literals and open brackets.
     */
    String repairStructure(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
                    if (next != 0 && VALID_ESCAPES.indexOf(next) >= 0) {
                        out.append(c).append(next);
                        i++;
                    } else {
                        out.append("\\\\");
                    }
                } else if (c == '"') {
                    out.append(c);
                    inString = false;
                } else if (c < 0x20) {
                    out.append(escapeControl(c));
                } else {
                    out.append(c);
                }
                continue;
            }

            if (c == '"') {
                out.append(c);
                inString = true;
            } else if (c == '{' || c == '[') {
                out.append(c);
                open.push(c);
            } else if (c == '}' || c == ']') {
                closeBracket(out, open, c);
            } else {
                out.append(c);
            }
        }

        if (inString) {
            out.append('"');
        }
        while (!open.isEmpty()) {
            dropTrailingComma(out);
            out.append(closerOf(open.pop()));
        }
        return out.toString();
    }

    private void closeBracket(StringBuilder out, Deque<Character> open, char closer) {
        char opener = closer == '}' ? '{' : '[';
        if (!open.contains(opener)) {
            return; // nothing to close, drop it
        }
        while (open.peek() != opener) {
            dropTrailingComma(out);
            out.append(closerOf(open.pop()));
        }
        open.pop();
        dropTrailingComma(out);
        out.append(closer);
    }

    private static void dropTrailingComma(StringBuilder out) {
        int i = out.length() - 1;
        while (i >= 0 && Character.isWhitespace(out.charAt(i))) {
            i--;
        }
        if (i >= 0 && out.charAt(i) == ',') {
            out.deleteCharAt(i);
        }
    }

    private static char closerOf(char opener) {
        return opener == '{' ? '}' : ']';
    }

    private static String escapeControl(char c) {
        switch (c) {
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\t':
                return "\\t";
            case '\b':
                return "\\b";
            case '\f':
                return "\\f";
            default:
                return String.format("\\u%04x", (int) c);
        }
    }
}
