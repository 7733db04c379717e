package org.kryon.kirgen.codegen.python;

import org.kryon.kirgen.codegen.LiteralConverter;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Python literal syntax: {@code None}, {@code True}/{@code False}, lists, dicts
 * and triple-quoted strings for multi-line text.
 */
public class PythonLiteralConverter extends LiteralConverter {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name);
    }

    @Override
    public String nullLiteral() {
        return "None";
    }

    @Override
    public String booleanLiteral(boolean value) {
        return value ? "True" : "False";
    }

    @Override
    public String stringLiteral(String value) {
        if (value.indexOf('\n') >= 0 && value.indexOf('\r') < 0 && isLongFormSafe(value)) {
            String body = value.replace("\\", "\\\\");
            String tripleQuoted = tripleQuoted(body, '"');
            if (tripleQuoted == null) {
                tripleQuoted = tripleQuoted(body, '\'');
            }
            if (tripleQuoted != null) {
                return tripleQuoted;
            }
        }
        return quoted(value);
    }

    private static String tripleQuoted(String body, char quote) {
        String delimiter = String.valueOf(quote).repeat(3);
        if (body.contains(delimiter) || body.endsWith(String.valueOf(quote))) {
            return null;
        }
        return delimiter + body + delimiter;
    }

    /**
     * Only triple-quoted strings may span lines.
     */
    @Override
    public String openStringAfter(String line, String open) {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (open != null) {
                if (c == '\\') {
                    i += 2;
                } else if (line.startsWith(open, i)) {
                    i += open.length();
                    open = null;
                } else {
                    i++;
                }
            } else if (line.startsWith("\"\"\"", i) || line.startsWith("'''", i)) {
                open = line.substring(i, i + 3);
                i += 3;
            } else if (c == '"' || c == '\'') {
                i = skipQuoted(line, i);
            } else if (c == '#') {
                return null;
            } else {
                i++;
            }
        }
        return open;
    }

    static String quoted(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    @Override
    protected String arrayLiteral(List<String> elements) {
        return "[" + String.join(", ", elements) + "]";
    }

    @Override
    protected String objectEntry(String key, String valueLiteral) {
        return quoted(key) + ": " + valueLiteral;
    }

    @Override
    protected String objectLiteral(List<String> entries) {
        return "{" + String.join(", ", entries) + "}";
    }

    @Override
    protected String nanLiteral() {
        return "float(\"nan\")";
    }

    @Override
    protected String infinityLiteral() {
        return "float(\"inf\")";
    }
}
