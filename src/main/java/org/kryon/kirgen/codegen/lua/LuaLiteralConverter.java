package org.kryon.kirgen.codegen.lua;

import org.kryon.kirgen.codegen.LiteralConverter;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lua literal syntax: {@code nil}, table constructors, {@code "..."} strings and
 * long brackets ({@code [[...]]}, {@code [=[...]=]}, ...) for multi-line text.
 */
public class LuaLiteralConverter extends LiteralConverter {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "goto", "if",
            "in", "local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while");

    @Override
    public String nullLiteral() {
        return "nil";
    }

    @Override
    public String booleanLiteral(boolean value) {
        return value ? "true" : "false";
    }

    @Override
    public String stringLiteral(String value) {
        if (value.indexOf('\n') >= 0 && value.indexOf('\r') < 0 && isLongFormSafe(value)) {
            return longBracket(value);
        }
        return quoted(value);
    }

    /**
     * Picks the lowest bracket level whose closer first appears where the
     * literal ends. The newline after the opener is dropped by the Lua lexer,
     * so content starting with a newline survives.
     */
    static String longBracket(String value) {
        for (int level = 0; ; level++) {
            String equals = "=".repeat(level);
            String closer = "]" + equals + "]";
            if ((value + closer).indexOf(closer) == value.length()) {
                return "[" + equals + "[\n" + value + closer;
            }
        }
    }

    /**
     * Long brackets and long comments ({@code --[[ ... ]]}) may span lines.
     */
    @Override
    public String openStringAfter(String line, String open) {
        int i = 0;
        while (i < line.length()) {
            if (open != null) {
                int close = line.indexOf(open, i);
                if (close < 0) return open;
                i = close + open.length();
                open = null;
                continue;
            }
            char c = line.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipQuoted(line, i);
            } else if (line.startsWith("--", i)) {
                open = longBracketCloser(line, i + 2);
                if (open == null) return null;
                i += 2 + open.length();
            } else if (c == '[') {
                open = longBracketCloser(line, i);
                i += open == null ? 1 : open.length();
            } else {
                i++;
            }
        }
        return open;
    }

    private static String longBracketCloser(String line, int start) {
        if (start >= line.length() || line.charAt(start) != '[') return null;
        int end = start + 1;
        while (end < line.length() && line.charAt(end) == '=') end++;
        if (end >= line.length() || line.charAt(end) != '[') return null;
        return "]" + "=".repeat(end - start - 1) + "]";
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
                        sb.append(String.format("\\%03d", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !RESERVED_WORDS.contains(name);
    }

    /**
     * Table key: bare when it is a valid identifier, {@code ["..."]} otherwise.
     */
    public String tableKey(String key) {
        return isIdentifier(key) ? key : "[" + quoted(key) + "]";
    }

    @Override
    protected String arrayLiteral(List<String> elements) {
        return "{" + String.join(",", elements) + "}";
    }

    @Override
    protected String objectEntry(String key, String valueLiteral) {
        return tableKey(key) + "=" + valueLiteral;
    }

    @Override
    protected String objectLiteral(List<String> entries) {
        return "{" + String.join(",", entries) + "}";
    }

    @Override
    protected String nanLiteral() {
        return "0/0";
    }

    @Override
    protected String infinityLiteral() {
        return "math.huge";
    }
}
