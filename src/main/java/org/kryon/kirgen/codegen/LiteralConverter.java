package org.kryon.kirgen.codegen;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON values to literal text of a target language.
 *
 * Subclasses supply the target syntax for each value shape; number rendering
 * is shared. Implementations are stateless.
 */
public abstract class LiteralConverter {

    public String toLiteral(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return nullLiteral();
        }
        if (value.isBoolean()) {
            return booleanLiteral(value.booleanValue());
        }
        if (value.isNumber()) {
            return numberLiteral(value);
        }
        if (value.isTextual()) {
            return stringLiteral(value.textValue());
        }
        if (value.isArray()) {
            List<String> elements = new ArrayList<>();
            for (JsonNode element : value) {
                elements.add(toLiteral(element));
            }
            return arrayLiteral(elements);
        }
        if (value.isObject()) {
            List<String> entries = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.add(objectEntry(field.getKey(), toLiteral(field.getValue())));
            }
            return objectLiteral(entries);
        }
        // binary / POJO nodes have no literal form
        return nullLiteral();
    }

    /**
     * Exact integers that fit a signed 32-bit int render without a decimal
     * point; everything else renders as the shortest plain decimal that reads
     * back to the same double. Integral values outside the 64-bit range pass
     * through {@code double} and lose precision.
     */
    protected String numberLiteral(JsonNode value) {
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return Integer.toString(value.intValue());
        }
        double number = value.doubleValue();
        if (Double.isNaN(number)) {
            return nanLiteral();
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? infinityLiteral() : "-" + infinityLiteral();
        }
        if (number == (double) (int) number) {
            return Integer.toString((int) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    public abstract String nullLiteral();

    public abstract String booleanLiteral(boolean value);

    public abstract String stringLiteral(String value);

    protected abstract String arrayLiteral(List<String> elements);

    protected abstract String objectEntry(String key, String valueLiteral);

    protected abstract String objectLiteral(List<String> entries);

    protected abstract String nanLiteral();

    protected abstract String infinityLiteral();

    /**
     * Scans one line of target source for a multi-line string literal left
     * open at its end.
     *
     * @param open closing delimiter of the literal open at the start of the
     *             line, or {@code null}
     * @return closing delimiter still open after the line, or {@code null}
     */
    public abstract String openStringAfter(String line, String open);

    /**
     * @return index just past the closing quote, or the line length when the
     * quoted string runs to the end of the line
     */
    protected static int skipQuoted(String line, int start) {
        char quote = line.charAt(start);
        for (int i = start + 1; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i + 1;
            }
        }
        return line.length();
    }

    /**
     * Long string forms only carry printable text, newlines and tabs.
     */
    protected static boolean isLongFormSafe(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 && c != '\n' && c != '\t') return false;
            if (c == 0x7f) return false;
        }
        return true;
    }
}
