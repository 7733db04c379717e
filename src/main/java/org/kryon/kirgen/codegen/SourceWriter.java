package org.kryon.kirgen.codegen;

/**
 * Line-oriented output buffer. It keeps no indentation state: every call
 * takes the indentation level it writes at.
 */
public class SourceWriter {

    private final StringBuilder out = new StringBuilder(8192);
    private final String indentUnit;

    public SourceWriter(int indentWidth) {
        this.indentUnit = " ".repeat(Math.max(0, indentWidth));
    }

    public SourceWriter line(int indent, String text) {
        if (!text.isEmpty()) {
            out.append(indentUnit.repeat(indent)).append(text);
        }
        out.append('\n');
        return this;
    }

    /**
     * Starts a new paragraph: one empty line, unless the buffer is empty or
     * already ends with one.
     */
    public SourceWriter blankLine() {
        if (out.length() > 0 && !endsWith("\n\n")) {
            out.append('\n');
        }
        return this;
    }

    /**
     * Writes a multi-line body at {@code indent}, after removing the common
     * leading whitespace of its non-blank lines. Lines that continue a
     * multi-line string literal are copied as they are.
     */
    public SourceWriter block(int indent, String text, LiteralConverter strings) {
        String[] lines = text.replace("\r\n", "\n").strip().split("\n", -1);
        boolean[] continuesString = new boolean[lines.length];
        boolean[] leavesStringOpen = new boolean[lines.length];
        String open = null;
        for (int i = 0; i < lines.length; i++) {
            continuesString[i] = open != null;
            open = strings.openStringAfter(lines[i], open);
            leavesStringOpen[i] = open != null;
        }

        int common = commonIndent(lines, continuesString);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (continuesString[i]) {
                out.append(line).append('\n');
                continue;
            }
            // first line already lost its indentation to strip()
            if (i > 0 && !line.isBlank()) {
                line = line.substring(common);
            }
            line(indent, leavesStringOpen[i] ? line : line.stripTrailing());
        }
        return this;
    }

    /**
     * Copies preserved text exactly, adding only a final newline if it lacks one.
     */
    public SourceWriter verbatim(String text) {
        out.append(text);
        if (!text.endsWith("\n")) {
            out.append('\n');
        }
        return this;
    }

    public boolean isEmpty() {
        return out.length() == 0;
    }

    public String build() {
        return out.toString();
    }

    private boolean endsWith(String suffix) {
        int start = out.length() - suffix.length();
        return start >= 0 && out.substring(start).equals(suffix);
    }

    private static int commonIndent(String[] lines, boolean[] skipped) {
        int common = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (skipped[i] || line.isBlank()) continue;
            int leading = 0;
            while (leading < line.length() && (line.charAt(leading) == ' ' || line.charAt(leading) == '\t')) {
                leading++;
            }
            common = Math.min(common, leading);
        }
        return common == Integer.MAX_VALUE ? 0 : common;
    }
}
