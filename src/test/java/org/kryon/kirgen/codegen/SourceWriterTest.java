package org.kryon.kirgen.codegen;

import org.junit.jupiter.api.Test;
import org.kryon.kirgen.codegen.lua.LuaLiteralConverter;
import org.kryon.kirgen.codegen.python.PythonLiteralConverter;

import static org.junit.jupiter.api.Assertions.*;

public class SourceWriterTest {

    private final LuaLiteralConverter lua = new LuaLiteralConverter();

    @Test
    void indentsEachLineByItsOwnLevel() {
        SourceWriter out = new SourceWriter(2);
        out.line(0, "a").line(2, "b").line(1, "").line(1, "c");

        assertEquals("a\n    b\n\n  c\n", out.build());
    }

    @Test
    void blankLineNeverStacks() {
        SourceWriter out = new SourceWriter(4);
        out.blankLine();
        assertTrue(out.isEmpty());

        out.line(0, "x").blankLine().blankLine().line(0, "y");

        assertEquals("x\n\ny\n", out.build());
    }

    @Test
    void blockReindentsBody() {
        SourceWriter out = new SourceWriter(4);
        out.block(1, "if ok then\n        go()   \n    end", lua);

        assertEquals("    if ok then\n        go()\n    end\n", out.build());
    }

    @Test
    void verbatimKeepsTextAndAddsFinalNewline() {
        SourceWriter out = new SourceWriter(4);
        out.verbatim("  keep\r\n  as is").verbatim("done\n");

        assertEquals("  keep\r\n  as is\ndone\n", out.build());
    }

    @Test
    void blockDedentIgnoresBlankLinesAndFirstLine() {
        SourceWriter out = new SourceWriter(2);
        out.block(0, "a\n      b\n\n    c\n", lua);

        assertEquals("a\n  b\n\nc\n", out.build());
    }

    @Test
    void blockKeepsLuaLongStringLinesAsTheyAre() {
        SourceWriter out = new SourceWriter(4);
        out.block(2, "local s = [==[\nline two ]] \n  ]==] .. x\nprint(s)", lua);

        assertEquals("        local s = [==[\n"
                + "line two ]] \n"
                + "  ]==] .. x\n"
                + "        print(s)\n", out.build());
    }

    @Test
    void blockIgnoresBracketsInsideQuotesAndComments() {
        SourceWriter out = new SourceWriter(4);
        out.block(1, "local a = \"[[\" -- [ not long\n    b()", lua);

        assertEquals("    local a = \"[[\" -- [ not long\n    b()\n", out.build());
    }

    @Test
    void blockKeepsPythonTripleQuotedLinesAsTheyAre() {
        SourceWriter out = new SourceWriter(4);
        out.block(1, "doc = \"\"\"first\n  second\n\"\"\"\n    items = [[1], [2]]\n    print(doc)",
                new PythonLiteralConverter());

        assertEquals("    doc = \"\"\"first\n"
                + "  second\n"
                + "\"\"\"\n"
                + "    items = [[1], [2]]\n"
                + "    print(doc)\n", out.build());
    }
}
