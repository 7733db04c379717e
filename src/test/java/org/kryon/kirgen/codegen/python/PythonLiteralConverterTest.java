package org.kryon.kirgen.codegen.python;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PythonLiteralConverterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PythonLiteralConverter converter = new PythonLiteralConverter();

    private String literal(String json) throws Exception {
        return converter.toLiteral(MAPPER.readTree(json));
    }

    @Test
    void scalars() throws Exception {
        assertEquals("None", literal("null"));
        assertEquals("True", literal("true"));
        assertEquals("False", literal("false"));
        assertEquals("12", literal("12"));
        assertEquals("0.75", literal("0.75"));
        assertEquals("\"text\"", literal("\"text\""));
    }

    @Test
    void nonFiniteNumbers() {
        assertEquals("float(\"nan\")", converter.toLiteral(DoubleNode.valueOf(Double.NaN)));
        assertEquals("-float(\"inf\")", converter.toLiteral(DoubleNode.valueOf(Double.NEGATIVE_INFINITY)));
    }

    @Test
    void shortStringsUseHexEscapes() {
        assertEquals("\"a\\x01b\"", converter.stringLiteral("a\u0001b"));
        assertEquals("\"tab\\there\"", converter.stringLiteral("tab\there"));
    }

    @Test
    void multiLineStringsAreTripleQuoted() {
        assertEquals("\"\"\"one\ntwo\"\"\"", converter.stringLiteral("one\ntwo"));
        assertEquals("\"\"\"path\nC:\\\\dir\"\"\"", converter.stringLiteral("path\nC:\\dir"));
    }

    @Test
    void tripleQuoteFallsBackWhenContentCollides() {
        assertEquals("'''say \"\"\"\nhi'''", converter.stringLiteral("say \"\"\"\nhi"));
        assertEquals("'''quote at end\n\"'''", converter.stringLiteral("quote at end\n\""));
        assertEquals("\"both \\\"\\\"\\\" and '''\\n\"", converter.stringLiteral("both \"\"\" and '''\n"));
    }

    @Test
    void listsAndDicts() throws Exception {
        assertEquals("[1, \"a\", None]", literal("[1, \"a\", null]"));
        assertEquals("{\"title\": \"T\", \"size\": [1, 2]}", literal("{\"title\": \"T\", \"size\": [1, 2]}"));
        assertEquals("{}", literal("{}"));
    }
}
