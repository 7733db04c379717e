package org.kryon.kirgen.codegen.lua;

import org.junit.jupiter.api.Test;
import org.kryon.kirgen.KirgenConfig;
import org.kryon.kirgen.model.KirDocument;

import static org.junit.jupiter.api.Assertions.*;
import static org.kryon.kirgen.TestUtils.decode;
import static org.kryon.kirgen.TestUtils.decodeSample;

public class LuaCodeGeneratorTest {

    private static final String HEADER = "-- Generated from .kir by Kryon Code Generator\n"
            + "-- Do not edit manually - regenerate from source\n"
            + "\n"
            + "local Reactive = require(\"kryon.reactive\")\n"
            + "local UI = require(\"kryon.dsl\")\n";

    private final LuaCodeGenerator generator = new LuaCodeGenerator(KirgenConfig.defaults());

    @Test
    void emptyDocumentIsAnEmptyLibrary() throws Exception {
        assertEquals(HEADER + "\nreturn {}\n", generator.generate(decode("{}"), "main"));
    }

    @Test
    void buttonHandlerIsWrappedInAnonymousFunction() throws Exception {
        String lua = generator.generate(decodeSample("button_app.kir"), "main");

        assertTrue(lua.contains("        onClick = function()\n"
                + "            print(\"Button clicked!\")\n"
                + "        end,\n"));
        // bound handlers are not repeated as module functions
        assertFalse(lua.contains("local function handleClick"));
    }

    @Test
    void reactiveVariableWithoutPreservedInitGetsState() throws Exception {
        KirDocument document = decode("{\"reactive_manifest\": {\"variables\": ["
                + "{\"name\": \"count\", \"type\": \"number\", \"initial_value\": \"0\"}]}}");

        String lua = generator.generate(document, "main");

        assertTrue(lua.contains("-- Reactive State\nlocal count = Reactive.state(0)\n"));
    }

    @Test
    void stateInitialValuesFollowTheirType() throws Exception {
        KirDocument document = decode("{\"reactive_manifest\": {\"variables\": ["
                + "{\"name\": \"label\", \"type\": \"string\", \"initial_value\": \"Hi\"},"
                + "{\"name\": \"quoted\", \"type\": \"string\", \"initial_value\": \"\\\"Hi\\\"\"},"
                + "{\"name\": \"items\", \"type\": \"table\", \"initial_value\": \"{1, 2}\"},"
                + "{\"name\": \"flag\", \"initial_value\": true},"
                + "{\"name\": \"nothing\"},"
                + "{\"name\": \"UI\", \"initial_value\": \"1\"}]}}");

        String lua = generator.generate(document, "main");

        assertTrue(lua.contains("local label = Reactive.state(\"Hi\")\n"));
        assertTrue(lua.contains("local quoted = Reactive.state(\"Hi\")\n"));
        assertTrue(lua.contains("local items = Reactive.state({1, 2})\n"));
        assertTrue(lua.contains("local flag = Reactive.state(true)\n"));
        assertTrue(lua.contains("local nothing = Reactive.state(nil)\n"));
        assertFalse(lua.contains("local UI = Reactive.state"));
    }

    @Test
    void componentDefinitionsExportExactlyTheirNames() throws Exception {
        String lua = generator.generate(decodeSample("components.kir"), "main");

        assertTrue(lua.contains("local function Card(props)\n    return UI.Column {\n"));
        assertTrue(lua.contains("local function Avatar(props)\n    return UI.Image {\n"));
        assertTrue(lua.endsWith("\nreturn {\n    Card = Card,\n    Avatar = Avatar,\n}\n"));
    }

    @Test
    void definitionWithoutTemplateIsAnEmptyContainer() throws Exception {
        String lua = generator.generate(decode("{\"component_definitions\": [{\"name\": \"Spacer\"}]}"), "main");

        assertTrue(lua.contains("local function Spacer(props)\n    return UI.Container {\n    }\nend\n"));
    }

    @Test
    void preservedDefinitionSourceIsCopied() throws Exception {
        String source = "local function Card(props)\n  return UI.Text { text = props.title }\nend";
        KirDocument document = decode("{\"component_definitions\": [{\"name\": \"Card\", \"source\": "
                + "\"local function Card(props)\\n  return UI.Text { text = props.title }\\nend\"}]}");

        String lua = generator.generate(document, "main");

        assertTrue(lua.contains(source + "\n"));
        assertTrue(lua.endsWith("return {\n    Card = Card,\n}\n"));
    }

    @Test
    void appTakesPrecedenceOverDefinitions() throws Exception {
        KirDocument document = decode("{\"root\": {\"type\": \"Column\"},"
                + " \"component_definitions\": [{\"name\": \"Card\"}]}");

        String lua = generator.generate(document, "main");

        assertTrue(lua.contains("local root = UI.Column {\n}\n"));
        assertTrue(lua.endsWith("return root\n"));
        assertFalse(lua.contains("Card"));
    }

    @Test
    void libraryExportsHelperFunctions() throws Exception {
        KirDocument document = decode("{\"logic_block\": {\"functions\": ["
                + "{\"name\": \"helper\", \"sources\": [{\"language\": \"lua\", \"source\": \"return 1\"}]},"
                + "{\"name\": \"pyOnly\", \"sources\": [{\"language\": \"python\", \"source\": \"return 2\"}]}]}}");

        String lua = generator.generate(document, "main");

        assertEquals(HEADER + "\n"
                + "local function helper()\n"
                + "    return 1\n"
                + "end\n"
                + "\n"
                + "return {\n"
                + "    helper = helper,\n"
                + "}\n", lua);
    }

    @Test
    void declaredExportsSkipNamesLuaCannotBind() throws Exception {
        String lua = generator.generate(decode("{\"exports\": [\"format\", \"bad-name\", \"end\"]}"), "main");

        assertTrue(lua.endsWith("return {\n    format = format,\n}\n"));
    }

    @Test
    void preservedDeclarationsAreReproduced() throws Exception {
        String lua = generator.generate(decodeSample("preserved_counter.kir"), "main");

        assertEquals("-- Generated from .kir by Kryon Code Generator\n"
                + "-- Do not edit manually - regenerate from source\n"
                + "\n"
                + "local Reactive = require(\"kryon.reactive\")\n"
                + "local UI = require(\"kryon.dsl\")\n"
                + "local utils = require(\"components.utils\")\n"
                + "\n"
                + "local count = Reactive.state(10)\n"
                + "\n"
                + "local function increment()\n"
                + "    count:set(count:get() + 1)\n"
                + "end\n"
                + "\n"
                + "-- UI Component Tree\n"
                + "local root = UI.Column {\n"
                + "\n"
                + "    UI.Text {\n"
                + "        text = \"Count\",\n"
                + "    }\n"
                + "}\n"
                + "\n"
                + "return root\n", lua);
    }

    @Test
    void regeneratingFromPreservedSourceIsIdempotent() throws Exception {
        KirDocument document = decodeSample("todo_list.kir");
        String first = generator.generate(document, "main");

        document.sources.put("main", first);
        String second = generator.generate(document, "main");

        assertEquals(first, second);
        assertEquals(first, generator.generate(document, "main"));
    }

    @Test
    void wholeModuleSourceGetsFinalNewline() throws Exception {
        KirDocument document = decode("{\"sources\": {\"main\": \"return 42\", \"other\": \"x\"}}");

        assertEquals("return 42\n", generator.generate(document, "main"));
    }

    @Test
    void preservedTextFromAnotherLanguageIsIgnored() throws Exception {
        KirDocument document = decode("{\"metadata\": {\"source_language\": \"python\"},"
                + " \"sources\": {\"main\": \"x = 1\"},"
                + " \"source_declarations\": {\"module_init\": \"import os\"}}");

        String lua = generator.generate(document, "main");

        assertEquals(HEADER + "\nreturn {}\n", lua);
    }

    @Test
    void appExportCarriesPartialWindowMetadata() throws Exception {
        KirDocument document = decode("{\"app\": {\"windowTitle\": \"Only title\"}, \"root\": {\"type\": \"Column\"}}");

        String lua = generator.generate(document, "main");

        assertTrue(lua.endsWith("return {\n"
                + "    root = root,\n"
                + "    window = {\n"
                + "        title = \"Only title\",\n"
                + "    },\n"
                + "}\n"));
    }

    @Test
    void verbatimSectionsAppearInOrder() throws Exception {
        KirDocument document = decode("{\"root\": {\"type\": \"Column\"}, \"source_declarations\": {"
                + "\"module_init\": \"local init = true\","
                + "\"module_constants\": \"local MAX = 10\","
                + "\"initialization\": \"utils.setup()\","
                + "\"app_export\": \"return { root = UI.Column {} }\"}}");

        String lua = generator.generate(document, "main");

        assertEquals(HEADER + "\n"
                + "local init = true\n"
                + "\n"
                + "local MAX = 10\n"
                + "\n"
                + "utils.setup()\n"
                + "\n"
                + "return { root = UI.Column {} }\n", lua);
    }

    @Test
    void blankPreservedFunctionDoesNotHideItsDefinition() throws Exception {
        KirDocument document = decode("{\"component_definitions\": [{\"name\": \"Card\", \"template\": {\"type\": \"Text\"}}],"
                + " \"source_declarations\": {\"functions\": [{\"name\": \"Card\", \"source\": \"\"}]}}");

        String lua = generator.generate(document, "main");

        assertTrue(lua.contains("local function Card(props)\n    return UI.Text {\n"));
        assertTrue(lua.endsWith("return {\n    Card = Card,\n}\n"));
    }

    @Test
    void helperKeepsLongStringContent() throws Exception {
        KirDocument document = decode("{\"logic_block\": {\"functions\": [{\"name\": \"banner\", \"sources\": "
                + "[{\"language\": \"lua\", \"source\": \"local s = [[\\nline two]]\\nreturn s\"}]}]}}");

        String lua = generator.generate(document, "main");

        assertTrue(lua.contains("local function banner()\n"
                + "    local s = [[\n"
                + "line two]]\n"
                + "    return s\n"
                + "end\n"));
    }

    @Test
    void namesLuaCannotDeclareAreSkipped() throws Exception {
        KirDocument document = decode("{\"component_definitions\": [{\"name\": \"my-card\"}, {\"name\": \"Card\"}],"
                + " \"reactive_manifest\": {\"variables\": [{\"name\": \"bad-name\", \"initial_value\": 1},"
                + " {\"name\": \"local\", \"initial_value\": 2}, {\"name\": \"count\", \"initial_value\": 3}]}}");

        String lua = generator.generate(document, "main");

        assertFalse(lua.contains("my-card"));
        assertFalse(lua.contains("bad-name"));
        assertFalse(lua.contains("local local"));
        assertTrue(lua.contains("-- Reactive State\nlocal count = Reactive.state(3)\n"));
        assertTrue(lua.endsWith("return {\n    Card = Card,\n}\n"));
    }
}
