package org.kryon.kirgen.codegen.lua;

import org.junit.jupiter.api.Test;
import org.kryon.kirgen.codegen.EmitMode;
import org.kryon.kirgen.codegen.EventHandlerResolver;
import org.kryon.kirgen.codegen.SourceWriter;
import org.kryon.kirgen.model.KirDocument;

import static org.junit.jupiter.api.Assertions.*;
import static org.kryon.kirgen.TestUtils.decode;

public class LuaComponentEmitterTest {

    private static String emit(String rootJson, EmitMode mode) throws Exception {
        KirDocument document = decode("{\"root\": " + rootJson + "}");
        LuaComponentEmitter emitter = new LuaComponentEmitter(
                new LuaLiteralConverter(), new EventHandlerResolver("lua"), document.logicBlock);
        SourceWriter out = new SourceWriter(4);
        emitter.emit(document.root, document.root.root(), mode, out, 0, "");
        return out.build();
    }

    @Test
    void defaultValuedPropertiesAreOmitted() throws Exception {
        String lua = emit("{\"type\": \"Text\", \"width\": \"0.0px\", \"height\": 0, \"padding\": -2,"
                + " \"fontSize\": 0, \"fontWeight\": 400, \"opacity\": 1, \"visible\": true,"
                + " \"flexDirection\": \"row\", \"margin\": \"10\"}", EmitMode.inline());

        assertEquals("UI.Text {\n}\n", lua);
    }

    @Test
    void nonDefaultValuesAreWrittenInFixedOrder() throws Exception {
        String lua = emit("{\"type\": \"Row\", \"flexDirection\": \"column\", \"visible\": false,"
                + " \"opacity\": 0.5, \"fontWeight\": 700, \"height\": 40, \"width\": \"100%\"}", EmitMode.inline());

        assertEquals("UI.Row {\n"
                + "    width = \"100%\",\n"
                + "    height = 40,\n"
                + "    fontWeight = 700,\n"
                + "    opacity = 0.5,\n"
                + "    visible = false,\n"
                + "    layoutDirection = \"column\",\n"
                + "}\n", lua);
    }

    @Test
    void unknownTypesBecomeContainers() throws Exception {
        assertEquals("local root = UI.Container {\n}\n", emit("{\"type\": \"Spinner\"}", EmitMode.named("root")));
        assertEquals("return UI.Container {\n}\n", emit("{}", EmitMode.returned()));
    }

    @Test
    void forEachWritesNonDefaultIndexAndRendersEveryChild() throws Exception {
        String lua = emit("{\"type\": \"ForEach\", \"custom_data\": {\"each_source\": [1, 2],"
                + " \"each_item_name\": \"row\", \"each_index_name\": \"i\"},"
                + " \"children\": [{\"type\": \"Text\", \"text\": \"x\"}, {\"type\": \"Text\", \"text\": \"y\"}]}",
                EmitMode.inline());

        assertEquals("UI.ForEach {\n"
                + "    as = \"row\",\n"
                + "    index = \"i\",\n"
                + "    each = {1,2},\n"
                + "\n"
                + "    render = function(row, row_index)\n"
                + "        return\n"
                + "            UI.Text {\n"
                + "                text = \"x\",\n"
                + "            },\n"
                + "            UI.Text {\n"
                + "                text = \"y\",\n"
                + "            }\n"
                + "    end,\n"
                + "}\n", lua);
    }

    @Test
    void forEachIndexNamedIndexIsImplicit() throws Exception {
        String lua = emit("{\"type\": \"ForEach\", \"custom_data\": {\"each_index_name\": \"index\"},"
                + " \"children\": [{\"type\": \"Text\"}]}", EmitMode.inline());

        assertFalse(lua.contains("index ="));
        assertFalse(lua.contains("as ="));
        assertTrue(lua.contains("render = function(item, item_index)"));
    }

    @Test
    void everyResolvedEventBecomesAnInlineFunction() throws Exception {
        KirDocument document = decode("{"
                + "\"root\": {\"id\": 9, \"type\": \"Input\", \"placeholder\": \"Name\"},"
                + "\"logic_block\": {"
                + "  \"functions\": ["
                + "    {\"name\": \"changed\", \"sources\": [{\"language\": \"lua\", \"source\": \"if x then\\n  y()\\nend\"}]},"
                + "    {\"name\": \"left\", \"sources\": [{\"language\": \"kry\", \"source\": \"{ log(\\\"blur\\\") }\"}]}"
                + "  ],"
                + "  \"event_bindings\": ["
                + "    {\"component_id\": 9, \"event_type\": \"blur\", \"handler_name\": \"left\"},"
                + "    {\"component_id\": 9, \"event_type\": \"change\", \"handler_name\": \"changed\"}"
                + "  ]"
                + "}}");
        LuaComponentEmitter emitter = new LuaComponentEmitter(
                new LuaLiteralConverter(), new EventHandlerResolver("lua"), document.logicBlock);
        SourceWriter out = new SourceWriter(4);
        emitter.emit(document.root, document.root.root(), EmitMode.inline(), out, 0, "");

        assertEquals("UI.Input {\n"
                + "    placeholder = \"Name\",\n"
                + "    onChange = function()\n"
                + "        if x then\n"
                + "          y()\n"
                + "        end\n"
                + "    end,\n"
                + "    onBlur = function()\n"
                + "        log(\"blur\")\n"
                + "    end,\n"
                + "}\n", out.build());
    }
}
