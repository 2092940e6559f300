package work.lcod.typeset.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void parsesYamlEvents() {
        var document = TemplateLoader.parse("""
            template:
              - text: Hello
              - space
              - font: {size: 12pt}
                body:
                  - text: big
            """, "inline.yaml");

        assertEquals("inline.yaml", document.name());
        assertEquals(3, document.events().size());
        assertEquals(Map.of("text", "Hello"), document.events().get(0));
        assertEquals("space", document.events().get(1));
        var styled = (Map<?, ?>) document.events().get(2);
        assertEquals(Map.of("size", "12pt"), styled.get("font"));
        assertEquals(List.of(Map.of("text", "big")), styled.get("body"));
    }

    @Test
    void parsesJsonEvents() {
        var document = TemplateLoader.parse("{\"template\": [{\"v\": 12}, \"parbreak\"]}", "inline.json");
        assertEquals(List.of(Map.of("v", 12), "parbreak"), document.events());
    }

    @Test
    void emptySourceHasNoEvents() {
        assertTrue(TemplateLoader.parse("", "empty.yaml").events().isEmpty());
        assertTrue(TemplateLoader.parse("template:\n", "null.yaml").events().isEmpty());
    }

    @Test
    void rejectsDocumentsWithoutTemplateList() {
        assertThrows(TemplateLoadException.class, () -> TemplateLoader.parse("compose: []", "wrong.yaml"));
        assertThrows(TemplateLoadException.class, () -> TemplateLoader.parse("template: hello", "scalar.yaml"));
        assertThrows(TemplateLoadException.class, () -> TemplateLoader.parse("template: [unclosed", "broken.yaml"));
    }

    @Test
    void loadsFromFile() throws Exception {
        Path file = tempDir.resolve("doc.yaml");
        Files.writeString(file, "template:\n  - text: from disk\n");

        var document = TemplateLoader.loadFromLocalFile(file);
        assertEquals(file.toString(), document.name());
        assertEquals(List.of(Map.of("text", "from disk")), document.events());
    }

    @Test
    void reportsMissingFile() {
        var ex = assertThrows(TemplateLoadException.class,
            () -> TemplateLoader.loadFromLocalFile(tempDir.resolve("missing.yaml")));
        assertTrue(ex.getMessage().startsWith("Template file not found"));
    }
}
