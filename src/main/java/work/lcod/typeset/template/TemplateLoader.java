package work.lcod.typeset.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Loads template documents (YAML or JSON, a top-level {@code template} list) into plain
 * lists, maps and scalars.
 */
public final class TemplateLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private TemplateLoader() {}

    public static TemplateDocument loadFromLocalFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new TemplateLoadException("Template file not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            return new TemplateDocument(path.toString(), parseTemplate(in, path.toString()));
        } catch (IOException ex) {
            throw new TemplateLoadException("Failed to read template: " + path, ex);
        }
    }

    public static TemplateDocument parse(String source, String name) {
        try {
            var root = YAML_MAPPER.readTree(source);
            return new TemplateDocument(name, extractEvents(root, name));
        } catch (IOException ex) {
            throw new TemplateLoadException("Failed to parse template " + name + ": " + ex.getMessage(), ex);
        }
    }

    private static List<Object> parseTemplate(InputStream in, String name) throws IOException {
        return extractEvents(YAML_MAPPER.readTree(in), name);
    }

    private static List<Object> extractEvents(JsonNode root, String name) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        if (!root.isObject() || !root.has("template")) {
            throw new TemplateLoadException("Template " + name + " must contain a top-level 'template' list");
        }
        var templateNode = root.get("template");
        if (templateNode.isNull()) {
            return List.of();
        }
        if (!templateNode.isArray()) {
            throw new TemplateLoadException("'template' must be a list in " + name);
        }
        var events = new ArrayList<Object>();
        for (var eventNode : templateNode) {
            events.add(convertNode(eventNode));
        }
        return events;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
