package work.lcod.typeset.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.typeset.exec.State;
import work.lcod.typeset.template.StyleOptions;

/**
 * Reads the base formatting state from a TOML style file ({@code typeset.toml}).
 *
 * <pre>
 * [page]
 * paper = "a5"
 * margins = "2cm"
 *
 * [font]
 * families = ["Libertinus Serif", "serif"]
 * size = "10pt"
 * </pre>
 */
public final class StyleConfigLoader {
    public static final String DEFAULT_FILE_NAME = "typeset.toml";

    private StyleConfigLoader() {}

    public static State load(Path path) {
        return load(path, State.DEFAULT);
    }

    public static State load(Path path, State base) {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read style file: " + path, ex);
        }
        try {
            return parse(raw, base);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid style file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static State parse(String raw, State base) {
        TomlParseResult result = Toml.parse(raw);
        if (result.hasErrors()) {
            String message = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException(message);
        }

        State state = base;
        TomlTable page = result.getTable("page");
        if (page != null) {
            state = StyleOptions.page(state, toMap(page));
        }
        TomlTable font = result.getTable("font");
        if (font != null) {
            state = StyleOptions.font(state, toMap(font));
        }
        TomlTable par = result.getTable("par");
        if (par != null) {
            state = StyleOptions.par(state, toMap(par));
        }
        TomlTable align = result.getTable("align");
        if (align != null) {
            state = StyleOptions.align(state, toMap(align));
        }
        TomlTable lang = result.getTable("lang");
        if (lang != null) {
            state = StyleOptions.lang(state, toMap(lang));
        }
        return state;
    }

    private static Map<String, Object> toMap(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            Object value = table.get(List.of(key));
            if (value instanceof TomlTable nested) {
                map.put(key, toMap(nested));
            } else if (value instanceof TomlArray array) {
                map.put(key, array.toList());
            } else {
                map.put(key, value);
            }
        }
        return map;
    }
}
