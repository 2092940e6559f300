package work.lcod.typeset.layout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.typeset.geom.Gen;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Linear;
import work.lcod.typeset.geom.Sides;

/**
 * Converts a layout tree into plain maps and lists so it can be written as JSON or YAML.
 */
public final class TreeSerializer {
    private TreeSerializer() {}

    public static Map<String, Object> toMap(Tree tree) {
        var runs = new ArrayList<Object>(tree.runs().size());
        for (PageRun run : tree.runs()) {
            runs.add(toMap(run));
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("pages", runs);
        return map;
    }

    public static Map<String, Object> toMap(PageRun run) {
        var map = new LinkedHashMap<String, Object>();
        map.put("width", length(run.size().width()));
        map.put("height", length(run.size().height()));
        map.put("child", node(run.child()));
        return map;
    }

    public static Map<String, Object> node(LayoutNode node) {
        var map = new LinkedHashMap<String, Object>();
        if (node instanceof PadNode pad) {
            map.put("type", "pad");
            map.put("padding", sides(pad.padding()));
            map.put("child", node(pad.child()));
        } else if (node instanceof StackNode stack) {
            map.put("type", "stack");
            map.put("dirs", gen(stack.dirs()));
            var children = new ArrayList<Object>(stack.children().size());
            for (StackChild child : stack.children()) {
                children.add(stackChild(child));
            }
            map.put("children", children);
        } else if (node instanceof ParNode par) {
            map.put("type", "par");
            map.put("dir", lower(par.dir()));
            map.put("lineSpacing", length(par.lineSpacing()));
            var children = new ArrayList<Object>(par.children().size());
            for (ParChild child : par.children()) {
                children.add(parChild(child));
            }
            map.put("children", children);
        } else if (node instanceof FixedNode fixed) {
            map.put("type", "fixed");
            fixed.width().ifPresent(width -> map.put("width", width.toString()));
            fixed.height().ifPresent(height -> map.put("height", height.toString()));
            map.put("child", node(fixed.child()));
        }
        return map;
    }

    private static Map<String, Object> stackChild(StackChild child) {
        var map = new LinkedHashMap<String, Object>();
        if (child instanceof StackChild.Spacing spacing) {
            map.put("spacing", length(spacing.amount()));
        } else if (child instanceof StackChild.Any any) {
            map.put("aligns", gen(any.aligns()));
            map.put("node", node(any.node()));
        }
        return map;
    }

    private static Map<String, Object> parChild(ParChild child) {
        var map = new LinkedHashMap<String, Object>();
        if (child instanceof ParChild.Spacing spacing) {
            map.put("spacing", length(spacing.amount()));
        } else if (child instanceof ParChild.Text text) {
            map.put("text", text.node().text());
            map.put("align", lower(text.align()));
            map.put("props", props(text.node().props()));
        } else if (child instanceof ParChild.Linebreak) {
            map.put("linebreak", true);
        } else if (child instanceof ParChild.Any any) {
            map.put("align", lower(any.align()));
            map.put("node", node(any.node()));
        }
        return map;
    }

    private static Map<String, Object> props(TextProps props) {
        var map = new LinkedHashMap<String, Object>();
        map.put("families", List.copyOf(props.families()));
        map.put("size", length(props.size()));
        if (props.strong()) {
            map.put("strong", true);
        }
        if (props.emph()) {
            map.put("emph", true);
        }
        return map;
    }

    private static Map<String, Object> sides(Sides<Linear> sides) {
        var map = new LinkedHashMap<String, Object>();
        map.put("left", sides.left().toString());
        map.put("top", sides.top().toString());
        map.put("right", sides.right().toString());
        map.put("bottom", sides.bottom().toString());
        return map;
    }

    private static Map<String, Object> gen(Gen<? extends Enum<?>> gen) {
        var map = new LinkedHashMap<String, Object>();
        map.put("cross", lower(gen.cross()));
        map.put("main", lower(gen.main()));
        return map;
    }

    private static double length(Length length) {
        return length.pt();
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
