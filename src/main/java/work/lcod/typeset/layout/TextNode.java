package work.lcod.typeset.layout;

import java.util.Objects;

public record TextNode(String text, TextProps props) {
    public TextNode {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(props, "props");
    }

    public TextNode append(String more) {
        return new TextNode(text + more, props);
    }
}
