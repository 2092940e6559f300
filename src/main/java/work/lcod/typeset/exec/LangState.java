package work.lcod.typeset.exec;

import java.util.Objects;
import work.lcod.typeset.geom.Dir;

public record LangState(Dir dir) {
    public static final LangState DEFAULT = new LangState(Dir.LTR);

    public LangState {
        Objects.requireNonNull(dir, "dir");
        if (!dir.isHorizontal()) {
            throw new IllegalArgumentException("Writing direction must be horizontal: " + dir);
        }
    }
}
