package work.lcod.typeset.diag;

import java.util.Objects;

/**
 * The output of a pass together with the diagnostics it produced.
 */
public record Pass<T>(T output, DiagSet diags) {
    public Pass {
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(diags, "diags");
    }
}
