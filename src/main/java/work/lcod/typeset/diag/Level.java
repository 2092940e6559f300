package work.lcod.typeset.diag;

/**
 * How severe a diagnostic is.
 */
public enum Level {
    ERROR,
    WARNING
}
