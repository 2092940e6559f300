package work.lcod.typeset.exec;

/**
 * Content that can be executed into an {@link ExecutionContext}, usually by the template evaluator.
 */
@FunctionalInterface
public interface Template {
    void exec(ExecutionContext ctx);
}
