package work.lcod.typeset.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import work.lcod.typeset.diag.Diag;
import work.lcod.typeset.diag.DiagSet;
import work.lcod.typeset.diag.Pass;
import work.lcod.typeset.diag.Span;
import work.lcod.typeset.geom.GenAxis;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.layout.LayoutNode;
import work.lcod.typeset.layout.PageRun;
import work.lcod.typeset.layout.ParChild;
import work.lcod.typeset.layout.StackChild;
import work.lcod.typeset.layout.StackNode;
import work.lcod.typeset.layout.Tree;

/**
 * The context for execution. Receives content and breaks in document order and builds the
 * layout tree from them.
 */
public final class ExecutionContext {
    public static final int DEFAULT_MAX_GROUP_DEPTH = 128;

    private final Env env;
    private final DiagSet diags = new DiagSet();
    private final List<PageRun> runs = new ArrayList<>();
    private final int maxGroupDepth;
    private State state;
    // Page metrics while building the top-level stack, null inside execGroup.
    private PageBuilder page;
    private StackBuilder stack;
    private int groupDepth;
    private boolean finished;

    public ExecutionContext(Env env, State state) {
        this(env, state, DEFAULT_MAX_GROUP_DEPTH);
    }

    public ExecutionContext(Env env, State state, int maxGroupDepth) {
        if (maxGroupDepth < 0) {
            throw new IllegalArgumentException("maxGroupDepth must not be negative");
        }
        this.env = Objects.requireNonNull(env, "env");
        this.state = Objects.requireNonNull(state, "state");
        this.maxGroupDepth = maxGroupDepth;
        this.page = new PageBuilder(state, true);
        this.stack = new StackBuilder(state);
    }

    public Env env() {
        return env;
    }

    public State state() {
        return state;
    }

    public void setState(State state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    public void updateState(UnaryOperator<State> update) {
        setState(update.apply(state));
    }

    public DiagSet diags() {
        return diags;
    }

    public void diag(Diag diag) {
        diags.insert(diag);
    }

    /**
     * Whether page breaks are currently allowed, i.e. we are not inside a group.
     */
    public boolean hasPage() {
        return page != null;
    }

    public int groupDepth() {
        return groupDepth;
    }

    public void setMonospace() {
        updateState(s -> s.withFont(s.font().withPreferred(FontFamily.MONOSPACE)));
    }

    public StackNode execGroup(Template template) {
        return execGroup(template, Span.DETACHED);
    }

    /**
     * Executes a template into a fresh stack and returns it. The state is restored afterwards
     * and the page cannot be modified from inside.
     */
    public StackNode execGroup(Template template, Span span) {
        ensureActive();
        if (groupDepth >= maxGroupDepth) {
            diag(Diag.error(span, "maximum nesting depth exceeded"));
            return new StackBuilder(state).build();
        }

        var snapshot = state;
        var outerPage = page;
        var outerStack = stack;
        page = null;
        stack = new StackBuilder(state);
        groupDepth++;

        StackBuilder inner = stack;
        try {
            template.exec(this);
        } finally {
            groupDepth--;
            state = snapshot;
            page = outerPage;
            stack = outerStack;
        }
        return inner.build();
    }

    /**
     * Pushes any node into the active paragraph.
     */
    public void push(LayoutNode node) {
        ensureActive();
        var align = state.aligns().cross();
        stack.par().push(new ParChild.Any(node, align));
    }

    public void pushWordSpace() {
        ensureActive();
        Length em = state.font().resolveSize();
        Length amount = state.par().wordSpacing().resolve(em);
        stack.par().pushSoft(new ParChild.Spacing(amount));
    }

    /**
     * Pushes text into the active paragraph. Every newline becomes a forced line break;
     * a carriage return followed by a line feed counts once.
     */
    public void pushText(String text) {
        ensureActive();
        var buffer = new StringBuilder();
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                i++;
            }
            if (isNewline(c)) {
                stack.par().pushText(buffer.toString(), state);
                buffer.setLength(0);
                linebreak();
            } else {
                buffer.append(c);
            }
        }
        stack.par().pushText(buffer.toString(), state);
    }

    /**
     * Main-axis spacing separates paragraphs, cross-axis spacing stays inline.
     */
    public void pushSpacing(GenAxis axis, Length amount) {
        ensureActive();
        if (axis == GenAxis.MAIN) {
            stack.parbreak(state);
            stack.pushHard(new StackChild.Spacing(amount));
        } else {
            stack.par().pushHard(new ParChild.Spacing(amount));
        }
    }

    public void linebreak() {
        ensureActive();
        stack.par().pushHard(new ParChild.Linebreak());
    }

    public void parbreak() {
        ensureActive();
        Length em = state.font().resolveSize();
        Length amount = state.par().spacing().resolve(em);
        stack.parbreak(state);
        stack.pushSoft(new StackChild.Spacing(amount));
    }

    /**
     * Finishes the current page and starts a new one with the current page state.
     * Inside a group this only records an error.
     */
    public void pagebreak(boolean keep, boolean hard, Span source) {
        ensureActive();
        if (page == null) {
            diag(Diag.error(source, "cannot modify page from here"));
            return;
        }
        var finishedPage = page;
        var finishedStack = stack;
        page = new PageBuilder(state, hard);
        stack = new StackBuilder(state);
        finishedPage.build(finishedStack.build(), keep).ifPresent(runs::add);
    }

    /**
     * Finishes execution and returns the layout tree with all diagnostics.
     */
    public Pass<Tree> finish() {
        ensureActive();
        if (page == null) {
            throw new IllegalStateException("finish() requires an active page context");
        }
        pagebreak(true, false, Span.DETACHED);
        finished = true;
        return new Pass<>(new Tree(runs), diags);
    }

    private void ensureActive() {
        if (finished) {
            throw new IllegalStateException("Execution context was already finished");
        }
    }

    static boolean isNewline(char c) {
        return c == '\n'
            || c == '\u000B'
            || c == '\u000C'
            || c == '\r'
            || c == '\u0085'
            || c == '\u2028'
            || c == '\u2029';
    }
}
