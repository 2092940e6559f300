package work.lcod.typeset.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.typeset.diag.Diag;
import work.lcod.typeset.diag.Pass;
import work.lcod.typeset.diag.Span;
import work.lcod.typeset.exec.Env;
import work.lcod.typeset.exec.ExecutionContext;
import work.lcod.typeset.exec.PageState;
import work.lcod.typeset.exec.State;
import work.lcod.typeset.geom.Align;
import work.lcod.typeset.geom.Dir;
import work.lcod.typeset.geom.Length;
import work.lcod.typeset.geom.Size;
import work.lcod.typeset.layout.FixedNode;
import work.lcod.typeset.layout.ParChild;
import work.lcod.typeset.layout.StackNode;
import work.lcod.typeset.layout.Tree;
import work.lcod.typeset.support.TypesetTestSupport;

class TemplateRunnerTest {
    @TempDir
    Path tempDir;

    @Test
    void buildsParagraphsFromEvents() {
        var pass = execute("""
            template:
              - text: Hello
              - space
              - text: world
              - parbreak
              - text: Second
            """);

        var stack = onlyPage(pass.output());
        assertEquals(List.of("par", "_11.0", "par"), TypesetTestSupport.describe(stack));
        var first = TypesetTestSupport.paragraphs(stack).get(0);
        assertEquals(List.of("Hello", "_2.75", "world"), TypesetTestSupport.describe(first));
        assertTrue(pass.diags().isEmpty());
    }

    @Test
    void styleWithBodyOnlyAppliesToBody() {
        var ctx = TypesetTestSupport.defaultContext();
        new TemplateRunner().run(ctx, TemplateLoader.parse("""
            template:
              - text: "plain "
              - font: {strong: true}
                body:
                  - text: bold
              - text: " again"
            """, "styled.yaml"));

        assertSame(State.DEFAULT, ctx.state());
        var par = TypesetTestSupport.paragraphs(onlyPage(ctx.finish().output())).get(0);
        assertEquals(List.of("plain ", "bold", " again"), TypesetTestSupport.texts(par));
        assertTrue(((ParChild.Text) par.children().get(1)).node().props().strong());
        assertFalse(((ParChild.Text) par.children().get(2)).node().props().strong());
    }

    @Test
    void styleWithoutBodyAppliesUntilScopeEnds() {
        var pass = execute("""
            template:
              - align: center
              - text: centered
              - lang: {dir: rtl}
              - parbreak
              - text: rtl
            """);

        var paragraphs = TypesetTestSupport.paragraphs(onlyPage(pass.output()));
        assertEquals(Align.CENTER, ((ParChild.Text) paragraphs.get(0).children().get(0)).align());
        assertEquals(Dir.LTR, paragraphs.get(0).dir());
        assertEquals(Dir.RTL, paragraphs.get(1).dir());
    }

    @Test
    void boxRunsBodyAsIsolatedGroup() {
        var pass = execute("""
            template:
              - text: before
              - box: {width: 2cm}
                body:
                  - font: {monospace: true}
                  - text: inside
                  - pagebreak
              - text: after
            """);

        assertEquals(
            List.of(Diag.error(new Span("template[1].body[2]"), "cannot modify page from here")),
            pass.diags().toList()
        );
        var par = TypesetTestSupport.paragraphs(onlyPage(pass.output())).get(0);
        assertEquals(List.of("before", "<node>", "after"), TypesetTestSupport.describe(par));

        var fixed = assertInstanceOf(FixedNode.class, ((ParChild.Any) par.children().get(1)).node());
        assertEquals(Length.mm(20).pt(), fixed.width().orElseThrow().abs().pt(), 1e-9);
        assertTrue(fixed.height().isEmpty());
        var inner = assertInstanceOf(StackNode.class, fixed.child());
        assertEquals(List.of("inside"), TypesetTestSupport.texts(TypesetTestSupport.paragraphs(inner).get(0)));

        var after = (ParChild.Text) par.children().get(2);
        assertEquals(List.of("serif"), after.node().props().families());
    }

    @Test
    void reportsAndSkipsMalformedEvents() {
        var pass = execute("""
            template:
              - wiggle
              - h: nonsense
              - {text: a, v: 2pt}
              - text: ok
            """);

        assertEquals(List.of(
            Diag.error(new Span("template[0]"), "Unknown template event: wiggle"),
            Diag.error(new Span("template[1]"), "Invalid length: nonsense"),
            Diag.error(new Span("template[2]"), "Template event must have exactly one kind, found [text, v]")
        ), pass.diags().toList());
        var par = TypesetTestSupport.paragraphs(onlyPage(pass.output())).get(0);
        assertEquals(List.of("ok"), TypesetTestSupport.texts(par));
    }

    @Test
    void pageWithBodyGetsItsOwnPages() {
        var pass = execute("""
            template:
              - text: cover
              - page: {paper: a5, flip: true}
                body:
                  - text: landscape
              - text: back
            """);

        var runs = pass.output().runs();
        assertEquals(3, runs.size());
        assertEquals(PageState.A4, runs.get(0).size());
        assertEquals(new Size(Length.mm(210), Length.mm(148)), runs.get(1).size());
        assertEquals(PageState.A4, runs.get(2).size());
        assertEquals(List.of("landscape"),
            TypesetTestSupport.texts(TypesetTestSupport.paragraphs(TypesetTestSupport.pageContent(runs.get(1))).get(0)));
    }

    @Test
    void keptPagebreakPreservesEmptyPage() {
        var pass = execute("""
            template:
              - text: one
              - pagebreak: {keep: true}
              - pagebreak: {keep: true}
              - text: two
              - pagebreak
              - pagebreak
              - text: three
            """);

        assertEquals(4, pass.output().pageCount());
    }

    @Test
    void rawBlockIsMonospacedParagraph() {
        var pass = execute("""
            template:
              - text: intro
              - raw: {text: "let x\\nlet y", block: true}
              - text: outro
            """);

        var stack = onlyPage(pass.output());
        assertEquals(List.of("par", "_11.0", "par", "_11.0", "par"), TypesetTestSupport.describe(stack));
        var code = TypesetTestSupport.paragraphs(stack).get(1);
        assertEquals(List.of("let x", "|", "let y"), TypesetTestSupport.describe(code));
        assertEquals("monospace", ((ParChild.Text) code.children().get(0)).node().props().families().get(0));
        var outro = TypesetTestSupport.paragraphs(stack).get(2);
        assertEquals("serif", ((ParChild.Text) outro.children().get(0)).node().props().families().get(0));
    }

    @Test
    void includesTemplatesFromEnvironment() throws Exception {
        Files.writeString(tempDir.resolve("part.yaml"), "template:\n  - text: included\n");
        var ctx = new ExecutionContext(new Env(tempDir), State.DEFAULT);
        new TemplateRunner().run(ctx, TemplateLoader.parse("""
            template:
              - text: "main "
              - include: part.yaml
              - include: missing.yaml
            """, "main.yaml"));

        var pass = ctx.finish();
        var par = TypesetTestSupport.paragraphs(onlyPage(pass.output())).get(0);
        assertEquals(List.of("main included"), TypesetTestSupport.texts(par));
        assertEquals(1, pass.diags().size());
        var diag = pass.diags().toList().get(0);
        assertEquals(new Span("template[2]"), diag.span());
        assertTrue(diag.message().startsWith("cannot include missing.yaml"));
    }

    @Test
    void reportsCyclicIncludes() throws Exception {
        Files.writeString(tempDir.resolve("loop.yaml"), "template:\n  - text: loop\n  - include: loop.yaml\n");
        var ctx = new ExecutionContext(new Env(tempDir), State.DEFAULT);
        new TemplateRunner().run(ctx, TemplateLoader.parse("template:\n  - include: loop.yaml\n", "main.yaml"));

        var pass = ctx.finish();
        assertEquals(
            List.of(Diag.error(new Span("template[0].include[1]"), "cyclic include of loop.yaml")),
            pass.diags().toList()
        );
        assertEquals(1, ctx.env().loadedCount());
    }

    private Pass<Tree> execute(String source) {
        var ctx = TypesetTestSupport.defaultContext();
        new TemplateRunner().run(ctx, TemplateLoader.parse(source, "test.yaml"));
        return ctx.finish();
    }

    private static StackNode onlyPage(Tree tree) {
        assertEquals(1, tree.pageCount());
        return TypesetTestSupport.pageContent(tree.runs().get(0));
    }
}
