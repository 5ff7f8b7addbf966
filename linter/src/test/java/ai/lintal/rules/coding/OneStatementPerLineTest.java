package ai.lintal.rules.coding;

import static org.junit.jupiter.api.Assertions.*;

import ai.lintal.rules.RuleProperties;
import ai.lintal.testutil.RuleTester;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class OneStatementPerLineTest {

    private final OneStatementPerLine rule = new OneStatementPerLine();

    private static String inMethod(String body) {
        return "class Test {\n    void method() {\n        " + body + "\n    }\n}\n";
    }

    @Test
    public void testTwoStatementsSameLine() {
        var source = inMethod("int a; int b;");
        var diagnostics = RuleTester.check(rule, source);

        assertEquals(1, diagnostics.size(), "Expected 1 violation for two statements on same line");
        var diagnostic = diagnostics.get(0).diagnostic();
        assertEquals("Only one statement per line allowed.", diagnostic.message());
        assertEquals(source.indexOf("int b;"), diagnostic.range().start());
        assertEquals(inMethod("int a;\n        int b;"), RuleTester.applyFixes(diagnostics, source));
    }

    @Test
    public void testSingleStatementPerLineOk() {
        assertTrue(RuleTester.check(rule, inMethod("int a;\n        int b;")).isEmpty());
    }

    @Test
    public void testForLoopHeaderOk() {
        assertTrue(RuleTester.check(rule, inMethod("for (int i = 0; i < 10; i++) {}")).isEmpty());
    }

    @Test
    public void testEveryExtraStatementIsReported() {
        var source = inMethod("a(); b(); c();");
        var diagnostics = RuleTester.check(rule, source);

        assertEquals(2, diagnostics.size());
        assertEquals(inMethod("a();\n        b();\n        c();"), RuleTester.applyFixes(diagnostics, source));
    }

    @Test
    public void testStatementStartingWhereMultiLineStatementEnds() {
        var source = inMethod("int x = 1 +\n            2; int y;");
        assertEquals(List.of(4), RuleTester.lines(RuleTester.check(rule, source), source));
    }

    @Test
    public void testUnbracedIfBodyEndsWithSemicolon() {
        assertEquals(1, RuleTester.check(rule, inMethod("if (true) a(); b();")).size());
    }

    @Test
    public void testBracedBlockResetsTheLine() {
        assertTrue(RuleTester.check(rule, inMethod("if (true) { a(); } b();")).isEmpty());
    }

    @Test
    public void testFieldsInClassBody() {
        var source = "class Test {\n    int a; int b;\n}\n";
        assertEquals(1, RuleTester.check(rule, source).size());
    }

    @Test
    public void testTryResourcesIgnoredByDefault() {
        var source = inMethod("try (var in = open(); var out = open()) { }");
        assertTrue(RuleTester.check(rule, source).isEmpty());
    }

    @Test
    public void testTryResourcesWhenConfigured() {
        var configured =
                OneStatementPerLine.fromConfig(RuleProperties.of(Map.of("treatTryResourcesAsStatement", "TRUE")));
        var source = inMethod("try (var in = open(); var out = open()) { }");
        var diagnostics = RuleTester.check(configured, source);

        assertEquals(1, diagnostics.size());
        assertEquals(source.indexOf("var out"), diagnostics.get(0).diagnostic().range().start());
        assertEquals(
                inMethod("try (var in = open();\n        var out = open()) { }"),
                RuleTester.applyFixes(diagnostics, source));
    }
}
