package ai.lintal.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.Test;

public class LintEngineTest {

    private static String fixture(String name) throws IOException {
        try (InputStream in = LintEngineTest.class.getResourceAsStream("/testcode-java/" + name)) {
            Objects.requireNonNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testAllRulesOnFixture() throws IOException {
        var engine = new LintEngine(RuleCatalog.defaultRuleSet());
        var result = engine.lint("Inventory.java", fixture("Inventory.java"));

        assertEquals(FileLintResult.Status.ANALYZED, result.status());
        assertEquals(
                List.of(
                        "UnusedImports 3:1 Unused import - java.util.Map.",
                        "FinalLocalVariable 10:13 Variable 'total' should be declared final.",
                        "MultipleVariableDeclarations 11:9 Each variable declaration must be in its own statement.",
                        "FinalLocalVariable 11:13 Variable 'a' should be declared final.",
                        "FinalLocalVariable 11:20 Variable 'b' should be declared final.",
                        "OneStatementPerLine 15:29 Only one statement per line allowed.",
                        "FinalLocalVariable 18:16 Variable 'label' should be declared final."),
                result.diagnostics().stream()
                        .map(d -> d.ruleName() + " " + d.line() + ":" + d.column() + " " + d.message())
                        .toList());
    }

    @Test
    public void testReportedPositionsAndFix() {
        var engine = new LintEngine(RuleCatalog.fromConfig(List.of(new RuleCatalog.RuleConfig("OneStatementPerLine"))));
        var result = engine.lint("A.java", "class A {\n  void m() { a(); b(); }\n}\n");

        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(2, diagnostic.line());
        assertEquals(19, diagnostic.column());
        assertEquals(2, diagnostic.endLine());
        assertEquals(23, diagnostic.endColumn());
        assertNotNull(diagnostic.fix());
        assertEquals(1, diagnostic.fix().edits().size());
    }
}
