package ai.lintal.rules.modifier;

import static org.junit.jupiter.api.Assertions.*;

import ai.lintal.diagnostics.FixAvailability;
import ai.lintal.rules.RuleProperties;
import ai.lintal.testutil.RuleTester;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class FinalLocalVariableTest {

    private static List<String> reported(FinalLocalVariable rule, String source) {
        return RuleTester.check(rule, source).stream()
                .map(d -> ((FinalLocalVariable.VariableShouldBeFinal) d.diagnostic().kind()).variableName())
                .toList();
    }

    private static List<String> reported(String source) {
        return reported(new FinalLocalVariable(), source);
    }

    /** Wraps statements in a method that has a few parameters to branch and loop on. */
    private static List<String> reportedInMethod(String body) {
        return reported(inMethod(body));
    }

    private static String inMethod(String body) {
        return "class T {\n    void m(boolean c, int k, java.util.List<String> list) {\n" + body + "\n    }\n}\n";
    }

    // ---------------------------------------------------------------------------------------------
    // sequential composition

    @Test
    public void testInitializedAndNeverReassigned() {
        assertEquals(List.of("x"), reportedInMethod("int x = 1; System.out.println(x);"));
    }

    @Test
    public void testReassignedAfterInitializer() {
        assertEquals(List.of(), reportedInMethod("int x = 1; x = 2;"));
    }

    @Test
    public void testDeclaredThenAssignedOnce() {
        assertEquals(List.of("a"), reportedInMethod("int a; a = 1;"));
    }

    @Test
    public void testDeclaredButNeverAssigned() {
        assertEquals(List.of(), reportedInMethod("int a;"));
    }

    @Test
    public void testCompoundAssignmentAndIncrementDisqualify() {
        assertEquals(List.of(), reportedInMethod("int a = 0; a += 1; int b = 0; b++; int d = 0; --d;"));
    }

    @Test
    public void testFinalLocalIsNotReported() {
        assertEquals(List.of(), reportedInMethod("final int x = 1; System.out.println(x);"));
    }

    @Test
    public void testParametersAreNeverReported() {
        assertEquals(List.of(), reported("class T { void m(int p, String... rest) { p = 1; rest = null; } }"));
    }

    @Test
    public void testEachDeclaratorIsItsOwnCandidate() {
        assertEquals(List.of("a", "c"), reportedInMethod("int a = 1, b = 2, c; b = 3; c = 4;"));
    }

    @Test
    public void testMessageAndRange() {
        var source = inMethod("        int total = 1;");
        var diagnostics = RuleTester.check(new FinalLocalVariable(), source);

        assertEquals(1, diagnostics.size());
        var diagnostic = diagnostics.get(0).diagnostic();
        assertEquals("Variable 'total' should be declared final.", diagnostic.message());
        assertEquals(FixAvailability.NONE, diagnostic.kind().fixAvailability());
        assertTrue(diagnostic.optionalFix().isEmpty());
        assertEquals(source.indexOf("total"), diagnostic.range().start());
        assertEquals(source.indexOf("total") + "total".length(), diagnostic.range().end());
        assertEquals("FinalLocalVariable", diagnostics.get(0).ruleName());
    }

    // ---------------------------------------------------------------------------------------------
    // branches

    @Test
    public void testAssignedOnceInEachBranch() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                if (c) {
                    a = 1;
                } else {
                    a = 2;
                }
                System.out.println(a);
                """));
    }

    @Test
    public void testAssignedInBranchesAndAgainAfter() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                int d;
                if (c) {
                    d = 1;
                } else {
                    d = 2;
                }
                d = 3;
                """));
    }

    @Test
    public void testAssignedOnlyInThenBranch() {
        assertEquals(List.of("a"), reportedInMethod("int a; if (c) { a = 1; }"));
    }

    @Test
    public void testAssignedInThenBranchAndAfter() {
        assertEquals(List.of(), reportedInMethod("int a; if (c) a = 1; a = 2;"));
    }

    @Test
    public void testReturningBranchDoesNotReachTheMerge() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                if (c) {
                    a = 1;
                    return;
                }
                a = 2;
                """));
    }

    @Test
    public void testThrowingBranchDoesNotReachTheMerge() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                if (c) {
                    a = 1;
                } else {
                    throw new IllegalStateException();
                }
                System.out.println(a);
                """));
    }

    @Test
    public void testShortCircuitRightOperandIsConditional() {
        assertEquals(List.of(), reportedInMethod("int a = 0; if (c && (a = 1) > 0) { }"));
        assertEquals(List.of("b", "ok"), reportedInMethod("int b; boolean ok = c || (b = 1) > 0;"));
    }

    @Test
    public void testTernaryArmsAreAlternatives() {
        assertEquals(List.of("a", "r"), reportedInMethod("int a; int r = c ? (a = 1) : (a = 2);"));
    }

    // ---------------------------------------------------------------------------------------------
    // switch

    @Test
    public void testSwitchGroupsWithBreaks() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                switch (k) {
                    case 1:
                        a = 1;
                        break;
                    case 2:
                        a = 2;
                        break;
                    default:
                        a = 3;
                }
                System.out.println(a);
                """));
    }

    @Test
    public void testSwitchFallThroughAccumulates() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                int a;
                switch (k) {
                    case 1:
                        a = 1;
                    case 2:
                        a = 2;
                        break;
                    default:
                        a = 3;
                }
                """));
    }

    @Test
    public void testSwitchWithoutDefaultKeepsEntryPath() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                int a;
                switch (k) {
                    case 1:
                        a = 1;
                        break;
                }
                a = 2;
                """));
    }

    @Test
    public void testInitializedInOneGroupAssignedInLater() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                switch (k) {
                    case 1:
                        int y = 1;
                        System.out.println(y);
                        break;
                    case 2:
                        y = 2;
                        System.out.println(y);
                        break;
                }
                """));
    }

    @Test
    public void testDeclaredInOneGroupAssignedOnceInLater() {
        assertEquals(
                List.of("y"),
                reportedInMethod("""
                switch (k) {
                    case 1:
                        int y;
                        break;
                    case 2:
                        y = 2;
                        System.out.println(y);
                        break;
                }
                """));
    }

    @Test
    public void testSwitchRulesNeverFallThrough() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                switch (k) {
                    case 1 -> a = 1;
                    case 2 -> { a = 2; }
                    default -> a = 3;
                }
                System.out.println(a);
                """));
    }

    @Test
    public void testSwitchExpressionWithYield() {
        assertEquals(
                List.of("r", "t"),
                reportedInMethod("""
                int r = switch (k) {
                    case 1 -> {
                        int t = 5;
                        yield t;
                    }
                    default -> 0;
                };
                System.out.println(r);
                """));
    }

    // ---------------------------------------------------------------------------------------------
    // loops

    @Test
    public void testLoopAccumulatorIsDisqualified() {
        assertEquals(List.of(), reportedInMethod("int sum = 0; for (int i = 0; i < 10; i++) { sum += i; }"));
    }

    @Test
    public void testDeclaredInsideLoopBody() {
        assertEquals(List.of("step"), reportedInMethod("int i = 0; while (i < 10) { int step = 2; i += step; }"));
    }

    @Test
    public void testAssignedOnceInsideLoopButDeclaredOutside() {
        assertEquals(List.of(), reportedInMethod("int a; while (c) { a = 1; }"));
        assertEquals(List.of(), reportedInMethod("int b; do { b = 1; } while (c);"));
        assertEquals(List.of(), reportedInMethod("int d; for (String s : list) { d = 1; }"));
    }

    @Test
    public void testAssignedInForUpdateOrCondition() {
        assertEquals(List.of(), reportedInMethod("int n = 0; for (int i = 0; i < 3; n = i++) { }"));
        assertEquals(List.of(), reportedInMethod("int m; for (int i = 0; (m = i) < 3; i++) { }"));
    }

    @Test
    public void testForInitializerVariablesAreNeverReported() {
        assertEquals(List.of(), reportedInMethod("for (int i = 0, j = 10; i < j; i++) { System.out.println(i); }"));
        assertEquals(List.of(), reportedInMethod("for (int i = 0; ; ) { break; }"));
    }

    @Test
    public void testOuterVariableAssignedInForInitializer() {
        assertEquals(List.of("i"), reportedInMethod("int i; for (i = 0; k < 10; ) { break; }"));
    }

    @Test
    public void testContinueInsideLoopBody() {
        assertEquals(
                List.of("v"),
                reportedInMethod("""
                for (int i = 0; i < 10; i++) {
                    int v = i * 2;
                    if (v > 4) {
                        continue;
                    }
                    System.out.println(v);
                }
                """));
    }

    @Test
    public void testInfiniteLoopLeftOnlyThroughBreak() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                while (true) {
                    if (c) {
                        break;
                    }
                }
                a = 1;
                """));
    }

    @Test
    public void testLabeledBlockBreak() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                done: {
                    if (c) {
                        a = 1;
                        break done;
                    }
                    a = 2;
                }
                System.out.println(a);
                """));
    }

    @Test
    public void testLabeledContinueTargetsOuterLoop() {
        assertEquals(
                List.of("inner"),
                reportedInMethod("""
                outer:
                for (int i = 0; i < 3; i++) {
                    for (int j = 0; j < 3; j++) {
                        int inner = i + j;
                        if (inner > 2) {
                            continue outer;
                        }
                    }
                }
                """));
    }

    @Test
    public void testEnhancedForVariableSkippedByDefault() {
        assertEquals(List.of(), reportedInMethod("for (String s : list) { System.out.println(s); }"));
    }

    @Test
    public void testEnhancedForVariableValidatedWhenConfigured() {
        var rule = FinalLocalVariable.fromConfig(RuleProperties.of(Map.of("validateEnhancedForLoopVariable", "true")));

        assertEquals(List.of("s"), reported(rule, inMethod("for (String s : list) { System.out.println(s); }")));
        assertEquals(List.of(), reported(rule, inMethod("for (String s : list) { s = s.trim(); }")));
        assertEquals(List.of(), reported(rule, inMethod("for (final String s : list) { System.out.println(s); }")));
    }

    // ---------------------------------------------------------------------------------------------
    // try / catch

    @Test
    public void testCatchParametersAreNeverReported() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                try {
                    System.out.println();
                } catch (IllegalStateException | IllegalArgumentException e) {
                    System.out.println(e);
                } catch (RuntimeException e) {
                    e = null;
                }
                """));
    }

    @Test
    public void testAssignedInTryAndInCatch() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                int a;
                try {
                    a = Integer.parseInt("1");
                } catch (NumberFormatException e) {
                    a = 0;
                }
                """));
    }

    @Test
    public void testAssignedInTryWithReturningCatch() {
        assertEquals(
                List.of("a"),
                reportedInMethod("""
                int a;
                try {
                    System.out.println();
                    a = 1;
                } catch (RuntimeException e) {
                    return;
                }
                System.out.println(a);
                """));
    }

    @Test
    public void testFinallyRunsAfterTheMerge() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                int a = 0;
                try {
                    System.out.println();
                } finally {
                    a = 1;
                }
                """));
    }

    @Test
    public void testTryResourcesAreNeverReported() {
        assertEquals(
                List.of(),
                reportedInMethod("""
                try (var in = new java.io.StringReader("x")) {
                    System.out.println(in);
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
                """));
    }

    // ---------------------------------------------------------------------------------------------
    // lambdas, nested classes and entry points

    @Test
    public void testLambdaParametersAreNeverReported() {
        assertEquals(
                List.of("f"),
                reportedInMethod("""
                java.util.function.Function<Integer, Integer> f = x -> {
                    x = x + 1;
                    return x;
                };
                """));
    }

    @Test
    public void testLambdaLocalsAreReportedOnce() {
        assertEquals(
                List.of("r", "inner"),
                reportedInMethod("""
                Runnable r = () -> {
                    int inner = 1;
                    System.out.println(inner);
                };
                """));
    }

    @Test
    public void testLambdaInFieldInitializer() {
        assertEquals(
                List.of("z"),
                reported("""
                class T {
                    Runnable r = () -> {
                        int z = 1;
                        System.out.println(z);
                    };
                }
                """));
    }

    @Test
    public void testAnonymousClassMembers() {
        assertEquals(
                List.of("count", "r", "local"),
                reportedInMethod("""
                int count = 0;
                Runnable r = new Runnable() {
                    int field;

                    public void run() {
                        field = 1;
                        field = 2;
                        int local = 2;
                        System.out.println(local + count);
                    }
                };
                """));
    }

    @Test
    public void testNestedClassFieldShadowsOuterLocal() {
        assertEquals(
                List.of("value", "o"),
                reportedInMethod("""
                int value = 0;
                Object o = new Object() {
                    int value;

                    void set() {
                        value = 5;
                    }
                };
                """));
    }

    @Test
    public void testEveryMethodIsAnalyzedIndependently() {
        assertEquals(
                List.of("x", "y"),
                reported("""
                class T {
                    void first() {
                        int x = 1;
                        return;
                    }

                    void second() {
                        int y = 1;
                    }
                }
                """));
    }

    @Test
    public void testInitializersAndConstructors() {
        assertEquals(
                List.of("s", "i", "c"),
                reported("""
                class T {
                    static {
                        int s = 1;
                    }

                    {
                        int i = 1;
                    }

                    T() {
                        int c = 1;
                    }
                }
                """));
    }

    @Test
    public void testCompactConstructor() {
        assertEquals(
                List.of("y"),
                reported("""
                record P(int x) {
                    P {
                        int y = x;
                        System.out.println(y);
                    }
                }
                """));
    }

    @Test
    public void testPatternVariablesAreNeverReported() {
        assertEquals(
                List.of(),
                reported("""
                class T {
                    void m(Object o) {
                        if (o instanceof String s) {
                            System.out.println(s);
                        }
                    }
                }
                """));
    }

    @Test
    public void testInnerScopeDeclarationsAreIndependent() {
        assertEquals(
                List.of("a", "a"),
                reportedInMethod("""
                {
                    int a = 1;
                }
                {
                    int a = 2;
                }
                """));
    }

    // ---------------------------------------------------------------------------------------------
    // unnamed variables and configuration

    @Test
    public void testUnnamedVariableSkippedByDefault() {
        assertEquals(List.of(), reportedInMethod("int _ = k;"));
    }

    @Test
    public void testUnnamedVariableValidatedWhenConfigured() {
        var rule = FinalLocalVariable.fromConfig(RuleProperties.of(Map.of("validateUnnamedVariables", "true")));
        assertEquals(List.of("_"), reported(rule, inMethod("int _ = k;")));
    }

    @Test
    public void testMalformedPropertyFallsBackToDefault() {
        var rule = FinalLocalVariable.fromConfig(
                RuleProperties.of(Map.of("validateEnhancedForLoopVariable", "sometimes", "unknownKey", "1")));
        assertEquals(List.of(), reported(rule, inMethod("for (String s : list) { System.out.println(s); }")));
    }

    @Test
    public void testVeryLongConcatenation() {
        var expression = String.join(" + ", Collections.nCopies(4000, "\"a\""));
        assertEquals(List.of("s"), reportedInMethod("String s = " + expression + "; System.out.println(s);"));
    }

    @Test
    public void testLongConditionChainStillBranches() {
        var conditions = String.join(" && ", Collections.nCopies(3000, "c"));
        // a is assigned twice when the first assignment yields false
        assertEquals(
                List.of("b"),
                reportedInMethod("int a; boolean b = " + conditions + " && (a = 1) > 0 || (a = 2) > 0;"));
    }
}
