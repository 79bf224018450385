package org.introspect.rewriter;

import org.introspect.runtime.CPointer;
import org.introspect.runtime.TreeInterpreter;
import org.introspect.tree.CType;
import org.introspect.tree.FunctionDecl;
import org.introspect.tree.FunctionDefinition;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.VarDecl;
import org.junit.Test;

import javax.tools.Diagnostic;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class AssertRewriterIntegrationTest {
    private static final FunctionDecl F1 = FunctionDecl.of("f", CType.INT, CType.INT);
    private static final FunctionDecl F2 = FunctionDecl.of("f", CType.INT, CType.INT, CType.INT);

    @Test
    public void reportsSimpleComparison() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        fixture.defineTest(fixture.assertion(
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(5)), "n == 5"), n);

        RewriteReport report = fixture.rewrite(AssertionFixture.monochrome());

        assertThat(report.getMatched()).isEqualTo(1);
        assertThat(report.getRewritten()).isEqualTo(1);
        assertThat(report.getDiagnostics()).isEmpty();
        assertThat(fixture.runFailing(3)).containsExactly(
                "In test.c:3, function 'test':",
                "> assert(n == 5)",
                "E assert(3 == 5)",
                "> subexpressions:",
                "  n = 3");
    }

    @Test
    public void passingAssertionPrintsNothing() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        fixture.defineTest(fixture.assertion(
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(5)), "n == 5"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        new TreeInterpreter(fixture.unit, fixture.environment).invoke("test", 5);

        assertThat(fixture.environment.getOutput()).isEmpty();
    }

    @Test
    public void showsOnlyTheRightSideWhenTheLeftSideOfAndPassed() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        VarDecl m = new VarDecl("m", CType.INT);
        int condition = arena.compare(NodeKind.TRUTH_ANDIF,
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(42)),
                arena.compare(NodeKind.EQ, arena.variable(m), arena.integer(7)));
        fixture.defineTest(fixture.assertion(condition, "n == 42 && m == 7"), n, m);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(42, 6)).containsExactly(
                "> assert((n == 42) && (m == 7))",
                "E assert((...) && (6 == 7))",
                "> subexpressions:",
                "  m = 6");
    }

    @Test
    public void showsBothSidesOfFailedOr() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        VarDecl m = new VarDecl("m", CType.INT);
        int condition = arena.compare(NodeKind.TRUTH_ORIF,
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(43)),
                arena.compare(NodeKind.EQ, arena.variable(m), arena.integer(7)));
        fixture.defineTest(fixture.assertion(condition, "n == 43 || m == 7"), n, m);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(42, 6)).containsExactly(
                "> assert((n == 43) || (m == 7))",
                "E assert((42 == 43) || (6 == 7))",
                "> subexpressions:",
                "  n = 42",
                "  m = 6");
    }

    @Test
    public void reportsCallArgumentsAndResult() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        fixture.environment.define("f", arguments -> (Long) arguments.get(0) + (Long) arguments.get(1));
        int call = arena.call(F2, arena.integer(12), arena.variable(n));
        fixture.defineTest(fixture.assertion(
                arena.compare(NodeKind.EQ, call, arena.integer(5)), "f(12, n) == 5"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(20)).containsExactly(
                "> assert(f(12, n) == 5)",
                "E assert(32 == 5)",
                "> subexpressions:",
                "  n = 20",
                "  f(12, n=20) = 32");
    }

    @Test
    public void printsStringPointersQuotedAndNullAsAddress() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        CType constString = CType.pointerTo(CType.CHAR.withConst());
        FunctionDecl strstr = FunctionDecl.of("strstr", CType.pointerTo(CType.CHAR), constString, constString);
        VarDecl s = new VarDecl("s", constString);
        fixture.environment.define("strstr", arguments -> {
            CPointer haystack = (CPointer) arguments.get(0);
            CPointer needle = (CPointer) arguments.get(1);
            int at = haystack.getTarget().indexOf(needle.getTarget());
            return at < 0 ? CPointer.NULL
                    : new CPointer(haystack.getAddress() + at, haystack.getTarget().substring(at));
        });
        int call = arena.call(strstr, arena.string("hello world"), arena.variable(s));
        int condition = arena.compare(NodeKind.EQ, call, arena.nullPointer(CType.pointerTo(CType.VOID)));
        fixture.defineTest(fixture.assertion(condition, "strstr(\"hello world\", s) == NULL"), s);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf("world")).containsExactly(
                "> assert(strstr(\"hello world\", s) == NULL)",
                "E assert(\"world\" == (nil))",
                "> subexpressions:",
                "  s = \"world\"",
                "  strstr(\"hello world\", s=\"world\") = \"world\"");
    }

    @Test
    public void evaluatesCallsOnlyOnce() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        AtomicInteger calls = new AtomicInteger();
        fixture.environment.define("call_me_once", arguments -> {
            calls.incrementAndGet();
            return (Long) arguments.get(0) + 1;
        });
        int call = arena.call(FunctionDecl.of("call_me_once", CType.INT, CType.INT), arena.variable(n));
        fixture.defineTest(fixture.assertion(
                arena.compare(NodeKind.EQ, call, arena.variable(n)), "call_me_once(n) == n"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(3)).containsExactly(
                "> assert(call_me_once(n) == n)",
                "E assert(4 == 3)",
                "> subexpressions:",
                "  n = 3",
                "  call_me_once(n=3) = 4");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    public void neverEvaluatesShortCircuitedOperands() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        fixture.environment.define("dont_call_me", arguments -> {
            throw new AssertionError("dont_call_me was evaluated");
        });
        int call = arena.call(FunctionDecl.of("dont_call_me", CType.INT, CType.INT), arena.variable(n));
        int condition = arena.compare(NodeKind.TRUTH_ANDIF,
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(5)),
                arena.compare(NodeKind.EQ, call, arena.variable(n)));
        fixture.defineTest(fixture.assertion(condition, "n == 5 && dont_call_me(n) == n"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(42)).containsExactly(
                "> assert((n == 5) && (dont_call_me(n) == n))",
                "E assert(42 == 5)",
                "> subexpressions:",
                "  n = 42");
    }

    @Test
    public void skipsRightSideOfTrueOrUnderComparison() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        AtomicInteger calls = new AtomicInteger();
        fixture.environment.define("f", arguments -> {
            calls.incrementAndGet();
            return 2L;
        });
        int or = arena.compare(NodeKind.TRUTH_ORIF,
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(1)),
                arena.compare(NodeKind.EQ, arena.call(F1, arena.variable(n)), arena.integer(2)));
        int condition = arena.compare(NodeKind.EQ, or, arena.integer(0));
        fixture.defineTest(fixture.assertion(condition, "(n == 1 || f(n) == 2) == 0"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(1)).containsExactly(
                "> assert(((n == 1) || (f(n) == 2)) == 0)",
                "E assert(((1 == 1) || (...)) == 0)",
                "> subexpressions:",
                "  n = 1");
        assertThat(calls.get()).isZero();
    }

    @Test
    public void showsBothSidesOfFalseLeftOrUnderComparison() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        AtomicInteger calls = new AtomicInteger();
        fixture.environment.define("f", arguments -> {
            calls.incrementAndGet();
            return 2L;
        });
        int or = arena.compare(NodeKind.TRUTH_ORIF,
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(1)),
                arena.compare(NodeKind.EQ, arena.call(F1, arena.variable(n)), arena.integer(2)));
        int condition = arena.compare(NodeKind.EQ, or, arena.integer(0));
        fixture.defineTest(fixture.assertion(condition, "(n == 1 || f(n) == 2) == 0"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(3)).containsExactly(
                "> assert(((n == 1) || (f(n) == 2)) == 0)",
                "E assert(((3 == 1) || (2 == 2)) == 0)",
                "> subexpressions:",
                "  n = 3",
                "  f(n=3) = 2");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    public void skipsRightSideOfFalseAndUnderArithmetic() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        AtomicInteger calls = new AtomicInteger();
        fixture.environment.define("f", arguments -> {
            calls.incrementAndGet();
            return 1L;
        });
        int and = arena.compare(NodeKind.TRUTH_ANDIF,
                arena.compare(NodeKind.GT, arena.variable(n), arena.integer(0)),
                arena.compare(NodeKind.GT, arena.call(F1, arena.variable(n)), arena.integer(0)));
        int sum = arena.binary(NodeKind.PLUS, CType.INT, and, arena.integer(1));
        int condition = arena.compare(NodeKind.EQ, sum, arena.integer(2));
        fixture.defineTest(fixture.assertion(condition, "(n > 0 && f(n) > 0) + 1 == 2"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(0)).containsExactly(
                "> assert(((n > 0) && (f(n) > 0)) + 1 == 2)",
                "E assert((0 > 0) + 1 == 2)",
                "> subexpressions:",
                "  n = 0");
        assertThat(calls.get()).isZero();
    }

    @Test
    public void skipsCallInOrNestedInAndUnderComparison() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        AtomicInteger calls = new AtomicInteger();
        fixture.environment.define("f", arguments -> {
            calls.incrementAndGet();
            return 2L;
        });
        int or = arena.compare(NodeKind.TRUTH_ORIF,
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(1)),
                arena.compare(NodeKind.EQ, arena.call(F1, arena.variable(n)), arena.integer(2)));
        int and = arena.compare(NodeKind.TRUTH_ANDIF,
                arena.compare(NodeKind.GT, arena.variable(n), arena.integer(0)), or);
        int condition = arena.compare(NodeKind.EQ, and, arena.integer(0));
        fixture.defineTest(fixture.assertion(condition, "(n > 0 && (n == 1 || f(n) == 2)) == 0"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(1)).containsExactly(
                "> assert(((n > 0) && ((n == 1) || (f(n) == 2))) == 0)",
                "E assert(((...) && ((1 == 1) || (...))) == 0)",
                "> subexpressions:",
                "  n = 1");
        assertThat(calls.get()).isZero();
    }

    @Test
    public void showsReturnValueInPlaceOfTheCall() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        fixture.environment.define("f", arguments -> (Long) arguments.get(0) * 3 + 1);
        int condition = arena.compare(NodeKind.GT, arena.call(F1, arena.variable(n)), arena.integer(100));
        fixture.defineTest(fixture.assertion(condition, "f(n) > 100"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(2)).containsExactly(
                "> assert(f(n) > 100)",
                "E assert(7 > 100)",
                "> subexpressions:",
                "  n = 2",
                "  f(n=2) = 7");
    }

    @Test
    public void listsNestedCallsBeforeTheirCaller() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        fixture.environment.define("f", arguments -> (Long) arguments.get(0) + 1);
        fixture.environment.define("g", arguments -> (Long) arguments.get(0) * 2);
        int inner = arena.call(F1, arena.variable(n));
        int outer = arena.call(FunctionDecl.of("g", CType.INT, CType.INT), inner);
        fixture.defineTest(fixture.assertion(
                arena.compare(NodeKind.EQ, outer, arena.integer(0)), "g(f(n)) == 0"), n);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(1)).containsExactly(
                "> assert(g(f(n)) == 0)",
                "E assert(4 == 0)",
                "> subexpressions:",
                "  n = 1",
                "  f(n=1) = 2",
                "  g(f(n)=2) = 4");
    }

    @Test
    public void keepsArithmeticOperatorsAndParentheses() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl a = new VarDecl("a", CType.INT);
        VarDecl b = new VarDecl("b", CType.INT);
        int sum = arena.binary(NodeKind.PLUS, CType.INT, arena.variable(a), arena.variable(b));
        int product = arena.binary(NodeKind.MULT, CType.INT, sum, arena.integer(2));
        int odd = arena.binary(NodeKind.TRUNC_MOD, CType.INT, product, arena.integer(4));
        fixture.defineTest(fixture.assertion(
                arena.compare(NodeKind.EQ, odd, arena.integer(0)), "(a + b) * 2 % 4 == 0"), a, b);
        fixture.rewrite(AssertionFixture.monochrome());

        assertThat(fixture.reportOf(1, 2)).containsExactly(
                "> assert((a + b) * 2 % 4 == 0)",
                "E assert((1 + 2) * 2 % 4 == 0)",
                "> subexpressions:",
                "  a = 1",
                "  b = 2");
    }

    @Test
    public void eagerAndShowsEveryFailingOperand() {
        assertThat(eagerAndReport(1, 5)).containsExactly(
                "> assert((a == 1) && (b == 2))",
                "E assert((...) && (5 == 2))",
                "> subexpressions:",
                "  b = 5");
        assertThat(eagerAndReport(0, 2)).containsExactly(
                "> assert((a == 1) && (b == 2))",
                "E assert((0 == 1) && (...))",
                "> subexpressions:",
                "  a = 0");
        assertThat(eagerAndReport(0, 0)).containsExactly(
                "> assert((a == 1) && (b == 2))",
                "E assert((0 == 1) && (0 == 2))",
                "> subexpressions:",
                "  a = 0",
                "  b = 0");
    }

    @Test
    public void skipsAssertionsOnFloatingValues() {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl d = new VarDecl("d", CType.DOUBLE);
        int condition = arena.compare(NodeKind.GT, arena.variable(d),
                arena.convert(CType.DOUBLE, arena.integer(0)));
        FunctionDefinition test = fixture.defineTest(fixture.assertion(condition, "d > 0"), d);
        int body = test.getBody();

        RewriteReport report = fixture.rewrite(AssertionFixture.monochrome());

        assertThat(report.getMatched()).isEqualTo(1);
        assertThat(report.getSkipped()).isEqualTo(1);
        assertThat(report.getRewritten()).isZero();
        assertThat(report.getDiagnostics()).hasSize(1);
        assertThat(report.getDiagnostics().get(0).getKind()).isEqualTo(Diagnostic.Kind.WARNING);
        assertThat(report.getDiagnostics().get(0).getMessage()).contains("double");
        assertThat(report.getDiagnostics().get(0).getLocation()).isEqualTo("test.c:3");
        assertThat(test.getBody()).isEqualTo(body);

        assertThat(fixture.runFailing(-1.5)).isEmpty();
        assertThat(fixture.environment.getErrorLines()).containsExactly("test.c:3: test: Assertion `d > 0' failed.");
    }

    @Test
    public void leavesAssertionsAloneWithoutPrintPrimitives() {
        AssertionFixture fixture = new AssertionFixture(false);
        NodeArena arena = fixture.arena;
        VarDecl n = new VarDecl("n", CType.INT);
        FunctionDefinition test = fixture.defineTest(fixture.assertion(
                arena.compare(NodeKind.EQ, arena.variable(n), arena.integer(5)), "n == 5"), n);
        int body = test.getBody();

        RewriteReport report = fixture.rewrite(AssertionFixture.monochrome());

        assertThat(report.getSkipped()).isEqualTo(1);
        assertThat(report.getDiagnostics()).hasSize(1);
        assertThat(report.getDiagnostics().get(0).getKind()).isEqualTo(Diagnostic.Kind.ERROR);
        assertThat(report.getDiagnostics().get(0).getMessage()).contains("printf, snprintf, abort");
        assertThat(test.getBody()).isEqualTo(body);
    }

    private static List<String> eagerAndReport(int aValue, int bValue) {
        AssertionFixture fixture = new AssertionFixture();
        NodeArena arena = fixture.arena;
        VarDecl a = new VarDecl("a", CType.INT);
        VarDecl b = new VarDecl("b", CType.INT);
        int condition = arena.compare(NodeKind.TRUTH_AND,
                arena.compare(NodeKind.EQ, arena.variable(a), arena.integer(1)),
                arena.compare(NodeKind.EQ, arena.variable(b), arena.integer(2)));
        fixture.defineTest(fixture.assertion(condition, "(a == 1) & (b == 2)"), a, b);
        fixture.rewrite(AssertionFixture.monochrome());
        return fixture.reportOf(aValue, bValue);
    }
}
