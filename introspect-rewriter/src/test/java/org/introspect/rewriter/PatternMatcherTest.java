package org.introspect.rewriter;

import org.introspect.tree.CType;
import org.introspect.tree.FunctionDecl;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.VarDecl;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PatternMatcherTest {
    private final AssertionFixture fixture = new AssertionFixture();
    private final NodeArena arena = fixture.arena;
    private final PatternMatcher matcher = new PatternMatcher(arena, "__assert_fail");
    private final int condition = arena.compare(NodeKind.EQ, arena.variable(new VarDecl("n", CType.INT)),
            arena.integer(5));

    @Test
    public void matchesAssertExpansion() {
        int assertion = fixture.assertion(condition, "n == 5");

        AssertionSite site = matcher.match(assertion);

        assertThat(site).isNotNull();
        assertThat(site.getCondition()).isEqualTo(condition);
        assertThat(site.getExpressionText()).isEqualTo("n == 5");
        assertThat(site.getFile()).isEqualTo("test.c");
        assertThat(site.getLine()).isEqualTo(3L);
        assertThat(site.location()).isEqualTo("test.c:3");
    }

    @Test
    public void looksThroughConversionsOfTheArguments() {
        int failure = arena.call(AssertionFixture.ASSERT_FAIL,
                arena.convert(AssertionFixture.STRING, arena.string("n == 5")),
                arena.string("test.c"),
                arena.convert(CType.UNSIGNED_INT, arena.integer(9)),
                arena.string("test"));

        assertThat(matcher.matches(arena.conditional(condition, arena.nop(), failure))).isTrue();
    }

    @Test
    public void rejectsOtherConditionals() {
        int failure = arena.call(AssertionFixture.ASSERT_FAIL, arena.string("n == 5"), arena.string("test.c"),
                arena.integer(CType.UNSIGNED_INT, 3), arena.string("test"));
        FunctionDecl report = FunctionDecl.of("report_failure", CType.VOID, AssertionFixture.STRING,
                AssertionFixture.STRING, CType.UNSIGNED_INT, AssertionFixture.STRING);
        int otherCall = arena.call(report, arena.string("n == 5"), arena.string("test.c"),
                arena.integer(CType.UNSIGNED_INT, 3), arena.string("test"));
        int shortCall = arena.call(AssertionFixture.ASSERT_FAIL, arena.string("n == 5"), arena.string("test.c"),
                arena.integer(CType.UNSIGNED_INT, 3));
        int lineNotConstant = arena.call(AssertionFixture.ASSERT_FAIL, arena.string("n == 5"),
                arena.string("test.c"), arena.variable(new VarDecl("line", CType.UNSIGNED_INT)), arena.string("test"));

        assertThat(matcher.matches(arena.conditional(condition, failure, arena.nop()))).isFalse();
        assertThat(matcher.matches(arena.conditional(condition, arena.nop(), otherCall))).isFalse();
        assertThat(matcher.matches(arena.conditional(condition, arena.nop(), shortCall))).isFalse();
        assertThat(matcher.matches(arena.conditional(condition, arena.nop(), lineNotConstant))).isFalse();
        assertThat(matcher.matches(condition)).isFalse();
    }

    @Test
    public void failureFunctionNameIsConfigurable() {
        FunctionDecl report = FunctionDecl.of("report_failure", CType.VOID, AssertionFixture.STRING,
                AssertionFixture.STRING, CType.UNSIGNED_INT, AssertionFixture.STRING);
        int assertion = arena.conditional(condition, arena.nop(), arena.call(report, arena.string("n == 5"),
                arena.string("test.c"), arena.integer(CType.UNSIGNED_INT, 3), arena.string("test")));

        assertThat(new PatternMatcher(arena, "report_failure").matches(assertion)).isTrue();
        assertThat(matcher.matches(assertion)).isFalse();
    }
}
