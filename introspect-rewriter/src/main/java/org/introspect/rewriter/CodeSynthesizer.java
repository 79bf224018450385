package org.introspect.rewriter;

import org.introspect.tree.BufferDescriptor;
import org.introspect.tree.NodeArena;
import org.introspect.tree.SyntheticLocal;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the replacement for a matched assertion: the same condition, now under evaluate-once handles, and
 * a failure block that prints the header, the evaluated part of the condition and the subexpressions, then
 * aborts.
 */
public final class CodeSynthesizer {
    static final String SUBEXPRESSIONS_HEADER = "> subexpressions:\n";

    private final NodeArena arena;
    private final RewriteDefaults defaults;
    private final SingleEvaluationWrapper wrapper;

    public CodeSynthesizer(NodeArena arena, RewriteDefaults defaults) {
        this.arena = arena;
        this.defaults = defaults;
        this.wrapper = new SingleEvaluationWrapper(arena);
    }

    /**
     * @return index of the new conditional that takes the place of the matched one
     * @throws UnsupportedExpressionException when the condition cannot be reported
     */
    public int synthesize(AssertionSite site, AssertionScope scope, ResolvedPrimitives primitives) {
        int condition = wrapper.wrap(site.getCondition());
        wrapper.verify(condition);

        StaticReconstructor reconstructor = new StaticReconstructor(arena, scope.getColors(),
                defaults.showStaticCastsEnabled());
        RuntimeReporter reporter = new RuntimeReporter(arena, scope, primitives.getSnprintf(), reconstructor);
        ReportBuilder expression = reporter.newBuilder().text("assert(");
        reporter.report(condition, expression);
        List<Integer> report = expression.text(")").build();
        // colors are assigned by the report, so the static text is built after it
        String source = reconstructor.reconstruct(condition);

        BufferDescriptor expressionBuffer = scope.getExpressionBuffer();
        BufferDescriptor subexpressionBuffer = scope.getSubexpressionBuffer();
        List<Integer> block = new ArrayList<>();
        block.add(print(primitives, "In %s:" + site.getLine() + ", function '%s':\n",
                site.getFileArgument(), site.getFunctionArgument()));
        block.add(print(primitives, "> assert(%s)\n", arena.string(source)));
        declare(block, expressionBuffer);
        declare(block, subexpressionBuffer);
        for (SyntheticLocal flag : scope.getFlags()) {
            block.add(arena.declare(flag));
        }
        block.addAll(report);
        String marker = scope.getColors().getPalette().highlight("E");
        block.add(print(primitives, marker + " %s\n", arena.reference(expressionBuffer.getBuffer())));
        block.add(print(primitives, SUBEXPRESSIONS_HEADER + "%s", arena.reference(subexpressionBuffer.getBuffer())));
        block.add(arena.call(primitives.getAbort()));

        return arena.conditional(condition, site.getThenBranch(), arena.block(block));
    }

    private void declare(List<Integer> block, BufferDescriptor buffer) {
        block.add(arena.declare(buffer.getBuffer()));
        block.add(arena.declare(buffer.getCursor()));
    }

    private int print(ResolvedPrimitives primitives, String format, int... arguments) {
        int[] all = new int[arguments.length + 1];
        all[0] = arena.string(format);
        System.arraycopy(arguments, 0, all, 1, arguments.length);
        return arena.call(primitives.getPrintf(), all);
    }
}
