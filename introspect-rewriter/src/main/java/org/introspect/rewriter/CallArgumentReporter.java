package org.introspect.rewriter;

import org.introspect.tree.AbstractNode;
import org.introspect.tree.BinaryNode;
import org.introspect.tree.CallNode;
import org.introspect.tree.FunctionDecl;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports a call: its return value goes into the expression buffer, and a line
 * {@code name(arg=value, ...) = result} goes into the subexpressions buffer after the lines of the
 * variables and calls inside its arguments.
 */
final class CallArgumentReporter {
    private final NodeArena arena;
    private final AssertionScope scope;
    private final FunctionDecl formatter;
    private final FormatResolver formats;
    private final StaticReconstructor reconstructor;
    private final RuntimeReporter reporter;

    CallArgumentReporter(NodeArena arena, AssertionScope scope, FunctionDecl formatter, FormatResolver formats,
                         StaticReconstructor reconstructor, RuntimeReporter reporter) {
        this.arena = arena;
        this.scope = scope;
        this.formatter = formatter;
        this.formats = formats;
        this.reconstructor = reconstructor;
        this.reporter = reporter;
    }

    void report(int index, ReportBuilder out) {
        Color color = scope.getColors().assign(EntityIdentity.of(arena, index));
        reportLines(RuntimeReporter.leafHandle(arena, index), out);
        out.value(formats.resolve(index).render(color), index);
    }

    private void reportLines(int handle, ReportBuilder out) {
        CallNode call = arena.get(EntityIdentity.unwrap(arena, handle), CallNode.class);
        Color color = scope.getColors().assign(EntityIdentity.of(arena, handle));
        for (int i = 0; i < call.argumentCount(); i++) {
            collect(call.argument(i), out);
        }
        StringBuilder format = new StringBuilder("  ")
                .append(FormatPlan.escape(Color.paint(color, call.function.getName()))).append('(');
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < call.argumentCount(); i++) {
            int argument = call.argument(i);
            if (i > 0) {
                format.append(", ");
            }
            format.append(FormatPlan.escape(reconstructor.reconstruct(argument)));
            if (!isConstant(argument)) {
                format.append('=').append(formats.resolve(argument).render(null));
                values.add(argument);
            }
        }
        format.append(") = ").append(formats.resolve(handle).render(null)).append('\n');
        int[] arguments = new int[values.size() + 1];
        for (int i = 0; i < values.size(); i++) {
            arguments[i] = values.get(i);
        }
        arguments[values.size()] = handle;
        out.statement(arena.append(scope.getSubexpressionBuffer(), formatter, format.toString(), arguments));
    }

    /**
     * Adds the lines of the variables and calls evaluated as part of an argument. Logical operators are not
     * descended into since their operands may not have been evaluated.
     */
    private void collect(int argument, ReportBuilder out) {
        int node = EntityIdentity.unwrap(arena, argument);
        AbstractNode unwrapped = arena.get(node);
        if (unwrapped.getKind() == NodeKind.VAR_REF) {
            out.statement(reporter.variableLine(RuntimeReporter.leafHandle(arena, argument)));
        } else if (unwrapped.getKind() == NodeKind.CALL) {
            reportLines(RuntimeReporter.leafHandle(arena, argument), out);
        } else if (unwrapped.getKind().isBinary() && !unwrapped.getKind().isLogical()) {
            BinaryNode binary = (BinaryNode) unwrapped;
            collect(binary.left, out);
            collect(binary.right, out);
        }
    }

    private boolean isConstant(int argument) {
        NodeKind kind = arena.kind(EntityIdentity.unwrap(arena, argument));
        return kind == NodeKind.INTEGER_CST || kind == NodeKind.STRING_CST || kind == NodeKind.ADDR;
    }
}
