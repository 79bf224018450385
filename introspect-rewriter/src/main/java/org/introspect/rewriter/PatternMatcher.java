package org.introspect.rewriter;

import org.introspect.tree.CallNode;
import org.introspect.tree.ConditionalNode;
import org.introspect.tree.ConversionNode;
import org.introspect.tree.IntegerConstantNode;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.StringConstantNode;

/**
 * Recognizes the conditional an {@code assert} macro expands into:
 * {@code cond ? (void) 0 : __assert_fail("expr", "file.c", line, __func__)}.
 */
public final class PatternMatcher {
    private static final int FAILURE_ARGUMENTS = 4;

    private final NodeArena arena;
    private final String failureFunction;

    public PatternMatcher(NodeArena arena, String failureFunction) {
        this.arena = arena;
        this.failureFunction = failureFunction;
    }

    public boolean matches(int index) {
        return match(index) != null;
    }

    /**
     * Returns the matched site, or null when the node is anything but a complete assertion expansion.
     */
    public AssertionSite match(int index) {
        if (arena.kind(index) != NodeKind.CONDITIONAL) {
            return null;
        }
        ConditionalNode conditional = arena.get(index, ConditionalNode.class);
        if (arena.kind(conditional.thenBranch) != NodeKind.NOP
                || arena.kind(conditional.elseBranch) != NodeKind.CALL) {
            return null;
        }
        CallNode call = arena.get(conditional.elseBranch, CallNode.class);
        if (!failureFunction.equals(call.function.getName()) || call.argumentCount() != FAILURE_ARGUMENTS) {
            return null;
        }
        int expression = skipConversions(call.argument(0));
        int file = skipConversions(call.argument(1));
        int line = skipConversions(call.argument(2));
        if (arena.kind(expression) != NodeKind.STRING_CST
                || arena.kind(file) != NodeKind.STRING_CST
                || arena.kind(line) != NodeKind.INTEGER_CST) {
            return null;
        }
        return new AssertionSite(index, conditional.condition, conditional.thenBranch,
                arena.get(expression, StringConstantNode.class).value, file,
                arena.get(file, StringConstantNode.class).value,
                arena.get(line, IntegerConstantNode.class).value, call.argument(3));
    }

    private int skipConversions(int index) {
        int node = index;
        while (arena.kind(node) == NodeKind.CONVERT) {
            node = arena.get(node, ConversionNode.class).operand;
        }
        return node;
    }
}
