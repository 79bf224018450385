package org.introspect.rewriter;

import org.introspect.tree.AbstractNode;
import org.introspect.tree.BinaryNode;
import org.introspect.tree.CallNode;
import org.introspect.tree.ConversionNode;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.SaveNode;
import org.introspect.tree.VarRefNode;

/**
 * Puts evaluate-once handles around every value the report reads a second time. Children are handled
 * before their parent; a parent whose children changed is re-added to the arena. Pure values stay unwrapped,
 * and a tree that is already wrapped comes back unchanged.
 */
public final class SingleEvaluationWrapper {
    private final NodeArena arena;

    public SingleEvaluationWrapper(NodeArena arena) {
        this.arena = arena;
    }

    public int wrap(int index) {
        AbstractNode node = arena.get(index);
        switch (node.getKind()) {
            case SAVE:
            case INTEGER_CST:
            case STRING_CST:
            case ADDR:
                return index;
            case VAR_REF:
                return protect(index);
            case CONVERT: {
                ConversionNode conversion = (ConversionNode) node;
                int operand = wrap(conversion.operand);
                int rebuilt = operand == conversion.operand ? index : arena.convert(node.getType(), operand);
                return protect(rebuilt);
            }
            case CALL: {
                CallNode call = (CallNode) node;
                int[] arguments = new int[call.argumentCount()];
                boolean changed = false;
                for (int i = 0; i < arguments.length; i++) {
                    arguments[i] = wrap(call.argument(i));
                    changed |= arguments[i] != call.argument(i);
                }
                return arena.save(changed ? arena.call(call.function, arguments) : index);
            }
            default:
                if (node.getKind().isBinary()) {
                    BinaryNode binary = (BinaryNode) node;
                    int left = wrap(binary.left);
                    int right = wrap(binary.right);
                    int rebuilt = left == binary.left && right == binary.right
                            ? index : arena.binary(node.getKind(), node.getType(), left, right);
                    return protect(rebuilt);
                }
                throw new UnsupportedExpressionException("Cannot report a " + node.getKind()
                        + " node inside an assertion");
        }
    }

    /**
     * True for values that can be read again without side effects and without changing.
     */
    public boolean isPure(int index) {
        AbstractNode node = arena.get(index);
        switch (node.getKind()) {
            case INTEGER_CST:
            case STRING_CST:
            case ADDR:
                return true;
            case VAR_REF:
                return !((VarRefNode) node).decl.getType().isVolatile();
            case CONVERT:
                return isPure(((ConversionNode) node).operand);
            default:
                if (node.getKind().isBinary()) {
                    BinaryNode binary = (BinaryNode) node;
                    return isPure(binary.left) && isPure(binary.right);
                }
                return false;
        }
    }

    /**
     * Checks that a wrapped tree only exposes handles or pure values to the report.
     *
     * @throws IllegalStateException on a node that would be evaluated twice
     */
    public void verify(int index) {
        AbstractNode node = arena.get(index);
        if (node.getKind() != NodeKind.SAVE && !isPure(index)) {
            throw new IllegalStateException("Node " + index + " of kind " + node.getKind()
                    + " is read again by the report but has no evaluate-once handle");
        }
        AbstractNode inner = node.getKind() == NodeKind.SAVE ? arena.get(((SaveNode) node).operand) : node;
        if (inner.getKind() == NodeKind.ADDR) {
            return;
        }
        for (int operand : inner.operands()) {
            verify(operand);
        }
    }

    private int protect(int index) {
        return isPure(index) ? index : arena.save(index);
    }
}
