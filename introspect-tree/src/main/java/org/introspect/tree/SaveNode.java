package org.introspect.tree;

/**
 * Evaluate-once handle: the operand is evaluated the first time the handle is reached and every later read
 * yields the captured value.
 */
public final class SaveNode extends AbstractNode {
    public final int operand;

    public SaveNode(CType type, int operand) {
        super(NodeKind.SAVE, type);
        this.operand = operand;
    }

    @Override
    public int[] operands() {
        return new int[]{operand};
    }
}
