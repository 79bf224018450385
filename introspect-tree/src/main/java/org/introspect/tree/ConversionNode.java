package org.introspect.tree;

/**
 * Implicit conversion of the operand to this node's type.
 */
public final class ConversionNode extends AbstractNode {
    public final int operand;

    public ConversionNode(CType type, int operand) {
        super(NodeKind.CONVERT, type);
        this.operand = operand;
    }

    @Override
    public int[] operands() {
        return new int[]{operand};
    }
}
