package org.introspect.tree;

public final class AddressOfNode extends AbstractNode {
    public final int operand;

    public AddressOfNode(CType type, int operand) {
        super(NodeKind.ADDR, type);
        this.operand = operand;
    }

    @Override
    public int[] operands() {
        return new int[]{operand};
    }
}
