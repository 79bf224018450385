package org.introspect.tree;

public final class IntegerConstantNode extends AbstractNode {
    public final long value;

    public IntegerConstantNode(CType type, long value) {
        super(NodeKind.INTEGER_CST, type);
        this.value = value;
    }

    /**
     * A zero constant of pointer type, which is how {@code NULL} reaches the tree.
     */
    public boolean isNullPointer() {
        return value == 0 && getType().canonical().isPointer();
    }

    @Override
    public int[] operands() {
        return new int[0];
    }
}
