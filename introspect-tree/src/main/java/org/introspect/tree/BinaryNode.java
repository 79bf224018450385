package org.introspect.tree;

public final class BinaryNode extends AbstractNode {
    public final int left;
    public final int right;

    public BinaryNode(NodeKind kind, CType type, int left, int right) {
        super(kind, type);
        if (!kind.isBinary()) {
            throw new IllegalArgumentException("Not a binary operator: " + kind);
        }
        this.left = left;
        this.right = right;
    }

    @Override
    public int[] operands() {
        return new int[]{left, right};
    }
}
