package org.introspect.tree;

public final class ConditionalNode extends AbstractNode {
    public final int condition;
    public final int thenBranch;
    public final int elseBranch;

    public ConditionalNode(int condition, int thenBranch, int elseBranch) {
        super(NodeKind.CONDITIONAL, CType.VOID);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    @Override
    public int[] operands() {
        return new int[]{condition, thenBranch, elseBranch};
    }
}
