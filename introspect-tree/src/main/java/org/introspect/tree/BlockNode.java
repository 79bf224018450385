package org.introspect.tree;

public final class BlockNode extends AbstractNode {
    private final int[] statements;

    public BlockNode(int... statements) {
        super(NodeKind.BLOCK, CType.VOID);
        this.statements = statements.clone();
    }

    public int size() {
        return statements.length;
    }

    public int statement(int index) {
        return statements[index];
    }

    @Override
    public int[] operands() {
        return statements.clone();
    }
}
