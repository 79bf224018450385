package org.introspect.tree;

public final class NopNode extends AbstractNode {

    public NopNode() {
        super(NodeKind.NOP, CType.VOID);
    }

    @Override
    public int[] operands() {
        return new int[0];
    }
}
