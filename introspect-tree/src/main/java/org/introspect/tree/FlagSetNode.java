package org.introspect.tree;

import java.util.Objects;

public final class FlagSetNode extends AbstractNode {
    public final SyntheticLocal flag;

    public FlagSetNode(SyntheticLocal flag) {
        super(NodeKind.FLAG_SET, CType.VOID);
        if (flag.getKind() != SyntheticLocal.Kind.FLAG) {
            throw new IllegalArgumentException("Not a flag: " + flag);
        }
        this.flag = Objects.requireNonNull(flag, "flag");
    }

    @Override
    public int[] operands() {
        return new int[0];
    }
}
