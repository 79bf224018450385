package org.introspect.tree;

import java.util.Objects;

public final class LocalRefNode extends AbstractNode {
    public final SyntheticLocal local;

    public LocalRefNode(SyntheticLocal local) {
        super(NodeKind.LOCAL_REF, local.getType());
        this.local = Objects.requireNonNull(local, "local");
    }

    @Override
    public int[] operands() {
        return new int[0];
    }
}
