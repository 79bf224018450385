package org.introspect.tree;

import java.util.Objects;

/**
 * Declares a synthetic local, zero-initialized.
 */
public final class LocalDeclNode extends AbstractNode {
    public final SyntheticLocal local;

    public LocalDeclNode(SyntheticLocal local) {
        super(NodeKind.LOCAL_DECL, CType.VOID);
        this.local = Objects.requireNonNull(local, "local");
    }

    @Override
    public int[] operands() {
        return new int[0];
    }
}
