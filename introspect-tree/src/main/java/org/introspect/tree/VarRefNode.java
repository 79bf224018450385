package org.introspect.tree;

import java.util.Objects;

public final class VarRefNode extends AbstractNode {
    public final VarDecl decl;

    public VarRefNode(VarDecl decl) {
        super(NodeKind.VAR_REF, decl.getType());
        this.decl = Objects.requireNonNull(decl, "decl");
    }

    @Override
    public int[] operands() {
        return new int[0];
    }
}
