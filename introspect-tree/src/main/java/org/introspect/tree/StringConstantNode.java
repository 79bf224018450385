package org.introspect.tree;

import java.util.Objects;

public final class StringConstantNode extends AbstractNode {
    public static final CType STRING_TYPE = CType.pointerTo(CType.CHAR.withConst());

    public final String value;

    public StringConstantNode(String value) {
        super(NodeKind.STRING_CST, STRING_TYPE);
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public int[] operands() {
        return new int[0];
    }
}
