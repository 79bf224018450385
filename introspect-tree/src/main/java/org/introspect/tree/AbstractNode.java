package org.introspect.tree;

import java.util.Objects;

/**
 * A node of the expression and statement tree. Nodes are immutable and live in a {@link NodeArena}, where they
 * reference each other by index.
 */
public abstract class AbstractNode {
    private final NodeKind kind;
    private final CType type;

    protected AbstractNode(NodeKind kind, CType type) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.type = Objects.requireNonNull(type, "type");
    }

    public NodeKind getKind() {
        return kind;
    }

    public CType getType() {
        return type;
    }

    /**
     * Indexes of the nodes this node owns, in evaluation order.
     */
    public abstract int[] operands();

    @Override
    public String toString() {
        return kind + ":" + type;
    }
}
