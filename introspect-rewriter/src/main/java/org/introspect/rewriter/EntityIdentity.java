package org.introspect.rewriter;

import org.introspect.tree.AbstractNode;
import org.introspect.tree.ConversionNode;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.SaveNode;
import org.introspect.tree.VarDecl;
import org.introspect.tree.VarRefNode;

import java.util.Objects;

/**
 * What a colored occurrence refers to. Variable references are the same entity when they name the same
 * declaration; calls are only the same entity when they are the same node.
 */
public final class EntityIdentity {
    private final VarDecl variable;
    private final int call;

    private EntityIdentity(VarDecl variable, int call) {
        this.variable = variable;
        this.call = call;
    }

    public static EntityIdentity of(NodeArena arena, int index) {
        int node = unwrap(arena, index);
        AbstractNode unwrapped = arena.get(node);
        if (unwrapped.getKind() == NodeKind.VAR_REF) {
            return new EntityIdentity(((VarRefNode) unwrapped).decl, -1);
        }
        if (unwrapped.getKind() == NodeKind.CALL) {
            return new EntityIdentity(null, node);
        }
        throw new IllegalStateException("Node " + index + " of kind " + unwrapped.getKind() + " has no identity");
    }

    /**
     * Strips evaluate-once handles and conversions.
     */
    static int unwrap(NodeArena arena, int index) {
        int node = index;
        while (true) {
            NodeKind kind = arena.kind(node);
            if (kind == NodeKind.SAVE) {
                node = arena.get(node, SaveNode.class).operand;
            } else if (kind == NodeKind.CONVERT) {
                node = arena.get(node, ConversionNode.class).operand;
            } else {
                return node;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntityIdentity)) {
            return false;
        }
        EntityIdentity other = (EntityIdentity) o;
        return variable == other.variable && call == other.call;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(variable), call);
    }

    @Override
    public String toString() {
        return variable != null ? "var " + variable.getName() : "call #" + call;
    }
}
