package org.introspect.tree;

import java.util.Objects;

/**
 * A variable or parameter declaration. References to the same declaration share this instance, so
 * declarations compare by identity.
 */
public final class VarDecl {
    private final String name;
    private final CType type;

    public VarDecl(String name, CType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public CType getType() {
        return type;
    }

    @Override
    public String toString() {
        return type.declare(name);
    }
}
