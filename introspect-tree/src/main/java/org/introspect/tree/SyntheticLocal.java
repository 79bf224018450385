package org.introspect.tree;

import java.util.Objects;

/**
 * A local introduced by synthesized code: a character buffer, its write cursor, or a zero-initialized flag.
 */
public final class SyntheticLocal {

    public enum Kind {
        BUFFER,
        CURSOR,
        FLAG
    }

    private final String name;
    private final Kind kind;
    private final int capacity;

    private SyntheticLocal(String name, Kind kind, int capacity) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.capacity = capacity;
    }

    public static SyntheticLocal buffer(String name, int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Buffer capacity must be at least 2, got " + capacity);
        }
        return new SyntheticLocal(name, Kind.BUFFER, capacity);
    }

    public static SyntheticLocal cursor(String name) {
        return new SyntheticLocal(name, Kind.CURSOR, 0);
    }

    public static SyntheticLocal flag(String name) {
        return new SyntheticLocal(name, Kind.FLAG, 0);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public int getCapacity() {
        return capacity;
    }

    public CType getType() {
        return kind == Kind.BUFFER ? CType.pointerTo(CType.CHAR) : CType.INT;
    }

    @Override
    public String toString() {
        return kind == Kind.BUFFER ? "char " + name + "[" + capacity + "]" : "int " + name;
    }
}
