package org.introspect.tree;

import java.util.Objects;

/**
 * A fixed-capacity character buffer together with the cursor that tracks how much of it is written.
 */
public final class BufferDescriptor {
    private final SyntheticLocal buffer;
    private final SyntheticLocal cursor;

    public BufferDescriptor(SyntheticLocal buffer, SyntheticLocal cursor) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        if (buffer.getKind() != SyntheticLocal.Kind.BUFFER || cursor.getKind() != SyntheticLocal.Kind.CURSOR) {
            throw new IllegalArgumentException("Expected a buffer and a cursor, got " + buffer + " and " + cursor);
        }
    }

    public static BufferDescriptor named(String name, int capacity) {
        return new BufferDescriptor(SyntheticLocal.buffer(name, capacity), SyntheticLocal.cursor(name + "_pos"));
    }

    public SyntheticLocal getBuffer() {
        return buffer;
    }

    public SyntheticLocal getCursor() {
        return cursor;
    }

    public int getCapacity() {
        return buffer.getCapacity();
    }
}
