package org.introspect.runtime;

/**
 * Pointer value of the interpreter. A pointer may carry the string it points at, which is what {@code %s}
 * prints.
 */
public final class CPointer {
    public static final CPointer NULL = new CPointer(0L, null);

    private final long address;
    private final String target;

    public CPointer(long address, String target) {
        this.address = address;
        this.target = target;
    }

    public long getAddress() {
        return address;
    }

    public String getTarget() {
        return target;
    }

    public boolean isNull() {
        return address == 0L;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CPointer && ((CPointer) o).address == address;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(address);
    }

    @Override
    public String toString() {
        return isNull() ? "(nil)" : "0x" + Long.toHexString(address);
    }
}
