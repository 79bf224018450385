package org.introspect.tree;

import java.util.Objects;

/**
 * Bounded formatted write at the cursor of a buffer. The format follows printf conventions, so literal percent
 * signs in it are already escaped. The cursor never moves past the last byte of the buffer.
 */
public final class BufferAppendNode extends AbstractNode {
    public final BufferDescriptor buffer;
    public final FunctionDecl formatter;
    public final String format;
    private final int[] arguments;

    public BufferAppendNode(BufferDescriptor buffer, FunctionDecl formatter, String format, int... arguments) {
        super(NodeKind.BUFFER_APPEND, CType.VOID);
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.format = Objects.requireNonNull(format, "format");
        this.arguments = arguments.clone();
    }

    public int argumentCount() {
        return arguments.length;
    }

    public int argument(int index) {
        return arguments[index];
    }

    @Override
    public int[] operands() {
        return arguments.clone();
    }
}
