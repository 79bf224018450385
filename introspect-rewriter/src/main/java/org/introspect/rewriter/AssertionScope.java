package org.introspect.rewriter;

import org.introspect.tree.BufferDescriptor;
import org.introspect.tree.SyntheticLocal;
import org.introspect.tree.VarDecl;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping for rewriting one assertion: the color allocator, both report buffers and the flags that
 * keep each variable to one line in the subexpressions list. Closed once the assertion is done, whether or
 * not it was rewritten.
 */
public final class AssertionScope implements AutoCloseable {
    static final String EXPRESSION_BUFFER = "__ai_repr";
    static final String SUBEXPRESSION_BUFFER = "__ai_subexprs";
    private static final String FLAG_PREFIX = "__ai_seen_";

    private final ColorAllocator colors;
    private final BufferDescriptor expressionBuffer;
    private final BufferDescriptor subexpressionBuffer;
    private final Map<VarDecl, SyntheticLocal> flags = new IdentityHashMap<>();
    private final List<SyntheticLocal> flagOrder = new ArrayList<>();
    private boolean closed;

    public AssertionScope(RewriteDefaults defaults) {
        this.colors = new ColorAllocator(Palette.forDefaults(defaults));
        this.expressionBuffer = BufferDescriptor.named(EXPRESSION_BUFFER, defaults.bufferSizeOrDefault());
        this.subexpressionBuffer = BufferDescriptor.named(SUBEXPRESSION_BUFFER,
                defaults.subexpressionBufferSizeOrDefault());
    }

    public ColorAllocator getColors() {
        checkOpen();
        return colors;
    }

    public BufferDescriptor getExpressionBuffer() {
        return expressionBuffer;
    }

    public BufferDescriptor getSubexpressionBuffer() {
        return subexpressionBuffer;
    }

    /**
     * Flag local recording whether the line of a variable was already written.
     */
    public SyntheticLocal flagFor(VarDecl variable) {
        checkOpen();
        SyntheticLocal flag = flags.get(variable);
        if (flag == null) {
            flag = SyntheticLocal.flag(FLAG_PREFIX + flagOrder.size());
            flags.put(variable, flag);
            flagOrder.add(flag);
        }
        return flag;
    }

    public List<SyntheticLocal> getFlags() {
        return new ArrayList<>(flagOrder);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Assertion scope is already closed");
        }
    }

    @Override
    public void close() {
        colors.clear();
        flags.clear();
        flagOrder.clear();
        closed = true;
    }
}
