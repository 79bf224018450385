package org.introspect.rewriter;

import org.introspect.tree.CType;
import org.introspect.tree.IntegerConstantNode;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.SaveNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Picks the printf conversion for a value from its static type.
 */
public final class FormatResolver {
    static final String STRING_FORMAT = "\"%s\"";
    static final String POINTER_FORMAT = "%p";

    private static final Map<String, String> INTEGER_FORMATS = new HashMap<>();

    static {
        INTEGER_FORMATS.put("char", "%d");
        INTEGER_FORMATS.put("signed char", "%hhd");
        INTEGER_FORMATS.put("unsigned char", "%hhu");
        INTEGER_FORMATS.put("short", "%hd");
        INTEGER_FORMATS.put("unsigned short", "%hu");
        INTEGER_FORMATS.put("int", "%d");
        INTEGER_FORMATS.put("unsigned int", "%u");
        INTEGER_FORMATS.put("long", "%ld");
        INTEGER_FORMATS.put("unsigned long", "%lu");
        INTEGER_FORMATS.put("long long", "%lld");
        INTEGER_FORMATS.put("unsigned long long", "%llu");
    }

    private final NodeArena arena;

    public FormatResolver(NodeArena arena) {
        this.arena = arena;
    }

    /**
     * Plan for the value of a node. Evaluate-once handles are looked through; an implicit conversion on top
     * contributes its cast text.
     */
    public FormatPlan resolve(int index) {
        int node = stripSaves(index);
        String cast = null;
        if (arena.kind(node) == NodeKind.CONVERT) {
            cast = "(" + arena.type(node).displayName() + ")";
        }
        return new FormatPlan(specifier(arena.type(node), isNullPointerLiteral(node)), cast);
    }

    public static String specifier(CType type, boolean nullPointerLiteral) {
        CType canonical = type.canonical();
        switch (canonical.getKind()) {
            case POINTER:
                if (!nullPointerLiteral && canonical.getPointee().isStringLike()) {
                    return STRING_FORMAT;
                }
                return POINTER_FORMAT;
            case BOOLEAN:
                return "%d";
            case INTEGER:
            case ENUM: {
                String format = canonical.isAnonymous() ? null : INTEGER_FORMATS.get(canonical.getName());
                if (format != null) {
                    return format;
                }
                return canonical.isUnsigned() ? "%u" : "%d";
            }
            default:
                throw new UnsupportedExpressionException("Cannot print a value of type '" + type.displayName() + "'");
        }
    }

    private boolean isNullPointerLiteral(int index) {
        int node = EntityIdentity.unwrap(arena, index);
        if (arena.kind(node) != NodeKind.INTEGER_CST) {
            return false;
        }
        IntegerConstantNode constant = arena.get(node, IntegerConstantNode.class);
        return constant.value == 0 && (constant.getType().canonical().isPointer()
                || arena.type(index).canonical().isPointer());
    }

    private int stripSaves(int index) {
        int node = index;
        while (arena.kind(node) == NodeKind.SAVE) {
            node = arena.get(node, SaveNode.class).operand;
        }
        return node;
    }
}
