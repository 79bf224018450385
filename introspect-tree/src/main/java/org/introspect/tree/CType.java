package org.introspect.tree;

import java.util.Objects;

/**
 * Static type of a tree node, modelled after the C type system as far as the rewriter needs it.
 */
public final class CType {

    public enum Kind {
        VOID,
        BOOLEAN,
        INTEGER,
        ENUM,
        REAL,
        POINTER,
        RECORD
    }

    public static final CType VOID = new CType(Kind.VOID, "void", false, 0, null, null, false, false);
    public static final CType BOOL = new CType(Kind.BOOLEAN, "_Bool", true, 1, null, null, false, false);
    public static final CType CHAR = integer("char", 8, false);
    public static final CType SIGNED_CHAR = integer("signed char", 8, false);
    public static final CType UNSIGNED_CHAR = integer("unsigned char", 8, true);
    public static final CType SHORT = integer("short", 16, false);
    public static final CType UNSIGNED_SHORT = integer("unsigned short", 16, true);
    public static final CType INT = integer("int", 32, false);
    public static final CType UNSIGNED_INT = integer("unsigned int", 32, true);
    public static final CType LONG = integer("long", 64, false);
    public static final CType UNSIGNED_LONG = integer("unsigned long", 64, true);
    public static final CType LONG_LONG = integer("long long", 64, false);
    public static final CType UNSIGNED_LONG_LONG = integer("unsigned long long", 64, true);
    public static final CType FLOAT = new CType(Kind.REAL, "float", false, 32, null, null, false, false);
    public static final CType DOUBLE = new CType(Kind.REAL, "double", false, 64, null, null, false, false);

    private final Kind kind;
    private final String name;
    private final boolean unsigned;
    private final int precision;
    private final CType pointee;
    private final CType typedefTarget;
    private final boolean constQualified;
    private final boolean volatileQualified;

    private CType(Kind kind, String name, boolean unsigned, int precision, CType pointee, CType typedefTarget,
                  boolean constQualified, boolean volatileQualified) {
        this.kind = kind;
        this.name = name;
        this.unsigned = unsigned;
        this.precision = precision;
        this.pointee = pointee;
        this.typedefTarget = typedefTarget;
        this.constQualified = constQualified;
        this.volatileQualified = volatileQualified;
    }

    /**
     * Integer type. A null name makes the type anonymous.
     */
    public static CType integer(String name, int precision, boolean unsigned) {
        return new CType(Kind.INTEGER, name, unsigned, precision, null, null, false, false);
    }

    public static CType enumeration(String tag) {
        return new CType(Kind.ENUM, tag == null ? null : "enum " + tag, false, 32, null, null, false, false);
    }

    public static CType record(String tag) {
        return new CType(Kind.RECORD, "struct " + tag, false, 0, null, null, false, false);
    }

    public static CType pointerTo(CType pointee) {
        Objects.requireNonNull(pointee, "pointee");
        return new CType(Kind.POINTER, null, true, 64, pointee, null, false, false);
    }

    public static CType typedef(String name, CType target) {
        Objects.requireNonNull(target, "target");
        return new CType(target.kind, name, target.unsigned, target.precision, target.pointee, target, false, false);
    }

    public CType withConst() {
        return new CType(kind, name, unsigned, precision, pointee, typedefTarget, true, volatileQualified);
    }

    public CType withVolatile() {
        return new CType(kind, name, unsigned, precision, pointee, typedefTarget, constQualified, true);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public boolean isAnonymous() {
        return name == null;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    public int getPrecision() {
        return precision;
    }

    public CType getPointee() {
        return pointee;
    }

    public CType getTypedefTarget() {
        return typedefTarget;
    }

    public boolean isConst() {
        return constQualified;
    }

    public boolean isVolatile() {
        return volatileQualified || (typedefTarget != null && typedefTarget.isVolatile());
    }

    public boolean isPointer() {
        return kind == Kind.POINTER;
    }

    public boolean isIntegral() {
        return kind == Kind.INTEGER || kind == Kind.ENUM || kind == Kind.BOOLEAN;
    }

    /**
     * Strips typedefs down to the underlying type.
     */
    public CType canonical() {
        CType type = this;
        while (type.typedefTarget != null) {
            type = type.typedefTarget;
        }
        return type;
    }

    public boolean isStringLike() {
        CType canonical = canonical();
        if (canonical.kind != Kind.INTEGER || canonical.precision != 8) {
            return false;
        }
        return "char".equals(canonical.name) || "signed char".equals(canonical.name)
                || "unsigned char".equals(canonical.name);
    }

    public String displayName() {
        String qualifiers = (constQualified ? "const " : "") + (volatileQualified ? "volatile " : "");
        if (kind == Kind.POINTER && typedefTarget == null) {
            String base = pointee.displayName();
            String pointer = base.endsWith("*") ? base + "*" : base + " *";
            if (constQualified || volatileQualified) {
                pointer += (constQualified ? " const" : "") + (volatileQualified ? " volatile" : "");
            }
            return pointer;
        }
        if (name != null) {
            return qualifiers + name;
        }
        if (kind == Kind.ENUM) {
            return qualifiers + "int";
        }
        if (precision <= 32) {
            return qualifiers + (unsigned ? "unsigned int" : "int");
        }
        return qualifiers + (unsigned ? "unsigned long long" : "long long");
    }

    /**
     * Declarator text for a variable of this type, e.g. {@code const char *s}.
     */
    public String declare(String variable) {
        String type = displayName();
        return type.endsWith("*") ? type + variable : type + " " + variable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CType other = (CType) o;
        return unsigned == other.unsigned
                && precision == other.precision
                && constQualified == other.constQualified
                && volatileQualified == other.volatileQualified
                && kind == other.kind
                && Objects.equals(name, other.name)
                && Objects.equals(pointee, other.pointee)
                && Objects.equals(typedefTarget, other.typedefTarget);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, unsigned, precision, pointee, typedefTarget, constQualified, volatileQualified);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
