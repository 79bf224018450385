package org.introspect.tree;

public enum NodeKind {
    EQ(Category.RELATIONAL, "==", 6),
    NE(Category.RELATIONAL, "!=", 6),
    LT(Category.RELATIONAL, "<", 7),
    LE(Category.RELATIONAL, "<=", 7),
    GT(Category.RELATIONAL, ">", 7),
    GE(Category.RELATIONAL, ">=", 7),
    TRUTH_ANDIF(Category.LOGICAL, "&&", 2),
    TRUTH_AND(Category.LOGICAL, "&&", 2),
    TRUTH_ORIF(Category.LOGICAL, "||", 1),
    TRUTH_OR(Category.LOGICAL, "||", 1),
    PLUS(Category.ARITHMETIC, "+", 9),
    MINUS(Category.ARITHMETIC, "-", 9),
    MULT(Category.ARITHMETIC, "*", 10),
    TRUNC_DIV(Category.ARITHMETIC, "/", 10),
    TRUNC_MOD(Category.ARITHMETIC, "%", 10),
    BIT_AND(Category.ARITHMETIC, "&", 5),
    BIT_XOR(Category.ARITHMETIC, "^", 4),
    BIT_IOR(Category.ARITHMETIC, "|", 3),
    LSHIFT(Category.ARITHMETIC, "<<", 8),
    RSHIFT(Category.ARITHMETIC, ">>", 8),
    CALL(Category.LEAF, null, 100),
    VAR_REF(Category.LEAF, null, 100),
    INTEGER_CST(Category.LEAF, null, 100),
    STRING_CST(Category.LEAF, null, 100),
    ADDR(Category.LEAF, null, 100),
    CONVERT(Category.WRAPPER, null, 100),
    SAVE(Category.WRAPPER, null, 100),
    CONDITIONAL(Category.STATEMENT, null, 0),
    NOP(Category.STATEMENT, null, 0),
    BLOCK(Category.STATEMENT, null, 0),
    LOCAL_DECL(Category.STATEMENT, null, 0),
    LOCAL_REF(Category.LEAF, null, 100),
    FLAG_SET(Category.STATEMENT, null, 0),
    BUFFER_APPEND(Category.STATEMENT, null, 0);

    public enum Category {
        RELATIONAL,
        LOGICAL,
        ARITHMETIC,
        LEAF,
        WRAPPER,
        STATEMENT
    }

    private final Category category;
    private final String operator;
    private final int precedence;

    NodeKind(Category category, String operator, int precedence) {
        this.category = category;
        this.operator = operator;
        this.precedence = precedence;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Source text of a binary operator, null for every other kind.
     */
    public String getOperator() {
        return operator;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isBinary() {
        return category == Category.RELATIONAL || category == Category.LOGICAL || category == Category.ARITHMETIC;
    }

    public boolean isLogical() {
        return category == Category.LOGICAL;
    }

    public boolean isConjunction() {
        return this == TRUTH_ANDIF || this == TRUTH_AND;
    }

    public boolean isShortCircuit() {
        return this == TRUTH_ANDIF || this == TRUTH_ORIF;
    }
}
