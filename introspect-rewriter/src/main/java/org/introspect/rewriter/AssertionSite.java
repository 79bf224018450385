package org.introspect.rewriter;

/**
 * The parts of a matched assertion conditional: the condition and the arguments of the failure call.
 */
public final class AssertionSite {
    private final int conditional;
    private final int condition;
    private final int thenBranch;
    private final String expressionText;
    private final int fileArgument;
    private final String file;
    private final long line;
    private final int functionArgument;

    AssertionSite(int conditional, int condition, int thenBranch, String expressionText, int fileArgument,
                  String file, long line, int functionArgument) {
        this.conditional = conditional;
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.expressionText = expressionText;
        this.fileArgument = fileArgument;
        this.file = file;
        this.line = line;
        this.functionArgument = functionArgument;
    }

    public int getConditional() {
        return conditional;
    }

    public int getCondition() {
        return condition;
    }

    public int getThenBranch() {
        return thenBranch;
    }

    /**
     * Expression text as the assertion macro stringified it.
     */
    public String getExpressionText() {
        return expressionText;
    }

    public int getFileArgument() {
        return fileArgument;
    }

    public String getFile() {
        return file;
    }

    public long getLine() {
        return line;
    }

    /**
     * Argument that yields the enclosing function name at runtime.
     */
    public int getFunctionArgument() {
        return functionArgument;
    }

    public String location() {
        return file + ":" + line;
    }

    @Override
    public String toString() {
        return "assert(" + expressionText + ") at " + location();
    }
}
