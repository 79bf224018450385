package org.introspect.rewriter;

import org.introspect.tree.FunctionDecl;
import org.introspect.tree.TranslationUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The functions generated code calls, looked up by name once per translation unit.
 */
public final class ResolvedPrimitives {
    private final FunctionDecl printf;
    private final FunctionDecl snprintf;
    private final FunctionDecl abort;
    private final List<String> missing;

    private ResolvedPrimitives(FunctionDecl printf, FunctionDecl snprintf, FunctionDecl abort, List<String> missing) {
        this.printf = printf;
        this.snprintf = snprintf;
        this.abort = abort;
        this.missing = Collections.unmodifiableList(missing);
    }

    public static ResolvedPrimitives resolve(TranslationUnit unit, RewriteDefaults defaults) {
        List<String> missing = new ArrayList<>();
        FunctionDecl printf = find(unit, defaults.printfNameOrDefault(), missing);
        FunctionDecl snprintf = find(unit, defaults.snprintfNameOrDefault(), missing);
        FunctionDecl abort = find(unit, defaults.abortNameOrDefault(), missing);
        return new ResolvedPrimitives(printf, snprintf, abort, missing);
    }

    private static FunctionDecl find(TranslationUnit unit, String name, List<String> missing) {
        FunctionDecl decl = unit.findFunction(name);
        if (decl == null) {
            missing.add(name);
        }
        return decl;
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }

    public List<String> missing() {
        return missing;
    }

    public FunctionDecl getPrintf() {
        return require(printf);
    }

    public FunctionDecl getSnprintf() {
        return require(snprintf);
    }

    public FunctionDecl getAbort() {
        return require(abort);
    }

    private FunctionDecl require(FunctionDecl decl) {
        if (decl == null) {
            throw new IllegalStateException("Runtime primitives " + missing + " were not resolved");
        }
        return decl;
    }
}
