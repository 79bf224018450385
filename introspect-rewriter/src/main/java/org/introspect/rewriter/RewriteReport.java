package org.introspect.rewriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of rewriting one translation unit.
 */
public final class RewriteReport {
    private final String fileName;
    private int matched;
    private int rewritten;
    private int skipped;
    private final List<RewriteDiagnostic> diagnostics = new ArrayList<>();

    RewriteReport(String fileName) {
        this.fileName = fileName;
    }

    void recordMatch() {
        matched++;
    }

    void recordRewrite() {
        rewritten++;
    }

    void recordSkip() {
        skipped++;
    }

    void addDiagnostics(List<RewriteDiagnostic> collected) {
        diagnostics.addAll(collected);
    }

    public String getFileName() {
        return fileName;
    }

    public int getMatched() {
        return matched;
    }

    public int getRewritten() {
        return rewritten;
    }

    public int getSkipped() {
        return skipped;
    }

    public List<RewriteDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    @Override
    public String toString() {
        return fileName + ": " + matched + " assertions, " + rewritten + " rewritten, " + skipped + " skipped";
    }
}
