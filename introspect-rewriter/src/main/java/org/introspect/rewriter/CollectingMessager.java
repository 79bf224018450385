package org.introspect.rewriter;

import javax.tools.Diagnostic;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CollectingMessager implements RewriteMessager {
    private final List<RewriteDiagnostic> diagnostics = new ArrayList<>();

    @Override
    public void printMessage(Diagnostic.Kind kind, String message, AssertionSite site) {
        diagnostics.add(new RewriteDiagnostic(kind, message, site != null ? site.location() : null));
    }

    public List<RewriteDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<RewriteDiagnostic> getDiagnostics(Diagnostic.Kind kind) {
        List<RewriteDiagnostic> matching = new ArrayList<>();
        for (RewriteDiagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind() == kind) {
                matching.add(diagnostic);
            }
        }
        return matching;
    }
}
