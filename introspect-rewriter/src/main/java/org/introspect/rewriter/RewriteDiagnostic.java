package org.introspect.rewriter;

import javax.tools.Diagnostic;
import java.util.Locale;

public final class RewriteDiagnostic {
    private final Diagnostic.Kind kind;
    private final String message;
    private final String location;

    public RewriteDiagnostic(Diagnostic.Kind kind, String message, String location) {
        this.kind = kind;
        this.message = message;
        this.location = location;
    }

    public Diagnostic.Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * {@code file:line} of the assertion, or null for diagnostics about the whole unit.
     */
    public String getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return (location != null ? location + ": " : "") + kind.name().toLowerCase(Locale.ROOT) + ": " + message;
    }
}
