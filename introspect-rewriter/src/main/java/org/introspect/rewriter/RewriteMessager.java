package org.introspect.rewriter;

import javax.tools.Diagnostic;

/**
 * Receives the diagnostics of a rewrite, in the manner of an annotation processing {@code Messager}.
 */
public interface RewriteMessager {

    void printMessage(Diagnostic.Kind kind, String message, AssertionSite site);
}
