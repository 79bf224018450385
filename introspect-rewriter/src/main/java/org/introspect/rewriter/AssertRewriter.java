package org.introspect.rewriter;

import org.introspect.tree.BlockNode;
import org.introspect.tree.ConditionalNode;
import org.introspect.tree.FunctionDefinition;
import org.introspect.tree.NodeArena;
import org.introspect.tree.NodeKind;
import org.introspect.tree.TranslationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces every {@code assert} expansion in the function bodies of a translation unit with code that
 * explains the failure before aborting. Assertions that cannot be rewritten keep their original behavior.
 */
public class AssertRewriter {
    private static final Logger log = LoggerFactory.getLogger(AssertRewriter.class);

    private final RewriteDefaults defaults;
    private final RewriteMessager messager;

    public AssertRewriter() {
        this(RewriteDefaults.fromSystemEnv());
    }

    public AssertRewriter(RewriteDefaults defaults) {
        this(defaults, null);
    }

    /**
     * @param messager receives every diagnostic as it is reported, in addition to the {@link RewriteReport}
     */
    public AssertRewriter(RewriteDefaults defaults, RewriteMessager messager) {
        this.defaults = defaults == null ? new RewriteDefaults() : defaults;
        this.messager = messager;
    }

    public List<RewriteReport> rewriteAll(List<TranslationUnit> units) {
        List<RewriteReport> reports = new ArrayList<>();
        for (TranslationUnit unit : units) {
            reports.add(rewrite(unit));
        }
        return reports;
    }

    public RewriteReport rewrite(TranslationUnit unit) {
        UnitRewrite pass = new UnitRewrite(unit);
        for (FunctionDefinition definition : unit.getDefinitions()) {
            int body = pass.rewriteStatement(definition.getBody());
            if (body != definition.getBody()) {
                definition.setBody(body);
            }
        }
        pass.report.addDiagnostics(pass.diagnostics.getDiagnostics());
        log.info("Rewrote {} of {} assertions in {} ({} skipped)", pass.report.getRewritten(),
                pass.report.getMatched(), unit.getFileName(), pass.report.getSkipped());
        return pass.report;
    }

    private final class UnitRewrite {
        private final NodeArena arena;
        private final PatternMatcher matcher;
        private final CodeSynthesizer synthesizer;
        private final ResolvedPrimitives primitives;
        private final CollectingMessager diagnostics = new CollectingMessager();
        private final RewriteReport report;

        private UnitRewrite(TranslationUnit unit) {
            this.arena = unit.getArena();
            this.matcher = new PatternMatcher(arena, defaults.assertFailNameOrDefault());
            this.synthesizer = new CodeSynthesizer(arena, defaults);
            this.primitives = ResolvedPrimitives.resolve(unit, defaults);
            this.report = new RewriteReport(unit.getFileName());
            if (!primitives.isComplete()) {
                log.debug("{} does not declare {}, assertions in it stay as they are",
                        unit.getFileName(), primitives.missing());
            }
        }

        int rewriteStatement(int index) {
            NodeKind kind = arena.kind(index);
            if (kind == NodeKind.BLOCK) {
                BlockNode block = arena.get(index, BlockNode.class);
                List<Integer> statements = new ArrayList<>(block.size());
                boolean changed = false;
                for (int i = 0; i < block.size(); i++) {
                    int statement = rewriteStatement(block.statement(i));
                    changed |= statement != block.statement(i);
                    statements.add(statement);
                }
                return changed ? arena.block(statements) : index;
            }
            if (kind != NodeKind.CONDITIONAL) {
                return index;
            }
            AssertionSite site = matcher.match(index);
            if (site != null) {
                return rewriteAssertion(site);
            }
            ConditionalNode conditional = arena.get(index, ConditionalNode.class);
            int thenBranch = rewriteStatement(conditional.thenBranch);
            int elseBranch = rewriteStatement(conditional.elseBranch);
            if (thenBranch == conditional.thenBranch && elseBranch == conditional.elseBranch) {
                return index;
            }
            return arena.conditional(conditional.condition, thenBranch, elseBranch);
        }

        private int rewriteAssertion(AssertionSite site) {
            report.recordMatch();
            if (!primitives.isComplete()) {
                diagnose(Diagnostic.Kind.ERROR, "cannot rewrite assert(" + site.getExpressionText()
                        + "): missing declaration of " + String.join(", ", primitives.missing()), site);
                log.warn("Skipping {}: no declaration of {}", site, primitives.missing());
                report.recordSkip();
                return site.getConditional();
            }
            try (AssertionScope scope = new AssertionScope(defaults)) {
                int rewritten = synthesizer.synthesize(site, scope, primitives);
                report.recordRewrite();
                log.debug("Rewrote {} into node {}", site, rewritten);
                return rewritten;
            } catch (UnsupportedExpressionException ex) {
                diagnose(Diagnostic.Kind.WARNING, "assert(" + site.getExpressionText()
                        + ") left as is: " + ex.getMessage(), site);
                log.warn("Skipping {}: {}", site, ex.getMessage());
                report.recordSkip();
                return site.getConditional();
            }
        }

        private void diagnose(Diagnostic.Kind kind, String message, AssertionSite site) {
            diagnostics.printMessage(kind, message, site);
            if (messager != null) {
                messager.printMessage(kind, message, site);
            }
        }
    }
}
