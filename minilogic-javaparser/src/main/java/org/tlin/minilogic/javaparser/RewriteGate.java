package org.tlin.minilogic.javaparser;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlin.minilogic.MiniLogic;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.verify.ReasonCode;
import org.tlin.minilogic.verify.VerificationReport;

/**
 * Decides whether a rule's suggested replacement for a snippet may be applied without
 * asking. Snippets that cannot be translated are never safe. When verification stops at a
 * condition it cannot decide, the suggestion is still accepted if both sides have the same
 * canonical form, that is the same tree after normalizing and flattening every if/else-if
 * chain. Other inconclusive outcomes (out of scope, calls disallowed, scope violations)
 * are refused.
 */
public final class RewriteGate {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteGate.class);

    private final MiniLogic miniLogic;
    private final SnippetTranslator translator;

    public RewriteGate() {
        this(MiniLogic.create(), new SnippetTranslator());
    }

    public RewriteGate(MiniLogic miniLogic, SnippetTranslator translator) {
        this.miniLogic = Objects.requireNonNull(miniLogic, "miniLogic");
        this.translator = Objects.requireNonNull(translator, "translator");
    }

    public boolean isSafeRewrite(String original, String suggestion) {
        return check(original, suggestion).safe();
    }

    public GateDecision check(String original, String suggestion) {
        Optional<Stmt> before = translator.translate(original);
        Optional<Stmt> after = translator.translate(suggestion);
        if (before.isEmpty() || after.isEmpty()) {
            LOG.debug("Refusing rewrite: {} side is outside the translatable subset",
                    before.isEmpty() ? "original" : "suggested");
            return GateDecision.untranslatable();
        }

        VerificationReport report = miniLogic.verify(before.get(), after.get());
        boolean safe;
        switch (report.result()) {
            case EQUIVALENT:
                safe = true;
                break;
            case NOT_EQUIVALENT:
                safe = false;
                break;
            default:
                safe = report.reason() == ReasonCode.SYMBOLIC_CONDITION
                        && sameCanonicalForm(before.get(), after.get());
                break;
        }
        LOG.debug("Rewrite {}: {}", safe ? "accepted" : "refused", report);
        return new GateDecision(true, report, safe);
    }

    private boolean sameCanonicalForm(Stmt original, Stmt suggestion) {
        return canonical(original).equals(canonical(suggestion));
    }

    private Stmt canonical(Stmt stmt) {
        return miniLogic.flattenAllIfElseChains(miniLogic.normalize(stmt));
    }
}
