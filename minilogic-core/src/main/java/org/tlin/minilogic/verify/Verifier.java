package org.tlin.minilogic.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlin.minilogic.NestingDepthExceededException;
import org.tlin.minilogic.eval.CallPolicy;
import org.tlin.minilogic.eval.EvalConfig;
import org.tlin.minilogic.eval.Evaluator;
import org.tlin.minilogic.eval.Result;
import org.tlin.minilogic.eval.ResultKind;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.value.Env;

/**
 * Decides whether two statements behave identically from a common starting environment.
 * <p>
 * The check runs in order and stops at the first failure:
 * <ol>
 *   <li>constructs the configuration cannot model: {@code UNKNOWN / OUT_OF_SCOPE}
 *       (or {@code CALLS_DISALLOWED})</li>
 *   <li>if-initializer variables used outside their if: {@code UNKNOWN / SCOPE_VIOLATION}</li>
 *   <li>either side evaluates to Unknown: {@code UNKNOWN / SYMBOLIC_CONDITION}</li>
 *   <li>different result kinds: {@code NOT_EQUIVALENT / DIFFERENT_KIND}</li>
 *   <li>different environments or return values: {@code DIFFERENT_ENV} / {@code DIFFERENT_VALUE}</li>
 *   <li>different call sequences (opaque calls only): {@code DIFFERENT_CALLS}</li>
 *   <li>otherwise {@code EQUIVALENT / SAME_RESULT}</li>
 * </ol>
 * Verifiers hold no mutable state and may be shared between threads.
 */
public final class Verifier {

    private static final Logger LOG = LoggerFactory.getLogger(Verifier.class);

    private final EvalConfig config;
    private final Evaluator evaluator;
    private final ScopeChecker scopeChecker;

    public Verifier(EvalConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.evaluator = new Evaluator(config);
        this.scopeChecker = new ScopeChecker(config);
    }

    public EvalConfig config() {
        return config;
    }

    public VerificationReport checkEquivalence(Stmt original, Stmt transformed) {
        return checkEquivalence(original, transformed, Env.empty());
    }

    public VerificationReport checkEquivalence(Stmt original, Stmt transformed, Env env) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(transformed, "transformed");
        Objects.requireNonNull(env, "env");

        VerificationReport report;
        try {
            report = compare(original, transformed, env);
        } catch (NestingDepthExceededException e) {
            LOG.warn("Giving up on verification: {}", e.getMessage());
            report = VerificationReport.unknown(ReasonCode.OUT_OF_SCOPE, e.getMessage());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} <=> {}: {}", original, transformed, report.result().label() + "/" + report.reason());
        }
        return config.debugIr() ? report.withIr(irReport(original, transformed, env)) : report;
    }

    private VerificationReport compare(Stmt original, Stmt transformed, Env env) {
        Optional<ScopeChecker.Finding> finding = scopeChecker.findOutOfScope(original)
                .or(() -> scopeChecker.findOutOfScope(transformed));
        if (finding.isEmpty()) {
            finding = scopeChecker.findScopeViolation(original)
                    .or(() -> scopeChecker.findScopeViolation(transformed));
        }
        if (finding.isPresent()) {
            return VerificationReport.unknown(finding.get().reason(), finding.get().detail());
        }

        Result r1 = evaluator.eval(original, env);
        Result r2 = evaluator.eval(transformed, env);

        if (r1.kind() == ResultKind.UNKNOWN || r2.kind() == ResultKind.UNKNOWN) {
            return VerificationReport.unknown(ReasonCode.SYMBOLIC_CONDITION, "evaluation produced unknown result");
        }
        if (r1.kind() != r2.kind()) {
            return VerificationReport.notEquivalent(ReasonCode.DIFFERENT_KIND,
                    "result kinds differ: " + r1.kind().label() + " vs " + r2.kind().label());
        }
        if (r1 instanceof Result.Continue c1 && r2 instanceof Result.Continue c2 && !c1.env().equals(c2.env())) {
            return VerificationReport.notEquivalent(ReasonCode.DIFFERENT_ENV,
                    "environments differ: " + c1.env() + " vs " + c2.env());
        }
        if (r1 instanceof Result.Return v1 && r2 instanceof Result.Return v2 && !v1.value().equals(v2.value())) {
            return VerificationReport.notEquivalent(ReasonCode.DIFFERENT_VALUE,
                    "return values differ: " + v1.value().render() + " vs " + v2.value().render());
        }
        if (config.callPolicy() == CallPolicy.OPAQUE && !r1.calls().equals(r2.calls())) {
            return VerificationReport.notEquivalent(ReasonCode.DIFFERENT_CALLS,
                    "call sequences differ: " + ResultFormatter.formatCalls(r1.calls())
                            + " vs " + ResultFormatter.formatCalls(r2.calls()));
        }
        return VerificationReport.equivalent("statements produce identical results");
    }

    private IrReport irReport(Stmt original, Stmt transformed, Env env) {
        return new IrReport(
                ResultFormatter.pretty(evaluator.eval(original, env)),
                ResultFormatter.pretty(evaluator.eval(transformed, env)));
    }

    // ── Rewrite recipes ──────────────────────────────────────────────────

    /**
     * {@code if cond { return v } else { S }} against {@code if cond { return v }; S}.
     */
    public VerificationReport verifyEarlyReturnRewrite(Expr cond, Expr returnValue, Stmt elseStmt) {
        Stmt original = Ir.ifElse(cond, Ir.ret(returnValue), elseStmt);
        Stmt rewritten = Ir.seq(Ir.ifThen(cond, Ir.ret(returnValue)), elseStmt);
        return checkEquivalence(original, rewritten);
    }

    /**
     * A nested {@code if c1 { return v1 } else if c2 { return v2 } ... else { return fallback }}
     * against the flat sequence of single-armed ifs followed by {@code return fallback}.
     */
    public VerificationReport verifyIfElseChainFlattening(List<Expr> conditions, List<Expr> returns, Expr fallback) {
        if (conditions.size() != returns.size()) {
            return VerificationReport.unknown(ReasonCode.OUT_OF_SCOPE,
                    "mismatched conditions and returns: " + conditions.size() + " vs " + returns.size());
        }
        if (conditions.isEmpty()) {
            return VerificationReport.equivalent("empty chain");
        }

        Stmt original = Ir.ret(fallback);
        for (int i = conditions.size() - 1; i >= 0; i--) {
            original = Ir.ifElse(conditions.get(i), Ir.ret(returns.get(i)), original);
        }

        List<Stmt> flat = new ArrayList<>(conditions.size() + 1);
        for (int i = 0; i < conditions.size(); i++) {
            flat.add(Ir.ifThen(conditions.get(i), Ir.ret(returns.get(i))));
        }
        flat.add(Ir.ret(fallback));
        return checkEquivalence(original, Ir.seq(flat));
    }
}
