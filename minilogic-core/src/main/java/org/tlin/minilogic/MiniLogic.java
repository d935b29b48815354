package org.tlin.minilogic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlin.minilogic.eval.EvalConfig;
import org.tlin.minilogic.eval.Evaluator;
import org.tlin.minilogic.eval.Result;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.normalize.Normalizer;
import org.tlin.minilogic.value.Env;
import org.tlin.minilogic.value.Value;
import org.tlin.minilogic.verify.VerificationReport;
import org.tlin.minilogic.verify.VerificationResult;
import org.tlin.minilogic.verify.Verifier;

/**
 * Entry point for verifying rule rewrites.
 *
 * <pre>{@code
 * MiniLogic ml = MiniLogic.create();
 * VerificationReport report = ml.verify(original, rewritten);
 * if (MiniLogic.isSafeToApply(report)) { ... }
 * }</pre>
 *
 * Instances are immutable and thread-safe.
 */
public final class MiniLogic {

    private static final Logger LOG = LoggerFactory.getLogger(MiniLogic.class);

    private final EvalConfig config;
    private final Verifier verifier;
    private final Normalizer normalizer;
    private final Evaluator evaluator;

    private MiniLogic(EvalConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.verifier = new Verifier(config);
        this.normalizer = new Normalizer(config);
        this.evaluator = new Evaluator(config);
    }

    public static MiniLogic create() {
        return new MiniLogic(EvalConfig.defaults());
    }

    /**
     * For rewrites inside loop bodies, where {@code break} and {@code continue} are modeled.
     */
    public static MiniLogic forLoopContext() {
        return new MiniLogic(EvalConfig.forLoopContext());
    }

    public static MiniLogic withConfig(EvalConfig config) {
        return new MiniLogic(config);
    }

    public EvalConfig config() {
        return config;
    }

    public VerificationReport verify(Stmt original, Stmt transformed) {
        return verifier.checkEquivalence(original, transformed);
    }

    public VerificationReport verify(Stmt original, Stmt transformed, Env env) {
        return verifier.checkEquivalence(original, transformed, env);
    }

    /**
     * Normalizes both sides first, so constant-foldable differences do not matter.
     */
    public VerificationReport verifyNormalized(Stmt original, Stmt transformed) {
        return verifier.checkEquivalence(normalizer.normalize(original), normalizer.normalize(transformed));
    }

    public VerificationReport verifyEarlyReturn(Expr cond, Expr returnValue, Stmt elseStmt) {
        return verifier.verifyEarlyReturnRewrite(cond, returnValue, elseStmt);
    }

    public VerificationReport verifyIfElseChainFlattening(List<Expr> conditions, List<Expr> returns, Expr fallback) {
        return verifier.verifyIfElseChainFlattening(conditions, returns, fallback);
    }

    public Stmt normalize(Stmt stmt) {
        return normalizer.normalize(stmt);
    }

    public Stmt flattenIfElseChain(Stmt stmt) {
        return normalizer.flattenIfElseChain(stmt);
    }

    public Stmt unflattenIfElseChain(Stmt stmt) {
        return normalizer.unflattenIfElseChain(stmt);
    }

    public Stmt flattenAllIfElseChains(Stmt stmt) {
        return normalizer.flattenAllIfElseChains(stmt);
    }

    public Result evaluate(Stmt stmt, Env env) {
        return evaluator.eval(stmt, env);
    }

    public Value evaluateExpr(Expr expr, Env env) {
        return evaluator.evalExpr(expr, env);
    }

    public BatchVerificationReport batchVerify(List<TransformationContext> transformations) {
        List<TransformationResult> results = new ArrayList<>(transformations.size());
        for (TransformationContext t : transformations) {
            VerificationReport report = verify(t.original(), t.transformed());
            if (report.result() == VerificationResult.NOT_EQUIVALENT) {
                LOG.debug("Rule {} produced an unsafe rewrite at {}: {}", t.ruleName(), t.location(), report.detail());
            }
            results.add(new TransformationResult(t, report));
        }
        BatchVerificationReport batch = new BatchVerificationReport(results);
        LOG.info(batch.summary());
        return batch;
    }

    // ── Consumer policy ──────────────────────────────────────────────────

    public static boolean isSafeToApply(VerificationReport report) {
        return report.result() == VerificationResult.EQUIVALENT;
    }

    public static boolean shouldWarn(VerificationReport report) {
        return report.result() == VerificationResult.UNKNOWN;
    }

    public static boolean isDefinitelyUnsafe(VerificationReport report) {
        return report.result() == VerificationResult.NOT_EQUIVALENT;
    }
}
