package org.tlin.minilogic.eval;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.value.Env;
import org.tlin.minilogic.value.Value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tlin.minilogic.ir.Ir.*;

class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator(EvalConfig.defaults());

    private static Env envOf(Object... bindings) {
        Env env = Env.empty();
        for (int i = 0; i < bindings.length; i += 2) {
            env.set((String) bindings[i], (Value) bindings[i + 1]);
        }
        return env;
    }

    private static Env continueEnv(Result result) {
        assertThat(result).isInstanceOf(Result.Continue.class);
        return ((Result.Continue) result).env();
    }

    // ── Straight-line code ──────────────────────────────────────────────

    @Test
    void assignments_threadThroughSequence() {
        Result result = evaluator.eval(seq(
                assign("x", intLit(1)),
                assign("y", add(var("x"), intLit(2)))), Env.empty());

        assertThat(continueEnv(result)).isEqualTo(envOf("x", Value.of(1), "y", Value.of(3)));
        assertThat(result.calls()).isEmpty();
    }

    @Test
    void sequence_stopsAtFirstReturn() {
        Result result = evaluator.eval(seq(
                ret(intLit(1)),
                assign("x", intLit(2)),
                callStmt("never")), Env.empty());

        assertThat(result).isEqualTo(Result.returning(Value.of(1), List.of()));
    }

    @Test
    void block_stopsAtFirstReturn() {
        Result result = evaluator.eval(block(
                callStmt("a"),
                ret(nilLit()),
                callStmt("b")), Env.empty());

        assertThat(result.kind()).isEqualTo(ResultKind.RETURN);
        assertThat(result.calls()).containsExactly(new CallRecord("a", List.of()));
    }

    @Test
    void returnWithoutValue_returnsNil() {
        Result result = evaluator.eval(retVoid(), Env.empty());

        assertThat(result).isEqualTo(Result.returning(Value.nil(), List.of()));
    }

    @Test
    void inputEnvironment_isNeverMutated() {
        Env env = envOf("x", Value.of(1));
        evaluator.eval(seq(assign("x", intLit(2)), declAssign("y", intLit(3))), env);

        assertThat(env).isEqualTo(envOf("x", Value.of(1)));
    }

    @Test
    void unboundVariable_isSymbolic() {
        Result result = evaluator.eval(assign("y", add(var("a"), intLit(1))), Env.empty());

        assertThat(continueEnv(result).get("y")).contains(Value.symbolic("(<a> + 1)"));
    }

    @Test
    void divisionByZero_isSymbolic() {
        Value value = evaluator.evalExpr(binary(BinaryOp.DIV, intLit(1), intLit(0)), Env.empty());

        assertThat(value).isEqualTo(Value.symbolic("(1 / 0)"));
    }

    @Test
    void varDeclWithoutInitializer_bindsPlaceholder() {
        Result result = evaluator.eval(varDecl("x"), Env.empty());

        assertThat(continueEnv(result).get("x")).contains(Value.symbolic("var_x"));
    }

    @Test
    void multiDeclAssign_bindsTupleComponents() {
        Result result = evaluator.eval(declAssign(List.of("a", "b"), call("pair")), Env.empty());

        Env env = continueEnv(result);
        assertThat(env.get("a")).contains(Value.symbolic("tuple(pair())[0]"));
        assertThat(env.get("b")).contains(Value.symbolic("tuple(pair())[1]"));
        assertThat(result.calls()).containsExactly(new CallRecord("pair", List.of()));
    }

    @Test
    void evaluation_isDeterministic() {
        Stmt stmt = seq(
                callStmt("f", var("a")),
                ifElse(var("c"), assign("x", intLit(1)), assign("x", intLit(2))));
        Env env = envOf("a", Value.of(7));

        assertThat(evaluator.eval(stmt, env)).isEqualTo(evaluator.eval(stmt, env));
    }

    // ── Calls ───────────────────────────────────────────────────────────

    @Test
    void calls_recordEvaluatedArgumentsInOrder() {
        Result result = evaluator.eval(seq(
                callStmt("f", intLit(1), var("x")),
                callStmt("g", add(var("x"), intLit(1)))), envOf("x", Value.of(2)));

        assertThat(result.calls()).containsExactly(
                new CallRecord("f", List.of(Value.of(1), Value.of(2))),
                new CallRecord("g", List.of(Value.of(3))));
    }

    @Test
    void callExpression_valueIsNamedByPosition() {
        Result result = evaluator.eval(seq(
                callStmt("first"),
                assign("y", call("g", intLit(1)))), Env.empty());

        assertThat(continueEnv(result).get("y")).contains(Value.symbolic("g(1)@1"));
    }

    @Test
    void logicalAnd_shortCircuitsBeforeCall() {
        Result result = evaluator.eval(
                ifThen(and(boolLit(false), call("check")), assign("x", intLit(1))), Env.empty());

        assertThat(result.calls()).isEmpty();
        assertThat(continueEnv(result)).isEqualTo(Env.empty());
    }

    @Test
    void disallowPolicy_anyCallIsUnknown() {
        Evaluator strict = new Evaluator(EvalConfig.builder().callPolicy(CallPolicy.DISALLOW).build());

        assertThat(strict.eval(callStmt("f"), Env.empty())).isEqualTo(Result.unknown());
        assertThat(strict.eval(assign("x", call("f")), Env.empty())).isEqualTo(Result.unknown());
        assertThat(strict.eval(ifThen(call("p"), noop()), Env.empty())).isEqualTo(Result.unknown());
        assertThat(strict.eval(assign("x", intLit(1)), Env.empty()).kind()).isEqualTo(ResultKind.CONTINUE);
    }

    // ── Control flow configuration ──────────────────────────────────────

    @Test
    void noTermination_returnIsUnknown() {
        Evaluator plain = new Evaluator(EvalConfig.builder().controlFlowMode(ControlFlowMode.NO_TERMINATION).build());

        assertThat(plain.eval(ret(intLit(1)), Env.empty())).isEqualTo(Result.unknown());
    }

    @Test
    void breakAndContinue_needLoopContext() {
        Evaluator inLoop = new Evaluator(EvalConfig.forLoopContext());

        assertThat(evaluator.eval(breakLoop(), Env.empty())).isEqualTo(Result.unknown());
        assertThat(evaluator.eval(continueLoop(), Env.empty())).isEqualTo(Result.unknown());
        assertThat(inLoop.eval(breakLoop(), Env.empty()).kind()).isEqualTo(ResultKind.BREAK);
        assertThat(inLoop.eval(continueLoop(), Env.empty()).kind()).isEqualTo(ResultKind.CONTINUE_LOOP);
    }

    // ── Conditionals ────────────────────────────────────────────────────

    @Test
    void concreteCondition_runsOneBranch() {
        Stmt stmt = ifElse(gt(var("n"), intLit(0)), callStmt("pos"), callStmt("neg"));

        assertThat(evaluator.eval(stmt, envOf("n", Value.of(5))).calls())
                .containsExactly(new CallRecord("pos", List.of()));
        assertThat(evaluator.eval(stmt, envOf("n", Value.of(-5))).calls())
                .containsExactly(new CallRecord("neg", List.of()));
    }

    @Test
    void nonBooleanCondition_usesTruthiness() {
        Stmt stmt = ifElse(var("n"), ret(intLit(1)), ret(intLit(2)));

        assertThat(evaluator.eval(stmt, envOf("n", Value.of(0)))).isEqualTo(Result.returning(Value.of(2), List.of()));
        assertThat(evaluator.eval(stmt, envOf("n", Value.of("x")))).isEqualTo(Result.returning(Value.of(1), List.of()));
    }

    @Test
    void initVariable_shadowsOuterAndIsDropped() {
        Env outer = envOf("x", Value.of(100));

        Result returned = evaluator.eval(
                ifInit(declAssign("x", intLit(1)), gt(var("x"), intLit(0)), ret(var("x")), ret(intLit(0))), outer);
        assertThat(returned).isEqualTo(Result.returning(Value.of(1), List.of()));

        Result continued = evaluator.eval(
                ifInit(declAssign("x", intLit(1)), gt(var("x"), intLit(0)), assign("y", var("x")), null), outer);
        assertThat(continueEnv(continued)).isEqualTo(envOf("x", Value.of(100), "y", Value.of(1)));
        assertThat(outer).isEqualTo(envOf("x", Value.of(100)));
    }

    @Test
    void initVariable_notVisibleAfterIf() {
        Result result = evaluator.eval(
                ifInit(declAssign("t", intLit(1)), boolLit(false), assign("y", intLit(2)), null), Env.empty());

        assertThat(continueEnv(result)).isEqualTo(Env.empty());
    }

    @Test
    void symbolicCondition_mergesDifferingVariablesWithIte() {
        Result result = evaluator.eval(
                ifElse(var("c"), assign("x", intLit(1)), assign("x", intLit(2))), envOf("x", Value.of(0)));

        assertThat(continueEnv(result).get("x")).contains(Value.symbolic("ite(c,1,2)"));
    }

    @Test
    void symbolicCondition_identicalBranchesMergeToCommonResult() {
        Result result = evaluator.eval(
                ifElse(var("c"), assign("x", intLit(1)), assign("x", intLit(1))), Env.empty());

        assertThat(continueEnv(result)).isEqualTo(envOf("x", Value.of(1)));
    }

    @Test
    void symbolicCondition_variableBoundOnOneSideIsUnknown() {
        Result result = evaluator.eval(ifThen(var("c"), assign("y", intLit(1))), Env.empty());

        assertThat(result).isEqualTo(Result.unknown());
    }

    @Test
    void symbolicCondition_differentCallsIsUnknown() {
        Result result = evaluator.eval(ifElse(var("c"), callStmt("f"), callStmt("g")), Env.empty());

        assertThat(result).isEqualTo(Result.unknown());
    }

    @Test
    void symbolicCondition_differingReturnsMergeWithIte() {
        Result result = evaluator.eval(ifElse(var("c"), ret(intLit(1)), ret(intLit(2))), Env.empty());

        assertThat(result).isEqualTo(Result.returning(Value.symbolic("ite(c,1,2)"), List.of()));
    }

    @Test
    void symbolicCondition_returnAgainstFallThroughIsUnknown() {
        Result result = evaluator.eval(ifThen(var("c"), ret(intLit(1))), Env.empty());

        assertThat(result).isEqualTo(Result.unknown());
    }

    @Test
    void symbolicEarlyExit_joinsFollowingStatements() {
        Result flat = evaluator.eval(seq(ifThen(var("c"), ret(intLit(1))), ret(intLit(2))), Env.empty());
        Result nested = evaluator.eval(ifElse(var("c"), ret(intLit(1)), ret(intLit(2))), Env.empty());

        assertThat(flat).isEqualTo(nested);
    }

    @Test
    void solver_resolvesBoundBooleanAndSelfEquality() {
        Stmt byVar = ifElse(var("flag"), ret(intLit(1)), ret(intLit(2)));
        Stmt selfEq = ifElse(eq(var("a"), var("a")), ret(intLit(1)), callStmt("never"));

        assertThat(evaluator.eval(byVar, envOf("flag", Value.of(false)))).isEqualTo(Result.returning(Value.of(2), List.of()));
        assertThat(evaluator.eval(selfEq, Env.empty())).isEqualTo(Result.returning(Value.of(1), List.of()));
    }

    @Test
    void withoutSolver_selfEqualityIsMerged() {
        Evaluator unsolved = new Evaluator(EvalConfig.builder().condSolver(null).build());

        Result result = unsolved.eval(ifElse(eq(var("a"), var("a")), ret(intLit(1)), ret(intLit(1))), Env.empty());

        assertThat(result).isEqualTo(Result.returning(Value.of(1), List.of()));
    }

    // ── Resource limits ─────────────────────────────────────────────────

    @Test
    void longSequence_evaluatesIteratively() {
        Stmt[] stmts = new Stmt[20_000];
        for (int i = 0; i < stmts.length; i++) {
            stmts[i] = assign("x", add(var("x"), intLit(1)));
        }

        Result result = evaluator.eval(seq(stmts), envOf("x", Value.of(0)));

        assertThat(continueEnv(result).get("x")).contains(Value.of(20_000));
    }

    @Test
    void nestingBeyondLimit_isUnknown() {
        Stmt stmt = assign("x", intLit(1));
        for (int i = 0; i < 300; i++) {
            stmt = block(stmt);
        }

        assertThat(evaluator.eval(stmt, Env.empty())).isEqualTo(Result.unknown());
        assertThat(new Evaluator(EvalConfig.builder().maxDepth(400).build()).eval(stmt, Env.empty()).kind())
                .isEqualTo(ResultKind.CONTINUE);
    }

    @Test
    void selfDoublingAssignments_keepSymbolicNamesBounded() {
        Stmt[] stmts = new Stmt[40];
        for (int i = 0; i < stmts.length; i++) {
            stmts[i] = assign("x", add(var("x"), var("x")));
        }

        Result first = evaluator.eval(seq(stmts), Env.empty());
        Result second = evaluator.eval(seq(stmts), Env.empty());

        Value x = continueEnv(first).get("x").orElseThrow();
        assertThat(x).isInstanceOf(Value.SymbolicValue.class);
        assertThat(((Value.SymbolicValue) x).name()).hasSizeLessThanOrEqualTo(Value.MAX_DERIVED_NAME_LENGTH);
        assertThat(first).isEqualTo(second);

        Result oneMore = evaluator.eval(seq(seq(stmts), assign("x", add(var("x"), var("x")))), Env.empty());
        assertThat(continueEnv(oneMore).get("x")).isNotEqualTo(Optional.of(x));
    }

    @Test
    void leftNestedSequence_evaluatesInOrder() {
        Stmt stmt = new Stmt.Seq(
                new Stmt.Seq(assign("x", intLit(1)), assign("x", add(var("x"), intLit(1)))),
                assign("y", var("x")));

        assertThat(continueEnv(evaluator.eval(stmt, Env.empty())))
                .isEqualTo(envOf("x", Value.of(2), "y", Value.of(2)));
    }

    @Test
    void leftNestedSequenceBeyondLimit_isUnknown() {
        Stmt stmt = assign("x", intLit(0));
        for (int i = 0; i < 200_000; i++) {
            stmt = new Stmt.Seq(stmt, assign("x", add(var("x"), intLit(1))));
        }

        assertThat(evaluator.eval(stmt, Env.empty())).isEqualTo(Result.unknown());
    }

    @Test
    void expressionNestingBeyondLimit_isUnknown() {
        Expr sum = intLit(0);
        for (int i = 0; i < 200_000; i++) {
            sum = add(sum, var("y"));
        }

        assertThat(evaluator.eval(assign("x", sum), Env.empty())).isEqualTo(Result.unknown());
        assertThat(evaluator.eval(ret(not(sum)), Env.empty())).isEqualTo(Result.unknown());
    }

    @Test
    void continueResult_isNeverTheCallersEnvironment() {
        Env env = envOf("x", Value.of(1));

        for (Stmt stmt : List.of(noop(), callStmt("log"), block(), ifThen(boolLit(false), assign("x", intLit(2))))) {
            Env result = continueEnv(evaluator.eval(stmt, env));
            assertThat(result).isNotSameAs(env).isEqualTo(env);

            result.set("x", Value.of(9));
            assertThat(env.get("x")).contains(Value.of(1));
        }
    }
}
