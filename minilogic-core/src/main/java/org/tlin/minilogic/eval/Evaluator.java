package org.tlin.minilogic.eval;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlin.minilogic.NestingDepthExceededException;
import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.ExprVisitor;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.Operators;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.ir.StmtVisitor;
import org.tlin.minilogic.printer.IrPrinter;
import org.tlin.minilogic.value.Env;
import org.tlin.minilogic.value.Value;

/**
 * Executes IR against an environment.
 * <p>
 * Sequences short-circuit on the first non-{@code Continue} result. An {@code if} whose
 * condition cannot be decided runs both branches and merges them; when they cannot be
 * merged the statement is {@code Unknown}, as is any tree that nests statements or
 * expressions deeper than {@link EvalConfig#maxDepth()}. The input environment is never
 * mutated and never handed back, so one evaluator may serve many threads.
 */
public final class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final EvalConfig config;
    private final Executor executor = new Executor();

    public Evaluator(EvalConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public EvalConfig config() {
        return config;
    }

    public Result eval(Stmt stmt, Env env) {
        Result result;
        try {
            result = exec(stmt, new Frame(env, List.of(), 0));
        } catch (NestingDepthExceededException e) {
            LOG.warn("{}; evaluating as Unknown", e.getMessage());
            return Result.unknown();
        }
        if (result instanceof Result.Continue c && c.env() == env) {
            return Result.continueWith(env.copy(), c.calls());
        }
        return result;
    }

    /**
     * @throws NestingDepthExceededException when {@code expr} nests deeper than the configured limit
     */
    public Value evalExpr(Expr expr, Env env) {
        return evalExpr(expr, env, new ArrayList<>(), 0);
    }

    private record Frame(Env env, List<CallRecord> calls, int depth) {

        Frame at(Env env, List<CallRecord> calls) {
            return new Frame(env, calls, depth);
        }

        Frame nested() {
            return new Frame(env, calls, depth + 1);
        }
    }

    private Result exec(Stmt stmt, Frame frame) {
        if (frame.depth() > config.maxDepth()) {
            LOG.warn("Statement nesting exceeds {}; evaluating as Unknown", config.maxDepth());
            return Result.unknown();
        }
        return stmt.accept(executor, frame);
    }

    private boolean disallowed(Expr expr) {
        return expr != null && config.callPolicy() == CallPolicy.DISALLOW && Ir.containsCall(expr);
    }

    private Value evalExpr(Expr expr, Env env, List<CallRecord> calls, int depth) {
        return expr.accept(ExprEvaluator.INSTANCE, new ExprScope(env, calls, depth, config.maxDepth()));
    }

    // ── Statements ───────────────────────────────────────────────────────

    private final class Executor implements StmtVisitor<Result, Frame> {

        @Override
        public Result visit(Stmt.Assign n, Frame frame) {
            if (disallowed(n.expr())) {
                return Result.unknown();
            }
            List<CallRecord> calls = new ArrayList<>(frame.calls());
            Value value = evalExpr(n.expr(), frame.env(), calls, frame.depth());
            return Result.continueWith(frame.env().with(n.name(), value), calls);
        }

        @Override
        public Result visit(Stmt.DeclAssign n, Frame frame) {
            if (disallowed(n.expr())) {
                return Result.unknown();
            }
            List<CallRecord> calls = new ArrayList<>(frame.calls());
            Value value = evalExpr(n.expr(), frame.env(), calls, frame.depth());
            Env env = frame.env().copy();
            if (n.isMulti()) {
                String tuple = "tuple(" + IrPrinter.print(n.expr(), config.maxDepth()) + ")";
                for (int i = 0; i < n.names().size(); i++) {
                    env.set(n.names().get(i), Value.derived(tuple + "[" + i + "]"));
                }
            } else {
                env.set(n.names().get(0), value);
            }
            return Result.continueWith(env, calls);
        }

        @Override
        public Result visit(Stmt.VarDecl n, Frame frame) {
            if (disallowed(n.initializer())) {
                return Result.unknown();
            }
            List<CallRecord> calls = new ArrayList<>(frame.calls());
            Value value = n.hasInitializer()
                    ? evalExpr(n.initializer(), frame.env(), calls, frame.depth())
                    : Value.symbolic("var_" + n.name());
            return Result.continueWith(frame.env().with(n.name(), value), calls);
        }

        @Override
        public Result visit(Stmt.Seq n, Frame frame) {
            Frame current = frame;
            Stmt stmt = n;
            while (stmt instanceof Stmt.Seq seq) {
                // a sequence nested in first position counts as one more level
                Frame first = seq.first() instanceof Stmt.Seq ? current.nested() : current;
                Step step = execBefore(seq.first(), seq.second(), first);
                if (step.restConsumed() || !(step.result() instanceof Result.Continue next)) {
                    return step.result();
                }
                current = current.at(next.env(), next.calls());
                stmt = seq.second();
            }
            return exec(stmt, current);
        }

        @Override
        public Result visit(Stmt.Block n, Frame frame) {
            Frame current = frame.nested();
            List<Stmt> statements = n.statements();
            for (int i = 0; i < statements.size(); i++) {
                Stmt stmt = statements.get(i);
                Stmt rest = stmt instanceof Stmt.If && i + 1 < statements.size()
                        ? Ir.seq(statements.subList(i + 1, statements.size()))
                        : null;
                Step step = execBefore(stmt, rest, current);
                if (step.restConsumed() || !(step.result() instanceof Result.Continue next)) {
                    return step.result();
                }
                current = current.at(next.env(), next.calls());
            }
            return Result.continueWith(current.env(), current.calls());
        }

        @Override
        public Result visit(Stmt.If n, Frame frame) {
            return evalIf(n, null, frame.nested()).result();
        }

        @Override
        public Result visit(Stmt.Return n, Frame frame) {
            if (!config.isEarlyReturnAware() || disallowed(n.value())) {
                return Result.unknown();
            }
            if (!n.hasValue()) {
                return Result.returning(Value.nil(), frame.calls());
            }
            List<CallRecord> calls = new ArrayList<>(frame.calls());
            Value value = evalExpr(n.value(), frame.env(), calls, frame.depth());
            return Result.returning(value, calls);
        }

        @Override
        public Result visit(Stmt.Break n, Frame frame) {
            return config.allowsLoopControl() ? Result.breaking(frame.calls()) : Result.unknown();
        }

        @Override
        public Result visit(Stmt.Continue n, Frame frame) {
            return config.allowsLoopControl() ? Result.continuingLoop(frame.calls()) : Result.unknown();
        }

        @Override
        public Result visit(Stmt.Call n, Frame frame) {
            if (config.callPolicy() == CallPolicy.DISALLOW) {
                return Result.unknown();
            }
            List<CallRecord> calls = new ArrayList<>(frame.calls());
            evalExpr(n.call(), frame.env(), calls, frame.depth());
            return Result.continueWith(frame.env(), calls);
        }

        @Override
        public Result visit(Stmt.Noop n, Frame frame) {
            return Result.continueWith(frame.env(), frame.calls());
        }
    }

    // ── Conditionals ─────────────────────────────────────────────────────

    /**
     * Outcome of a statement run inside a sequence. When {@code restConsumed} is set the
     * result already covers the statements that followed it.
     */
    private record Step(Result result, boolean restConsumed) {}

    private Step execBefore(Stmt stmt, Stmt rest, Frame frame) {
        if (rest != null && stmt instanceof Stmt.If n) {
            return evalIf(n, rest, frame.nested());
        }
        return new Step(exec(stmt, frame), false);
    }

    private Step evalIf(Stmt.If n, Stmt rest, Frame frame) {
        Env outer = frame.env();
        Frame working = frame;
        List<String> initNames = n.hasInit() ? Ir.declaredNames(n.init()) : List.of();
        if (n.hasInit()) {
            Result init = exec(n.init(), frame.at(outer.child(), frame.calls()));
            if (!(init instanceof Result.Continue c)) {
                return new Step(init, false);
            }
            working = frame.at(c.env(), c.calls());
        }

        if (disallowed(n.cond())) {
            return new Step(Result.unknown(), false);
        }
        List<CallRecord> calls = new ArrayList<>(working.calls());
        Value cond = evalExpr(n.cond(), working.env(), calls, working.depth());
        if (cond.isSymbolic() && config.condSolver() != null) {
            Optional<Boolean> solved = config.condSolver().solve(n.cond(), working.env());
            if (solved.isPresent()) {
                cond = Value.of(solved.get());
            }
        }
        working = working.at(working.env(), calls);

        Step step;
        if (cond.isSymbolic()) {
            // the statements after the if may only join a branch when no initializer name can capture them
            step = evalSymbolicIf(n, initNames.isEmpty() ? rest : null, working);
        } else if (cond.isTruthy()) {
            step = new Step(exec(n.then(), working), false);
        } else if (n.hasElse()) {
            step = new Step(exec(n.otherwise(), working), false);
        } else {
            step = new Step(Result.continueWith(working.env(), working.calls()), false);
        }

        return n.hasInit() ? new Step(leaveInitScope(step.result(), outer, initNames), step.restConsumed()) : step;
    }

    /**
     * Fold the child frame of an if initializer back into {@code outer}: writes to outer
     * variables survive, variables the initializer declared are dropped.
     */
    private static Result leaveInitScope(Result result, Env outer, List<String> initNames) {
        if (!(result instanceof Result.Continue c)) {
            return result;
        }
        Env env = outer.copy();
        for (String name : c.env().localNames()) {
            if (!initNames.contains(name)) {
                c.env().get(name).ifPresent(value -> env.set(name, value));
            }
        }
        return Result.continueWith(env, c.calls());
    }

    /**
     * Runs both branches and merges them. When the branches end differently (one returns,
     * the other falls through) and {@code rest} is given, each branch is run again followed
     * by {@code rest}, which is how an early exit followed by more code becomes comparable
     * with the equivalent if/else.
     */
    private Step evalSymbolicIf(Stmt.If n, Stmt rest, Frame frame) {
        Result thenResult = exec(n.then(), frame);
        Result elseResult = n.hasElse()
                ? exec(n.otherwise(), frame)
                : Result.continueWith(frame.env(), frame.calls());

        if (thenResult.kind() == ResultKind.UNKNOWN || elseResult.kind() == ResultKind.UNKNOWN) {
            return new Step(Result.unknown(), false);
        }
        if (rest != null && thenResult.kind() != elseResult.kind()) {
            thenResult = exec(Ir.seq(n.then(), rest), frame);
            elseResult = exec(n.hasElse() ? Ir.seq(n.otherwise(), rest) : rest, frame);
            return new Step(mergeBranches(n.cond(), thenResult, elseResult, frame.env()), true);
        }
        return new Step(mergeBranches(n.cond(), thenResult, elseResult, frame.env()), false);
    }

    private Result mergeBranches(Expr cond, Result thenResult, Result elseResult, Env base) {
        if (thenResult.kind() == ResultKind.UNKNOWN || elseResult.kind() == ResultKind.UNKNOWN) {
            return Result.unknown();
        }
        if (thenResult.equals(elseResult)) {
            return thenResult;
        }
        return merge(cond, thenResult, elseResult, base);
    }

    private Result merge(Expr cond, Result thenResult, Result elseResult, Env base) {
        if (thenResult.kind() != elseResult.kind() || !thenResult.calls().equals(elseResult.calls())) {
            return Result.unknown();
        }
        if (thenResult instanceof Result.Continue t && elseResult instanceof Result.Continue e) {
            return mergeEnv(cond, t.env(), e.env(), base)
                    .map(env -> Result.continueWith(env, t.calls()))
                    .orElseGet(Result::unknown);
        }
        if (thenResult instanceof Result.Return t && elseResult instanceof Result.Return e) {
            if (t.value().equals(e.value())) {
                return t;
            }
            return Result.returning(ite(cond, t.value(), e.value()), t.calls());
        }
        // Break and ContinueLoop carry nothing beyond their kind and calls
        return thenResult;
    }

    private Optional<Env> mergeEnv(Expr cond, Env thenEnv, Env elseEnv, Env base) {
        Set<String> names = new HashSet<>(thenEnv.localNames());
        names.addAll(elseEnv.localNames());
        Env merged = base.copy();
        for (String name : names) {
            Optional<Value> thenValue = thenEnv.get(name);
            Optional<Value> elseValue = elseEnv.get(name);
            if (thenValue.isEmpty() || elseValue.isEmpty()) {
                return Optional.empty();
            }
            merged.set(name, thenValue.get().equals(elseValue.get())
                    ? thenValue.get()
                    : ite(cond, thenValue.get(), elseValue.get()));
        }
        return Optional.of(merged);
    }

    private Value ite(Expr cond, Value thenValue, Value elseValue) {
        return Value.derived("ite(" + IrPrinter.print(cond, config.maxDepth()) + ","
                + thenValue.render() + "," + elseValue.render() + ")");
    }

    // ── Expressions ──────────────────────────────────────────────────────

    private record ExprScope(Env env, List<CallRecord> calls, int depth, int maxDepth) {

        ExprScope deeper() {
            if (depth + 1 > maxDepth) {
                throw new NestingDepthExceededException(maxDepth);
            }
            return new ExprScope(env, calls, depth + 1, maxDepth);
        }
    }

    /**
     * Stateless; the call log of the enclosing statement travels in {@link ExprScope}.
     */
    private static final class ExprEvaluator implements ExprVisitor<Value, ExprScope> {

        static final ExprEvaluator INSTANCE = new ExprEvaluator();

        @Override
        public Value visit(Expr.Literal n, ExprScope scope) {
            return n.value();
        }

        @Override
        public Value visit(Expr.Var n, ExprScope scope) {
            return scope.env().get(n.name()).orElseGet(() -> Value.symbolic(n.name()));
        }

        @Override
        public Value visit(Expr.Binary n, ExprScope scope) {
            ExprScope inner = scope.deeper();
            Value left = n.left().accept(this, inner);
            if (n.op().isLogical() && left instanceof Value.BoolValue b) {
                // short-circuit: the right operand, and any call in it, is not evaluated
                if (n.op() == BinaryOp.AND && !b.value()) {
                    return left;
                }
                if (n.op() == BinaryOp.OR && b.value()) {
                    return left;
                }
            }
            Value right = n.right().accept(this, inner);
            return Operators.applyBinary(n.op(), left, right)
                    .orElseGet(() -> Value.derived("(" + left.render() + " " + n.op().symbol() + " " + right.render() + ")"));
        }

        @Override
        public Value visit(Expr.Unary n, ExprScope scope) {
            Value operand = n.operand().accept(this, scope.deeper());
            return Operators.applyUnary(n.op(), operand)
                    .orElseGet(() -> Value.derived("(" + n.op().symbol() + operand.render() + ")"));
        }

        @Override
        public Value visit(Expr.Call n, ExprScope scope) {
            List<Value> args = new ArrayList<>(n.args().size());
            ExprScope inner = scope.deeper();
            for (Expr arg : n.args()) {
                args.add(arg.accept(this, inner));
            }
            int position = scope.calls().size();
            CallRecord record = new CallRecord(n.function(), args);
            scope.calls().add(record);
            return Value.derived(record + "@" + position);
        }
    }
}
