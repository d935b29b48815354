package org.tlin.minilogic.normalize;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlin.minilogic.NestingDepthExceededException;
import org.tlin.minilogic.eval.EvalConfig;
import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.ExprVisitor;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.IrScanner;
import org.tlin.minilogic.ir.Operators;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.ir.StmtVisitor;
import org.tlin.minilogic.ir.UnaryOp;
import org.tlin.minilogic.value.Value;

/**
 * Canonicalizes statements so that syntactically different forms of the same logic
 * compare structurally equal, and converts between nested if/else-if chains and their
 * flat early-exit form.
 * <p>
 * Every operation returns its input unchanged when the tree nests deeper than the
 * configured limit.
 */
public final class Normalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    private final int maxDepth;

    public Normalizer() {
        this(EvalConfig.defaults());
    }

    public Normalizer(EvalConfig config) {
        this.maxDepth = Objects.requireNonNull(config, "config").maxDepth();
    }

    public Stmt normalize(Stmt stmt) {
        try {
            return stmt.accept(new Rewriter(maxDepth), null);
        } catch (NestingDepthExceededException e) {
            LOG.warn("Not normalizing: {}", e.getMessage());
            return stmt;
        }
    }

    public Expr normalize(Expr expr) {
        try {
            return expr.accept(new Rewriter(maxDepth), null);
        } catch (NestingDepthExceededException e) {
            LOG.warn("Not normalizing: {}", e.getMessage());
            return expr;
        }
    }

    /**
     * Turns {@code if c1 {T1} else if c2 {T2} else {S}} into {@code if c1 {T1}; if c2 {T2}; S}
     * for as long as each detached {@code then} branch provably terminates. Anything that is
     * not an {@code if} with a terminating {@code then} comes back unchanged.
     */
    public Stmt flattenIfElseChain(Stmt stmt) {
        try {
            return flattenChain(stmt);
        } catch (NestingDepthExceededException e) {
            LOG.warn("Not flattening: {}", e.getMessage());
            return stmt;
        }
    }

    /**
     * Inverse of {@link #flattenIfElseChain}: every single-armed {@code if} in a sequence
     * whose {@code then} provably terminates takes the remainder of the sequence as its
     * {@code else}.
     */
    public Stmt unflattenIfElseChain(Stmt stmt) {
        try {
            return unflattenChain(stmt);
        } catch (NestingDepthExceededException e) {
            LOG.warn("Not unflattening: {}", e.getMessage());
            return stmt;
        }
    }

    /**
     * Flattens every if/else-if chain in the tree, innermost first, and rebuilds sequences
     * right-nested so the results of two equivalent trees can be compared with {@code equals}.
     */
    public Stmt flattenAllIfElseChains(Stmt stmt) {
        try {
            return new ChainFlattener(maxDepth).apply(stmt);
        } catch (NestingDepthExceededException e) {
            LOG.warn("Not flattening: {}", e.getMessage());
            return stmt;
        }
    }

    /**
     * Whether every path through {@code stmt} ends in a return, break or continue.
     */
    public boolean branchTerminates(Stmt stmt) {
        try {
            return terminates(stmt, 0);
        } catch (NestingDepthExceededException e) {
            LOG.warn("Treating branch as non-terminating: {}", e.getMessage());
            return false;
        }
    }

    // ── Chains ───────────────────────────────────────────────────────────

    private Stmt flattenChain(Stmt stmt) {
        if (!(stmt instanceof Stmt.If head) || !terminates(head.then(), 0)) {
            return stmt;
        }
        List<Stmt> flat = new ArrayList<>();
        Stmt current = head;
        while (current instanceof Stmt.If link && terminates(link.then(), 0) && canDetachElse(link)) {
            flat.add(link.withoutElse());
            current = link.otherwise();
            if (current == null) {
                break;
            }
        }
        if (flat.isEmpty()) {
            return stmt;
        }
        if (current != null) {
            flat.add(current);
        }
        return Ir.seq(flat);
    }

    private Stmt unflattenChain(Stmt stmt) {
        List<Stmt> parts = new ArrayList<>();
        collectSequence(stmt, parts);
        if (parts.isEmpty()) {
            return Ir.noop();
        }
        Stmt result = parts.get(parts.size() - 1);
        for (int i = parts.size() - 2; i >= 0; i--) {
            Stmt part = parts.get(i);
            if (part instanceof Stmt.If link && !link.hasElse() && terminates(link.then(), 0)
                    && canAttachElse(link, result)) {
                result = link.withElse(result);
            } else {
                result = new Stmt.Seq(part, result);
            }
        }
        return result;
    }

    /**
     * Statements of a sequence in order, whatever its association; blocks in it are spread.
     */
    private static void collectSequence(Stmt stmt, List<Stmt> out) {
        Deque<Stmt> pending = new ArrayDeque<>();
        pending.push(stmt);
        while (!pending.isEmpty()) {
            Stmt current = pending.pop();
            if (current instanceof Stmt.Seq seq) {
                pending.push(seq.second());
                pending.push(seq.first());
            } else if (current instanceof Stmt.Block block) {
                out.addAll(block.statements());
            } else {
                out.add(current);
            }
        }
    }

    /**
     * The else of an {@code if} with an initializer lives in the initializer's scope;
     * pulling it out is only sound when it does not mention the initializer's names.
     */
    private boolean canDetachElse(Stmt.If link) {
        return !link.hasElse() || !link.hasInit() || !mentions(link.otherwise(), Ir.declaredNames(link.init()));
    }

    private boolean canAttachElse(Stmt.If link, Stmt rest) {
        return !link.hasInit() || !mentions(rest, Ir.declaredNames(link.init()));
    }

    private boolean mentions(Stmt stmt, List<String> names) {
        if (names.isEmpty()) {
            return false;
        }
        NameCollector collector = new NameCollector(maxDepth);
        collector.scan(stmt, null);
        for (String name : names) {
            if (collector.names.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private boolean terminates(Stmt stmt, int depth) {
        if (depth > maxDepth) {
            throw new NestingDepthExceededException(maxDepth);
        }
        if (stmt instanceof Stmt.Return || stmt instanceof Stmt.Break || stmt instanceof Stmt.Continue) {
            return true;
        }
        if (stmt instanceof Stmt.Seq) {
            List<Stmt> parts = new ArrayList<>();
            collectSequence(stmt, parts);
            return anyTerminates(parts, depth);
        }
        if (stmt instanceof Stmt.Block block) {
            return anyTerminates(block.statements(), depth + 1);
        }
        if (stmt instanceof Stmt.If n) {
            return n.hasElse() && terminates(n.then(), depth + 1) && terminates(n.otherwise(), depth + 1);
        }
        return false;
    }

    private boolean anyTerminates(List<Stmt> stmts, int depth) {
        for (Stmt s : stmts) {
            if (terminates(s, depth)) {
                return true;
            }
        }
        return false;
    }

    private static final class NameCollector extends IrScanner<Void> {
        final Set<String> names = new HashSet<>();

        NameCollector(int maxDepth) {
            super(maxDepth);
        }

        @Override
        public Void visit(Stmt.Assign n, Void arg) {
            names.add(n.name());
            return super.visit(n, arg);
        }

        @Override
        public Void visit(Expr.Var n, Void arg) {
            names.add(n.name());
            return null;
        }
    }

    private final class ChainFlattener {
        private final int limit;
        private int depth;

        ChainFlattener(int limit) {
            this.limit = limit;
        }

        Stmt apply(Stmt stmt) {
            if (stmt instanceof Stmt.Seq) {
                List<Stmt> parts = new ArrayList<>();
                Stmt current = stmt;
                while (current instanceof Stmt.Seq seq) {
                    parts.add(seq.first() instanceof Stmt.Seq ? applyNested(seq.first()) : apply(seq.first()));
                    current = seq.second();
                }
                parts.add(apply(current));
                return Ir.seq(spread(parts));
            }
            if (stmt instanceof Stmt.Block block) {
                enter();
                try {
                    List<Stmt> parts = new ArrayList<>();
                    for (Stmt s : block.statements()) {
                        parts.add(apply(s));
                    }
                    return Ir.block(parts);
                } finally {
                    depth--;
                }
            }
            if (stmt instanceof Stmt.If n) {
                enter();
                try {
                    Stmt then = apply(n.then());
                    Stmt otherwise = n.hasElse() ? apply(n.otherwise()) : null;
                    return flattenChain(new Stmt.If(n.init(), n.cond(), then, otherwise));
                } finally {
                    depth--;
                }
            }
            return stmt;
        }

        private void enter() {
            if (++depth > limit) {
                throw new NestingDepthExceededException(limit);
            }
        }

        private Stmt applyNested(Stmt stmt) {
            enter();
            try {
                return apply(stmt);
            } finally {
                depth--;
            }
        }

        /**
         * Inlines nested sequences so the rebuilt spine is right-nested throughout.
         */
        private List<Stmt> spread(List<Stmt> parts) {
            List<Stmt> out = new ArrayList<>();
            for (Stmt part : parts) {
                if (part instanceof Stmt.Seq) {
                    Stmt current = part;
                    while (current instanceof Stmt.Seq seq) {
                        out.add(seq.first());
                        current = seq.second();
                    }
                    out.add(current);
                } else {
                    out.add(part);
                }
            }
            return out;
        }
    }

    // ── Canonicalization ─────────────────────────────────────────────────

    private static final class Rewriter implements StmtVisitor<Stmt, Void>, ExprVisitor<Expr, Void> {
        private final int limit;
        private int depth;

        Rewriter(int limit) {
            this.limit = limit;
        }

        private void enter() {
            if (++depth > limit) {
                throw new NestingDepthExceededException(limit);
            }
        }

        private Stmt nested(Stmt stmt) {
            enter();
            try {
                return stmt.accept(this, null);
            } finally {
                depth--;
            }
        }

        private Expr nested(Expr expr) {
            enter();
            try {
                return expr.accept(this, null);
            } finally {
                depth--;
            }
        }

        @Override
        public Stmt visit(Stmt.Assign n, Void arg) {
            return new Stmt.Assign(n.name(), n.expr().accept(this, arg));
        }

        @Override
        public Stmt visit(Stmt.DeclAssign n, Void arg) {
            return new Stmt.DeclAssign(n.names(), n.expr().accept(this, arg));
        }

        @Override
        public Stmt visit(Stmt.VarDecl n, Void arg) {
            return n.hasInitializer() ? new Stmt.VarDecl(n.name(), n.initializer().accept(this, arg)) : n;
        }

        @Override
        public Stmt visit(Stmt.Seq n, Void arg) {
            List<Stmt> parts = new ArrayList<>();
            Stmt current = n;
            while (current instanceof Stmt.Seq seq) {
                addUnlessNoop(parts, seq.first() instanceof Stmt.Seq ? nested(seq.first()) : seq.first().accept(this, arg));
                current = seq.second();
            }
            addUnlessNoop(parts, current.accept(this, arg));
            return Ir.seq(parts);
        }

        @Override
        public Stmt visit(Stmt.Block n, Void arg) {
            enter();
            try {
                List<Stmt> parts = new ArrayList<>();
                for (Stmt s : n.statements()) {
                    addUnlessNoop(parts, s.accept(this, arg));
                }
                if (parts.isEmpty()) {
                    return Ir.noop();
                }
                return parts.size() == 1 ? parts.get(0) : Ir.block(parts);
            } finally {
                depth--;
            }
        }

        private static void addUnlessNoop(List<Stmt> parts, Stmt stmt) {
            if (!(stmt instanceof Stmt.Noop)) {
                parts.add(stmt);
            }
        }

        @Override
        public Stmt visit(Stmt.If n, Void arg) {
            enter();
            try {
                Stmt init = n.hasInit() ? n.init().accept(this, arg) : null;
                Expr cond = n.cond().accept(this, arg);
                Stmt then = n.then().accept(this, arg);
                Stmt otherwise = n.hasElse() ? n.otherwise().accept(this, arg) : null;

                Optional<Boolean> literal = boolLiteral(cond);
                if (literal.isEmpty()) {
                    return new Stmt.If(init, cond, then, otherwise);
                }
                Stmt taken = literal.get() ? then : (otherwise != null ? otherwise : Ir.noop());
                if (init == null) {
                    return taken;
                }
                if (!Ir.declaredNames(init).isEmpty()) {
                    // the taken branch still needs the initializer's scope
                    return new Stmt.If(init, Ir.boolLit(true), taken, null);
                }
                return taken instanceof Stmt.Noop ? init : Ir.seq(init, taken);
            } finally {
                depth--;
            }
        }

        @Override
        public Stmt visit(Stmt.Return n, Void arg) {
            return n.hasValue() ? new Stmt.Return(n.value().accept(this, arg)) : n;
        }

        @Override
        public Stmt visit(Stmt.Break n, Void arg) {
            return n;
        }

        @Override
        public Stmt visit(Stmt.Continue n, Void arg) {
            return n;
        }

        @Override
        public Stmt visit(Stmt.Call n, Void arg) {
            return new Stmt.Call((Expr.Call) n.call().accept(this, arg));
        }

        @Override
        public Stmt visit(Stmt.Noop n, Void arg) {
            return n;
        }

        @Override
        public Expr visit(Expr.Literal n, Void arg) {
            return n;
        }

        @Override
        public Expr visit(Expr.Var n, Void arg) {
            return n;
        }

        @Override
        public Expr visit(Expr.Binary n, Void arg) {
            Expr left = nested(n.left());
            Expr right = nested(n.right());

            if (left instanceof Expr.Literal l && right instanceof Expr.Literal r) {
                Optional<Value> folded = Operators.applyBinary(n.op(), l.value(), r.value());
                if (folded.isPresent()) {
                    return Ir.lit(folded.get());
                }
            }
            if (n.op() == BinaryOp.AND || n.op() == BinaryOp.OR) {
                // the absorbing literal: false for &&, true for ||
                boolean absorbing = n.op() == BinaryOp.OR;
                Optional<Boolean> l = boolLiteral(left);
                Optional<Boolean> r = boolLiteral(right);
                if (l.isPresent()) {
                    return l.get() == absorbing ? left : right;
                }
                if (r.isPresent()) {
                    if (r.get() != absorbing) {
                        return left;
                    }
                    // dropping the left operand would drop its calls
                    if (!Ir.containsCall(left)) {
                        return right;
                    }
                }
            }
            return new Expr.Binary(n.op(), left, right);
        }

        @Override
        public Expr visit(Expr.Unary n, Void arg) {
            Expr operand = nested(n.operand());
            if (operand instanceof Expr.Literal lit) {
                Optional<Value> folded = Operators.applyUnary(n.op(), lit.value());
                if (folded.isPresent()) {
                    return Ir.lit(folded.get());
                }
            }
            if (n.op() == UnaryOp.NOT && operand instanceof Expr.Unary inner && inner.op() == UnaryOp.NOT) {
                return inner.operand();
            }
            return new Expr.Unary(n.op(), operand);
        }

        @Override
        public Expr visit(Expr.Call n, Void arg) {
            List<Expr> args = new ArrayList<>(n.args().size());
            for (Expr a : n.args()) {
                args.add(nested(a));
            }
            return new Expr.Call(n.function(), args);
        }

        private static Optional<Boolean> boolLiteral(Expr expr) {
            if (expr instanceof Expr.Literal lit && lit.value() instanceof Value.BoolValue b) {
                return Optional.of(b.value());
            }
            return Optional.empty();
        }
    }
}
