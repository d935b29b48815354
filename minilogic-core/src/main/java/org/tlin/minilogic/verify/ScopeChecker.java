package org.tlin.minilogic.verify;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.tlin.minilogic.eval.CallPolicy;
import org.tlin.minilogic.eval.EvalConfig;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.IrScanner;
import org.tlin.minilogic.ir.Stmt;

/**
 * Structural pre-checks run before evaluation. Both return the first problem found, or
 * empty. A tree nested deeper than the configured limit makes either check throw
 * {@link org.tlin.minilogic.NestingDepthExceededException}.
 */
final class ScopeChecker {

    record Finding(ReasonCode reason, String detail) {}

    private final EvalConfig config;

    ScopeChecker(EvalConfig config) {
        this.config = config;
    }

    /**
     * Constructs the active configuration cannot model: calls under
     * {@link CallPolicy#DISALLOW}, returns without early-return awareness, and loop
     * control outside a loop context.
     */
    Optional<Finding> findOutOfScope(Stmt stmt) {
        ConstructFinder finder = new ConstructFinder();
        finder.scan(stmt, null);
        return Optional.ofNullable(finder.finding);
    }

    /**
     * An if-initializer name used outside that if. A name that is also declared outside
     * any initializer is left to the evaluator, which resolves it correctly.
     */
    Optional<Finding> findScopeViolation(Stmt stmt) {
        DeclarationCollector declarations = new DeclarationCollector();
        declarations.scan(stmt, null);
        Set<String> scoped = new HashSet<>(declarations.initNames);
        scoped.removeAll(declarations.plainNames);
        if (scoped.isEmpty()) {
            return Optional.empty();
        }
        ViolationFinder finder = new ViolationFinder(scoped);
        finder.scan(stmt, Set.of());
        return Optional.ofNullable(finder.finding);
    }

    private final class ConstructFinder extends IrScanner<Void> {
        Finding finding;

        ConstructFinder() {
            super(config.maxDepth());
        }

        private void report(ReasonCode reason, String detail) {
            if (finding == null) {
                finding = new Finding(reason, detail);
            }
        }

        @Override
        public Void visit(Stmt.Return n, Void arg) {
            if (!config.isEarlyReturnAware()) {
                report(ReasonCode.OUT_OF_SCOPE, "return requires early-return-aware control flow");
            }
            return super.visit(n, arg);
        }

        @Override
        public Void visit(Stmt.Break n, Void arg) {
            if (!config.allowsLoopControl()) {
                report(ReasonCode.OUT_OF_SCOPE, "break outside loop context");
            }
            return null;
        }

        @Override
        public Void visit(Stmt.Continue n, Void arg) {
            if (!config.allowsLoopControl()) {
                report(ReasonCode.OUT_OF_SCOPE, "continue outside loop context");
            }
            return null;
        }

        @Override
        public Void visit(Expr.Call n, Void arg) {
            if (config.callPolicy() == CallPolicy.DISALLOW) {
                report(ReasonCode.CALLS_DISALLOWED, "call to " + n.function() + " under disallow call policy");
            }
            return super.visit(n, arg);
        }
    }

    private final class DeclarationCollector extends IrScanner<Void> {
        final Set<String> initNames = new HashSet<>();
        final Set<String> plainNames = new HashSet<>();

        DeclarationCollector() {
            super(config.maxDepth());
        }

        @Override
        public Void visit(Stmt.DeclAssign n, Void arg) {
            plainNames.addAll(n.names());
            return super.visit(n, arg);
        }

        @Override
        public Void visit(Stmt.VarDecl n, Void arg) {
            plainNames.add(n.name());
            return super.visit(n, arg);
        }

        @Override
        public Void visit(Stmt.If n, Void arg) {
            if (!n.hasInit()) {
                return super.visit(n, arg);
            }
            initNames.addAll(Ir.declaredNames(n.init()));
            enter();
            try {
                // only the right-hand side; the targets are not plain declarations
                if (n.init() instanceof Stmt.DeclAssign d) {
                    scan(d.expr(), arg);
                } else if (n.init() instanceof Stmt.VarDecl d) {
                    scan(d.initializer(), arg);
                } else {
                    scan(n.init(), arg);
                }
                scan(n.cond(), arg);
                scan(n.then(), arg);
                scan(n.otherwise(), arg);
            } finally {
                exit();
            }
            return null;
        }
    }

    /**
     * The argument is the set of initializer names in scope at the visited node.
     */
    private final class ViolationFinder extends IrScanner<Set<String>> {
        private final Set<String> scoped;
        Finding finding;

        ViolationFinder(Set<String> scoped) {
            super(config.maxDepth());
            this.scoped = scoped;
        }

        private void check(String name, Set<String> visible, String use) {
            if (finding == null && scoped.contains(name) && !visible.contains(name)) {
                finding = new Finding(ReasonCode.SCOPE_VIOLATION,
                        "init-scoped variable '" + name + "' " + use + " outside if scope");
            }
        }

        @Override
        public Void visit(Stmt.Assign n, Set<String> visible) {
            check(n.name(), visible, "assigned");
            return super.visit(n, visible);
        }

        @Override
        public Void visit(Expr.Var n, Set<String> visible) {
            check(n.name(), visible, "referenced");
            return null;
        }

        @Override
        public Void visit(Stmt.If n, Set<String> visible) {
            if (!n.hasInit()) {
                return super.visit(n, visible);
            }
            enter();
            try {
                // the initializer's own right-hand side still sees only the outer scope
                scan(n.init(), visible);
                Set<String> inner = new HashSet<>(visible);
                inner.addAll(Ir.declaredNames(n.init()));
                scan(n.cond(), inner);
                scan(n.then(), inner);
                scan(n.otherwise(), inner);
            } finally {
                exit();
            }
            return null;
        }
    }
}
