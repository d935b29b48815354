package org.tlin.minilogic.javaparser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tlin.minilogic.IrTranslationException;
import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.ir.UnaryOp;

/**
 * Lowers a fragment of Java statements into IR.
 * <p>
 * The accepted subset is deliberately small: calls, assignments (plain, compound and
 * {@code ++}/{@code --}), local declarations, {@code if}/{@code else}, blocks, {@code return},
 * unlabelled {@code break}/{@code continue} and empty statements, over literals, names and
 * the arithmetic, comparison and logical operators. Anything else fails closed, so an
 * unsupported rewrite is reported as unverifiable instead of being approved.
 * <p>
 * A block holding exactly one initialized declaration followed by an {@code if} is read as
 * an if with an initializer, since that is how the scoped-declaration idiom is written in Java.
 */
public final class SnippetTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(SnippetTranslator.class);

    private final JavaParser parser;

    public SnippetTranslator() {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public Optional<Stmt> translate(String snippet) {
        try {
            return Optional.of(translateOrThrow(snippet));
        } catch (IrTranslationException e) {
            LOG.debug("Snippet not translatable at {}:{}: {}", e.getLine(), e.getColumn(), e.getMessage());
            return Optional.empty();
        }
    }

    public Stmt translateOrThrow(String snippet) {
        // the snippet starts on line 2 so that reported columns match the input
        ParseResult<BlockStmt> parsed = parser.parseBlock("{\n" + snippet + "\n}");
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            Problem problem = parsed.getProblems().isEmpty() ? null : parsed.getProblems().get(0);
            Position at = problem == null ? null : problem.getLocation()
                    .flatMap(range -> range.getBegin().getRange())
                    .map(range -> range.begin)
                    .orElse(null);
            throw new IrTranslationException(problem == null ? "unparseable snippet" : problem.getMessage(),
                    snippet, at == null ? -1 : at.line - 1, at == null ? -1 : at.column);
        }
        return new Lowering(snippet).statements(parsed.getResult().get().getStatements());
    }

    /**
     * One translation; carries the source for error reporting.
     */
    private static final class Lowering {
        private final String snippet;

        Lowering(String snippet) {
            this.snippet = snippet;
        }

        private IrTranslationException unsupported(Node node, String what) {
            Optional<Position> begin = node.getBegin();
            return new IrTranslationException("unsupported " + what + ": " + node, snippet,
                    begin.map(p -> p.line - 1).orElse(-1), begin.map(p -> p.column).orElse(-1));
        }

        Stmt statements(NodeList<Statement> statements) {
            List<Stmt> out = new ArrayList<>(statements.size());
            for (Statement s : statements) {
                out.add(statement(s));
            }
            return Ir.seq(out);
        }

        Stmt statement(Statement stmt) {
            if (stmt instanceof ExpressionStmt es) {
                return expressionStatement(es.getExpression());
            }
            if (stmt instanceof BlockStmt block) {
                return block(block);
            }
            if (stmt instanceof IfStmt is) {
                return ifStatement(null, is);
            }
            if (stmt instanceof ReturnStmt rs) {
                return rs.getExpression().isPresent()
                        ? Ir.ret(expression(rs.getExpression().get()))
                        : Ir.retVoid();
            }
            if (stmt instanceof BreakStmt bs) {
                if (bs.getLabel().isPresent()) {
                    throw unsupported(stmt, "labelled break");
                }
                return Ir.breakLoop();
            }
            if (stmt instanceof ContinueStmt cs) {
                if (cs.getLabel().isPresent()) {
                    throw unsupported(stmt, "labelled continue");
                }
                return Ir.continueLoop();
            }
            if (stmt instanceof EmptyStmt) {
                return Ir.noop();
            }
            throw unsupported(stmt, "statement");
        }

        private Stmt block(BlockStmt block) {
            NodeList<Statement> statements = block.getStatements();
            if (statements.size() == 2 && statements.get(1) instanceof IfStmt is) {
                Optional<VariableDeclarator> scoped = singleInitializedDeclarator(statements.get(0));
                if (scoped.isPresent()) {
                    VariableDeclarator d = scoped.get();
                    Stmt init = Ir.declAssign(d.getNameAsString(), expression(d.getInitializer().get()));
                    return ifStatement(init, is);
                }
            }
            List<Stmt> out = new ArrayList<>(statements.size());
            for (Statement s : statements) {
                out.add(statement(s));
            }
            return Ir.block(out);
        }

        private static Optional<VariableDeclarator> singleInitializedDeclarator(Statement stmt) {
            if (stmt instanceof ExpressionStmt es && es.getExpression() instanceof VariableDeclarationExpr vde
                    && vde.getVariables().size() == 1 && vde.getVariable(0).getInitializer().isPresent()) {
                return Optional.of(vde.getVariable(0));
            }
            return Optional.empty();
        }

        private Stmt ifStatement(Stmt init, IfStmt is) {
            Expr cond = expression(is.getCondition());
            Stmt then = statement(is.getThenStmt());
            Stmt otherwise = is.getElseStmt().isPresent() ? statement(is.getElseStmt().get()) : null;
            return Ir.ifInit(init, cond, then, otherwise);
        }

        private Stmt expressionStatement(Expression expr) {
            if (expr instanceof MethodCallExpr call) {
                return new Stmt.Call(call(call));
            }
            if (expr instanceof AssignExpr ae) {
                String target = targetName(ae.getTarget());
                Expr value = expression(ae.getValue());
                if (ae.getOperator() == AssignExpr.Operator.ASSIGN) {
                    return Ir.assign(target, value);
                }
                BinaryOp op = JavaOperators.compound(ae.getOperator())
                        .orElseThrow(() -> unsupported(ae, "compound assignment"));
                return Ir.assign(target, Ir.binary(op, Ir.var(target), value));
            }
            if (expr instanceof UnaryExpr ue) {
                return increment(ue);
            }
            if (expr instanceof VariableDeclarationExpr vde) {
                List<Stmt> declarations = new ArrayList<>();
                for (VariableDeclarator d : vde.getVariables()) {
                    if (d.getType().isArrayType()) {
                        throw unsupported(d, "array declaration");
                    }
                    declarations.add(d.getInitializer().isPresent()
                            ? Ir.declAssign(d.getNameAsString(), expression(d.getInitializer().get()))
                            : Ir.varDecl(d.getNameAsString()));
                }
                return Ir.seq(declarations);
            }
            throw unsupported(expr, "expression statement");
        }

        private Stmt increment(UnaryExpr ue) {
            BinaryOp op;
            switch (ue.getOperator()) {
                case PREFIX_INCREMENT:
                case POSTFIX_INCREMENT:
                    op = BinaryOp.ADD;
                    break;
                case PREFIX_DECREMENT:
                case POSTFIX_DECREMENT:
                    op = BinaryOp.SUB;
                    break;
                default:
                    throw unsupported(ue, "expression statement");
            }
            String target = targetName(ue.getExpression());
            return Ir.assign(target, Ir.binary(op, Ir.var(target), Ir.intLit(1)));
        }

        private String targetName(Expression target) {
            if (target instanceof NameExpr ne) {
                return ne.getNameAsString();
            }
            throw unsupported(target, "assignment target");
        }

        Expr expression(Expression expr) {
            if (expr instanceof IntegerLiteralExpr lit) {
                return integer(lit, () -> lit.asNumber().longValue());
            }
            if (expr instanceof LongLiteralExpr lit) {
                return integer(lit, () -> lit.asNumber().longValue());
            }
            if (expr instanceof StringLiteralExpr lit) {
                return Ir.strLit(lit.asString());
            }
            if (expr instanceof BooleanLiteralExpr lit) {
                return Ir.boolLit(lit.getValue());
            }
            if (expr instanceof NullLiteralExpr) {
                return Ir.nilLit();
            }
            if (expr instanceof NameExpr ne) {
                return Ir.var(ne.getNameAsString());
            }
            if (expr instanceof EnclosedExpr ee) {
                return expression(ee.getInner());
            }
            if (expr instanceof BinaryExpr be) {
                BinaryOp op = JavaOperators.binary(be.getOperator())
                        .orElseThrow(() -> unsupported(be, "operator " + be.getOperator().asString()));
                return Ir.binary(op, expression(be.getLeft()), expression(be.getRight()));
            }
            if (expr instanceof UnaryExpr ue) {
                if (ue.getOperator() == UnaryExpr.Operator.PLUS) {
                    return expression(ue.getExpression());
                }
                UnaryOp op = JavaOperators.unary(ue.getOperator())
                        .orElseThrow(() -> unsupported(ue, "operator " + ue.getOperator().asString()));
                return Ir.unary(op, expression(ue.getExpression()));
            }
            if (expr instanceof MethodCallExpr call) {
                return call(call);
            }
            throw unsupported(expr, "expression");
        }

        /**
         * JavaParser accepts integer literals of any size; values that overflow their type
         * only fail when converted.
         */
        private Expr integer(Expression lit, LongSupplier value) {
            try {
                return Ir.intLit(value.getAsLong());
            } catch (NumberFormatException | ArithmeticException e) {
                throw unsupported(lit, "literal");
            }
        }

                private Expr.Call call(MethodCallExpr call) {
            if (call.getTypeArguments().isPresent()) {
                throw unsupported(call, "generic call");
            }
            String function = call.getNameAsString();
            if (call.getScope().isPresent()) {
                if (!(call.getScope().get() instanceof NameExpr scope)) {
                    throw unsupported(call, "call receiver");
                }
                function = scope.getNameAsString() + "." + function;
            }
            List<Expr> args = new ArrayList<>(call.getArguments().size());
            for (Expression arg : call.getArguments()) {
                args.add(expression(arg));
            }
            return new Expr.Call(function, args);
        }
    }
}
