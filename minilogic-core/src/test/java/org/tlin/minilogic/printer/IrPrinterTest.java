package org.tlin.minilogic.printer;

import org.junit.jupiter.api.Test;
import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.Stmt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tlin.minilogic.ir.Ir.*;

class IrPrinterTest {

    @Test
    void print_expressionsFullyParenthesized() {
        assertThat(IrPrinter.print(add(var("a"), intLit(1)))).isEqualTo("(a + 1)");
        assertThat(IrPrinter.print(not(and(var("p"), boolLit(true))))).isEqualTo("(!(p && true))");
        assertThat(IrPrinter.print(call("f", strLit("s"), nilLit()))).isEqualTo("f(\"s\", nil)");
    }

    @Test
    void print_statementsOnOneLine() {
        Stmt stmt = seq(
                declAssign("x", intLit(1)),
                ifInit(varDecl("y", var("x")), gt(var("y"), intLit(0)), ret(var("y")),
                        ifElse(var("c"), breakLoop(), block())),
                callStmt("log"));

        assertThat(IrPrinter.print(stmt))
                .isEqualTo("x := 1; if var y = x; (y > 0) { return y } else if c { break } else { {} }; log()");
    }

    @Test
    void print_longSequenceWithoutDeepRecursion() {
        Stmt[] stmts = new Stmt[5_000];
        for (int i = 0; i < stmts.length; i++) {
            stmts[i] = assign("x", intLit(i));
        }
        String printed = IrPrinter.print(seq(stmts));

        assertThat(printed).startsWith("x = 0; x = 1; ").endsWith("x = 4999");
    }

    @Test
    void print_leftNestedSequenceReadsFlat() {
        Stmt leftNested = new Stmt.Seq(new Stmt.Seq(assign("a", intLit(1)), assign("b", intLit(2))), retVoid());
        Stmt deep = noop();
        for (int i = 0; i < 100_000; i++) {
            deep = new Stmt.Seq(deep, continueLoop());
        }

        assertThat(IrPrinter.print(leftNested)).isEqualTo("a = 1; b = 2; return");
        assertThat(IrPrinter.print(deep)).startsWith("noop; continue; ").endsWith("; continue");
    }

    @Test
    void print_elidesBeyondDepthLimit() {
        Expr deep = var("y");
        for (int i = 0; i < 100_000; i++) {
            deep = not(deep);
        }

        assertThat(IrPrinter.print(add(var("a"), not(not(var("b")))), 2)).isEqualTo("(a + (!...))");
        assertThat(IrPrinter.print(deep)).startsWith("(!(!").contains("...").doesNotContain("y");
        assertThat(IrPrinter.print(call("f", add(var("a"), var("b"))), 1)).isEqualTo("f(...)");
    }

    @Test
    void prettyPrint_indentsNestedBodies() {
        Stmt stmt = seq(
                ifElse(var("c"), ret(intLit(1)), assign("x", intLit(2))),
                Ir.retVoid());

        assertThat(IrPrinter.prettyPrint(stmt)).isEqualTo(String.join("\n",
                "if c {",
                "    return 1",
                "} else {",
                "    x = 2",
                "}",
                "return"));
    }

    @Test
    void toString_delegatesToPrinter() {
        assertThat(assign("a", binary(BinaryOp.SUB, var("b"), intLit(1)))).hasToString("a = (b - 1)");
        assertThat(noop()).hasToString("noop");
        assertThat(continueLoop()).hasToString("continue");
    }
}
